package settingsd.service;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import settingsd.config.SettingsdConfig;
import settingsd.config.SettingsdConfigLoader;

import java.io.IOException;
import java.nio.file.Path;

@Getter
public class Settingsd {

    private static final Logger log = LoggerFactory.getLogger(Settingsd.class);

    private final SettingsdConfig config;
    private final ResourceLocks locks;
    private final HostnameSettings hostname;
    private final LocaleSettings locale;
    private final ClockSettings clock;

    public Settingsd(SettingsdConfig config, Authorizer authorizer) {
        this.config = config;
        this.locks = new ResourceLocks();
        this.hostname = new HostnameSettings(config, authorizer, locks);
        this.locale = new LocaleSettings(config, authorizer, locks);
        this.clock = new ClockSettings(config, authorizer, locks);
        if (config.isReadOnly()) {
            log.info("Running in read-only mode");
        }
    }

    public static Settingsd open(Path configFile, Authorizer authorizer) throws IOException {
        return new Settingsd(SettingsdConfigLoader.load(configFile), authorizer);
    }
}
