package settingsd.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import settingsd.ConfigParseException;
import settingsd.config.SettingsdConfig;
import settingsd.service.ResourceLocks.Resource;

import java.io.IOException;

abstract class AbstractSettingsService {

    @FunctionalInterface
    interface FileAction<T> {
        T run() throws IOException;
    }

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final SettingsdConfig config;
    protected final Authorizer authorizer;
    protected final ResourceLocks locks;

    protected AbstractSettingsService(SettingsdConfig config, Authorizer authorizer, ResourceLocks locks) {
        this.config = config;
        this.authorizer = authorizer;
        this.locks = locks;
    }

    protected <T> T read(FileAction<T> action, Resource first, Resource... rest) {
        try (ResourceLocks.Held ignored = locks.acquire(first, rest)) {
            return call(action);
        }
    }

    protected <T> T mutate(String subject,
                           String actionId,
                           boolean interactive,
                           FileAction<T> action,
                           Resource first,
                           Resource... rest) {
        if (config.isReadOnly()) {
            throw SettingsException.readOnly();
        }
        if (!authorizer.authorize(subject, actionId, interactive)) {
            log.warn("Denied {} for '{}'", actionId, subject);
            throw SettingsException.notAuthorized(subject, actionId);
        }
        try (ResourceLocks.Held ignored = locks.acquire(first, rest)) {
            return call(action);
        }
    }

    private static <T> T call(FileAction<T> action) {
        try {
            return action.run();
        } catch (IOException ex) {
            throw SettingsException.io(ex);
        } catch (ConfigParseException ex) {
            throw SettingsException.parse(ex);
        }
    }
}
