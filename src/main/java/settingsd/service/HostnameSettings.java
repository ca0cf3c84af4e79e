package settingsd.service;

import org.apache.commons.lang3.StringUtils;
import settingsd.config.SettingsdConfig;
import settingsd.io.AtomicFiles;
import settingsd.service.ResourceLocks.Resource;
import settingsd.shell.ShellConfigDocument;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

public class HostnameSettings extends AbstractSettingsService {

    public static final String ACTION_SET_STATIC_HOSTNAME = "org.freedesktop.hostname1.set-static-hostname";
    public static final String ACTION_SET_MACHINE_INFO = "org.freedesktop.hostname1.set-machine-info";

    static final String DEFAULT_HOSTNAME = "localhost";

    private static final Pattern VALID_HOSTNAME = Pattern.compile("^[a-zA-Z0-9_.-]{1,64}$");

    public HostnameSettings(SettingsdConfig config, Authorizer authorizer, ResourceLocks locks) {
        super(config, authorizer, locks);
    }

    public String getHostname() {
        return read(() -> AtomicFiles.read(config.getKernelHostnameFile())
                .map(bytes -> StringUtils.strip(new String(bytes, StandardCharsets.US_ASCII)))
                .filter(StringUtils::isNotEmpty)
                .orElse(DEFAULT_HOSTNAME), Resource.HOSTNAME);
    }

    public String getStaticHostname() {
        return read(() -> {
            ShellConfigDocument doc = ShellConfigDocument.parse(config.getStaticHostnameFile());
            return doc.get("hostname")
                    .or(() -> doc.get("HOSTNAME"))
                    .orElse(DEFAULT_HOSTNAME);
        }, Resource.STATIC_HOSTNAME_FILE);
    }

    public String setStaticHostname(String subject, String name, boolean interactive) {
        String hostname = isValidHostname(name) ? name : DEFAULT_HOSTNAME;
        return mutate(subject, ACTION_SET_STATIC_HOSTNAME, interactive, () -> {
            ShellConfigDocument doc = ShellConfigDocument.parse(config.getStaticHostnameFile());
            doc.setEither("hostname", "HOSTNAME", hostname);
            doc.save();
            log.info("Static hostname set to '{}'", hostname);
            return hostname;
        }, Resource.STATIC_HOSTNAME_FILE);
    }

    public String getPrettyHostname() {
        return machineInfo("PRETTY_HOSTNAME").orElse("");
    }

    public String setPrettyHostname(String subject, String name, boolean interactive) {
        return setMachineInfo(subject, "PRETTY_HOSTNAME", name, interactive);
    }

    public String getIconName() {
        return machineInfo("ICON_NAME")
                .filter(StringUtils::isNotEmpty)
                .orElseGet(this::guessIconName);
    }

    public String setIconName(String subject, String name, boolean interactive) {
        return setMachineInfo(subject, "ICON_NAME", name, interactive);
    }

    static boolean isValidHostname(String name) {
        return name != null && VALID_HOSTNAME.matcher(name).matches();
    }

    static String iconNameForChassis(String chassisType) {
        int type;
        try {
            type = Integer.parseInt(StringUtils.strip(chassisType));
        } catch (NumberFormatException ex) {
            return "computer";
        }
        switch (type) {
            case 0x3:
            case 0x4:
            case 0x5:
            case 0x6:
            case 0x7:
                return "computer-desktop";
            case 0x9:
            case 0xA:
            case 0xE:
                return "computer-laptop";
            case 0x11:
            case 0x17:
            case 0x1C:
            case 0x1D:
                return "computer-server";
            default:
                return "computer";
        }
    }

    private String guessIconName() {
        return read(() -> AtomicFiles.read(config.getChassisTypeFile())
                .map(bytes -> iconNameForChassis(new String(bytes, StandardCharsets.US_ASCII)))
                .orElse("computer"), Resource.MACHINE_INFO_FILE);
    }

    private Optional<String> machineInfo(String variable) {
        return read(() -> ShellConfigDocument.sourceVar(config.getMachineInfoFile(), variable),
                Resource.MACHINE_INFO_FILE);
    }

    private String setMachineInfo(String subject, String variable, String value, boolean interactive) {
        String v = StringUtils.defaultString(value);
        return mutate(subject, ACTION_SET_MACHINE_INFO, interactive, () -> {
            ShellConfigDocument doc = ShellConfigDocument.parse(config.getMachineInfoFile());
            doc.set(variable, v, true);
            doc.save();
            log.info("{} set to '{}'", variable, v);
            return v;
        }, Resource.MACHINE_INFO_FILE);
    }
}
