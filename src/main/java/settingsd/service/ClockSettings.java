package settingsd.service;

import org.apache.commons.lang3.StringUtils;
import settingsd.config.SettingsdConfig;
import settingsd.io.AtomicFiles;
import settingsd.service.ResourceLocks.Resource;
import settingsd.shell.ShellConfigDocument;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class ClockSettings extends AbstractSettingsService {

    public static final String ACTION_SET_TIMEZONE = "org.freedesktop.timedate1.set-timezone";
    public static final String ACTION_SET_LOCAL_RTC = "org.freedesktop.timedate1.set-local-rtc";

    static final String CLOCK_LOCAL = "local";
    static final String CLOCK_UTC = "UTC";

    public ClockSettings(SettingsdConfig config, Authorizer authorizer, ResourceLocks locks) {
        super(config, authorizer, locks);
    }

    public boolean isLocalRtc() {
        return read(() -> ShellConfigDocument.sourceVar(config.getHwclockFile(), "clock")
                .map(CLOCK_LOCAL::equals)
                .orElse(false), Resource.CLOCK);
    }

    public void setLocalRtc(String subject, boolean localRtc, boolean interactive) {
        mutate(subject, ACTION_SET_LOCAL_RTC, interactive, () -> {
            ShellConfigDocument doc = ShellConfigDocument.parse(config.getHwclockFile());
            if (doc.get("clock").isEmpty() && !localRtc) {
                log.debug("No clock setting in '{}', leaving UTC default", config.getHwclockFile());
                return null;
            }
            doc.set("clock", localRtc ? CLOCK_LOCAL : CLOCK_UTC, true);
            doc.save();
            log.info("Hardware clock set to {}", localRtc ? CLOCK_LOCAL : CLOCK_UTC);
            return null;
        }, Resource.CLOCK);
    }

    public String getTimezone() {
        return read(() -> AtomicFiles.read(config.getTimezoneFile())
                .map(bytes -> firstLine(new String(bytes, StandardCharsets.UTF_8)))
                .orElse(""), Resource.CLOCK);
    }

    public void setTimezone(String subject, String zone, boolean interactive) {
        mutate(subject, ACTION_SET_TIMEZONE, interactive, () -> {
            Path zoneFile = resolveZone(zone);
            AtomicFiles.writeAtomic(config.getTimezoneFile(), (zone + "\n").getBytes(StandardCharsets.UTF_8));
            AtomicFiles.writeAtomic(config.getLocaltimeFile(), Files.readAllBytes(zoneFile));
            log.info("Timezone set to '{}'", zone);
            return null;
        }, Resource.CLOCK);
    }

    Path resolveZone(String zone) throws IOException {
        if (StringUtils.isEmpty(zone) || zone.startsWith("/")) {
            throw SettingsException.invalidArgument("Invalid timezone '" + zone + "'");
        }
        Path dir = config.getZoneinfoDir().toAbsolutePath().normalize();
        Path candidate = dir.resolve(zone).normalize();
        if (!candidate.startsWith(dir) || candidate.equals(dir) || !Files.isRegularFile(candidate)) {
            throw SettingsException.invalidArgument("Unknown timezone '" + zone + "'");
        }
        return candidate;
    }

    private static String firstLine(String text) {
        return StringUtils.strip(StringUtils.substringBefore(text, "\n"));
    }
}
