package settingsd.config;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.nio.file.Path;
import java.nio.file.Paths;

@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor
@Data
public class SettingsdConfig {
    @Builder.Default
    private boolean readOnly = false;
    @Builder.Default
    private Path kernelHostnameFile = Paths.get("/proc/sys/kernel/hostname");
    @Builder.Default
    private Path staticHostnameFile = Paths.get("/etc/conf.d/hostname");
    @Builder.Default
    private Path machineInfoFile = Paths.get("/etc/machine-info");
    @Builder.Default
    private Path localeFile = Paths.get("/etc/env.d/02locale");
    @Builder.Default
    private Path keymapFile = Paths.get("/etc/conf.d/keymaps");
    @Builder.Default
    private Path xorgKeyboardFile = Paths.get("/etc/X11/xorg.conf.d/30-keyboard.conf");
    @Builder.Default
    private Path keyboardModelMapFile = Paths.get("/usr/share/settingsd/kbd-model-map");
    @Builder.Default
    private Path hwclockFile = Paths.get("/etc/conf.d/hwclock");
    @Builder.Default
    private Path timezoneFile = Paths.get("/etc/timezone");
    @Builder.Default
    private Path localtimeFile = Paths.get("/etc/localtime");
    @Builder.Default
    private Path zoneinfoDir = Paths.get("/usr/share/zoneinfo");
    @Builder.Default
    private Path chassisTypeFile = Paths.get("/sys/class/dmi/id/chassis_type");
}
