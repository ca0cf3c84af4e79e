package settingsd.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import settingsd.config.SettingsdConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HostnameSettingsTest {

    private static final Path HOSTNAME_CONF = Paths.get("src/test/resources/settingsd/shell/hostname.conf");
    private static final Path MACHINE_INFO = Paths.get("src/test/resources/settingsd/shell/machine-info");

    @TempDir
    Path tmp;

    private SettingsdConfig config;
    private final List<String> requestedActions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        config = SettingsdConfig.builder()
                .kernelHostnameFile(tmp.resolve("kernel-hostname"))
                .staticHostnameFile(tmp.resolve("hostname"))
                .machineInfoFile(tmp.resolve("machine-info"))
                .chassisTypeFile(tmp.resolve("chassis_type"))
                .build();
    }

    private HostnameSettings settings(boolean allowed) {
        Authorizer authorizer = (subject, actionId, interactive) -> {
            requestedActions.add(actionId);
            return allowed;
        };
        return new HostnameSettings(config, authorizer, new ResourceLocks());
    }

    @Test
    void getHostname_readsKernelHostnameFile() throws Exception {
        assertEquals("localhost", settings(true).getHostname());

        Files.writeString(config.getKernelHostnameFile(), "buildbox\n");
        assertEquals("buildbox", settings(true).getHostname());

        Files.writeString(config.getKernelHostnameFile(), "\n");
        assertEquals("localhost", settings(true).getHostname());
    }

    @Test
    void getStaticHostname_defaultsToLocalhost() {
        assertEquals("localhost", settings(true).getStaticHostname());
    }

    @Test
    void getStaticHostname_readsEitherSpelling() throws Exception {
        Files.copy(HOSTNAME_CONF, config.getStaticHostnameFile());
        assertEquals("box1", settings(true).getStaticHostname());

        Files.writeString(config.getStaticHostnameFile(), "HOSTNAME=\"legacy\"\n");
        assertEquals("legacy", settings(true).getStaticHostname());
    }

    @Test
    void setStaticHostname_rewritesExistingSpelling() throws Exception {
        Files.writeString(config.getStaticHostnameFile(), "# legacy\nHOSTNAME=old\n");
        assertEquals("new-host", settings(true).setStaticHostname(":1.42", "new-host", false));
        assertEquals("# legacy\nHOSTNAME='new-host'\n", Files.readString(config.getStaticHostnameFile()));
        assertEquals(List.of(HostnameSettings.ACTION_SET_STATIC_HOSTNAME), requestedActions);
    }

    @Test
    void setStaticHostname_invalidNameBecomesLocalhost() throws Exception {
        assertEquals("localhost", settings(true).setStaticHostname(":1.42", "bad host!", false));
        assertEquals("hostname='localhost'\n", Files.readString(config.getStaticHostnameFile()));
    }

    @Test
    void setStaticHostname_deniedLeavesFileAlone() {
        var ex = assertThrows(SettingsException.class,
                () -> settings(false).setStaticHostname(":1.42", "box2", true));
        assertEquals(SettingsException.Reason.NOT_AUTHORIZED, ex.getReason());
        assertFalse(Files.exists(config.getStaticHostnameFile()));
    }

    @Test
    void setStaticHostname_readOnlySkipsAuthorization() {
        config.setReadOnly(true);
        var ex = assertThrows(SettingsException.class,
                () -> settings(true).setStaticHostname(":1.42", "box2", true));
        assertEquals(SettingsException.Reason.READ_ONLY, ex.getReason());
        assertEquals(List.of(), requestedActions);
        assertFalse(Files.exists(config.getStaticHostnameFile()));
    }

    @Test
    void getStaticHostname_reportsParseFailure() throws Exception {
        Files.writeString(config.getStaticHostnameFile(), "hostname=$(hostname)\n");
        var ex = assertThrows(SettingsException.class, () -> settings(true).getStaticHostname());
        assertEquals(SettingsException.Reason.PARSE_FAILURE, ex.getReason());
    }

    @Test
    void prettyHostname_roundTrip() throws Exception {
        var settings = settings(true);
        assertEquals("", settings.getPrettyHostname());
        assertEquals("", settings.setPrettyHostname(":1.42", null, false));
        assertEquals("Lennart's Laptop", settings.setPrettyHostname(":1.42", "Lennart's Laptop", false));
        assertEquals("Lennart's Laptop", settings.getPrettyHostname());
        assertEquals(List.of(HostnameSettings.ACTION_SET_MACHINE_INFO, HostnameSettings.ACTION_SET_MACHINE_INFO),
                requestedActions);
    }

    @Test
    void getIconName_prefersMachineInfo() throws Exception {
        Files.copy(MACHINE_INFO, config.getMachineInfoFile());
        Files.writeString(config.getChassisTypeFile(), "3\n");
        var settings = settings(true);
        assertEquals("computer-laptop", settings.getIconName());
        assertEquals("Lab Machine", settings.getPrettyHostname());
    }

    @Test
    void getIconName_guessesFromChassis() throws Exception {
        var settings = settings(true);
        assertEquals("computer", settings.getIconName());

        Files.writeString(config.getChassisTypeFile(), "10\n");
        assertEquals("computer-laptop", settings.getIconName());

        settings.setIconName(":1.42", "", false);
        assertEquals("computer-laptop", settings.getIconName());

        settings.setIconName(":1.42", "computer-vm", false);
        assertEquals("computer-vm", settings.getIconName());
    }

    @Test
    void iconNameForChassis_mapsDmiTypes() {
        assertEquals("computer-desktop", HostnameSettings.iconNameForChassis("3"));
        assertEquals("computer-desktop", HostnameSettings.iconNameForChassis("7\n"));
        assertEquals("computer-laptop", HostnameSettings.iconNameForChassis("14"));
        assertEquals("computer-server", HostnameSettings.iconNameForChassis("23"));
        assertEquals("computer-server", HostnameSettings.iconNameForChassis("29"));
        assertEquals("computer", HostnameSettings.iconNameForChassis("1"));
        assertEquals("computer", HostnameSettings.iconNameForChassis("unknown"));
    }

    @Test
    void isValidHostname_limits() {
        assertTrue(HostnameSettings.isValidHostname("box-1.example_org"));
        assertFalse(HostnameSettings.isValidHostname(""));
        assertFalse(HostnameSettings.isValidHostname(null));
        assertFalse(HostnameSettings.isValidHostname("a".repeat(65)));
    }
}
