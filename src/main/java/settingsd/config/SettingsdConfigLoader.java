package settingsd.config;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import settingsd.ConfigParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Reads {@code settingsd.yml}. Every key is optional; keys use the
 * {@link SettingsdConfig} property names, e.g. {@code localeFile: /etc/locale.conf}.
 */
public final class SettingsdConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(SettingsdConfigLoader.class);

    private SettingsdConfigLoader() {
    }

    public static SettingsdConfig load(Path path) throws IOException {
        Object root;
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            root = new Yaml().load(reader);
        } catch (NoSuchFileException ex) {
            log.debug("No configuration at '{}', using defaults", path);
            return new SettingsdConfig();
        } catch (YAMLException ex) {
            throw parseError(path, ex.getMessage(), ex);
        }
        if (root == null) {
            return new SettingsdConfig();
        }
        if (!(root instanceof Map)) {
            throw parseError(path, "top level must be a mapping", null);
        }
        return fromMap(path, (Map<?, ?>) root);
    }

    static SettingsdConfig fromMap(Path path, Map<?, ?> values) {
        SettingsdConfig.SettingsdConfigBuilder builder = SettingsdConfig.builder();
        for (Map.Entry<?, ?> entry : values.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case "readOnly":
                    builder.readOnly(toBoolean(path, key, value));
                    break;
                case "kernelHostnameFile":
                    builder.kernelHostnameFile(toPath(path, key, value));
                    break;
                case "staticHostnameFile":
                    builder.staticHostnameFile(toPath(path, key, value));
                    break;
                case "machineInfoFile":
                    builder.machineInfoFile(toPath(path, key, value));
                    break;
                case "localeFile":
                    builder.localeFile(toPath(path, key, value));
                    break;
                case "keymapFile":
                    builder.keymapFile(toPath(path, key, value));
                    break;
                case "xorgKeyboardFile":
                    builder.xorgKeyboardFile(toPath(path, key, value));
                    break;
                case "keyboardModelMapFile":
                    builder.keyboardModelMapFile(toPath(path, key, value));
                    break;
                case "hwclockFile":
                    builder.hwclockFile(toPath(path, key, value));
                    break;
                case "timezoneFile":
                    builder.timezoneFile(toPath(path, key, value));
                    break;
                case "localtimeFile":
                    builder.localtimeFile(toPath(path, key, value));
                    break;
                case "zoneinfoDir":
                    builder.zoneinfoDir(toPath(path, key, value));
                    break;
                case "chassisTypeFile":
                    builder.chassisTypeFile(toPath(path, key, value));
                    break;
                default:
                    log.warn("Ignoring unknown configuration key '{}' in '{}'", key, path);
            }
        }
        return builder.build();
    }

    private static boolean toBoolean(Path path, String key, Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        String s = StringUtils.strip(String.valueOf(value));
        if ("true".equalsIgnoreCase(s)) {
            return true;
        }
        if ("false".equalsIgnoreCase(s)) {
            return false;
        }
        throw parseError(path, key + " must be true or false, got '" + s + "'", null);
    }

    private static Path toPath(Path path, String key, Object value) {
        String s = StringUtils.strip(String.valueOf(value));
        if (StringUtils.isEmpty(s)) {
            throw parseError(path, key + " must not be empty", null);
        }
        return Paths.get(s);
    }

    private static ConfigParseException parseError(Path path, String detail, Exception cause) {
        ConfigParseException ex = ConfigParseException.atOffset(path, -1, detail);
        if (cause != null) {
            ex.initCause(cause);
        }
        return ex;
    }
}
