package settingsd.service;

import org.apache.commons.lang3.StringUtils;
import settingsd.ConfigParseException;
import settingsd.config.SettingsdConfig;
import settingsd.keyboard.KeyboardMapEntry;
import settingsd.keyboard.KeyboardMatch;
import settingsd.keyboard.KeyboardModelMatcher;
import settingsd.service.ResourceLocks.Resource;
import settingsd.shell.QuoteCodec;
import settingsd.shell.ShellConfigDocument;
import settingsd.xorg.XkbSettings;
import settingsd.xorg.XorgKeyboardConfig;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

public class LocaleSettings extends AbstractSettingsService {

    public static final String ACTION_SET_LOCALE = "org.freedesktop.locale1.set-locale";
    public static final String ACTION_SET_KEYBOARD = "org.freedesktop.locale1.set-keyboard";

    public static final List<String> LOCALE_VARIABLES = Collections.unmodifiableList(Arrays.asList(
            "LANG", "LC_CTYPE", "LC_NUMERIC", "LC_TIME", "LC_COLLATE", "LC_MONETARY", "LC_MESSAGES",
            "LC_PAPER", "LC_NAME", "LC_ADDRESS", "LC_TELEPHONE", "LC_MEASUREMENT", "LC_IDENTIFICATION"));

    static final String LOCALE_FILE_HEADER =
            "# Configuration file for eselect\n# This file has been automatically generated\n";

    private static final Pattern VALID_LOCALE = Pattern.compile("^[a-zA-Z0-9_.@-]*$");

    public LocaleSettings(SettingsdConfig config, Authorizer authorizer, ResourceLocks locks) {
        super(config, authorizer, locks);
    }

    public List<String> getLocale() {
        return read(() -> {
            ShellConfigDocument doc = ShellConfigDocument.parse(config.getLocaleFile());
            List<String> out = new ArrayList<>();
            for (String variable : LOCALE_VARIABLES) {
                doc.get(variable).ifPresent(value -> out.add(variable + "=" + value));
            }
            return out;
        }, Resource.LOCALE_FILE);
    }

    public List<String> setLocale(String subject, List<String> assignments, boolean interactive) {
        return mutate(subject, ACTION_SET_LOCALE, interactive, () -> {
            Map<String, String> values = parseAssignments(assignments);
            ShellConfigDocument doc = ShellConfigDocument.parse(config.getLocaleFile());
            if (doc.isEmpty()) {
                doc = ShellConfigDocument.parse(config.getLocaleFile(), LOCALE_FILE_HEADER);
            }
            List<String> out = new ArrayList<>();
            for (String variable : LOCALE_VARIABLES) {
                String value = values.get(variable);
                if (value == null) {
                    doc.clear(variable);
                } else {
                    doc.set(variable, value, true);
                    out.add(variable + "=" + value);
                }
            }
            doc.save();
            log.info("Locale set to {}", out);
            return out;
        }, Resource.LOCALE_FILE);
    }

    public String getVconsoleKeymap() {
        return read(() -> ShellConfigDocument.sourceVar(config.getKeymapFile(), "keymap").orElse(""),
                Resource.KEYMAP_FILE);
    }

    public void setVconsoleKeyboard(String subject,
                                    String keymap,
                                    String keymapToggle,
                                    boolean convert,
                                    boolean interactive) {
        String target = StringUtils.defaultString(keymap);
        Resource[] extra = convert ? new Resource[]{Resource.XORG_KEYBOARD_FILE} : new Resource[0];
        mutate(subject, ACTION_SET_KEYBOARD, interactive, () -> {
            Optional<KeyboardMapEntry> entry = Optional.empty();
            if (convert) {
                entry = KeyboardModelMatcher.findByConsoleKeymap(loadModelMap(), target);
            }

            ShellConfigDocument doc = ShellConfigDocument.parse(config.getKeymapFile());
            doc.set("keymap", target, true);
            doc.save();
            log.info("Console keymap set to '{}'", target);

            if (convert) {
                if (entry.isEmpty()) {
                    log.warn("No conversion entry for console keymap '{}' in '{}'",
                            target, config.getKeyboardModelMapFile());
                } else {
                    convertToX11(entry.get());
                }
            }
            return null;
        }, Resource.KEYMAP_FILE, extra);
    }

    public XkbSettings getX11Keyboard() {
        return read(() -> XorgKeyboardConfig.parse(config.getXorgKeyboardFile()).getXkb(),
                Resource.XORG_KEYBOARD_FILE);
    }

    public void setX11Keyboard(String subject,
                               String layout,
                               String model,
                               String variant,
                               String options,
                               boolean convert,
                               boolean interactive) {
        XkbSettings settings = new XkbSettings(layout, model, variant, options);
        Resource[] extra = convert ? new Resource[]{Resource.KEYMAP_FILE} : new Resource[0];
        mutate(subject, ACTION_SET_KEYBOARD, interactive, () -> {
            checkXkbValues(settings);
            Optional<KeyboardMatch> best = Optional.empty();
            if (convert) {
                best = KeyboardModelMatcher.findBestByX11(loadModelMap(), layout, model, variant, options)
                        .filter(KeyboardMatch::isLayoutCompatible);
            }

            XorgKeyboardConfig xorg = XorgKeyboardConfig.parse(config.getXorgKeyboardFile());
            xorg.setXkb(settings);
            xorg.save();
            log.info("X11 keyboard set to {}", settings);

            if (convert) {
                if (best.isEmpty()) {
                    log.warn("No conversion entry for X11 layout '{}' in '{}'",
                            layout, config.getKeyboardModelMapFile());
                } else {
                    String keymap = best.get().getEntry().getConsoleKeymap();
                    ShellConfigDocument doc = ShellConfigDocument.parse(config.getKeymapFile());
                    doc.set("keymap", keymap, true);
                    doc.save();
                    log.info("Console keymap converted to '{}'", keymap);
                }
            }
            return null;
        }, Resource.XORG_KEYBOARD_FILE, extra);
    }

    static Map<String, String> parseAssignments(List<String> assignments) {
        Map<String, String> values = new LinkedHashMap<>();
        if (assignments == null) {
            return values;
        }
        for (String assignment : assignments) {
            String variable = StringUtils.substringBefore(assignment, "=");
            if (assignment == null || !assignment.contains("=") || !LOCALE_VARIABLES.contains(variable)) {
                throw SettingsException.invalidArgument("Invalid locale variable name or value: " + assignment);
            }
            String value;
            try {
                value = QuoteCodec.unquote(StringUtils.substringAfter(assignment, "="));
            } catch (ConfigParseException ex) {
                throw new SettingsException(SettingsException.Reason.INVALID_ARGUMENT,
                        "Invalid locale variable name or value: " + assignment, ex);
            }
            if (!VALID_LOCALE.matcher(value).matches()) {
                throw SettingsException.invalidArgument("Invalid locale variable name or value: " + assignment);
            }
            values.put(variable, value);
        }
        return values;
    }

    private void convertToX11(KeyboardMapEntry entry) throws IOException {
        XorgKeyboardConfig xorg = XorgKeyboardConfig.parse(config.getXorgKeyboardFile());
        XkbSettings current = xorg.getXkb();
        int score = KeyboardModelMatcher.score(entry, current.getLayout(), current.getModel(),
                current.getVariant(), current.getOptions());
        if (score == 0) {
            log.debug("X11 keyboard already matches console keymap '{}'", entry.getConsoleKeymap());
            return;
        }
        xorg.setXkb(entry.getX11Layout(), entry.getX11Model(), entry.getX11Variant(), entry.getX11Options());
        xorg.save();
        log.info("X11 keyboard converted from console keymap '{}'", entry.getConsoleKeymap());
    }

    private List<KeyboardMapEntry> loadModelMap() throws IOException {
        return KeyboardModelMatcher.load(config.getKeyboardModelMapFile());
    }

    private static void checkXkbValues(XkbSettings settings) {
        for (String value : Arrays.asList(settings.getLayout(), settings.getModel(),
                settings.getVariant(), settings.getOptions())) {
            if (StringUtils.containsAny(value, '"', '\n')) {
                throw SettingsException.invalidArgument("Invalid X11 keyboard value: " + value);
            }
        }
    }
}
