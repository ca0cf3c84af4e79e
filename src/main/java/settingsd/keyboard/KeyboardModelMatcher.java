package settingsd.keyboard;

import org.apache.commons.lang3.StringUtils;
import settingsd.ConfigParseException;
import settingsd.io.AtomicFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps console keymaps to X11 keyboard settings using a kbd-model-map table.
 * Each data line holds five whitespace separated columns: console keymap,
 * layout, model, variant and options, with {@code -} standing for an empty value.
 */
public final class KeyboardModelMatcher {

    private static final Pattern COMMENT = Pattern.compile("^\\s*(?:#.*)?$");
    private static final Pattern ENTRY = Pattern.compile("^\\s*(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)");
    private static final String EMPTY_MARKER = "-";

    private KeyboardModelMatcher() {
    }

    public static List<KeyboardMapEntry> load(Path path) throws IOException {
        Optional<String> text = AtomicFiles.readText(path);
        if (text.isEmpty()) {
            return new ArrayList<>();
        }
        return load(path, text.get());
    }

    public static List<KeyboardMapEntry> load(Path path, String text) {
        List<KeyboardMapEntry> out = new ArrayList<>();
        String[] lines = StringUtils.defaultString(text).split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String line = StringUtils.removeEnd(lines[i], "\r");
            if (COMMENT.matcher(line).matches()) {
                continue;
            }
            Matcher m = ENTRY.matcher(line);
            if (!m.find()) {
                throw ConfigParseException.atLine(path, i + 1, "expected five columns");
            }
            out.add(KeyboardMapEntry.builder()
                    .consoleKeymap(column(m.group(1)))
                    .x11Layout(column(m.group(2)))
                    .x11Model(column(m.group(3)))
                    .x11Variant(column(m.group(4)))
                    .x11Options(column(m.group(5)))
                    .build());
        }
        return out;
    }

    public static SetEquality setEqual(String a, String b) {
        Set<String> left = commaSet(a);
        Set<String> right = commaSet(b);
        boolean equal = left.isEmpty() && right.isEmpty();
        int mismatches = 0;
        for (String s : left) {
            if (right.contains(s)) {
                equal = true;
            } else {
                mismatches++;
            }
        }
        for (String s : right) {
            if (!left.contains(s)) {
                mismatches++;
            }
        }
        return new SetEquality(equal, mismatches);
    }

    public static Optional<KeyboardMapEntry> findByConsoleKeymap(List<KeyboardMapEntry> entries, String keymap) {
        return entries.stream()
                .filter(e -> StringUtils.equals(e.getConsoleKeymap(), keymap))
                .findFirst();
    }

    public static int score(KeyboardMapEntry entry, String layout, String model, String variant, String options) {
        SetEquality layouts = setEqual(entry.getX11Layout(), layout);
        SetEquality opts = setEqual(entry.getX11Options(), options);
        int score = 0;
        if (!layouts.isEqual()) {
            score += KeyboardMatch.LAYOUT_INCOMPATIBLE;
        }
        score += 100 * layouts.getMismatchCount();
        if (!StringUtils.equals(StringUtils.defaultString(entry.getX11Model()), StringUtils.defaultString(model))) {
            score += 1;
        }
        if (!StringUtils.equals(StringUtils.defaultString(entry.getX11Variant()), StringUtils.defaultString(variant))) {
            score += 10;
        }
        if (!opts.isEqual()) {
            score += 1;
        }
        return score;
    }

    public static Optional<KeyboardMatch> findBestByX11(List<KeyboardMapEntry> entries,
                                                        String layout,
                                                        String model,
                                                        String variant,
                                                        String options) {
        KeyboardMatch best = null;
        for (KeyboardMapEntry entry : entries) {
            int s = score(entry, layout, model, variant, options);
            if (best == null || s < best.getScore()) {
                best = new KeyboardMatch(entry, s);
            }
        }
        return Optional.ofNullable(best);
    }

    private static Set<String> commaSet(String value) {
        if (StringUtils.isEmpty(value)) {
            return new LinkedHashSet<>();
        }
        return new LinkedHashSet<>(Arrays.asList(StringUtils.splitPreserveAllTokens(value, ',')));
    }

    private static String column(String raw) {
        return EMPTY_MARKER.equals(raw) ? "" : raw;
    }
}
