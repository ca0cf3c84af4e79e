package settingsd.xorg;

import settingsd.ConfigDocument;
import settingsd.ConfigParseException;
import settingsd.io.AtomicFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class XorgKeyboardConfig implements ConfigDocument {

    private final Path path;
    private final List<XorgLine> lines;
    private int keyboardSection;

    private XorgKeyboardConfig(Path path, List<XorgLine> lines, int keyboardSection) {
        this.path = path;
        this.lines = lines;
        this.keyboardSection = keyboardSection;
    }

    public static XorgKeyboardConfig parse(Path path) throws IOException {
        Optional<String> text = AtomicFiles.readText(path);
        if (text.isEmpty()) {
            return new XorgKeyboardConfig(path, new ArrayList<>(), -1);
        }
        return parse(path, text.get());
    }

    public static XorgKeyboardConfig parse(Path path, String text) {
        return parse(path, text, XorgPatterns.DEFAULT);
    }

    public static XorgKeyboardConfig parse(Path path, String text, XorgPatterns patterns) {
        ParseContext ctx = new ParseContext(path, patterns);
        for (String line : splitLines(text)) {
            ctx.accept(line);
        }
        ctx.finish();
        return new XorgKeyboardConfig(path, ctx.out, ctx.keyboardSection);
    }

    @Override
    public Path getPath() {
        return path;
    }

    public List<XorgLine> getLines() {
        return Collections.unmodifiableList(lines);
    }

    public boolean hasKeyboardSection() {
        return keyboardSection >= 0;
    }

    public XkbSettings getXkb() {
        if (keyboardSection < 0) {
            return XkbSettings.EMPTY;
        }
        Map<XkbOption, String> found = new EnumMap<>(XkbOption.class);
        for (int i = keyboardSection + 1; i < lines.size(); i++) {
            XorgLine line = lines.get(i);
            if (line.is(XorgLineType.END_SECTION)) {
                break;
            }
            if (line.is(XorgLineType.XKB_OPTION)) {
                found.put(line.getOption(), line.getValue());
            }
        }
        return new XkbSettings(found.get(XkbOption.LAYOUT), found.get(XkbOption.MODEL),
                found.get(XkbOption.VARIANT), found.get(XkbOption.OPTIONS));
    }

    public void setXkb(String layout, String model, String variant, String options) {
        setXkb(new XkbSettings(layout, model, variant, options));
    }

    public void setXkb(XkbSettings settings) {
        if (keyboardSection < 0) {
            appendKeyboardSection();
        }

        Map<XkbOption, Boolean> seen = new EnumMap<>(XkbOption.class);
        int i = keyboardSection + 1;
        while (i < lines.size() && !lines.get(i).is(XorgLineType.END_SECTION)) {
            XorgLine line = lines.get(i);
            if (!line.is(XorgLineType.XKB_OPTION)) {
                i++;
                continue;
            }
            seen.put(line.getOption(), Boolean.TRUE);
            String value = settings.get(line.getOption());
            if (value == null) {
                i++;
            } else if (value.isEmpty()) {
                lines.remove(i);
            } else {
                lines.set(i, line.withValue(value));
                i++;
            }
        }

        int end = i;
        String eol = carriageReturn(keyboardSection);
        for (XkbOption option : XkbOption.values()) {
            String value = settings.get(option);
            if (seen.containsKey(option) || value == null || value.isEmpty()) {
                continue;
            }
            lines.add(end++, XorgLine.newXkbOption(option, value, eol));
        }
    }

    @Override
    public String serialize() {
        StringBuilder sb = new StringBuilder();
        for (XorgLine line : lines) {
            sb.append(line.getText()).append('\n');
        }
        return sb.toString();
    }

    private void appendKeyboardSection() {
        String eol = carriageReturn(lines.size() - 1);
        keyboardSection = lines.size();
        lines.add(XorgLine.of(XorgLineType.SECTION_INPUT_CLASS, "Section \"InputClass\"" + eol));
        lines.add(XorgLine.of(XorgLineType.UNKNOWN, "        Identifier \"keyboard-all\"" + eol));
        lines.add(XorgLine.of(XorgLineType.MATCH_IS_KEYBOARD, "        MatchIsKeyboard \"on\"" + eol));
        lines.add(XorgLine.of(XorgLineType.END_SECTION, "EndSection" + eol));
    }

    // New lines follow the CRLF convention of the line they are anchored to.
    private String carriageReturn(int anchor) {
        if (anchor < 0 || anchor >= lines.size()) {
            return "";
        }
        return lines.get(anchor).getText().endsWith("\r") ? "\r" : "";
    }

    private static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return Collections.emptyList();
        }
        String[] parts = text.split("\n", -1);
        int count = parts[parts.length - 1].isEmpty() ? parts.length - 1 : parts.length;
        List<String> out = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            out.add(parts[i]);
        }
        return out;
    }

    private static final class ParseContext {
        final List<XorgLine> out = new ArrayList<>();
        final Path path;
        final XorgPatterns patterns;
        int keyboardSection = -1;
        int sectionStart = -1;
        boolean inputClass;
        boolean keyboard;
        int lineNo;

        ParseContext(Path path, XorgPatterns patterns) {
            this.path = path;
            this.patterns = patterns;
        }

        void accept(String line) {
            lineNo++;
            if (find(patterns.comment, line) != null) {
                out.add(XorgLine.of(XorgLineType.COMMENT, line));
            } else if (find(patterns.sectionInputClass, line) != null) {
                onSection(line, true);
            } else if (find(patterns.section, line) != null) {
                onSection(line, false);
            } else if (find(patterns.endSection, line) != null) {
                onEndSection(line);
            } else {
                acceptEntry(line);
            }
        }

        void finish() {
            if (sectionStart >= 0) {
                throw ConfigParseException.atLine(path, lineNo, "unterminated section");
            }
        }

        private void acceptEntry(String line) {
            Matcher m = find(patterns.matchIsKeyboard, line);
            if (m != null) {
                requireSection("MatchIsKeyboard");
                if (m.group(1) == null || !patterns.falseValue.matcher(m.group(1)).matches()) {
                    keyboard = true;
                    out.add(XorgLine.of(XorgLineType.MATCH_IS_KEYBOARD, line));
                } else {
                    out.add(XorgLine.of(XorgLineType.UNKNOWN, line));
                }
                return;
            }
            m = find(patterns.xkbOption, line);
            if (m != null) {
                requireSection(m.group(2));
                out.add(XorgLine.xkbOption(XkbOption.fromOptionName(m.group(2)), m.group(1), m.group(3), m.group(4)));
                return;
            }
            out.add(XorgLine.of(XorgLineType.UNKNOWN, line));
        }

        private void onSection(String line, boolean isInputClass) {
            if (sectionStart >= 0) {
                throw ConfigParseException.atLine(path, lineNo, "section started inside another section");
            }
            sectionStart = out.size();
            inputClass = isInputClass;
            keyboard = false;
            out.add(XorgLine.of(isInputClass ? XorgLineType.SECTION_INPUT_CLASS : XorgLineType.SECTION_OTHER, line));
        }

        private void onEndSection(String line) {
            requireSection("EndSection");
            if (inputClass && keyboard) {
                keyboardSection = sectionStart;
            }
            sectionStart = -1;
            inputClass = false;
            keyboard = false;
            out.add(XorgLine.of(XorgLineType.END_SECTION, line));
        }

        private void requireSection(String what) {
            if (sectionStart < 0) {
                throw ConfigParseException.atLine(path, lineNo, what + " outside of a section");
            }
        }

        private static Matcher find(Pattern pattern, String line) {
            Matcher m = pattern.matcher(line);
            return m.find() ? m : null;
        }
    }
}
