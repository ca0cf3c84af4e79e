package settingsd.shell;

import settingsd.ConfigDocument;
import settingsd.ConfigParseException;
import settingsd.io.AtomicFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

public class ShellConfigDocument implements ConfigDocument {

    private final Path path;
    private final List<ShellToken> tokens;

    private ShellConfigDocument(Path path, List<ShellToken> tokens) {
        this.path = path;
        this.tokens = tokens;
    }

    public static ShellConfigDocument parse(Path path) throws IOException {
        Optional<String> text = AtomicFiles.readText(path);
        if (text.isEmpty()) {
            return new ShellConfigDocument(path, new ArrayList<>());
        }
        return parse(path, text.get());
    }

    public static ShellConfigDocument parse(Path path, String text) {
        return parse(path, text, ShellPatterns.DEFAULT);
    }

    public static ShellConfigDocument parse(Path path, String text, ShellPatterns patterns) {
        return new ShellConfigDocument(path, new Scanner(path, text == null ? "" : text, patterns).scan());
    }

    public static Optional<String> sourceVar(Path path, String variable) throws IOException {
        return parse(path).get(variable);
    }

    @Override
    public Path getPath() {
        return path;
    }

    public List<ShellToken> getTokens() {
        return Collections.unmodifiableList(tokens);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public Optional<String> get(String name) {
        int idx = lastAssignmentOf(name);
        return idx < 0 ? Optional.empty() : Optional.of(tokens.get(idx).getValue());
    }

    public boolean set(String name, String value, boolean addIfUnset) {
        String v = value == null ? "" : value;
        int idx = lastAssignmentOf(name);
        if (idx >= 0) {
            ShellToken old = tokens.get(idx);
            tokens.set(idx, ShellToken.quotedAssignment(old.getKeyword(), name, v));
            return true;
        }
        if (!addIfUnset) {
            return false;
        }
        if (!tokens.isEmpty() && !tokens.get(tokens.size() - 1).endsStatement()) {
            tokens.add(ShellToken.separator("\n"));
        }
        tokens.add(ShellToken.quotedAssignment("", name, v));
        tokens.add(ShellToken.separator("\n"));
        return true;
    }

    public boolean setEither(String name, String altName, String value) {
        if (set(name, value, false)) {
            return true;
        }
        if (altName != null && set(altName, value, false)) {
            return true;
        }
        return set(name, value, true);
    }

    public void clear(String name) {
        int i = 0;
        while (i < tokens.size()) {
            if (!tokens.get(i).isAssignmentOf(name)) {
                i++;
                continue;
            }
            if (i + 1 < tokens.size() && tokens.get(i + 1).is(ShellTokenType.SEPARATOR)) {
                tokens.remove(i + 1);
                tokens.remove(i);
            } else if (i > 0 && tokens.get(i - 1).is(ShellTokenType.SEPARATOR)) {
                tokens.remove(i);
                tokens.remove(i - 1);
                i--;
            } else {
                tokens.remove(i);
            }
        }
    }

    @Override
    public String serialize() {
        StringBuilder sb = new StringBuilder();
        for (ShellToken token : tokens) {
            sb.append(token.getText());
        }
        return sb.toString();
    }

    private int lastAssignmentOf(String name) {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            if (tokens.get(i).isAssignmentOf(name)) {
                return i;
            }
        }
        return -1;
    }

    private static final class Scanner {
        private final Path path;
        private final String text;
        private final ShellPatterns patterns;
        private final Matcher comment;
        private final Matcher separator;
        private final Matcher indent;
        private final Matcher assignment;
        private final List<ShellToken> out = new ArrayList<>();
        private boolean wantSeparator;
        private int pos;
        private int matchEnd;

        Scanner(Path path, String text, ShellPatterns patterns) {
            this.path = path;
            this.text = text;
            this.patterns = patterns;
            this.comment = patterns.comment.matcher(text);
            this.separator = patterns.separator.matcher(text);
            this.indent = patterns.indent.matcher(text);
            this.assignment = patterns.assignment.matcher(text);
        }

        List<ShellToken> scan() {
            while (pos < text.length()) {
                if (lookingAt(comment)) {
                    out.add(ShellToken.comment(comment.group()));
                    wantSeparator = false;
                } else if (lookingAt(separator)) {
                    out.add(ShellToken.separator(separator.group()));
                    wantSeparator = false;
                } else if (lookingAt(indent)) {
                    out.add(ShellToken.indent(indent.group()));
                } else if (lookingAt(assignment)) {
                    scanAssignment();
                    continue;
                } else {
                    throw error(pos, QuoteCodec.diagnose(text, pos));
                }
                pos = matchEnd;
            }
            return out;
        }

        private boolean lookingAt(Matcher matcher) {
            matcher.region(pos, text.length());
            if (matcher.lookingAt()) {
                matchEnd = matcher.end();
                return true;
            }
            return false;
        }

        private void scanAssignment() {
            if (wantSeparator) {
                throw error(pos, "expected a separator or comment before assignment");
            }
            String keyword = assignment.group(1) == null ? "" : text.substring(pos, assignment.start(2));
            String name = assignment.group(2);
            int valueStart = assignment.end();
            int valueEnd = QuoteCodec.scanValue(patterns, text, valueStart);
            if (valueEnd < text.length() && isForbidden(text.charAt(valueEnd))) {
                throw error(valueEnd, QuoteCodec.diagnose(text, valueEnd));
            }

            String unquoted;
            try {
                unquoted = QuoteCodec.unquote(text.substring(valueStart, valueEnd));
            } catch (ConfigParseException ex) {
                throw error(valueStart + (int) ex.getOffset(), ex.getDetail());
            }
            out.add(ShellToken.assignment(text.substring(pos, valueEnd), name, unquoted, keyword));
            wantSeparator = true;
            pos = valueEnd;
        }

        private static boolean isForbidden(char c) {
            return c == '$' || c == '`' || c == '"' || c == '\'' || c == '\\';
        }

        private ConfigParseException error(int charOffset, String detail) {
            long byteOffset = text.substring(0, charOffset).getBytes(StandardCharsets.UTF_8).length;
            return ConfigParseException.atOffset(path, byteOffset, detail);
        }
    }
}
