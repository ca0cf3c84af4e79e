package settingsd.shell;

import settingsd.ConfigParseException;

import java.util.regex.Matcher;

public final class QuoteCodec {

    static final String COMMAND_SUBSTITUTION = "command substitution and parameter expansion are not supported";
    static final String UNTERMINATED_SINGLE = "unterminated single-quoted string";
    static final String UNTERMINATED_DOUBLE = "unterminated double-quoted string";
    static final String TRAILING_BACKSLASH = "trailing backslash";

    private QuoteCodec() {
    }

    public static String quote(String value) {
        String v = value == null ? "" : value;
        return "'" + v.replace("'", "'\"'\"'") + "'";
    }

    public static String unquote(String fragment) {
        String s = fragment == null ? "" : fragment;
        StringBuilder out = new StringBuilder(s.length());
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '\'') {
                int close = s.indexOf('\'', i + 1);
                if (close < 0) {
                    throw ConfigParseException.atIndex(null, i, UNTERMINATED_SINGLE);
                }
                out.append(s, i + 1, close);
                i = close + 1;
            } else if (c == '"') {
                i = unquoteDouble(s, i, out);
            } else if (c == '\\') {
                if (i + 1 >= s.length()) {
                    throw ConfigParseException.atIndex(null, i, TRAILING_BACKSLASH);
                }
                char next = s.charAt(i + 1);
                if (next != '\n') {
                    out.append(next);
                }
                i += 2;
            } else if (c == '$' || c == '`') {
                checkDollarBrace(s, i);
                out.append("${");
                i += 2;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int unquoteDouble(String s, int open, StringBuilder out) {
        int i = open + 1;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '"') {
                return i + 1;
            }
            if (c == '\\') {
                if (i + 1 >= s.length()) {
                    break;
                }
                char next = s.charAt(i + 1);
                if (next == '"' || next == '\\' || next == '$' || next == '`') {
                    out.append(next);
                } else if (next != '\n') {
                    out.append(c).append(next);
                }
                i += 2;
            } else if (c == '$' || c == '`') {
                checkDollarBrace(s, i);
                out.append("${");
                i += 2;
            } else {
                out.append(c);
                i++;
            }
        }
        throw ConfigParseException.atIndex(null, open, UNTERMINATED_DOUBLE);
    }

    private static void checkDollarBrace(String s, int i) {
        if (s.charAt(i) == '`' || i + 1 >= s.length() || s.charAt(i + 1) != '{') {
            throw ConfigParseException.atIndex(null, i, COMMAND_SUBSTITUTION);
        }
    }

    static int scanValue(ShellPatterns patterns, String text, int start) {
        int pos = start;
        Matcher single = patterns.singleQuoted.matcher(text);
        Matcher dbl = patterns.doubleQuoted.matcher(text);
        Matcher plain = patterns.unquoted.matcher(text);
        while (pos < text.length()) {
            int end = matchAt(single, pos, text.length());
            if (end < 0) {
                end = matchAt(dbl, pos, text.length());
            }
            if (end < 0) {
                end = matchAt(plain, pos, text.length());
            }
            if (end < 0) {
                break;
            }
            pos = end;
        }
        return pos;
    }

    static String diagnose(String text, int pos) {
        if (pos >= text.length()) {
            return "unexpected end of input";
        }
        char c = text.charAt(pos);
        if (c == '$' || c == '`') {
            return COMMAND_SUBSTITUTION;
        }
        if (c == '\'') {
            return UNTERMINATED_SINGLE;
        }
        if (c == '\\') {
            return TRAILING_BACKSLASH;
        }
        if (c != '"') {
            return "unexpected character '" + c + "'";
        }
        for (int i = pos + 1; i < text.length(); i++) {
            char d = text.charAt(i);
            if (d == '\\') {
                i++;
            } else if (d == '"') {
                return UNTERMINATED_DOUBLE;
            } else if (d == '`' || d == '$' && (i + 1 >= text.length() || text.charAt(i + 1) != '{')) {
                return COMMAND_SUBSTITUTION;
            }
        }
        return UNTERMINATED_DOUBLE;
    }

    private static int matchAt(Matcher matcher, int from, int to) {
        matcher.region(from, to);
        return matcher.lookingAt() ? matcher.end() : -1;
    }
}
