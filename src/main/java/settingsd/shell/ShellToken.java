package settingsd.shell;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ShellToken {

    ShellTokenType type;
    String text;
    String name;
    String value;
    String keyword;

    public static ShellToken indent(String text) {
        return new ShellToken(ShellTokenType.INDENT, text, null, null, null);
    }

    public static ShellToken comment(String text) {
        return new ShellToken(ShellTokenType.COMMENT, text, null, null, null);
    }

    public static ShellToken separator(String text) {
        return new ShellToken(ShellTokenType.SEPARATOR, text, null, null, null);
    }

    public static ShellToken assignment(String text, String name, String value, String keyword) {
        return new ShellToken(ShellTokenType.ASSIGNMENT, text, name, value, keyword == null ? "" : keyword);
    }

    public static ShellToken quotedAssignment(String keyword, String name, String value) {
        String kw = keyword == null ? "" : keyword;
        return assignment(kw + name + "=" + QuoteCodec.quote(value), name, value, kw);
    }

    public boolean is(ShellTokenType other) {
        return type == other;
    }

    public boolean isAssignmentOf(String variable) {
        return type == ShellTokenType.ASSIGNMENT && name != null && name.equals(variable);
    }

    boolean endsStatement() {
        if (type == ShellTokenType.SEPARATOR) {
            return true;
        }
        return type == ShellTokenType.COMMENT && text.endsWith("\n");
    }
}
