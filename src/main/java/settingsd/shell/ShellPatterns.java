package settingsd.shell;

import java.util.regex.Pattern;

public final class ShellPatterns {

    public static final ShellPatterns DEFAULT = new ShellPatterns();

    final Pattern indent;
    final Pattern comment;
    final Pattern separator;
    final Pattern assignment;
    final Pattern singleQuoted;
    final Pattern doubleQuoted;
    final Pattern unquoted;

    private ShellPatterns() {
        indent = Pattern.compile("[ \\t]+");
        comment = Pattern.compile("#[^\\n]*+\\n?");
        separator = Pattern.compile("[ \\t\\r]*+[;\\n][ \\t;\\n\\r]*+");
        assignment = Pattern.compile("(?:(export|local)[ \\t]++)?([A-Za-z_][A-Za-z0-9_]*+)(?:\\\\\\n)*+=(?:\\\\\\n)*+");
        singleQuoted = Pattern.compile("'[^']*+'");
        doubleQuoted = Pattern.compile("\"(?:[^\"`$\\\\]++|\\\\[\\s\\S]|\\$\\{)*+\"");
        unquoted = Pattern.compile("(?:[^\\s\"'`$|&<>;\\\\]++|\\\\[\\s\\S]|\\$\\{)++");
    }
}
