package settingsd.shell;

public enum ShellTokenType {
    INDENT, COMMENT, SEPARATOR, ASSIGNMENT
}
