package settingsd.xorg;

public enum XorgLineType {
    UNKNOWN, COMMENT, SECTION_INPUT_CLASS, SECTION_OTHER, END_SECTION, MATCH_IS_KEYBOARD, XKB_OPTION
}
