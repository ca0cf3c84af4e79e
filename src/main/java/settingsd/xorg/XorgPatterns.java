package settingsd.xorg;

import java.util.regex.Pattern;

public final class XorgPatterns {

    public static final XorgPatterns DEFAULT = new XorgPatterns();

    final Pattern comment;
    final Pattern sectionInputClass;
    final Pattern section;
    final Pattern endSection;
    final Pattern matchIsKeyboard;
    final Pattern falseValue;
    final Pattern xkbOption;

    private XorgPatterns() {
        int flags = Pattern.CASE_INSENSITIVE;
        comment = Pattern.compile("^\\s*#");
        sectionInputClass = Pattern.compile("^\\s*Section\\s+\"InputClass\"", flags);
        section = Pattern.compile("^\\s*Section\\s+\"[^\"]*\"", flags);
        endSection = Pattern.compile("^\\s*EndSection", flags);
        matchIsKeyboard = Pattern.compile("^\\s*MatchIsKeyboard(?:\\s*$|\\s+\"([^\"]*)\")", flags);
        falseValue = Pattern.compile("0|off|false|no", flags);
        xkbOption = Pattern.compile("^(\\s*Option\\s+\"(Xkb(?:Layout|Model|Variant|Options))\"\\s+)\"([^\"]*)\"(.*)", flags | Pattern.DOTALL);
    }
}
