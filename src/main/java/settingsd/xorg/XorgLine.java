package settingsd.xorg;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class XorgLine {

    XorgLineType type;
    String text;
    XkbOption option;
    String value;
    String prefix;
    String suffix;

    public static XorgLine of(XorgLineType type, String text) {
        return new XorgLine(type, text == null ? "" : text, null, null, null, null);
    }

    public static XorgLine xkbOption(XkbOption option, String prefix, String value, String suffix) {
        String p = prefix == null ? "" : prefix;
        String s = suffix == null ? "" : suffix;
        return new XorgLine(XorgLineType.XKB_OPTION, p + "\"" + value + "\"" + s, option, value, p, s);
    }

    public static XorgLine newXkbOption(XkbOption option, String value) {
        return newXkbOption(option, value, "");
    }

    public static XorgLine newXkbOption(XkbOption option, String value, String suffix) {
        return xkbOption(option, "        Option \"" + option.getOptionName() + "\" ", value, suffix);
    }

    public XorgLine withValue(String newValue) {
        return xkbOption(option, prefix, newValue, suffix);
    }

    public boolean is(XorgLineType other) {
        return type == other;
    }

    public boolean isOption(XkbOption kind) {
        return type == XorgLineType.XKB_OPTION && option == kind;
    }
}
