package settingsd.xorg;

import lombok.Getter;

@Getter
public enum XkbOption {
    LAYOUT("XkbLayout"),
    MODEL("XkbModel"),
    VARIANT("XkbVariant"),
    OPTIONS("XkbOptions");

    private final String optionName;

    XkbOption(String optionName) {
        this.optionName = optionName;
    }

    public static XkbOption fromOptionName(String name) {
        for (XkbOption option : values()) {
            if (option.optionName.equalsIgnoreCase(name)) {
                return option;
            }
        }
        throw new IllegalArgumentException("Unknown Xkb option: " + name);
    }
}
