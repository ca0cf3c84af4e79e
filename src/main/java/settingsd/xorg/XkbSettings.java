package settingsd.xorg;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class XkbSettings {

    public static final XkbSettings EMPTY = new XkbSettings(null, null, null, null);

    String layout;
    String model;
    String variant;
    String options;

    public String get(XkbOption option) {
        switch (option) {
            case LAYOUT:
                return layout;
            case MODEL:
                return model;
            case VARIANT:
                return variant;
            case OPTIONS:
                return options;
            default:
                throw new IllegalArgumentException("Unknown Xkb option: " + option);
        }
    }
}
