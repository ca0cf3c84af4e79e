package settingsd.keyboard;

import lombok.Value;

@Value
public class KeyboardMatch {

    public static final int LAYOUT_INCOMPATIBLE = 10000;

    KeyboardMapEntry entry;
    int score;

    public boolean isLayoutCompatible() {
        return score < LAYOUT_INCOMPATIBLE;
    }
}
