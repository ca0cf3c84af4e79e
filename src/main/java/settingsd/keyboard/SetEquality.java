package settingsd.keyboard;

import lombok.Value;

@Value
public class SetEquality {
    boolean equal;
    int mismatchCount;
}
