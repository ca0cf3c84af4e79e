package settingsd.keyboard;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
public class KeyboardMapEntry {
    String consoleKeymap;
    String x11Layout;
    String x11Model;
    String x11Variant;
    String x11Options;
}
