package settingsd;

import settingsd.io.AtomicFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

public interface ConfigDocument {

    Path getPath();

    String serialize();

    default void save() throws IOException {
        AtomicFiles.writeAtomic(getPath(), serialize().getBytes(StandardCharsets.UTF_8));
    }
}
