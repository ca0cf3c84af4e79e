package settingsd;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class ConfigParseException extends RuntimeException {

    private final transient Path path;
    private final long offset;
    private final int line;
    private final String detail;

    private ConfigParseException(Path path, long offset, String unit, int line, String detail) {
        super(buildMessage(path, offset, unit, line, detail));
        this.path = path;
        this.offset = offset;
        this.line = line;
        this.detail = detail;
    }

    public static ConfigParseException atOffset(Path path, long offset, String detail) {
        return new ConfigParseException(path, offset, "byte", -1, detail);
    }

    /**
     * Error inside a string fragment rather than a file; {@code index} counts chars, not bytes.
     */
    public static ConfigParseException atIndex(Path path, int index, String detail) {
        return new ConfigParseException(path, index, "character", -1, detail);
    }

    public static ConfigParseException atLine(Path path, int line, String detail) {
        return new ConfigParseException(path, -1, null, line, detail);
    }

    private static String buildMessage(Path path, long offset, String unit, int line, String detail) {
        StringBuilder sb = new StringBuilder("Unable to parse '");
        sb.append(path == null ? "<string>" : path.toString()).append('\'');
        if (line >= 0) {
            sb.append(" at line ").append(line);
        } else if (offset >= 0) {
            sb.append(" at ").append(unit).append(' ').append(offset);
        }
        if (detail != null && !detail.isEmpty()) {
            sb.append(": ").append(detail);
        }
        return sb.toString();
    }
}
