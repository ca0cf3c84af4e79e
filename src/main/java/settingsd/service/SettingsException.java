package settingsd.service;

import lombok.Getter;
import settingsd.ConfigParseException;

import java.io.IOException;

@Getter
public class SettingsException extends RuntimeException {

    public enum Reason {
        NOT_AUTHORIZED,
        READ_ONLY,
        INVALID_ARGUMENT,
        IO_FAILURE,
        PARSE_FAILURE
    }

    private final Reason reason;

    public SettingsException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SettingsException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public static SettingsException notAuthorized(String subject, String actionId) {
        return new SettingsException(Reason.NOT_AUTHORIZED, "'" + subject + "' is not authorized for " + actionId);
    }

    public static SettingsException readOnly() {
        return new SettingsException(Reason.READ_ONLY, "settingsd is in read-only mode");
    }

    public static SettingsException invalidArgument(String message) {
        return new SettingsException(Reason.INVALID_ARGUMENT, message);
    }

    public static SettingsException io(IOException cause) {
        return new SettingsException(Reason.IO_FAILURE, "I/O failure: " + cause, cause);
    }

    public static SettingsException parse(ConfigParseException cause) {
        return new SettingsException(Reason.PARSE_FAILURE, cause.getMessage(), cause);
    }
}
