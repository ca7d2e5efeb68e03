package clitree.cli;

public enum ExitCode {
    SUCCESS(0),
    GENERAL_ERROR(1),
    INVALID_CHARACTER(2),
    OVERFLOW(3),
    SYNTAX_ERROR(4),
    ARGUMENT_NOT_FOUND(6),
    ARGUMENT_MISSING(7),
    NO_VALUE_SET(8),
    INVALID_ENUM_VALUE(10),
    INVALID_JSON_FORMAT(11),
    MISSING_REQUIRED_FIELD(12),
    UNSUPPORTED_TYPE(14),
    WRITE_FAILED(15);

    private final int code;

    ExitCode(final int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ExitCode of(final ValueError.Kind kind) {
        return kind.exitCode();
    }
}
