package clitree.cli;

import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Raised when a resolved raw value cannot be looked up or converted to its declared type.
 * Decoding is lazy, so this surfaces when an action reads a value, never while parsing.
 */
@Getter
@Accessors(fluent = true)
public class ValueError extends Exception {
    public enum Kind {
        NO_VALUE_SET(ExitCode.NO_VALUE_SET),
        REQUIRED_ARGUMENT_MISSING(ExitCode.ARGUMENT_MISSING),
        OPTION_NOT_FOUND(ExitCode.ARGUMENT_NOT_FOUND),
        ARGUMENT_NOT_FOUND(ExitCode.ARGUMENT_NOT_FOUND),
        INVALID_FORMAT(ExitCode.SYNTAX_ERROR),
        INVALID_CHARACTER(ExitCode.INVALID_CHARACTER),
        OVERFLOW(ExitCode.OVERFLOW),
        INVALID_BOOL_VALUE(ExitCode.INVALID_CHARACTER),
        INVALID_ENUM_VALUE(ExitCode.INVALID_ENUM_VALUE),
        INVALID_JSON_FORMAT(ExitCode.INVALID_JSON_FORMAT),
        MISSING_FIELD(ExitCode.MISSING_REQUIRED_FIELD),
        UNSUPPORTED_TYPE(ExitCode.UNSUPPORTED_TYPE);

        private final ExitCode exitCode;

        Kind(final ExitCode exitCode) {
            this.exitCode = exitCode;
        }

        public ExitCode exitCode() {
            return exitCode;
        }
    }

    private final Kind kind;

    private final String parameter;

    private final String value;

    public ValueError(final Kind kind, final String parameter, final String value, final String message) {
        super(message);
        this.kind = kind;
        this.parameter = parameter;
        this.value = value;
    }

    public ValueError(final Kind kind, final String parameter, final String value, final String message, final Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.parameter = parameter;
        this.value = value;
    }

    public static ValueError decode(final Kind kind, final String value, final String message) {
        return new ValueError(kind, null, value, message);
    }

    public static ValueError decode(final Kind kind, final String value, final String message, final Throwable cause) {
        return new ValueError(kind, null, value, message, cause);
    }

    public static ValueError noValueSet(final String parameter) {
        return new ValueError(Kind.NO_VALUE_SET, parameter, null, "No value was set for " + parameter + ".");
    }

    public static ValueError requiredArgumentMissing(final String parameter) {
        return new ValueError(Kind.REQUIRED_ARGUMENT_MISSING, parameter, null, "The required argument " + parameter + " is missing.");
    }

    public static ValueError optionNotFound(final String parameter) {
        return new ValueError(Kind.OPTION_NOT_FOUND, parameter, null, "No value was resolved for option " + parameter + ".");
    }

    public static ValueError argumentNotFound(final String parameter) {
        return new ValueError(Kind.ARGUMENT_NOT_FOUND, parameter, null, "No value was resolved for argument " + parameter + ".");
    }

    public static ValueError unsupportedType(final String parameter, final String expected, final Class<?> requested) {
        return new ValueError(
            Kind.UNSUPPORTED_TYPE,
            parameter,
            null,
            parameter + " is declared as " + expected + " and cannot be read as " + requested.getSimpleName() + ".");
    }

    /**
     * Attaches the parameter name to an error raised by a codec, which only knows the raw value.
     */
    public ValueError forParameter(final String name) {
        if (parameter != null) {
            return this;
        }
        return new ValueError(kind, name, value, "Invalid value for " + name + ": " + getMessage(), getCause());
    }
}
