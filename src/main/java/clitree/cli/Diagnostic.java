package clitree.cli;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * One user input problem found while scanning. The parser keeps scanning after recording one.
 */
@Builder
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class Diagnostic {
    public enum Kind {
        UNKNOWN_OPTION,
        INSUFFICIENT_VALUES,
        TOO_MANY_VALUES,
        UNEXPECTED_POSITIONAL,
        REQUIRED_ARGUMENT_MISSING
    }

    private final Kind kind;

    private final String parameter;

    private final String value;

    private final Integer expected;

    private final Integer actual;

    static Diagnostic unknownOption(final String name, final String token) {
        return builder().kind(Kind.UNKNOWN_OPTION).parameter(name).value(token).build();
    }

    static Diagnostic insufficientValues(final String name, final int min, final int actual) {
        return builder().kind(Kind.INSUFFICIENT_VALUES).parameter(name).expected(min).actual(actual).build();
    }

    static Diagnostic tooManyValues(final String name, final String value, final int max, final int actual) {
        return builder().kind(Kind.TOO_MANY_VALUES).parameter(name).value(value).expected(max).actual(actual).build();
    }

    static Diagnostic unexpectedPositional(final String command, final String token) {
        return builder().kind(Kind.UNEXPECTED_POSITIONAL).parameter(command).value(token).build();
    }

    static Diagnostic requiredArgumentMissing(final String name) {
        return builder().kind(Kind.REQUIRED_ARGUMENT_MISSING).parameter(name).expected(1).actual(0).build();
    }

    public String message() {
        switch (kind) {
            case UNKNOWN_OPTION:
                return value + " is not a valid flag or option!";
            case INSUFFICIENT_VALUES:
                return parameter + " requires at least " + expected + " value(s), but received " + actual + "!";
            case TOO_MANY_VALUES:
                return parameter + " accepts at most " + expected + " value(s), but received " + actual
                    + (value == null ? "" : " (" + value + ")") + "!";
            case UNEXPECTED_POSITIONAL:
                return value + " is not a valid argument for " + parameter + "!";
            case REQUIRED_ARGUMENT_MISSING:
                return "The required argument " + parameter + " is missing!";
            default:
                throw new IllegalStateException("Unexpected kind: " + kind);
        }
    }

    @Override
    public String toString() {
        return kind + ": " + message();
    }
}
