package clitree.cli;

public interface ErrorFactory {
    String INVALID_ARITY = "Expected an arity with 0 <= min <= max, but received: ";

    String DEFAULTS_ALREADY_SET = "Default values were already set for: ";

    String VALUES_ALREADY_SET = "Values were already set for: ";

    String ARITY_VIOLATION = "Value count does not meet the arity requirements of ";

    String DEFAULT_ON_REQUIRED_ARGUMENT = "A required argument cannot carry a default value: ";

    String OPTIONAL_REQUIRED_ARGUMENT = "A required argument must accept at least one value: ";

    String REQUIRED_AFTER_OPTIONAL = "Required arguments must be registered before optional ones, but received: ";

    String MISSING_NAME = "Expected a long or a short name, but received neither for: ";

    String DUPLICATE_NAME = "The name is already registered on command ";

    String ALREADY_ATTACHED = "The command already has a parent: ";

    String NO_ACTION_DEFINED = "No action is defined for command: ";

    static RuntimeException invalidArity(final int min, final int max) {
        return new IllegalArgumentException(INVALID_ARITY + "{" + min + "," + max + "}");
    }

    static RuntimeException defaultsAlreadySet(final String name) {
        return new IllegalStateException(DEFAULTS_ALREADY_SET + name);
    }

    static RuntimeException valuesAlreadySet(final String name) {
        return new IllegalStateException(VALUES_ALREADY_SET + name);
    }

    static RuntimeException arityViolation(final String name, final Arity arity, final int count) {
        return new IllegalArgumentException(ARITY_VIOLATION + name + " " + arity + ": " + count);
    }

    static RuntimeException defaultOnRequiredArgument(final String name) {
        return new IllegalStateException(DEFAULT_ON_REQUIRED_ARGUMENT + name);
    }

    static RuntimeException optionalRequiredArgument(final String name) {
        return new IllegalArgumentException(OPTIONAL_REQUIRED_ARGUMENT + name);
    }

    static RuntimeException requiredAfterOptional(final String name) {
        return new IllegalStateException(REQUIRED_AFTER_OPTIONAL + name);
    }

    static RuntimeException missingName(final String description) {
        return new IllegalArgumentException(MISSING_NAME + description);
    }

    static RuntimeException duplicateName(final String command, final String name) {
        return new IllegalStateException(DUPLICATE_NAME + command + ": " + name);
    }

    static RuntimeException alreadyAttached(final String name) {
        return new IllegalStateException(ALREADY_ATTACHED + name);
    }

    static RuntimeException noActionDefined(final String name) {
        return new IllegalStateException(NO_ACTION_DEFINED + name);
    }
}
