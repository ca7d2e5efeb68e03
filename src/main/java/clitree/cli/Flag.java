package clitree.cli;

import java.util.List;

/**
 * A boolean switch that takes no value token. Giving it on the command line yields the negation of its default.
 */
public final class Flag extends Parameter<Boolean> {
    public static final String HELP = "help";

    private final boolean defaultValue;

    private String longName;

    private Character shortName;

    private Flag(final String description, final boolean defaultValue) {
        super(description, ValueCodecs.bool(), Arity.ZERO_OR_ONE);
        this.defaultValue = defaultValue;
        assignDefaults(List.of(defaultValue));
    }

    public static Flag of(final String description) {
        return new Flag(description, false);
    }

    public static Flag of(final String description, final boolean defaultValue) {
        return new Flag(description, defaultValue);
    }

    static Flag help() {
        return of("Print this message and exit").withName(HELP).withShort('h');
    }

    public Flag withName(final String longName) {
        this.longName = longName;
        return this;
    }

    public Flag withShort(final char shortName) {
        this.shortName = shortName;
        return this;
    }

    public boolean defaultValue() {
        return defaultValue;
    }

    /**
     * Value when given on the command line.
     */
    public boolean presentValue() {
        return !defaultValue;
    }

    public void set() {
        setValues(List.of(presentValue()));
    }

    public boolean isSet() {
        return hasValue();
    }

    public boolean value() {
        if (values() != null) {
            return values().get(0);
        }
        return rawValues() != null ? Boolean.parseBoolean(rawValues().get(0)) : defaultValue;
    }

    public boolean isHelp() {
        return HELP.equals(longName);
    }

    public String longName() {
        return longName;
    }

    public Character shortName() {
        return shortName;
    }

    @Override
    public String key() {
        return keyOf(longName, shortName);
    }

    @Override
    public String toString() {
        return longName != null ? "--" + longName : "-" + shortName;
    }
}
