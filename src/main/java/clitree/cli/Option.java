package clitree.cli;

import java.util.List;

/**
 * A named, value-bearing parameter, e.g. {@code --jobs 4}, {@code --jobs=4} or {@code -j4}.
 * Accepts zero or one value unless another arity is given.
 */
public final class Option<T> extends Parameter<T> {
    private String longName;

    private Character shortName;

    private Option(final ValueCodec<T> codec, final String description) {
        super(description, codec, Arity.ZERO_OR_ONE);
    }

    public static <T> Option<T> of(final ValueCodec<T> codec, final String description) {
        return new Option<>(codec, description);
    }

    public Option<T> withName(final String longName) {
        this.longName = longName;
        return this;
    }

    public Option<T> withShort(final char shortName) {
        this.shortName = shortName;
        return this;
    }

    public Option<T> withArity(final Arity arity) {
        assignArity(arity);
        return this;
    }

    public Option<T> withDefault(final T value) {
        return withDefaults(List.of(value));
    }

    public Option<T> withDefaults(final List<T> values) {
        assignDefaults(values);
        return this;
    }

    public Option<T> withValues(final List<T> values) {
        setValues(values);
        return this;
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
