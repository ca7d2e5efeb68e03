package clitree.cli;

import java.util.List;

/**
 * A positional parameter. Its position is its registration order on a {@link Command}.
 */
public final class Argument<T> extends Parameter<T> {
    private final String name;

    private final boolean required;

    private Argument(final String name, final ValueCodec<T> codec, final String description, final boolean required) {
        super(description, codec, required ? Arity.EXACTLY_ONE : Arity.ZERO_OR_ONE);
        this.name = name;
        this.required = required;
    }

    public static <T> Argument<T> required(final String name, final ValueCodec<T> codec, final String description) {
        return new Argument<>(name, codec, description, true);
    }

    public static <T> Argument<T> optional(final String name, final ValueCodec<T> codec, final String description) {
        return new Argument<>(name, codec, description, false);
    }

    public Argument<T> withArity(final Arity arity) {
        if (required && arity.min() == 0) {
            throw ErrorFactory.optionalRequiredArgument(name);
        }
        assignArity(arity);
        return this;
    }

    public Argument<T> withDefault(final T value) {
        return withDefaults(List.of(value));
    }

    public Argument<T> withDefaults(final List<T> values) {
        if (required) {
            throw ErrorFactory.defaultOnRequiredArgument(name);
        }
        assignDefaults(values);
        return this;
    }

    public Argument<T> withValues(final List<T> values) {
        setValues(values);
        return this;
    }

    public String name() {
        return name;
    }

    public boolean required() {
        return required;
    }

    @Override
    public String key() {
        return name;
    }

    @Override
    protected ValueError missingValue() {
        return required ? ValueError.requiredArgumentMissing(name) : super.missingValue();
    }

    @Override
    public String toString() {
        return name;
    }
}
