package clitree.cli;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A declared option, argument or flag bound to one value type.
 * <p>
 * The parser never touches {@code T}: it only reads the arity and key, stores raw strings,
 * and leaves decoding to {@link #decode(String)} at access time.
 */
@Getter
@Accessors(fluent = true)
public abstract class Parameter<T> {
    private final String description;

    private final ValueCodec<T> codec;

    private Arity arity;

    private List<T> defaults;

    private List<T> values;

    private List<String> rawValues;

    protected Parameter(final String description, final ValueCodec<T> codec, final Arity arity) {
        this.description = description;
        this.codec = codec;
        this.arity = arity;
    }

    /**
     * Name under which resolved values are stored in an {@link ActionContext}.
     */
    public abstract String key();

    public String typeName() {
        return codec.typeName();
    }

    public boolean hasDefault() {
        return defaults != null;
    }

    /**
     * Whether values were given, programmatically or by the last parse.
     */
    public boolean hasValue() {
        return values != null || rawValues != null;
    }

    public boolean isSatisfied(final int count) {
        return arity.isSatisfiedBy(count);
    }

    public List<T> defaults() {
        return defaults == null ? null : Collections.unmodifiableList(defaults);
    }

    public List<T> values() {
        return values == null ? null : Collections.unmodifiableList(values);
    }

    /**
     * Raw strings the last parse resolved for this declaration, {@code null} when it was not given.
     */
    public List<String> rawValues() {
        return rawValues == null ? null : Collections.unmodifiableList(rawValues);
    }

    void setRawValues(final List<String> rawValues) {
        checkArity(rawValues.size());
        this.rawValues = new ArrayList<>(rawValues);
    }

    void clearRawValues() {
        rawValues = null;
    }

    public void setValues(final List<T> values) {
        if (this.values != null) {
            throw ErrorFactory.valuesAlreadySet(key());
        }
        checkArity(values.size());
        this.values = new ArrayList<>(values);
    }

    /**
     * Programmatic values when present, else parsed values decoded on the spot, else defaults.
     */
    public List<T> effectiveValues() throws ValueError {
        if (values != null) {
            return values();
        }
        if (rawValues != null) {
            final List<T> decoded = new ArrayList<>(rawValues.size());
            for (final var raw : rawValues) {
                decoded.add(decode(raw));
            }
            return Collections.unmodifiableList(decoded);
        }
        if (defaults != null) {
            return defaults();
        }
        throw missingValue();
    }

    public T decode(final String raw) throws ValueError {
        try {
            return codec.decode(raw);
        } catch (final ValueError e) {
            throw e.forParameter(key());
        }
    }

    public List<String> encodedDefaults() {
        if (defaults == null) {
            return List.of();
        }
        return defaults.stream().map(codec::encode).collect(Collectors.toList());
    }

    protected ValueError missingValue() {
        return ValueError.noValueSet(key());
    }

    protected void assignDefaults(final List<T> defaults) {
        if (this.defaults != null) {
            throw ErrorFactory.defaultsAlreadySet(key());
        }
        checkArity(defaults.size());
        this.defaults = new ArrayList<>(defaults);
    }

    protected void assignArity(final Arity arity) {
        if (defaults != null && !arity.isSatisfiedBy(defaults.size())) {
            throw ErrorFactory.arityViolation(key(), arity, defaults.size());
        }
        this.arity = arity;
    }

    private void checkArity(final int count) {
        if (!arity.isSatisfiedBy(count)) {
            throw ErrorFactory.arityViolation(key(), arity, count);
        }
    }

    static String keyOf(final String longName, final Character shortName) {
        if (longName != null) {
            return longName;
        }
        return shortName == null ? null : String.valueOf(shortName);
    }
}
