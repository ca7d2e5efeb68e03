package clitree.cli;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import io.vavr.control.Try;

import java.util.function.Function;
import java.util.regex.Pattern;

public final class ValueCodecs {
    private static final Pattern DIGITS = Pattern.compile("^[+-]?\\d+$");

    private static final ObjectMapper JSON = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, true);

    private static final ValueCodec<String> STRING = simple("string", String.class, raw -> raw);

    private static final ValueCodec<Integer> INTEGER = number("int", Integer.class, Integer::parseInt);

    private static final ValueCodec<Long> LONG = number("long", Long.class, Long::parseLong);

    private static final ValueCodec<Double> DOUBLE = decimal("double", Double.class, Double::parseDouble);

    private static final ValueCodec<Float> FLOAT = decimal("float", Float.class, Float::parseFloat);

    private static final ValueCodec<Boolean> BOOL = new ValueCodec<>() {
        @Override
        public String typeName() {
            return "bool";
        }

        @Override
        public Class<Boolean> type() {
            return Boolean.class;
        }

        @Override
        public Boolean decode(final String raw) throws ValueError {
            if ("true".equals(raw) || "1".equals(raw)) {
                return true;
            }
            if ("false".equals(raw) || "0".equals(raw)) {
                return false;
            }
            throw ValueError.decode(ValueError.Kind.INVALID_BOOL_VALUE, raw, "Expected one of true, false, 1 or 0, but received: " + raw);
        }

        @Override
        public String encode(final Boolean value) {
            return String.valueOf(value);
        }
    };

    private ValueCodecs() {
        throw new IllegalStateException("Util class");
    }

    public static ValueCodec<String> string() {
        return STRING;
    }

    public static ValueCodec<Integer> integer() {
        return INTEGER;
    }

    public static ValueCodec<Long> longs() {
        return LONG;
    }

    public static ValueCodec<Double> doubles() {
        return DOUBLE;
    }

    public static ValueCodec<Float> floats() {
        return FLOAT;
    }

    public static ValueCodec<Boolean> bool() {
        return BOOL;
    }

    public static <E extends Enum<E>> ValueCodec<E> enumOf(final Class<E> clazz) {
        return new ValueCodec<>() {
            @Override
            public String typeName() {
                return clazz.getSimpleName();
            }

            @Override
            public Class<E> type() {
                return clazz;
            }

            @Override
            public E decode(final String raw) throws ValueError {
                try {
                    return Enum.valueOf(clazz, raw);
                } catch (final IllegalArgumentException e) {
                    throw ValueError.decode(ValueError.Kind.INVALID_ENUM_VALUE, raw, raw + " is not a constant of " + clazz.getSimpleName(), e);
                }
            }

            @Override
            public String encode(final E value) {
                return value.name();
            }
        };
    }

    /**
     * Struct-typed values travel as JSON objects. Unknown fields are ignored, missing creator fields are rejected.
     */
    public static <T> ValueCodec<T> json(final Class<T> clazz) {
        return new ValueCodec<>() {
            @Override
            public String typeName() {
                return clazz.getSimpleName();
            }

            @Override
            public Class<T> type() {
                return clazz;
            }

            @Override
            public T decode(final String raw) throws ValueError {
                try {
                    return JSON.readValue(raw, clazz);
                } catch (final JsonParseException e) {
                    throw ValueError.decode(ValueError.Kind.INVALID_JSON_FORMAT, raw, "Malformed JSON: " + e.getOriginalMessage(), e);
                } catch (final MismatchedInputException e) {
                    if (e.getOriginalMessage() != null && e.getOriginalMessage().startsWith("Missing required creator property")) {
                        throw ValueError.decode(ValueError.Kind.MISSING_FIELD, raw, e.getOriginalMessage(), e);
                    }
                    throw ValueError.decode(ValueError.Kind.INVALID_FORMAT, raw, e.getOriginalMessage(), e);
                } catch (final JsonProcessingException e) {
                    throw ValueError.decode(ValueError.Kind.INVALID_FORMAT, raw, e.getOriginalMessage(), e);
                }
            }

            @Override
            public String encode(final T value) {
                return Try.of(() -> JSON.writeValueAsString(value))
                    .getOrElseThrow(e -> new IllegalArgumentException("Unable to encode " + clazz.getSimpleName() + " as JSON: " + e.getMessage(), e));
            }
        };
    }

    private static <T> ValueCodec<T> simple(final String typeName, final Class<T> clazz, final Function<String, T> decoder) {
        return new ValueCodec<>() {
            @Override
            public String typeName() {
                return typeName;
            }

            @Override
            public Class<T> type() {
                return clazz;
            }

            @Override
            public T decode(final String raw) {
                return decoder.apply(raw);
            }

            @Override
            public String encode(final T value) {
                return String.valueOf(value);
            }
        };
    }

    private static <T> ValueCodec<T> number(final String typeName, final Class<T> clazz, final Function<String, T> decoder) {
        return new ValueCodec<>() {
            @Override
            public String typeName() {
                return typeName;
            }

            @Override
            public Class<T> type() {
                return clazz;
            }

            @Override
            public T decode(final String raw) throws ValueError {
                try {
                    return decoder.apply(raw);
                } catch (final NumberFormatException e) {
                    if (DIGITS.matcher(raw).matches()) {
                        throw ValueError.decode(ValueError.Kind.OVERFLOW, raw, raw + " does not fit in " + typeName, e);
                    }
                    throw ValueError.decode(ValueError.Kind.INVALID_CHARACTER, raw, raw + " is not a valid " + typeName, e);
                }
            }

            @Override
            public String encode(final T value) {
                return String.valueOf(value);
            }
        };
    }

    private static <T> ValueCodec<T> decimal(final String typeName, final Class<T> clazz, final Function<String, T> decoder) {
        return new ValueCodec<>() {
            @Override
            public String typeName() {
                return typeName;
            }

            @Override
            public Class<T> type() {
                return clazz;
            }

            @Override
            public T decode(final String raw) throws ValueError {
                try {
                    return decoder.apply(raw);
                } catch (final NumberFormatException e) {
                    throw ValueError.decode(ValueError.Kind.INVALID_CHARACTER, raw, raw + " is not a valid " + typeName, e);
                }
            }

            @Override
            public String encode(final T value) {
                return String.valueOf(value);
            }
        };
    }
}
