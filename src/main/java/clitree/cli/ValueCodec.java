package clitree.cli;

/**
 * Converts between a declared parameter type and the raw string form the parser stores.
 */
public interface ValueCodec<T> {
    String typeName();

    Class<T> type();

    T decode(String raw) throws ValueError;

    String encode(T value);
}
