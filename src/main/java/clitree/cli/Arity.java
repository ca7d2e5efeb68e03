package clitree.cli;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Inclusive {@code [min, max]} range of how many values a parameter accepts.
 */
@Getter
@Accessors(fluent = true)
@EqualsAndHashCode
public final class Arity {
    public static final int UNBOUNDED = Integer.MAX_VALUE;

    public static final Arity ZERO = new Arity(0, 0);
    public static final Arity ZERO_OR_ONE = new Arity(0, 1);
    public static final Arity ZERO_OR_MORE = new Arity(0, UNBOUNDED);
    public static final Arity EXACTLY_ONE = new Arity(1, 1);
    public static final Arity ONE_OR_MORE = new Arity(1, UNBOUNDED);
    public static final Arity MANY = new Arity(UNBOUNDED, UNBOUNDED);

    private final int min;

    private final int max;

    public Arity(final int min, final int max) {
        if (min < 0 || max < 0 || min > max) {
            throw ErrorFactory.invalidArity(min, max);
        }
        this.min = min;
        this.max = max;
    }

    public static Arity of(final int min, final int max) {
        return new Arity(min, max);
    }

    public static Arity exactly(final int count) {
        return new Arity(count, count);
    }

    public boolean isSatisfiedBy(final int count) {
        return min <= count && count <= max;
    }

    public boolean isUnbounded() {
        return max == UNBOUNDED;
    }

    @Override
    public String toString() {
        return "{" + min + "," + (isUnbounded() ? "*" : String.valueOf(max)) + "}";
    }
}
