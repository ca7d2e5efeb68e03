package clitree.cli;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

@Builder
@Getter
@Accessors(fluent = true)
@ToString
public final class ParserConfiguration {
    private static final ParserConfiguration DEFAULTS = builder().build();

    @Builder.Default
    private final boolean allowUnknownOptions = false;

    @Builder.Default
    private final boolean doubleHyphenDelimiter = true;

    @Builder.Default
    private final boolean allowOptionsAfterArgs = true;

    public static ParserConfiguration defaults() {
        return DEFAULTS;
    }
}
