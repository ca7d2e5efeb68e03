package clitree.cli;

import io.vavr.control.Try;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * The command a parse ended on and its context. The context chain is released as a unit with this result.
 */
@AllArgsConstructor
@Getter
@Accessors(fluent = true)
@ToString
public final class ParseResult {
    private final Command command;

    private final ActionContext context;

    public Try<Void> invoke() {
        return Try.run(() -> command.execute(context));
    }
}
