package clitree.cli;

import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Parses, invokes, and maps the outcome to an {@link ExitCode}.
 */
@Slf4j
public final class Cli {
    private Cli() {
        throw new IllegalStateException("Util class");
    }

    public static void exec(final Command root, final ParserConfiguration configuration, final String[] args) {
        final var exitCode = run(root, configuration, Arrays.asList(args), System.out, System.err);
        if (exitCode != ExitCode.SUCCESS) {
            System.exit(exitCode.code());
        }
    }

    public static ExitCode run(
        final Command root,
        final ParserConfiguration configuration,
        final List<String> args,
        final PrintStream out,
        final PrintStream err) {
        final var parser = new Parser(root, configuration);
        final var result = parser.parse(args);

        if (result.isFailure()) {
            final var failure = result.getCause();
            err.println(failure.getMessage());
            err.println(failure instanceof ParseError ? ((ParseError) failure).help() : parser.help());
            return ExitCode.GENERAL_ERROR;
        }

        final var either = result.get();
        if (either.isLeft()) {
            out.print(either.getLeft());
            return flushed(out);
        }

        final var parsed = either.get();
        if (!parsed.command().isLeaf()) {
            log.debug("{} has no action, showing help", parsed.command());
            out.print(parsed.command().help());
            return flushed(out);
        }

        return parsed.invoke().fold(
            failure -> {
                err.println(failure.getMessage());
                if (failure instanceof ValueError) {
                    return ExitCode.of(((ValueError) failure).kind());
                }
                log.error("{}: {}", failure.getClass().getSimpleName(), failure.getMessage());
                return ExitCode.GENERAL_ERROR;
            },
            nothing -> flushed(out));
    }

    private static ExitCode flushed(final PrintStream out) {
        if (out.checkError()) {
            log.error("writing to standard output failed");
            return ExitCode.WRITE_FAILED;
        }
        return ExitCode.SUCCESS;
    }
}
