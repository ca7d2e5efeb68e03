package clitree.cli;

import java.util.List;
import java.util.stream.Collectors;

/**
 * All user input problems of one parse, with the help text of the command the parse ended on.
 */
public class ParseError extends Exception {
    private final List<Diagnostic> diagnostics;

    private final transient Command command;

    private final String help;

    public ParseError(final List<Diagnostic> diagnostics, final Command command, final String help) {
        super(diagnostics.stream().map(Diagnostic::message).collect(Collectors.joining("\n")));
        this.diagnostics = List.copyOf(diagnostics);
        this.command = command;
        this.help = help;
    }

    public List<Diagnostic> diagnostics() {
        return diagnostics;
    }

    public Command command() {
        return command;
    }

    public String help() {
        return help;
    }
}
