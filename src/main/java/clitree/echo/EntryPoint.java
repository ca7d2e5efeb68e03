package clitree.echo;

import clitree.Const;
import clitree.cli.Argument;
import clitree.cli.Arity;
import clitree.cli.Cli;
import clitree.cli.Command;
import clitree.cli.Flag;
import clitree.cli.ParserConfiguration;
import clitree.cli.ValueCodecs;

import java.io.PrintStream;
import java.util.List;

public final class EntryPoint {
    static final ParserConfiguration CONFIGURATION = ParserConfiguration.builder()
        .allowUnknownOptions(false)
        .doubleHyphenDelimiter(true)
        .allowOptionsAfterArgs(false)
        .build();

    private EntryPoint() {
        throw new IllegalStateException("Util class");
    }

    public static void entryPoint(final String[] args) {
        Cli.exec(command(System.out), CONFIGURATION, args);
    }

    static Command command(final PrintStream out) {
        final var noNewline = Flag.of("Do not print the trailing newline").withShort('n');
        final var escapes = Flag.of("Enable interpretation of backslash escapes").withShort('e');
        final var strings = Argument.optional("strings", ValueCodecs.string(), "Strings to echo")
            .withArity(Arity.ZERO_OR_MORE);

        return new Command(Const.ECHO, "Echo the input arguments")
            .withFlag(noNewline)
            .withFlag(escapes)
            .withArgument(strings)
            .withAction(context -> {
                final List<String> values = context.rawArgument(strings.name()).orElse(List.of());
                out.print(render(values, context.flag(escapes), !context.flag(noNewline)));
                out.flush();
            });
    }

    static String render(final List<String> values, final boolean interpretEscapes, final boolean newline) {
        final var sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(' ');
            }
            if (!interpretEscapes) {
                sb.append(values.get(i));
            } else if (Escapes.interpret(values.get(i), sb)) {
                return sb.toString();
            }
        }
        if (newline) {
            sb.append('\n');
        }
        return sb.toString();
    }
}
