package clitree.demo;

import clitree.Const;
import clitree.cli.Argument;
import clitree.cli.Arity;
import clitree.cli.Cli;
import clitree.cli.Command;
import clitree.cli.Flag;
import clitree.cli.Option;
import clitree.cli.ParserConfiguration;
import clitree.cli.ValueCodecs;

import java.io.PrintStream;

/**
 * A two level command tree: {@code demo [--int N] [--verbose] sub [--worker JSON] <input> [worker_arg...]}.
 */
public final class EntryPoint {
    static final int DEFAULT_INT = 42;

    private EntryPoint() {
        throw new IllegalStateException("Util class");
    }

    public static void entryPoint(final String[] args) {
        Cli.exec(command(System.out), ParserConfiguration.defaults(), args);
    }

    static Command command(final PrintStream out) {
        final var number = Option.of(ValueCodecs.integer(), "An integer option")
            .withName("int")
            .withShort('i')
            .withDefault(DEFAULT_INT);
        final var verbose = Flag.of("Enable verbose output").withName("verbose").withShort('v');

        final var worker = Option.of(ValueCodecs.json(Worker.class), "A worker as a JSON object")
            .withName("worker")
            .withShort('w');
        final var input = Argument.required("input", ValueCodecs.string(), "The input to process");
        final var workers = Argument.optional("worker_arg", ValueCodecs.json(Worker.class), "Workers as JSON objects")
            .withArity(Arity.of(1, 2));

        final var sub = new Command("sub", "A subcommand")
            .withOption(worker)
            .withArgument(input)
            .withArgument(workers)
            .withAction(context -> {
                out.println("int: " + context.value(number));
                out.println("verbose: " + context.flag(verbose));
                out.println("input: " + context.value(input));
                if (context.rawOption(worker.key()).isPresent()) {
                    final var w = context.value(worker);
                    out.println("worker: " + w.getName() + " (" + w.getId() + ")");
                }
                if (context.rawArgument(workers.name()).isPresent()) {
                    for (final var w : context.values(workers)) {
                        out.println("worker_arg: " + w.getName() + " (" + w.getId() + ")");
                    }
                }
            });

        return new Command(Const.DEMO, "A demo command")
            .withOption(number)
            .withFlag(verbose)
            .withSubcommand(sub);
    }
}
