package clitree.cli;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.experimental.Accessors;

import java.io.PrintStream;
import java.util.List;
import java.util.stream.Collectors;

@AllArgsConstructor
@Data
@Accessors(fluent = true)
public class Help {
    private static final int PADDING = 30;

    private static final String HELP_LINE = "  -h, --help";

    private final Command command;

    public static Help of(final Command command) {
        return new Help(command);
    }

    private String usage() {
        final var sb = new StringBuilder("USAGE:\n    " + command.name());
        if (!command.options().isEmpty() || !command.flags().isEmpty()) {
            sb.append(" [OPTIONS]");
        }
        if (!command.subcommands().isEmpty()) {
            sb.append(" <COMMAND>");
        }
        for (final var argument : command.arguments()) {
            sb.append(argument.required() ? " <" + argument.name() + ">" : " [" + argument.name() + "]");
        }
        return sb.append("\n\n").toString();
    }

    private String arguments() {
        if (command.arguments().isEmpty()) {
            return "";
        }
        return "ARGUMENTS:\n"
            + command.arguments().stream()
            .map(argument -> line("  " + argument.name(), argument.description() + " (" + (argument.required() ? "required" : "optional") + ")"))
            .collect(Collectors.joining())
            + "\n";
    }

    private String options() {
        if (command.options().isEmpty()) {
            return "";
        }
        return "OPTIONS:\n"
            + command.options().stream()
            .map(option -> line(
                "  " + names(option.longName(), option.shortName()) + "[=VALUE]",
                option.description() + (option.hasDefault() ? " (default: " + String.join(", ", option.encodedDefaults()) + ")" : "")))
            .collect(Collectors.joining())
            + "\n";
    }

    private String flags() {
        final List<Flag> visible = command.flags().stream().filter(e -> !e.isHelp()).collect(Collectors.toList());
        return "FLAGS:\n"
            + visible.stream().map(flag -> line("  " + names(flag.longName(), flag.shortName()), flag.description())).collect(Collectors.joining())
            + line(HELP_LINE, "Print this message and exit");
    }

    private String commands() {
        if (command.subcommands().isEmpty()) {
            return "";
        }
        return "\nCOMMANDS:\n"
            + command.subcommands().stream()
            .map(sub -> "  " + sub.name() + "\n          " + sub.description() + "\n")
            .collect(Collectors.joining());
    }

    private static String names(final String longName, final Character shortName) {
        if (longName == null) {
            return "-" + shortName;
        }
        return shortName == null ? "    --" + longName : "-" + shortName + ", --" + longName;
    }

    private static String line(final String left, final String right) {
        if (left.length() <= PADDING) {
            return String.format("%-" + PADDING + "s%s\n", left, right);
        }
        return left + "\n" + " ".repeat(PADDING) + right + "\n";
    }

    public String text() {
        return command.name() + " - " + command.description() + "\n\n"
            + usage()
            + arguments()
            + options()
            + flags()
            + commands();
    }

    public void print(final PrintStream out) {
        out.print(text());
    }
}
