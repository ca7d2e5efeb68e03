package clitree.cli;

import io.vavr.control.Either;
import io.vavr.control.Try;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Walks a token sequence against a command tree.
 * <p>
 * {@link #parse(List)} yields a {@code Left} holding help text when help was requested, a {@code Right} holding the
 * resolved {@link ParseResult}, or a failed {@code Try} with a {@link ParseError} listing every user input problem found.
 * The parser does not stop at the first problem; it scans all tokens and decides at the end.
 */
@Slf4j
public final class Parser {
    private static final String DOUBLE_HYPHEN = "--";

    private final Command root;

    private final ParserConfiguration configuration;

    public Parser(final Command root) {
        this(root, ParserConfiguration.defaults());
    }

    public Parser(final Command root, final ParserConfiguration configuration) {
        this.root = root;
        this.configuration = configuration;
    }

    public Try<Either<String, ParseResult>> parse(final String... args) {
        return parse(Arrays.asList(args));
    }

    public Try<Either<String, ParseResult>> parse(final List<String> args) {
        return Try.of(() -> resolve(args));
    }

    public String help() {
        return root.help();
    }

    private Either<String, ParseResult> resolve(final List<String> args) throws ParseError {
        final var scan = new Scan(root, args);
        while (scan.hasNext()) {
            classify(scan, scan.next());
        }
        return finish(scan);
    }

    private void classify(final Scan scan, final String token) {
        if (scan.positionalOnly) {
            positional(scan, token);
            return;
        }

        if (configuration.doubleHyphenDelimiter() && DOUBLE_HYPHEN.equals(token)) {
            log.debug("'--' seen, remaining tokens are positional");
            scan.positionalOnly = true;
            return;
        }

        if (looksLikeOption(token)) {
            if (!configuration.allowOptionsAfterArgs() && scan.positionalSeen) {
                log.debug("{} follows a positional value and is treated as one", token);
                positional(scan, token);
            } else if (token.startsWith(DOUBLE_HYPHEN) && token.length() > 2) {
                longOption(scan, token);
            } else {
                shortOption(scan, token);
            }
            return;
        }

        final var subcommand = scan.command.findSubcommand(token);
        if (subcommand.isPresent()) {
            scan.descend(subcommand.get());
            return;
        }

        positional(scan, token);
    }

    private void longOption(final Scan scan, final String token) {
        final var body = token.substring(2);
        final int eq = body.indexOf('=');
        final var name = eq < 0 ? body : body.substring(0, eq);
        final var seed = eq < 0 ? null : body.substring(eq + 1);

        if (Flag.HELP.equals(name)) {
            scan.help = true;
            return;
        }

        final var flag = scan.command.findFlag(name);
        if (flag.isPresent()) {
            setFlag(scan, flag.get());
            return;
        }

        final var option = scan.command.findOption(name);
        if (option.isPresent()) {
            gather(scan, option.get(), seed, true);
            return;
        }

        unknown(scan, name, token);
    }

    private void shortOption(final Scan scan, final String token) {
        final var body = token.substring(1);
        final int eq = body.indexOf('=');

        if (eq >= 0) {
            final var name = body.substring(0, eq);
            if (name.length() == 1) {
                final var option = scan.command.findOptionByShort(name.charAt(0));
                if (option.isPresent()) {
                    gather(scan, option.get(), body.substring(eq + 1), false);
                    return;
                }
            }
            unknown(scan, name, token);
            return;
        }

        if (body.length() == 1) {
            final char c = body.charAt(0);
            final var flag = scan.command.findFlagByShort(c);
            if (flag.isPresent()) {
                setFlag(scan, flag.get());
                return;
            }
            final var option = scan.command.findOptionByShort(c);
            if (option.isPresent()) {
                gather(scan, option.get(), null, true);
                return;
            }
            if (!configuration.allowOptionsAfterArgs()) {
                positional(scan, token);
                return;
            }
            unknown(scan, body, token);
            return;
        }

        // -abc is -a -b -c; a known short option takes the rest of the cluster as its value
        for (int i = 0; i < body.length(); i++) {
            final char c = body.charAt(i);
            final var flag = scan.command.findFlagByShort(c);
            if (flag.isPresent()) {
                setFlag(scan, flag.get());
                continue;
            }
            final var option = scan.command.findOptionByShort(c);
            if (option.isPresent()) {
                final var rest = body.substring(i + 1);
                gather(scan, option.get(), rest.isEmpty() ? null : rest, rest.isEmpty());
                return;
            }
            scan.fail(Diagnostic.unknownOption(String.valueOf(c), token));
            return;
        }
    }

    private void setFlag(final Scan scan, final Flag flag) {
        log.debug("flag {} set on {}", flag, scan.command.name());
        scan.context.putFlag(flag.key(), flag.presentValue());
        if (flag.isHelp()) {
            scan.help = true;
        }
    }

    private void unknown(final Scan scan, final String name, final String token) {
        if (configuration.allowUnknownOptions()) {
            log.warn("ignoring unknown option {}", token);
            return;
        }
        scan.fail(Diagnostic.unknownOption(name, token));
    }

    /**
     * Pulls values for an option until its arity max is reached, the next token looks like an option,
     * or the tokens run out.
     */
    private void gather(final Scan scan, final Option<?> option, final String seed, final boolean pull) {
        final var arity = option.arity();
        final List<String> gathered = new ArrayList<>();
        if (seed != null) {
            gathered.add(seed);
        }
        while (pull && gathered.size() < arity.max() && scan.hasNext() && !looksLikeOption(scan.peek())) {
            gathered.add(scan.next());
        }

        if (gathered.size() < arity.min()) {
            scan.fail(Diagnostic.insufficientValues(option.key(), arity.min(), gathered.size()));
        } else if (gathered.size() > arity.max()) {
            scan.fail(Diagnostic.tooManyValues(option.key(), seed, arity.max(), gathered.size()));
        } else if (gathered.isEmpty()) {
            log.debug("option {} given without values", option);
        } else {
            log.debug("option {} = {}", option, gathered);
            scan.context.putOption(option.key(), gathered);
        }
    }

    private void positional(final Scan scan, final String token) {
        scan.positionalSeen = true;
        final var arguments = scan.command.arguments();
        if (scan.cursor >= arguments.size()) {
            scan.fail(Diagnostic.unexpectedPositional(scan.command.name(), token));
            return;
        }

        final var argument = arguments.get(scan.cursor);
        final int count = scan.context.argumentCount(argument.name());
        final int max = argument.arity().max();
        if (count >= max) {
            scan.fail(Diagnostic.tooManyValues(argument.name(), token, max, count + 1));
            return;
        }

        log.debug("argument {} += {}", argument, token);
        scan.context.appendArgument(argument.name(), token);
        if (count + 1 >= max) {
            scan.cursor++;
        }
    }

    private Either<String, ParseResult> finish(final Scan scan) throws ParseError {
        final var terminal = scan.command;
        if (scan.help) {
            log.debug("help requested for {}", terminal);
            return Either.left(terminal.help());
        }

        for (final var argument : terminal.arguments()) {
            final int count = scan.context.argumentCount(argument.name());
            if (!argument.isSatisfied(count)) {
                scan.fail(argument.required()
                    ? Diagnostic.requiredArgumentMissing(argument.name())
                    : Diagnostic.insufficientValues(argument.name(), argument.arity().min(), count));
            }
        }

        if (!scan.diagnostics.isEmpty()) {
            log.debug("{} problem(s) found while parsing {}", scan.diagnostics.size(), terminal);
            throw new ParseError(scan.diagnostics, terminal, terminal.help());
        }

        final List<ActionContext> chain = new ArrayList<>();
        for (var context = scan.context; context != null; context = context.parent().orElse(null)) {
            chain.add(0, context);
        }
        // root first, so a value given deeper in the chain is the one a declaration keeps
        chain.forEach(Parser::assignRawValues);
        chain.forEach(Parser::fillDefaults);

        return Either.right(new ParseResult(terminal, scan.context));
    }

    /**
     * Hands the values given on the command line to their declarations. Defaults are not assigned.
     */
    private static void assignRawValues(final ActionContext context) {
        final var command = context.command();
        context.localOptions().forEach((key, raw) -> command.findOptionByKey(key).ifPresent(e -> e.setRawValues(raw)));
        // arguments of an ancestor are not validated and may hold fewer values than their arity asks for
        context.localArguments().forEach((name, raw) -> command.findArgument(name)
            .filter(e -> e.isSatisfied(raw.size()))
            .ifPresent(e -> e.setRawValues(raw)));
        context.localFlags().forEach((key, value) -> command.findFlagByKey(key).ifPresent(e -> e.setRawValues(List.of(String.valueOf(value)))));
    }

    /**
     * Defaults go into the context of the command that declares them, each context independently.
     */
    private static void fillDefaults(final ActionContext context) {
        final var command = context.command();
        for (final var option : command.options()) {
            if (!context.hasLocalOption(option.key()) && option.hasDefault() && !option.defaults().isEmpty()) {
                log.debug("option {} defaults to {}", option, option.encodedDefaults());
                context.putOption(option.key(), option.encodedDefaults());
            }
        }
        for (final var argument : command.arguments()) {
            if (context.argumentCount(argument.name()) == 0 && argument.hasDefault() && !argument.defaults().isEmpty()) {
                context.putArgument(argument.name(), argument.encodedDefaults());
            }
        }
        for (final var flag : command.flags()) {
            if (!context.hasLocalFlag(flag.key())) {
                context.putFlag(flag.key(), flag.defaultValue());
            }
        }
    }

    private static boolean looksLikeOption(final String token) {
        return token.length() > 1 && token.charAt(0) == '-';
    }

    /**
     * State of one parse run.
     */
    private static final class Scan {
        private final List<String> tokens;

        private final List<Diagnostic> diagnostics = new ArrayList<>();

        private int index;

        private Command command;

        private ActionContext context;

        private int cursor;

        private boolean positionalOnly;

        private boolean positionalSeen;

        private boolean help;

        Scan(final Command root, final List<String> tokens) {
            this.tokens = tokens;
            command = root;
            context = new ActionContext(root, null);
            forget(root);
        }

        boolean hasNext() {
            return index < tokens.size();
        }

        String next() {
            return tokens.get(index++);
        }

        String peek() {
            return tokens.get(index);
        }

        void descend(final Command subcommand) {
            log.debug("descending into {}", subcommand);
            command = subcommand;
            context = new ActionContext(subcommand, context);
            cursor = 0;
            positionalSeen = false;
            forget(subcommand);
        }

        /**
         * Drops what an earlier parse left on the declarations of a command about to be resolved.
         */
        private static void forget(final Command command) {
            command.options().forEach(Parameter::clearRawValues);
            command.arguments().forEach(Parameter::clearRawValues);
            command.flags().forEach(Parameter::clearRawValues);
        }

        void fail(final Diagnostic diagnostic) {
            log.debug("{}", diagnostic);
            diagnostics.add(diagnostic);
        }
    }
}
