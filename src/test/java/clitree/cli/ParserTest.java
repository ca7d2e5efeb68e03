package clitree.cli;

import io.vavr.control.Either;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest {
    private static final ParserConfiguration STRICT_ORDER = ParserConfiguration.builder().allowOptionsAfterArgs(false).build();

    private static final ParserConfiguration LENIENT = ParserConfiguration.builder().allowUnknownOptions(true).build();

    private static final ParserConfiguration NO_DELIMITER = ParserConfiguration.builder().doubleHyphenDelimiter(false).build();

    static Command tree() {
        final var build = new Command("build", "Build a target")
            .withOption(Option.of(ValueCodecs.integer(), "Parallel jobs").withName("jobs").withShort('j'))
            .withArgument(Argument.required("target", ValueCodecs.string(), "What to build"))
            .withArgument(Argument.optional("extras", ValueCodecs.string(), "Extra targets").withArity(Arity.of(0, 2)))
            .withAction(context -> { });

        return new Command("tool", "A tool")
            .withOption(Option.of(ValueCodecs.integer(), "Log level").withName("level").withShort('l').withDefault(1))
            .withOption(Option.of(ValueCodecs.string(), "A name").withName("name").withShort('n'))
            .withOption(Option.of(ValueCodecs.string(), "A pair").withName("pair").withShort('p').withArity(Arity.exactly(2)))
            .withOption(Option.of(ValueCodecs.string(), "A marker").withName("marker").withArity(Arity.ZERO))
            .withFlag(Flag.of("Verbose output").withName("verbose").withShort('v'))
            .withFlag(Flag.of("Quiet output").withShort('q'))
            .withSubcommand(build);
    }

    private static ParseResult resolve(final ParserConfiguration configuration, final String in) {
        final var result = new Parser(tree(), configuration).parse(in.split(" "));

        assertThat(result.isSuccess()).as(() -> String.valueOf(result.getCause())).isTrue();
        assertThat(result.get()).isInstanceOf(Either.Right.class);
        return result.get().get();
    }

    private static ParseResult resolve(final String in) {
        return resolve(ParserConfiguration.defaults(), in);
    }

    @ParameterizedTest
    @MethodSource("failureProvider")
    void parserParseReturnsFailure(final ParserConfiguration configuration, final String in, final String cause) {
        final var result = new Parser(tree(), configuration).parse(in.split(" "));

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getCause()).isInstanceOf(ParseError.class);
        assertThat(result.getCause().getMessage()).isEqualTo(cause);
    }

    static Stream<Arguments> failureProvider() {
        final var defaults = ParserConfiguration.defaults();
        return Stream.of(
            Arguments.of(defaults, "--bogus build app", "--bogus is not a valid flag or option!"),
            Arguments.of(defaults, "build", "The required argument target is missing!"),
            Arguments.of(defaults, "--pair a --verbose build x", "pair requires at least 2 value(s), but received 1!"),
            Arguments.of(defaults, "-p=a build x", "pair requires at least 2 value(s), but received 1!"),
            Arguments.of(defaults, "--marker=x build app", "marker accepts at most 0 value(s), but received 1 (x)!"),
            Arguments.of(defaults, "build app b c d", "d is not a valid argument for build!"),
            Arguments.of(defaults, "stray", "stray is not a valid argument for tool!"),
            Arguments.of(defaults, "--name build app", "app is not a valid argument for tool!"),
            Arguments.of(defaults, "--level -3 build app", "-3 is not a valid flag or option!"),
            Arguments.of(defaults, "-vx build app", "-vx is not a valid flag or option!"),
            Arguments.of(LENIENT, "-vx build app", "-vx is not a valid flag or option!"),
            Arguments.of(NO_DELIMITER, "build -- app", "-- is not a valid flag or option!"),
            Arguments.of(defaults, "--bogus build", "--bogus is not a valid flag or option!\nThe required argument target is missing!"));
    }

    @Test
    void parseErrorCarriesDiagnosticsAndTerminalHelp() {
        final var result = new Parser(tree()).parse("--bogus", "build");
        final var error = (ParseError) result.getCause();

        assertThat(error.diagnostics()).extracting(Diagnostic::kind)
            .containsExactly(Diagnostic.Kind.UNKNOWN_OPTION, Diagnostic.Kind.REQUIRED_ARGUMENT_MISSING);
        assertThat(error.diagnostics().get(0).parameter()).isEqualTo("bogus");
        assertThat(error.command().name()).isEqualTo("build");
        assertThat(error.help()).isEqualTo(error.command().help());
    }

    @ParameterizedTest
    @MethodSource("helpProvider")
    void helpRequestYieldsTerminalHelp(final String in, final String command) {
        final var root = tree();
        final var result = new Parser(root).parse(in.split(" "));
        final var expected = root.findSubcommand(command).map(Command::help).orElse(root.help());

        assertThat(result.isSuccess()).isTrue();
        result.get().mapLeft(e -> {
            assertThat(e).isEqualTo(expected);
            return 0;
        });
        assertThat(result.get().isLeft()).isTrue();
    }

    static Stream<Arguments> helpProvider() {
        return Stream.of(
            Arguments.of("--help", "tool"),
            Arguments.of("-h", "tool"),
            Arguments.of("build --help", "build"),
            Arguments.of("build -h", "build"),
            Arguments.of("build --bogus -h", "build"),
            Arguments.of("-vh build", "build"));
    }

    @Test
    void resolvesSubcommandWithArgumentsAndDefaults() {
        final var parsed = resolve("build app");
        final var context = parsed.context();

        assertThat(parsed.command().name()).isEqualTo("build");
        assertThat(context.rawArgument("target")).contains(List.of("app"));
        assertThat(context.rawArgument("extras")).isEmpty();
        assertThat(context.rawOption("level")).contains(List.of("1"));
        assertThat(context.rawOption("jobs")).isEmpty();
        assertThat(context.getFlag("verbose")).isFalse();
        assertThat(context.parent()).hasValueSatisfying(e -> assertThat(e.command().name()).isEqualTo("tool"));
    }

    @Test
    void optionValueForms() {
        assertThat(resolve("--level=3 build app").context().rawOption("level")).contains(List.of("3"));
        assertThat(resolve("--level 3 build app").context().rawOption("level")).contains(List.of("3"));
        assertThat(resolve("-l 3 build app").context().rawOption("level")).contains(List.of("3"));
        assertThat(resolve("--level=-3 build app").context().rawOption("level")).contains(List.of("-3"));
        assertThat(resolve("build -j4 app").context().rawOption("jobs")).contains(List.of("4"));
        assertThat(resolve("build -j=4 app").context().rawOption("jobs")).contains(List.of("4"));
        assertThat(resolve("build -vj 4 app").context().rawOption("jobs")).contains(List.of("4"));
        assertThat(resolve("--pair a b build x").context().rawOption("pair")).contains(List.of("a", "b"));
    }

    @Test
    void optionWithoutValueRecordsNothing() {
        final var parsed = resolve("build app --name");

        assertThat(parsed.context().rawOption("name")).isEmpty();
    }

    @Test
    void repeatedOptionKeepsLastOccurrence() {
        assertThat(resolve("--name a --name b build x").context().rawOption("name")).contains(List.of("b"));
    }

    @Test
    void ancestorOptionGivenInSubcommandIsStoredThere() {
        final var context = resolve("build --level 5 app").context();

        assertThat(context.rawOption("level")).contains(List.of("5"));
        assertThat(context.parent().flatMap(e -> e.rawOption("level"))).contains(List.of("1"));
    }

    @Test
    void flagsAndClusters() {
        final var context = resolve("-vq build app").context();
        assertThat(context.getFlag("verbose")).isTrue();
        assertThat(context.getFlag("q")).isTrue();

        assertThat(resolve("build -v app").context().getFlag("verbose")).isTrue();
        assertThat(resolve("--verbose=false build app").context().getFlag("verbose")).isTrue();
    }

    @Test
    void positionalsFillArgumentsInOrder() {
        final var context = resolve("build app b c").context();

        assertThat(context.rawArgument("target")).contains(List.of("app"));
        assertThat(context.rawArgument("extras")).contains(List.of("b", "c"));
    }

    @Test
    void doubleHyphenEndsOptionParsing() {
        final var context = resolve("build -- -v").context();

        assertThat(context.rawArgument("target")).contains(List.of("-v"));
        assertThat(context.getFlag("verbose")).isFalse();
    }

    @Test
    void loneHyphenIsAValue() {
        assertThat(resolve("build -").context().rawArgument("target")).contains(List.of("-"));
    }

    @Test
    void optionsAfterArgumentsDependOnConfiguration() {
        assertThat(resolve("build app -v").context().getFlag("verbose")).isTrue();

        final var context = resolve(STRICT_ORDER, "build app -v").context();
        assertThat(context.getFlag("verbose")).isFalse();
        assertThat(context.rawArgument("extras")).contains(List.of("-v"));
    }

    @Test
    void unknownSingleShortBecomesPositionalWhenOptionsMustPrecedeArguments() {
        assertThat(resolve(STRICT_ORDER, "build -x").context().rawArgument("target")).contains(List.of("-x"));
    }

    @Test
    void unknownOptionsCanBeIgnored() {
        final var parsed = resolve(LENIENT, "--bogus build -x app");

        assertThat(parsed.command().name()).isEqualTo("build");
        assertThat(parsed.context().rawArgument("target")).contains(List.of("app"));
    }

    @Test
    void commandWithoutActionIsReturnedForHelp() {
        final var parsed = new Parser(tree()).parse().get().get();

        assertThat(parsed.command().name()).isEqualTo("tool");
        assertThat(parsed.command().isLeaf()).isFalse();
        assertThat(parsed.invoke().isFailure()).isTrue();
    }

    @Test
    void parsedValuesReachDeclarations() throws ValueError {
        final var count = Option.of(ValueCodecs.integer(), "").withName("count").withDefault(1);
        final var file = Argument.required("file", ValueCodecs.string(), "");
        final var verbose = Flag.of("").withName("verbose");
        final var quiet = Flag.of("").withName("quiet");
        final var root = new Command("tool", "")
            .withOption(count)
            .withArgument(file)
            .withFlag(verbose)
            .withFlag(quiet)
            .withAction(context -> { });

        assertThat(new Parser(root).parse("--count", "5", "--verbose", "a.txt").isSuccess()).isTrue();

        assertThat(count.hasValue()).isTrue();
        assertThat(count.rawValues()).containsExactly("5");
        assertThat(count.effectiveValues()).containsExactly(5);
        assertThat(count.defaults()).containsExactly(1);
        assertThat(file.effectiveValues()).containsExactly("a.txt");
        assertThat(verbose.isSet()).isTrue();
        assertThat(verbose.value()).isTrue();
        assertThat(quiet.isSet()).isFalse();
    }

    @Test
    void defaultsAreNotAssignedAsParsedValues() throws ValueError {
        final var count = Option.of(ValueCodecs.integer(), "").withName("count").withDefault(1);
        final var root = new Command("tool", "").withOption(count).withAction(context -> { });

        new Parser(root).parse("--count", "5");
        new Parser(root).parse();

        assertThat(count.hasValue()).isFalse();
        assertThat(count.rawValues()).isNull();
        assertThat(count.effectiveValues()).containsExactly(1);
    }

    @Test
    void ancestorOptionKeepsValueGivenDeepest() throws ValueError {
        final var root = tree();
        new Parser(root).parse("--level", "2", "build", "--level", "3", "app");

        final var level = root.findOption("level").orElseThrow();
        assertThat(level.rawValues()).containsExactly("3");
        assertThat(level.effectiveValues()).isEqualTo(List.of(3));
    }

    @Test
    void parsedValuesDecodeOnlyWhenRead() {
        final var count = Option.of(ValueCodecs.integer(), "").withName("count");
        final var root = new Command("tool", "").withOption(count).withAction(context -> { });

        assertThat(new Parser(root).parse("--count", "five").isSuccess()).isTrue();
        assertThat(count.hasValue()).isTrue();
        assertThatThrownBy(count::effectiveValues)
            .isInstanceOf(ValueError.class)
            .extracting(e -> ((ValueError) e).kind())
            .isEqualTo(ValueError.Kind.INVALID_CHARACTER);
    }

    @Test
    void failedParseLeavesDeclarationsWithoutValues() {
        final var root = tree();
        new Parser(root).parse("--name", "x", "build");

        assertThat(root.findOption("name")).hasValueSatisfying(e -> assertThat(e.hasValue()).isFalse());
    }

    @Test
    void greedyGatherStopsAtMaxAndLeavesNextOption() throws ValueError {
        final var nums = Option.of(ValueCodecs.integer(), "").withName("nums").withArity(Arity.of(1, 3));
        final var next = Flag.of("").withName("next");
        final var root = new Command("tool", "").withOption(nums).withFlag(next).withAction(context -> { });

        final var context = new Parser(root).parse("--nums", "1", "2", "3", "--next").get().get().context();

        assertThat(context.values(nums)).containsExactly(1, 2, 3);
        assertThat(context.flag(next)).isTrue();
    }

    @Test
    void rootArgumentWithDefaultedOptionAndTrailingFlag() throws ValueError {
        final var name = Argument.required("name", ValueCodecs.string(), "");
        final var count = Option.of(ValueCodecs.integer(), "").withName("count").withDefault(1);
        final var verbose = Flag.of("").withName("verbose").withShort('v');
        final var root = new Command("greet", "")
            .withArgument(name)
            .withOption(count)
            .withFlag(verbose)
            .withAction(context -> { });

        final var context = new Parser(root).parse("alice", "-v").get().get().context();

        assertThat(context.value(name)).isEqualTo("alice");
        assertThat(context.value(count)).isEqualTo(1);
        assertThat(context.flag(verbose)).isTrue();
        assertThat(count.effectiveValues()).containsExactly(1);
    }

    @Test
    void subcommandOptionGathersSeveralValues() throws ValueError {
        final var jobs = Option.of(ValueCodecs.integer(), "").withName("jobs").withArity(Arity.of(1, 3));
        final var root = new Command("tool", "")
            .withSubcommand(new Command("build", "").withOption(jobs).withAction(context -> { }));

        final var parsed = new Parser(root).parse("build", "--jobs", "2", "4").get().get();

        assertThat(parsed.command().name()).isEqualTo("build");
        assertThat(parsed.context().values(jobs)).containsExactly(2, 4);
    }

    @Test
    void subcommandNameAfterDoubleHyphenIsPositional() {
        final var result = new Parser(tree()).parse("--", "build");

        assertThat(result.isFailure()).isTrue();
        assertThat(result.getCause()).hasMessage("build is not a valid argument for tool!");
    }

    @Test
    void subcommandNameDescendsEvenWithUnfilledArguments() {
        final var root = new Command("tool", "")
            .withArgument(Argument.required("file", ValueCodecs.string(), ""))
            .withSubcommand(new Command("sub", "").withAction(context -> { }));

        final var result = new Parser(root).parse("sub");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get().get().command().name()).isEqualTo("sub");
    }

    @Test
    void invokeRunsTerminalAction() {
        final var seen = new StringBuilder();
        final var root = new Command("tool", "")
            .withArgument(Argument.required("word", ValueCodecs.string(), ""))
            .withAction(context -> seen.append(context.rawArgument("word").orElseThrow().get(0)));

        final var result = new Parser(root).parse("hello").get().get().invoke();

        assertThat(result.isSuccess()).isTrue();
        assertThat(seen).hasToString("hello");
    }
}
