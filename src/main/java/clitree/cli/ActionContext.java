package clitree.cli;

import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw values resolved for one command of a parse, chained to the context of the enclosing command.
 * <p>
 * A lookup that misses locally continues with the parent context, which is how a subcommand's action
 * sees options given to, or defaulted on, its ancestors. Values stay raw strings until a typed accessor
 * decodes them with the declaration's {@link ValueCodec}.
 */
@ToString(exclude = "parent")
public final class ActionContext {
    private final Command command;

    private final ActionContext parent;

    private final Map<String, List<String>> options = new LinkedHashMap<>();

    private final Map<String, List<String>> arguments = new LinkedHashMap<>();

    private final Map<String, Boolean> flags = new LinkedHashMap<>();

    ActionContext(final Command command, final ActionContext parent) {
        this.command = command;
        this.parent = parent;
    }

    public Command command() {
        return command;
    }

    public Optional<ActionContext> parent() {
        return Optional.ofNullable(parent);
    }

    public ActionContext root() {
        return parent == null ? this : parent.root();
    }

    void putOption(final String key, final List<String> values) {
        options.put(key, new ArrayList<>(values));
    }

    boolean hasLocalOption(final String key) {
        return options.containsKey(key);
    }

    void appendArgument(final String name, final String value) {
        arguments.computeIfAbsent(name, e -> new ArrayList<>()).add(value);
    }

    void putArgument(final String name, final List<String> values) {
        arguments.put(name, new ArrayList<>(values));
    }

    int argumentCount(final String name) {
        final var values = arguments.get(name);
        return values == null ? 0 : values.size();
    }

    void putFlag(final String key, final boolean value) {
        flags.put(key, value);
    }

    boolean hasLocalFlag(final String key) {
        return flags.containsKey(key);
    }

    Map<String, List<String>> localOptions() {
        return Collections.unmodifiableMap(options);
    }

    Map<String, List<String>> localArguments() {
        return Collections.unmodifiableMap(arguments);
    }

    Map<String, Boolean> localFlags() {
        return Collections.unmodifiableMap(flags);
    }

    public Optional<List<String>> rawOption(final String key) {
        return owningOption(key).map(e -> Collections.unmodifiableList(e.options.get(key)));
    }

    public Optional<List<String>> rawArgument(final String name) {
        return owningArgument(name).map(e -> Collections.unmodifiableList(e.arguments.get(name)));
    }

    public <T> T value(final Option<T> option) throws ValueError {
        return option.decode(first(option.key(), requireOption(option.key())));
    }

    public <T> List<T> values(final Option<T> option) throws ValueError {
        return decodeAll(option, requireOption(option.key()));
    }

    public <T> T value(final Argument<T> argument) throws ValueError {
        return argument.decode(first(argument.name(), requireArgument(argument.name())));
    }

    public <T> List<T> values(final Argument<T> argument) throws ValueError {
        return decodeAll(argument, requireArgument(argument.name()));
    }

    public boolean flag(final Flag flag) {
        return getFlag(flag.key());
    }

    /**
     * Reads the first value of an option, decoded with the codec of the declaration the key resolves to.
     */
    public <T> T getOption(final String key, final Class<T> type) throws ValueError {
        final var owner = owningOption(key).orElseThrow(() -> ValueError.optionNotFound(key));
        final var option = owner.command.findOptionByKey(key).orElseThrow(() -> ValueError.optionNotFound(key));
        return cast(option, type, option.decode(first(key, owner.options.get(key))));
    }

    public <T> List<T> getOptions(final String key, final Class<T> type) throws ValueError {
        final var owner = owningOption(key).orElseThrow(() -> ValueError.optionNotFound(key));
        final var option = owner.command.findOptionByKey(key).orElseThrow(() -> ValueError.optionNotFound(key));
        final List<T> result = new ArrayList<>();
        for (final var raw : owner.options.get(key)) {
            result.add(cast(option, type, option.decode(raw)));
        }
        return result;
    }

    public <T> T getArgument(final String name, final Class<T> type) throws ValueError {
        final var owner = owningArgument(name).orElseThrow(() -> ValueError.argumentNotFound(name));
        final var argument = owner.command.findArgument(name).orElseThrow(() -> ValueError.argumentNotFound(name));
        return cast(argument, type, argument.decode(first(name, owner.arguments.get(name))));
    }

    public <T> List<T> getArguments(final String name, final Class<T> type) throws ValueError {
        final var owner = owningArgument(name).orElseThrow(() -> ValueError.argumentNotFound(name));
        final var argument = owner.command.findArgument(name).orElseThrow(() -> ValueError.argumentNotFound(name));
        final List<T> result = new ArrayList<>();
        for (final var raw : owner.arguments.get(name)) {
            result.add(cast(argument, type, argument.decode(raw)));
        }
        return result;
    }

    /**
     * Flags that were never declared read as {@code false}.
     */
    public boolean getFlag(final String key) {
        final var value = flags.get(key);
        if (value != null) {
            return value;
        }
        return parent != null && parent.getFlag(key);
    }

    private Optional<ActionContext> owningOption(final String key) {
        if (options.containsKey(key)) {
            return Optional.of(this);
        }
        return parent == null ? Optional.empty() : parent.owningOption(key);
    }

    private Optional<ActionContext> owningArgument(final String name) {
        if (arguments.containsKey(name)) {
            return Optional.of(this);
        }
        return parent == null ? Optional.empty() : parent.owningArgument(name);
    }

    private List<String> requireOption(final String key) throws ValueError {
        return rawOption(key).orElseThrow(() -> ValueError.optionNotFound(key));
    }

    private List<String> requireArgument(final String name) throws ValueError {
        return rawArgument(name).orElseThrow(() -> ValueError.argumentNotFound(name));
    }

    private static String first(final String key, final List<String> raw) throws ValueError {
        if (raw.isEmpty()) {
            throw ValueError.noValueSet(key);
        }
        return raw.get(0);
    }

    private static <T> List<T> decodeAll(final Parameter<T> parameter, final List<String> raw) throws ValueError {
        final List<T> result = new ArrayList<>(raw.size());
        for (final var value : raw) {
            result.add(parameter.decode(value));
        }
        return result;
    }

    private static <T> T cast(final Parameter<?> parameter, final Class<T> type, final Object value) throws ValueError {
        if (!type.isInstance(value)) {
            throw ValueError.unsupportedType(parameter.key(), parameter.typeName(), type);
        }
        return type.cast(value);
    }
}
