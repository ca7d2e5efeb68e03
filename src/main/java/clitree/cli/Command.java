package clitree.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the command tree. The tree is built before parsing and not modified afterwards.
 * <p>
 * {@code parent} is a back-reference only, used for scoped lookup: options and flags declared on an ancestor
 * can be given from within any descendant's argument list.
 */
public final class Command {
    private final String name;

    private final String description;

    private final List<Option<?>> options = new ArrayList<>();

    private final List<Flag> flags = new ArrayList<>();

    private final List<Argument<?>> arguments = new ArrayList<>();

    private final List<Command> subcommands = new ArrayList<>();

    private Action action;

    private Command parent;

    public Command(final String name, final String description) {
        this.name = Objects.requireNonNull(name);
        this.description = description;
        withFlag(Flag.help());
    }

    public Command withOption(final Option<?> option) {
        if (option.key() == null) {
            throw ErrorFactory.missingName(option.description());
        }
        checkUnique(option.longName(), option.shortName());
        options.add(option);
        return this;
    }

    public Command withFlag(final Flag flag) {
        if (flag.key() == null) {
            throw ErrorFactory.missingName(flag.description());
        }
        checkUnique(flag.longName(), flag.shortName());
        flags.add(flag);
        return this;
    }

    public Command withArgument(final Argument<?> argument) {
        if (arguments.stream().anyMatch(e -> e.name().equals(argument.name()))) {
            throw ErrorFactory.duplicateName(name, argument.name());
        }
        if (argument.required() && arguments.stream().anyMatch(e -> !e.required())) {
            throw ErrorFactory.requiredAfterOptional(argument.name());
        }
        arguments.add(argument);
        return this;
    }

    public Command withSubcommand(final Command subcommand) {
        if (subcommand.parent != null) {
            throw ErrorFactory.alreadyAttached(subcommand.name);
        }
        if (findSubcommand(subcommand.name).isPresent()) {
            throw ErrorFactory.duplicateName(name, subcommand.name);
        }
        subcommand.parent = this;
        subcommands.add(subcommand);
        return this;
    }

    public Command withAction(final Action action) {
        this.action = action;
        return this;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public List<Option<?>> options() {
        return Collections.unmodifiableList(options);
    }

    public List<Flag> flags() {
        return Collections.unmodifiableList(flags);
    }

    public List<Argument<?>> arguments() {
        return Collections.unmodifiableList(arguments);
    }

    public List<Command> subcommands() {
        return Collections.unmodifiableList(subcommands);
    }

    public Optional<Action> action() {
        return Optional.ofNullable(action);
    }

    public Optional<Command> parent() {
        return Optional.ofNullable(parent);
    }

    public boolean isLeaf() {
        return action != null;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * Space separated names from the root down to this command.
     */
    public String path() {
        return parent == null ? name : parent.path() + " " + name;
    }

    public void execute(final ActionContext context) throws Exception {
        if (action == null) {
            throw ErrorFactory.noActionDefined(name);
        }
        action.run(context);
    }

    public String help() {
        return Help.of(this).text();
    }

    public Optional<Option<?>> findOption(final String longName) {
        final Optional<Option<?>> local = options.stream().filter(e -> longName.equals(e.longName())).findFirst();
        return local.isPresent() || parent == null ? local : parent.findOption(longName);
    }

    public Optional<Option<?>> findOptionByShort(final char shortName) {
        final Optional<Option<?>> local = options.stream().filter(e -> e.shortName() != null && e.shortName() == shortName).findFirst();
        return local.isPresent() || parent == null ? local : parent.findOptionByShort(shortName);
    }

    public Optional<Flag> findFlag(final String longName) {
        final var local = flags.stream().filter(e -> longName.equals(e.longName())).findFirst();
        return local.isPresent() || parent == null ? local : parent.findFlag(longName);
    }

    public Optional<Flag> findFlagByShort(final char shortName) {
        final var local = flags.stream().filter(e -> e.shortName() != null && e.shortName() == shortName).findFirst();
        return local.isPresent() || parent == null ? local : parent.findFlagByShort(shortName);
    }

    /**
     * Looks an option up by its context key, walking up through the parents.
     */
    public Optional<Option<?>> findOptionByKey(final String key) {
        final Optional<Option<?>> local = options.stream().filter(e -> key.equals(e.key())).findFirst();
        return local.isPresent() || parent == null ? local : parent.findOptionByKey(key);
    }

    public Optional<Flag> findFlagByKey(final String key) {
        final var local = flags.stream().filter(e -> key.equals(e.key())).findFirst();
        return local.isPresent() || parent == null ? local : parent.findFlagByKey(key);
    }

    /**
     * Local lookup only: arguments are positional and never inherited.
     */
    public Optional<Argument<?>> findArgument(final String name) {
        return arguments.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public Optional<Command> findSubcommand(final String name) {
        return subcommands.stream().filter(e -> e.name.equals(name)).findFirst();
    }

    private void checkUnique(final String longName, final Character shortName) {
        if (longName != null && (options.stream().anyMatch(e -> longName.equals(e.longName()))
            || flags.stream().anyMatch(e -> longName.equals(e.longName())))) {
            throw ErrorFactory.duplicateName(name, "--" + longName);
        }
        if (shortName != null && (options.stream().anyMatch(e -> shortName.equals(e.shortName()))
            || flags.stream().anyMatch(e -> shortName.equals(e.shortName())))) {
            throw ErrorFactory.duplicateName(name, "-" + shortName);
        }
    }

    @Override
    public String toString() {
        return path();
    }
}
