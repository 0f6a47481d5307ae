package work.geodsl.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.geodsl.command.Command;
import work.geodsl.command.CommandTable;
import work.geodsl.construction.LabelResolver;
import work.geodsl.error.ArgumentCountException;
import work.geodsl.error.ArgumentTypeException;
import work.geodsl.error.CommandDisallowedException;
import work.geodsl.error.CommandNotFoundException;
import work.geodsl.error.DslException;
import work.geodsl.error.InvalidArgumentException;
import work.geodsl.error.SyntaxException;
import work.geodsl.error.UndefinedLabelException;
import work.geodsl.filter.ArgumentFilterChain;
import work.geodsl.filter.CommandFilterChain;
import work.geodsl.filter.FilterContext;
import work.geodsl.filter.FilterDecision;
import work.geodsl.parser.Assignment;
import work.geodsl.parser.CommandCall;
import work.geodsl.parser.Literal;
import work.geodsl.parser.ParsedExpression;
import work.geodsl.parser.Reference;
import work.geodsl.value.DslValue;

/**
 * Evaluates expression trees: resolves labels, looks commands up by display name, runs both
 * filter chains and invokes the bound leaf algorithm. Never writes to the construction; label
 * values come in through a {@link LabelResolver}.
 */
public final class Dispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    private final CommandTable commands;
    private final AlgorithmRegistry algorithms;
    private final CommandFilterChain commandFilters;
    private final ArgumentFilterChain argumentFilters;

    public Dispatcher(
        CommandTable commands,
        AlgorithmRegistry algorithms,
        CommandFilterChain commandFilters,
        ArgumentFilterChain argumentFilters
    ) {
        this.commands = Objects.requireNonNull(commands, "commands");
        this.algorithms = Objects.requireNonNull(algorithms, "algorithms");
        this.commandFilters = Objects.requireNonNull(commandFilters, "commandFilters");
        this.argumentFilters = Objects.requireNonNull(argumentFilters, "argumentFilters");
    }

    public CommandTable commands() {
        return commands;
    }

    public AlgorithmRegistry algorithms() {
        return algorithms;
    }

    public CommandFilterChain commandFilters() {
        return commandFilters;
    }

    public ArgumentFilterChain argumentFilters() {
        return argumentFilters;
    }

    public Evaluation evaluate(ParsedExpression expression, LabelResolver labels, FilterContext context) {
        Objects.requireNonNull(expression, "expression");
        if (expression instanceof Literal literal) {
            return Evaluation.of(literal.value());
        }
        if (expression instanceof Reference reference) {
            DslValue value = labels.resolve(reference.label())
                .orElseThrow(() -> new UndefinedLabelException(reference.label()));
            return new Evaluation(value, Set.of(reference.label()), Map.of());
        }
        if (expression instanceof CommandCall call) {
            return invoke(call, labels, context);
        }
        if (expression instanceof Assignment assignment) {
            throw new SyntaxException("Assignment to '" + assignment.label() + "' cannot be used as a value", 0);
        }
        throw new IllegalArgumentException("Unsupported expression node: " + expression.getClass().getSimpleName());
    }

    private Evaluation invoke(CommandCall call, LabelResolver labels, FilterContext context) {
        String name = call.name();
        Command command = commands.lookup(name);

        FilterDecision allowed = commandFilters.check(command, context);
        if (allowed.denied()) {
            throw new CommandDisallowedException(name, allowed.reason());
        }

        List<DslValue> arguments = new ArrayList<>(call.arguments().size());
        Set<String> dependencies = new LinkedHashSet<>();
        for (ParsedExpression argument : call.arguments()) {
            Evaluation evaluated = evaluate(argument, labels, context);
            arguments.add(evaluated.value());
            dependencies.addAll(evaluated.dependencies());
        }

        if (!command.acceptsCount(arguments.size())) {
            throw new ArgumentCountException(name, arguments.size(), command.arityDescription());
        }

        FilterDecision valid = argumentFilters.check(command, arguments, context);
        if (valid.denied()) {
            throw rejected(name, arguments.size(), valid);
        }

        AlgorithmRegistry.Entry entry = algorithms.get(command)
            .orElseThrow(() -> new CommandNotFoundException(name, "no algorithm bound"));
        AlgorithmResult result;
        try {
            result = entry.algorithm().invoke(command, List.copyOf(arguments), Collections.unmodifiableSet(dependencies));
        } catch (DslException ex) {
            throw ex;
        } catch (Exception ex) {
            String message = ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getSimpleName()
                : ex.getMessage();
            throw new InvalidArgumentException(name, message, ex);
        }
        if (result == null) {
            throw new InvalidArgumentException(name, "algorithm produced no value");
        }
        LOG.trace("{} -> {}", name, result.value().display());

        Map<String, Object> metadata = new LinkedHashMap<>(result.metadata());
        metadata.putIfAbsent("command", command.displayName());
        return new Evaluation(result.value(), dependencies, metadata);
    }

    private static DslException rejected(String name, int count, FilterDecision decision) {
        return switch (decision.kind()) {
            case ARGUMENT_COUNT -> new ArgumentCountException(name, count, decision.reason());
            case ARGUMENT_TYPE -> new ArgumentTypeException(name, decision.reason());
            case ILLEGAL_ARGUMENT -> new InvalidArgumentException(name, decision.reason());
            case COMMAND_DISALLOWED -> new CommandDisallowedException(name, decision.reason());
            default -> new DslException(decision.kind(), name, name + ": " + decision.reason());
        };
    }
}
