package work.geodsl.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.geodsl.algorithm.StandardAlgorithms;
import work.geodsl.command.Command;
import work.geodsl.command.CommandCategory;
import work.geodsl.command.CommandTable;
import work.geodsl.config.KernelConfiguration;
import work.geodsl.construction.Construction;
import work.geodsl.construction.ConstructionElement;
import work.geodsl.error.DslException;
import work.geodsl.error.ErrorKind;
import work.geodsl.error.InvalidInputException;
import work.geodsl.error.NameUsedException;
import work.geodsl.filter.AllowListFilter;
import work.geodsl.filter.ArgumentCountFilter;
import work.geodsl.filter.ArgumentFilter;
import work.geodsl.filter.ArgumentFilterChain;
import work.geodsl.filter.ArgumentShapeFilter;
import work.geodsl.filter.CategoryFilter;
import work.geodsl.filter.CommandFilter;
import work.geodsl.filter.CommandFilterChain;
import work.geodsl.filter.FilterContext;
import work.geodsl.filter.InputFilter;
import work.geodsl.parser.Assignment;
import work.geodsl.parser.CommandCall;
import work.geodsl.parser.ParsedExpression;
import work.geodsl.parser.Parser;
import work.geodsl.parser.Reference;
import work.geodsl.value.DslValue;

/**
 * One evaluation session: a construction plus the parser, filter chains and algorithms that act
 * on it. Each input line either commits completely or leaves the construction untouched.
 * Confined to one thread.
 */
public final class Kernel {
    private static final Logger LOG = LoggerFactory.getLogger(Kernel.class);

    private final KernelConfiguration configuration;
    private final Parser parser = new Parser();
    private final Construction construction = new Construction();
    private final Dispatcher dispatcher;
    private final FilterContext context;
    private final List<InputFilter> inputFilters = new CopyOnWriteArrayList<>();
    private final ErrorLog errorLog;

    private Kernel(KernelConfiguration configuration, AlgorithmRegistry algorithms, ErrorLog errorLog) {
        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.errorLog = Objects.requireNonNull(errorLog, "errorLog");
        this.context = new FilterContext(
            configuration.examMode() ? FilterContext.EXAM_MODE : FilterContext.DEFAULT_MODE,
            configuration.allowRedefinition()
        );
        CommandTable commands = CommandTable.standard();
        this.dispatcher = new Dispatcher(
            commands,
            algorithms,
            commandFilters(configuration, commands),
            argumentFilters(configuration)
        );
        LOG.info(
            "Kernel started in {} mode ({} commands, {} command filters, {} argument filters)",
            context.mode(),
            commands.size(),
            dispatcher.commandFilters().filters().size(),
            dispatcher.argumentFilters().filters().size()
        );
    }

    public static Kernel create() {
        return create(KernelConfiguration.defaults());
    }

    public static Kernel create(KernelConfiguration configuration) {
        return new Kernel(configuration, StandardAlgorithms.create(), new ErrorLog());
    }

    public static Kernel create(KernelConfiguration configuration, AlgorithmRegistry algorithms, ErrorLog errorLog) {
        return new Kernel(configuration, algorithms, errorLog);
    }

    private static CommandFilterChain commandFilters(KernelConfiguration configuration, CommandTable commands) {
        var chain = new CommandFilterChain();
        Set<CommandCategory> blocked = new LinkedHashSet<>(configuration.blockedCategories());
        if (!configuration.casAllowed()) {
            blocked.add(CommandCategory.CAS);
        }
        if (!blocked.isEmpty()) {
            chain.add(new CategoryFilter(blocked));
        }
        if (configuration.examMode()) {
            Set<Command> allowed = configuration.allowedCommands().stream()
                .map(commands::lookup)
                .collect(Collectors.toSet());
            chain.add(new AllowListFilter(allowed));
        }
        return chain;
    }

    private static ArgumentFilterChain argumentFilters(KernelConfiguration configuration) {
        var chain = new ArgumentFilterChain();
        int max = configuration.maxArguments() > 0 ? configuration.maxArguments() : Command.VARIADIC;
        chain.add(new ArgumentCountFilter(0, max));
        if (configuration.checkArgumentTypes()) {
            chain.add(new ArgumentShapeFilter());
        }
        return chain;
    }

    /**
     * Evaluates one line and commits an assignment.
     *
     * @throws DslException describing why the line was rejected; the construction is unchanged
     */
    public LineResult evaluate(String text) {
        LOG.debug("Evaluating: {}", text);
        ParsedExpression root = parser.parse(text);
        for (InputFilter filter : inputFilters) {
            if (!filter.accepts(root)) {
                throw new InvalidInputException("Input rejected: " + root.toSource());
            }
        }

        if (root instanceof Assignment assignment) {
            String label = assignment.label();
            ParsedExpression expression = assignment.value();
            Evaluation evaluation = dispatcher.evaluate(expression, construction, context);
            List<String> recomputed = commit(label, expression, evaluation);
            return LineResult.success(text, label, evaluation, recomputed);
        }
        Evaluation evaluation = dispatcher.evaluate(root, construction, context);
        return LineResult.success(text, null, evaluation, List.of());
    }

    /**
     * Like {@link #evaluate} but never throws: failures are returned and recorded in the error
     * log.
     */
    public LineResult process(String text) {
        try {
            return evaluate(text);
        } catch (DslException ex) {
            errorLog.record(text, ex);
            return LineResult.failure(text, ex);
        } catch (RuntimeException ex) {
            LOG.error("Internal failure while evaluating '{}'", text, ex);
            String detail = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
            var internal = new DslException(ErrorKind.INTERNAL, null, "Internal error: " + detail, ex);
            errorLog.record(text, internal);
            return LineResult.failure(text, internal);
        }
    }

    private List<String> commit(String label, ParsedExpression expression, Evaluation evaluation) {
        if (!construction.contains(label)) {
            construction.define(label, expression, evaluation.value(), evaluation.dependencies());
            return List.of();
        }
        if (!context.allowRedefinition()) {
            throw new NameUsedException(label);
        }
        return construction.redefine(
            label,
            expression,
            evaluation.value(),
            evaluation.dependencies(),
            (element, staged) -> dispatcher.evaluate(element.definition(), staged, context).value()
        );
    }

    /**
     * Problems a line would run into, found without evaluating it: syntax errors, unknown
     * commands and undefined labels. Empty when none are found.
     */
    public List<String> validate(String text) {
        List<String> problems = new ArrayList<>();
        ParsedExpression root;
        try {
            root = parser.parse(text);
        } catch (DslException ex) {
            problems.add(ex.getMessage());
            return problems;
        }
        ParsedExpression expression = root instanceof Assignment assignment ? assignment.value() : root;
        collectProblems(expression, problems);
        if (root instanceof Assignment assignment
            && construction.contains(assignment.label())
            && !context.allowRedefinition()) {
            problems.add("Name already used: " + assignment.label());
        }
        return problems;
    }

    private void collectProblems(ParsedExpression expression, List<String> problems) {
        if (expression instanceof Reference reference && !construction.contains(reference.label())) {
            problems.add("Undefined variable: " + reference.label());
        } else if (expression instanceof CommandCall call) {
            if (!dispatcher.commands().contains(call.name())) {
                problems.add("Unknown command: " + call.name());
            }
            for (ParsedExpression argument : call.arguments()) {
                collectProblems(argument, problems);
            }
        }
    }

    public Optional<DslValue> lookup(String label) {
        return construction.resolve(label);
    }

    /**
     * Snapshot of label to value in definition order.
     */
    public Map<String, DslValue> elements() {
        var snapshot = new LinkedHashMap<String, DslValue>();
        for (ConstructionElement element : construction.elements()) {
            snapshot.put(element.label(), element.value());
        }
        return snapshot;
    }

    public Set<String> dependentsOf(String label) {
        return construction.dependentsOf(label);
    }

    public void clear() {
        construction.clear();
        errorLog.clear();
    }

    /**
     * Binds a leaf algorithm to a catalogued command, replacing any shipped one.
     */
    public void registerAlgorithm(String displayName, CommandAlgorithm algorithm) {
        Command command = dispatcher.commands().lookup(displayName);
        dispatcher.algorithms().register(command, algorithm, true);
        LOG.debug("Registered macro for {}", displayName);
    }

    public Kernel addCommandFilter(CommandFilter filter) {
        dispatcher.commandFilters().add(filter);
        return this;
    }

    public Kernel addArgumentFilter(ArgumentFilter filter) {
        dispatcher.argumentFilters().add(filter);
        return this;
    }

    public Kernel addInputFilter(InputFilter filter) {
        if (filter != null) {
            inputFilters.add(filter);
        }
        return this;
    }

    public KernelConfiguration configuration() {
        return configuration;
    }

    public FilterContext context() {
        return context;
    }

    public CommandTable commands() {
        return dispatcher.commands();
    }

    public Construction construction() {
        return construction;
    }

    public ErrorLog errorLog() {
        return errorLog;
    }
}
