package io.flowcheck.core;

import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.exception.FlowCheckException;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Symbol;
import io.flowcheck.core.flow.FlowDefinition;
import io.flowcheck.core.flow.FlowEnvironment;
import io.flowcheck.core.flow.Page;
import io.flowcheck.core.flow.PageTransition;
import io.flowcheck.core.graph.NodePredicatePropagator;
import io.flowcheck.core.graph.SoundnessChecker;
import io.flowcheck.core.graph.SoundnessReport;
import io.flowcheck.core.graph.Transition;
import io.flowcheck.core.graph.TransitionGraph;
import io.flowcheck.core.graph.TransitionGraphBuilder;
import io.flowcheck.core.pass.BooleanSimplifier;
import io.flowcheck.core.pass.PassPipeline;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;

/// Entry point of a flow analysis: compiles conditions, builds the transition graph,
/// propagates node predicates and checks soundness.
///
/// ### Contracts
/// - **Precondition**: the flow definition is valid (see {@link FlowDefinition.Builder})
/// - **Postcondition**: every node of the returned graph carries a predicate
///
/// @implNote Each run owns a fixed thread pool of `parallelism` workers for edge filter
/// simplification and shuts it down before returning. An analyzer holds no per-run state
/// and may be reused.
///
/// @see FlowCheckConfig for tuning options
public final class FlowAnalyzer {

    private static final Logger logger = Logger.getLogger(FlowAnalyzer.class.getName());

    private final FlowCheckConfig config;
    private final BooleanSimplifier simplifier;

    public FlowAnalyzer() {
        this(new FlowCheckConfig());
    }

    public FlowAnalyzer(FlowCheckConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        if (config.getParallelism() < 1) {
            throw new IllegalArgumentException("parallelism must be positive: " + config.getParallelism());
        }
        this.simplifier = new BooleanSimplifier(config.getTruthTableAtomLimit());
    }

    /// Analyses a flow definition.
    ///
    /// Conditions failing to compile are reported in
    /// {@link AnalysisReport#conditionErrors()} unless `failFast` is set. Their transitions
    /// stay in the chain guarded by an opaque boolean symbol (see {@link #unknownCondition}),
    /// so later transitions of the page keep their override guard.
    ///
    /// @param flow flow to analyse, not null
    /// @return analysis report, never null
    /// @throws io.flowcheck.core.exception.ConfigurationException on invalid enum
    ///     declarations or cyclic flows
    /// @throws FlowCheckException for the first failing condition when `failFast` is set
    public AnalysisReport analyze(FlowDefinition flow) {
        logger.info("Analysing flow " + flow.getId() + " with " + flow.getPages().size() + " pages");
        FlowEnvironment environment = FlowEnvironment.of(flow, new PassPipeline(simplifier));
        Map<String, List<Transition>> transitions = new LinkedHashMap<>();
        List<ConditionError> errors = new ArrayList<>();
        for (Page page : flow.getPages().values()) {
            List<Transition> compiled = new ArrayList<>();
            for (int i = 0; i < page.transitions().size(); i++) {
                PageTransition transition = page.transitions().get(i);
                if (transition.isUnconditional()) {
                    compiled.add(Transition.always(transition.target()));
                    continue;
                }
                try {
                    Expr condition = environment.compile(transition.condition());
                    compiled.add(new Transition(condition, transition.target()));
                } catch (FlowCheckException e) {
                    if (config.isFailFast()) {
                        throw e;
                    }
                    logger.warning("Condition of " + page.uid() + " -> " + transition.target()
                            + " failed: " + e.getMessage());
                    errors.add(new ConditionError(page.uid(), transition.target(), transition.condition(),
                            e.getClass().getSimpleName(), e.getMessage()));
                    compiled.add(new Transition(
                            unknownCondition(page.uid(), i, transition.target()), transition.target()));
                }
            }
            transitions.put(page.uid(), compiled);
        }
        return analyzeTransitions(flow.getId(), flow.getStartPage(), flow.getPages().keySet(),
                transitions, environment.getEnums(), errors);
    }

    /// Analyses already compiled transitions.
    ///
    /// @param flowId identifier reported back, not null
    /// @param source node predicates are propagated from, not null
    /// @param nodes nodes to include even without transitions, not null
    /// @param transitions ordered compiled transitions per node, not null
    /// @param enums enumerations the conditions refer to, not null
    /// @param conditionErrors errors collected while compiling, not null
    /// @return analysis report, never null
    /// @throws io.flowcheck.core.exception.ConfigurationException on cyclic transitions
    public AnalysisReport analyzeTransitions(
            String flowId,
            String source,
            Collection<String> nodes,
            Map<String, List<Transition>> transitions,
            EnumRegistry enums,
            List<ConditionError> conditionErrors) {
        ExecutorService executor = Executors.newFixedThreadPool(config.getParallelism());
        try {
            TransitionGraph graph = new TransitionGraphBuilder(simplifier, executor).build(nodes, transitions);
            new NodePredicatePropagator(simplifier).propagate(graph, source, enums);
            SoundnessReport soundness =
                    new SoundnessChecker(simplifier, config.getSelfLoopPolicy()).check(graph, enums);
            logger.info("Flow " + flowId + ": " + soundness.violations().size() + " unsound nodes, "
                    + conditionErrors.size() + " condition errors");
            return new AnalysisReport(flowId, source, graph, conditionErrors, soundness, enums);
        } finally {
            executor.shutdown();
        }
    }

    /// Returns the placeholder for the condition of the `index`-th transition of `page`
    /// that failed to compile, e.g. `?index[0]->A`.
    ///
    /// @return boolean symbol unique per page and transition position, never null
    static Symbol unknownCondition(String page, int index, String target) {
        return new Symbol("?" + page + "[" + index + "]->" + target, Kind.BOOLEAN);
    }

    public FlowCheckConfig getConfig() {
        return config;
    }
}
