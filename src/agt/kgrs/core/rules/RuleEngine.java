package kgrs.core.rules;

import kgrs.core.error.RuleSyntaxException;
import kgrs.core.rdf.Graph;
import kgrs.core.rdf.Namespaces;
import kgrs.core.rules.library.RecommendationStep;

import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Main entry point for rule application.
 * Dispatches each selected mode to its registered tier and returns the
 * extended graph with a trace.
 *
 * The input graph is never modified: tiers work on a private copy. Modes are
 * applied in the order given, each one seeing the output of the previous.
 */
public class RuleEngine {

    private static final Logger logger = Logger.getLogger(RuleEngine.class.getName());

    private final RuleTierRegistry registry;
    private final boolean traceEnabled;

    public RuleEngine(RuleTierRegistry registry) {
        this(registry, true);
    }

    public RuleEngine(RuleTierRegistry registry, boolean traceEnabled) {
        this.registry = registry;
        this.traceEnabled = traceEnabled;
    }

    public RuleTierRegistry getRegistry() {
        return registry;
    }

    /**
     * Apply one or more rule modes.
     *
     * @param graph The source graph; left untouched
     * @param modes Modes to apply in order; none at all behaves like NONE
     * @return The extended graph and its trace
     * @throws RuleSyntaxException if a tier rejects its whole batch
     * @throws IllegalStateException if no tier is registered for a selected mode
     */
    public RuleApplication apply(Graph graph, RuleMode... modes) throws RuleSyntaxException {
        long startTime = System.currentTimeMillis();
        Graph working = graph.copy();
        RuleTrace.Builder trace = RuleTrace.builder(graph.size()).recordSteps(traceEnabled);

        for (RuleMode mode : modes) {
            if (mode.getKind() == RuleMode.Kind.NONE) {
                continue;
            }
            RuleTier tier = registry.getTier(mode.getKind())
                .orElseThrow(() -> new IllegalStateException("No rule tier registered for " + mode.getKind()));

            int before = working.size();
            tier.apply(working, mode, trace);
            logger.fine("Tier " + tier.getId() + " added " + (working.size() - before) + " triples");
        }

        long totalTime = System.currentTimeMillis() - startTime;
        RuleTrace result = trace
            .outputSize(working.size())
            .totalTime(totalTime)
            .build();

        logger.info(buildSummary(modes, result));
        return new RuleApplication(working, result);
    }

    private String buildSummary(RuleMode[] modes, RuleTrace trace) {
        List<String> kinds = Arrays.stream(modes)
            .map(m -> m.getKind().name())
            .collect(Collectors.toList());
        return String.format("Applied rules %s: %d -> %d triples, %d skipped rules, %dms",
            kinds.isEmpty() ? "[NONE]" : kinds, trace.getInputSize(), trace.getOutputSize(),
            trace.getDiagnostics().size(), trace.getTotalTimeMs());
    }

    /**
     * Create an engine over a registry with the built-in tiers.
     */
    public static RuleEngine withDefaults(Namespaces namespaces, RecommendationStep.Variant variant) {
        return new RuleEngine(RuleTierRegistry.withDefaults(namespaces, variant));
    }
}
