package kgrs.core.rules;

import kgrs.core.error.RuleSyntaxException;
import kgrs.core.rdf.Graph;

/**
 * One tier of the rule engine.
 *
 * A tier extends the working graph it is handed and never removes triples.
 * The engine hands each tier a graph it exclusively owns for the duration of
 * the call. Tiers are stateless; everything they need comes from the mode
 * and the working graph.
 */
public interface RuleTier {

    /**
     * Unique identifier, used in logs and traces.
     */
    String getId();

    /**
     * Human-readable name for display.
     */
    String getName();

    /**
     * The mode this tier serves.
     */
    RuleMode.Kind getKind();

    /**
     * Derive new triples into the working graph.
     *
     * @param working Graph to extend in place
     * @param mode The selected mode, carrying rule text for text tiers
     * @param trace Collects step records and diagnostics
     * @throws RuleSyntaxException if the tier rejects the whole batch; the
     *         working graph must then be left unchanged
     */
    void apply(Graph working, RuleMode mode, RuleTrace.Builder trace) throws RuleSyntaxException;

    /**
     * Brief description of what this tier does.
     */
    default String getDescription() {
        return getName() + " (" + getKind() + ")";
    }
}
