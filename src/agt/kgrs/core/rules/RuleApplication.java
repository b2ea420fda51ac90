package kgrs.core.rules;

import kgrs.core.rdf.Graph;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of applying rules: the extended graph plus the trace,
 * including diagnostics for declarative rules that were skipped.
 */
public class RuleApplication {

    private final Graph graph;
    private final RuleTrace trace;

    public RuleApplication(Graph graph, RuleTrace trace) {
        this.graph = Objects.requireNonNull(graph);
        this.trace = Objects.requireNonNull(trace);
    }

    public Graph getGraph() {
        return graph;
    }

    public RuleTrace getTrace() {
        return trace;
    }

    public List<RuleDiagnostic> getDiagnostics() {
        return trace.getDiagnostics();
    }

    public boolean hasDiagnostics() {
        return !trace.getDiagnostics().isEmpty();
    }

    @Override
    public String toString() {
        return "RuleApplication{" + graph + ", " + trace + "}";
    }
}
