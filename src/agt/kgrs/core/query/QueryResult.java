package kgrs.core.query;

import kgrs.core.rdf.Graph;
import kgrs.core.rdf.GraphSerializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of a query, shaped by its form.
 * Either a table (SELECT), a boolean (ASK) or a graph (CONSTRUCT, DESCRIBE).
 *
 * Use the static factory methods to create instances:
 * - QueryResult.table(...)
 * - QueryResult.bool(...)
 * - QueryResult.graph(...)
 */
public abstract class QueryResult {

    /** Cell value for a variable left unbound in a row */
    public static final String NOT_APPLICABLE = "N/A";

    protected final QueryForm form;

    protected QueryResult(QueryForm form) {
        this.form = Objects.requireNonNull(form);
    }

    public QueryForm getForm() {
        return form;
    }

    public SelectResult asSelect() {
        if (this instanceof SelectResult) {
            return (SelectResult) this;
        }
        throw new IllegalStateException("Result is " + form + ", not SELECT");
    }

    public AskResult asAsk() {
        if (this instanceof AskResult) {
            return (AskResult) this;
        }
        throw new IllegalStateException("Result is " + form + ", not ASK");
    }

    public GraphResult asGraph() {
        if (this instanceof GraphResult) {
            return (GraphResult) this;
        }
        throw new IllegalStateException("Result is " + form + ", not a graph");
    }

    /**
     * Plain text rendering for display.
     */
    public abstract String toText();

    // Factory methods

    public static SelectResult table(List<String> headers, List<List<String>> rows) {
        return new SelectResult(headers, rows);
    }

    public static AskResult bool(boolean value) {
        return new AskResult(value);
    }

    public static GraphResult graph(QueryForm form, Graph graph) {
        return new GraphResult(form, graph);
    }

    // ========== SELECT ==========

    public static class SelectResult extends QueryResult {

        private final List<String> headers;
        private final List<List<String>> rows;

        private SelectResult(List<String> headers, List<List<String>> rows) {
            super(QueryForm.SELECT);
            this.headers = List.copyOf(headers);
            List<List<String>> copy = new ArrayList<>(rows.size());
            for (List<String> row : rows) {
                copy.add(List.copyOf(row));
            }
            this.rows = Collections.unmodifiableList(copy);
        }

        public List<String> getHeaders() {
            return headers;
        }

        public List<List<String>> getRows() {
            return rows;
        }

        public boolean isEmpty() {
            return rows.isEmpty();
        }

        @Override
        public String toText() {
            StringBuilder sb = new StringBuilder(String.join("\t", headers)).append('\n');
            for (List<String> row : rows) {
                sb.append(String.join("\t", row)).append('\n');
            }
            return sb.toString();
        }

        @Override
        public String toString() {
            return String.format("SelectResult{headers=%s, rows=%d}", headers, rows.size());
        }
    }

    // ========== ASK ==========

    public static class AskResult extends QueryResult {

        private final boolean value;

        private AskResult(boolean value) {
            super(QueryForm.ASK);
            this.value = value;
        }

        public boolean getValue() {
            return value;
        }

        @Override
        public String toText() {
            return value ? "True" : "False";
        }

        @Override
        public String toString() {
            return "AskResult{" + value + "}";
        }
    }

    // ========== CONSTRUCT / DESCRIBE ==========

    public static class GraphResult extends QueryResult {

        private final Graph graph;

        private GraphResult(QueryForm form, Graph graph) {
            super(form);
            this.graph = Objects.requireNonNull(graph);
        }

        public Graph getGraph() {
            return graph;
        }

        /**
         * One N-Triples statement per line.
         */
        @Override
        public String toText() {
            return GraphSerializer.toNTriples(graph);
        }

        @Override
        public String toString() {
            return String.format("GraphResult{form=%s, triples=%d}", form, graph.size());
        }
    }
}
