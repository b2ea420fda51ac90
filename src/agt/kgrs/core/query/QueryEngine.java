package kgrs.core.query;

import kgrs.core.error.QueryEvaluationException;
import kgrs.core.error.QuerySyntaxException;
import kgrs.core.rdf.Graph;
import kgrs.core.rdf.Namespaces;
import kgrs.core.rdf.Term;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Runs queries against a graph and projects the bindings into the query's result shape.
 * Stateless apart from the compiler's prefix table; safe to share between threads.
 */
public class QueryEngine {

    private static final Logger logger = Logger.getLogger(QueryEngine.class.getName());

    private final QueryCompiler compiler;

    public QueryEngine(Namespaces namespaces) {
        this.compiler = new QueryCompiler(namespaces);
    }

    /**
     * Run a query whose form must be {@code expected}.
     *
     * @throws QuerySyntaxException if the text does not parse
     * @throws QueryEvaluationException if the query uses unsupported features or has another form
     */
    public QueryResult run(Graph graph, String queryText, QueryForm expected)
            throws QuerySyntaxException, QueryEvaluationException {
        CompiledQuery query = compiler.compile(queryText);
        if (expected != null && query.form != expected) {
            throw new QueryEvaluationException(
                "Query is a " + query.form + " query but " + expected + " was requested", queryText);
        }
        return evaluate(graph, query);
    }

    /**
     * Run a query, taking the form from the query text.
     */
    public QueryResult run(Graph graph, String queryText) throws QuerySyntaxException, QueryEvaluationException {
        return run(graph, queryText, null);
    }

    /**
     * Evaluate a compiled query. Never fails; no match gives an empty result.
     */
    public QueryResult evaluate(Graph graph, CompiledQuery query) {
        List<Binding> rows = PatternMatcher.evaluate(graph, query.patterns);
        logger.fine(query.form + " query matched " + rows.size() + " rows");

        switch (query.form) {
            case SELECT:
                return select(query.resultVars, rows, query.distinct, query.offset, query.limit);
            case ASK:
                return ask(rows);
            case CONSTRUCT:
            case DESCRIBE:
                return QueryResult.graph(query.form, construct(query.template, rows));
            default:
                throw new IllegalStateException("Unhandled query form: " + query.form);
        }
    }

    /**
     * SELECT projection: for each row, the display string of each requested
     * variable, or {@link QueryResult#NOT_APPLICABLE} when unbound.
     */
    public static QueryResult.SelectResult select(List<String> variables, List<Binding> rows) {
        return select(variables, rows, false, 0, CompiledQuery.NO_LIMIT);
    }

    static QueryResult.SelectResult select(List<String> variables, List<Binding> rows,
                                           boolean distinct, long offset, long limit) {
        List<Term.Variable> vars = new ArrayList<>(variables.size());
        for (String name : variables) {
            vars.add(Term.variable(name));
        }

        List<List<String>> table = new ArrayList<>();
        Set<List<String>> seen = new LinkedHashSet<>();
        long skipped = 0;
        for (Binding row : rows) {
            List<String> cells = new ArrayList<>(vars.size());
            for (Term.Variable v : vars) {
                Term value = row.get(v);
                cells.add(value != null ? value.toDisplayString() : QueryResult.NOT_APPLICABLE);
            }
            if (distinct && !seen.add(cells)) {
                continue;
            }
            if (skipped < offset) {
                skipped++;
                continue;
            }
            if (limit >= 0 && table.size() >= limit) {
                break;
            }
            table.add(cells);
        }
        return QueryResult.table(variables, table);
    }

    /**
     * ASK projection: true iff there is at least one row.
     */
    public static QueryResult.AskResult ask(List<Binding> rows) {
        return QueryResult.bool(!rows.isEmpty());
    }

    /**
     * CONSTRUCT projection: instantiate every template for every row.
     * A template with a variable unbound in the row is skipped for that row,
     * as is one that would put a literal in subject position or a non-IRI
     * in predicate position.
     * Blank nodes in templates are minted fresh per row.
     */
    public static Graph construct(List<TriplePattern> templates, List<Binding> rows) {
        Graph result = new Graph();
        String scope = UUID.randomUUID().toString().substring(0, 8);
        int rowIndex = 0;
        for (Binding row : rows) {
            Map<Term, Term> fresh = new HashMap<>();
            for (TriplePattern template : templates) {
                TriplePattern t = freshenBlankNodes(template, fresh, scope + "r" + rowIndex);
                t.instantiate(row).ifPresent(result::add);
            }
            rowIndex++;
        }
        return result;
    }

    private static TriplePattern freshenBlankNodes(TriplePattern template, Map<Term, Term> fresh, String rowScope) {
        if (!template.subject.isBlankNode() && !template.object.isBlankNode()) {
            return template;
        }
        return new TriplePattern(
            freshen(template.subject, fresh, rowScope),
            template.predicate,
            freshen(template.object, fresh, rowScope));
    }

    private static Term freshen(Term term, Map<Term, Term> fresh, String rowScope) {
        if (!term.isBlankNode()) {
            return term;
        }
        return fresh.computeIfAbsent(term,
            k -> Term.blank(rowScope + "_" + ((Term.BlankNode) k).getId()));
    }
}
