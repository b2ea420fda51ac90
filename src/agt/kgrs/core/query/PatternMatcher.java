package kgrs.core.query;

import kgrs.core.rdf.Graph;
import kgrs.core.rdf.RdfTriple;
import kgrs.core.rdf.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Basic Graph Pattern (BGP) matcher.
 *
 * Patterns are joined in the order given. Each pattern extends every
 * surviving row with the triples that match it; a variable already bound in
 * the row must agree with the matched term, otherwise the row is dropped.
 * The set of result rows does not depend on the pattern order.
 */
public class PatternMatcher {

    private static final Logger logger = Logger.getLogger(PatternMatcher.class.getName());

    private PatternMatcher() {}

    /**
     * Evaluate a pattern list against a graph.
     * An empty pattern list yields a single empty row.
     *
     * @param graph The graph to match against
     * @param patterns Ordered triple patterns
     * @return One binding per solution; each binds every variable of the pattern list
     */
    public static List<Binding> evaluate(Graph graph, List<TriplePattern> patterns) {
        List<Binding> rows = Collections.singletonList(Binding.empty());

        for (TriplePattern pattern : patterns) {
            List<Binding> next = new ArrayList<>();
            for (Binding row : rows) {
                extend(graph, pattern, row, next);
            }
            rows = next;
            if (rows.isEmpty()) {
                break;
            }
        }

        if (logger.isLoggable(Level.FINE)) {
            logger.fine("BGP of " + patterns.size() + " patterns matched " + rows.size() + " rows");
        }
        return rows;
    }

    private static void extend(Graph graph, TriplePattern pattern, Binding row, List<Binding> out) {
        // Resolve terms based on current bindings
        TriplePattern req = pattern.substitute(row);

        // Fixed positions narrow the scan; the graph indexes subjects
        List<RdfTriple> candidates = graph.find(
            fixed(req.subject), fixed(req.predicate), fixed(req.object));

        for (RdfTriple triple : candidates) {
            Binding extended = row.tryBind(req.subject, triple.subject);
            if (extended != null) extended = extended.tryBind(req.predicate, triple.predicate);
            if (extended != null) extended = extended.tryBind(req.object, triple.object);

            if (extended != null) {
                out.add(extended);
            }
        }
    }

    private static Term fixed(Term term) {
        return term.isVariable() ? null : term;
    }
}
