package kgrs.core.query;

import kgrs.core.error.QueryEvaluationException;
import kgrs.core.error.QuerySyntaxException;
import kgrs.core.rdf.JenaGraphAdapter;
import kgrs.core.rdf.Namespaces;
import org.apache.jena.graph.Triple;
import org.apache.jena.query.Query;
import org.apache.jena.query.QueryException;
import org.apache.jena.query.QueryFactory;
import org.apache.jena.query.Syntax;
import org.apache.jena.sparql.core.TriplePath;
import org.apache.jena.sparql.syntax.Element;
import org.apache.jena.sparql.syntax.ElementGroup;
import org.apache.jena.sparql.syntax.ElementPathBlock;
import org.apache.jena.sparql.syntax.ElementTriplesBlock;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Compiles SPARQL text into a {@link CompiledQuery}.
 *
 * Parsing is done by Jena ARQ with the configured prefixes pre-declared.
 * Only basic graph patterns compile: a group of plain triple blocks.
 * FILTER, OPTIONAL, UNION, sub-queries, property paths, grouping,
 * aggregates, ordering and projected expressions are rejected.
 */
public class QueryCompiler {

    private static final Logger logger = Logger.getLogger(QueryCompiler.class.getName());

    private final Namespaces namespaces;

    public QueryCompiler(Namespaces namespaces) {
        this.namespaces = namespaces;
    }

    /**
     * Compile query text.
     *
     * @throws QuerySyntaxException for malformed text or undeclared prefixes
     * @throws QueryEvaluationException for well-formed queries using unsupported features
     */
    public CompiledQuery compile(String text) throws QuerySyntaxException, QueryEvaluationException {
        if (text == null || text.isBlank()) {
            throw new QuerySyntaxException("Empty query", text);
        }

        Query query = parse(text);
        QueryForm form = formOf(query, text);

        List<TriplePattern> patterns = new ArrayList<>();
        Element where = query.getQueryPattern();
        if (where == null) {
            if (form == QueryForm.DESCRIBE) {
                throw new QuerySyntaxException("DESCRIBE requires a WHERE pattern", text);
            }
        } else {
            extractPatterns(where, patterns, text);
        }

        rejectSolutionModifiers(query, text);

        List<String> resultVars = List.of();
        List<TriplePattern> template = List.of();
        boolean distinct = false;
        long limit = CompiledQuery.NO_LIMIT;
        long offset = 0;

        switch (form) {
            case SELECT:
                if (!query.getProject().getExprs().isEmpty()) {
                    throw unsupported("projected expressions", text);
                }
                resultVars = query.getResultVars();
                distinct = query.isDistinct() || query.isReduced();
                if (query.hasLimit()) limit = query.getLimit();
                if (query.hasOffset()) offset = query.getOffset();
                break;
            case CONSTRUCT:
                template = toPatterns(query.getConstructTemplate().getTriples(), text);
                break;
            case DESCRIBE:
                template = patterns;
                break;
            default:
                break;
        }

        CompiledQuery compiled = new CompiledQuery(text, form, patterns, resultVars, template, distinct, limit, offset);
        logger.fine("Compiled " + compiled);
        return compiled;
    }

    private Query parse(String text) throws QuerySyntaxException {
        Query query = new Query();
        namespaces.getPrefixMap().forEach(query::setPrefix);
        try {
            QueryFactory.parse(query, text, null, Syntax.syntaxSPARQL_11);
            return query;
        } catch (QueryException e) {
            logger.warning("Query parse error: " + e.getMessage());
            throw new QuerySyntaxException("Invalid query: " + e.getMessage(), text, e);
        }
    }

    private QueryForm formOf(Query query, String text) throws QueryEvaluationException {
        if (query.isSelectType()) return QueryForm.SELECT;
        if (query.isAskType()) return QueryForm.ASK;
        if (query.isConstructType()) return QueryForm.CONSTRUCT;
        if (query.isDescribeType()) return QueryForm.DESCRIBE;
        throw new QueryEvaluationException("Unsupported query form", text);
    }

    private void rejectSolutionModifiers(Query query, String text) throws QueryEvaluationException {
        if (query.hasGroupBy() || query.hasAggregators() || query.hasHaving()) {
            throw unsupported("grouping and aggregates", text);
        }
        if (query.hasOrderBy()) {
            throw unsupported("ORDER BY", text);
        }
        if (query.hasValues()) {
            throw unsupported("VALUES", text);
        }
    }

    private void extractPatterns(Element el, List<TriplePattern> list, String text) throws QueryEvaluationException {
        if (el instanceof ElementGroup) {
            for (Element child : ((ElementGroup) el).getElements()) {
                extractPatterns(child, list, text);
            }
        } else if (el instanceof ElementPathBlock) {
            for (TriplePath tp : ((ElementPathBlock) el).getPattern().getList()) {
                if (!tp.isTriple()) {
                    throw unsupported("property paths", text);
                }
                list.add(toPattern(tp.asTriple(), text));
            }
        } else if (el instanceof ElementTriplesBlock) {
            list.addAll(toPatterns(((ElementTriplesBlock) el).getPattern().getList(), text));
        } else {
            // FILTER, OPTIONAL, UNION, MINUS, BIND, sub-select, ...
            throw unsupported(el.getClass().getSimpleName().replace("Element", "").toUpperCase(), text);
        }
    }

    private List<TriplePattern> toPatterns(List<Triple> triples, String text) throws QueryEvaluationException {
        List<TriplePattern> list = new ArrayList<>(triples.size());
        for (Triple t : triples) {
            list.add(toPattern(t, text));
        }
        return list;
    }

    private TriplePattern toPattern(Triple t, String text) throws QueryEvaluationException {
        try {
            return new TriplePattern(
                JenaGraphAdapter.toTerm(t.getSubject()),
                JenaGraphAdapter.toTerm(t.getPredicate()),
                JenaGraphAdapter.toTerm(t.getObject()));
        } catch (IllegalArgumentException e) {
            throw unsupported("term " + e.getMessage(), text);
        }
    }

    private static QueryEvaluationException unsupported(String feature, String text) {
        return new QueryEvaluationException("Unsupported query feature: " + feature, text);
    }
}
