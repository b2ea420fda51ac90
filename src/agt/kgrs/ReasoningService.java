package kgrs;

import kgrs.core.error.ExtractionFailedException;
import kgrs.core.error.QueryEvaluationException;
import kgrs.core.error.QuerySyntaxException;
import kgrs.core.error.RuleSyntaxException;
import kgrs.core.error.SourceUnavailableException;
import kgrs.core.query.QueryEngine;
import kgrs.core.query.QueryForm;
import kgrs.core.query.QueryResult;
import kgrs.core.rdf.Graph;
import kgrs.core.rdf.GraphSerializer;
import kgrs.core.rdf.NamespaceLoader;
import kgrs.core.rdf.Namespaces;
import kgrs.core.rules.RuleApplication;
import kgrs.core.rules.RuleEngine;
import kgrs.core.rules.RuleMode;
import kgrs.core.rules.RuleTierRegistry;
import kgrs.core.source.GraphSource;
import kgrs.core.source.RdfDocumentSource;

import java.util.logging.Logger;

/**
 * Facade over the reasoning core: load a graph, extend it with rules,
 * and query the result.
 *
 * Instances hold only immutable configuration and may be shared between threads.
 */
public class ReasoningService {

    private static final Logger logger = Logger.getLogger(ReasoningService.class.getName());

    private final ReasonerConfiguration config;
    private final Namespaces namespaces;
    private final RuleEngine ruleEngine;
    private final QueryEngine queryEngine;
    private final GraphSource source;

    public ReasoningService() {
        this(ReasonerConfiguration.defaults());
    }

    public ReasoningService(ReasonerConfiguration config) {
        this(config, new RdfDocumentSource());
    }

    public ReasoningService(ReasonerConfiguration config, GraphSource source) {
        this.config = config;
        this.namespaces = NamespaceLoader.load(
            config.getDefaultPrefix(),
            config.getDefaultNamespace(),
            config.getNamespaceSources().toArray(new String[0]));
        this.ruleEngine = new RuleEngine(
            RuleTierRegistry.withDefaults(namespaces, config.getRecommendationVariant()),
            config.isTraceEnabled());
        this.queryEngine = new QueryEngine(namespaces);
        this.source = source;
        logger.info("Reasoning service ready: " + config);
    }

    public ReasonerConfiguration getConfig() {
        return config;
    }

    public Namespaces getNamespaces() {
        return namespaces;
    }

    /**
     * Load a graph from a document location (URL, file path or classpath: resource).
     */
    public Graph load(String location) throws SourceUnavailableException, ExtractionFailedException {
        return source.load(location);
    }

    /**
     * Extend a copy of the graph with the selected rule modes, applied in order.
     */
    public RuleApplication applyRules(Graph graph, RuleMode... modes) throws RuleSyntaxException {
        return ruleEngine.apply(graph, modes);
    }

    /**
     * Run a query of the given form against the graph.
     */
    public QueryResult runQuery(Graph graph, String queryText, QueryForm form)
            throws QuerySyntaxException, QueryEvaluationException {
        return queryEngine.run(graph, queryText, form);
    }

    public String toNTriples(Graph graph) {
        return GraphSerializer.toNTriples(graph);
    }

    public String toTurtle(Graph graph) {
        return GraphSerializer.toTurtle(graph, namespaces);
    }
}
