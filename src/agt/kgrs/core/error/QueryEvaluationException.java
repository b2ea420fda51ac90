package kgrs.core.error;

/**
 * A well-formed query that cannot be evaluated: unsupported form or
 * feature, or a form other than the one requested.
 */
public class QueryEvaluationException extends ReasoningException {

    public QueryEvaluationException(String message, String queryText) {
        super(Stage.QUERY, message, queryText, null);
    }
}
