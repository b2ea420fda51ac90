package kgrs.core.error;

/**
 * Malformed query text, undeclared prefix, or a pattern with the wrong arity.
 */
public class QuerySyntaxException extends ReasoningException {

    public QuerySyntaxException(String message, String queryText) {
        super(Stage.QUERY, message, queryText, null);
    }

    public QuerySyntaxException(String message, String queryText, Throwable cause) {
        super(Stage.QUERY, message, queryText, cause);
    }
}
