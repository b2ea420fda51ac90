package kgrs.core.error;

/**
 * Malformed declarative or heuristic rule text.
 */
public class RuleSyntaxException extends ReasoningException {

    private final int lineNumber;

    public RuleSyntaxException(String message, String ruleText) {
        this(message, ruleText, -1, null);
    }

    public RuleSyntaxException(String message, String ruleText, Throwable cause) {
        this(message, ruleText, -1, cause);
    }

    public RuleSyntaxException(String message, String ruleText, int lineNumber, Throwable cause) {
        super(Stage.RULES, message, ruleText, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * 1-based line in the rule batch, or -1 if unknown.
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
