package kgrs.core.error;

/**
 * Base class of all errors reported by the reasoning core.
 * Carries the stage that failed and, when known, the offending fragment
 * (rule line or query text).
 */
public abstract class ReasoningException extends Exception {

    /**
     * Processing stage an error originates from.
     */
    public enum Stage {
        /** Loading or extracting the input graph */
        SOURCE,
        /** Applying a rule tier */
        RULES,
        /** Compiling or evaluating a query */
        QUERY
    }

    private final Stage stage;
    private final String fragment;

    protected ReasoningException(Stage stage, String message, String fragment, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.fragment = fragment;
    }

    public Stage getStage() {
        return stage;
    }

    /**
     * The rule line or query text that failed, or null.
     */
    public String getFragment() {
        return fragment;
    }
}
