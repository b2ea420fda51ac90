package kgrs.core.error;

/**
 * The input document could not be fetched or opened.
 */
public class SourceUnavailableException extends ReasoningException {

    public SourceUnavailableException(String source, Throwable cause) {
        super(Stage.SOURCE, "Could not fetch source: " + source
                + (cause != null && cause.getMessage() != null ? " - " + cause.getMessage() : ""),
            source, cause);
    }
}
