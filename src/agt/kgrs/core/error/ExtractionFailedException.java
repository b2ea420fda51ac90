package kgrs.core.error;

/**
 * The input document was fetched but no graph could be extracted from it.
 */
public class ExtractionFailedException extends ReasoningException {

    public ExtractionFailedException(String source, Throwable cause) {
        super(Stage.SOURCE, "Error extracting triples from " + source
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""),
            source, cause);
    }
}
