package kgrs.core.error;

/**
 * A compact identifier uses a prefix that is not declared.
 */
public class UnresolvedPrefixException extends ReasoningException {

    private final String prefix;

    public UnresolvedPrefixException(String prefix, String compactName) {
        super(Stage.RULES, "Unresolved prefix '" + prefix + ":' in " + compactName, compactName, null);
        this.prefix = prefix;
    }

    public String getPrefix() {
        return prefix;
    }
}
