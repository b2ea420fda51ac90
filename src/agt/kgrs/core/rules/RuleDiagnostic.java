package kgrs.core.rules;

/**
 * Report of one declarative rule that was skipped.
 */
public class RuleDiagnostic {

    public final int lineNumber;    // 1-based line in the rule batch
    public final String ruleText;
    public final String message;

    public RuleDiagnostic(int lineNumber, String ruleText, String message) {
        this.lineNumber = lineNumber;
        this.ruleText = ruleText;
        this.message = message;
    }

    @Override
    public String toString() {
        return String.format("line %d: %s [%s]", lineNumber, message, ruleText);
    }
}
