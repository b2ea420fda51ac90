package kgrs.core.rules;

import java.util.Locale;
import java.util.Objects;

/**
 * Selects which rule tier to apply.
 * A tagged variant: the {@link Kind} names the tier and the text tiers carry
 * their rule text as payload.
 *
 * Use the static factory methods to create instances:
 * - RuleMode.none()
 * - RuleMode.basic(), RuleMode.advanced()
 * - RuleMode.custom(text)
 * - RuleMode.declarative(text)
 */
public final class RuleMode {

    /**
     * Rule tiers.
     */
    public enum Kind {
        /** No rules; graph returned unchanged */
        NONE(false),
        /** Fixed library rule set: authorship, genres, borrowing */
        BASIC(false),
        /** BASIC plus expertise and recommendations */
        ADVANCED(false),
        /** Free-text IF/THEN rules handled by the heuristic matcher */
        CUSTOM(true),
        /** One declarative implication rule per line */
        DECLARATIVE(true);

        private final boolean takesText;

        Kind(boolean takesText) {
            this.takesText = takesText;
        }

        public boolean takesText() {
            return takesText;
        }
    }

    private static final RuleMode NONE = new RuleMode(Kind.NONE, "");
    private static final RuleMode BASIC = new RuleMode(Kind.BASIC, "");
    private static final RuleMode ADVANCED = new RuleMode(Kind.ADVANCED, "");

    private final Kind kind;
    private final String ruleText;

    private RuleMode(Kind kind, String ruleText) {
        this.kind = Objects.requireNonNull(kind);
        this.ruleText = ruleText == null ? "" : ruleText;
    }

    public static RuleMode none() {
        return NONE;
    }

    public static RuleMode basic() {
        return BASIC;
    }

    public static RuleMode advanced() {
        return ADVANCED;
    }

    public static RuleMode custom(String ruleText) {
        return new RuleMode(Kind.CUSTOM, ruleText);
    }

    public static RuleMode declarative(String ruleText) {
        return new RuleMode(Kind.DECLARATIVE, ruleText);
    }

    /**
     * Build a mode from a selector name (none, basic, advanced, custom, declarative; cwm is
     * accepted for declarative) and the accompanying rule text.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static RuleMode of(String name, String ruleText) {
        String key = name == null ? "none" : name.trim().toLowerCase(Locale.ROOT);
        switch (key) {
            case "":
            case "none":
                return none();
            case "basic":
                return basic();
            case "advanced":
                return advanced();
            case "custom":
                return custom(ruleText);
            case "declarative":
            case "cwm":
                return declarative(ruleText);
            default:
                throw new IllegalArgumentException("Unknown rule mode: " + name);
        }
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Rule text for CUSTOM and DECLARATIVE; empty otherwise.
     */
    public String getRuleText() {
        return ruleText;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RuleMode)) return false;
        RuleMode other = (RuleMode) obj;
        return kind == other.kind && ruleText.equals(other.ruleText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, ruleText);
    }

    @Override
    public String toString() {
        return kind.takesText()
            ? "RuleMode{" + kind + ", " + ruleText.lines().count() + " lines}"
            : "RuleMode{" + kind + "}";
    }
}
