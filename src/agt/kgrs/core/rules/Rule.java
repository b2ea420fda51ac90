package kgrs.core.rules;

import kgrs.core.query.TriplePattern;

import java.util.List;
import java.util.Objects;

/**
 * A declarative implication rule: when the antecedent patterns match,
 * the consequent templates are instantiated with the resulting bindings.
 */
public class Rule {

    private final List<TriplePattern> antecedent;
    private final List<TriplePattern> consequent;
    private final String source;

    public Rule(List<TriplePattern> antecedent, List<TriplePattern> consequent, String source) {
        this.antecedent = List.copyOf(antecedent);
        this.consequent = List.copyOf(consequent);
        this.source = Objects.requireNonNull(source);
    }

    public List<TriplePattern> getAntecedent() {
        return antecedent;
    }

    public List<TriplePattern> getConsequent() {
        return consequent;
    }

    /**
     * The rule text this rule was parsed from.
     */
    public String getSource() {
        return source;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Rule)) return false;
        Rule other = (Rule) obj;
        return antecedent.equals(other.antecedent) && consequent.equals(other.consequent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(antecedent, consequent);
    }

    @Override
    public String toString() {
        return "Rule{" + antecedent + " => " + consequent + "}";
    }
}
