package kgrs.core.query;

import kgrs.core.rdf.Term;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One solution row: an assignment of variables to concrete terms.
 * Bindings are immutable; {@link #tryBind} returns an extended copy.
 */
public final class Binding {

    private static final Binding EMPTY = new Binding(Collections.emptyMap());

    private final Map<Term.Variable, Term> values;

    private Binding(Map<Term.Variable, Term> values) {
        this.values = values;
    }

    public static Binding empty() {
        return EMPTY;
    }

    public Term get(Term.Variable variable) {
        return values.get(variable);
    }

    public Term get(String variableName) {
        return values.get(Term.variable(variableName));
    }

    public boolean isBound(Term.Variable variable) {
        return values.containsKey(variable);
    }

    public Set<Term.Variable> variables() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    /**
     * Resolve a term against this row: bound variables are replaced, everything else is returned as is.
     */
    public Term resolve(Term term) {
        if (term.isVariable()) {
            Term bound = values.get(term.asVariable());
            return bound != null ? bound : term;
        }
        return term;
    }

    /**
     * Bind {@code term} to {@code value} if it is a variable.
     *
     * @return the extended row, this row if nothing had to be bound,
     *         or null if the variable is already bound to a different value
     */
    public Binding tryBind(Term term, Term value) {
        if (!term.isVariable()) {
            return this;
        }
        Term.Variable var = term.asVariable();
        Term existing = values.get(var);
        if (existing != null) {
            return existing.equals(value) ? this : null; // must match existing binding
        }
        Map<Term.Variable, Term> extended = new LinkedHashMap<>(values);
        extended.put(var, value);
        return new Binding(Collections.unmodifiableMap(extended));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Binding)) return false;
        return values.equals(((Binding) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        values.forEach((k, v) -> {
            if (sb.length() > 1) sb.append(", ");
            sb.append(k).append('=').append(v);
        });
        return sb.append('}').toString();
    }
}
