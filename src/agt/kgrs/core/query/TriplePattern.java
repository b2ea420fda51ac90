package kgrs.core.query;

import kgrs.core.rdf.RdfTriple;
import kgrs.core.rdf.Term;

import java.util.Objects;
import java.util.Optional;

/**
 * A triple whose positions may hold variables.
 * Used on the matching side (antecedents, WHERE clauses) and, as a template,
 * on the producing side (consequents, CONSTRUCT templates).
 */
public class TriplePattern {

    public final Term subject;
    public final Term predicate;
    public final Term object;

    public TriplePattern(Term subject, Term predicate, Term object) {
        this.subject = Objects.requireNonNull(subject, "Subject cannot be null");
        this.predicate = Objects.requireNonNull(predicate, "Predicate cannot be null");
        this.object = Objects.requireNonNull(object, "Object cannot be null");
    }


    /**
     * Replace variables bound in the row by their values.
     */
    public TriplePattern substitute(Binding binding) {
        return new TriplePattern(binding.resolve(subject), binding.resolve(predicate), binding.resolve(object));
    }

    /**
     * Instantiate this pattern as a template.
     *
     * @return the concrete triple, or empty if a variable is unbound in the row
     *         or the result would have a literal subject or a non-IRI predicate
     */
    public Optional<RdfTriple> instantiate(Binding binding) {
        Term s = binding.resolve(subject);
        Term p = binding.resolve(predicate);
        Term o = binding.resolve(object);
        if (s.isVariable() || p.isVariable() || o.isVariable()) {
            return Optional.empty();
        }
        if (s.isLiteral() || !p.isIri()) {
            return Optional.empty();
        }
        return Optional.of(new RdfTriple(s, p, o));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TriplePattern)) return false;
        TriplePattern other = (TriplePattern) obj;
        return subject.equals(other.subject)
            && predicate.equals(other.predicate)
            && object.equals(other.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, predicate, object);
    }

    @Override
    public String toString() {
        return subject + " " + predicate + " " + object;
    }
}
