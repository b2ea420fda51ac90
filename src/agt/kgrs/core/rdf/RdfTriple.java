package kgrs.core.rdf;

import java.util.Objects;

/**
 * A stored RDF triple.
 * Subject, predicate, and object are concrete terms; variables are rejected.
 */
public class RdfTriple {

    public final Term subject;
    public final Term predicate;
    public final Term object;

    /**
     * Create an RDF triple.
     *
     * @param subject Subject IRI or blank node
     * @param predicate Predicate IRI
     * @param object Object IRI, blank node, or literal
     */
    public RdfTriple(Term subject, Term predicate, Term object) {
        this.subject = requireConcrete(subject, "Subject");
        this.predicate = requireConcrete(predicate, "Predicate");
        this.object = requireConcrete(object, "Object");
    }

    private static Term requireConcrete(Term term, String position) {
        Objects.requireNonNull(term, position + " cannot be null");
        if (term.isVariable()) {
            throw new IllegalArgumentException(position + " of a stored triple cannot be a variable: " + term);
        }
        return term;
    }

    /**
     * One N-Triples statement, terminated by " .".
     */
    public String toNTriples() {
        return subject.toNTriples() + " " + predicate.toNTriples() + " " + object.toNTriples() + " .";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof RdfTriple)) return false;
        RdfTriple other = (RdfTriple) obj;
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
        return String.format("%s %s %s", subject, predicate, object);
    }
}
