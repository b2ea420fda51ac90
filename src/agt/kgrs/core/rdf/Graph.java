package kgrs.core.rdf;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * A set of RDF triples.
 *
 * Adding a triple that is already present is a no-op. Iteration follows
 * insertion order so results are reproducible, but equality is plain set
 * equality. Triples are additionally indexed by subject.
 *
 * Not thread-safe: a graph is owned by one invocation at a time.
 */
public class Graph implements Iterable<RdfTriple> {

    private final Set<RdfTriple> triples = new LinkedHashSet<>();
    private final Map<Term, List<RdfTriple>> subjectIndex = new HashMap<>();

    public Graph() {}

    public Graph(Collection<RdfTriple> initial) {
        addAll(initial);
    }

    public static Graph of(RdfTriple... triples) {
        Graph graph = new Graph();
        for (RdfTriple t : triples) {
            graph.add(t);
        }
        return graph;
    }

    /**
     * Add a triple.
     *
     * @return true if the graph changed
     */
    public boolean add(RdfTriple triple) {
        Objects.requireNonNull(triple, "Triple cannot be null");
        if (!triples.add(triple)) {
            return false;
        }
        subjectIndex.computeIfAbsent(triple.subject, k -> new ArrayList<>()).add(triple);
        return true;
    }

    public boolean add(Term subject, Term predicate, Term object) {
        return add(new RdfTriple(subject, predicate, object));
    }

    /**
     * Add all triples.
     *
     * @return number of triples that were not yet present
     */
    public int addAll(Iterable<RdfTriple> source) {
        int added = 0;
        for (RdfTriple t : source) {
            if (add(t)) added++;
        }
        return added;
    }

    public boolean contains(RdfTriple triple) {
        return triples.contains(triple);
    }

    public boolean contains(Term subject, Term predicate, Term object) {
        return triples.contains(new RdfTriple(subject, predicate, object));
    }

    public int size() {
        return triples.size();
    }

    public boolean isEmpty() {
        return triples.isEmpty();
    }

    /**
     * Find triples matching a pattern.
     *
     * @param subject Subject or null for wildcard
     * @param predicate Predicate or null for wildcard
     * @param object Object or null for wildcard
     * @return Matching triples in insertion order
     */
    public List<RdfTriple> find(Term subject, Term predicate, Term object) {
        Collection<RdfTriple> candidates = subject == null
                ? triples
                : subjectIndex.getOrDefault(subject, Collections.emptyList());

        List<RdfTriple> result = new ArrayList<>();
        for (RdfTriple t : candidates) {
            if ((predicate == null || predicate.equals(t.predicate))
                    && (object == null || object.equals(t.object))
                    && (subject == null || subject.equals(t.subject))) {
                result.add(t);
            }
        }
        return result;
    }

    /**
     * Subjects having the given predicate and object, in insertion order, without duplicates.
     */
    public List<Term> subjects(Term predicate, Term object) {
        Set<Term> result = new LinkedHashSet<>();
        for (RdfTriple t : find(null, predicate, object)) {
            result.add(t.subject);
        }
        return new ArrayList<>(result);
    }

    /**
     * Objects of the given subject and predicate, in insertion order, without duplicates.
     */
    public List<Term> objects(Term subject, Term predicate) {
        Set<Term> result = new LinkedHashSet<>();
        for (RdfTriple t : find(subject, predicate, null)) {
            result.add(t.object);
        }
        return new ArrayList<>(result);
    }

    /**
     * Independent snapshot of this graph.
     */
    public Graph copy() {
        return new Graph(triples);
    }

    public Stream<RdfTriple> stream() {
        return triples.stream();
    }

    @Override
    public Iterator<RdfTriple> iterator() {
        return Collections.unmodifiableSet(triples).iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Graph)) return false;
        return triples.equals(((Graph) obj).triples);
    }

    @Override
    public int hashCode() {
        return triples.hashCode();
    }

    @Override
    public String toString() {
        return String.format("Graph{%d triples}", triples.size());
    }
}
