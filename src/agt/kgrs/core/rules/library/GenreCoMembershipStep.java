package kgrs.core.rules.library;

import kgrs.core.rdf.Graph;
import kgrs.core.rdf.RdfTriple;
import kgrs.core.rdf.Term;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Subjects sharing a genre are related to each other, in both directions,
 * never to themselves.
 */
public class GenreCoMembershipStep implements DerivationStep {

    public static final String ID = "genre-co-membership";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Graph derive(Graph graph, LibraryVocabulary vocab) {
        Map<Term, Set<Term>> genreMembers = new LinkedHashMap<>();
        for (RdfTriple t : graph.find(null, vocab.hasGenre, null)) {
            genreMembers.computeIfAbsent(t.object, k -> new LinkedHashSet<>()).add(t.subject);
        }

        Graph derived = new Graph();
        for (Set<Term> members : genreMembers.values()) {
            for (Term first : members) {
                for (Term second : members) {
                    if (!first.equals(second)) {
                        derived.add(first, vocab.relatedTo, second);
                    }
                }
            }
        }
        return derived;
    }
}
