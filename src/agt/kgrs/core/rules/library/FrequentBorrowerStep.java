package kgrs.core.rules.library;

import kgrs.core.rdf.Graph;
import kgrs.core.rdf.RdfTriple;
import kgrs.core.rdf.Term;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A member borrowing more than one loan is typed FrequentBorrower.
 */
public class FrequentBorrowerStep implements DerivationStep {

    public static final String ID = "frequent-borrower";

    /** Loans a member needs to exceed */
    public static final int THRESHOLD = 1;

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Graph derive(Graph graph, LibraryVocabulary vocab) {
        Map<Term, Set<Term>> memberLoans = new LinkedHashMap<>();
        for (RdfTriple t : graph.find(null, vocab.borrowedBy, null)) {
            memberLoans.computeIfAbsent(t.object, k -> new LinkedHashSet<>()).add(t.subject);
        }

        Graph derived = new Graph();
        memberLoans.forEach((member, loans) -> {
            if (loans.size() > THRESHOLD) {
                derived.add(member, vocab.type, vocab.frequentBorrower);
            }
        });
        return derived;
    }
}
