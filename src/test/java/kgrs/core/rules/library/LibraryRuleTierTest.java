package kgrs.core.rules.library;

import kgrs.LibraryFixtures;
import kgrs.core.rdf.Graph;
import kgrs.core.rdf.Namespaces;
import kgrs.core.rdf.RdfTriple;
import kgrs.core.rules.RuleMode;
import kgrs.core.rules.RuleTrace;
import org.junit.jupiter.api.Test;

import java.util.List;

import static kgrs.LibraryFixtures.ex;
import static kgrs.LibraryFixtures.library;
import static org.junit.jupiter.api.Assertions.*;

public class LibraryRuleTierTest {

    private final LibraryVocabulary vocab = LibraryVocabulary.of(LibraryFixtures.namespaces());

    private Graph apply(LibraryRuleTier tier, Graph graph) {
        Graph working = graph.copy();
        tier.apply(working, RuleMode.none(), RuleTrace.builder(working.size()));
        return working;
    }

    @Test
    public void basic_derivesAuthorshipRelatednessAndFrequentBorrowers() {
        Graph input = library();
        Graph out = apply(LibraryRuleTier.basic(vocab), input);

        assertTrue(out.contains(ex("Alice"), ex("wrote"), ex("Book1")));
        assertTrue(out.contains(ex("Alice"), ex("wrote"), ex("Book2")));
        assertTrue(out.contains(ex("Book1"), ex("relatedTo"), ex("Book2")));
        assertTrue(out.contains(ex("Book2"), ex("relatedTo"), ex("Book1")));
        assertTrue(out.contains(ex("Bob"), Namespaces.RDF_TYPE, ex("FrequentBorrower")));
        assertEquals(input.size() + 5, out.size());
        for (RdfTriple t : input) {
            assertTrue(out.contains(t));
        }
    }

    @Test
    public void basic_reapplyingAddsNothing() {
        LibraryRuleTier tier = LibraryRuleTier.basic(vocab);
        Graph once = apply(tier, library());
        Graph twice = apply(tier, once);

        assertEquals(once, twice);
    }

    @Test
    public void authorInversion_oneWroteTriplePerHasAuthor() {
        Graph g = library();
        g.add(ex("Book3"), ex("hasAuthor"), ex("Carol"));
        g.add(ex("Book3"), ex("hasAuthor"), ex("Dan"));

        Graph derived = new AuthorInversionStep().derive(g, vocab);

        assertEquals(4, derived.size());
        assertEquals(g.find(null, ex("hasAuthor"), null).size(), derived.find(null, ex("wrote"), null).size());
        for (RdfTriple t : g.find(null, ex("hasAuthor"), null)) {
            assertTrue(derived.contains(t.object, ex("wrote"), t.subject));
        }
    }

    @Test
    public void genreCoMembership_isSymmetricAndIrreflexive() {
        Graph g = library();
        g.add(ex("Book3"), ex("hasGenre"), ex("SciFi"));
        g.add(ex("Book4"), ex("hasGenre"), ex("Poetry"));

        Graph derived = new GenreCoMembershipStep().derive(g, vocab);

        assertEquals(6, derived.size());
        for (RdfTriple t : derived) {
            assertNotEquals(t.subject, t.object);
            assertTrue(derived.contains(t.object, ex("relatedTo"), t.subject));
        }
        assertTrue(derived.find(ex("Book4"), null, null).isEmpty());
    }

    @Test
    public void frequentBorrower_needsMoreThanOneLoan() {
        Graph g = new Graph();
        g.add(ex("Loan1"), ex("borrowedBy"), ex("Bob"));
        g.add(ex("Loan2"), ex("borrowedBy"), ex("Bob"));
        g.add(ex("Loan3"), ex("borrowedBy"), ex("Bob"));
        g.add(ex("Loan4"), ex("borrowedBy"), ex("Eve"));

        Graph derived = new FrequentBorrowerStep().derive(g, vocab);

        assertEquals(1, derived.size());
        assertTrue(derived.contains(ex("Bob"), Namespaces.RDF_TYPE, ex("FrequentBorrower")));
    }

    @Test
    public void frequentBorrower_noLoansNoType() {
        assertTrue(new FrequentBorrowerStep().derive(new Graph(), vocab).isEmpty());
    }

    @Test
    public void advanced_addsExpertiseAndPreferenceRecommendations() {
        Graph g = library();
        g.add(ex("Book1"), Namespaces.RDF_TYPE, ex("Book"));
        g.add(ex("Carol"), Namespaces.RDF_TYPE, ex("User"));
        g.add(ex("Carol"), ex("prefersGenre"), ex("SciFi"));

        Graph out = apply(LibraryRuleTier.advanced(vocab, RecommendationStep.Variant.PREFERENCE), g);

        // basic steps still run
        assertTrue(out.contains(ex("Alice"), ex("wrote"), ex("Book1")));
        assertTrue(out.contains(ex("Alice"), ex("hasExpertise"), ex("SciFi")));
        assertTrue(out.contains(ex("Book1"), ex("recommendedFor"), ex("Carol")));
        assertTrue(out.contains(ex("Book2"), ex("recommendedFor"), ex("Carol")));
    }

    @Test
    public void advanced_expertiseOnlyForTypedBooks() {
        Graph out = apply(LibraryRuleTier.advanced(vocab, RecommendationStep.Variant.PREFERENCE), library());

        assertTrue(out.find(null, ex("hasExpertise"), null).isEmpty());
    }

    @Test
    public void borrowingRecommendation_usesTheLoanedBooksGenres() {
        Graph g = library();
        g.add(ex("Book3"), ex("hasGenre"), ex("Poetry"));
        g.add(ex("Loan1"), Namespaces.RDF_TYPE, ex("Loan"));
        g.add(ex("Loan1"), ex("loanOf"), ex("Book1"));

        Graph derived = new RecommendationStep(RecommendationStep.Variant.BORROWING).derive(g, vocab);

        assertEquals(2, derived.size());
        assertTrue(derived.contains(ex("Book1"), ex("recommendedFor"), ex("Bob")));
        assertTrue(derived.contains(ex("Book2"), ex("recommendedFor"), ex("Bob")));
        assertFalse(derived.contains(ex("Book3"), ex("recommendedFor"), ex("Bob")));
    }

    @Test
    public void borrowingRecommendation_loanWithoutBookMatchesBooksOfAnyGenre() {
        Graph g = new Graph();
        g.add(ex("Loan1"), Namespaces.RDF_TYPE, ex("Loan"));
        g.add(ex("Loan1"), ex("borrowedBy"), ex("Bob"));
        g.add(ex("Book1"), ex("hasGenre"), ex("SciFi"));

        Graph out = apply(LibraryRuleTier.advanced(vocab, RecommendationStep.Variant.BORROWING), g);

        assertTrue(out.contains(ex("Book1"), ex("recommendedFor"), ex("Bob")));
    }

    @Test
    public void borrowingRecommendation_loanWithoutBookUsesEveryGenre() {
        Graph g = library();
        g.add(ex("Book3"), ex("hasGenre"), ex("Poetry"));
        g.add(ex("Loan2"), Namespaces.RDF_TYPE, ex("Loan"));

        Graph derived = new RecommendationStep(RecommendationStep.Variant.BORROWING).derive(g, vocab);

        assertEquals(3, derived.size());
        assertTrue(derived.contains(ex("Book1"), ex("recommendedFor"), ex("Bob")));
        assertTrue(derived.contains(ex("Book2"), ex("recommendedFor"), ex("Bob")));
        assertTrue(derived.contains(ex("Book3"), ex("recommendedFor"), ex("Bob")));
    }

    @Test
    public void traceRecordsEveryStep() {
        LibraryRuleTier tier = LibraryRuleTier.advanced(vocab, RecommendationStep.Variant.PREFERENCE);
        Graph working = library();
        RuleTrace.Builder builder = RuleTrace.builder(working.size());

        tier.apply(working, RuleMode.advanced(), builder);
        RuleTrace trace = builder.outputSize(working.size()).build();

        List<RuleTrace.StepRecord> steps = trace.getSteps();
        assertEquals(5, steps.size());
        assertEquals(AuthorInversionStep.ID, steps.get(0).getStepId());
        assertEquals("recommendation-preference", steps.get(4).getStepId());
        assertEquals(2, steps.get(0).getTriplesAdded());
        assertEquals(5, trace.getTriplesAdded());
    }
}
