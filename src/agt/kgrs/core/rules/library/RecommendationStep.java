package kgrs.core.rules.library;

import kgrs.core.rdf.Graph;
import kgrs.core.rdf.RdfTriple;
import kgrs.core.rdf.Term;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Recommends books by genre, either to users by their stated preference or
 * to members by the genres of the books they borrowed.
 */
public class RecommendationStep implements DerivationStep {

    public static final String ID = "recommendation";

    /**
     * Where the target genres come from.
     */
    public enum Variant {
        /** Users typed User with a prefersGenre value */
        PREFERENCE,
        /** Members borrowing a Loan: genres of the loaned book (loanOf / hasBook), or any genre if none is named */
        BORROWING
    }

    private final Variant variant;

    public RecommendationStep() {
        this(Variant.PREFERENCE);
    }

    public RecommendationStep(Variant variant) {
        this.variant = variant;
    }

    public Variant getVariant() {
        return variant;
    }

    @Override
    public String getId() {
        return ID + "-" + variant.name().toLowerCase();
    }

    @Override
    public Graph derive(Graph graph, LibraryVocabulary vocab) {
        return variant == Variant.PREFERENCE ? byPreference(graph, vocab) : byBorrowing(graph, vocab);
    }

    private Graph byPreference(Graph graph, LibraryVocabulary vocab) {
        Graph derived = new Graph();
        for (Term user : graph.subjects(vocab.type, vocab.user)) {
            for (Term genre : graph.objects(user, vocab.prefersGenre)) {
                recommend(graph, vocab, genre, user, derived);
            }
        }
        return derived;
    }

    private Graph byBorrowing(Graph graph, LibraryVocabulary vocab) {
        Graph derived = new Graph();
        for (Term loan : graph.subjects(vocab.type, vocab.loan)) {
            List<Term> books = new ArrayList<>(graph.objects(loan, vocab.loanOf));
            books.addAll(graph.objects(loan, vocab.hasBook));

            // a loan naming no book matches every genre in the graph
            Set<Term> genres = new LinkedHashSet<>();
            if (books.isEmpty()) {
                for (RdfTriple t : graph.find(null, vocab.hasGenre, null)) {
                    genres.add(t.object);
                }
            } else {
                for (Term borrowed : books) {
                    genres.addAll(graph.objects(borrowed, vocab.hasGenre));
                }
            }

            for (Term member : graph.objects(loan, vocab.borrowedBy)) {
                for (Term genre : genres) {
                    recommend(graph, vocab, genre, member, derived);
                }
            }
        }
        return derived;
    }

    private void recommend(Graph graph, LibraryVocabulary vocab, Term genre, Term target, Graph derived) {
        for (Term book : graph.subjects(vocab.hasGenre, genre)) {
            derived.add(book, vocab.recommendedFor, target);
        }
    }
}
