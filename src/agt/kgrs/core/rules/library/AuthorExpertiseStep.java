package kgrs.core.rules.library;

import kgrs.core.rdf.Graph;
import kgrs.core.rdf.Term;

/**
 * Authors of typed books gain expertise in the genres of those books.
 */
public class AuthorExpertiseStep implements DerivationStep {

    public static final String ID = "author-expertise";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Graph derive(Graph graph, LibraryVocabulary vocab) {
        Graph derived = new Graph();
        for (Term book : graph.subjects(vocab.type, vocab.book)) {
            for (Term author : graph.objects(book, vocab.hasAuthor)) {
                for (Term genre : graph.objects(book, vocab.hasGenre)) {
                    derived.add(author, vocab.hasExpertise, genre);
                }
            }
        }
        return derived;
    }
}
