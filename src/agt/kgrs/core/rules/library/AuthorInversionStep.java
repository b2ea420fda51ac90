package kgrs.core.rules.library;

import kgrs.core.rdf.Graph;
import kgrs.core.rdf.RdfTriple;

/**
 * (book hasAuthor author) gives (author wrote book).
 */
public class AuthorInversionStep implements DerivationStep {

    public static final String ID = "author-inversion";

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public Graph derive(Graph graph, LibraryVocabulary vocab) {
        Graph derived = new Graph();
        for (RdfTriple t : graph.find(null, vocab.hasAuthor, null)) {
            derived.add(t.object, vocab.wrote, t.subject);
        }
        return derived;
    }
}
