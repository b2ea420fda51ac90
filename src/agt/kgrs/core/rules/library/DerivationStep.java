package kgrs.core.rules.library;

import kgrs.core.rdf.Graph;

/**
 * A named, fixed derivation over the library vocabulary.
 * Steps read the graph and return what they derive; they never modify it.
 */
public interface DerivationStep {

    String getId();

    /**
     * Derive triples from a snapshot of the working graph.
     *
     * @param graph Snapshot to read
     * @param vocab Library terms
     * @return Newly derived triples (may overlap with the graph)
     */
    Graph derive(Graph graph, LibraryVocabulary vocab);
}
