package kgrs.core.source;

import kgrs.core.error.ExtractionFailedException;
import kgrs.core.error.SourceUnavailableException;
import kgrs.core.rdf.Graph;

/**
 * Produces the initial graph handed to the reasoning core.
 * Implementations fetch a document and extract its triples; the core itself
 * never performs I/O.
 */
public interface GraphSource {

    /**
     * Load a graph.
     *
     * @param location Source identifier (URL, file path, or classpath: resource)
     * @return A new graph owned by the caller
     * @throws SourceUnavailableException if the document cannot be fetched
     * @throws ExtractionFailedException if the document holds no readable RDF
     */
    Graph load(String location) throws SourceUnavailableException, ExtractionFailedException;
}
