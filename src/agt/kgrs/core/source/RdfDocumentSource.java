package kgrs.core.source;

import kgrs.core.error.ExtractionFailedException;
import kgrs.core.error.SourceUnavailableException;
import kgrs.core.rdf.Graph;
import kgrs.core.rdf.JenaGraphAdapter;
import org.apache.jena.atlas.RuntimeIOException;
import org.apache.jena.atlas.web.HttpException;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFLanguages;
import org.apache.jena.riot.RiotException;
import org.apache.jena.riot.RiotNotFoundException;

import java.io.IOException;
import java.io.InputStream;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads RDF documents (Turtle, N-Triples, RDF/XML, JSON-LD) with Jena.
 * The syntax is chosen from the file extension or HTTP content type,
 * defaulting to Turtle for classpath resources.
 */
public class RdfDocumentSource implements GraphSource {

    private static final Logger logger = Logger.getLogger(RdfDocumentSource.class.getName());

    @Override
    public Graph load(String location) throws SourceUnavailableException, ExtractionFailedException {
        if (location == null || location.isBlank()) {
            throw new SourceUnavailableException(String.valueOf(location),
                new IllegalArgumentException("No source location given"));
        }

        Model model = ModelFactory.createDefaultModel();
        try {
            if (location.startsWith("classpath:")) {
                readClasspath(model, location.substring("classpath:".length()));
            } else {
                RDFDataMgr.read(model, location);
            }
        } catch (RiotNotFoundException | HttpException | RuntimeIOException e) {
            logger.log(Level.SEVERE, "Network error fetching " + location, e);
            throw new SourceUnavailableException(location, e);
        } catch (RiotException e) {
            logger.log(Level.SEVERE, "Error parsing RDF from " + location, e);
            throw new ExtractionFailedException(location, e);
        }

        Graph graph = JenaGraphAdapter.fromModel(model);
        logger.info("Successfully parsed RDF from " + location);
        logger.info("Parsed graph contains " + graph.size() + " triples");
        return graph;
    }

    private void readClasspath(Model model, String resourcePath) throws SourceUnavailableException {
        InputStream in = RdfDocumentSource.class.getClassLoader().getResourceAsStream(resourcePath);
        if (in == null) {
            throw new SourceUnavailableException("classpath:" + resourcePath,
                new IOException("Classpath resource not found: " + resourcePath));
        }
        Lang lang = RDFLanguages.filenameToLang(resourcePath, Lang.TURTLE);
        try (InputStream stream = in) {
            RDFDataMgr.read(model, stream, lang);
        } catch (IOException e) {
            throw new SourceUnavailableException("classpath:" + resourcePath, e);
        }
    }
}
