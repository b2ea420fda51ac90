package kgrs.core.rdf;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;

import java.io.InputStream;
import java.util.logging.Logger;

/**
 * Loads prefix tables from RDF documents.
 * Only the {@code @prefix} declarations are kept; the statements are discarded.
 * Supports multiple sources: classpath resources, file paths, HTTP(S) URLs.
 */
public class NamespaceLoader {

    private static final Logger logger = Logger.getLogger(NamespaceLoader.class.getName());

    public static final String DEFAULT_SOURCE = "classpath:kgrs-namespaces.ttl";

    /**
     * Load prefixes from multiple sources.
     * Sources are processed in order; later declarations override earlier ones.
     * The default namespace always wins over a loaded binding of the same prefix.
     *
     * @param defaultPrefix Prefix bound to the default namespace
     * @param defaultNamespace Namespace used for bare tokens
     * @param sources Source identifiers (URLs, file paths, or classpath: prefixed resources)
     * @return Loaded namespaces
     */
    public static Namespaces load(String defaultPrefix, String defaultNamespace, String... sources) {
        Model model = ModelFactory.createDefaultModel();

        for (String source : sources) {
            try {
                if (source.startsWith("http://") || source.startsWith("https://")) {
                    logger.info("Loading namespaces from URL: " + source);
                    model.read(source);
                } else if (source.startsWith("classpath:")) {
                    String resourcePath = source.substring("classpath:".length());
                    InputStream in = NamespaceLoader.class
                        .getClassLoader()
                        .getResourceAsStream(resourcePath);
                    if (in != null) {
                        logger.info("Loading namespaces from classpath: " + resourcePath);
                        try (InputStream stream = in) {
                            model.read(stream, null, "TURTLE");
                        }
                    } else {
                        logger.warning("Classpath resource not found: " + resourcePath);
                    }
                } else {
                    logger.info("Loading namespaces from file: " + source);
                    model.read(source);
                }
            } catch (Exception e) {
                logger.warning("Failed to load namespaces from " + source + ": " + e.getMessage());
            }
        }

        Namespaces namespaces = Namespaces.builder()
            .prefixes(model.getNsPrefixMap())
            .defaultNamespace(defaultPrefix, defaultNamespace)
            .build();
        logger.fine("Loaded " + namespaces);
        return namespaces;
    }

    /**
     * Load the built-in prefix table.
     */
    public static Namespaces loadDefault(String defaultPrefix, String defaultNamespace) {
        return load(defaultPrefix, defaultNamespace, DEFAULT_SOURCE);
    }
}
