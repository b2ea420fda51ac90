package kgrs.core.rdf;

import kgrs.core.error.UnresolvedPrefixException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Prefix table used to resolve compact identifiers such as {@code ex:hasAuthor}.
 * Exactly one default namespace is configured; bare tokens in rules resolve
 * against it. The well-known rdf, rdfs, xsd and owl prefixes are always present.
 */
public class Namespaces {

    public static final String RDF_NS = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
    public static final String RDFS_NS = "http://www.w3.org/2000/01/rdf-schema#";
    public static final String XSD_NS = "http://www.w3.org/2001/XMLSchema#";
    public static final String OWL_NS = "http://www.w3.org/2002/07/owl#";

    public static final Term.Iri RDF_TYPE = Term.iri(RDF_NS + "type");

    private final Map<String, String> prefixes;
    private final String defaultPrefix;
    private final String defaultNamespace;

    private Namespaces(Builder builder) {
        Map<String, String> map = new LinkedHashMap<>();
        map.put("rdf", RDF_NS);
        map.put("rdfs", RDFS_NS);
        map.put("xsd", XSD_NS);
        map.put("owl", OWL_NS);
        map.putAll(builder.prefixes);
        map.put(builder.defaultPrefix, builder.defaultNamespace);
        this.prefixes = Collections.unmodifiableMap(map);
        this.defaultPrefix = builder.defaultPrefix;
        this.defaultNamespace = builder.defaultNamespace;
    }

    public String getDefaultNamespace() {
        return defaultNamespace;
    }

    public String getDefaultPrefix() {
        return defaultPrefix;
    }

    public Map<String, String> getPrefixMap() {
        return prefixes;
    }

    public boolean hasPrefix(String prefix) {
        return prefixes.containsKey(prefix);
    }

    /**
     * Resolve a compact identifier {@code prefix:local} to a full IRI.
     *
     * @throws UnresolvedPrefixException if the prefix is not declared
     */
    public Term.Iri resolve(String compact) throws UnresolvedPrefixException {
        int colon = compact.indexOf(':');
        if (colon < 0) {
            return inDefault(compact);
        }
        String prefix = compact.substring(0, colon);
        String base = prefixes.get(prefix);
        if (base == null) {
            throw new UnresolvedPrefixException(prefix, compact);
        }
        return Term.iri(base + compact.substring(colon + 1));
    }

    /**
     * IRI for a local name in the default namespace.
     */
    public Term.Iri inDefault(String localName) {
        return Term.iri(defaultNamespace + localName);
    }

    /**
     * True if the token looks like a full IRI (carries a URI scheme) rather than a compact name.
     */
    public static boolean isFullIri(String token) {
        return token.contains("://") || token.startsWith("urn:") || token.startsWith("mailto:");
    }

    /**
     * Namespaces with only the given default namespace.
     */
    public static Namespaces withDefault(String prefix, String namespace) {
        return builder().defaultNamespace(prefix, namespace).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "Namespaces{default=" + defaultPrefix + ":<" + defaultNamespace + ">, prefixes=" + prefixes.keySet() + "}";
    }

    public static class Builder {
        private final Map<String, String> prefixes = new LinkedHashMap<>();
        private String defaultPrefix = "ex";
        private String defaultNamespace = "http://example.org/";

        public Builder prefix(String prefix, String namespace) {
            prefixes.put(Objects.requireNonNull(prefix), Objects.requireNonNull(namespace));
            return this;
        }

        public Builder prefixes(Map<String, String> map) {
            map.forEach(this::prefix);
            return this;
        }

        /**
         * Set the default namespace and the prefix bound to it.
         */
        public Builder defaultNamespace(String prefix, String namespace) {
            this.defaultPrefix = Objects.requireNonNull(prefix);
            this.defaultNamespace = Objects.requireNonNull(namespace);
            return this;
        }

        public Namespaces build() {
            return new Namespaces(this);
        }
    }
}
