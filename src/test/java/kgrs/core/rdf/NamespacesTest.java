package kgrs.core.rdf;

import kgrs.core.error.UnresolvedPrefixException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NamespacesTest {

    private final Namespaces namespaces = Namespaces.builder()
        .prefix("schema", "http://schema.org/")
        .defaultNamespace("ex", "http://example.org/")
        .build();

    @Test
    public void resolvesDeclaredPrefixes() throws Exception {
        assertEquals(Term.iri("http://schema.org/name"), namespaces.resolve("schema:name"));
        assertEquals(Term.iri("http://example.org/hasAuthor"), namespaces.resolve("ex:hasAuthor"));
        assertEquals(Namespaces.RDF_TYPE, namespaces.resolve("rdf:type"));
    }

    @Test
    public void bareNamesUseTheDefaultNamespace() throws Exception {
        assertEquals(Term.iri("http://example.org/wrote"), namespaces.resolve("wrote"));
    }

    @Test
    public void unknownPrefixFails() {
        UnresolvedPrefixException e =
            assertThrows(UnresolvedPrefixException.class, () -> namespaces.resolve("foo:bar"));
        assertEquals("foo", e.getPrefix());
    }

    @Test
    public void fullIriDetection() {
        assertTrue(Namespaces.isFullIri("http://example.org/x"));
        assertTrue(Namespaces.isFullIri("urn:isbn:123"));
        assertFalse(Namespaces.isFullIri("ex:x"));
    }

    @Test
    public void loaderReadsBundledPrefixes() {
        Namespaces loaded = NamespaceLoader.loadDefault("lib", "http://library.example/");

        assertTrue(loaded.hasPrefix("schema"));
        assertTrue(loaded.hasPrefix("foaf"));
        assertEquals("http://library.example/", loaded.getPrefixMap().get("lib"));
        assertEquals("http://library.example/", loaded.getDefaultNamespace());
    }

    @Test
    public void loaderSkipsMissingSources() {
        Namespaces loaded = NamespaceLoader.load("ex", "http://example.org/", "classpath:does-not-exist.ttl");

        assertEquals("http://example.org/", loaded.getDefaultNamespace());
        assertTrue(loaded.hasPrefix("rdf"));
    }
}
