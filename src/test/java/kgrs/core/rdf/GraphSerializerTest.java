package kgrs.core.rdf;

import kgrs.LibraryFixtures;
import org.junit.jupiter.api.Test;

import static kgrs.LibraryFixtures.ex;
import static org.junit.jupiter.api.Assertions.*;

public class GraphSerializerTest {

    @Test
    public void nTriples_oneStatementPerLine() {
        Graph g = new Graph();
        g.add(ex("Book1"), ex("title"), Term.literal("Dune"));
        g.add(ex("Book1"), ex("hasAuthor"), ex("Alice"));

        String text = GraphSerializer.toNTriples(g);

        assertEquals(
            "<http://example.org/Book1> <http://example.org/title> \"Dune\" .\n" +
            "<http://example.org/Book1> <http://example.org/hasAuthor> <http://example.org/Alice> .\n",
            text);
    }

    @Test
    public void nTriples_emptyGraph() {
        assertEquals("", GraphSerializer.toNTriples(new Graph()));
    }

    @Test
    public void turtle_usesDeclaredPrefixes() {
        String turtle = GraphSerializer.toTurtle(LibraryFixtures.library(), LibraryFixtures.namespaces());

        assertTrue(turtle.contains("@prefix ex:"));
        assertTrue(turtle.contains("ex:hasAuthor"));
    }

    @Test
    public void jenaRoundTripKeepsLiteralsExact() {
        Graph g = new Graph();
        g.add(ex("a"), ex("label"), Term.langLiteral("chat", "fr"));
        g.add(ex("a"), ex("count"), Term.typedLiteral("3", Namespaces.XSD_NS + "integer"));
        g.add(ex("a"), ex("name"), Term.literal("plain"));

        Graph back = JenaGraphAdapter.fromModel(JenaGraphAdapter.toModel(g, LibraryFixtures.namespaces()));

        assertEquals(g, back);
    }
}
