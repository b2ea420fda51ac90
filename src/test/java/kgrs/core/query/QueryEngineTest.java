package kgrs.core.query;

import kgrs.LibraryFixtures;
import kgrs.core.error.QueryEvaluationException;
import kgrs.core.error.QuerySyntaxException;
import kgrs.core.error.ReasoningException;
import kgrs.core.rdf.Graph;
import kgrs.core.rdf.RdfTriple;
import kgrs.core.rdf.Term;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static kgrs.LibraryFixtures.NS;
import static kgrs.LibraryFixtures.ex;
import static kgrs.LibraryFixtures.library;
import static org.junit.jupiter.api.Assertions.*;

public class QueryEngineTest {

    private final QueryEngine engine = new QueryEngine(LibraryFixtures.namespaces());

    @Test
    public void select_authorsOfBooks() throws Exception {
        QueryResult.SelectResult result = engine.run(library(),
            "SELECT ?b ?a WHERE { ?b ex:hasAuthor ?a }", QueryForm.SELECT).asSelect();

        assertEquals(List.of("b", "a"), result.getHeaders());
        assertEquals(
            Set.of(List.of(NS + "Book1", NS + "Alice"), List.of(NS + "Book2", NS + "Alice")),
            new HashSet<>(result.getRows()));
    }

    @Test
    public void select_unboundProjectionIsNotApplicable() throws Exception {
        QueryResult.SelectResult result = engine.run(library(),
            "SELECT ?b ?missing WHERE { ?b ex:hasGenre ex:SciFi }", QueryForm.SELECT).asSelect();

        assertEquals(2, result.getRows().size());
        for (List<String> row : result.getRows()) {
            assertEquals(QueryResult.NOT_APPLICABLE, row.get(1));
        }
    }

    @Test
    public void select_literalsShowTheirLexicalForm() throws Exception {
        Graph g = library();
        g.add(ex("Book1"), ex("title"), Term.langLiteral("Dune", "en"));

        QueryResult.SelectResult result = engine.run(g,
            "SELECT ?t WHERE { ex:Book1 ex:title ?t }", QueryForm.SELECT).asSelect();

        assertEquals(List.of(List.of("Dune")), result.getRows());
    }

    @Test
    public void select_distinctAndLimit() throws Exception {
        QueryResult.SelectResult distinct = engine.run(library(),
            "SELECT DISTINCT ?a WHERE { ?b ex:hasAuthor ?a }", QueryForm.SELECT).asSelect();
        assertEquals(List.of(List.of(NS + "Alice")), distinct.getRows());

        QueryResult.SelectResult limited = engine.run(library(),
            "SELECT ?b WHERE { ?b ex:hasAuthor ?a } LIMIT 1", QueryForm.SELECT).asSelect();
        assertEquals(1, limited.getRows().size());
    }

    @Test
    public void select_noMatchIsEmptyNotAnError() throws Exception {
        QueryResult.SelectResult result = engine.run(library(),
            "SELECT ?b WHERE { ?b ex:hasGenre ex:Fantasy }", QueryForm.SELECT).asSelect();

        assertTrue(result.isEmpty());
        assertEquals(List.of("b"), result.getHeaders());
    }

    @Test
    public void ask_trueAndFalse() throws Exception {
        QueryResult yes = engine.run(library(), "ASK { ex:Book1 ex:hasGenre ex:SciFi }", QueryForm.ASK);
        QueryResult no = engine.run(library(), "ASK { ex:Book1 ex:hasGenre ex:Fantasy }", QueryForm.ASK);

        assertTrue(yes.asAsk().getValue());
        assertEquals("True", yes.toText());
        assertFalse(no.asAsk().getValue());
        assertEquals("False", no.toText());
    }

    @Test
    public void ask_emptyPatternIsTrue() throws Exception {
        assertTrue(engine.run(new Graph(), "ASK {}", QueryForm.ASK).asAsk().getValue());
    }

    @Test
    public void construct_instantiatesTemplate() throws Exception {
        Graph result = engine.run(library(),
            "CONSTRUCT { ?a ex:wrote ?b } WHERE { ?b ex:hasAuthor ?a }", QueryForm.CONSTRUCT)
            .asGraph().getGraph();

        assertEquals(2, result.size());
        assertTrue(result.contains(ex("Alice"), ex("wrote"), ex("Book1")));
        assertTrue(result.contains(ex("Alice"), ex("wrote"), ex("Book2")));
    }

    @Test
    public void construct_dropsTriplesWithLiteralSubjectOrPredicate() throws Exception {
        Graph g = library();
        g.add(ex("Book1"), ex("title"), Term.literal("Dune"));

        Graph result = engine.run(g,
            "CONSTRUCT { ?t ex:titleOf ?b . ?b ?t ex:x } WHERE { ?b ex:title ?t }", QueryForm.CONSTRUCT)
            .asGraph().getGraph();

        assertTrue(result.isEmpty());
    }

    @Test
    public void construct_blankNodesAreFreshPerRow() throws Exception {
        Graph result = engine.run(library(),
            "CONSTRUCT { _:r ex:about ?b . _:r ex:by ?a } WHERE { ?b ex:hasAuthor ?a }", QueryForm.CONSTRUCT)
            .asGraph().getGraph();

        Set<Term> nodes = new HashSet<>();
        for (RdfTriple t : result.find(null, ex("about"), null)) {
            assertTrue(t.subject.isBlankNode());
            nodes.add(t.subject);
        }
        assertEquals(2, nodes.size());
        assertEquals(4, result.size());
    }

    @Test
    public void describe_returnsMatchedTriples() throws Exception {
        QueryResult result = engine.run(library(),
            "DESCRIBE ?b WHERE { ?b ex:hasGenre ex:SciFi }", QueryForm.DESCRIBE);

        Graph graph = result.asGraph().getGraph();
        assertEquals(QueryForm.DESCRIBE, result.getForm());
        assertEquals(2, graph.size());
        assertTrue(graph.contains(ex("Book1"), ex("hasGenre"), ex("SciFi")));
        assertTrue(result.toText().contains("<http://example.org/Book2> <http://example.org/hasGenre> <http://example.org/SciFi> ."));
    }

    @Test
    public void describeWithoutWhereIsASyntaxError() {
        assertThrows(QuerySyntaxException.class,
            () -> engine.run(library(), "DESCRIBE ex:Book1", QueryForm.DESCRIBE));
    }

    @Test
    public void formMismatchIsAnEvaluationError() {
        assertThrows(QueryEvaluationException.class,
            () -> engine.run(library(), "ASK { ?s ?p ?o }", QueryForm.SELECT));
    }

    @Test
    public void malformedQueryIsASyntaxError() {
        QuerySyntaxException e = assertThrows(QuerySyntaxException.class,
            () -> engine.run(library(), "SELECT ?b WHERE { ?b ex:hasAuthor }", QueryForm.SELECT));

        assertEquals(ReasoningException.Stage.QUERY, e.getStage());
        assertNotNull(e.getFragment());
    }

    @Test
    public void undeclaredPrefixIsASyntaxError() {
        assertThrows(QuerySyntaxException.class,
            () -> engine.run(library(), "SELECT ?b WHERE { ?b nope:hasAuthor ?a }", QueryForm.SELECT));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "SELECT ?b WHERE { ?b ex:hasAuthor ?a FILTER(?a = ex:Alice) }",
        "SELECT ?b WHERE { ?b ex:hasAuthor ?a OPTIONAL { ?b ex:hasGenre ?g } }",
        "SELECT ?b WHERE { { ?b ex:hasAuthor ?a } UNION { ?b ex:hasGenre ?a } }",
        "SELECT ?b WHERE { ?b ex:hasAuthor/ex:knows ?a }",
        "SELECT ?b WHERE { ?b ex:hasAuthor ?a } ORDER BY ?b",
        "SELECT (COUNT(?b) AS ?n) WHERE { ?b ex:hasAuthor ?a }"
    })
    public void unsupportedFeaturesAreEvaluationErrors(String query) {
        assertThrows(QueryEvaluationException.class,
            () -> engine.run(library(), query, QueryForm.SELECT));
    }

    @Test
    public void formNamesParseCaseInsensitively() throws Exception {
        assertEquals(QueryForm.CONSTRUCT, QueryForm.fromName("construct"));
        assertEquals(QueryForm.SELECT, QueryForm.fromName(""));
        assertThrows(QueryEvaluationException.class, () -> QueryForm.fromName("update"));
    }
}
