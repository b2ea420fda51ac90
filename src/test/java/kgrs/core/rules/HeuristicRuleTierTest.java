package kgrs.core.rules;

import kgrs.LibraryFixtures;
import kgrs.core.error.RuleSyntaxException;
import kgrs.core.rdf.Graph;
import kgrs.core.rules.library.LibraryVocabulary;
import org.junit.jupiter.api.Test;

import static kgrs.LibraryFixtures.ex;
import static kgrs.LibraryFixtures.library;
import static org.junit.jupiter.api.Assertions.*;

public class HeuristicRuleTierTest {

    private final HeuristicRuleTier tier =
        new HeuristicRuleTier(LibraryVocabulary.of(LibraryFixtures.namespaces()));

    private Graph apply(String text, Graph graph) throws RuleSyntaxException {
        tier.apply(graph, RuleMode.custom(text), RuleTrace.builder(graph.size()));
        return graph;
    }

    @Test
    public void ifThenAuthorRuleInvertsAuthorship() throws Exception {
        Graph out = apply("IF ?book hasAuthor ?author THEN ?author wrote ?book", library());

        assertTrue(out.contains(ex("Alice"), ex("wrote"), ex("Book1")));
        assertTrue(out.contains(ex("Alice"), ex("wrote"), ex("Book2")));
        assertEquals(8, out.size());
    }

    @Test
    public void arrowFormIsRecognizedToo() throws Exception {
        Graph out = apply("?b ex:hasAuthor ?a => ?a ex:wrote ?b", library());

        assertEquals(8, out.size());
    }

    @Test
    public void otherLinesHaveNoEffect() throws Exception {
        Graph out = apply("some free text\nIF ?x hasGenre ?g THEN ?x liked ?g\n\n", library());

        assertEquals(library(), out);
    }

    @Test
    public void malformedLineAbortsTheWholeBatch() {
        Graph graph = library();
        String text = "IF ?b hasAuthor ?a THEN ?a wrote ?b\nIF ?x hasGenre ?g THEN ?x THEN ?g";

        RuleSyntaxException e = assertThrows(RuleSyntaxException.class, () -> apply(text, graph));

        assertEquals(2, e.getLineNumber());
        assertEquals(library(), graph);
    }

    @Test
    public void doubleArrowAbortsTheBatch() {
        Graph graph = library();

        assertThrows(RuleSyntaxException.class,
            () -> apply("?b hasAuthor ?a => ?a wrote ?b => ?b", graph));
        assertEquals(library(), graph);
    }

    @Test
    public void emptyTextIsANoOp() throws Exception {
        assertEquals(library(), apply("", library()));
    }
}
