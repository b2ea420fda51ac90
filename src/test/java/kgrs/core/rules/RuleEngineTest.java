package kgrs.core.rules;

import kgrs.LibraryFixtures;
import kgrs.core.error.RuleSyntaxException;
import kgrs.core.rdf.Graph;
import kgrs.core.rdf.Namespaces;
import kgrs.core.rdf.Term;
import kgrs.core.rules.library.LibraryRuleTier;
import kgrs.core.rules.library.LibraryVocabulary;
import kgrs.core.rules.library.RecommendationStep;
import org.junit.jupiter.api.Test;

import static kgrs.LibraryFixtures.ex;
import static kgrs.LibraryFixtures.library;
import static org.junit.jupiter.api.Assertions.*;

public class RuleEngineTest {

    private final RuleEngine engine =
        RuleEngine.withDefaults(LibraryFixtures.namespaces(), RecommendationStep.Variant.PREFERENCE);

    @Test
    public void noneReturnsAnEqualGraph() throws Exception {
        Graph input = library();
        RuleApplication result = engine.apply(input, RuleMode.none());

        assertEquals(input, result.getGraph());
        assertEquals(0, result.getTrace().getTriplesAdded());
        assertFalse(result.hasDiagnostics());
    }

    @Test
    public void basicScenario() throws Exception {
        RuleApplication result = engine.apply(library(), RuleMode.basic());
        Graph out = result.getGraph();

        assertTrue(out.contains(ex("Alice"), ex("wrote"), ex("Book1")));
        assertTrue(out.contains(ex("Alice"), ex("wrote"), ex("Book2")));
        assertTrue(out.contains(ex("Book1"), ex("relatedTo"), ex("Book2")));
        assertTrue(out.contains(ex("Book2"), ex("relatedTo"), ex("Book1")));
        assertTrue(out.contains(ex("Bob"), Namespaces.RDF_TYPE, ex("FrequentBorrower")));
        assertEquals(5, result.getTrace().getTriplesAdded());
    }

    @Test
    public void inputGraphIsNeverMutated() throws Exception {
        Graph input = library();

        engine.apply(input, RuleMode.advanced());
        engine.apply(input, RuleMode.declarative("?x ex:hasAuthor ?y => ?y ex:wrote ?x"));

        assertEquals(library(), input);
    }

    @Test
    public void failedCustomBatchLeavesInputUntouched() {
        Graph input = library();

        assertThrows(RuleSyntaxException.class,
            () -> engine.apply(input, RuleMode.custom("IF a THEN b THEN c")));
        assertEquals(library(), input);
    }

    @Test
    public void declarativeScenarioWithOneBadLine() throws Exception {
        RuleApplication result = engine.apply(library(),
            RuleMode.declarative("this line has no arrow\n?x ex:hasAuthor ?y => ?y ex:wrote ?x"));

        assertTrue(result.hasDiagnostics());
        assertEquals(1, result.getDiagnostics().get(0).lineNumber);
        assertTrue(result.getGraph().contains(ex("Alice"), ex("wrote"), ex("Book1")));
    }

    @Test
    public void modesComposeInOrder() throws Exception {
        RuleApplication result = engine.apply(library(),
            RuleMode.basic(),
            RuleMode.declarative("?p a ex:FrequentBorrower => ?p ex:memberLevel \"gold\""));

        assertTrue(result.getGraph().contains(ex("Bob"), ex("memberLevel"),
            Term.literal("gold")));
    }

    @Test
    public void traceCanBeDisabled() throws Exception {
        RuleEngine quiet = new RuleEngine(
            RuleTierRegistry.withDefaults(LibraryFixtures.namespaces(), RecommendationStep.Variant.PREFERENCE), false);

        RuleApplication result = quiet.apply(library(), RuleMode.basic());

        assertTrue(result.getTrace().getSteps().isEmpty());
        assertEquals(5, result.getTrace().getTriplesAdded());
    }

    @Test
    public void missingTierIsAnError() {
        RuleEngine empty = new RuleEngine(new RuleTierRegistry());

        assertThrows(IllegalStateException.class, () -> empty.apply(library(), RuleMode.basic()));
    }

    @Test
    public void registryRejectsDuplicateKinds() {
        RuleTierRegistry registry = new RuleTierRegistry();
        LibraryVocabulary vocab = LibraryVocabulary.of(LibraryFixtures.namespaces());
        registry.register(LibraryRuleTier.basic(vocab));

        assertThrows(IllegalArgumentException.class, () -> registry.register(LibraryRuleTier.basic(vocab)));
        assertEquals(1, registry.size());
    }

    @Test
    public void defaultRegistryServesEveryTextAndFixedMode() {
        RuleTierRegistry registry = engine.getRegistry();

        assertEquals(4, registry.size());
        for (RuleMode.Kind kind : RuleMode.Kind.values()) {
            assertEquals(kind != RuleMode.Kind.NONE, registry.getTier(kind).isPresent());
        }
    }

    @Test
    public void registryDescribesEachTier() {
        String description = engine.getRegistry().toString();

        assertTrue(description.startsWith("RuleTierRegistry{4 tiers: "));
        assertTrue(description.contains("Basic library rules: author-inversion, genre-co-membership, frequent-borrower"));
        assertTrue(description.contains("recommendation"));
        assertTrue(description.contains("Custom text rules (CUSTOM)"));
        assertTrue(description.contains("Declarative rules (DECLARATIVE)"));
    }

    @Test
    public void modeNames() {
        assertEquals(RuleMode.Kind.DECLARATIVE, RuleMode.of("cwm", "x").getKind());
        assertEquals("x", RuleMode.of("CUSTOM", "x").getRuleText());
        assertEquals(RuleMode.none(), RuleMode.of(null, null));
        assertThrows(IllegalArgumentException.class, () -> RuleMode.of("owl", ""));
    }
}
