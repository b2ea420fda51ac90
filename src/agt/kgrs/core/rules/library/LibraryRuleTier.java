package kgrs.core.rules.library;

import kgrs.core.rdf.Graph;
import kgrs.core.rules.RuleMode;
import kgrs.core.rules.RuleTier;
import kgrs.core.rules.RuleTrace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Fixed procedural rule set over the library vocabulary.
 *
 * Steps run once, in order. Each step reads the working graph as it stands
 * when the step starts, and its output is merged only after it finishes, so
 * later steps see earlier steps' output. Re-running a tier on its own output
 * adds nothing.
 */
public class LibraryRuleTier implements RuleTier {

    private static final Logger logger = Logger.getLogger(LibraryRuleTier.class.getName());

    private final RuleMode.Kind kind;
    private final LibraryVocabulary vocab;
    private final List<DerivationStep> steps;

    public LibraryRuleTier(RuleMode.Kind kind, LibraryVocabulary vocab, List<DerivationStep> steps) {
        this.kind = kind;
        this.vocab = vocab;
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    /**
     * Author inversion, genre co-membership, frequent borrowers.
     */
    public static LibraryRuleTier basic(LibraryVocabulary vocab) {
        return new LibraryRuleTier(RuleMode.Kind.BASIC, vocab, basicSteps());
    }

    /**
     * The basic steps followed by author expertise and recommendations.
     */
    public static LibraryRuleTier advanced(LibraryVocabulary vocab, RecommendationStep.Variant variant) {
        List<DerivationStep> steps = new ArrayList<>(basicSteps());
        steps.add(new AuthorExpertiseStep());
        steps.add(new RecommendationStep(variant));
        return new LibraryRuleTier(RuleMode.Kind.ADVANCED, vocab, steps);
    }

    private static List<DerivationStep> basicSteps() {
        return List.of(
            new AuthorInversionStep(),
            new GenreCoMembershipStep(),
            new FrequentBorrowerStep());
    }

    @Override
    public String getId() {
        return kind.name().toLowerCase();
    }

    @Override
    public String getName() {
        return kind == RuleMode.Kind.BASIC ? "Basic library rules" : "Advanced library rules";
    }

    @Override
    public RuleMode.Kind getKind() {
        return kind;
    }

    public List<DerivationStep> getSteps() {
        return steps;
    }

    @Override
    public void apply(Graph working, RuleMode mode, RuleTrace.Builder trace) {
        for (DerivationStep step : steps) {
            long start = System.currentTimeMillis();
            Graph derived = step.derive(working, vocab);
            int added = working.addAll(derived);
            long elapsed = System.currentTimeMillis() - start;

            trace.addStep(getId(), step.getId(), added, elapsed);
            logger.fine("Step " + step.getId() + " added " + added + " triples");
        }
    }

    @Override
    public String getDescription() {
        StringBuilder sb = new StringBuilder(getName()).append(": ");
        for (int i = 0; i < steps.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(steps.get(i).getId());
        }
        return sb.toString();
    }
}
