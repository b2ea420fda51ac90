package kgrs.core.rules;

import kgrs.core.error.RuleSyntaxException;
import kgrs.core.query.Binding;
import kgrs.core.query.PatternMatcher;
import kgrs.core.query.QueryEngine;
import kgrs.core.rdf.Graph;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Applies declarative implication rules, one per line, in order.
 *
 * Each rule's antecedent is matched against the running graph, which already
 * holds what earlier rules derived. The consequent is instantiated for every
 * binding and merged once the rule has been evaluated, so a rule never sees
 * its own output within the batch (single pass, no fixpoint).
 *
 * A failing line is skipped and reported as a {@link RuleDiagnostic}; the
 * rest of the batch still runs. Blank lines and lines starting with '#' are
 * ignored.
 */
public class DeclarativeRuleTier implements RuleTier {

    private static final Logger logger = Logger.getLogger(DeclarativeRuleTier.class.getName());

    public static final String ID = "declarative";

    private final RuleParser parser;

    public DeclarativeRuleTier(RuleParser parser) {
        this.parser = parser;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Declarative rules";
    }

    @Override
    public RuleMode.Kind getKind() {
        return RuleMode.Kind.DECLARATIVE;
    }

    @Override
    public void apply(Graph working, RuleMode mode, RuleTrace.Builder trace) {
        String text = mode.getRuleText();
        if (text == null || text.isBlank()) {
            return;
        }

        List<String> lines = text.lines().collect(Collectors.toList());
        int applied = 0;
        int skipped = 0;

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            int lineNumber = i + 1;
            long start = System.currentTimeMillis();

            try {
                Rule rule = parser.parse(line);
                int added = applyRule(rule, working);
                trace.addStep(ID, "line-" + lineNumber, added, System.currentTimeMillis() - start);
                applied++;
            } catch (RuleSyntaxException e) {
                logger.warning("Error applying rule " + line + ": " + e.getMessage());
                trace.addDiagnostic(new RuleDiagnostic(lineNumber, line, e.getMessage()));
                skipped++;
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Error applying rule " + line, e);
                trace.addDiagnostic(new RuleDiagnostic(lineNumber, line, "Evaluation failed: " + e));
                skipped++;
            }
        }

        logger.info("Declarative rules applied: " + applied + " ok, " + skipped + " skipped");
    }

    /**
     * Apply one rule to the running graph.
     *
     * @return number of triples added
     */
    public int applyRule(Rule rule, Graph running) {
        List<Binding> rows = PatternMatcher.evaluate(running, rule.getAntecedent());
        Graph derived = QueryEngine.construct(rule.getConsequent(), rows);
        int added = running.addAll(derived);
        logger.fine("Rule " + rule.getSource() + " matched " + rows.size() + " rows, added " + added);
        return added;
    }
}
