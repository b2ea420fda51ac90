package kgrs.core.rules;

import kgrs.core.error.RuleSyntaxException;
import kgrs.core.rdf.Graph;
import kgrs.core.rules.library.AuthorInversionStep;
import kgrs.core.rules.library.LibraryVocabulary;

import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Minimal matcher for free-text rules.
 *
 * This is a stub, not a rule interpreter. A line is recognized when it has
 * the shape {@code IF <condition> THEN <action>} or {@code <condition> => <action>};
 * other lines are ignored. The only implemented combination is a condition
 * mentioning {@code hasAuthor} with an action mentioning {@code wrote}, which
 * runs the author inversion derivation. General rules belong in the
 * declarative tier.
 *
 * A recognized line with more than one separator (or an IF line without THEN)
 * rejects the whole batch: nothing derived by the batch is kept.
 */
public class HeuristicRuleTier implements RuleTier {

    private static final Logger logger = Logger.getLogger(HeuristicRuleTier.class.getName());

    public static final String ID = "custom";

    private final LibraryVocabulary vocab;
    private final AuthorInversionStep authorInversion = new AuthorInversionStep();

    public HeuristicRuleTier(LibraryVocabulary vocab) {
        this.vocab = vocab;
    }

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getName() {
        return "Custom text rules";
    }

    @Override
    public RuleMode.Kind getKind() {
        return RuleMode.Kind.CUSTOM;
    }

    @Override
    public void apply(Graph working, RuleMode mode, RuleTrace.Builder trace) throws RuleSyntaxException {
        String text = mode.getRuleText();
        if (text == null || text.isBlank()) {
            return;
        }

        List<String> lines = text.lines().collect(Collectors.toList());
        Graph derived = new Graph();
        int fired = 0;
        long start = System.currentTimeMillis();

        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }

            String[] parts = split(line, i + 1);
            if (parts == null) {
                logger.fine("Ignoring unrecognized rule line: " + line);
                continue;
            }

            String condition = parts[0];
            String action = parts[1];
            if (condition.contains("hasAuthor") && action.contains("wrote")) {
                derived.addAll(authorInversion.derive(working, vocab));
                fired++;
            } else {
                logger.fine("No handler for rule: " + line);
            }
        }

        // only reached when every line was acceptable
        int added = working.addAll(derived);
        trace.addStep(ID, authorInversion.getId(), added, System.currentTimeMillis() - start);
        logger.info("Custom rules applied: " + fired + " fired, " + added + " triples added");
    }

    /**
     * Split a recognized line into condition and action.
     *
     * @return [condition, action], or null if the line is not recognized
     */
    private String[] split(String line, int lineNumber) throws RuleSyntaxException {
        if (isIfLine(line)) {
            String[] parts = line.split("THEN", -1);
            if (parts.length != 2) {
                logger.severe("Error in custom rule processing at line " + lineNumber + ": " + line);
                throw new RuleSyntaxException("IF rule must contain exactly one THEN", line, lineNumber, null);
            }
            return new String[] {parts[0].substring(2).trim(), parts[1].trim()};
        }
        if (line.contains("=>")) {
            String[] parts = line.split("=>", -1);
            if (parts.length != 2) {
                logger.severe("Error in custom rule processing at line " + lineNumber + ": " + line);
                throw new RuleSyntaxException("Rule must contain exactly one '=>'", line, lineNumber, null);
            }
            return new String[] {parts[0].trim(), parts[1].trim()};
        }
        return null;
    }

    private static boolean isIfLine(String line) {
        return line.startsWith("IF") && (line.length() == 2 || Character.isWhitespace(line.charAt(2)));
    }
}
