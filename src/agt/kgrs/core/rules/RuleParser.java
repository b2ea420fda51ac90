package kgrs.core.rules;

import kgrs.core.error.RuleSyntaxException;
import kgrs.core.error.UnresolvedPrefixException;
import kgrs.core.query.TriplePattern;
import kgrs.core.rdf.Namespaces;
import kgrs.core.rdf.Term;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Parser for one-line implication rules in an N3-like notation.
 *
 * <pre>
 *   ?x ex:hasAuthor ?y => ?y ex:wrote ?x
 *   { ?b ex:hasGenre ?g . ?u ex:prefersGenre ?g } => { ?b ex:recommendedFor ?u } .
 * </pre>
 *
 * Each side is a '.'-separated list of clauses of exactly three terms.
 * Terms: {@code ?var}, {@code <iri>}, full IRIs with a scheme, {@code prefix:local},
 * {@code a} (rdf:type), quoted literals with optional {@code @lang} or
 * {@code ^^datatype}, {@code _:label} blank nodes, and bare names in the
 * default namespace. Either side may be empty.
 */
public class RuleParser {

    private static final String ARROW = "=>";
    private static final String DOT = ".";
    private static final String OPEN = "{";
    private static final String CLOSE = "}";

    private static final Pattern VARIABLE = Pattern.compile("\\?[A-Za-z_][A-Za-z0-9_]*");

    private final Namespaces namespaces;

    public RuleParser(Namespaces namespaces) {
        this.namespaces = namespaces;
    }

    /**
     * Parse one rule.
     *
     * @param ruleText A single rule line
     * @return The parsed rule
     * @throws RuleSyntaxException if the text is not a well-formed rule
     */
    public Rule parse(String ruleText) throws RuleSyntaxException {
        if (ruleText == null || ruleText.isBlank()) {
            throw new RuleSyntaxException("Empty rule", ruleText);
        }
        String text = ruleText.trim();
        List<String> tokens = tokenize(text);

        int arrow = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (ARROW.equals(tokens.get(i))) {
                if (arrow >= 0) {
                    throw new RuleSyntaxException("Rule must contain exactly one '=>'", text);
                }
                arrow = i;
            }
        }
        if (arrow < 0) {
            throw new RuleSyntaxException("Rule must contain exactly one '=>'", text);
        }

        List<String> left = new ArrayList<>(tokens.subList(0, arrow));
        List<String> right = new ArrayList<>(tokens.subList(arrow + 1, tokens.size()));

        List<TriplePattern> antecedent = parseClauses(stripBraces(left, text), true, text);
        List<TriplePattern> consequent = parseClauses(stripBraces(right, text), false, text);
        return new Rule(antecedent, consequent, text);
    }

    // Tokenizing

    private List<String> tokenize(String text) throws RuleSyntaxException {
        List<String> tokens = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        int n = text.length();
        int i = 0;

        while (i < n) {
            char c = text.charAt(i);

            if (c == '"') {
                i = readQuoted(text, i, cur);
            } else if (c == '<' && cur.length() == 0) {
                int end = text.indexOf('>', i);
                if (end < 0) {
                    throw new RuleSyntaxException("Unterminated IRI", text);
                }
                cur.append(text, i, end + 1);
                i = end + 1;
            } else if (Character.isWhitespace(c)) {
                flush(cur, tokens);
                i++;
            } else if (c == '=' && i + 1 < n && text.charAt(i + 1) == '>') {
                flush(cur, tokens);
                tokens.add(ARROW);
                i += 2;
            } else if (c == '{' || c == '}') {
                flush(cur, tokens);
                tokens.add(String.valueOf(c));
                i++;
            } else if (c == '.' && cur.length() > 0 && cur.charAt(0) == '?') {
                // variables cannot contain dots
                flush(cur, tokens);
                tokens.add(DOT);
                i++;
            } else {
                cur.append(c);
                i++;
            }
        }
        flush(cur, tokens);
        return tokens;
    }

    private int readQuoted(String text, int start, StringBuilder cur) throws RuleSyntaxException {
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                cur.append(text, start, i + 1);
                return i + 1;
            }
            i++;
        }
        throw new RuleSyntaxException("Unterminated literal", text);
    }

    /**
     * A '.' ends a clause only when it ends a token; dots inside IRIs are kept.
     */
    private void flush(StringBuilder cur, List<String> tokens) {
        if (cur.length() == 0) {
            return;
        }
        String token = cur.toString();
        cur.setLength(0);
        if (DOT.equals(token)) {
            tokens.add(DOT);
        } else if (token.endsWith(DOT) && !token.endsWith("\"")) {
            tokens.add(token.substring(0, token.length() - 1));
            tokens.add(DOT);
        } else {
            tokens.add(token);
        }
    }

    private List<String> stripBraces(List<String> side, String text) throws RuleSyntaxException {
        List<String> tokens = new ArrayList<>(side);
        // trailing '.' after the closing brace of an N3 rule
        if (tokens.size() >= 2 && DOT.equals(tokens.get(tokens.size() - 1))
                && CLOSE.equals(tokens.get(tokens.size() - 2))) {
            tokens.remove(tokens.size() - 1);
        }
        if (!tokens.isEmpty() && OPEN.equals(tokens.get(0))) {
            if (!CLOSE.equals(tokens.get(tokens.size() - 1))) {
                throw new RuleSyntaxException("Unbalanced braces", text);
            }
            tokens = tokens.subList(1, tokens.size() - 1);
        }
        if (tokens.contains(OPEN) || tokens.contains(CLOSE)) {
            throw new RuleSyntaxException("Unbalanced braces", text);
        }
        return tokens;
    }

    // Clauses

    private List<TriplePattern> parseClauses(List<String> tokens, boolean antecedent, String text)
            throws RuleSyntaxException {
        List<TriplePattern> clauses = new ArrayList<>();
        List<String> clause = new ArrayList<>();
        for (String token : tokens) {
            if (DOT.equals(token)) {
                addClause(clause, clauses, antecedent, text);
                clause.clear();
            } else {
                clause.add(token);
            }
        }
        addClause(clause, clauses, antecedent, text);
        return clauses;
    }

    private void addClause(List<String> clause, List<TriplePattern> out, boolean antecedent, String text)
            throws RuleSyntaxException {
        if (clause.isEmpty()) {
            return;
        }
        if (clause.size() != 3) {
            throw new RuleSyntaxException(
                "Clause must have exactly three terms, got " + clause.size() + ": " + String.join(" ", clause), text);
        }
        out.add(new TriplePattern(
            toTerm(clause.get(0), antecedent, text),
            toTerm(clause.get(1), antecedent, text),
            toTerm(clause.get(2), antecedent, text)));
    }

    // Terms

    private Term toTerm(String token, boolean antecedent, String text) throws RuleSyntaxException {
        if (token.startsWith("?")) {
            if (!VARIABLE.matcher(token).matches()) {
                throw new RuleSyntaxException("Invalid variable: " + token, text);
            }
            return Term.variable(token.substring(1));
        }
        if (token.startsWith("<")) {
            if (token.length() < 3 || !token.endsWith(">")) {
                throw new RuleSyntaxException("Invalid IRI: " + token, text);
            }
            return Term.iri(token.substring(1, token.length() - 1));
        }
        if (token.startsWith("\"")) {
            return toLiteral(token, text);
        }
        if (token.startsWith("_:")) {
            String label = token.substring(2);
            if (label.isEmpty()) {
                throw new RuleSyntaxException("Invalid blank node: " + token, text);
            }
            // a blank node in a condition matches anything, like an unnamed variable
            return antecedent ? Term.variable("_bn_" + label) : Term.blank(label);
        }
        if ("a".equals(token)) {
            return Namespaces.RDF_TYPE;
        }
        if (Namespaces.isFullIri(token)) {
            return Term.iri(token);
        }
        try {
            return namespaces.resolve(token);
        } catch (UnresolvedPrefixException e) {
            throw new RuleSyntaxException(e.getMessage(), text, e);
        }
    }

    private Term toLiteral(String token, String text) throws RuleSyntaxException {
        int close = token.lastIndexOf('"');
        if (close <= 0) {
            throw new RuleSyntaxException("Invalid literal: " + token, text);
        }
        String lexical = unescape(token.substring(1, close));
        String suffix = token.substring(close + 1);

        if (suffix.isEmpty()) {
            return Term.literal(lexical);
        }
        if (suffix.startsWith("@") && suffix.length() > 1) {
            return Term.langLiteral(lexical, suffix.substring(1));
        }
        if (suffix.startsWith("^^") && suffix.length() > 2) {
            Term datatype = toTerm(suffix.substring(2), false, text);
            if (!datatype.isIri()) {
                throw new RuleSyntaxException("Invalid datatype: " + suffix, text);
            }
            return Term.typedLiteral(lexical, datatype.asIri().getValue());
        }
        throw new RuleSyntaxException("Invalid literal: " + token, text);
    }

    private static String unescape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' && i + 1 < s.length()) {
                char next = s.charAt(++i);
                switch (next) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
