package kgrs.core.query;

import kgrs.core.error.QueryEvaluationException;

import java.util.Locale;

/**
 * The four supported query result shapes.
 */
public enum QueryForm {
    /** Table of variable bindings */
    SELECT,
    /** Boolean: does the pattern match at all */
    ASK,
    /** Graph built from a template */
    CONSTRUCT,
    /** Graph of the triples that matched the pattern */
    DESCRIBE;

    /**
     * Parse a form name as supplied by a caller (case-insensitive).
     *
     * @throws QueryEvaluationException for unknown form names
     */
    public static QueryForm fromName(String name) throws QueryEvaluationException {
        if (name == null || name.isBlank()) {
            return SELECT;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new QueryEvaluationException("Unsupported query form: " + name, null);
        }
    }
}
