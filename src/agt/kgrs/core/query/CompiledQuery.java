package kgrs.core.query;

import java.util.List;

/**
 * A query reduced to what the pattern matcher evaluates:
 * the WHERE pattern list plus the projection of its form.
 */
public class CompiledQuery {

    public static final long NO_LIMIT = -1;

    public final String text;
    public final QueryForm form;
    public final List<TriplePattern> patterns;
    /** SELECT only: projected variable names in order */
    public final List<String> resultVars;
    /** CONSTRUCT: the template; DESCRIBE: the WHERE patterns */
    public final List<TriplePattern> template;
    public final boolean distinct;
    public final long limit;
    public final long offset;

    CompiledQuery(String text, QueryForm form, List<TriplePattern> patterns, List<String> resultVars,
                  List<TriplePattern> template, boolean distinct, long limit, long offset) {
        this.text = text;
        this.form = form;
        this.patterns = List.copyOf(patterns);
        this.resultVars = List.copyOf(resultVars);
        this.template = List.copyOf(template);
        this.distinct = distinct;
        this.limit = limit;
        this.offset = offset;
    }

    @Override
    public String toString() {
        return "CompiledQuery{" + form + ", " + patterns.size() + " patterns}";
    }
}
