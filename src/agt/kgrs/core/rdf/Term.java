package kgrs.core.rdf;

import java.util.Objects;

/**
 * A graph term: IRI, blank node, literal, or (pattern-only) variable.
 *
 * Terms are immutable values. Equality and hashing are structural: two
 * literals are equal iff lexical form, datatype and language tag all match.
 * Use the static factory methods to create instances:
 * - Term.iri(...)
 * - Term.blank(...)
 * - Term.literal(...), Term.typedLiteral(...), Term.langLiteral(...)
 * - Term.variable(...)
 */
public abstract class Term {

    public static final String XSD_STRING = "http://www.w3.org/2001/XMLSchema#string";
    public static final String RDF_LANG_STRING = "http://www.w3.org/1999/02/22-rdf-syntax-ns#langString";

    /**
     * Tag of the term variant.
     */
    public enum Kind {
        IRI,
        BLANK_NODE,
        LITERAL,
        VARIABLE
    }

    private Term() {}

    public abstract Kind getKind();

    /**
     * N-Triples style rendering: {@code <iri>}, {@code _:id}, quoted literal, {@code ?name}.
     */
    public abstract String toNTriples();

    /**
     * Plain rendering used for tabular results: IRI string, literal lexical form.
     */
    public abstract String toDisplayString();

    public boolean isIri() {
        return getKind() == Kind.IRI;
    }

    public boolean isBlankNode() {
        return getKind() == Kind.BLANK_NODE;
    }

    public boolean isLiteral() {
        return getKind() == Kind.LITERAL;
    }

    public boolean isVariable() {
        return getKind() == Kind.VARIABLE;
    }

    /**
     * True for terms that may be stored in a graph.
     */
    public boolean isConcrete() {
        return !isVariable();
    }

    public Iri asIri() {
        if (this instanceof Iri) {
            return (Iri) this;
        }
        throw new IllegalStateException("Term is " + getKind() + ", not an IRI: " + this);
    }

    public Literal asLiteral() {
        if (this instanceof Literal) {
            return (Literal) this;
        }
        throw new IllegalStateException("Term is " + getKind() + ", not a literal: " + this);
    }

    public Variable asVariable() {
        if (this instanceof Variable) {
            return (Variable) this;
        }
        throw new IllegalStateException("Term is " + getKind() + ", not a variable: " + this);
    }

    @Override
    public String toString() {
        return toNTriples();
    }

    // Factory methods

    public static Iri iri(String value) {
        return new Iri(value);
    }

    public static BlankNode blank(String id) {
        return new BlankNode(id);
    }

    public static Literal literal(String lexical) {
        return new Literal(lexical, null, null);
    }

    /**
     * Typed literal. {@code xsd:string} is normalised to a plain literal.
     */
    public static Literal typedLiteral(String lexical, String datatype) {
        if (datatype == null || XSD_STRING.equals(datatype)) {
            return new Literal(lexical, null, null);
        }
        return new Literal(lexical, datatype, null);
    }

    public static Literal langLiteral(String lexical, String language) {
        if (language == null || language.isEmpty()) {
            return new Literal(lexical, null, null);
        }
        return new Literal(lexical, null, language.toLowerCase());
    }

    public static Variable variable(String name) {
        return new Variable(name);
    }

    // ========== IRI ==========

    public static final class Iri extends Term {

        private final String value;

        private Iri(String value) {
            this.value = Objects.requireNonNull(value, "IRI cannot be null");
            if (value.isEmpty()) {
                throw new IllegalArgumentException("IRI cannot be empty");
            }
        }

        public String getValue() {
            return value;
        }

        @Override
        public Kind getKind() {
            return Kind.IRI;
        }

        @Override
        public String toNTriples() {
            return "<" + value + ">";
        }

        @Override
        public String toDisplayString() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Iri)) return false;
            return value.equals(((Iri) obj).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    // ========== Blank node ==========

    public static final class BlankNode extends Term {

        private final String id;

        private BlankNode(String id) {
            this.id = Objects.requireNonNull(id, "Blank node id cannot be null");
        }

        public String getId() {
            return id;
        }

        @Override
        public Kind getKind() {
            return Kind.BLANK_NODE;
        }

        @Override
        public String toNTriples() {
            return "_:" + id;
        }

        @Override
        public String toDisplayString() {
            return "_:" + id;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof BlankNode)) return false;
            return id.equals(((BlankNode) obj).id);
        }

        @Override
        public int hashCode() {
            return 31 * id.hashCode() + 7;
        }
    }

    // ========== Literal ==========

    public static final class Literal extends Term {

        private final String lexical;
        private final String datatype;
        private final String language;

        private Literal(String lexical, String datatype, String language) {
            this.lexical = Objects.requireNonNull(lexical, "Lexical form cannot be null");
            this.datatype = datatype;
            this.language = language;
        }

        public String getLexical() {
            return lexical;
        }

        /**
         * Datatype IRI, or null for plain and language-tagged literals.
         */
        public String getDatatype() {
            return datatype;
        }

        public String getLanguage() {
            return language;
        }

        @Override
        public Kind getKind() {
            return Kind.LITERAL;
        }

        @Override
        public String toNTriples() {
            StringBuilder sb = new StringBuilder();
            sb.append('"').append(escape(lexical)).append('"');
            if (language != null) {
                sb.append('@').append(language);
            } else if (datatype != null) {
                sb.append("^^<").append(datatype).append('>');
            }
            return sb.toString();
        }

        @Override
        public String toDisplayString() {
            return lexical;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Literal)) return false;
            Literal other = (Literal) obj;
            return lexical.equals(other.lexical)
                && Objects.equals(datatype, other.datatype)
                && Objects.equals(language, other.language);
        }

        @Override
        public int hashCode() {
            return Objects.hash(lexical, datatype, language);
        }

        private static String escape(String s) {
            StringBuilder sb = new StringBuilder(s.length());
            for (char c : s.toCharArray()) {
                switch (c) {
                    case '\\' -> sb.append("\\\\");
                    case '"' -> sb.append("\\\"");
                    case '\n' -> sb.append("\\n");
                    case '\r' -> sb.append("\\r");
                    case '\t' -> sb.append("\\t");
                    default -> sb.append(c);
                }
            }
            return sb.toString();
        }
    }

    // ========== Variable ==========

    public static final class Variable extends Term {

        private final String name;

        private Variable(String name) {
            this.name = Objects.requireNonNull(name, "Variable name cannot be null");
            if (name.isEmpty()) {
                throw new IllegalArgumentException("Variable name cannot be empty");
            }
        }

        public String getName() {
            return name;
        }

        @Override
        public Kind getKind() {
            return Kind.VARIABLE;
        }

        @Override
        public String toNTriples() {
            return "?" + name;
        }

        @Override
        public String toDisplayString() {
            return "?" + name;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Variable)) return false;
            return name.equals(((Variable) obj).name);
        }

        @Override
        public int hashCode() {
            return 17 * name.hashCode() + 3;
        }
    }
}
