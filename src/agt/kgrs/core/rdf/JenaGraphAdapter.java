package kgrs.core.rdf;

import org.apache.jena.datatypes.TypeMapper;
import org.apache.jena.graph.Node;
import org.apache.jena.graph.NodeFactory;
import org.apache.jena.graph.Triple;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.util.iterator.ExtendedIterator;

/**
 * Adapter between Jena nodes/models and the core term model.
 */
public class JenaGraphAdapter {

    private JenaGraphAdapter() {}

    /**
     * Convert a Jena node to a term.
     * Query variables (including blank-node variables from a WHERE clause) become {@link Term.Variable}.
     *
     * @throws IllegalArgumentException for node kinds with no term counterpart (e.g. quoted triples)
     */
    public static Term toTerm(Node node) {
        if (node.isVariable()) {
            return Term.variable(node.getName());
        }
        if (node.isURI()) {
            return Term.iri(node.getURI());
        }
        if (node.isBlank()) {
            return Term.blank(node.getBlankNodeLabel());
        }
        if (node.isLiteral()) {
            String lang = node.getLiteralLanguage();
            if (lang != null && !lang.isEmpty()) {
                return Term.langLiteral(node.getLiteralLexicalForm(), lang);
            }
            return Term.typedLiteral(node.getLiteralLexicalForm(), node.getLiteralDatatypeURI());
        }
        throw new IllegalArgumentException("Unsupported node: " + node);
    }

    /**
     * Convert a concrete term to a Jena node.
     */
    public static Node toNode(Term term) {
        switch (term.getKind()) {
            case IRI:
                return NodeFactory.createURI(term.asIri().getValue());
            case BLANK_NODE:
                return NodeFactory.createBlankNode(((Term.BlankNode) term).getId());
            case LITERAL: {
                Term.Literal lit = term.asLiteral();
                if (lit.getLanguage() != null) {
                    return NodeFactory.createLiteral(lit.getLexical(), lit.getLanguage());
                }
                if (lit.getDatatype() != null) {
                    return NodeFactory.createLiteral(lit.getLexical(),
                        TypeMapper.getInstance().getSafeTypeByName(lit.getDatatype()));
                }
                return NodeFactory.createLiteral(lit.getLexical());
            }
            case VARIABLE:
                return NodeFactory.createVariable(term.asVariable().getName());
            default:
                throw new IllegalArgumentException("Unknown term kind: " + term.getKind());
        }
    }

    public static RdfTriple toTriple(Triple triple) {
        return new RdfTriple(toTerm(triple.getSubject()), toTerm(triple.getPredicate()), toTerm(triple.getObject()));
    }

    /**
     * Copy every statement of a Jena model into a new graph.
     */
    public static Graph fromModel(Model model) {
        Graph graph = new Graph();
        ExtendedIterator<Triple> it = model.getGraph().find(Node.ANY, Node.ANY, Node.ANY);
        try {
            while (it.hasNext()) {
                graph.add(toTriple(it.next()));
            }
        } finally {
            it.close();
        }
        return graph;
    }

    /**
     * Copy a graph into a new Jena model carrying the given prefixes.
     */
    public static Model toModel(Graph graph, Namespaces namespaces) {
        Model model = ModelFactory.createDefaultModel();
        if (namespaces != null) {
            model.setNsPrefixes(namespaces.getPrefixMap());
        }
        org.apache.jena.graph.Graph target = model.getGraph();
        for (RdfTriple t : graph) {
            target.add(Triple.create(toNode(t.subject), toNode(t.predicate), toNode(t.object)));
        }
        return model;
    }
}
