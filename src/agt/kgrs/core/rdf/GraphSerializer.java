package kgrs.core.rdf;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.riot.RDFFormat;

import java.io.StringWriter;

/**
 * Textual renderings of a graph.
 */
public class GraphSerializer {

    private GraphSerializer() {}

    /**
     * One {@code subject predicate object .} statement per line, full IRIs and quoted literals.
     */
    public static String toNTriples(Graph graph) {
        StringBuilder sb = new StringBuilder();
        for (RdfTriple t : graph) {
            sb.append(t.toNTriples()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Turtle using the declared prefixes.
     */
    public static String toTurtle(Graph graph, Namespaces namespaces) {
        Model model = JenaGraphAdapter.toModel(graph, namespaces);
        StringWriter out = new StringWriter();
        RDFDataMgr.write(out, model, RDFFormat.TURTLE_PRETTY);
        return out.toString();
    }
}
