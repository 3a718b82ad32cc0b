package authz.modelgraph.io;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

import authz.modelgraph.graph.Edge;
import authz.modelgraph.graph.Graph;
import authz.modelgraph.graph.Node;

/**
 * Writes a relation graph as a Graphviz digraph, bottom-to-top:
 * <pre>
 * digraph {
 * graph [
 * rankdir=BT
 * ];
 *
 * // Node definitions.
 * 2 [label="document#editor"];
 *
 * // Edge definitions.
 * 3 -> 2 [
 * label=1
 * headlabel=""
 * ];
 * }
 * </pre>
 * Every edge carries {@code headlabel}, empty unless it is a tupleset edge.
 */
public final class DotWriter {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_\\x{80}-\\x{FF}][A-Za-z0-9_\\x{80}-\\x{FF}]*");
    private static final Pattern NUMERAL = Pattern.compile("-?(\\.[0-9]+|[0-9]+(\\.[0-9]*)?)");
    private static final Set<String> KEYWORDS = Set.of("node", "edge", "graph", "digraph", "subgraph", "strict");

    public String render(Graph graph) {
        final StringWriter sw = new StringWriter();
        try {
            write(graph, sw);
        } catch (IOException ex) {
            // StringWriter does not fail
            throw new UncheckedIOException(ex);
        }
        return sw.toString();
    }

    public void write(Graph graph, Writer out) throws RenderException {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(out, "out");
        try {
            out.write("digraph {\n");
            out.write("graph [\n");
            out.write("rankdir=BT\n");
            out.write("];\n");

            final List<Node> nodes = new ArrayList<>(graph.nodes());
            nodes.sort(Comparator.comparingInt(Node::id));
            if (!nodes.isEmpty()) {
                out.write("\n// Node definitions.\n");
                for (Node n : nodes) {
                    out.write(n.id() + " [label=" + quote(n.label()) + "];\n");
                }
            }

            final List<Edge> edges = new ArrayList<>(graph.edges());
            edges.sort(Comparator.comparingInt(Edge::from)
                    .thenComparingInt(Edge::to)
                    .thenComparingInt(Edge::sequence));
            if (!edges.isEmpty()) {
                out.write("\n// Edge definitions.\n");
                for (Edge e : edges) {
                    out.write(e.from() + " -> " + e.to() + " [\n");
                    out.write("label=" + e.sequence() + "\n");
                    out.write("headlabel=" + quote(e.context()) + "\n");
                    if (e.computed()) {
                        out.write("style=dashed\n");
                    }
                    out.write("];\n");
                }
            }

            out.write("}\n");
            out.flush();
        } catch (IOException ex) {
            throw new RenderException("failed to render graph: " + ex.getMessage(), ex);
        }
    }

    static String quote(String id) {
        if (!id.isEmpty()
                && (IDENTIFIER.matcher(id).matches() || NUMERAL.matcher(id).matches())
                && !KEYWORDS.contains(id.toLowerCase(Locale.ROOT))) {
            return id;
        }
        return "\"" + id.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
