package authz.modelgraph.graph;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable node table and edge list for a single build. Owns the edge sequence
 * counter, so independent builds never share numbering.
 */
final class GraphAccumulator {

    private final List<Node> nodes = new ArrayList<>();
    private final Map<String, Node> nodesByLabel = new HashMap<>();
    private final List<Edge> edges = new ArrayList<>();
    private final Set<EdgeKey> edgeKeys = new HashSet<>();
    private int edgeCounter;

    Node addOrGetNode(String label) {
        Objects.requireNonNull(label, "label");
        final Node existing = nodesByLabel.get(label);
        if (existing != null) {
            return existing;
        }
        final Node n = new Node(nodes.size(), label);
        nodes.add(n);
        nodesByLabel.put(label, n);
        return n;
    }

    /**
     * Adds the edge unless one with the same endpoints and context exists.
     *
     * @return true if a new edge was created
     */
    boolean addEdge(String fromLabel, String toLabel, String context, boolean computed) {
        final Node from = addOrGetNode(fromLabel);
        final Node to = addOrGetNode(toLabel);
        final String ctx = context == null ? "" : context;
        if (!edgeKeys.add(new EdgeKey(from.id(), to.id(), ctx))) {
            return false;
        }
        edgeCounter++;
        edges.add(new Edge(from.id(), to.id(), edgeCounter, ctx, computed));
        return true;
    }

    Graph toGraph() {
        return new Graph(nodes, edges);
    }

    private record EdgeKey(int from, int to, String context) {
    }
}
