package authz.modelgraph.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Fully built relation graph, ready for rendering and cycle analysis.
 * - nodes in ascending id order (ids may have gaps once pruned)
 * - edges in creation order; parallel edges differ by context
 */
public final class Graph {

    private final List<Node> nodes;
    private final List<Edge> edges;
    private final Map<Integer, Node> nodesById = new HashMap<>();
    private final Map<String, Integer> idsByLabel = new HashMap<>();
    private final Map<Integer, SortedSet<Integer>> successors = new HashMap<>();

    Graph(List<Node> nodes, List<Edge> edges) {
        this.nodes = List.copyOf(nodes);
        this.edges = List.copyOf(edges);
        for (Node n : this.nodes) {
            nodesById.put(n.id(), n);
            idsByLabel.put(n.label(), n.id());
        }
        for (Edge e : this.edges) {
            successors.computeIfAbsent(e.from(), k -> new TreeSet<>()).add(e.to());
        }
    }

    public List<Node> nodes() {
        return nodes;
    }

    public List<Edge> edges() {
        return edges;
    }

    public Node node(int id) {
        final Node n = nodesById.get(id);
        if (n == null) {
            throw new IllegalArgumentException("no node with id " + id);
        }
        return n;
    }

    public String label(int id) {
        return node(id).label();
    }

    public Optional<Integer> nodeId(String label) {
        return Optional.ofNullable(idsByLabel.get(label));
    }

    public boolean hasNode(String label) {
        return idsByLabel.containsKey(label);
    }

    /**
     * Distinct successor ids of a node, ascending.
     */
    public SortedSet<Integer> successors(int id) {
        final SortedSet<Integer> out = successors.get(id);
        return out == null ? Collections.emptySortedSet() : Collections.unmodifiableSortedSet(out);
    }

    public List<Edge> edgesBetween(int from, int to) {
        final List<Edge> out = new ArrayList<>();
        for (Edge e : edges) {
            if (e.from() == from && e.to() == to) {
                out.add(e);
            }
        }
        return out;
    }

    public Optional<Edge> edge(String fromLabel, String toLabel, String context) {
        final Integer from = idsByLabel.get(fromLabel);
        final Integer to = idsByLabel.get(toLabel);
        if (from == null || to == null) {
            return Optional.empty();
        }
        for (Edge e : edges) {
            if (e.from() == from && e.to() == to && e.context().equals(context)) {
                return Optional.of(e);
            }
        }
        return Optional.empty();
    }

    /**
     * Copy without nodes that are neither source nor target of any edge.
     * Surviving nodes keep their ids.
     */
    public Graph withoutIsolatedNodes() {
        final Set<Integer> connected = new HashSet<>();
        for (Edge e : edges) {
            connected.add(e.from());
            connected.add(e.to());
        }
        final List<Node> kept = new ArrayList<>(connected.size());
        for (Node n : nodes) {
            if (connected.contains(n.id())) {
                kept.add(n);
            }
        }
        return new Graph(kept, edges);
    }
}
