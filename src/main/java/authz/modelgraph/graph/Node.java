package authz.modelgraph.graph;

/**
 * Graph vertex. The label is its identity; the id is its creation index.
 */
public record Node(int id, String label) {
}
