package authz.modelgraph.graph;

/**
 * Directed edge from a granting node to the relation it feeds.
 * {@code (from, to, context)} is unique within a graph.
 *
 * @param sequence creation order, starting at 1
 * @param context  {@code "(type#tupleset)"} for tupleset indirection, otherwise empty
 * @param computed true when the target is defined in terms of the source relation
 */
public record Edge(
        int from,
        int to,
        int sequence,
        String context,
        boolean computed
) {
}
