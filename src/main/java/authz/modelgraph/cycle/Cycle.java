package authz.modelgraph.cycle;

import java.util.List;

/**
 * Elementary cycle, starting at its lowest node id. The closing step back to
 * the first node is implied; a self-loop has a single node.
 */
public record Cycle(
        List<Integer> nodeIds,
        List<String> labels,
        CycleKind kind
) {
    public Cycle {
        nodeIds = List.copyOf(nodeIds);
        labels = List.copyOf(labels);
    }

    public boolean isDefinitive() {
        return kind == CycleKind.DEFINITIVE;
    }

    public int length() {
        return nodeIds.size();
    }

    /** e.g. {@code resource#a -> resource#b -> resource#a} */
    public String describe() {
        return String.join(" -> ", labels) + " -> " + labels.get(0);
    }
}
