package authz.modelgraph;

import java.util.Objects;

import authz.modelgraph.cycle.CycleAnalyzer;
import authz.modelgraph.cycle.CycleReport;
import authz.modelgraph.graph.Graph;
import authz.modelgraph.graph.GraphBuilder;
import authz.modelgraph.graph.TypeSystem;
import authz.modelgraph.io.DotWriter;
import authz.modelgraph.model.AuthorizationModel;

/**
 * build -> analyze -> prune -> render, as one call. Any failure aborts the
 * whole run; callers never see a partial result.
 */
public final class ModelGraphPipeline {

    private final CycleAnalyzer analyzer = new CycleAnalyzer();
    private final DotWriter dotWriter = new DotWriter();

    public Result run(AuthorizationModel model) {
        Objects.requireNonNull(model, "model");

        final TypeSystem typeSystem = new TypeSystem(model);
        final Graph graph = new GraphBuilder(model, typeSystem).build();
        final CycleReport cycles = analyzer.classify(graph);

        // prune only for rendering
        final Graph pruned = graph.withoutIsolatedNodes();
        final String dot = dotWriter.render(pruned);

        return new Result(graph, pruned, dot, cycles);
    }

    public record Result(
            Graph graph,
            Graph renderedGraph,
            String dot,
            CycleReport cycles
    ) {
    }
}
