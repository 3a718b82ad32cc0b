package authz.modelgraph.graph;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

import authz.modelgraph.model.AuthorizationModel;
import authz.modelgraph.model.Labels;
import authz.modelgraph.model.RelatedTypeRef;
import authz.modelgraph.model.RewriteExpression;
import authz.modelgraph.model.TypeDefinition;

/**
 * Turns every relation rewrite of a model into edges pointing at that relation's node.
 * <p>
 * Types are visited by name, relations by name within a type, so node ids and
 * edge sequence numbers are identical across runs for the same model.
 * <p>
 * Intersection and difference only draw edges for their direct
 * {@code computedUserset} children. Direct and tupleset operands of those
 * operators, and nested operators below them, contribute nothing.
 */
public final class GraphBuilder {

    private final AuthorizationModel model;
    private final TypeSystem typeSystem;

    public GraphBuilder(AuthorizationModel model) {
        this(model, new TypeSystem(model));
    }

    public GraphBuilder(AuthorizationModel model, TypeSystem typeSystem) {
        this.model = Objects.requireNonNull(model, "model");
        this.typeSystem = Objects.requireNonNull(typeSystem, "typeSystem");
    }

    /**
     * @throws ModelLookupException if a rewrite refers to an undefined type or relation
     */
    public Graph build() {
        final GraphAccumulator acc = new GraphAccumulator();

        final List<TypeDefinition> typeDefs = new ArrayList<>(model.typeDefinitions());
        typeDefs.sort(Comparator.comparing(TypeDefinition::type));

        for (TypeDefinition td : typeDefs) {
            final String typeName = td.type();
            acc.addOrGetNode(typeName);
            acc.addOrGetNode(Labels.wildcard(typeName));

            final List<String> relationNames = new ArrayList<>(td.relations().keySet());
            relationNames.sort(Comparator.naturalOrder());

            for (String relation : relationNames) {
                final String target = Labels.relation(typeName, relation);
                acc.addOrGetNode(target);
                walk(acc, td.relations().get(relation), typeName, relation, target);
            }
        }

        return acc.toGraph();
    }

    /**
     * @return number of edges this rewrite added
     */
    private int walk(GraphAccumulator acc, RewriteExpression rewrite, String typeName, String relation, String target) {
        return switch (rewrite.kind()) {
            case DIRECT -> addDirectEdges(acc, typeName, relation, target);
            case COMPUTED_REFERENCE -> addComputedEdge(acc, (RewriteExpression.ComputedReference) rewrite, typeName, target);
            case TUPLESET_REFERENCE -> addTuplesetEdges(acc, (RewriteExpression.TuplesetReference) rewrite, typeName, target);
            case UNION -> {
                int added = 0;
                for (RewriteExpression child : ((RewriteExpression.Union) rewrite).children()) {
                    added += walk(acc, child, typeName, relation, target);
                }
                yield added;
            }
            case INTERSECTION -> addComputedChildren(acc, ((RewriteExpression.Intersection) rewrite).children(), typeName, target);
            case DIFFERENCE -> addComputedChildren(acc, ((RewriteExpression.Difference) rewrite).children(), typeName, target);
        };
    }

    private int addDirectEdges(GraphAccumulator acc, String typeName, String relation, String target) {
        int added = 0;
        for (RelatedTypeRef ref : typeSystem.getDirectlyRelatedUserTypes(typeName, relation)) {
            if (acc.addEdge(Labels.directSource(ref), target, "", false)) {
                added++;
            }
        }
        return added;
    }

    private int addTuplesetEdges(GraphAccumulator acc, RewriteExpression.TuplesetReference ttu, String typeName, String target) {
        final TypeSystem.Relation tupleset = typeSystem.getRelation(typeName, ttu.tuplesetRelation());
        final String context = Labels.tuplesetContext(typeName, tupleset.name());
        int added = 0;
        for (RelatedTypeRef ref : tupleset.directlyRelatedUserTypes()) {
            if (acc.addEdge(Labels.relation(ref.type(), ttu.computedRelation()), target, context, false)) {
                added++;
            }
        }
        return added;
    }

    private int addComputedChildren(GraphAccumulator acc, List<RewriteExpression> children, String typeName, String target) {
        int added = 0;
        for (RewriteExpression child : children) {
            if (child instanceof RewriteExpression.ComputedReference computed) {
                added += addComputedEdge(acc, computed, typeName, target);
            }
        }
        return added;
    }

    private int addComputedEdge(GraphAccumulator acc, RewriteExpression.ComputedReference computed, String typeName, String target) {
        final TypeSystem.Relation rewritten = typeSystem.getRelation(typeName, computed.relation());
        return acc.addEdge(Labels.relation(typeName, rewritten.name()), target, "", true) ? 1 : 0;
    }
}
