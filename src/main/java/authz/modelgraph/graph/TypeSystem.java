package authz.modelgraph.graph;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import authz.modelgraph.model.AuthorizationModel;
import authz.modelgraph.model.RelatedTypeRef;
import authz.modelgraph.model.RewriteExpression;
import authz.modelgraph.model.TypeDefinition;

/**
 * Read-only lookups over a model:
 * - type#relation -> rewrite
 * - type#relation -> directly related user types
 */
public final class TypeSystem {

    private final Map<String, TypeDefinition> typesByName = new HashMap<>();

    public TypeSystem(AuthorizationModel model) {
        Objects.requireNonNull(model, "model");
        for (TypeDefinition td : model.typeDefinitions()) {
            typesByName.put(td.type(), td);
        }
    }

    public Relation getRelation(String type, String relation) {
        final TypeDefinition td = typesByName.get(type);
        if (td == null) {
            throw ModelLookupException.unknownType(type, relation);
        }
        final RewriteExpression rewrite = td.relations().get(relation);
        if (rewrite == null) {
            throw ModelLookupException.unknownRelation(type, relation);
        }
        return new Relation(relation, rewrite, td.directlyRelatedUserTypes().getOrDefault(relation, List.of()));
    }

    public List<RelatedTypeRef> getDirectlyRelatedUserTypes(String type, String relation) {
        return getRelation(type, relation).directlyRelatedUserTypes();
    }

    public boolean hasType(String type) {
        return typesByName.containsKey(type);
    }

    public record Relation(
            String name,
            RewriteExpression rewrite,
            List<RelatedTypeRef> directlyRelatedUserTypes
    ) {
    }
}
