package authz.modelgraph.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One object type: its relation rewrites and, per relation, the user types that
 * may be assigned to it directly.
 */
public record TypeDefinition(
        String type,
        Map<String, RewriteExpression> relations,
        Map<String, List<RelatedTypeRef>> directlyRelatedUserTypes
) {
    public TypeDefinition {
        Objects.requireNonNull(type, "type");
        relations = relations == null ? Map.of() : Map.copyOf(relations);
        directlyRelatedUserTypes = directlyRelatedUserTypes == null ? Map.of() : copyRefs(directlyRelatedUserTypes);
    }

    public static TypeDefinition of(String type) {
        return new TypeDefinition(type, Map.of(), Map.of());
    }

    public TypeDefinition withRelation(String relation, RewriteExpression rewrite, RelatedTypeRef... directlyRelated) {
        Objects.requireNonNull(relation, "relation");
        Objects.requireNonNull(rewrite, "rewrite");
        final Map<String, RewriteExpression> rels = new LinkedHashMap<>(relations);
        rels.put(relation, rewrite);
        final Map<String, List<RelatedTypeRef>> refs = new LinkedHashMap<>(directlyRelatedUserTypes);
        if (directlyRelated.length > 0) {
            refs.put(relation, List.of(directlyRelated));
        }
        return new TypeDefinition(type, rels, refs);
    }

    private static Map<String, List<RelatedTypeRef>> copyRefs(Map<String, List<RelatedTypeRef>> in) {
        final Map<String, List<RelatedTypeRef>> out = new LinkedHashMap<>();
        for (var e : in.entrySet()) {
            out.put(e.getKey(), List.copyOf(e.getValue()));
        }
        return Map.copyOf(out);
    }
}
