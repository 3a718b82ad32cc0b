package authz.modelgraph.model;

import java.util.Objects;

/**
 * Node and edge label formats used in the rendered graph.
 */
public final class Labels {

    private Labels() {
    }

    public static String wildcard(String type) {
        Objects.requireNonNull(type, "type");
        return type + ":*";
    }

    public static String relation(String type, String relation) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(relation, "relation");
        return type + "#" + relation;
    }

    /**
     * Type part of a conditioned direct assignment. The leading space keeps it
     * from ever colliding with a plain type name.
     */
    public static String conditioned(String type, String condition) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(condition, "condition");
        return " " + type + "[with " + condition + "]";
    }

    public static String tuplesetContext(String type, String tuplesetRelation) {
        return "(" + relation(type, tuplesetRelation) + ")";
    }

    /**
     * Source label for one directly related user type.
     * Sub-relation wins over wildcard; the condition decorates the type part.
     */
    public static String directSource(RelatedTypeRef ref) {
        Objects.requireNonNull(ref, "ref");
        final String typePart = ref.hasCondition() ? conditioned(ref.type(), ref.condition()) : ref.type();
        if (ref.hasRelation()) {
            return relation(typePart, ref.relation());
        }
        if (ref.wildcard()) {
            return wildcard(typePart);
        }
        return typePart;
    }
}
