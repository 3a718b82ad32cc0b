package authz.modelgraph.model;

import java.util.Objects;

/**
 * One entry of a relation's directly assignable user types, e.g. {@code user},
 * {@code user:*}, {@code group#member} or {@code user with expiry}.
 * {@code relation} and {@code condition} are null when absent.
 */
public record RelatedTypeRef(
        String type,
        String relation,
        boolean wildcard,
        String condition
) {
    public RelatedTypeRef {
        Objects.requireNonNull(type, "type");
        if (relation != null && relation.isEmpty()) {
            relation = null;
        }
        if (condition != null && condition.isEmpty()) {
            condition = null;
        }
    }

    public static RelatedTypeRef of(String type) {
        return new RelatedTypeRef(type, null, false, null);
    }

    public static RelatedTypeRef wildcardOf(String type) {
        return new RelatedTypeRef(type, null, true, null);
    }

    public static RelatedTypeRef userset(String type, String relation) {
        return new RelatedTypeRef(type, relation, false, null);
    }

    public RelatedTypeRef withCondition(String conditionName) {
        return new RelatedTypeRef(type, relation, wildcard, conditionName);
    }

    public boolean hasRelation() {
        return relation != null;
    }

    public boolean hasCondition() {
        return condition != null;
    }
}
