package authz.modelgraph.model;

import java.util.List;
import java.util.Objects;

/**
 * Closed set of relation rewrite formulas. Consumers switch over {@link #kind()},
 * so adding a variant is a compile error at every switch expression that does
 * not handle it.
 */
public sealed interface RewriteExpression {

    enum Kind {
        DIRECT,
        COMPUTED_REFERENCE,
        TUPLESET_REFERENCE,
        UNION,
        INTERSECTION,
        DIFFERENCE
    }

    Kind kind();

    static RewriteExpression direct() {
        return Direct.INSTANCE;
    }

    static RewriteExpression computed(String relation) {
        return new ComputedReference(relation);
    }

    static RewriteExpression tupleset(String tuplesetRelation, String computedRelation) {
        return new TuplesetReference(tuplesetRelation, computedRelation);
    }

    static RewriteExpression union(RewriteExpression... children) {
        return new Union(List.of(children));
    }

    static RewriteExpression intersection(RewriteExpression... children) {
        return new Intersection(List.of(children));
    }

    static RewriteExpression difference(RewriteExpression base, RewriteExpression subtract) {
        return new Difference(base, subtract);
    }

    /** {@code this}: users assigned directly to the relation. */
    record Direct() implements RewriteExpression {
        static final Direct INSTANCE = new Direct();

        @Override
        public Kind kind() {
            return Kind.DIRECT;
        }
    }

    /** Another relation on the same object. */
    record ComputedReference(String relation) implements RewriteExpression {
        public ComputedReference {
            Objects.requireNonNull(relation, "relation");
        }

        @Override
        public Kind kind() {
            return Kind.COMPUTED_REFERENCE;
        }
    }

    /** {@code computedRelation from tuplesetRelation}. */
    record TuplesetReference(String tuplesetRelation, String computedRelation) implements RewriteExpression {
        public TuplesetReference {
            Objects.requireNonNull(tuplesetRelation, "tuplesetRelation");
            Objects.requireNonNull(computedRelation, "computedRelation");
        }

        @Override
        public Kind kind() {
            return Kind.TUPLESET_REFERENCE;
        }
    }

    record Union(List<RewriteExpression> children) implements RewriteExpression {
        public Union {
            children = List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.UNION;
        }
    }

    record Intersection(List<RewriteExpression> children) implements RewriteExpression {
        public Intersection {
            children = List.copyOf(children);
        }

        @Override
        public Kind kind() {
            return Kind.INTERSECTION;
        }
    }

    /** {@code base but not subtract}. */
    record Difference(RewriteExpression base, RewriteExpression subtract) implements RewriteExpression {
        public Difference {
            Objects.requireNonNull(base, "base");
            Objects.requireNonNull(subtract, "subtract");
        }

        public List<RewriteExpression> children() {
            return List.of(base, subtract);
        }

        @Override
        public Kind kind() {
            return Kind.DIFFERENCE;
        }
    }
}
