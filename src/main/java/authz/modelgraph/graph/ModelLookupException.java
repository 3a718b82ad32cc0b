package authz.modelgraph.graph;

import authz.modelgraph.model.Labels;

/**
 * A rewrite refers to a type or relation the model does not define.
 */
public class ModelLookupException extends RuntimeException {

    private final String type;
    private final String relation;

    public ModelLookupException(String type, String relation, String message) {
        super(message);
        this.type = type;
        this.relation = relation;
    }

    public static ModelLookupException unknownType(String type, String relation) {
        return new ModelLookupException(type, relation,
                "type '" + type + "' not found (while resolving '" + Labels.relation(type, relation) + "')");
    }

    public static ModelLookupException unknownRelation(String type, String relation) {
        return new ModelLookupException(type, relation,
                "relation '" + Labels.relation(type, relation) + "' not found");
    }

    public String type() {
        return type;
    }

    public String relation() {
        return relation;
    }
}
