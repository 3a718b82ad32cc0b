package authz.modelgraph.model;

/**
 * A rewrite carries a variant outside the supported set, usually a model written
 * for a newer schema than this tool understands.
 */
public class UnsupportedRewriteVariantException extends RuntimeException {

    private final String variant;

    public UnsupportedRewriteVariantException(String type, String relation, String variant) {
        super("unsupported rewrite variant '" + variant + "' in " + Labels.relation(type, relation));
        this.variant = variant;
    }

    public String variant() {
        return variant;
    }
}
