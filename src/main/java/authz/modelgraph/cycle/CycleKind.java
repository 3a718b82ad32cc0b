package authz.modelgraph.cycle;

import java.util.Locale;

public enum CycleKind {
    /** Every step is a computed edge: the relation can never be resolved. */
    DEFINITIVE,
    /** At least one step is a direct or tupleset edge: loops only if the tuples do. */
    POSSIBLE;

    public String lowerName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
