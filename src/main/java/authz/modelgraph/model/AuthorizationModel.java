package authz.modelgraph.model;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validated authorization model: ordered type definitions plus the names of the
 * conditions it declares. Immutable once constructed.
 */
public record AuthorizationModel(
        String schemaVersion,
        List<TypeDefinition> typeDefinitions,
        Set<String> conditions
) {
    public AuthorizationModel {
        Objects.requireNonNull(typeDefinitions, "typeDefinitions");
        typeDefinitions = List.copyOf(typeDefinitions);
        conditions = conditions == null ? Set.of() : Set.copyOf(conditions);
    }

    public static AuthorizationModel of(TypeDefinition... typeDefinitions) {
        return new AuthorizationModel("1.1", List.of(typeDefinitions), Set.of());
    }
}
