package authz.modelgraph.load;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import authz.modelgraph.model.AuthorizationModel;
import authz.modelgraph.model.RelatedTypeRef;
import authz.modelgraph.model.RewriteExpression;
import authz.modelgraph.model.TypeDefinition;
import authz.modelgraph.model.UnsupportedRewriteVariantException;

/**
 * Reads an authorization model in the JSON form the modeling DSL compiles to:
 * <pre>
 * { "schema_version": "1.1",
 *   "type_definitions": [
 *     { "type": "document",
 *       "relations": { "viewer": { "union": { "child": [ {"this": {}}, {"computedUserset": {"relation": "editor"}} ] } } },
 *       "metadata": { "relations": { "viewer": { "directly_related_user_types": [ {"type": "user"} ] } } } } ],
 *   "conditions": { ... } }
 * </pre>
 * No semantic validation happens here; references are resolved later by the type system.
 */
public final class ModelLoader {

    private final ObjectMapper mapper;

    public ModelLoader() {
        this.mapper = new ObjectMapper();
    }

    public AuthorizationModel load(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Model file not found: " + file);
        }
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }

    public AuthorizationModel parse(String json) {
        Objects.requireNonNull(json, "json");
        final JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException ex) {
            throw new ModelFormatException("invalid JSON: " + ex.getOriginalMessage(), ex);
        }
        if (root == null || !root.isObject()) {
            throw new ModelFormatException("model must be a JSON object");
        }

        final JsonNode typeDefs = root.path("type_definitions");
        if (!typeDefs.isArray()) {
            throw new ModelFormatException("missing 'type_definitions' array");
        }

        final List<TypeDefinition> types = new ArrayList<>(typeDefs.size());
        final Set<String> seen = new HashSet<>();
        for (int i = 0; i < typeDefs.size(); i++) {
            final TypeDefinition td = readTypeDefinition(typeDefs.get(i), "type_definitions[" + i + "]");
            if (!seen.add(td.type())) {
                throw new ModelFormatException("duplicate type definition '" + td.type() + "'");
            }
            types.add(td);
        }

        final Set<String> conditions = new LinkedHashSet<>();
        root.path("conditions").fieldNames().forEachRemaining(conditions::add);

        final String schemaVersion = root.path("schema_version").isTextual()
                ? root.get("schema_version").asText()
                : null;
        return new AuthorizationModel(schemaVersion, types, conditions);
    }

    private TypeDefinition readTypeDefinition(JsonNode node, String where) {
        final String type = requiredText(node, "type", where);

        final Map<String, RewriteExpression> relations = new LinkedHashMap<>();
        final var relIt = node.path("relations").fields();
        while (relIt.hasNext()) {
            final var e = relIt.next();
            relations.put(e.getKey(), readRewrite(e.getValue(), type, e.getKey()));
        }

        final Map<String, List<RelatedTypeRef>> directlyRelated = new LinkedHashMap<>();
        final var metaIt = node.path("metadata").path("relations").fields();
        while (metaIt.hasNext()) {
            final var e = metaIt.next();
            final JsonNode refs = e.getValue().path("directly_related_user_types");
            if (!refs.isArray()) {
                continue;
            }
            final List<RelatedTypeRef> out = new ArrayList<>(refs.size());
            for (int i = 0; i < refs.size(); i++) {
                out.add(readRelatedTypeRef(refs.get(i),
                        where + ".metadata.relations." + e.getKey() + ".directly_related_user_types[" + i + "]"));
            }
            directlyRelated.put(e.getKey(), out);
        }

        return new TypeDefinition(type, relations, directlyRelated);
    }

    private RelatedTypeRef readRelatedTypeRef(JsonNode node, String where) {
        final String type = requiredText(node, "type", where);
        final String relation = node.path("relation").asText(null);
        // wildcard is an empty object when present
        final boolean wildcard = node.has("wildcard") && !node.get("wildcard").isNull();
        final String condition = node.path("condition").asText(null);
        return new RelatedTypeRef(type, relation, wildcard, condition);
    }

    private RewriteExpression readRewrite(JsonNode node, String type, String relation) {
        if (node == null || !node.isObject() || node.size() == 0) {
            throw new ModelFormatException("empty rewrite for relation '" + type + "#" + relation + "'");
        }
        final String key = node.fieldNames().next();
        final JsonNode body = node.get(key);

        return switch (key) {
            case "this" -> RewriteExpression.direct();
            case "computedUserset" ->
                    RewriteExpression.computed(requiredText(body, "relation", type + "#" + relation + ".computedUserset"));
            case "tupleToUserset" -> RewriteExpression.tupleset(
                    requiredText(body.path("tupleset"), "relation", type + "#" + relation + ".tupleToUserset.tupleset"),
                    requiredText(body.path("computedUserset"), "relation",
                            type + "#" + relation + ".tupleToUserset.computedUserset"));
            case "union" -> new RewriteExpression.Union(readChildren(body, type, relation));
            case "intersection" -> new RewriteExpression.Intersection(readChildren(body, type, relation));
            case "difference" -> RewriteExpression.difference(
                    readRewrite(body.get("base"), type, relation),
                    readRewrite(body.get("subtract"), type, relation));
            default -> throw new UnsupportedRewriteVariantException(type, relation, key);
        };
    }

    private List<RewriteExpression> readChildren(JsonNode body, String type, String relation) {
        final JsonNode children = body.path("child");
        if (!children.isArray()) {
            throw new ModelFormatException("missing 'child' array in rewrite of '" + type + "#" + relation + "'");
        }
        final List<RewriteExpression> out = new ArrayList<>(children.size());
        for (JsonNode child : children) {
            out.add(readRewrite(child, type, relation));
        }
        return out;
    }

    private static String requiredText(JsonNode node, String field, String where) {
        final JsonNode value = node == null ? null : node.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new ModelFormatException("missing '" + field + "' at " + where);
        }
        return value.asText();
    }
}
