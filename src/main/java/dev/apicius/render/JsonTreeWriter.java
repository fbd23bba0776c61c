package dev.apicius.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.apicius.engine.Registry;
import dev.apicius.model.ActionStep;
import dev.apicius.model.BackwardTree;
import dev.apicius.model.Ingredient;

import java.io.UncheckedIOException;

/**
 * Writes a {@link BackwardTree} as JSON with every handle resolved, for
 * renderers living outside this process.
 */
public final class JsonTreeWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JsonTreeWriter() {}

    public static String write(BackwardTree tree, Registry registry) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(tree, registry));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize backward tree", e);
        }
    }

    public static ObjectNode toJson(BackwardTree tree, Registry registry) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("size", tree.size());
        node.put("maxDepth", tree.maxDepth());

        ArrayNode actions = node.putArray("actions");
        for (ActionStep action : tree.actions()) {
            ObjectNode step = actions.addObject();
            step.put("action", registry.resolve(action.description()));
            ArrayNode seasonings = step.putArray("seasonings");
            action.seasonings().forEach(i -> seasonings.add(ingredient(i, registry)));
        }

        ArrayNode ingredients = node.putArray("ingredients");
        tree.ingredients().forEach(i -> ingredients.add(ingredient(i, registry)));

        ArrayNode paths = node.putArray("paths");
        tree.paths().forEach(p -> paths.add(toJson(p, registry)));
        return node;
    }

    private static ObjectNode ingredient(Ingredient ingredient, Registry registry) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("name", registry.resolve(ingredient.name()));
        if (ingredient.hasAmount()) {
            node.put("amount", registry.resolve(ingredient.amount()));
        } else {
            node.putNull("amount");
        }
        return node;
    }
}
