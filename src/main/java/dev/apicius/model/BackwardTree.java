package dev.apicius.model;

import java.util.List;

/**
 * The checked recipe seen backwards from its end, ready for rendering.
 * All join points are gone: each node holds a straight run of actions and
 * is either a leaf fed by raw ingredients or a merge of its {@code paths}.
 * The root is a synthetic wrapper with no actions, no ingredients and a
 * single path.
 *
 * <p>{@code size} is the number of ingredient leaves feeding a node and
 * {@code maxDepth} the longest run of actions from the node down to any
 * leaf. Both drive chart layout.
 *
 * <p>Actions are listed in preparation order.
 */
public record BackwardTree(
    List<ActionStep> actions,
    List<Ingredient> ingredients,
    int size,
    int maxDepth,
    List<BackwardTree> paths
) {
    public BackwardTree {
        actions = List.copyOf(actions);
        ingredients = List.copyOf(ingredients);
        paths = List.copyOf(paths);
    }

    public static BackwardTree leaf(List<ActionStep> actions, List<Ingredient> ingredients) {
        return new BackwardTree(actions, ingredients, ingredients.size(), actions.size(), List.of());
    }

    public static BackwardTree branch(List<ActionStep> actions, List<BackwardTree> paths) {
        int size = 0;
        int deepest = 0;
        for (BackwardTree path : paths) {
            size += path.size();
            deepest = Math.max(deepest, path.maxDepth());
        }
        return new BackwardTree(actions, List.of(), size, actions.size() + deepest, paths);
    }

    /** The root handed to renderers: no actions, no ingredients, one path. */
    public static BackwardTree wrap(BackwardTree child) {
        return new BackwardTree(List.of(), List.of(), child.size(), child.maxDepth(), List.of(child));
    }

    public boolean isLeaf() {
        return paths.isEmpty();
    }
}
