package dev.apicius.engine;

import dev.apicius.model.Recipe;

/**
 * A parsed recipe together with the registry its handles belong to.
 */
public record ParsedRecipe(Registry registry, Recipe recipe) {

    public <T> Printable<T> printable(T value) {
        return Printable.of(value, registry);
    }
}
