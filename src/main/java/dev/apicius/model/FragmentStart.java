package dev.apicius.model;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Where a rule begins: raw ingredients, or the continuation of a join point.
 */
public sealed interface FragmentStart {

    /** One or more raw ingredients joined by {@code +}. Repeats collapse to one. */
    record IngredientGroup(List<Ingredient> ingredients) implements FragmentStart {
        public IngredientGroup {
            ingredients = List.copyOf(new LinkedHashSet<>(ingredients));
            if (ingredients.isEmpty()) {
                throw new IllegalArgumentException("Ingredient group must not be empty");
            }
        }
    }

    /** Picks up where the rules ending at {@code $name} left off. */
    record Join(TextHandle name) implements FragmentStart {}
}
