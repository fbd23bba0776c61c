package dev.apicius.model;

import java.util.Objects;

/**
 * A named input, optionally with an amount such as {@code [2 cloves]}.
 */
public record Ingredient(
    TextHandle name,
    TextHandle amount // null when no amount is given
) {
    public Ingredient {
        Objects.requireNonNull(name, "name");
    }

    public static Ingredient of(TextHandle name) {
        return new Ingredient(name, null);
    }

    public boolean hasAmount() {
        return amount != null;
    }
}
