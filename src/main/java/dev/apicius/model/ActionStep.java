package dev.apicius.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * One instruction in a rule. Seasonings are the incidental ingredients of an
 * {@code & butter} clause; repeated seasonings collapse to one.
 */
public record ActionStep(TextHandle description, List<Ingredient> seasonings) {

    public ActionStep {
        Objects.requireNonNull(description, "description");
        seasonings = List.copyOf(new LinkedHashSet<>(seasonings));
    }

    public static ActionStep of(TextHandle description) {
        return new ActionStep(description, List.of());
    }
}
