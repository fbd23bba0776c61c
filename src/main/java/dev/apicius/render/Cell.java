package dev.apicius.render;

import java.util.List;

/**
 * One cell of a table layout, with its text already resolved.
 */
public record Cell(int colspan, int rowspan, Content content) {

    public sealed interface Content {}

    public record IngredientContent(String name, String amount) implements Content {

        public String debug() {
            return amount == null ? name : "[%s] %s".formatted(amount, name);
        }
    }

    public record StepContent(String name, List<IngredientContent> seasonings) implements Content {
        public StepContent {
            seasonings = List.copyOf(seasonings);
        }
    }

    /** The final {@code <>} column. */
    public record DoneContent() implements Content {}

    public String debug() {
        if (content instanceof IngredientContent ingredient) {
            return ingredient.debug();
        } else if (content instanceof StepContent step) {
            if (step.seasonings().isEmpty()) {
                return step.name();
            }
            var seasonings = step.seasonings().stream().map(IngredientContent::debug).toList();
            return step.name() + " & " + String.join(",", seasonings);
        }
        return "<>";
    }
}
