package dev.apicius.model;

import java.util.List;

/**
 * A problem that keeps a recipe from being turned into a {@link BackwardTree}.
 * Diagnostics are collected, never thrown, so a recipe can be fixed in one pass.
 */
public sealed interface Diagnostic {

    /** Position of the rule the problem was found in. */
    SourceSpan span();

    /** A join point is continued by some rule, but no rule ever leads into it. */
    record UnknownJoinReference(TextHandle name, SourceSpan span) implements Diagnostic {}

    /** Rules lead into a join point, but no rule carries it forward. */
    record MissingContinuation(TextHandle name, SourceSpan span) implements Diagnostic {}

    /** A second rule tries to carry a join point forward. {@code span} is that second rule. */
    record DuplicateContinuation(TextHandle name, SourceSpan span) implements Diagnostic {}

    /** A rule starting from raw ingredients never reaches a join point or {@code <>}. */
    record OrphanIngredientRoot(
        List<Ingredient> ingredients,
        List<ActionStep> actions,
        SourceSpan span
    ) implements Diagnostic {
        public OrphanIngredientRoot {
            ingredients = List.copyOf(ingredients);
            actions = List.copyOf(actions);
        }
    }

    /** Steps after a join point that never reach another join point or {@code <>}. */
    record DanglingSteps(TextHandle join, List<ActionStep> actions, SourceSpan span) implements Diagnostic {
        public DanglingSteps {
            actions = List.copyOf(actions);
        }
    }

    /** Following continuations forward comes back to this join point. */
    record CycleDetected(TextHandle name, SourceSpan span) implements Diagnostic {}

    /** The chain starting at these ingredients never reaches {@code <>}. */
    record DisconnectedChain(List<Ingredient> ingredients, SourceSpan span) implements Diagnostic {
        public DisconnectedChain {
            ingredients = List.copyOf(ingredients);
        }
    }

    /** No rule reaches {@code <>}. */
    record EmptyRecipe() implements Diagnostic {
        @Override
        public SourceSpan span() {
            return SourceSpan.UNKNOWN;
        }
    }
}
