package dev.apicius.model;

import java.util.List;

/**
 * Result of checking a recipe.
 */
public sealed interface CheckResult {

    record Success(BackwardTree tree) implements CheckResult {}

    record Failure(List<Diagnostic> diagnostics) implements CheckResult {
        public Failure {
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
