package dev.apicius.engine;

import dev.apicius.model.ActionStep;
import dev.apicius.model.BackwardTree;
import dev.apicius.model.BodyElement;
import dev.apicius.model.CheckResult;
import dev.apicius.model.Diagnostic;
import dev.apicius.model.FragmentEnd;
import dev.apicius.model.FragmentStart;
import dev.apicius.model.Ingredient;
import dev.apicius.model.PathFragment;
import dev.apicius.model.Recipe;
import dev.apicius.model.TextHandle;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Pairs a value holding handles with the registry that minted them, so that
 * {@link #toString()} shows text instead of handle indices. Values themselves
 * never point back at a registry.
 */
public record Printable<T>(T value, Registry registry) {

    public static <T> Printable<T> of(T value, Registry registry) {
        return new Printable<>(value, registry);
    }

    @Override
    public String toString() {
        var printer = new Printer(registry);
        if (value instanceof TextHandle handle) {
            return printer.text(handle);
        } else if (value instanceof Ingredient ingredient) {
            return printer.ingredient(ingredient);
        } else if (value instanceof ActionStep step) {
            return printer.actionStep(step);
        } else if (value instanceof FragmentStart start) {
            return printer.start(start);
        } else if (value instanceof BodyElement element) {
            return printer.bodyElement(element);
        } else if (value instanceof FragmentEnd end) {
            return printer.end(end);
        } else if (value instanceof PathFragment fragment) {
            return printer.fragment(fragment);
        } else if (value instanceof Recipe recipe) {
            return printer.recipe(recipe);
        } else if (value instanceof DirectedStructure structure) {
            return printer.structure(structure);
        } else if (value instanceof DirectedStructure.Vertex vertex) {
            return printer.vertexLabel(vertex);
        } else if (value instanceof DirectedStructure.Edge edge) {
            return printer.edge(edge);
        } else if (value instanceof Analysis analysis) {
            return printer.structure(analysis.structure()) + "\n" + printer.diagnostics(analysis.diagnostics());
        } else if (value instanceof BackwardTree tree) {
            return printer.tree(tree);
        } else if (value instanceof Diagnostic diagnostic) {
            return printer.diagnostic(diagnostic);
        } else if (value instanceof CheckResult.Success success) {
            return printer.tree(success.tree());
        } else if (value instanceof CheckResult.Failure failure) {
            return printer.diagnostics(failure.diagnostics());
        } else if (value instanceof List<?> list) {
            return list.stream()
                .map(element -> Printable.of(element, registry).toString())
                .collect(Collectors.joining(", ", "[", "]"));
        }
        // Anything else would print raw handle indices.
        throw new IllegalArgumentException("Cannot print value of type "
            + (value == null ? "null" : value.getClass().getName()));
    }
}
