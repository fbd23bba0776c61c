package dev.apicius.engine;

import dev.apicius.model.Diagnostic;

import java.util.List;

/**
 * Outcome of analyzing a {@link DirectedStructure}: every diagnostic found
 * while building and checking it, and, when there are none, an order in which
 * each vertex comes after all of its predecessors.
 */
public record Analysis(
    DirectedStructure structure,
    List<Diagnostic> diagnostics,
    List<Integer> buildOrder // empty unless diagnostics is empty
) {
    public Analysis {
        diagnostics = List.copyOf(diagnostics);
        buildOrder = List.copyOf(buildOrder);
    }

    public boolean isValid() {
        return diagnostics.isEmpty();
    }
}
