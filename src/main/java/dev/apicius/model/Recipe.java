package dev.apicius.model;

import java.util.List;

/**
 * A recipe is a named, ordered list of rules. Rule order is significant:
 * it fixes the order of branches in the rendered chart.
 */
public record Recipe(
    TextHandle name,
    List<PathFragment> fragments
) {
    public Recipe {
        fragments = List.copyOf(fragments);
    }
}
