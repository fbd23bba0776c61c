package dev.apicius.model;

/**
 * Stable handle to a string interned in a {@link dev.apicius.engine.Registry}.
 * Two handles from the same registry are equal exactly when their text is equal.
 * Handles carry no reference to the registry that minted them.
 */
public record TextHandle(int index) {

    public TextHandle {
        if (index < 0) {
            throw new IllegalArgumentException("Handle index must be non-negative: " + index);
        }
    }
}
