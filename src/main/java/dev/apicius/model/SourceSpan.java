package dev.apicius.model;

/**
 * Position of a rule in recipe source, 1-based. {@link #UNKNOWN} marks
 * fragments that were built programmatically.
 */
public record SourceSpan(int line, int column) {

    public static final SourceSpan UNKNOWN = new SourceSpan(0, 0);

    public boolean isKnown() {
        return line > 0;
    }

    @Override
    public String toString() {
        return isKnown() ? "%d:%d".formatted(line, column) : "?";
    }
}
