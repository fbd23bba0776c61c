package dev.apicius.engine;

/**
 * Unchecked exception thrown when recipe source text cannot be parsed.
 * Line and column are 1-based.
 */
public class RecipeSyntaxException extends RuntimeException {

    private final int line;
    private final int column;

    public RecipeSyntaxException(String message, int line, int column) {
        super("%d:%d: %s".formatted(line, column, message));
        this.line = line;
        this.column = column;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
