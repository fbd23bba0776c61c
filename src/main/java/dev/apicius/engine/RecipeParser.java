package dev.apicius.engine;

import dev.apicius.model.ActionStep;
import dev.apicius.model.BodyElement;
import dev.apicius.model.FragmentEnd;
import dev.apicius.model.FragmentStart;
import dev.apicius.model.Ingredient;
import dev.apicius.model.PathFragment;
import dev.apicius.model.Recipe;
import dev.apicius.model.SourceSpan;
import dev.apicius.model.TextHandle;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses Apicius recipe source into path fragments, interning all text in a
 * fresh {@link Registry}.
 *
 * <pre>
 * nicer scrambled eggs {
 *   [1/2] onion + [1 clove] garlic
 *     -> chop coarsely -> sautee &amp; butter -> $mix;
 *   [2] eggs -> whisk -> $mix;
 *   $mix -> stir &amp; salt -> &lt;&gt;;
 * }
 * </pre>
 *
 * Free text is trimmed and runs of whitespace inside it collapse to one
 * space. {@code #} comments out the rest of a line.
 */
public final class RecipeParser {

    private final String source;
    private final Registry registry;
    private int pos;
    private int line = 1;
    private int lineStart;
    private int scannedTo;

    private RecipeParser(String source) {
        this.source = source;
        this.registry = new Registry();
        this.pos = 0;
    }

    /**
     * Parse a recipe from a file.
     */
    public static ParsedRecipe parseFile(Path path) throws IOException {
        return parseString(Files.readString(path, StandardCharsets.UTF_8));
    }

    /**
     * Parse a recipe from source text.
     *
     * @throws RecipeSyntaxException if the text is not a well-formed recipe
     */
    public static ParsedRecipe parseString(String source) {
        var parser = new RecipeParser(source);
        Recipe recipe = parser.parseRecipe();
        return new ParsedRecipe(parser.registry, recipe);
    }

    private Recipe parseRecipe() {
        skipWhitespace();
        String title = readText("recipe name");
        expect('{');

        var fragments = new ArrayList<PathFragment>();
        skipWhitespace();
        while (!atEnd() && peek() != '}') {
            fragments.add(parseRule());
            skipWhitespace();
        }
        expect('}');

        skipWhitespace();
        if (!atEnd()) {
            throw error("Unexpected text after end of recipe");
        }
        return new Recipe(registry.intern(title), fragments);
    }

    private PathFragment parseRule() {
        skipWhitespace();
        SourceSpan span = spanAt(pos);
        FragmentStart start = parseInput();

        var body = new ArrayList<BodyElement>();
        boolean terminal = false;
        skipWhitespace();
        while (lookingAt("->")) {
            if (terminal) {
                throw new RecipeSyntaxException("`<>` must be the last step of a rule", span.line(), span.column());
            }
            pos += 2;
            skipWhitespace();
            if (lookingAt("<>")) {
                pos += 2;
                terminal = true;
            } else {
                body.add(parseAction());
            }
            skipWhitespace();
        }
        expect(';');

        FragmentEnd end;
        if (terminal) {
            end = new FragmentEnd.Terminal();
        } else if (!body.isEmpty() && body.get(body.size() - 1) instanceof BodyElement.Join join) {
            body.remove(body.size() - 1);
            end = new FragmentEnd.Join(join.name());
        } else {
            end = new FragmentEnd.Open();
        }
        return new PathFragment(start, body, end, span);
    }

    private FragmentStart parseInput() {
        skipWhitespace();
        if (peekIs('$')) {
            return new FragmentStart.Join(parseJoinName());
        }
        return new FragmentStart.IngredientGroup(parseIngredients());
    }

    private BodyElement parseAction() {
        if (peekIs('$')) {
            return new BodyElement.Join(parseJoinName());
        }
        TextHandle description = registry.intern(readText("action"));
        List<Ingredient> seasonings = List.of();
        skipWhitespace();
        if (peekIs('&')) {
            pos++;
            seasonings = parseIngredients();
        }
        return new BodyElement.Step(new ActionStep(description, seasonings));
    }

    private List<Ingredient> parseIngredients() {
        var ingredients = new ArrayList<Ingredient>();
        ingredients.add(parseIngredient());
        skipWhitespace();
        while (peekIs('+')) {
            pos++;
            ingredients.add(parseIngredient());
            skipWhitespace();
        }
        return ingredients;
    }

    private Ingredient parseIngredient() {
        skipWhitespace();
        TextHandle amount = null;
        if (peekIs('[')) {
            pos++;
            int close = source.indexOf(']', pos);
            if (close < 0) {
                throw error("Unclosed `[` in ingredient amount");
            }
            String text = collapse(source.substring(pos, close));
            if (text.isEmpty()) {
                throw error("Empty ingredient amount");
            }
            amount = registry.intern(text);
            pos = close + 1;
        }
        return new Ingredient(registry.intern(readText("ingredient")), amount);
    }

    private TextHandle parseJoinName() {
        expect('$');
        int begin = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            pos++;
        }
        if (pos == begin) {
            throw error("Expected a join point name after `$`");
        }
        return registry.intern(source.substring(begin, pos));
    }

    /**
     * Read free text up to the next piece of syntax.
     */
    private String readText(String what) {
        skipWhitespace();
        var sb = new StringBuilder();
        while (!atEnd() && !atSyntax()) {
            if (peek() == '#') {
                skipComment();
                sb.append(' ');
            } else {
                sb.append(peek());
                pos++;
            }
        }
        String text = collapse(sb.toString());
        if (text.isEmpty()) {
            throw error("Expected " + what);
        }
        return text;
    }

    private boolean atSyntax() {
        char c = peek();
        return switch (c) {
            case ';', '{', '}', '[', ']', '+', '&', '$' -> true;
            case '-' -> lookingAt("->");
            case '<' -> lookingAt("<>");
            default -> false;
        };
    }

    private static String collapse(String text) {
        return text.trim().replaceAll("\\s+", " ");
    }

    private void skipWhitespace() {
        while (!atEnd()) {
            if (Character.isWhitespace(peek())) {
                pos++;
            } else if (peek() == '#') {
                skipComment();
            } else {
                return;
            }
        }
    }

    private void skipComment() {
        while (!atEnd() && peek() != '\n') {
            pos++;
        }
    }

    private void expect(char c) {
        skipWhitespace();
        if (!peekIs(c)) {
            throw error(atEnd()
                ? "Expected `%c` but reached end of input".formatted(c)
                : "Expected `%c` but found `%c`".formatted(c, peek()));
        }
        pos++;
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private boolean peekIs(char c) {
        return !atEnd() && peek() == c;
    }

    private boolean lookingAt(String token) {
        return source.startsWith(token, pos);
    }

    private RecipeSyntaxException error(String message) {
        SourceSpan span = spanAt(pos);
        return new RecipeSyntaxException(message, span.line(), span.column());
    }

    /**
     * Line and column of {@code offset}. Offsets are requested in increasing
     * order, so the scan resumes where the previous call stopped.
     */
    private SourceSpan spanAt(int offset) {
        if (offset < scannedTo) {
            scannedTo = 0;
            line = 1;
            lineStart = 0;
        }
        for (int i = scannedTo; i < offset && i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
        scannedTo = Math.max(scannedTo, Math.min(offset, source.length()));
        return new SourceSpan(line, offset - lineStart + 1);
    }
}
