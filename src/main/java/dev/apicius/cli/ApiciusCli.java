package dev.apicius.cli;

import dev.apicius.engine.Analysis;
import dev.apicius.engine.ParsedRecipe;
import dev.apicius.engine.Printer;
import dev.apicius.engine.RecipeChecker;
import dev.apicius.engine.RecipeParser;
import dev.apicius.engine.RecipeSyntaxException;
import dev.apicius.model.BackwardTree;
import dev.apicius.model.CheckResult;
import dev.apicius.render.HtmlTableOptions;
import dev.apicius.render.HtmlTableRenderer;
import dev.apicius.render.JsonTreeWriter;
import dev.apicius.render.TableLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI entry point for apicius. Every command reads a recipe from INPUT
 * (default: stdin) and writes to OUTPUT (default: stdout); {@code -} means
 * the standard stream.
 */
@Command(
    name = "apicius",
    mixinStandardHelpOptions = true,
    description = "Check recipes written in the Apicius language and render them as charts.",
    subcommands = {
        ApiciusCli.DebugParseTree.class,
        ApiciusCli.DebugAnalysis.class,
        ApiciusCli.DebugBackwardTree.class,
        ApiciusCli.DebugTable.class,
        ApiciusCli.HtmlTable.class,
        ApiciusCli.JsonTree.class
    }
)
public class ApiciusCli implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_RECIPE = 1;
    static final int EXIT_IO_ERROR = 2;

    private static final Logger LOG = LoggerFactory.getLogger(ApiciusCli.class);

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().getErr().println("Error: a command is required.");
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_INVALID_RECIPE;
    }

    /**
     * Shared input/output handling. Subclasses render a parsed recipe.
     */
    public abstract static class RecipeCommand implements Callable<Integer> {

        @Spec
        CommandSpec spec;

        @Parameters(index = "0", arity = "0..1", description = "Recipe source file (default: stdin)")
        String input;

        @Parameters(index = "1", arity = "0..1", description = "Output file (default: stdout)")
        String output;

        @Override
        public Integer call() {
            PrintWriter err = spec.commandLine().getErr();
            ParsedRecipe parsed;
            try {
                parsed = RecipeParser.parseString(readInput());
            } catch (IOException e) {
                LOG.debug("Failed to read recipe from {}", describe(input), e);
                err.println("Error reading " + describe(input) + ": " + e.getMessage());
                return EXIT_IO_ERROR;
            } catch (RecipeSyntaxException e) {
                err.println("Syntax error in " + describe(input) + " at " + e.getMessage());
                return EXIT_INVALID_RECIPE;
            }

            try {
                return render(parsed);
            } catch (IOException e) {
                LOG.debug("Failed to write output to {}", describe(output), e);
                err.println("Error writing " + describe(output) + ": " + e.getMessage());
                return EXIT_IO_ERROR;
            }
        }

        abstract int render(ParsedRecipe parsed) throws IOException;

        /**
         * Check the recipe, printing diagnostics on failure. Returns null when
         * the recipe has problems.
         */
        BackwardTree checkedTree(ParsedRecipe parsed) {
            CheckResult result = RecipeChecker.check(parsed);
            if (result instanceof CheckResult.Failure failure) {
                LOG.debug("Recipe {} has {} problems", describe(input), failure.diagnostics().size());
                spec.commandLine().getErr().println(new Printer(parsed.registry()).diagnostics(failure.diagnostics()));
                return null;
            }
            return ((CheckResult.Success) result).tree();
        }

        private String readInput() throws IOException {
            if (input == null || "-".equals(input)) {
                return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            }
            return Files.readString(Path.of(input), StandardCharsets.UTF_8);
        }

        void write(String text) throws IOException {
            if (output == null || "-".equals(output)) {
                PrintWriter out = spec.commandLine().getOut();
                out.println(text);
                out.flush();
                return;
            }
            try (Writer writer = Files.newBufferedWriter(Path.of(output), StandardCharsets.UTF_8)) {
                writer.write(text);
                writer.write(System.lineSeparator());
            }
        }

        private static String describe(String path) {
            return path == null || "-".equals(path) ? "<stdin/stdout>" : path;
        }
    }

    @Command(name = "debug-parse-tree", mixinStandardHelpOptions = true,
        description = "Print the raw parse tree")
    public static class DebugParseTree extends RecipeCommand {
        @Override
        int render(ParsedRecipe parsed) throws IOException {
            write(new Printer(parsed.registry()).recipe(parsed.recipe()));
            return EXIT_OK;
        }
    }

    @Command(name = "debug-analysis", mixinStandardHelpOptions = true,
        description = "Print the analysis output")
    public static class DebugAnalysis extends RecipeCommand {
        @Override
        int render(ParsedRecipe parsed) throws IOException {
            Analysis analysis = RecipeChecker.analyze(parsed.recipe());
            write(parsed.printable(analysis).toString());
            return analysis.isValid() ? EXIT_OK : EXIT_INVALID_RECIPE;
        }
    }

    @Command(name = "debug-backward-tree", mixinStandardHelpOptions = true,
        description = "Print the generated backward tree")
    public static class DebugBackwardTree extends RecipeCommand {
        @Override
        int render(ParsedRecipe parsed) throws IOException {
            BackwardTree tree = checkedTree(parsed);
            if (tree == null) {
                return EXIT_INVALID_RECIPE;
            }
            write(parsed.printable(tree).toString());
            return EXIT_OK;
        }
    }

    @Command(name = "debug-table", mixinStandardHelpOptions = true,
        description = "Print the raw table layout info")
    public static class DebugTable extends RecipeCommand {
        @Override
        int render(ParsedRecipe parsed) throws IOException {
            BackwardTree tree = checkedTree(parsed);
            if (tree == null) {
                return EXIT_INVALID_RECIPE;
            }
            write(TableLayout.of(tree, parsed.registry()).debug());
            return EXIT_OK;
        }
    }

    @Command(name = "html-table", mixinStandardHelpOptions = true,
        description = "Convert the recipe to an HTML table")
    public static class HtmlTable extends RecipeCommand {

        @Option(names = "--standalone", description = "Wrap the table in a complete HTML document")
        boolean standalone;

        @Option(names = "--html-header", description = "HTML emitted before the table in standalone mode")
        String htmlHeader;

        @Option(names = "--html-footer", description = "HTML emitted after the table in standalone mode")
        String htmlFooter;

        @Option(names = "--amount-class", defaultValue = HtmlTableOptions.DEFAULT_AMOUNT_CLASS,
            description = "CSS class for ingredient amounts (default: ${DEFAULT-VALUE})")
        String amountClass;

        @Option(names = "--seasonings-class", defaultValue = HtmlTableOptions.DEFAULT_SEASONINGS_CLASS,
            description = "CSS class for seasonings (default: ${DEFAULT-VALUE})")
        String seasoningsClass;

        @Option(names = "--ingredient-class", defaultValue = HtmlTableOptions.DEFAULT_INGREDIENT_CLASS,
            description = "CSS class for ingredient cells (default: ${DEFAULT-VALUE})")
        String ingredientClass;

        @Option(names = "--action-class", defaultValue = HtmlTableOptions.DEFAULT_ACTION_CLASS,
            description = "CSS class for action cells (default: ${DEFAULT-VALUE})")
        String actionClass;

        @Option(names = "--done-class", defaultValue = HtmlTableOptions.DEFAULT_DONE_CLASS,
            description = "CSS class for the final cell (default: ${DEFAULT-VALUE})")
        String doneClass;

        @Override
        int render(ParsedRecipe parsed) throws IOException {
            BackwardTree tree = checkedTree(parsed);
            if (tree == null) {
                return EXIT_INVALID_RECIPE;
            }
            write(HtmlTableRenderer.render(TableLayout.of(tree, parsed.registry()), options()));
            return EXIT_OK;
        }

        HtmlTableOptions options() {
            return new HtmlTableOptions(
                standalone,
                htmlHeader != null ? htmlHeader : HtmlTableOptions.DEFAULT_HTML_HEADER,
                htmlFooter != null ? htmlFooter : HtmlTableOptions.DEFAULT_HTML_FOOTER,
                amountClass, seasoningsClass, ingredientClass, actionClass, doneClass);
        }
    }

    @Command(name = "json-tree", mixinStandardHelpOptions = true,
        description = "Print the backward tree as JSON")
    public static class JsonTree extends RecipeCommand {
        @Override
        int render(ParsedRecipe parsed) throws IOException {
            BackwardTree tree = checkedTree(parsed);
            if (tree == null) {
                return EXIT_INVALID_RECIPE;
            }
            write(JsonTreeWriter.write(tree, parsed.registry()));
            return EXIT_OK;
        }
    }

    public static CommandLine commandLine() {
        return new CommandLine(new ApiciusCli());
    }
}
