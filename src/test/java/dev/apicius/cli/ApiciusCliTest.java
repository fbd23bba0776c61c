package dev.apicius.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.apicius.engine.SampleRecipes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class ApiciusCliTest {

    @TempDir
    Path tempDir;

    private CommandLine cli;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        cli = ApiciusCli.commandLine();
        out = new StringWriter();
        err = new StringWriter();
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
    }

    private Path recipe(String name, String source) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, source);
        return file;
    }

    @Test
    void printsTableLayout() throws IOException {
        Path input = recipe("eggs.recipe", SampleRecipes.EGGS);

        int code = cli.execute("debug-table", input.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_OK);
        assertThat(out.toString()).startsWith(" (1, 1, eggs) (1, 1, whisk) (1, 1, <>)");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void rendersStandaloneHtml() throws IOException {
        Path input = recipe("eggs.recipe", SampleRecipes.EGGS);

        int code = cli.execute("html-table", "--standalone", "--done-class", "finished", input.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_OK);
        assertThat(out.toString())
            .startsWith("<!DOCTYPE html>")
            .contains("<td class=\"finished\" rowspan=\"1\" colspan=\"1\">&lt;&gt;</td>");
    }

    @Test
    void usesCustomHeaderInStandaloneMode() throws IOException {
        Path input = recipe("eggs.recipe", SampleRecipes.EGGS);

        int code = cli.execute("html-table", "--standalone", "--html-header", "<main>",
            "--html-footer", "</main>", input.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_OK);
        assertThat(out.toString()).startsWith("<main>\n<table>").contains("</table>\n</main>");
    }

    @Test
    void writesToOutputFile() throws IOException {
        Path input = recipe("mushrooms.recipe", SampleRecipes.MUSHROOMS);
        Path output = tempDir.resolve("tree.json");

        int code = cli.execute("json-tree", input.toString(), output.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_OK);
        assertThat(out.toString()).isEmpty();
        JsonNode tree = new ObjectMapper().readTree(output.toFile());
        assertThat(tree.get("size").asInt()).isEqualTo(3);
        assertThat(tree.get("maxDepth").asInt()).isEqualTo(3);
    }

    @Test
    void printsAnalysisOfValidRecipe() throws IOException {
        Path input = recipe("mushrooms.recipe", SampleRecipes.MUSHROOMS);

        int code = cli.execute("debug-analysis", input.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_OK);
        assertThat(out.toString()).startsWith("analysis {").contains("graph ok");
    }

    @Test
    void printsParseTreeInSourceSyntax() throws IOException {
        Path input = recipe("eggs.recipe", SampleRecipes.EGGS);

        int code = cli.execute("debug-parse-tree", input.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_OK);
        assertThat(out.toString()).contains("eggs -> whisk -> <>;");
    }

    @Test
    void reportsProblemsOfInvalidRecipe() throws IOException {
        Path input = recipe("broken.recipe", """
            broken {
              eggs -> whisk -> $mix;
            }
            """);

        int code = cli.execute("debug-backward-tree", input.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_INVALID_RECIPE);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString())
            .contains("graph problems:")
            .contains("join point '$mix' is never continued by any rule");
    }

    @Test
    void analysisOfInvalidRecipeStillPrints() throws IOException {
        Path input = recipe("broken.recipe", "broken { eggs -> whisk -> $mix; }");

        int code = cli.execute("debug-analysis", input.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_INVALID_RECIPE);
        assertThat(out.toString()).contains("graph problems:");
    }

    @Test
    void reportsSyntaxErrors() throws IOException {
        Path input = recipe("bad.recipe", "bad { eggs -> whisk ");

        int code = cli.execute("debug-table", input.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_INVALID_RECIPE);
        assertThat(err.toString()).startsWith("Syntax error in " + input + " at 1:");
    }

    @Test
    void missingInputIsAnIoError() {
        Path missing = tempDir.resolve("nowhere.recipe");

        int code = cli.execute("debug-table", missing.toString());

        assertThat(code).isEqualTo(ApiciusCli.EXIT_IO_ERROR);
        assertThat(err.toString()).contains("Error reading " + missing);
    }

    @Test
    void requiresACommand() {
        int code = cli.execute();

        assertThat(code).isEqualTo(ApiciusCli.EXIT_INVALID_RECIPE);
        assertThat(err.toString()).contains("a command is required").contains("debug-table");
    }

    @Test
    void ioErrorIsReportedOnce() {
        Path missing = tempDir.resolve("nowhere.recipe");
        PrintStream stderr = System.err;
        var captured = new ByteArrayOutputStream();
        int code;
        try {
            System.setErr(new PrintStream(captured, true, StandardCharsets.UTF_8));
            code = cli.execute("debug-table", missing.toString());
        } finally {
            System.setErr(stderr);
        }

        assertThat(code).isEqualTo(ApiciusCli.EXIT_IO_ERROR);
        assertThat(err.toString()).isEqualTo("Error reading " + missing + ": " + missing + System.lineSeparator());
        assertThat(captured.toString(StandardCharsets.UTF_8)).doesNotContain("NoSuchFileException");
    }
}
