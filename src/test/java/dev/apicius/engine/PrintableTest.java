package dev.apicius.engine;

import dev.apicius.model.ActionStep;
import dev.apicius.model.BackwardTree;
import dev.apicius.model.CheckResult;
import dev.apicius.model.Diagnostic;
import dev.apicius.model.Ingredient;
import dev.apicius.model.PathFragment;
import dev.apicius.model.SourceSpan;
import dev.apicius.model.TextHandle;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PrintableTest {

    @Test
    void printsIngredientWithAmount() {
        var registry = new Registry();
        var garlic = new Ingredient(registry.intern("garlic"), registry.intern("2 cloves"));

        assertThat(Printable.of(garlic, registry)).hasToString("[2 cloves] garlic");
    }

    @Test
    void printsStepWithSeasonings() {
        var registry = new Registry();
        var step = new ActionStep(registry.intern("sautee"),
            List.of(Ingredient.of(registry.intern("butter")), Ingredient.of(registry.intern("salt"))));

        assertThat(Printable.of(step, registry)).hasToString("sautee & butter + salt");
    }

    @Test
    void printsRecipeInSourceSyntax() {
        ParsedRecipe parsed = RecipeParser.parseString(SampleRecipes.SCRAMBLED_EGGS);

        assertThat(parsed.printable(parsed.recipe()).toString()).isEqualTo("""
            nicer scrambled eggs {
              [1/2] onion + [1 clove] garlic -> chop coarsely -> sautee & butter -> $mix;
              [2] eggs -> whisk -> $mix;
              $mix -> stir & salt -> <>;
            }""");
    }

    @Test
    void printedRecipeParsesBackToSameFragments() {
        ParsedRecipe parsed = RecipeParser.parseString(SampleRecipes.MUSHROOMS);
        String printed = parsed.printable(parsed.recipe()).toString();

        ParsedRecipe reparsed = RecipeParser.parseString(printed);

        assertThat(reparsed.printable(reparsed.recipe()).toString()).isEqualTo(printed);
        assertThat(reparsed.recipe().fragments()).extracting(f -> f.body().size())
            .containsExactly(1, 2, 3);
    }

    @Test
    void printsStructureBackwards() {
        ParsedRecipe parsed = RecipeParser.parseString(SampleRecipes.MUSHROOMS);
        DirectedStructure structure = StructureBuilder.build(parsed.recipe());

        assertThat(parsed.printable(structure).toString()).isEqualTo("""
            analysis {
              <>
                <- sautee <- $add
              $oil
                <- mince <- [2 cloves] garlic
                <- oil
              $add
                <- fry <- $oil
                <- chop <- mushrooms
            }""");
    }

    @Test
    void printsAnalysisWithProblems() {
        ParsedRecipe parsed = RecipeParser.parseString("nothing { }");
        Analysis analysis = RecipeChecker.analyze(parsed.recipe());

        assertThat(parsed.printable(analysis).toString()).isEqualTo("""
            analysis {
              <>
            }
            graph problems:
             - no `<>` state""");
    }

    @Test
    void printsTree() {
        ParsedRecipe parsed = RecipeParser.parseString(SampleRecipes.EGGS);
        BackwardTree tree = ((CheckResult.Success) RecipeChecker.check(parsed)).tree();

        assertThat(parsed.printable(tree).toString()).isEqualTo("""
            size: 1
            max_depth: 1
            paths:
            - size: 1
              max_depth: 1
              actions: [whisk]
              ingredients: [eggs]""");
    }

    @Test
    void printsDiagnosticWithPosition() {
        var registry = new Registry();
        TextHandle mix = registry.intern("mix");

        var diagnostic = new Diagnostic.MissingContinuation(mix, new SourceSpan(2, 3));

        assertThat(Printable.of(diagnostic, registry))
            .hasToString("2:3: join point '$mix' is never continued by any rule");
    }

    @Test
    void printsDiagnosticList() {
        var registry = new Registry();
        var printer = new Printer(registry);

        assertThat(printer.diagnostics(List.of())).isEqualTo("graph ok");
        assertThat(printer.diagnostics(List.of(
            new Diagnostic.CycleDetected(registry.intern("a"), SourceSpan.UNKNOWN),
            new Diagnostic.EmptyRecipe())))
            .isEqualTo("""
                graph problems:
                 - the join point '$a' is involved in a cycle
                 - no `<>` state""");
    }

    @Test
    void printingWithWrongRegistryIsFatal() {
        ParsedRecipe parsed = RecipeParser.parseString(SampleRecipes.MUSHROOMS);

        assertThatThrownBy(() -> Printable.of(parsed.recipe(), new Registry()).toString())
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void printsFragmentParts() {
        ParsedRecipe parsed = RecipeParser.parseString(SampleRecipes.MUSHROOMS);
        PathFragment garlic = parsed.recipe().fragments().get(0);
        PathFragment mushrooms = parsed.recipe().fragments().get(2);

        assertThat(parsed.printable(garlic.start())).hasToString("[2 cloves] garlic");
        assertThat(parsed.printable(garlic.body().get(0))).hasToString("mince");
        assertThat(parsed.printable(garlic.end())).hasToString("$oil");
        assertThat(parsed.printable(mushrooms.body().get(1))).hasToString("$add");
        assertThat(parsed.printable(mushrooms.end())).hasToString("<>");
    }

    @Test
    void printsListsElementByElement() {
        ParsedRecipe parsed = RecipeParser.parseString(SampleRecipes.MUSHROOMS);
        PathFragment mushrooms = parsed.recipe().fragments().get(2);

        assertThat(parsed.printable(mushrooms.body())).hasToString("[chop, $add, sautee]");
    }

    @Test
    void printsVerticesAndEdges() {
        ParsedRecipe parsed = RecipeParser.parseString(SampleRecipes.MUSHROOMS);
        DirectedStructure structure = StructureBuilder.build(parsed.recipe());

        assertThat(parsed.printable(structure.terminal())).hasToString("<>");
        assertThat(parsed.printable(structure.vertex(1))).hasToString("[2 cloves] garlic");
        assertThat(parsed.printable(structure.join(parsed.registry().lookup("add")))).hasToString("$add");
        assertThat(parsed.printable(structure.incoming(DirectedStructure.TERMINAL_ID).get(0)))
            .hasToString("4 -> 0 [sautee]");
    }

    @Test
    void printsCheckResults() {
        ParsedRecipe eggs = RecipeParser.parseString(SampleRecipes.EGGS);
        ParsedRecipe broken = RecipeParser.parseString("broken { eggs -> whisk -> $mix; }");

        assertThat(eggs.printable(RecipeChecker.check(eggs)).toString()).contains("actions: [whisk]");
        assertThat(broken.printable(RecipeChecker.check(broken)).toString())
            .startsWith("graph problems:")
            .contains("join point '$mix' is never continued by any rule")
            .doesNotContain("TextHandle");
    }

    @Test
    void refusesValuesItCannotResolve() {
        var registry = new Registry();

        assertThatThrownBy(() -> Printable.of(42, registry).toString())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("java.lang.Integer");
    }
}
