package dev.apicius.engine;

import dev.apicius.model.BackwardTree;
import dev.apicius.model.CheckResult;
import dev.apicius.model.Recipe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the check phase: structure building, invariant analysis and, when no
 * diagnostics were found, tree construction.
 */
public final class RecipeChecker {

    private static final Logger LOG = LoggerFactory.getLogger(RecipeChecker.class);

    private RecipeChecker() {}

    /**
     * Build and analyze the directed structure of a recipe.
     */
    public static Analysis analyze(Recipe recipe) {
        DirectedStructure structure = StructureBuilder.build(recipe);
        LOG.debug("Built structure with {} vertices from {} rules ({} diagnostics)",
            structure.size(), recipe.fragments().size(), structure.diagnostics().size());

        Analysis analysis = InvariantAnalyzer.analyze(structure);
        LOG.debug("Analysis found {} diagnostics", analysis.diagnostics().size());
        return analysis;
    }

    /**
     * Check a recipe. Returns the backward tree, or every diagnostic found.
     */
    public static CheckResult check(Recipe recipe) {
        Analysis analysis = analyze(recipe);
        if (!analysis.isValid()) {
            return new CheckResult.Failure(analysis.diagnostics());
        }
        BackwardTree tree = TreeConstructor.construct(analysis);
        LOG.debug("Built tree of size {} and depth {}", tree.size(), tree.maxDepth());
        return new CheckResult.Success(tree);
    }

    public static CheckResult check(ParsedRecipe parsed) {
        return check(parsed.recipe());
    }
}
