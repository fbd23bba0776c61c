package dev.apicius.engine;

import dev.apicius.engine.DirectedStructure.Edge;
import dev.apicius.engine.DirectedStructure.Vertex;
import dev.apicius.engine.DirectedStructure.VertexKind;
import dev.apicius.model.ActionStep;
import dev.apicius.model.BackwardTree;
import dev.apicius.model.BodyElement;
import dev.apicius.model.Diagnostic;
import dev.apicius.model.FragmentEnd;
import dev.apicius.model.FragmentStart;
import dev.apicius.model.Ingredient;
import dev.apicius.model.PathFragment;
import dev.apicius.model.Recipe;
import dev.apicius.model.TextHandle;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders handle-bearing values as text by resolving every handle against
 * the registry that minted it. Recipes print back in source syntax.
 */
public final class Printer {

    private final Registry registry;

    public Printer(Registry registry) {
        this.registry = registry;
    }

    public String text(TextHandle handle) {
        return registry.resolve(handle);
    }

    public String join(TextHandle name) {
        return "$" + registry.resolve(name);
    }

    public String ingredient(Ingredient ingredient) {
        if (ingredient.hasAmount()) {
            return "[%s] %s".formatted(registry.resolve(ingredient.amount()), registry.resolve(ingredient.name()));
        }
        return registry.resolve(ingredient.name());
    }

    public String ingredients(List<Ingredient> ingredients) {
        return ingredients.stream().map(this::ingredient).collect(Collectors.joining(" + "));
    }

    public String actionStep(ActionStep step) {
        String description = registry.resolve(step.description());
        if (step.seasonings().isEmpty()) {
            return description;
        }
        return description + " & " + ingredients(step.seasonings());
    }

    public String actionSteps(List<ActionStep> steps) {
        return steps.stream().map(this::actionStep).collect(Collectors.joining(", ", "[", "]"));
    }

    public String start(FragmentStart start) {
        if (start instanceof FragmentStart.IngredientGroup group) {
            return ingredients(group.ingredients());
        } else if (start instanceof FragmentStart.Join j) {
            return join(j.name());
        }
        throw new IllegalArgumentException("Unknown fragment start: " + start.getClass().getSimpleName());
    }

    public String bodyElement(BodyElement element) {
        if (element instanceof BodyElement.Step step) {
            return actionStep(step.step());
        } else if (element instanceof BodyElement.Join j) {
            return join(j.name());
        }
        throw new IllegalArgumentException("Unknown body element: " + element.getClass().getSimpleName());
    }

    /** Empty for an open end. */
    public String end(FragmentEnd end) {
        if (end instanceof FragmentEnd.Join j) {
            return join(j.name());
        } else if (end instanceof FragmentEnd.Terminal) {
            return "<>";
        }
        return "";
    }

    public String fragment(PathFragment fragment) {
        var sb = new StringBuilder(start(fragment.start()));
        for (BodyElement element : fragment.body()) {
            sb.append(" -> ").append(bodyElement(element));
        }
        String end = end(fragment.end());
        if (!end.isEmpty()) {
            sb.append(" -> ").append(end);
        }
        return sb.toString();
    }

    public String recipe(Recipe recipe) {
        var sb = new StringBuilder();
        sb.append(registry.resolve(recipe.name())).append(" {\n");
        for (PathFragment fragment : recipe.fragments()) {
            sb.append("  ").append(fragment(fragment)).append(";\n");
        }
        sb.append("}");
        return sb.toString();
    }

    /**
     * The structure read backwards: each join point and {@code <>}, followed
     * by one line per incoming edge tracing the steps back to their source.
     */
    public String structure(DirectedStructure structure) {
        var sb = new StringBuilder();
        sb.append("analysis {\n");
        appendIncoming(sb, structure, structure.terminal());
        for (Vertex vertex : structure.vertices()) {
            if (vertex.kind() == VertexKind.JOIN) {
                appendIncoming(sb, structure, vertex);
            }
        }
        sb.append("}");
        return sb.toString();
    }

    private void appendIncoming(StringBuilder sb, DirectedStructure structure, Vertex vertex) {
        sb.append("  ").append(vertexLabel(vertex)).append('\n');
        for (Edge edge : structure.incoming(vertex.id())) {
            sb.append("   ");
            List<ActionStep> actions = edge.actions();
            for (int i = actions.size() - 1; i >= 0; i--) {
                sb.append(" <- ").append(actionStep(actions.get(i)));
            }
            sb.append(" <- ").append(vertexLabel(structure.vertex(edge.from()))).append('\n');
        }
    }

    public String vertexLabel(Vertex vertex) {
        return switch (vertex.kind()) {
            case TERMINAL -> "<>";
            case JOIN -> join(vertex.joinName());
            case INGREDIENT_ROOT -> ingredients(vertex.ingredients());
        };
    }

    /** Vertex ids are printed as is; only the actions carry handles. */
    public String edge(Edge edge) {
        return "%d -> %d %s".formatted(edge.from(), edge.to(), actionSteps(edge.actions()));
    }

    public String tree(BackwardTree tree) {
        var sb = new StringBuilder();
        appendTree(sb, tree, "", "");
        return sb.toString().stripTrailing();
    }

    private void appendTree(StringBuilder sb, BackwardTree node, String firstIndent, String indent) {
        sb.append(firstIndent).append("size: ").append(node.size()).append('\n');
        sb.append(indent).append("max_depth: ").append(node.maxDepth()).append('\n');
        if (!node.actions().isEmpty()) {
            sb.append(indent).append("actions: ").append(actionSteps(node.actions())).append('\n');
        }
        if (!node.ingredients().isEmpty()) {
            sb.append(indent).append("ingredients: [").append(ingredientsList(node.ingredients())).append("]\n");
        }
        if (!node.paths().isEmpty()) {
            sb.append(indent).append("paths:\n");
            for (BackwardTree path : node.paths()) {
                appendTree(sb, path, indent + "- ", indent + "  ");
            }
        }
    }

    private String ingredientsList(List<Ingredient> ingredients) {
        return ingredients.stream().map(this::ingredient).collect(Collectors.joining(", "));
    }

    public String diagnostic(Diagnostic diagnostic) {
        String message;
        if (diagnostic instanceof Diagnostic.UnknownJoinReference d) {
            message = "join point '%s' is continued but no rule leads into it".formatted(join(d.name()));
        } else if (diagnostic instanceof Diagnostic.MissingContinuation d) {
            message = "join point '%s' is never continued by any rule".formatted(join(d.name()));
        } else if (diagnostic instanceof Diagnostic.DuplicateContinuation d) {
            message = "join point '%s' is continued by more than one rule".formatted(join(d.name()));
        } else if (diagnostic instanceof Diagnostic.OrphanIngredientRoot d) {
            message = "path starting from ingredients list '%s' goes through actions '%s' but never reaches a join point"
                .formatted(ingredients(d.ingredients()), actionChain(d.actions()));
        } else if (diagnostic instanceof Diagnostic.DanglingSteps d) {
            message = "path starting at join point '%s' goes through actions '%s' but never reaches a join point"
                .formatted(join(d.join()), actionChain(d.actions()));
        } else if (diagnostic instanceof Diagnostic.CycleDetected d) {
            message = "the join point '%s' is involved in a cycle".formatted(join(d.name()));
        } else if (diagnostic instanceof Diagnostic.DisconnectedChain d) {
            message = "ingredients '%s' never reach `<>`".formatted(ingredients(d.ingredients()));
        } else if (diagnostic instanceof Diagnostic.EmptyRecipe) {
            message = "no `<>` state";
        } else {
            throw new IllegalArgumentException("Unknown diagnostic: " + diagnostic);
        }
        return diagnostic.span().isKnown() ? diagnostic.span() + ": " + message : message;
    }

    private String actionChain(List<ActionStep> actions) {
        return actions.stream().map(this::actionStep).collect(Collectors.joining(" -> "));
    }

    public String diagnostics(List<Diagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "graph ok";
        }
        var sb = new StringBuilder("graph problems:");
        for (Diagnostic diagnostic : diagnostics) {
            sb.append("\n - ").append(diagnostic(diagnostic));
        }
        return sb.toString();
    }
}
