package dev.apicius.engine;

import dev.apicius.engine.DirectedStructure.Edge;
import dev.apicius.engine.DirectedStructure.Vertex;
import dev.apicius.engine.DirectedStructure.VertexKind;
import dev.apicius.model.ActionStep;
import dev.apicius.model.BodyElement;
import dev.apicius.model.Diagnostic;
import dev.apicius.model.FragmentEnd;
import dev.apicius.model.FragmentStart;
import dev.apicius.model.Ingredient;
import dev.apicius.model.PathFragment;
import dev.apicius.model.Recipe;
import dev.apicius.model.SourceSpan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves join references across the rules of a recipe and assembles them
 * into one {@link DirectedStructure}.
 *
 * <p>Each rule is walked in order. A join point at the start of a rule, or
 * passed through mid-rule, gets its continuation from the steps that follow;
 * a join point at the end of a rule receives an incoming edge carrying the
 * steps accumulated since the previous vertex. {@code <>} always receives.
 *
 * <p>Problems are recorded on the structure rather than thrown, and assembly
 * carries on so later checks can report on as much of the recipe as possible.
 */
public final class StructureBuilder {

    private StructureBuilder() {}

    public static DirectedStructure build(Recipe recipe) {
        return build(recipe.fragments());
    }

    public static DirectedStructure build(List<PathFragment> fragments) {
        var structure = new DirectedStructure();
        var dangling = new HashSet<Integer>();

        for (int i = 0; i < fragments.size(); i++) {
            walk(structure, fragments.get(i), i, dangling);
        }

        checkJoins(structure, dangling);
        return structure;
    }

    private static void walk(DirectedStructure structure, PathFragment fragment, int index, Set<Integer> dangling) {
        SourceSpan span = fragment.span();
        List<Ingredient> rootIngredients = List.of();
        int current;

        FragmentStart start = fragment.start();
        if (start instanceof FragmentStart.IngredientGroup group) {
            rootIngredients = group.ingredients();
            current = structure.addIngredientRoot(rootIngredients, span);
        } else if (start instanceof FragmentStart.Join join) {
            current = structure.joinVertex(join.name(), span);
        } else {
            throw new IllegalArgumentException("Unknown fragment start: " + start);
        }

        var run = new ArrayList<ActionStep>();
        for (BodyElement element : fragment.body()) {
            if (element instanceof BodyElement.Step step) {
                run.add(step.step());
            } else if (element instanceof BodyElement.Join join) {
                int target = structure.joinVertex(join.name(), span);
                connect(structure, current, target, run, index, span);
                current = target;
                run = new ArrayList<>();
            }
        }

        FragmentEnd end = fragment.end();
        if (end instanceof FragmentEnd.Join join) {
            int target = structure.joinVertex(join.name(), span);
            connect(structure, current, target, run, index, span);
        } else if (end instanceof FragmentEnd.Terminal) {
            connect(structure, current, DirectedStructure.TERMINAL_ID, run, index, span);
        } else if (end instanceof FragmentEnd.Open) {
            Vertex from = structure.vertex(current);
            if (from.kind() == VertexKind.INGREDIENT_ROOT && !run.isEmpty()) {
                // An ingredient with no steps and no end is left to the connectivity check.
                structure.report(new Diagnostic.OrphanIngredientRoot(rootIngredients, run, span));
                structure.markReported(current);
            } else if (from.kind() == VertexKind.JOIN && !run.isEmpty()) {
                structure.report(new Diagnostic.DanglingSteps(from.joinName(), run, span));
                structure.markReported(current);
                dangling.add(current);
            }
        }
    }

    private static void connect(DirectedStructure structure, int from, int to,
                                List<ActionStep> actions, int index, SourceSpan span) {
        Vertex source = structure.vertex(from);
        if (source.kind() == VertexKind.JOIN && !structure.outgoing(from).isEmpty()) {
            structure.report(new Diagnostic.DuplicateContinuation(source.joinName(), span));
        }
        structure.addEdge(new Edge(from, to, actions, index, span));
    }

    private static void checkJoins(DirectedStructure structure, Set<Integer> dangling) {
        for (Vertex vertex : structure.vertices()) {
            if (vertex.kind() != VertexKind.JOIN) {
                continue;
            }
            List<Edge> incoming = structure.incoming(vertex.id());
            if (incoming.isEmpty()) {
                structure.report(new Diagnostic.UnknownJoinReference(vertex.joinName(), vertex.span()));
                structure.markReported(vertex.id());
            } else if (structure.outgoing(vertex.id()).isEmpty() && !dangling.contains(vertex.id())) {
                structure.report(new Diagnostic.MissingContinuation(vertex.joinName(), incoming.get(0).span()));
                structure.markReported(vertex.id());
            }
        }
    }
}
