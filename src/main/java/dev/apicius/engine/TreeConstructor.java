package dev.apicius.engine;

import dev.apicius.engine.DirectedStructure.Edge;
import dev.apicius.engine.DirectedStructure.Vertex;
import dev.apicius.engine.DirectedStructure.VertexKind;
import dev.apicius.model.ActionStep;
import dev.apicius.model.BackwardTree;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a validated {@link DirectedStructure} into a {@link BackwardTree},
 * starting from {@code <>} and walking edges backwards.
 *
 * <p>A vertex with a single incoming edge is a pass-through: its actions join
 * the run being accumulated and the walk carries on behind it, so a straight
 * preparation spanning several join points becomes one node. The run ends at
 * an ingredient root, which yields a leaf, or at a vertex with several
 * incoming edges, which yields a node with one path per edge in rule order.
 *
 * <p>No validation happens here. Sizes and depths are also computed over the
 * analyzer's build order and compared with the built nodes; a mismatch means
 * the analysis let an invalid structure through and is thrown as
 * {@link IllegalStateException}.
 */
public final class TreeConstructor {

    private final DirectedStructure structure;
    private final int[] sizes;
    private final int[] depths;

    private TreeConstructor(DirectedStructure structure) {
        this.structure = structure;
        this.sizes = new int[structure.size()];
        this.depths = new int[structure.size()];
    }

    public static BackwardTree construct(Analysis analysis) {
        if (!analysis.isValid()) {
            throw new IllegalStateException(
                "Cannot build a tree from an analysis with %d diagnostics".formatted(analysis.diagnostics().size()));
        }
        var constructor = new TreeConstructor(analysis.structure());
        constructor.measure(analysis.buildOrder());
        BackwardTree top = constructor.build(DirectedStructure.TERMINAL_ID, List.of());
        return BackwardTree.wrap(top);
    }

    /** Bottom-up size and depth per vertex; predecessors come first in {@code order}. */
    private void measure(List<Integer> order) {
        for (int id : order) {
            Vertex vertex = structure.vertex(id);
            if (vertex.kind() == VertexKind.INGREDIENT_ROOT) {
                sizes[id] = vertex.ingredients().size();
                depths[id] = 0;
                continue;
            }
            int size = 0;
            int depth = 0;
            for (Edge edge : structure.incoming(id)) {
                size += sizes[edge.from()];
                depth = Math.max(depth, edge.actions().size() + depths[edge.from()]);
            }
            sizes[id] = size;
            depths[id] = depth;
        }
    }

    private BackwardTree build(int start, List<ActionStep> seed) {
        var run = new ArrayList<ActionStep>(seed);
        int at = start;
        while (true) {
            Vertex vertex = structure.vertex(at);
            if (vertex.kind() == VertexKind.INGREDIENT_ROOT) {
                return verify(start, seed, BackwardTree.leaf(run, vertex.ingredients()));
            }

            List<Edge> incoming = structure.incoming(at);
            if (incoming.isEmpty()) {
                throw new IllegalStateException("Vertex %d has no incoming edges".formatted(at));
            }
            if (incoming.size() == 1) {
                Edge edge = incoming.get(0);
                run.addAll(0, edge.actions());
                at = edge.from();
                continue;
            }

            var paths = new ArrayList<BackwardTree>(incoming.size());
            for (Edge edge : incoming) {
                paths.add(build(edge.from(), edge.actions()));
            }
            return verify(start, seed, BackwardTree.branch(run, paths));
        }
    }

    private BackwardTree verify(int start, List<ActionStep> seed, BackwardTree node) {
        int expectedDepth = seed.size() + depths[start];
        if (node.size() != sizes[start] || node.maxDepth() != expectedDepth) {
            throw new IllegalStateException(
                "Node built from vertex %d has size %d and depth %d, expected %d and %d"
                    .formatted(start, node.size(), node.maxDepth(), sizes[start], expectedDepth));
        }
        return node;
    }
}
