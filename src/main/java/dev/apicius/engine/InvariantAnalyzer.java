package dev.apicius.engine;

import dev.apicius.engine.DirectedStructure.Edge;
import dev.apicius.engine.DirectedStructure.Vertex;
import dev.apicius.engine.DirectedStructure.VertexKind;
import dev.apicius.model.Diagnostic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Proves a {@link DirectedStructure} is a single-rooted in-tree that the
 * tree constructor can walk backwards from {@code <>}.
 *
 * <p>Checks run in a fixed order: cycles, one continuation per vertex,
 * every ingredient chain reaching {@code <>}, and {@code <>} being reached
 * at all. Findings are appended to the builder's own diagnostics.
 */
public final class InvariantAnalyzer {

    private static final int UNVISITED = 0;
    private static final int ON_PATH = 1;
    private static final int DONE = 2;

    private InvariantAnalyzer() {}

    public static Analysis analyze(DirectedStructure structure) {
        var diagnostics = new ArrayList<Diagnostic>(structure.diagnostics());

        // Check 1: acyclicity
        Set<Integer> cyclic = findCycles(structure, diagnostics);

        // Check 2: at most one continuation per vertex
        checkSingleContinuation(structure, diagnostics);

        // Check 3: every ingredient root reaches <>
        boolean terminalReached = structure.indegree(DirectedStructure.TERMINAL_ID) > 0;
        if (terminalReached) {
            checkConnectivity(structure, cyclic, diagnostics);
        }

        // Check 4: <> is reached at all
        if (!terminalReached) {
            diagnostics.add(new Diagnostic.EmptyRecipe());
        }

        if (!diagnostics.isEmpty()) {
            return new Analysis(structure, diagnostics, List.of());
        }
        return new Analysis(structure, diagnostics, buildOrder(structure));
    }

    private static Set<Integer> findCycles(DirectedStructure structure, List<Diagnostic> diagnostics) {
        int[] state = new int[structure.size()];
        var cyclic = new HashSet<Integer>();

        for (Vertex vertex : structure.vertices()) {
            if (vertex.kind() == VertexKind.INGREDIENT_ROOT) {
                visit(structure, vertex.id(), state, cyclic, diagnostics);
            }
        }
        // Loops nothing feeds into are invisible from the roots.
        for (Vertex vertex : structure.vertices()) {
            if (vertex.kind() == VertexKind.JOIN && state[vertex.id()] == UNVISITED) {
                visit(structure, vertex.id(), state, cyclic, diagnostics);
            }
        }
        return cyclic;
    }

    /** One vertex on the DFS path and the index of its next outgoing edge. */
    private static final class Frame {
        final int id;
        int nextEdge;

        Frame(int id) {
            this.id = id;
        }
    }

    /** Iterative, so long chains of join points do not exhaust the call stack. */
    private static void visit(DirectedStructure structure, int startId, int[] state,
                              Set<Integer> cyclic, List<Diagnostic> diagnostics) {
        var path = new ArrayDeque<Frame>();
        state[startId] = ON_PATH;
        path.push(new Frame(startId));
        while (!path.isEmpty()) {
            Frame frame = path.peek();
            List<Edge> outgoing = structure.outgoing(frame.id);
            if (frame.nextEdge == outgoing.size()) {
                state[frame.id] = DONE;
                path.pop();
                continue;
            }
            Edge edge = outgoing.get(frame.nextEdge++);
            int next = edge.to();
            if (state[next] == ON_PATH) {
                if (cyclic.add(next)) {
                    Vertex vertex = structure.vertex(next);
                    diagnostics.add(new Diagnostic.CycleDetected(vertex.joinName(), edge.span()));
                }
            } else if (state[next] == UNVISITED) {
                state[next] = ON_PATH;
                path.push(new Frame(next));
            }
        }
    }

    private static void checkSingleContinuation(DirectedStructure structure, List<Diagnostic> diagnostics) {
        if (!structure.outgoing(DirectedStructure.TERMINAL_ID).isEmpty()) {
            throw new IllegalStateException("Terminal vertex has an outgoing edge");
        }
        for (Vertex vertex : structure.vertices()) {
            List<Edge> outgoing = structure.outgoing(vertex.id());
            if (outgoing.size() <= 1) {
                continue;
            }
            if (vertex.kind() != VertexKind.JOIN) {
                throw new IllegalStateException("Vertex %d of kind %s has %d outgoing edges"
                    .formatted(vertex.id(), vertex.kind(), outgoing.size()));
            }
            boolean alreadyReported = diagnostics.stream()
                .anyMatch(d -> d instanceof Diagnostic.DuplicateContinuation dup
                    && dup.name().equals(vertex.joinName()));
            if (!alreadyReported) {
                diagnostics.add(new Diagnostic.DuplicateContinuation(vertex.joinName(), outgoing.get(1).span()));
            }
        }
    }

    private static void checkConnectivity(DirectedStructure structure, Set<Integer> cyclic,
                                          List<Diagnostic> diagnostics) {
        for (Vertex root : structure.vertices()) {
            if (root.kind() != VertexKind.INGREDIENT_ROOT) {
                continue;
            }
            boolean reachesTerminal = false;
            boolean explained = false;

            var seen = new HashSet<Integer>();
            var frontier = new ArrayDeque<Integer>();
            frontier.push(root.id());
            while (!frontier.isEmpty()) {
                int id = frontier.pop();
                if (!seen.add(id)) {
                    continue;
                }
                if (id == DirectedStructure.TERMINAL_ID) {
                    reachesTerminal = true;
                }
                if (cyclic.contains(id) || structure.isReported(id)) {
                    explained = true;
                }
                for (Edge edge : structure.outgoing(id)) {
                    frontier.push(edge.to());
                }
            }

            if (!reachesTerminal && !explained) {
                diagnostics.add(new Diagnostic.DisconnectedChain(root.ingredients(), root.span()));
            }
        }
    }

    /**
     * Kahn's algorithm, lowest vertex id first among ready vertices.
     */
    private static List<Integer> buildOrder(DirectedStructure structure) {
        int[] remaining = new int[structure.size()];
        var ready = new PriorityQueue<Integer>();
        for (Vertex vertex : structure.vertices()) {
            remaining[vertex.id()] = structure.indegree(vertex.id());
            if (remaining[vertex.id()] == 0) {
                ready.add(vertex.id());
            }
        }

        var order = new ArrayList<Integer>(structure.size());
        while (!ready.isEmpty()) {
            int id = ready.poll();
            order.add(id);
            for (Edge edge : structure.outgoing(id)) {
                if (--remaining[edge.to()] == 0) {
                    ready.add(edge.to());
                }
            }
        }

        if (order.size() != structure.size()
            || order.get(order.size() - 1) != DirectedStructure.TERMINAL_ID) {
            throw new IllegalStateException("Validated structure has no build order ending at the terminal vertex");
        }
        return order;
    }
}
