package dev.apicius.engine;

import dev.apicius.model.ActionStep;
import dev.apicius.model.Diagnostic;
import dev.apicius.model.Ingredient;
import dev.apicius.model.SourceSpan;
import dev.apicius.model.TextHandle;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The recipe as a graph: ingredient roots and join points linked by forward
 * edges that carry runs of action steps, all flowing into one terminal vertex.
 * Vertices are addressed by integer id; ids follow creation order.
 *
 * <p>Instances are assembled by {@link StructureBuilder} and carry the
 * diagnostics found while assembling them. Incoming edges are kept in the
 * order they were registered, which is the source order of the rules.
 */
public final class DirectedStructure {

    public enum VertexKind { INGREDIENT_ROOT, JOIN, TERMINAL }

    /**
     * A point in the graph. {@code joinName} is set for joins only,
     * {@code ingredients} for ingredient roots only.
     */
    public record Vertex(
        int id,
        VertexKind kind,
        TextHandle joinName,
        List<Ingredient> ingredients,
        SourceSpan span
    ) {
        public Vertex {
            ingredients = List.copyOf(ingredients);
        }
    }

    /** A run of actions between two vertices, registered by rule {@code fragmentIndex}. */
    public record Edge(int from, int to, List<ActionStep> actions, int fragmentIndex, SourceSpan span) {
        public Edge {
            actions = List.copyOf(actions);
        }
    }

    public static final int TERMINAL_ID = 0;

    private final List<Vertex> vertices = new ArrayList<>();
    private final List<List<Edge>> incoming = new ArrayList<>();
    private final List<List<Edge>> outgoing = new ArrayList<>();
    private final Map<TextHandle, Integer> joins = new HashMap<>();
    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private final Set<Integer> reported = new HashSet<>();

    DirectedStructure() {
        addVertex(VertexKind.TERMINAL, null, List.of(), SourceSpan.UNKNOWN);
    }

    int addIngredientRoot(List<Ingredient> ingredients, SourceSpan span) {
        return addVertex(VertexKind.INGREDIENT_ROOT, null, ingredients, span);
    }

    /** Id of the vertex for join {@code name}, created on first reference. */
    int joinVertex(TextHandle name, SourceSpan span) {
        Integer id = joins.get(name);
        if (id == null) {
            id = addVertex(VertexKind.JOIN, name, List.of(), span);
            joins.put(name, id);
        }
        return id;
    }

    void addEdge(Edge edge) {
        outgoing.get(edge.from()).add(edge);
        incoming.get(edge.to()).add(edge);
    }

    void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    void markReported(int id) {
        reported.add(id);
    }

    private int addVertex(VertexKind kind, TextHandle joinName, List<Ingredient> ingredients, SourceSpan span) {
        int id = vertices.size();
        vertices.add(new Vertex(id, kind, joinName, ingredients, span));
        incoming.add(new ArrayList<>());
        outgoing.add(new ArrayList<>());
        return id;
    }

    public List<Vertex> vertices() {
        return Collections.unmodifiableList(vertices);
    }

    public Vertex vertex(int id) {
        return vertices.get(id);
    }

    public Vertex terminal() {
        return vertices.get(TERMINAL_ID);
    }

    public List<Edge> incoming(int id) {
        return Collections.unmodifiableList(incoming.get(id));
    }

    /** Outgoing edges; more than one only when a join was continued twice. */
    public List<Edge> outgoing(int id) {
        return Collections.unmodifiableList(outgoing.get(id));
    }

    public int indegree(int id) {
        return incoming.get(id).size();
    }

    /** Vertex for a join, or {@code null} if the name never appeared. */
    public Vertex join(TextHandle name) {
        Integer id = joins.get(name);
        return id == null ? null : vertices.get(id);
    }

    /** Diagnostics found while assembling the structure. */
    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /** Whether a diagnostic already explains why this vertex leads nowhere. */
    public boolean isReported(int id) {
        return reported.contains(id);
    }

    public int size() {
        return vertices.size();
    }
}
