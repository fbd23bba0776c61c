package dev.apicius.render;

import dev.apicius.engine.Registry;
import dev.apicius.model.ActionStep;
import dev.apicius.model.BackwardTree;
import dev.apicius.model.Ingredient;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lays a {@link BackwardTree} out as table rows, ingredients on the left and
 * {@code <>} on the right. Each ingredient gets its own row; an action cell
 * spans the rows of every ingredient feeding it. Ingredient cells widen so
 * that every row ends in the same column.
 */
public final class TableLayout {

    private final List<List<Cell>> rows;

    private TableLayout(List<List<Cell>> rows) {
        this.rows = rows;
    }

    public static TableLayout of(BackwardTree tree, Registry registry) {
        var generator = new Generator(registry);
        List<List<Cell>> rows = generator.rows(tree, tree.maxDepth(), true);
        var frozen = new ArrayList<List<Cell>>(rows.size());
        for (List<Cell> row : rows) {
            frozen.add(List.copyOf(row));
        }
        return new TableLayout(Collections.unmodifiableList(frozen));
    }

    public List<List<Cell>> rows() {
        return rows;
    }

    /**
     * One line per row, each cell printed as {@code (colspan, rowspan, text)}.
     */
    public String debug() {
        var sb = new StringBuilder();
        for (List<Cell> row : rows) {
            for (Cell cell : row) {
                sb.append(" (%d, %d, %s)".formatted(cell.colspan(), cell.rowspan(), cell.debug()));
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static final class Generator {
        private final Registry registry;

        Generator(Registry registry) {
            this.registry = registry;
        }

        List<List<Cell>> rows(BackwardTree focus, int depth, boolean root) {
            var rows = new ArrayList<List<Cell>>();
            int remaining = depth - focus.actions().size();

            for (Ingredient ingredient : focus.ingredients()) {
                var row = new ArrayList<Cell>();
                row.add(new Cell(remaining + 1, 1, ingredient(ingredient)));
                rows.add(row);
            }

            if (focus.isLeaf() && !rows.isEmpty()) {
                for (ActionStep action : focus.actions()) {
                    rows.get(0).add(new Cell(1, focus.size(), step(action)));
                }
            }

            boolean first = true;
            for (BackwardTree path : focus.paths()) {
                for (List<Cell> row : rows(path, remaining, false)) {
                    if (first) {
                        if (root) {
                            row.add(new Cell(1, focus.size(), new Cell.DoneContent()));
                        } else {
                            for (ActionStep action : focus.actions()) {
                                row.add(new Cell(1, focus.size(), step(action)));
                            }
                        }
                        first = false;
                    }
                    rows.add(row);
                }
            }
            return rows;
        }

        private Cell.IngredientContent ingredient(Ingredient ingredient) {
            String amount = ingredient.hasAmount() ? registry.resolve(ingredient.amount()) : null;
            return new Cell.IngredientContent(registry.resolve(ingredient.name()), amount);
        }

        private Cell.StepContent step(ActionStep action) {
            var seasonings = new ArrayList<Cell.IngredientContent>();
            for (Ingredient seasoning : action.seasonings()) {
                seasonings.add(ingredient(seasoning));
            }
            return new Cell.StepContent(registry.resolve(action.description()), seasonings);
        }
    }
}
