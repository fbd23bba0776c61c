package dev.apicius.render;

import java.util.List;

/**
 * Emits a {@link TableLayout} as an HTML {@code <table>}.
 */
public final class HtmlTableRenderer {

    private HtmlTableRenderer() {}

    public static String render(TableLayout layout, HtmlTableOptions opts) {
        var sb = new StringBuilder();
        if (opts.standalone()) {
            sb.append(opts.htmlHeader()).append('\n');
        }
        sb.append("<table>\n");
        for (List<Cell> row : layout.rows()) {
            sb.append("  <tr>");
            for (Cell cell : row) {
                sb.append("<td class=\"%s\" rowspan=\"%d\" colspan=\"%d\">%s</td>".formatted(
                    cssClass(cell, opts), cell.rowspan(), cell.colspan(), contents(cell, opts)));
            }
            sb.append("</tr>\n");
        }
        sb.append("</table>\n");
        if (opts.standalone()) {
            sb.append(opts.htmlFooter()).append('\n');
        }
        return sb.toString();
    }

    private static String cssClass(Cell cell, HtmlTableOptions opts) {
        if (cell.content() instanceof Cell.IngredientContent) {
            return opts.ingredientClass();
        } else if (cell.content() instanceof Cell.StepContent) {
            return opts.actionClass();
        }
        return opts.doneClass();
    }

    private static String contents(Cell cell, HtmlTableOptions opts) {
        if (cell.content() instanceof Cell.IngredientContent ingredient) {
            return ingredient(ingredient, opts);
        } else if (cell.content() instanceof Cell.StepContent step) {
            var sb = new StringBuilder(escape(step.name()));
            if (step.seasonings().isEmpty()) {
                return sb.toString();
            }
            sb.append("<div class=\"").append(opts.seasoningsClass()).append("\">");
            for (Cell.IngredientContent seasoning : step.seasonings()) {
                sb.append(ingredient(seasoning, opts)).append(' ');
            }
            sb.append("</div>");
            return sb.toString();
        }
        return "&lt;&gt;";
    }

    private static String ingredient(Cell.IngredientContent ingredient, HtmlTableOptions opts) {
        if (ingredient.amount() == null) {
            return escape(ingredient.name());
        }
        return "<span class=\"%s\">%s</span> %s".formatted(
            opts.amountClass(), escape(ingredient.amount()), escape(ingredient.name()));
    }

    static String escape(String text) {
        var sb = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&' -> sb.append("&amp;");
                case '<' -> sb.append("&lt;");
                case '>' -> sb.append("&gt;");
                case '"' -> sb.append("&quot;");
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
