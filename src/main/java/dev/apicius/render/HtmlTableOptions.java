package dev.apicius.render;

/**
 * Settings for HTML table output: CSS class names for each kind of cell, and
 * the header and footer wrapped around the table in standalone mode.
 */
public record HtmlTableOptions(
    boolean standalone,
    String htmlHeader,
    String htmlFooter,
    String amountClass,
    String seasoningsClass,
    String ingredientClass,
    String actionClass,
    String doneClass
) {
    public static final String DEFAULT_HTML_HEADER = """
        <!DOCTYPE html>
        <html>
          <body>
            <style type="text/css">
              body { font-family: "Fira Sans", arial; }
              td {
                padding: 1em;
              }
              table, td, tr {
                border: 2px solid;
                border-spacing: 0px;
              }
              .ingredient {
                background-color: #ddd;
              }
              .done {
                background-color: #555;
              }
              .amount { color: #555; }
              .seasonings { color: #333; }
            </style>
        """;
    public static final String DEFAULT_HTML_FOOTER = """
          </body>
        </html>
        """;
    public static final String DEFAULT_AMOUNT_CLASS = "amount";
    public static final String DEFAULT_SEASONINGS_CLASS = "seasonings";
    public static final String DEFAULT_INGREDIENT_CLASS = "ingredient";
    public static final String DEFAULT_ACTION_CLASS = "action";
    public static final String DEFAULT_DONE_CLASS = "done";

    public static HtmlTableOptions defaults() {
        return new HtmlTableOptions(false, DEFAULT_HTML_HEADER, DEFAULT_HTML_FOOTER,
            DEFAULT_AMOUNT_CLASS, DEFAULT_SEASONINGS_CLASS, DEFAULT_INGREDIENT_CLASS,
            DEFAULT_ACTION_CLASS, DEFAULT_DONE_CLASS);
    }

    public HtmlTableOptions withStandalone(boolean standalone) {
        return new HtmlTableOptions(standalone, htmlHeader, htmlFooter, amountClass, seasoningsClass,
            ingredientClass, actionClass, doneClass);
    }
}
