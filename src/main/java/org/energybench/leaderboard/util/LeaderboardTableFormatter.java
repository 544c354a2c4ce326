package org.energybench.leaderboard.util;

import org.energybench.leaderboard.model.CategoryOption;
import org.energybench.leaderboard.model.Column;
import org.energybench.leaderboard.model.LeaderboardView;
import org.energybench.leaderboard.model.ViewCondition;

import java.util.List;
import java.util.Map;

/**
 * Renders a leaderboard view as a fixed-width text table for console output,
 * followed by the category legend and any view conditions.
 */
public final class LeaderboardTableFormatter {

    private static final String COLUMN_GAP = "  ";

    private LeaderboardTableFormatter() {
        // Utility class
    }

    public static String format(LeaderboardView view, List<CategoryOption> legend) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== ").append(view.getTask().getTabTitle()).append(" ===\n");
        sb.append(view.getTask().getDescription()).append('\n');

        if (view.isEmpty()) {
            sb.append("(no rows)\n");
        } else {
            List<Column> columns = view.getColumns();
            int[] widths = new int[columns.size()];
            for (int i = 0; i < columns.size(); i++) {
                widths[i] = displayWidth(columns.get(i).getLabel());
                for (Map<Column, String> row : view.getRows()) {
                    widths[i] = Math.max(widths[i], displayWidth(row.get(columns.get(i))));
                }
            }

            appendLine(sb, columns.stream().map(Column::getLabel).toArray(String[]::new), widths);
            String[] rule = new String[columns.size()];
            for (int i = 0; i < rule.length; i++) {
                rule[i] = "-".repeat(widths[i]);
            }
            appendLine(sb, rule, widths);
            for (Map<Column, String> row : view.getRows()) {
                appendLine(sb, columns.stream().map(row::get).toArray(String[]::new), widths);
            }
        }

        for (ViewCondition condition : view.getConditions()) {
            sb.append("! ").append(condition.getMessage()).append('\n');
        }

        for (CategoryOption option : legend) {
            if (option.getDescription() != null) {
                sb.append(option.getCaption()).append(": ").append(option.getDescription()).append('\n');
            }
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, String[] cells, int[] widths) {
        for (int i = 0; i < cells.length; i++) {
            if (i > 0) {
                sb.append(COLUMN_GAP);
            }
            sb.append(cells[i]);
            sb.append(" ".repeat(widths[i] - displayWidth(cells[i])));
        }
        sb.append('\n');
    }

    // Counts code points, so emoji badges take one cell
    private static int displayWidth(String text) {
        return text == null ? 0 : text.codePointCount(0, text.length());
    }
}
