package org.energybench.leaderboard.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One unparsed input row: header label to raw cell text, in header order.
 */
public final class RawRow {

    private final int rowNumber;
    private final Map<String, String> cells;

    /**
     * @param rowNumber 1-based data row number in the source (header excluded)
     * @param cells header label to raw cell; {@code null} cells mean the cell was absent
     */
    public RawRow(int rowNumber, Map<String, String> cells) {
        if (rowNumber < 1) {
            throw new IllegalArgumentException("Row number must be positive: " + rowNumber);
        }
        this.rowNumber = rowNumber;
        this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(cells, "Cells cannot be null")));
    }

    public int getRowNumber() {
        return rowNumber;
    }

    public Map<String, String> getCells() {
        return cells;
    }

    public boolean hasColumn(String label) {
        return cells.containsKey(label);
    }

    /** Raw cell for a header label; {@code null} if the column or cell is absent. */
    public String get(String label) {
        return cells.get(label);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;
        RawRow that = (RawRow) obj;
        return rowNumber == that.rowNumber && cells.equals(that.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowNumber, cells);
    }

    @Override
    public String toString() {
        return "RawRow{row=" + rowNumber + ", cells=" + cells + "}";
    }
}
