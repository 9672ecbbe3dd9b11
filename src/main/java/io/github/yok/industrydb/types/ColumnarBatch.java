package io.github.yok.industrydb.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.ToString;

/**
 * Ordered set of named columns sharing one row count.
 *
 * <p>
 * This is the only result representation handed to callers, whatever the backend. A batch read from
 * a statement that produced no rows still carries the column names and types reported by the
 * driver.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString
public final class ColumnarBatch {

    private static final ColumnarBatch EMPTY = new ColumnarBatch(Collections.emptyList());

    private final List<Column> columns;

    @ToString.Exclude
    private final Map<String, Column> byName;

    private final int rowCount;

    private ColumnarBatch(List<Column> columns) {
        Map<String, Column> index = new LinkedHashMap<>();
        int rows = columns.isEmpty() ? 0 : columns.get(0).size();
        for (Column column : columns) {
            if (column.size() != rows) {
                throw new IllegalArgumentException("Column '" + column.getName() + "' has "
                        + column.size() + " rows, expected " + rows);
            }
            if (index.put(column.getName(), column) != null) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
        }
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.byName = Collections.unmodifiableMap(index);
        this.rowCount = rows;
    }

    /**
     * Creates a batch from columns.
     *
     * @param columns columns in order
     * @return batch
     * @throws IllegalArgumentException if row counts differ or names repeat
     */
    public static ColumnarBatch of(List<Column> columns) {
        return columns.isEmpty() ? EMPTY : new ColumnarBatch(columns);
    }

    /**
     * Returns the batch with no columns and no rows.
     *
     * @return empty batch
     */
    public static ColumnarBatch empty() {
        return EMPTY;
    }

    /**
     * Starts a builder.
     *
     * @return builder
     */
    public static Builder builder() {
        return new Builder();
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<Column> getColumns() {
        return columns;
    }

    /**
     * Returns the column names in order.
     *
     * @return column names
     */
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (Column column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    /**
     * Returns a column by position.
     *
     * @param index zero based position
     * @return column
     */
    public Column column(int index) {
        return columns.get(index);
    }

    /**
     * Returns a column by name.
     *
     * @param name column name (exact match)
     * @return column
     * @throws IllegalArgumentException if no such column exists
     */
    public Column column(String name) {
        Column column = byName.get(name);
        if (column == null) {
            throw new IllegalArgumentException(
                    "No column named '" + name + "' in " + byName.keySet());
        }
        return column;
    }

    /**
     * Returns whether a column with the name exists.
     *
     * @param name column name
     * @return {@code true} if present
     */
    public boolean hasColumn(String name) {
        return byName.containsKey(name);
    }

    /**
     * Returns one row as a name to value map.
     *
     * @param row zero based row index
     * @return ordered map of the row's values
     */
    public Map<String, Object> row(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " of " + rowCount);
        }
        Map<String, Object> values = new LinkedHashMap<>();
        for (Column column : columns) {
            values.put(column.getName(), column.get(row));
        }
        return values;
    }

    public boolean isEmpty() {
        return rowCount == 0;
    }

    /**
     * Incremental builder of a batch.
     */
    public static final class Builder {

        private final List<Column> columns = new ArrayList<>();
        private final Set<String> names = new HashSet<>();

        private Builder() {}

        /**
         * Adds a column.
         *
         * @param column column
         * @return this builder
         */
        public Builder column(Column column) {
            if (!names.add(column.getName())) {
                throw new IllegalArgumentException("Duplicate column name: " + column.getName());
            }
            columns.add(column);
            return this;
        }

        /**
         * Adds a column from varargs values.
         *
         * @param name column name
         * @param type value type
         * @param values values in row order
         * @return this builder
         */
        public Builder column(String name, ColumnType type, Object... values) {
            return column(Column.of(name, type, values));
        }

        /**
         * Builds the batch.
         *
         * @return batch
         */
        public ColumnarBatch build() {
            return ColumnarBatch.of(columns);
        }
    }
}
