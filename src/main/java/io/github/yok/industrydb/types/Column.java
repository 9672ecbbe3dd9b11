package io.github.yok.industrydb.types;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * Named, single-typed, immutable sequence of values.
 *
 * <p>
 * Binary values are copied on construction and on access, so a column never changes once built.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@ToString(of = {"name", "type"})
public final class Column {

    @Getter
    private final String name;

    @Getter
    private final ColumnType type;

    private final List<Object> values;

    /**
     * Creates a column.
     *
     * @param name column name
     * @param type value type
     * @param values values in row order, nulls allowed
     * @throws IllegalArgumentException if the name is blank or a value does not match the type
     */
    public Column(String name, ColumnType type, List<?> values) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Column name must not be blank");
        }
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        List<Object> copy = new ArrayList<>(Objects.requireNonNull(values, "values").size());
        for (int i = 0; i < values.size(); i++) {
            Object value = values.get(i);
            if (!type.accepts(value)) {
                throw new IllegalArgumentException("Column '" + name + "' of type " + type
                        + " cannot hold " + value.getClass().getName() + " at row " + i);
            }
            copy.add(value instanceof byte[] ? ((byte[]) value).clone() : value);
        }
        this.values = Collections.unmodifiableList(copy);
    }

    /**
     * Creates a column from varargs values.
     *
     * @param name column name
     * @param type value type
     * @param values values in row order
     * @return column
     */
    public static Column of(String name, ColumnType type, Object... values) {
        return new Column(name, type, Arrays.asList(values));
    }

    /**
     * Returns the number of values.
     *
     * @return row count
     */
    public int size() {
        return values.size();
    }

    /**
     * Returns the value at a row.
     *
     * @param row zero based row index
     * @return value, possibly {@code null}; binary values are returned as a copy
     */
    public Object get(int row) {
        Object value = values.get(row);
        return value instanceof byte[] ? ((byte[]) value).clone() : value;
    }

    /**
     * Returns whether the value at a row is null.
     *
     * @param row zero based row index
     * @return {@code true} if null
     */
    public boolean isNull(int row) {
        return values.get(row) == null;
    }

    /**
     * Returns all values in row order.
     *
     * @return unmodifiable list; binary values are copies
     */
    public List<Object> getValues() {
        if (type != ColumnType.BINARY) {
            return values;
        }
        List<Object> copy = new ArrayList<>(values.size());
        for (Object value : values) {
            copy.add(value == null ? null : ((byte[]) value).clone());
        }
        return Collections.unmodifiableList(copy);
    }
}
