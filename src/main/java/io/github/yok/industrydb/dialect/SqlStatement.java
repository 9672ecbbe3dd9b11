package io.github.yok.industrydb.dialect;

import io.github.yok.industrydb.types.ColumnType;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * SQL text with its ordered bind values.
 *
 * <p>
 * {@link #getParameterTypes()} runs parallel to {@link #getParameters()}; an entry is the column
 * type a value was taken from, or {@code null} when unknown. It is only consulted to bind typed
 * nulls.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class SqlStatement {

    private final String sql;

    private final List<Object> parameters;

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    private final List<ColumnType> parameterTypes;

    /**
     * Creates a statement.
     *
     * @param sql SQL text
     * @param parameters bind values, nulls allowed
     * @param parameterTypes column types parallel to the values, entries may be {@code null}
     */
    public SqlStatement(String sql, List<?> parameters, List<ColumnType> parameterTypes) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
        if (parameterTypes.size() != parameters.size()) {
            throw new IllegalArgumentException("Expected " + parameters.size()
                    + " parameter types but got " + parameterTypes.size());
        }
        this.parameterTypes = Collections.unmodifiableList(new ArrayList<>(parameterTypes));
    }

    /**
     * Creates a statement whose parameter types are unknown.
     *
     * @param sql SQL text
     * @param parameters bind values
     * @return statement
     */
    public static SqlStatement of(String sql, List<?> parameters) {
        return new SqlStatement(sql, parameters, Collections.nCopies(parameters.size(), null));
    }

    /**
     * Creates a statement without parameters.
     *
     * @param sql SQL text
     * @return statement
     */
    public static SqlStatement of(String sql) {
        return of(sql, Collections.emptyList());
    }
}
