package io.github.yok.industrydb.dialect;

import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.types.Column;
import io.github.yok.industrydb.types.ColumnType;
import io.github.yok.industrydb.types.ColumnarBatch;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import lombok.Generated;
import org.apache.commons.lang3.StringUtils;

/**
 * Renders {@link CrudRequest}s as SQL for a {@link SqlDialect}.
 *
 * <p>
 * All methods are pure: the same request and dialect always produce the same statements.
 * </p>
 *
 * <ul>
 * <li>INSERT: one {@code (?, ...)} group per row. Dialects with multi-row insert get as few
 * statements as their row and parameter limits allow; others get one statement per row. An empty
 * batch yields no statement.</li>
 * <li>SELECT: {@code *} without a column list; the row cap appears exactly once, as
 * {@code SELECT TOP n} or as a trailing {@code LIMIT n}.</li>
 * <li>UPDATE: assignments are inline literals ordered by column name.</li>
 * <li>DELETE: without a predicate every row is removed.</li>
 * </ul>
 *
 * @author Yasuharu.Okawauchi
 */
public final class CrudSqlBuilder {

    /**
     * Prevents instantiation of this utility class.
     */
    @Generated
    private CrudSqlBuilder() {}

    /**
     * Renders any CRUD request.
     *
     * @param request request
     * @param dialect target dialect
     * @return statements to run in order; a single statement except for inserts
     * @throws IndustryDbException with {@code INVALID_PARAMETER} if the request cannot be rendered
     */
    public static List<SqlStatement> build(CrudRequest request, SqlDialect dialect)
            throws IndustryDbException {
        if (request instanceof CrudRequest.Insert) {
            return buildInsert((CrudRequest.Insert) request, dialect);
        }
        if (request instanceof CrudRequest.Select) {
            return Collections.singletonList(buildSelect((CrudRequest.Select) request, dialect));
        }
        if (request instanceof CrudRequest.Update) {
            return Collections.singletonList(buildUpdate((CrudRequest.Update) request, dialect));
        }
        if (request instanceof CrudRequest.Delete) {
            return Collections.singletonList(buildDelete((CrudRequest.Delete) request, dialect));
        }
        throw IndustryDbException.invalidParameter("Unsupported request " + request);
    }

    /**
     * Renders an insert.
     *
     * @param request insert request
     * @param dialect target dialect
     * @return statements, empty when the batch has no rows
     * @throws IndustryDbException with {@code INVALID_PARAMETER} for blank identifiers, a value the
     *         dialect cannot hold, or more columns than the dialect's parameter limit
     */
    public static List<SqlStatement> buildInsert(CrudRequest.Insert request, SqlDialect dialect)
            throws IndustryDbException {
        ColumnarBatch batch = request.getBatch();
        String table = quoteTable(request.getTable(), dialect);
        if (batch.getColumnCount() == 0 || batch.getRowCount() == 0) {
            return Collections.emptyList();
        }
        int columnCount = batch.getColumnCount();
        if (columnCount > dialect.getMaxParameters()) {
            throw IndustryDbException.invalidParameter(
                    columnCount + " columns exceed the " + dialect.getMaxParameters()
                            + " parameter limit of " + dialect.getDatabaseType());
        }

        StringJoiner columnList = new StringJoiner(", ", " (", ")");
        List<ColumnType> rowTypes = new ArrayList<>(columnCount);
        for (Column column : batch.getColumns()) {
            columnList.add(quoteIdentifier(column.getName(), dialect));
            rowTypes.add(column.getType());
        }
        String prefix = "INSERT INTO " + table + columnList + " VALUES ";

        int rowsPerStatement = 1;
        if (dialect.isMultiRowInsert()) {
            rowsPerStatement = Math.max(1, Math.min(dialect.getMaxRowsPerInsert(),
                    dialect.getMaxParameters() / columnCount));
        }

        List<SqlStatement> statements = new ArrayList<>();
        for (int start = 0; start < batch.getRowCount(); start += rowsPerStatement) {
            int end = Math.min(start + rowsPerStatement, batch.getRowCount());
            StringJoiner groups = new StringJoiner(", ");
            List<Object> params = new ArrayList<>((end - start) * columnCount);
            List<ColumnType> types = new ArrayList<>((end - start) * columnCount);
            int marker = 1;
            for (int row = start; row < end; row++) {
                StringJoiner group = new StringJoiner(", ", "(", ")");
                for (Column column : batch.getColumns()) {
                    Object value = column.get(row);
                    checkRepresentable(value, column.getName(), dialect);
                    group.add(dialect.getPlaceholderStyle().marker(marker++));
                    params.add(value);
                }
                types.addAll(rowTypes);
                groups.add(group.toString());
            }
            statements.add(new SqlStatement(prefix + groups, params, types));
        }
        return statements;
    }

    /**
     * Renders a select.
     *
     * @param request select request
     * @param dialect target dialect
     * @return statement
     * @throws IndustryDbException with {@code INVALID_PARAMETER} for blank identifiers or a
     *         negative row cap
     */
    public static SqlStatement buildSelect(CrudRequest.Select request, SqlDialect dialect)
            throws IndustryDbException {
        Long rowCap = request.getRowCap();
        if (rowCap != null && rowCap < 0) {
            throw IndustryDbException.invalidParameter("Row cap must not be negative: " + rowCap);
        }
        StringBuilder sql = new StringBuilder("SELECT ");
        if (rowCap != null
                && dialect.getPaginationStyle() == SqlDialect.PaginationStyle.PREFIX_TOP) {
            sql.append("TOP ").append(rowCap).append(' ');
        }
        if (request.getColumns().isEmpty()) {
            sql.append('*');
        } else {
            StringJoiner columns = new StringJoiner(", ");
            for (String column : request.getColumns()) {
                columns.add(quoteIdentifier(column, dialect));
            }
            sql.append(columns);
        }
        sql.append(" FROM ").append(quoteTable(request.getTable(), dialect));
        appendWhere(sql, request.getPredicate());
        if (rowCap != null
                && dialect.getPaginationStyle() == SqlDialect.PaginationStyle.SUFFIX_LIMIT) {
            sql.append(" LIMIT ").append(rowCap);
        }
        return SqlStatement.of(sql.toString(), request.getParams());
    }

    /**
     * Renders an update.
     *
     * @param request update request
     * @param dialect target dialect
     * @return statement
     * @throws IndustryDbException with {@code INVALID_PARAMETER} for blank identifiers, an empty
     *         assignment map or a value that cannot be rendered as a literal
     */
    public static SqlStatement buildUpdate(CrudRequest.Update request, SqlDialect dialect)
            throws IndustryDbException {
        String table = quoteTable(request.getTable(), dialect);
        if (request.getValues().isEmpty()) {
            throw IndustryDbException.invalidParameter("No columns to update in " + table);
        }
        StringJoiner assignments = new StringJoiner(", ");
        for (Map.Entry<String, Object> entry : new TreeMap<>(request.getValues()).entrySet()) {
            assignments.add(quoteIdentifier(entry.getKey(), dialect) + " = "
                    + LiteralRenderer.render(entry.getValue(), dialect));
        }
        StringBuilder sql =
                new StringBuilder("UPDATE ").append(table).append(" SET ").append(assignments);
        appendWhere(sql, request.getPredicate());
        return SqlStatement.of(sql.toString(), request.getParams());
    }

    /**
     * Renders a delete.
     *
     * @param request delete request
     * @param dialect target dialect
     * @return statement
     * @throws IndustryDbException with {@code INVALID_PARAMETER} for a blank table name
     */
    public static SqlStatement buildDelete(CrudRequest.Delete request, SqlDialect dialect)
            throws IndustryDbException {
        StringBuilder sql =
                new StringBuilder("DELETE FROM ").append(quoteTable(request.getTable(), dialect));
        appendWhere(sql, request.getPredicate());
        return SqlStatement.of(sql.toString(), request.getParams());
    }

    /**
     * Quotes a possibly schema qualified table name part by part.
     *
     * @param table table name, for example {@code dbo.orders}
     * @param dialect target dialect
     * @return quoted name, for example {@code [dbo].[orders]}
     * @throws IndustryDbException with {@code INVALID_PARAMETER} if the name or a part is blank
     */
    public static String quoteTable(String table, SqlDialect dialect) throws IndustryDbException {
        if (StringUtils.isBlank(table)) {
            throw IndustryDbException.invalidParameter("Table name must not be blank");
        }
        StringJoiner quoted = new StringJoiner(".");
        for (String part : StringUtils.splitPreserveAllTokens(table, '.')) {
            if (StringUtils.isBlank(part)) {
                throw IndustryDbException.invalidParameter("Malformed table name: " + table);
            }
            quoted.add(dialect.quote(part));
        }
        return quoted.toString();
    }

    /**
     * Quotes a column name.
     *
     * @param identifier column name
     * @param dialect target dialect
     * @return quoted name
     * @throws IndustryDbException with {@code INVALID_PARAMETER} if the name is blank
     */
    public static String quoteIdentifier(String identifier, SqlDialect dialect)
            throws IndustryDbException {
        if (StringUtils.isBlank(identifier)) {
            throw IndustryDbException.invalidParameter("Column name must not be blank");
        }
        return dialect.quote(identifier);
    }

    private static void appendWhere(StringBuilder sql, String predicate) {
        if (StringUtils.isNotBlank(predicate)) {
            sql.append(" WHERE ").append(predicate);
        }
    }

    private static void checkRepresentable(Object value, String column, SqlDialect dialect)
            throws IndustryDbException {
        if (value instanceof Double && !Double.isFinite((Double) value)
                && !dialect.isNonFiniteFloats()) {
            throw IndustryDbException.invalidParameter("Column '" + column + "': " + value
                    + " is not representable on " + dialect.getDatabaseType());
        }
    }
}
