package io.github.yok.industrydb.connector;

import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.types.ColumnarBatch;
import java.util.List;
import java.util.Map;

/**
 * Table level operations rendered in the connector's SQL dialect.
 *
 * <p>
 * Predicates are raw SQL placed after {@code WHERE}; their {@code ?} markers are bound from
 * {@code params}. A {@code null} predicate means every row.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface CrudConnector extends DatabaseConnector {

    /**
     * Inserts every row of a batch.
     *
     * <p>
     * Rows may be sent in several statements. If a later statement fails, rows of earlier
     * statements stay inserted and the thrown exception carries their count as its partial
     * outcome.
     * </p>
     *
     * @param table target table
     * @param batch rows to insert, column names matching the table
     * @return rows inserted
     * @throws IndustryDbException if a statement fails or the connector is closed
     */
    OperationOutcome insert(String table, ColumnarBatch batch) throws IndustryDbException;

    /**
     * Reads rows.
     *
     * @param table source table
     * @param columns columns to read, {@code null} or empty for all
     * @param predicate filter, may be {@code null}
     * @param params values for the predicate's markers, may be {@code null}
     * @param rowCap maximum rows, {@code null} for no cap
     * @return rows read
     * @throws IndustryDbException if the query fails or the connector is closed
     */
    ColumnarBatch select(String table, List<String> columns, String predicate, List<?> params,
            Long rowCap) throws IndustryDbException;

    /**
     * Reads every row and column of a table.
     *
     * @param table source table
     * @return rows read
     * @throws IndustryDbException if the query fails or the connector is closed
     */
    default ColumnarBatch select(String table) throws IndustryDbException {
        return select(table, null, null, null, null);
    }

    /**
     * Updates matching rows.
     *
     * @param table target table
     * @param values new values by column name
     * @param predicate filter, may be {@code null} to update every row
     * @param params values for the predicate's markers, may be {@code null}
     * @return rows updated
     * @throws IndustryDbException if the statement fails or the connector is closed
     */
    OperationOutcome update(String table, Map<String, ?> values, String predicate, List<?> params)
            throws IndustryDbException;

    /**
     * Deletes matching rows.
     *
     * @param table target table
     * @param predicate filter, may be {@code null} to delete every row
     * @param params values for the predicate's markers, may be {@code null}
     * @return rows deleted
     * @throws IndustryDbException if the statement fails or the connector is closed
     */
    OperationOutcome delete(String table, String predicate, List<?> params)
            throws IndustryDbException;
}
