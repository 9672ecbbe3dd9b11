package io.github.yok.industrydb.dialect;

import io.github.yok.industrydb.types.ColumnarBatch;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One CRUD operation to be rendered by {@link CrudSqlBuilder}.
 *
 * <p>
 * Predicates are raw SQL placed verbatim after {@code WHERE}; {@code ?} markers inside a predicate
 * are bound from the request's parameters, after any parameters the builder generates itself.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface CrudRequest {

    /**
     * Returns the target table, optionally schema qualified ({@code schema.table}).
     *
     * @return table name
     */
    String getTable();

    /**
     * Inserts every row of a batch.
     */
    @Value
    class Insert implements CrudRequest {
        String table;
        @NonNull
        ColumnarBatch batch;
    }

    /**
     * Reads rows, optionally projected, filtered and capped.
     */
    @Value
    @Builder
    class Select implements CrudRequest {
        String table;
        // Empty selects every column
        @Singular
        List<String> columns;
        String predicate;
        @Singular
        List<Object> params;
        // Maximum number of rows, null for no cap
        Long rowCap;

        /**
         * Creates a request reading every row and column of a table.
         *
         * @param table table name
         * @return request
         */
        public static Select all(String table) {
            return builder().table(table).build();
        }
    }

    /**
     * Assigns column values on matching rows.
     */
    @Value
    @Builder
    class Update implements CrudRequest {
        String table;
        @Singular
        Map<String, Object> values;
        String predicate;
        @Singular
        List<Object> params;
    }

    /**
     * Removes matching rows. Without a predicate every row is removed.
     */
    @Value
    @Builder
    class Delete implements CrudRequest {
        String table;
        String predicate;
        @Singular
        List<Object> params;
    }
}
