/**
 * Columnar data model.
 *
 * <p>
 * Holds the closed set of column types, typed columns, row-aligned batches, and the reader that
 * turns a JDBC {@link java.sql.ResultSet} into a batch.
 * </p>
 */
package io.github.yok.industrydb.types;
