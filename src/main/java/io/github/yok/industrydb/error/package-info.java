/**
 * Error taxonomy and driver exception translation.
 *
 * <p>
 * Every public operation fails with {@link io.github.yok.industrydb.error.IndustryDbException},
 * whose {@link io.github.yok.industrydb.error.ErrorKind} is derived from the driver's
 * {@link java.sql.SQLException} by a backend-specific translator.
 * </p>
 */
package io.github.yok.industrydb.error;
