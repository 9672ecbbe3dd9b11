package io.github.yok.industrydb.error;

import java.sql.SQLException;

/**
 * Converts a driver {@link SQLException} into an {@link IndustryDbException}.
 *
 * <p>
 * One implementation exists per backend, applied where the failure is first observed so that no
 * raw {@link SQLException} leaves a connector.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public interface SqlExceptionTranslator {

    /**
     * Translates a driver failure.
     *
     * @param operation short description of what was being done, used in the message
     * @param e driver exception
     * @return exception carrying the classified kind and {@code e} as cause
     */
    IndustryDbException translate(String operation, SQLException e);

    /**
     * Classifies a driver failure without wrapping it.
     *
     * @param e driver exception
     * @return error kind
     */
    ErrorKind classify(SQLException e);
}
