package io.github.yok.industrydb.connector;

import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Result of a mutating operation.
 *
 * <p>
 * Errors never travel in this value: a failed operation throws. The only non-succeeded outcome is
 * the partial progress attached to an insert that failed part way, see
 * {@link io.github.yok.industrydb.error.IndustryDbException#getPartialOutcome()}. It reports the
 * rows applied before the failure and the rows attempted up to and including the failed
 * statement.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@ToString
@EqualsAndHashCode
public final class OperationOutcome {

    private final long rowsAffected;

    // Equal to rowsAffected unless the operation failed part way
    private final long rowsAttempted;

    private final boolean succeeded;

    private final String message;

    private OperationOutcome(long rowsAffected, long rowsAttempted, boolean succeeded,
            String message) {
        if (rowsAffected < 0) {
            throw new IllegalArgumentException(
                    "rowsAffected must not be negative: " + rowsAffected);
        }
        if (rowsAttempted < rowsAffected) {
            throw new IllegalArgumentException("rowsAttempted " + rowsAttempted
                    + " must not be less than rowsAffected " + rowsAffected);
        }
        this.rowsAffected = rowsAffected;
        this.rowsAttempted = rowsAttempted;
        this.succeeded = succeeded;
        this.message = message;
    }

    /**
     * Creates a successful outcome.
     *
     * @param rowsAffected rows changed
     * @return outcome without message
     */
    public static OperationOutcome success(long rowsAffected) {
        return new OperationOutcome(rowsAffected, rowsAffected, true, null);
    }

    /**
     * Creates a successful outcome with an informational message.
     *
     * @param rowsAffected rows changed
     * @param info informational message
     * @return outcome
     */
    public static OperationOutcome success(long rowsAffected, String info) {
        return new OperationOutcome(rowsAffected, rowsAffected, true, info);
    }

    /**
     * Creates the progress report of an operation that failed part way.
     *
     * @param rowsApplied rows changed before the failure
     * @param rowsAttempted rows sent to the database, including those of the failed statement
     * @param message description of the failure
     * @return non-succeeded outcome
     * @throws IllegalArgumentException if a count is negative or fewer rows were attempted than
     *         applied
     */
    public static OperationOutcome partial(long rowsApplied, long rowsAttempted,
            String message) {
        return new OperationOutcome(rowsApplied, rowsAttempted, false, message);
    }

    public Optional<String> getMessage() {
        return Optional.ofNullable(message);
    }
}
