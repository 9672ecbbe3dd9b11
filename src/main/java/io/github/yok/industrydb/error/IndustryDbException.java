package io.github.yok.industrydb.error;

import io.github.yok.industrydb.connector.OperationOutcome;
import java.util.Objects;
import java.util.Optional;
import lombok.Getter;

/**
 * The single exception type crossing the public boundary of the library.
 *
 * <p>
 * Every instance carries exactly one {@link ErrorKind}. The message is prefixed with the kind's
 * display name, for example {@code "Constraint violation: duplicate key value"}. The native cause,
 * when there is one, is preserved as {@link #getCause()}.
 * </p>
 *
 * <p>
 * Failures of a multi-statement insert additionally carry the partial progress made before the
 * failing statement (see {@link #getPartialOutcome()}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class IndustryDbException extends Exception {

    private static final long serialVersionUID = 1L;

    @Getter
    private final ErrorKind kind;

    @Getter
    private final String detail;

    // Rows already applied when a multi-statement insert failed part way
    private final transient OperationOutcome partial;

    /**
     * Creates an exception of the given kind.
     *
     * @param kind error kind
     * @param detail detail message without the kind prefix
     */
    public IndustryDbException(ErrorKind kind, String detail) {
        this(kind, detail, null, null);
    }

    /**
     * Creates an exception of the given kind with a native cause.
     *
     * @param kind error kind
     * @param detail detail message without the kind prefix
     * @param cause native cause
     */
    public IndustryDbException(ErrorKind kind, String detail, Throwable cause) {
        this(kind, detail, cause, null);
    }

    /**
     * Creates an exception of the given kind with a native cause and partial progress.
     *
     * @param kind error kind
     * @param detail detail message without the kind prefix
     * @param cause native cause, may be {@code null}
     * @param partial progress before the failure, may be {@code null}
     */
    public IndustryDbException(ErrorKind kind, String detail, Throwable cause,
            OperationOutcome partial) {
        super(Objects.requireNonNull(kind, "kind").getDisplayName() + ": " + detail, cause);
        this.kind = kind;
        this.detail = detail;
        this.partial = partial;
    }

    /**
     * Returns the progress made before a multi-statement insert failed.
     *
     * @return partial outcome, empty for every other failure
     */
    public Optional<OperationOutcome> getPartialOutcome() {
        return Optional.ofNullable(partial);
    }

    /**
     * Creates a {@link ErrorKind#CONFIGURATION_INVALID} exception.
     *
     * @param detail detail message
     * @return exception
     */
    public static IndustryDbException configuration(String detail) {
        return new IndustryDbException(ErrorKind.CONFIGURATION_INVALID, detail);
    }

    /**
     * Creates a {@link ErrorKind#INVALID_PARAMETER} exception.
     *
     * @param detail detail message
     * @return exception
     */
    public static IndustryDbException invalidParameter(String detail) {
        return new IndustryDbException(ErrorKind.INVALID_PARAMETER, detail);
    }

    /**
     * Creates a {@link ErrorKind#ALREADY_CLOSED} exception.
     *
     * @param backend backend name used in the message
     * @return exception
     */
    public static IndustryDbException alreadyClosed(String backend) {
        return new IndustryDbException(ErrorKind.ALREADY_CLOSED, backend + " connector");
    }

    /**
     * Creates a {@link ErrorKind#UNSUPPORTED_BACKEND} exception.
     *
     * @param type type name that could not be resolved
     * @return exception
     */
    public static IndustryDbException unsupportedBackend(String type) {
        return new IndustryDbException(ErrorKind.UNSUPPORTED_BACKEND, type);
    }
}
