package io.github.yok.industrydb.error;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of failure kinds surfaced by every connector operation.
 *
 * <p>
 * Each native driver failure is mapped to exactly one kind where it is first observed. Callers that
 * expose the library to another runtime are expected to map each kind to a distinct error type.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
@RequiredArgsConstructor
public enum ErrorKind {

    CONNECTION_FAILURE("Database connection error"),

    QUERY_FAILURE("Query execution error"),

    CONFIGURATION_INVALID("Configuration error"),

    UNSUPPORTED_BACKEND("Unsupported database type"),

    ALREADY_CLOSED("Connection is closed"),

    TIMEOUT("Operation timed out"),

    CONSTRAINT_VIOLATION("Constraint violation"),

    INVALID_PARAMETER("Invalid parameter"),

    NOT_IMPLEMENTED("Not implemented"),

    SERIALIZATION_FAILURE("Serialization error"),

    IO_FAILURE("IO error");

    /**
     * Human readable prefix used in exception messages.
     */
    private final String displayName;
}
