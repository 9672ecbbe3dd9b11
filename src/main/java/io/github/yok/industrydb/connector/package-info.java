/**
 * Connector API and the pooled JDBC implementation shared by all backends.
 *
 * <p>
 * {@link io.github.yok.industrydb.connector.ConnectorFactory} selects the backend connector from a
 * descriptor; {@link io.github.yok.industrydb.connector.AsyncCrudConnector} runs the same calls on
 * an executor.
 * </p>
 */
package io.github.yok.industrydb.connector;
