/**
 * Connection configuration for IndustryDB.
 *
 * <p>
 * Defines the backend-neutral {@link io.github.yok.industrydb.config.ConnectionDescriptor}, its
 * validation rules, the connection URI format, and the Spring Boot binding of named connection
 * sections ({@code industrydb.connections.*}).
 * </p>
 */
package io.github.yok.industrydb.config;
