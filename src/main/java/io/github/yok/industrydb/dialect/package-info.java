/**
 * SQL dialect rules and statement construction.
 *
 * <p>
 * Describes how each backend paginates, quotes identifiers, writes literals and binds parameters,
 * and builds parameterized statements for CRUD requests.
 * </p>
 */
package io.github.yok.industrydb.dialect;
