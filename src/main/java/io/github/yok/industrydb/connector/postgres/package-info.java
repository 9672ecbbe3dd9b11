/**
 * PostgreSQL connector, type mapping and SQLState classification.
 */
package io.github.yok.industrydb.connector.postgres;
