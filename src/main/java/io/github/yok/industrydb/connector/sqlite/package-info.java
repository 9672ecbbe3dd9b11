/**
 * SQLite connector for file and in-memory databases.
 */
package io.github.yok.industrydb.connector.sqlite;
