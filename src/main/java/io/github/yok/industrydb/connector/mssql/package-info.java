/**
 * SQL Server connector, type mapping and error number classification.
 */
package io.github.yok.industrydb.connector.mssql;
