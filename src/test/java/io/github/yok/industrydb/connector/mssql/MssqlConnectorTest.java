package io.github.yok.industrydb.connector.mssql;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeast;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.github.yok.industrydb.config.ConnectionDescriptor;
import io.github.yok.industrydb.config.DatabaseType;
import io.github.yok.industrydb.error.ErrorKind;
import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.types.ColumnType;
import io.github.yok.industrydb.types.ColumnarBatch;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MssqlConnectorTest {

    // -------------------------------------------------------------------------
    // URL and pool settings
    // -------------------------------------------------------------------------

    @Test
    void jdbcUrl_正常ケース_名前付きインスタンス_databaseNameが付与されること() {
        ConnectionDescriptor d = ConnectionDescriptor.mssql("db01\\SQLEXPRESS", "mes", "sa", "pw");
        assertEquals("jdbc:sqlserver://db01\\SQLEXPRESS;databaseName=mes",
                MssqlConnector.jdbcUrl(d));
    }

    @Test
    void jdbcUrl_正常ケース_ポートと統合認証_integratedSecurityが付与されること() {
        ConnectionDescriptor d = ConnectionDescriptor.builder().type(DatabaseType.MSSQL)
                .host("db01").port(1433).database("mes").integratedAuth(true).build();
        assertEquals("jdbc:sqlserver://db01:1433;databaseName=mes;integratedSecurity=true",
                MssqlConnector.jdbcUrl(d));
    }

    @Test
    void jdbcUrl_正常ケース_区切り文字を含むDB名_波括弧でエスケープされること() {
        ConnectionDescriptor d = ConnectionDescriptor.mssql("db01", "a;b}c", "sa", "pw");
        assertEquals("jdbc:sqlserver://db01;databaseName={a;b}}c}", MssqlConnector.jdbcUrl(d));
    }

    @Test
    void poolConfig_正常ケース_既定のドライバ設定_loginTimeoutとapplicationNameが設定されること()
            throws Exception {
        ConnectionDescriptor d = ConnectionDescriptor.mssql("db01", "mes", "sa", "pw").toBuilder()
                .timeoutSeconds(8).extension("trustServerCertificate", "true").build();

        HikariConfig config = MssqlConnector.poolConfig(d);

        assertEquals("8", config.getDataSourceProperties().get("loginTimeout"));
        assertEquals("industrydb", config.getDataSourceProperties().get("applicationName"));
        assertEquals("true", config.getDataSourceProperties().get("trustServerCertificate"));
        assertEquals(8_000L, config.getConnectionTimeout());
        assertEquals("sa", config.getUsername());
    }

    @Test
    void poolConfig_異常ケース_Postgresの記述子_CONFIGURATION_INVALIDが送出されること() {
        ConnectionDescriptor d = ConnectionDescriptor.postgres("h", 5432, "db", "u", "p");
        IndustryDbException ex =
                assertThrows(IndustryDbException.class, () -> MssqlConnector.poolConfig(d));
        assertEquals(ErrorKind.CONFIGURATION_INVALID, ex.getKind());
    }

    // -------------------------------------------------------------------------
    // statements on a recorded pool
    // -------------------------------------------------------------------------

    @Test
    void execute_正常ケース_更新件数の後に結果セット_最初の結果セットが読まれること()
            throws Exception {
        Connection connection = mock(Connection.class);
        HikariDataSource dataSource = mock(HikariDataSource.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        Statement statement = mock(Statement.class);
        when(connection.createStatement()).thenReturn(statement);
        ResultSet rs = mock(ResultSet.class);
        ResultSetMetaData md = mock(ResultSetMetaData.class);
        when(statement.execute(anyString())).thenReturn(false);
        when(statement.getUpdateCount()).thenReturn(3);
        when(statement.getMoreResults()).thenReturn(true);
        when(statement.getResultSet()).thenReturn(rs);
        when(rs.getMetaData()).thenReturn(md);
        when(md.getColumnCount()).thenReturn(1);
        when(md.getColumnLabel(1)).thenReturn("total");
        when(md.getColumnType(1)).thenReturn(Types.INTEGER);
        when(md.getColumnTypeName(1)).thenReturn("int");
        when(rs.next()).thenReturn(true, false);
        when(rs.getObject(1)).thenReturn(3);

        try (MssqlConnector connector = new MssqlConnector(dataSource, 5)) {
            ColumnarBatch batch = connector.execute("INSERT INTO t VALUES (1); SELECT 3 AS total");

            assertEquals(List.of("total"), batch.getColumnNames());
            assertEquals(3L, batch.column("total").get(0));
            verify(statement).setQueryTimeout(5);
            verify(rs).close();
        }
    }

    @Test
    void execute_正常ケース_結果セットなし_空のバッチが返ること() throws Exception {
        Connection connection = mock(Connection.class);
        HikariDataSource dataSource = mock(HikariDataSource.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(connection.prepareStatement(anyString())).thenReturn(ps);
        when(ps.execute()).thenReturn(false);
        when(ps.getUpdateCount()).thenReturn(-1);

        try (MssqlConnector connector = new MssqlConnector(dataSource, 5)) {
            ColumnarBatch batch = connector.execute("EXEC dbo.touch ?", List.of(true));

            assertTrue(batch.isEmpty());
            assertEquals(0, batch.getColumnCount());
            verify(ps).setInt(1, 1);
        }
    }

    @Test
    void update_異常ケース_ドライバの一意制約違反_CONSTRAINT_VIOLATIONに変換されること()
            throws Exception {
        Connection connection = mock(Connection.class);
        HikariDataSource dataSource = mock(HikariDataSource.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.isValid(anyInt())).thenReturn(true);
        PreparedStatement ps = mock(PreparedStatement.class);
        when(connection.prepareStatement(anyString())).thenReturn(ps);
        when(ps.executeUpdate()).thenThrow(new SQLException(
                "Violation of PRIMARY KEY constraint 'PK_t'", "23000", 2627));

        try (MssqlConnector connector = new MssqlConnector(dataSource, 5)) {
            IndustryDbException ex = assertThrows(IndustryDbException.class,
                    () -> connector.update("t", Map.of("id", 1L), null, null));
            assertEquals(ErrorKind.CONSTRAINT_VIOLATION, ex.getKind());
            assertTrue(ex.getDetail().startsWith("Update of t failed: Violation of PRIMARY KEY"),
                    ex.getDetail());
            verify(connection, atLeast(2)).close();
        }
    }

    // -------------------------------------------------------------------------
    // type mapping and error classification
    // -------------------------------------------------------------------------

    @Test
    void map_正常ケース_SQLServer型名_列型に対応付けられること() {
        MssqlTypeMapping mapping = MssqlTypeMapping.INSTANCE;
        assertEquals(ColumnType.INT64, mapping.map(Types.INTEGER, "int identity"));
        assertEquals(ColumnType.INT64, mapping.map(Types.TINYINT, "tinyint"));
        assertEquals(ColumnType.FLOAT64, mapping.map(Types.DECIMAL, "money"));
        assertEquals(ColumnType.BOOLEAN, mapping.map(Types.BIT, "bit"));
        assertEquals(ColumnType.UTF8, mapping.map(Types.NVARCHAR, "nvarchar"));
        assertEquals(ColumnType.UTF8, mapping.map(Types.CHAR, "uniqueidentifier"));
        assertEquals(ColumnType.DATE, mapping.map(Types.DATE, "date"));
        assertEquals(ColumnType.TIMESTAMP, mapping.map(Types.TIMESTAMP, "datetime2"));
        assertEquals(ColumnType.TIMESTAMP, mapping.map(-155, "datetimeoffset"));
        assertEquals(ColumnType.BINARY, mapping.map(Types.BINARY, "timestamp"));
        assertEquals(ColumnType.UTF8, mapping.map(Types.TIME, "time"));
        assertTrue(mapping.isUuid("UNIQUEIDENTIFIER"));
        assertTrue(mapping.isZonedTimestamp("datetimeoffset"));
        assertFalse(mapping.isZonedTimestamp("datetime2"));
    }

    @Test
    void classify_正常ケース_エラー番号_種別に分類されること() {
        MssqlExceptionTranslator translator = new MssqlExceptionTranslator();
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION,
                translator.classify(new SQLException("dup key", "23000", 2627)));
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION,
                translator.classify(new SQLException("FK conflict", "S0001", 547)));
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION,
                translator.classify(new SQLException("NULL into column", "S0001", 515)));
        assertEquals(ErrorKind.CONNECTION_FAILURE,
                translator.classify(new SQLException("Login failed", "S0001", 18456)));
        assertEquals(ErrorKind.CONNECTION_FAILURE,
                translator.classify(new SQLException("TCP/IP failed", "08S01", 0)));
        assertEquals(ErrorKind.TIMEOUT,
                translator.classify(new SQLException("Lock timeout", "S0001", 1222)));
        assertEquals(ErrorKind.TIMEOUT,
                translator.classify(new SQLException("The query has timed out.", "HY008", 0)));
        assertEquals(ErrorKind.QUERY_FAILURE,
                translator.classify(new SQLException("Invalid object name", "S0002", 208)));
    }
}
