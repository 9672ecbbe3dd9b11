package io.github.yok.industrydb.connector.sqlite;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.zaxxer.hikari.HikariConfig;
import io.github.yok.industrydb.config.ConnectionDescriptor;
import io.github.yok.industrydb.config.DatabaseType;
import io.github.yok.industrydb.connector.OperationOutcome;
import io.github.yok.industrydb.error.ErrorKind;
import io.github.yok.industrydb.error.IndustryDbException;
import io.github.yok.industrydb.types.ColumnType;
import io.github.yok.industrydb.types.ColumnarBatch;
import java.nio.file.Path;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.LongStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SqliteConnectorTest {

    private SqliteConnector connector;

    @BeforeEach
    void setUp() throws Exception {
        connector = new SqliteConnector(
                ConnectionDescriptor.sqlite(ConnectionDescriptor.IN_MEMORY));
        connector.executeUpdate("CREATE TABLE sensors (id INTEGER PRIMARY KEY, tag TEXT NOT NULL,"
                + " reading REAL, active BOOLEAN, payload BLOB)", null);
    }

    @AfterEach
    void tearDown() {
        connector.close();
    }

    private static ColumnarBatch sensors(long... ids) {
        ColumnarBatch.Builder builder = ColumnarBatch.builder();
        Object[] idValues = new Object[ids.length];
        Object[] tags = new Object[ids.length];
        for (int i = 0; i < ids.length; i++) {
            idValues[i] = ids[i];
            tags[i] = "TI-" + ids[i];
        }
        return builder.column("id", ColumnType.INT64, idValues)
                .column("tag", ColumnType.UTF8, tags).build();
    }

    // -------------------------------------------------------------------------
    // CRUD round trips
    // -------------------------------------------------------------------------

    @Test
    void select_正常ケース_3行2列を挿入して全件取得_同じ列名と型の3行が返ること() throws Exception {
        OperationOutcome inserted = connector.insert("sensors", sensors(1, 2, 3));
        assertEquals(3, inserted.getRowsAffected());
        assertTrue(inserted.isSucceeded());

        ColumnarBatch batch = connector.select("sensors", List.of("id", "tag"), null, null, null);

        assertEquals(3, batch.getRowCount());
        assertEquals(List.of("id", "tag"), batch.getColumnNames());
        assertEquals(ColumnType.INT64, batch.column("id").getType());
        assertEquals(ColumnType.UTF8, batch.column("tag").getType());
        assertEquals(Arrays.asList(1L, 2L, 3L), batch.column("id").getValues());
        assertEquals(Arrays.asList("TI-1", "TI-2", "TI-3"), batch.column("tag").getValues());
    }

    @Test
    void select_正常ケース_全列取得_宣言型に応じた列型になること() throws Exception {
        ColumnarBatch row = ColumnarBatch.builder()
                .column("id", ColumnType.INT64, 7L)
                .column("tag", ColumnType.UTF8, "FI-7")
                .column("reading", ColumnType.FLOAT64, 21.5d)
                .column("active", ColumnType.BOOLEAN, true)
                .column("payload", ColumnType.BINARY, (Object) new byte[] {0x01, (byte) 0xff})
                .build();
        connector.insert("sensors", row);

        ColumnarBatch batch = connector.select("sensors");

        assertEquals(List.of("id", "tag", "reading", "active", "payload"), batch.getColumnNames());
        assertEquals(ColumnType.FLOAT64, batch.column("reading").getType());
        assertEquals(21.5d, batch.column("reading").get(0));
        assertEquals(ColumnType.BOOLEAN, batch.column("active").getType());
        assertEquals(true, batch.column("active").get(0));
        assertEquals(ColumnType.BINARY, batch.column("payload").getType());
        assertArrayEquals(new byte[] {0x01, (byte) 0xff}, (byte[]) batch.column("payload").get(0));
    }

    @Test
    void select_正常ケース_条件とパラメータと行数上限_該当行のみ返ること() throws Exception {
        connector.insert("sensors", sensors(1, 2, 3, 4, 5));

        ColumnarBatch batch =
                connector.select("sensors", List.of("id"), "\"id\" >= ?", List.of(2L), 2L);

        assertEquals(Arrays.asList(2L, 3L), batch.column("id").getValues());
    }

    @Test
    void update_正常ケース_条件なしで5行のテーブル_5行更新されること() throws Exception {
        connector.insert("sensors", sensors(1, 2, 3, 4, 5));

        OperationOutcome outcome =
                connector.update("sensors", Map.of("active", false), null, null);

        assertEquals(5, outcome.getRowsAffected());
        ColumnarBatch batch =
                connector.execute("SELECT COUNT(*) AS n FROM sensors WHERE active = 0");
        assertEquals(5L, batch.column("n").get(0));
    }

    @Test
    void update_正常ケース_条件付き_該当行のみ更新されること() throws Exception {
        connector.insert("sensors", sensors(1, 2, 3));

        OperationOutcome outcome =
                connector.update("sensors", Map.of("tag", "XX"), "id = ?", List.of(2L));

        assertEquals(1, outcome.getRowsAffected());
        assertEquals("XX", connector.execute("SELECT tag FROM sensors WHERE id = 2")
                .column("tag").get(0));
    }

    @Test
    void delete_正常ケース_条件付きと全件_削除件数が返ること() throws Exception {
        connector.insert("sensors", sensors(1, 2, 3));

        assertEquals(1, connector.delete("sensors", "id = ?", List.of(3L)).getRowsAffected());
        assertEquals(2, connector.delete("sensors", null, null).getRowsAffected());
        assertTrue(connector.select("sensors").isEmpty());
    }

    @Test
    void insert_正常ケース_空のバッチ_0行で成功すること() throws Exception {
        OperationOutcome outcome = connector.insert("sensors", ColumnarBatch.empty());
        assertEquals(OperationOutcome.success(0), outcome);
    }

    @Test
    void insert_異常ケース_バッチがnull_INVALID_PARAMETERが送出されること() {
        IndustryDbException ex = assertThrows(IndustryDbException.class,
                () -> connector.insert("sensors", null));
        assertEquals(ErrorKind.INVALID_PARAMETER, ex.getKind());
    }

    @Test
    void insert_異常ケース_主キー重複_CONSTRAINT_VIOLATIONが送出されること() throws Exception {
        connector.insert("sensors", sensors(1));

        IndustryDbException ex = assertThrows(IndustryDbException.class,
                () -> connector.insert("sensors", sensors(1)));

        assertEquals(ErrorKind.CONSTRAINT_VIOLATION, ex.getKind());
        assertTrue(ex.getCause() instanceof SQLException);
    }

    @Test
    void insert_異常ケース_後続の文で失敗_試行行数と適用済み行数が部分結果として報告されること()
            throws Exception {
        connector.insert("sensors", sensors(600));

        // two columns: 499 rows per statement, so row 600 fails the second of three statements
        IndustryDbException ex = assertThrows(IndustryDbException.class,
                () -> connector.insert("sensors",
                        sensors(LongStream.rangeClosed(1, 1000).toArray())));

        assertEquals(ErrorKind.CONSTRAINT_VIOLATION, ex.getKind());
        OperationOutcome partial = ex.getPartialOutcome().orElseThrow();
        assertFalse(partial.isSucceeded());
        assertEquals(499, partial.getRowsAffected());
        assertEquals(998, partial.getRowsAttempted());
        assertTrue(partial.getMessage().orElseThrow()
                .contains("499 of 998 attempted rows applied, 1000 requested"),
                partial.getMessage().orElseThrow());
        assertEquals(partial.getMessage().orElseThrow(), ex.getDetail());
        // no rollback of the rows already written
        assertEquals(500, connector.select("sensors").getRowCount());
    }

    @Test
    void update_異常ケース_NOT_NULL列にnull_CONSTRAINT_VIOLATIONが送出されること() throws Exception {
        connector.insert("sensors", sensors(1));
        Map<String, Object> values = new HashMap<>();
        values.put("tag", null);

        IndustryDbException ex = assertThrows(IndustryDbException.class,
                () -> connector.update("sensors", values, null, null));
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION, ex.getKind());
    }

    // -------------------------------------------------------------------------
    // raw statements
    // -------------------------------------------------------------------------

    @Test
    void execute_正常ケース_式の列_値から型が推定されること() throws Exception {
        ColumnarBatch batch =
                connector.execute("SELECT 1 + 1 AS two, 'x' AS letter, NULL AS nothing");

        assertEquals(ColumnType.INT64, batch.column("two").getType());
        assertEquals(2L, batch.column("two").get(0));
        assertEquals(ColumnType.UTF8, batch.column("letter").getType());
        assertEquals(ColumnType.NULL, batch.column("nothing").getType());
        assertNull(batch.column("nothing").get(0));
    }

    @Test
    void execute_正常ケース_INTEGER宣言の列に文字列が混在_列全体が文字列として読まれること()
            throws Exception {
        connector.executeUpdate("CREATE TABLE mixed (a INTEGER)", null);
        connector.executeUpdate("INSERT INTO mixed (a) VALUES (1), ('abc'), (NULL)", null);

        ColumnarBatch batch = connector.execute("SELECT a FROM mixed ORDER BY rowid");

        assertEquals(ColumnType.UTF8, batch.column("a").getType());
        assertEquals(Arrays.asList("1", "abc", null), batch.column("a").getValues());
    }

    @Test
    void execute_正常ケース_式の列に整数と文字列が混在_列全体が文字列として読まれること()
            throws Exception {
        ColumnarBatch batch = connector.execute("SELECT 1 AS x UNION ALL SELECT 'abc'");

        assertEquals(ColumnType.UTF8, batch.column("x").getType());
        assertEquals(List.of("1", "abc"), batch.column("x").getValues());
    }

    @Test
    void execute_正常ケース_式の列に整数と実数が混在_実数の列として読まれること() throws Exception {
        ColumnarBatch batch = connector.execute("SELECT 1 AS x UNION ALL SELECT 2.5");

        assertEquals(ColumnType.FLOAT64, batch.column("x").getType());
        assertEquals(List.of(1.0d, 2.5d), batch.column("x").getValues());
    }

    @Test
    void execute_正常ケース_パラメータ付き_バインドされた値で検索されること() throws Exception {
        connector.insert("sensors", sensors(10, 20));

        ColumnarBatch batch =
                connector.execute("SELECT tag FROM sensors WHERE id = ?", List.of(20L));

        assertEquals(List.of("TI-20"), batch.column("tag").getValues());
    }

    @Test
    void execute_正常ケース_結果を返さない文_空のバッチが返ること() throws Exception {
        ColumnarBatch batch = connector.execute("CREATE TABLE other (id INTEGER)");
        assertTrue(batch.isEmpty());
        assertEquals(0, batch.getColumnCount());
    }

    @Test
    void execute_異常ケース_存在しないテーブル_QUERY_FAILUREが送出されること() {
        IndustryDbException ex = assertThrows(IndustryDbException.class,
                () -> connector.execute("SELECT * FROM missing"));
        assertEquals(ErrorKind.QUERY_FAILURE, ex.getKind());
        assertTrue(ex.getDetail().startsWith("Statement failed: "), ex.getDetail());
    }

    @Test
    void execute_異常ケース_列ラベル重複_QUERY_FAILUREが送出されること() {
        IndustryDbException ex = assertThrows(IndustryDbException.class,
                () -> connector.execute("SELECT 1 AS a, 2 AS a"));
        assertEquals(ErrorKind.QUERY_FAILURE, ex.getKind());
    }

    @Test
    void select_異常ケース_不正なテーブル名_INVALID_PARAMETERが送出されること() {
        IndustryDbException ex = assertThrows(IndustryDbException.class,
                () -> connector.select("main..sensors"));
        assertEquals(ErrorKind.INVALID_PARAMETER, ex.getKind());
    }

    // -------------------------------------------------------------------------
    // lifecycle
    // -------------------------------------------------------------------------

    @Test
    void isAlive_正常ケース_開いている間はtrueで閉じた後はfalseになること() {
        assertTrue(connector.isAlive());
        assertEquals(DatabaseType.SQLITE, connector.backendType());

        connector.close();
        connector.close();

        assertTrue(connector.isClosed());
        assertFalse(connector.isAlive());
        IndustryDbException ex = assertThrows(IndustryDbException.class,
                () -> connector.select("sensors"));
        assertEquals(ErrorKind.ALREADY_CLOSED, ex.getKind());
    }

    @Test
    void constructor_正常ケース_ファイルDB_別の接続から同じデータが見えること(@TempDir Path dir)
            throws Exception {
        ConnectionDescriptor d =
                ConnectionDescriptor.sqlite(dir.resolve("plant.db").toString());
        try (SqliteConnector writer = new SqliteConnector(d)) {
            writer.executeUpdate("CREATE TABLE t (v TEXT)", null);
            writer.executeUpdate("INSERT INTO t VALUES (?)", List.of("kept"));
        }
        try (SqliteConnector reader = new SqliteConnector(d)) {
            assertEquals(List.of("kept"), reader.select("t").column("v").getValues());
        }
    }

    @Test
    void constructor_異常ケース_存在しないディレクトリ_CONNECTION_FAILUREが送出されること(
            @TempDir Path dir) {
        ConnectionDescriptor d =
                ConnectionDescriptor.sqlite(dir.resolve("no/such/dir/plant.db").toString());
        IndustryDbException ex =
                assertThrows(IndustryDbException.class, () -> new SqliteConnector(d));
        assertEquals(ErrorKind.CONNECTION_FAILURE, ex.getKind());
    }

    @Test
    void constructor_異常ケース_他種別の記述子_CONFIGURATION_INVALIDが送出されること() {
        ConnectionDescriptor d = ConnectionDescriptor.postgres("h", 5432, "db", "u", "p");
        IndustryDbException ex =
                assertThrows(IndustryDbException.class, () -> new SqliteConnector(d));
        assertEquals(ErrorKind.CONFIGURATION_INVALID, ex.getKind());
    }

    // -------------------------------------------------------------------------
    // pool settings, type mapping and error classification
    // -------------------------------------------------------------------------

    @Test
    void poolConfig_正常ケース_インメモリ_単一接続に固定されること() throws Exception {
        HikariConfig config = SqliteConnector
                .poolConfig(ConnectionDescriptor.sqlite(ConnectionDescriptor.IN_MEMORY));

        assertEquals("jdbc:sqlite::memory:", config.getJdbcUrl());
        assertEquals(1, config.getMaximumPoolSize());
        assertEquals(1, config.getMinimumIdle());
        assertEquals(0L, config.getMaxLifetime());
        assertEquals(0L, config.getIdleTimeout());
        assertEquals("30000", config.getDataSourceProperties().get("busy_timeout"));
    }

    @Test
    void poolConfig_正常ケース_ファイルDBとタイムアウト_busy_timeoutに反映されること()
            throws Exception {
        ConnectionDescriptor d = ConnectionDescriptor.sqlite("/data/plant.db").toBuilder()
                .timeoutSeconds(3).extension("pool.max-size", "2").build();

        HikariConfig config = SqliteConnector.poolConfig(d);

        assertEquals("jdbc:sqlite:/data/plant.db", config.getJdbcUrl());
        assertEquals("3000", config.getDataSourceProperties().get("busy_timeout"));
        assertEquals(2, config.getMaximumPoolSize());
    }

    @Test
    void map_正常ケース_宣言型_類似性規則で列型に対応付けられること() {
        SqliteTypeMapping mapping = SqliteTypeMapping.INSTANCE;
        assertEquals(ColumnType.INT64, mapping.map(Types.INTEGER, "INTEGER"));
        assertEquals(ColumnType.INT64, mapping.map(Types.INTEGER, "bigint"));
        assertEquals(ColumnType.UTF8, mapping.map(Types.VARCHAR, "VARCHAR(20)"));
        assertEquals(ColumnType.FLOAT64, mapping.map(Types.REAL, "DOUBLE PRECISION"));
        assertEquals(ColumnType.FLOAT64, mapping.map(Types.NUMERIC, "NUMERIC(10,2)"));
        assertEquals(ColumnType.BOOLEAN, mapping.map(Types.INTEGER, "BOOLEAN"));
        assertEquals(ColumnType.DATE, mapping.map(Types.VARCHAR, "DATE"));
        assertEquals(ColumnType.TIMESTAMP, mapping.map(Types.VARCHAR, "DATETIME"));
        assertEquals(ColumnType.BINARY, mapping.map(Types.BLOB, "BLOB"));
        assertEquals(ColumnType.NULL, mapping.map(Types.NULL, "NULL"));
        assertEquals(ColumnType.NULL, mapping.map(Types.NULL, ""));
        assertEquals(ColumnType.UTF8, mapping.map(Types.VARCHAR, "JSON"));
        assertTrue(mapping.isUuid("uuid"));
    }

    @Test
    void classify_正常ケース_結果コード_種別に分類されること() {
        SqliteExceptionTranslator translator = new SqliteExceptionTranslator();
        // extended code SQLITE_CONSTRAINT_PRIMARYKEY
        assertEquals(ErrorKind.CONSTRAINT_VIOLATION,
                translator.classify(new SQLException("UNIQUE", null, 1555)));
        assertEquals(ErrorKind.TIMEOUT, translator.classify(
                new SQLException("database is locked", null,
                        SqliteExceptionTranslator.SQLITE_BUSY)));
        assertEquals(ErrorKind.CONNECTION_FAILURE, translator.classify(
                new SQLException("unable to open", null,
                        SqliteExceptionTranslator.SQLITE_CANTOPEN)));
        assertEquals(ErrorKind.CONNECTION_FAILURE, translator.classify(
                new SQLException("not a database", null,
                        SqliteExceptionTranslator.SQLITE_NOTADB)));
        assertEquals(ErrorKind.IO_FAILURE, translator.classify(
                new SQLException("disk I/O error", null, SqliteExceptionTranslator.SQLITE_IOERR)));
        assertEquals(ErrorKind.IO_FAILURE, translator.classify(
                new SQLException("database is full", null, SqliteExceptionTranslator.SQLITE_FULL)));
        assertEquals(ErrorKind.QUERY_FAILURE,
                translator.classify(new SQLException("no such table", null, 1)));
    }
}
