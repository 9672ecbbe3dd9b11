package io.github.yok.industrydb.dialect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.industrydb.error.ErrorKind;
import io.github.yok.industrydb.error.IndustryDbException;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class LiteralRendererTest {

    @Test
    void render_正常ケース_真偽値_方言ごとのリテラルになること() throws Exception {
        assertEquals("TRUE", LiteralRenderer.render(true, SqlDialect.POSTGRES));
        assertEquals("FALSE", LiteralRenderer.render(false, SqlDialect.POSTGRES));
        assertEquals("1", LiteralRenderer.render(true, SqlDialect.MSSQL));
        assertEquals("0", LiteralRenderer.render(false, SqlDialect.MSSQL));
        assertEquals("1", LiteralRenderer.render(true, SqlDialect.SQLITE));
        assertEquals("0", LiteralRenderer.render(false, SqlDialect.SQLITE));
    }

    @Test
    void render_正常ケース_文字列_引用符が二重化されMSSQLではN接頭辞が付くこと() throws Exception {
        assertEquals("'O''Brien'", LiteralRenderer.render("O'Brien", SqlDialect.POSTGRES));
        assertEquals("N'O''Brien'", LiteralRenderer.render("O'Brien", SqlDialect.MSSQL));
        assertEquals("'O''Brien'", LiteralRenderer.render("O'Brien", SqlDialect.SQLITE));
    }

    @Test
    void render_正常ケース_数値とnull_そのままの表記になること() throws Exception {
        assertEquals("NULL", LiteralRenderer.render(null, SqlDialect.MSSQL));
        assertEquals("-42", LiteralRenderer.render(-42L, SqlDialect.POSTGRES));
        assertEquals("7", LiteralRenderer.render(7, SqlDialect.POSTGRES));
        assertEquals("0.0000001",
                LiteralRenderer.render(new BigDecimal("1E-7"), SqlDialect.SQLITE));
        assertEquals("2.5", LiteralRenderer.render(2.5d, SqlDialect.MSSQL));
    }

    @Test
    void render_正常ケース_Postgresで非有限値_float8キャスト付きになること() throws Exception {
        assertEquals("'NaN'::float8", LiteralRenderer.render(Double.NaN, SqlDialect.POSTGRES));
        assertEquals("'Infinity'::float8",
                LiteralRenderer.render(Double.POSITIVE_INFINITY, SqlDialect.POSTGRES));
        assertEquals("'-Infinity'::float8",
                LiteralRenderer.render(Float.NEGATIVE_INFINITY, SqlDialect.POSTGRES));
    }

    @Test
    void render_異常ケース_MSSQLとSQLiteで非有限値_INVALID_PARAMETERが送出されること() {
        for (SqlDialect dialect : new SqlDialect[] {SqlDialect.MSSQL, SqlDialect.SQLITE}) {
            IndustryDbException ex = assertThrows(IndustryDbException.class,
                    () -> LiteralRenderer.render(Double.NaN, dialect));
            assertEquals(ErrorKind.INVALID_PARAMETER, ex.getKind());
        }
    }

    @Test
    void render_正常ケース_日付と日時_方言ごとの書式になること() throws Exception {
        LocalDateTime at = LocalDateTime.of(2024, 6, 1, 7, 5);
        assertEquals("'2024-06-01'", LiteralRenderer.render(at.toLocalDate(), SqlDialect.MSSQL));
        assertEquals("'2024-06-01T07:05:00'", LiteralRenderer.render(at, SqlDialect.POSTGRES));
        assertEquals("'2024-06-01T07:05:00'", LiteralRenderer.render(at, SqlDialect.MSSQL));
        assertEquals("'2024-06-01 07:05:00'", LiteralRenderer.render(at, SqlDialect.SQLITE));
        assertEquals("'2024-02-29'",
                LiteralRenderer.render(LocalDate.of(2024, 2, 29), SqlDialect.SQLITE));
    }

    @Test
    void render_正常ケース_ナノ秒精度の日時_MSSQLでは小数7桁に切り詰められること()
            throws Exception {
        LocalDateTime at = LocalDateTime.of(2024, 1, 2, 3, 4, 5, 123456789);
        assertEquals("'2024-01-02T03:04:05.1234567'", LiteralRenderer.render(at, SqlDialect.MSSQL));
        assertEquals("'2024-01-02T03:04:05.123456789'",
                LiteralRenderer.render(at, SqlDialect.POSTGRES));
        assertEquals("'2024-01-02 03:04:05.123456789'",
                LiteralRenderer.render(at, SqlDialect.SQLITE));
        assertEquals("'2024-01-02T03:04:05.123'",
                LiteralRenderer.render(at.withNano(123_000_000), SqlDialect.MSSQL));
    }

    @Test
    void render_正常ケース_バイナリ_方言ごとの16進表記になること() throws Exception {
        byte[] bytes = {(byte) 0xCA, (byte) 0xFE};
        assertEquals("'\\xCAFE'::bytea", LiteralRenderer.render(bytes, SqlDialect.POSTGRES));
        assertEquals("0xCAFE", LiteralRenderer.render(bytes, SqlDialect.MSSQL));
        assertEquals("X'CAFE'", LiteralRenderer.render(bytes, SqlDialect.SQLITE));
    }

    @Test
    void render_正常ケース_UUID_文字列リテラルになること() throws Exception {
        UUID id = UUID.fromString("6f9619ff-8b86-d011-b42d-00c04fc964ff");
        assertEquals("'6f9619ff-8b86-d011-b42d-00c04fc964ff'",
                LiteralRenderer.render(id, SqlDialect.POSTGRES));
    }

    @Test
    void render_異常ケース_未対応の型_INVALID_PARAMETERが送出されること() {
        IndustryDbException ex = assertThrows(IndustryDbException.class,
                () -> LiteralRenderer.render(Duration.ofSeconds(1), SqlDialect.POSTGRES));
        assertEquals(ErrorKind.INVALID_PARAMETER, ex.getKind());
    }
}
