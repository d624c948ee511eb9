package com.semaphore.migrator.migration.transform.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A value rendered as SQL literal text. Text literals are single-quoted with every embedded quote
 * doubled, so document content can never end the literal early.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SqlLiteral {

    private static final SqlLiteral NULL = new SqlLiteral(Kind.NULL, "NULL");

    public enum Kind {
        NULL,
        INTEGER,
        REAL,
        TEXT,
        BLOB
    }

    Kind kind;
    String sql;

    public static SqlLiteral nullValue() {
        return NULL;
    }

    public static SqlLiteral ofInteger(long value) {
        return new SqlLiteral(Kind.INTEGER, Long.toString(value));
    }

    public static SqlLiteral ofInteger(BigInteger value) {
        return new SqlLiteral(Kind.INTEGER, value.toString());
    }

    public static SqlLiteral ofReal(BigDecimal value) {
        return new SqlLiteral(Kind.REAL, value.toString());
    }

    /**
     * Text literal. SQLite stops reading a statement at a NUL character, so text containing one is
     * written as a hex blob cast back to text.
     */
    public static SqlLiteral ofText(String value) {
        if (value.indexOf('\0') >= 0) {
            return new SqlLiteral(Kind.TEXT,
                    "CAST(X'" + HexFormat.of().formatHex(value.getBytes(StandardCharsets.UTF_8)) + "' AS TEXT)");
        }
        return new SqlLiteral(Kind.TEXT, quote(value));
    }

    public static SqlLiteral ofBlob(byte[] value) {
        return new SqlLiteral(Kind.BLOB, "X'" + HexFormat.of().formatHex(value) + "'");
    }

    public boolean isNull() {
        return kind == Kind.NULL;
    }

    /**
     * Standard SQL quoting: wraps in single quotes and doubles embedded single quotes.
     */
    public static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String toString() {
        return sql;
    }
}
