package com.asiainfo.kpicompute.core.model;

import java.sql.Types;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 列的粗粒度类型，用于编译期校验片段位置
 * 类型名优先（SQLite 只有声明类型可靠），其次 JDBC 类型码；都无法识别时为 UNKNOWN，不做校验
 */
public enum ColumnType {
    NUMERIC,
    BOOLEAN,
    TEXT,
    TEMPORAL,
    UNKNOWN;

    private static final Pattern NUMERIC_NAME = Pattern.compile(
            "U?(TINY|SMALL|BIG|HUGE)?INT(EGER)?\\d*|INT\\d+|DOUBLE( PRECISION)?|FLOAT\\d*|REAL|DECIMAL|NUMERIC|NUMBER");

    public static ColumnType of(int jdbcType, String typeName) {
        ColumnType byName = fromTypeName(typeName);
        return byName != UNKNOWN ? byName : fromJdbcType(jdbcType);
    }

    static ColumnType fromTypeName(String typeName) {
        if (typeName == null || typeName.isBlank()) {
            return UNKNOWN;
        }
        String base = typeName.trim().toUpperCase(Locale.ROOT);
        int paren = base.indexOf('(');
        if (paren > 0) {
            base = base.substring(0, paren).trim();
        }
        if (base.equals("BOOLEAN") || base.equals("BOOL")) {
            return BOOLEAN;
        }
        if (NUMERIC_NAME.matcher(base).matches()) {
            return NUMERIC;
        }
        if (base.contains("CHAR") || base.contains("TEXT") || base.contains("STRING") || base.contains("CLOB")) {
            return TEXT;
        }
        if (base.startsWith("DATE") || base.startsWith("TIME")) {
            return TEMPORAL;
        }
        return UNKNOWN;
    }

    static ColumnType fromJdbcType(int jdbcType) {
        return switch (jdbcType) {
            case Types.TINYINT, Types.SMALLINT, Types.INTEGER, Types.BIGINT,
                    Types.REAL, Types.FLOAT, Types.DOUBLE, Types.NUMERIC, Types.DECIMAL -> NUMERIC;
            case Types.BOOLEAN, Types.BIT -> BOOLEAN;
            case Types.CHAR, Types.VARCHAR, Types.LONGVARCHAR, Types.NCHAR, Types.NVARCHAR,
                    Types.LONGNVARCHAR, Types.CLOB -> TEXT;
            case Types.DATE, Types.TIME, Types.TIMESTAMP,
                    Types.TIME_WITH_TIMEZONE, Types.TIMESTAMP_WITH_TIMEZONE -> TEMPORAL;
            default -> UNKNOWN;
        };
    }
}
