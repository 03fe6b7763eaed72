package com.asiainfo.kpicompute.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 已解析的物理表
 * verified=false 表示后端不可用、仅知道表名，列名无法校验
 */
public record TableHandle(
    String source,                    // 原始数据源 URI
    String backendType,               // duckdb / sqlite / bigquery ...
    String tableName,                 // 如 events 或 main.events
    Map<String, ColumnType> columns,  // 小写列名 -> 类型
    boolean verified
) {
    public TableHandle {
        Map<String, ColumnType> normalized = new LinkedHashMap<>();
        if (columns != null) {
            columns.forEach((name, type) ->
                    normalized.put(name.toLowerCase(Locale.ROOT), type == null ? ColumnType.UNKNOWN : type));
        }
        columns = Collections.unmodifiableMap(normalized);
    }

    /**
     * 只知道列名、不知道类型
     */
    public TableHandle(String source, String backendType, String tableName, Set<String> columnNames, boolean verified) {
        this(source, backendType, tableName, columnNames.stream()
                .collect(Collectors.<String, String, ColumnType, LinkedHashMap<String, ColumnType>>toMap(c -> c, c -> ColumnType.UNKNOWN, (a, b) -> a, LinkedHashMap::new)), verified);
    }

    public static TableHandle unverified(String source, String backendType, String tableName) {
        return new TableHandle(source, backendType, tableName, Collections.<String, ColumnType>emptyMap(), false);
    }

    public boolean hasColumn(String column) {
        return columns.containsKey(column.toLowerCase(Locale.ROOT));
    }

    public ColumnType columnType(String column) {
        return columns.getOrDefault(column.toLowerCase(Locale.ROOT), ColumnType.UNKNOWN);
    }

    /**
     * 不带 schema 的表名，用于校验列限定符
     */
    public String simpleName() {
        int dot = tableName.lastIndexOf('.');
        return dot < 0 ? tableName : tableName.substring(dot + 1);
    }

    /**
     * SQL 中的表引用，每一段都加双引号
     */
    public String sqlReference() {
        return Arrays.stream(tableName.split("\\."))
                .map(part -> "\"" + part + "\"")
                .collect(Collectors.joining("."));
    }
}
