package com.asiainfo.kpicompute.core.model;

import com.asiainfo.kpicompute.core.MetricsConstants;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 标准长表结果
 * 列固定为 {@link MetricsConstants#OUTPUT_COLUMNS}，行顺序即计划提交顺序 + 组合顺序
 */
public final class ResultTable {

    private static final ResultTable EMPTY = new ResultTable(Collections.emptyList());

    private final List<ResultRow> rows;

    private ResultTable(List<ResultRow> rows) {
        this.rows = rows;
    }

    public static ResultTable empty() {
        return EMPTY;
    }

    /**
     * 直接包装已有列表，不复制
     * 调用方交出列表所有权后不应再修改它
     */
    public static ResultTable wrap(List<ResultRow> rows) {
        return rows.isEmpty() ? EMPTY : new ResultTable(Collections.unmodifiableList(rows));
    }

    public List<String> columns() {
        return MetricsConstants.OUTPUT_COLUMNS;
    }

    public List<ResultRow> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public List<ResultRow> rowsFor(String metricName) {
        return rows.stream().filter(r -> r.metricName().equals(metricName)).toList();
    }

    /**
     * 行式容器：每行一个按列顺序排列的 Map
     */
    public List<Map<String, Object>> toMaps() {
        List<Map<String, Object>> result = new ArrayList<>(rows.size());
        for (ResultRow row : rows) {
            Map<String, Object> map = new LinkedHashMap<>();
            map.put(MetricsConstants.COL_PERIOD_TYPE, row.periodType());
            map.put(MetricsConstants.COL_PERIOD_START, row.periodStart());
            map.put(MetricsConstants.COL_PERIOD_END, row.periodEnd());
            map.put(MetricsConstants.COL_METRIC_NAME, row.metricName());
            map.put(MetricsConstants.COL_SLICE_TYPE, row.sliceType());
            map.put(MetricsConstants.COL_SLICE_VALUE, row.sliceValue());
            map.put(MetricsConstants.COL_SEGMENT_NAME, row.segmentName());
            map.put(MetricsConstants.COL_METRIC_VALUE, row.metricValue());
            result.add(map);
        }
        return result;
    }

    /**
     * 列式容器：列名 -> 该列全部取值
     */
    public Map<String, List<Object>> toColumns() {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (String column : MetricsConstants.OUTPUT_COLUMNS) {
            columns.put(column, new ArrayList<>(rows.size()));
        }
        for (Map<String, Object> row : toMaps()) {
            row.forEach((k, v) -> columns.get(k).add(v));
        }
        return columns;
    }

    @Override
    public String toString() {
        return "ResultTable{rows=" + rows.size() + "}";
    }
}
