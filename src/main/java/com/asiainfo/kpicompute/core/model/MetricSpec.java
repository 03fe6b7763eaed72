package com.asiainfo.kpicompute.core.model;

/**
 * 指标定义（已校验的不可变值对象）
 */
public record MetricSpec(
    String name,             // 指标名称，如 revenue
    String source,           // 数据源 URI，如 duckdb://analytics.db/events
    AggregationKind aggregation,
    String numerator,        // 行级表达式，如 amount 或 CASE WHEN ... END
    String denominator,      // 仅 ratio 指标携带
    String timestampColumn   // 时间窗口过滤列，可为空
) {
    public static MetricSpec of(String name, String source, AggregationKind aggregation, String numerator) {
        return new MetricSpec(name, source, aggregation, numerator, null, null);
    }

    public static MetricSpec ratio(String name, String source, String numerator, String denominator) {
        return new MetricSpec(name, source, AggregationKind.RATIO, numerator, denominator, null);
    }

    public MetricSpec withTimestampColumn(String column) {
        return new MetricSpec(name, source, aggregation, numerator, denominator, column);
    }

    public boolean hasDenominator() {
        return denominator != null && !denominator.isBlank();
    }
}
