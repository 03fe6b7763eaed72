package com.asiainfo.kpicompute.core.model;

/**
 * 批量查询中的一个输出单元格：指标 × 切片组合 × 分群
 */
public record PlanCell(
    String metricName,
    String sliceType,
    String sliceValue,
    String segmentName,
    String columnAlias  // 该单元格在查询结果中的列名
) {
}
