package com.asiainfo.kpicompute.core.model;

import java.time.LocalDate;

/**
 * 标准输出表中的一行
 */
public record ResultRow(
    String periodType,
    LocalDate periodStart,
    LocalDate periodEnd,
    String metricName,
    String sliceType,
    String sliceValue,
    String segmentName,
    Double metricValue  // 可为空：无匹配行或分母为 0/NULL
) {
}
