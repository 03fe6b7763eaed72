package com.asiainfo.kpicompute.core.model;

import java.util.List;

/**
 * 一次指标计算请求
 */
public record ComputeRequest(
    List<MetricSpec> metrics,
    List<SliceSpec> slices,      // 可为空，按声明顺序做笛卡尔积
    List<SegmentSpec> segments,  // 可为空
    TimeWindow timeWindow        // 可为空
) {
    public ComputeRequest {
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        slices = slices == null ? List.of() : List.copyOf(slices);
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public static ComputeRequest of(List<MetricSpec> metrics) {
        return new ComputeRequest(metrics, List.of(), List.of(), null);
    }
}
