package com.asiainfo.kpicompute.core.model;

import com.asiainfo.kpicompute.common.exception.KpiComputeException;

import java.util.List;

/**
 * 单个数据源的批量查询计划
 * 一次计算内构建，执行后丢弃
 */
public record QueryPlan(
    String source,
    TableHandle table,
    TimeWindow window,                   // 可为空
    CompiledQuery query,
    List<PlanCell> cells,
    KpiComputeException resolutionFailure // 规划阶段解析表失败或超时时非空，执行器直接记为失败
) {
    public QueryPlan {
        cells = List.copyOf(cells);
    }

    public boolean isResolved() {
        return resolutionFailure == null;
    }

    /**
     * 计划覆盖的指标名称，按首次出现顺序
     */
    public List<String> metricNames() {
        return cells.stream().map(PlanCell::metricName).distinct().toList();
    }
}
