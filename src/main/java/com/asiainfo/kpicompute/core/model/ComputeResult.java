package com.asiainfo.kpicompute.core.model;

import java.util.List;

/**
 * 计算结果：结果表 + 被跳过的计划
 * failures 非空时结果表只包含可用数据源的指标
 */
public record ComputeResult(ResultTable table, List<PlanFailure> failures) {

    public ComputeResult {
        failures = List.copyOf(failures);
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }
}
