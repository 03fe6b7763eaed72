package com.asiainfo.kpicompute.core.model;

import java.util.List;

/**
 * 被跳过的计划：数据源、受影响的指标、原因
 */
public record PlanFailure(String source, List<String> metricNames, Throwable cause) {

    public PlanFailure {
        metricNames = List.copyOf(metricNames);
    }

    public static PlanFailure of(QueryPlan plan, Throwable cause) {
        return new PlanFailure(plan.source(), plan.metricNames(), cause);
    }

    public String reason() {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
