package com.asiainfo.kpicompute.core.model;

import java.util.List;
import java.util.Map;

/**
 * 单个计划的后端原始结果
 */
public record PlanResult(QueryPlan plan, List<Map<String, Object>> rows) {
}
