package com.asiainfo.kpicompute.core.engine;

import com.asiainfo.kpicompute.common.exception.AssemblyException;
import com.asiainfo.kpicompute.core.MetricsConstants;
import com.asiainfo.kpicompute.core.model.PlanCell;
import com.asiainfo.kpicompute.core.model.PlanResult;
import com.asiainfo.kpicompute.core.model.QueryPlan;
import com.asiainfo.kpicompute.core.model.ResultRow;
import com.asiainfo.kpicompute.core.model.ResultTable;
import com.asiainfo.kpicompute.core.model.TimeWindow;
import jakarta.enterprise.context.ApplicationScoped;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 结果组装
 * 把每个计划的单行宽表结果按单元格拆成长表行，行顺序 = 计划顺序 + 单元格顺序
 */
@ApplicationScoped
public class OutputAssembler {

    public ResultTable assemble(List<PlanResult> results) {
        if (results == null || results.isEmpty()) {
            return ResultTable.empty();
        }
        if (results.size() == 1) {
            return ResultTable.wrap(toRows(results.get(0)));
        }
        int total = results.stream().mapToInt(r -> r.plan().cells().size()).sum();
        List<ResultRow> rows = new ArrayList<>(total);
        for (PlanResult result : results) {
            rows.addAll(toRows(result));
        }
        return ResultTable.wrap(rows);
    }

    private List<ResultRow> toRows(PlanResult result) {
        QueryPlan plan = result.plan();
        List<Map<String, Object>> raw = result.rows();
        if (raw == null || raw.size() != 1) {
            throw new AssemblyException(String.format("Expected exactly one result row for source %s but got %d",
                    plan.source(), raw == null ? 0 : raw.size()));
        }
        Map<String, Object> row = raw.get(0);

        TimeWindow window = plan.window();
        String periodType = window == null ? MetricsConstants.PERIOD_ALL_TIME : window.periodType();
        LocalDate start = window == null ? null : window.start();
        LocalDate end = window == null ? null : window.end();

        List<ResultRow> rows = new ArrayList<>(plan.cells().size());
        for (PlanCell cell : plan.cells()) {
            rows.add(new ResultRow(periodType, start, end, cell.metricName(), cell.sliceType(),
                    cell.sliceValue(), cell.segmentName(), cellValue(plan, row, cell)));
        }
        return rows;
    }

    private static Double cellValue(QueryPlan plan, Map<String, Object> row, PlanCell cell) {
        String alias = cell.columnAlias();
        Object value;
        if (row.containsKey(alias)) {
            value = row.get(alias);
        } else {
            // 部分驱动会改写列标签大小写
            String key = row.keySet().stream()
                    .filter(k -> k.equalsIgnoreCase(alias))
                    .findFirst()
                    .orElseThrow(() -> new AssemblyException(String.format(
                            "Result for source %s has no column '%s' (metric '%s')",
                            plan.source(), alias, cell.metricName())));
            value = row.get(key);
        }
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new AssemblyException(String.format("Column '%s' for metric '%s' is not numeric: %s",
                alias, cell.metricName(), value.getClass().getSimpleName()));
    }
}
