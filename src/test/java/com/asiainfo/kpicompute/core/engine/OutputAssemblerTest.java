package com.asiainfo.kpicompute.core.engine;

import com.asiainfo.kpicompute.common.exception.AssemblyException;
import com.asiainfo.kpicompute.core.model.CompiledQuery;
import com.asiainfo.kpicompute.core.model.PlanCell;
import com.asiainfo.kpicompute.core.model.PlanResult;
import com.asiainfo.kpicompute.core.model.QueryPlan;
import com.asiainfo.kpicompute.core.model.ResultRow;
import com.asiainfo.kpicompute.core.model.ResultTable;
import com.asiainfo.kpicompute.core.model.TableHandle;
import com.asiainfo.kpicompute.core.model.TimeWindow;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class OutputAssemblerTest {

    private final OutputAssembler assembler = new OutputAssembler();

    private static QueryPlan plan(String source, TimeWindow window, PlanCell... cells) {
        TableHandle table = TableHandle.unverified(source, "duckdb", "events");
        return new QueryPlan(source, table, window, new CompiledQuery("SELECT 1", List.of()), List.of(cells), null);
    }

    @Test
    void testCellsBecomeRowsInOrder() {
        QueryPlan plan = plan("duckdb://a.db/events", null,
                new PlanCell("revenue", "country", "US", "premium", "cell_0"),
                new PlanCell("revenue", "country", "EU", "premium", "cell_1"));
        Map<String, Object> row = new HashMap<>();
        row.put("cell_0", 130.0);
        row.put("cell_1", 100L);

        ResultTable table = assembler.assemble(List.of(new PlanResult(plan, List.of(row))));

        assertEquals(2, table.size());
        ResultRow first = table.rows().get(0);
        assertEquals("all_time", first.periodType());
        assertNull(first.periodStart());
        assertNull(first.periodEnd());
        assertEquals("revenue", first.metricName());
        assertEquals("US", first.sliceValue());
        assertEquals(130.0, first.metricValue());
        assertEquals(100.0, table.rows().get(1).metricValue());
    }

    @Test
    void testWindowFillsPeriodColumns() {
        TimeWindow window = new TimeWindow("month", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));
        QueryPlan plan = plan("duckdb://a.db/events", window, new PlanCell("revenue", "none", "all", "none", "cell_0"));

        ResultRow row = assembler.assemble(List.of(new PlanResult(plan, List.of(Map.of("cell_0", new BigDecimal("12.5"))))))
                .rows().get(0);

        assertEquals("month", row.periodType());
        assertEquals(LocalDate.of(2024, 1, 1), row.periodStart());
        assertEquals(LocalDate.of(2024, 1, 31), row.periodEnd());
        assertEquals(12.5, row.metricValue());
    }

    @Test
    void testNullValueStaysNull() {
        QueryPlan plan = plan("duckdb://a.db/events", null, new PlanCell("ctr", "none", "all", "none", "cell_0"));
        Map<String, Object> row = new HashMap<>();
        row.put("cell_0", null);

        assertNull(assembler.assemble(List.of(new PlanResult(plan, List.of(row)))).rows().get(0).metricValue());
    }

    @Test
    void testColumnLookupFallsBackToCaseInsensitive() {
        QueryPlan plan = plan("duckdb://a.db/events", null, new PlanCell("revenue", "none", "all", "none", "cell_0"));

        ResultTable table = assembler.assemble(List.of(new PlanResult(plan, List.of(Map.of("CELL_0", 7)))));

        assertEquals(7.0, table.rows().get(0).metricValue());
    }

    @Test
    void testPlansConcatenateInSubmissionOrder() {
        QueryPlan first = plan("duckdb://a.db/events", null, new PlanCell("revenue", "none", "all", "none", "cell_0"));
        QueryPlan second = plan("sqlite://b.db/users", null, new PlanCell("signups", "none", "all", "none", "cell_0"));

        ResultTable table = assembler.assemble(List.of(
                new PlanResult(first, List.of(Map.of("cell_0", 1.0))),
                new PlanResult(second, List.of(Map.of("cell_0", 2.0)))));

        assertEquals(List.of("revenue", "signups"), table.rows().stream().map(ResultRow::metricName).toList());
        assertEquals(List.of(1.0, 2.0), table.toColumns().get("metric_value"));
        assertEquals(List.of("period_type", "period_start_date", "period_end_date", "metric_name",
                "slice_type", "slice_value", "segment_name", "metric_value"), table.columns());
    }

    @Test
    void testNoResultsYieldEmptyTable() {
        assertTrue(assembler.assemble(List.of()).isEmpty());
    }

    @Test
    void testAssemblyErrors() {
        QueryPlan plan = plan("duckdb://a.db/events", null, new PlanCell("revenue", "none", "all", "none", "cell_0"));

        assertThrows(AssemblyException.class, () -> assembler.assemble(List.of(new PlanResult(plan, List.of()))));
        assertThrows(AssemblyException.class, () -> assembler.assemble(List.of(
                new PlanResult(plan, List.of(Map.of("cell_0", 1.0), Map.of("cell_0", 2.0))))));
        assertThrows(AssemblyException.class, () -> assembler.assemble(List.of(
                new PlanResult(plan, List.of(Map.of("cell_9", 1.0))))));
        assertThrows(AssemblyException.class, () -> assembler.assemble(List.of(
                new PlanResult(plan, List.of(Map.of("cell_0", "abc"))))));
    }
}
