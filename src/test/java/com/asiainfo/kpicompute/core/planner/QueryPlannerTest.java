package com.asiainfo.kpicompute.core.planner;

import com.asiainfo.kpicompute.common.exception.CompilationException;
import com.asiainfo.kpicompute.common.exception.ConnectionNotFoundException;
import com.asiainfo.kpicompute.common.exception.PlanningException;
import com.asiainfo.kpicompute.core.model.AggregationKind;
import com.asiainfo.kpicompute.core.model.MetricSpec;
import com.asiainfo.kpicompute.core.model.PlanCell;
import com.asiainfo.kpicompute.core.model.QueryPlan;
import com.asiainfo.kpicompute.core.model.SegmentSpec;
import com.asiainfo.kpicompute.core.model.SliceSpec;
import com.asiainfo.kpicompute.core.model.SliceValue;
import com.asiainfo.kpicompute.core.model.TableHandle;
import com.asiainfo.kpicompute.core.model.TimeWindow;
import com.asiainfo.kpicompute.core.parser.ExpressionCompiler;
import com.asiainfo.kpicompute.infra.connector.Connector;
import com.asiainfo.kpicompute.infra.connector.ConnectorRegistry;
import com.asiainfo.kpicompute.infra.connector.SourceUri;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class QueryPlannerTest {

    private static final String EVENTS = "duckdb://analytics.db/events";
    private static final String ORDERS = "duckdb://analytics.db/orders";

    private final QueryPlanner planner = new QueryPlanner(new ExpressionCompiler(), new SlicePlanner());

    private Connector connector;
    private ConnectorRegistry registry;

    @BeforeEach
    void setUp() {
        connector = mock(Connector.class);
        when(connector.backendType()).thenReturn("duckdb");
        when(connector.isAvailable()).thenReturn(true);
        when(connector.resolveTable(any())).thenAnswer(invocation -> {
            SourceUri uri = invocation.getArgument(0);
            return new TableHandle(uri.uri(), "duckdb", uri.table(),
                    Set.of("amount", "clicks", "impressions", "country", "tier", "ts"), true);
        });
        registry = new ConnectorRegistry().register(connector);
    }

    @Test
    void testOnePlanPerSourceInFirstAppearanceOrder() {
        List<QueryPlan> plans = planner.buildPlans(List.of(
                        MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount"),
                        MetricSpec.of("order_total", ORDERS, AggregationKind.SUM, "amount"),
                        MetricSpec.of("clicks", EVENTS, AggregationKind.SUM, "clicks")),
                List.of(), List.<SegmentSpec>of(), null, registry);

        assertEquals(2, plans.size());
        assertEquals(EVENTS, plans.get(0).source());
        assertEquals(List.of("revenue", "clicks"), plans.get(0).metricNames());
        assertEquals(ORDERS, plans.get(1).source());
        assertTrue(plans.get(1).query().sql().contains("FROM \"orders\""));

        // 每个数据源只解析一次表
        verify(connector, times(2)).resolveTable(any());
    }

    @Test
    void testCellOrderMetricThenCombinationThenSegment() {
        SliceSpec country = SliceSpec.of("country",
                new SliceValue("US", "country = 'US'"),
                new SliceValue("EU", "country IN ('DE', 'FR')"));
        List<SegmentSpec> segments = List.of(
                new SegmentSpec("premium", "tier = 'premium'"),
                new SegmentSpec("free", "tier = 'free'"));

        QueryPlan plan = planner.buildPlans(List.of(
                        MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount"),
                        MetricSpec.ratio("ctr", EVENTS, "clicks", "impressions")),
                List.of(country), segments, null, registry).get(0);

        List<PlanCell> cells = plan.cells();
        assertEquals(8, cells.size());
        assertEquals(new PlanCell("revenue", "country", "US", "premium", "cell_0"), cells.get(0));
        assertEquals(new PlanCell("revenue", "country", "US", "free", "cell_1"), cells.get(1));
        assertEquals(new PlanCell("revenue", "country", "EU", "premium", "cell_2"), cells.get(2));
        assertEquals(new PlanCell("ctr", "country", "EU", "free", "cell_7"), cells.get(7));
        for (PlanCell cell : cells) {
            assertTrue(plan.query().sql().contains(" AS " + cell.columnAlias()));
        }
    }

    @Test
    void testSentinelCellsWithoutSlicesOrSegments() {
        QueryPlan plan = planner.buildPlans(List.of(MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount")),
                null, List.<SegmentSpec>of(), null, registry).get(0);

        assertEquals(List.of(new PlanCell("revenue", "none", "all", "none", "cell_0")), plan.cells());
        assertFalse(plan.query().sql().contains("CASE WHEN"));
        assertTrue(plan.query().sql().contains("CAST(SUM((amount)) AS DOUBLE) AS cell_0"));
        assertTrue(plan.query().params().isEmpty());
    }

    @Test
    void testFiltersApplyInsideAggregate() {
        QueryPlan plan = planner.buildPlans(List.of(MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount")),
                List.of(SliceSpec.of("country", new SliceValue("US", "country = 'US'"))),
                new SegmentSpec("premium", "tier = 'premium'"), null, registry).get(0);

        assertTrue(plan.query().sql().contains(
                "SUM(CASE WHEN (tier = 'premium') AND (country = 'US') THEN (amount) END)"));
        assertFalse(plan.query().sql().contains("WHERE"));
    }

    @Test
    void testRatioUsesNullIf() {
        QueryPlan plan = planner.buildPlans(List.of(MetricSpec.ratio("ctr", EVENTS, "clicks", "impressions")),
                List.of(), List.<SegmentSpec>of(), null, registry).get(0);

        assertTrue(plan.query().sql().contains(
                "CAST(SUM((clicks)) AS DOUBLE) / NULLIF(CAST(SUM((impressions)) AS DOUBLE), 0)"));
    }

    @Test
    void testCountStar() {
        QueryPlan unfiltered = planner.buildPlans(List.of(MetricSpec.of("rows", EVENTS, AggregationKind.COUNT, "*")),
                List.of(), List.<SegmentSpec>of(), null, registry).get(0);
        assertTrue(unfiltered.query().sql().contains("COUNT(*)"));

        QueryPlan filtered = planner.buildPlans(List.of(MetricSpec.of("rows", EVENTS, AggregationKind.COUNT, "*")),
                List.of(), new SegmentSpec("us", "country = 'US'"), null, registry).get(0);
        assertTrue(filtered.query().sql().contains("COUNT(CASE WHEN (country = 'US') THEN 1 END)"));
    }

    @Test
    void testTimeWindowBindsParameters() {
        TimeWindow window = TimeWindow.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31));

        QueryPlan plan = planner.buildPlans(List.of(
                        MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount").withTimestampColumn("ts"),
                        MetricSpec.ratio("ctr", EVENTS, "clicks", "impressions").withTimestampColumn("ts")),
                List.of(), List.<SegmentSpec>of(), window, registry).get(0);

        assertTrue(plan.query().sql().contains("((ts) >= ? AND (ts) < ?)"));
        // revenue 一次窗口，ctr 分子分母各一次
        assertEquals(List.of("2024-01-01", "2024-02-01", "2024-01-01", "2024-02-01", "2024-01-01", "2024-02-01"),
                plan.query().params());
        assertSame(window, plan.window());
    }

    @Test
    void testEmptyMetricsYieldNoPlans() {
        assertTrue(planner.buildPlans(List.of(), List.of(), List.<SegmentSpec>of(), null, registry).isEmpty());
    }

    @Test
    void testStructuralErrors() {
        assertThrows(PlanningException.class, () -> planner.buildPlans(List.of(
                MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount"),
                MetricSpec.of("revenue", EVENTS, AggregationKind.MAX, "amount")), List.of(), List.<SegmentSpec>of(), null, registry));
        assertThrows(PlanningException.class, () -> planner.buildPlans(List.of(
                new MetricSpec("ctr", EVENTS, AggregationKind.RATIO, "clicks", null, null)),
                List.of(), List.<SegmentSpec>of(), null, registry));
        assertThrows(PlanningException.class, () -> planner.buildPlans(List.of(
                new MetricSpec("revenue", EVENTS, AggregationKind.SUM, "amount", "clicks", null)),
                List.of(), List.<SegmentSpec>of(), null, registry));
        assertThrows(PlanningException.class, () -> planner.buildPlans(List.of(
                MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount")),
                List.of(), List.<SegmentSpec>of(), TimeWindow.of(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 2)),
                registry));
        assertThrows(PlanningException.class, () -> planner.buildPlans(List.of(
                MetricSpec.of("revenue", "analytics.db/events", AggregationKind.SUM, "amount")),
                List.of(), List.<SegmentSpec>of(), null, registry));
    }

    @Test
    void testCompilationErrorIsFatal() {
        CompilationException e = assertThrows(CompilationException.class, () -> planner.buildPlans(List.of(
                        MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "revenu")),
                List.of(), List.<SegmentSpec>of(), null, registry));
        assertEquals("metric 'revenue' numerator", e.getOwner());

        CompilationException sliceError = assertThrows(CompilationException.class, () -> planner.buildPlans(
                List.of(MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount")),
                List.of(SliceSpec.of("country", new SliceValue("US", "continent = 'NA'"))),
                List.<SegmentSpec>of(), null, registry));
        assertEquals("slice 'country' value 'US'", sliceError.getOwner());
    }

    @Test
    void testUnresolvableSourceCarriesFailure() {
        List<QueryPlan> plans = planner.buildPlans(List.of(
                        MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount"),
                        MetricSpec.of("signups", "sqlite://crm.db/users", AggregationKind.COUNT, "*")),
                List.of(), List.<SegmentSpec>of(), null, registry);

        assertTrue(plans.get(0).isResolved());
        QueryPlan unresolved = plans.get(1);
        assertFalse(unresolved.isResolved());
        assertInstanceOf(ConnectionNotFoundException.class, unresolved.resolutionFailure());
        assertFalse(unresolved.table().verified());
        assertEquals(List.of("signups"), unresolved.metricNames());
    }

    @Test
    void testUnresolvableSourceStillChecksSyntax() {
        assertThrows(CompilationException.class, () -> planner.buildPlans(List.of(
                        MetricSpec.of("signups", "sqlite://crm.db/users", AggregationKind.SUM, "amount +")),
                List.of(), List.<SegmentSpec>of(), null, registry));
    }
}
