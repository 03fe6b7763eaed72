package com.asiainfo.kpicompute.core.engine;

import com.asiainfo.kpicompute.common.exception.TableNotFoundException;
import com.asiainfo.kpicompute.core.model.AggregationKind;
import com.asiainfo.kpicompute.core.model.ComputeRequest;
import com.asiainfo.kpicompute.core.model.ComputeResult;
import com.asiainfo.kpicompute.core.model.MetricSpec;
import com.asiainfo.kpicompute.core.model.ResultRow;
import com.asiainfo.kpicompute.core.model.SegmentSpec;
import com.asiainfo.kpicompute.core.model.SliceSpec;
import com.asiainfo.kpicompute.core.model.SliceValue;
import com.asiainfo.kpicompute.support.SampleData;
import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * MetricComputeEngine 集成测试
 * 连接配置见 src/test/resources/application.properties
 */
@QuarkusTest
class MetricComputeEngineTest {

    private static final String EVENTS = "sqlite://quarkus-compute-test.db/events";

    @Inject
    MetricComputeEngine engine;

    @Inject
    MeterRegistry meterRegistry;

    @BeforeAll
    static void createData() throws Exception {
        Path file = Path.of("target", "quarkus-compute-test.db");
        Files.createDirectories(file.getParent());
        SampleData.createSqlite(file);
    }

    @Test
    void testCompute() {
        ComputeRequest request = new ComputeRequest(
                List.of(MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount"),
                        MetricSpec.ratio("ctr", EVENTS, "clicks", "impressions")),
                List.of(SliceSpec.of("country",
                        new SliceValue("US", "country = 'US'"),
                        new SliceValue("EU", "country IN ('DE', 'FR')"))),
                List.of(new SegmentSpec("premium", "tier = 'premium'")),
                null);

        ComputeResult result = engine.compute(request);

        assertTrue(result.isComplete());
        assertEquals(4, result.table().size());
        ResultRow usRevenue = result.table().rows().get(0);
        assertEquals("revenue", usRevenue.metricName());
        assertEquals("US", usRevenue.sliceValue());
        assertEquals("premium", usRevenue.segmentName());
        assertEquals(130.0, usRevenue.metricValue(), 1e-9);
        assertEquals(0.1, result.table().rowsFor("ctr").get(1).metricValue(), 1e-9);

        assertFalse(meterRegistry.find("kpi.compute.plan").timers().isEmpty());
    }

    @Test
    void testMissingTableIsPartialFailure() {
        ComputeRequest request = ComputeRequest.of(List.of(
                MetricSpec.of("revenue", EVENTS, AggregationKind.SUM, "amount"),
                MetricSpec.of("memory_rows", "duckdb://:memory:/events", AggregationKind.COUNT, "*")));

        ComputeResult result = engine.compute(request, Duration.ofSeconds(10));

        assertEquals(1, result.table().size());
        assertEquals(290.0, result.table().rows().get(0).metricValue(), 1e-9);
        assertEquals(1, result.failures().size());
        assertEquals(List.of("memory_rows"), result.failures().get(0).metricNames());
        assertInstanceOf(TableNotFoundException.class, result.failures().get(0).cause());
    }
}
