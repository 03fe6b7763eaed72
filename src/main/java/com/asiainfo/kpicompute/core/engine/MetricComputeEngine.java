package com.asiainfo.kpicompute.core.engine;

import com.asiainfo.kpicompute.config.ComputeConfig;
import com.asiainfo.kpicompute.config.ComputeExecutorConfig;
import com.asiainfo.kpicompute.core.model.ComputeRequest;
import com.asiainfo.kpicompute.core.model.ComputeResult;
import com.asiainfo.kpicompute.core.model.MetricSpec;
import com.asiainfo.kpicompute.core.model.QueryPlan;
import com.asiainfo.kpicompute.core.model.TableResolution;
import com.asiainfo.kpicompute.core.planner.QueryPlanner;
import com.asiainfo.kpicompute.infra.connector.ConnectorRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 指标计算入口
 * 1. 校验定义结构，在截止时间内并发解析各数据源的表
 * 2. 规划：按数据源生成批量查询计划（表达式错误、定义错误直接抛出）
 * 3. 执行：用剩余时间并发执行，单个数据源失败不影响其他数据源
 * 4. 组装：长表结果 + 失败清单
 * 截止时间从调用 compute 开始计算。
 */
@ApplicationScoped
public class MetricComputeEngine {

    private static final Logger log = LoggerFactory.getLogger(MetricComputeEngine.class);

    @Inject
    QueryPlanner queryPlanner;
    @Inject
    OutputAssembler outputAssembler;
    @Inject
    ConnectorRegistry connectorRegistry;
    @Inject
    ComputeConfig computeConfig;
    @Inject
    ComputeExecutorConfig executorConfig;
    @Inject
    MeterRegistry meterRegistry;

    private PlanExecutor planExecutor;

    @PostConstruct
    void init() {
        this.planExecutor = new PlanExecutor(connectorRegistry, executorConfig.getComputeExecutor(),
                outputAssembler, meterRegistry);
    }

    public ComputeResult compute(ComputeRequest request) {
        return compute(request, computeConfig.getTimeout());
    }

    public ComputeResult compute(ComputeRequest request, Duration deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("Deadline must not be null");
        }
        long t0 = System.nanoTime();

        queryPlanner.validate(request.metrics(), request.slices(), request.segments(), request.timeWindow());
        Map<String, TableResolution> tables = planExecutor.resolveTables(sources(request.metrics()), deadline);

        List<QueryPlan> plans = queryPlanner.buildPlans(request.metrics(), request.slices(),
                request.segments(), request.timeWindow(), source -> tables.get(source).handleOrThrow());

        ComputeResult result = planExecutor.execute(plans, remaining(deadline, t0));

        if (result.isComplete()) {
            log.info("Computed {} metric(s) into {} row(s) in {} ms",
                    request.metrics().size(), result.table().size(), elapsedMillis(t0));
        } else {
            log.warn("Computed {} metric(s) into {} row(s) in {} ms with {} failed source(s)",
                    request.metrics().size(), result.table().size(), elapsedMillis(t0),
                    result.failures().size());
        }
        return result;
    }

    private static Set<String> sources(List<MetricSpec> metrics) {
        Set<String> sources = new LinkedHashSet<>();
        if (metrics != null) {
            metrics.forEach(metric -> sources.add(metric.source()));
        }
        return sources;
    }

    private static Duration remaining(Duration deadline, long startNanos) {
        if (deadline.isNegative()) {
            return Duration.ZERO;
        }
        Duration left = deadline.minus(Duration.ofNanos(System.nanoTime() - startNanos));
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
