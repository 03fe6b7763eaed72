package com.asiainfo.kpicompute.core.engine;

import com.asiainfo.kpicompute.common.exception.KpiComputeException;
import com.asiainfo.kpicompute.common.exception.PlanTimeoutException;
import com.asiainfo.kpicompute.core.model.ComputeResult;
import com.asiainfo.kpicompute.core.model.PlanFailure;
import com.asiainfo.kpicompute.core.model.PlanResult;
import com.asiainfo.kpicompute.core.model.QueryPlan;
import com.asiainfo.kpicompute.core.model.ResultTable;
import com.asiainfo.kpicompute.core.model.TableResolution;
import com.asiainfo.kpicompute.infra.connector.Connector;
import com.asiainfo.kpicompute.infra.connector.ConnectorRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * 计划执行器
 * 每个计划一个任务并发提交，所有任务共享同一个截止时间；
 * 单个计划失败（后端不可用、查询报错、超时）只影响该计划的指标，其余结果照常返回。
 * 结果在调用线程上按提交顺序收集，保证输出顺序确定。
 * 超时的查询会通过连接器取消，释放其线程。
 */
public class PlanExecutor {

    private static final Logger log = LoggerFactory.getLogger(PlanExecutor.class);

    static final String PLAN_TIMER = "kpi.compute.plan";
    static final String FAILURE_COUNTER = "kpi.compute.plan.failures";

    // invokeAll 换算纳秒时不溢出的上限
    static final Duration MAX_WAIT = Duration.ofMillis(Long.MAX_VALUE / 2);

    private final ConnectorRegistry registry;
    private final ExecutorService executor;
    private final OutputAssembler assembler;
    private final MeterRegistry meterRegistry;

    public PlanExecutor(ConnectorRegistry registry, ExecutorService executor,
                        OutputAssembler assembler, MeterRegistry meterRegistry) {
        this.registry = registry;
        this.executor = executor;
        this.assembler = assembler;
        this.meterRegistry = meterRegistry;
    }

    /**
     * 在截止时间内并发解析各数据源的表，超时的数据源记为 PlanTimeoutException
     *
     * @return 数据源 -> 解析结果，顺序同 sources
     */
    public Map<String, TableResolution> resolveTables(Collection<String> sources, Duration deadline) {
        long waitMillis = waitMillis(deadline);
        List<String> ordered = new ArrayList<>(sources);
        List<Callable<TableResolution>> tasks = new ArrayList<>(ordered.size());
        for (String source : ordered) {
            tasks.add(() -> resolveOne(source));
        }

        Map<String, TableResolution> resolutions = new LinkedHashMap<>();
        List<Future<TableResolution>> futures = invokeAll(tasks, waitMillis);
        for (int i = 0; i < ordered.size(); i++) {
            String source = ordered.get(i);
            try {
                resolutions.put(source, futures.get(i).get());
            } catch (CancellationException e) {
                resolutions.put(source, TableResolution.failed(source, new PlanTimeoutException(String.format(
                        "Resolving table for source %s did not finish within %d ms", source, waitMillis))));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                if (cause instanceof RuntimeException runtime) {
                    throw runtime;
                }
                throw new KpiComputeException("Failed to resolve table for source " + source, cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new KpiComputeException("Interrupted while resolving tables", e);
            }
        }
        return resolutions;
    }

    private TableResolution resolveOne(String source) {
        try {
            return TableResolution.resolved(source, registry.resolveTable(source));
        } catch (KpiComputeException e) {
            return TableResolution.failed(source, e);
        }
    }

    public ComputeResult execute(List<QueryPlan> plans, Duration deadline) {
        long waitMillis = waitMillis(deadline);
        if (plans == null || plans.isEmpty()) {
            return new ComputeResult(ResultTable.empty(), List.of());
        }
        long t0 = System.currentTimeMillis();

        List<PlanFailure> failures = new ArrayList<>();
        List<QueryPlan> dispatched = new ArrayList<>();
        List<Callable<List<Map<String, Object>>>> tasks = new ArrayList<>();

        // 1. 规划阶段已失败的计划不再下发
        for (QueryPlan plan : plans) {
            if (!plan.isResolved()) {
                fail(failures, PlanFailure.of(plan, plan.resolutionFailure()));
                continue;
            }
            dispatched.add(plan);
            tasks.add(() -> runPlan(plan));
        }

        // 2. 并发执行，超时未完成的任务被取消
        List<Future<List<Map<String, Object>>>> futures = invokeAll(tasks, waitMillis);

        // 3. 按提交顺序收集
        List<PlanResult> results = new ArrayList<>(dispatched.size());
        for (int i = 0; i < dispatched.size(); i++) {
            QueryPlan plan = dispatched.get(i);
            Future<List<Map<String, Object>>> future = futures.get(i);
            try {
                results.add(new PlanResult(plan, future.get()));
            } catch (CancellationException e) {
                registry.find(plan.table().backendType()).ifPresent(connector -> connector.cancel(plan.query()));
                fail(failures, PlanFailure.of(plan, new PlanTimeoutException(String.format(
                        "Query for source %s did not finish within %d ms", plan.source(), waitMillis))));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                fail(failures, PlanFailure.of(plan, cause));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new KpiComputeException("Interrupted while collecting query results", e);
            }
        }

        ResultTable table = assembler.assemble(results);
        log.info("Executed {} plan(s): {} succeeded, {} failed, {} row(s) in {} ms",
                plans.size(), results.size(), failures.size(), table.size(), System.currentTimeMillis() - t0);
        return new ComputeResult(table, failures);
    }

    private <T> List<Future<T>> invokeAll(List<Callable<T>> tasks, long waitMillis) {
        if (tasks.isEmpty()) {
            return List.of();
        }
        try {
            return executor.invokeAll(tasks, waitMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new KpiComputeException("Interrupted while executing query plans", e);
        }
    }

    private List<Map<String, Object>> runPlan(QueryPlan plan) {
        String backend = plan.table().backendType();
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            // 健康检查已在解析表时完成
            Connector connector = registry.connectorFor(plan.source());
            log.debug("Dispatching {} cell(s) to {} for {}", plan.cells().size(), backend, plan.source());
            List<Map<String, Object>> rows = connector.runQuery(plan.query());
            outcome = "success";
            return rows;
        } finally {
            sample.stop(Timer.builder(PLAN_TIMER)
                    .description("Backend query time per plan")
                    .tag("backend", backend)
                    .tag("outcome", outcome)
                    .register(meterRegistry));
        }
    }

    static long waitMillis(Duration deadline) {
        if (deadline == null) {
            throw new IllegalArgumentException("Deadline must not be null");
        }
        if (deadline.isNegative()) {
            return 0;
        }
        if (deadline.compareTo(MAX_WAIT) > 0) {
            return MAX_WAIT.toMillis();
        }
        return Math.max(0, deadline.toMillis());
    }

    private void fail(List<PlanFailure> failures, PlanFailure failure) {
        log.warn("Skipping metrics {} from {}: {}", failure.metricNames(), failure.source(), failure.reason());
        Counter.builder(FAILURE_COUNTER)
                .description("Query plans that produced no result")
                .tag("reason", failure.cause().getClass().getSimpleName())
                .register(meterRegistry)
                .increment();
        failures.add(failure);
    }
}
