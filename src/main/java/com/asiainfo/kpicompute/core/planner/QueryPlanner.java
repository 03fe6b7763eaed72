package com.asiainfo.kpicompute.core.planner;

import com.asiainfo.kpicompute.common.exception.ConnectorException;
import com.asiainfo.kpicompute.common.exception.InvalidSourceUriException;
import com.asiainfo.kpicompute.common.exception.KpiComputeException;
import com.asiainfo.kpicompute.common.exception.PlanTimeoutException;
import com.asiainfo.kpicompute.common.exception.PlanningException;
import com.asiainfo.kpicompute.core.MetricsConstants;
import com.asiainfo.kpicompute.core.model.AggregationKind;
import com.asiainfo.kpicompute.core.model.Combination;
import com.asiainfo.kpicompute.core.model.CompiledQuery;
import com.asiainfo.kpicompute.core.model.MetricSpec;
import com.asiainfo.kpicompute.core.model.PlanCell;
import com.asiainfo.kpicompute.core.model.QueryPlan;
import com.asiainfo.kpicompute.core.model.SegmentSpec;
import com.asiainfo.kpicompute.core.model.SliceSpec;
import com.asiainfo.kpicompute.core.model.TableHandle;
import com.asiainfo.kpicompute.core.model.TimeWindow;
import com.asiainfo.kpicompute.core.parser.CompiledExpression;
import com.asiainfo.kpicompute.core.parser.ExpressionCompiler;
import com.asiainfo.kpicompute.infra.connector.ConnectorRegistry;
import com.asiainfo.kpicompute.infra.connector.SourceUri;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 查询计划生成
 * 按数据源分组，每个数据源生成一条单行聚合 SQL，覆盖 指标 × 切片组合 × 分群 的全部单元格：
 * <pre>
 * SELECT
 *   CAST(SUM(CASE WHEN (segment) AND (window) AND (slice) THEN (expr) END) AS DOUBLE) AS cell_0,
 *   ...
 * FROM "table"
 * </pre>
 * 过滤条件写在聚合函数内部，先过滤后聚合。所有片段均先经过 {@link ExpressionCompiler}。
 */
@ApplicationScoped
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private static final String COUNT_ALL = "*";

    private final ExpressionCompiler compiler;
    private final SlicePlanner slicePlanner;

    @Inject
    public QueryPlanner(ExpressionCompiler compiler, SlicePlanner slicePlanner) {
        this.compiler = compiler;
        this.slicePlanner = slicePlanner;
    }

    public List<QueryPlan> buildPlans(List<MetricSpec> metrics, List<SliceSpec> slices, SegmentSpec segment,
                                      TimeWindow window, ConnectorRegistry registry) {
        return buildPlans(metrics, slices, segment == null ? List.of() : List.of(segment), window, registry);
    }

    /**
     * 生成计划，每个不同的数据源一个，顺序按数据源在 metrics 中首次出现的顺序
     *
     * @throws PlanningException    定义结构错误
     * @throws com.asiainfo.kpicompute.common.exception.CompilationException 表达式无法编译
     */
    public List<QueryPlan> buildPlans(List<MetricSpec> metrics, List<SliceSpec> slices, List<SegmentSpec> segments,
                                      TimeWindow window, ConnectorRegistry registry) {
        return buildPlans(metrics, slices, segments, window, registry::resolveTable);
    }

    /**
     * 同上，表由调用方解析（如在截止时间内并发解析后传入）
     */
    public List<QueryPlan> buildPlans(List<MetricSpec> metrics, List<SliceSpec> slices, List<SegmentSpec> segments,
                                      TimeWindow window, TableResolver resolver) {
        if (metrics == null || metrics.isEmpty()) {
            return Collections.emptyList();
        }
        List<Combination> combinations = validate(metrics, slices, segments, window);

        // 1. 按数据源分组，保持出现顺序
        Map<String, List<MetricSpec>> bySource = new LinkedHashMap<>();
        for (MetricSpec metric : metrics) {
            bySource.computeIfAbsent(metric.source(), k -> new ArrayList<>()).add(metric);
        }

        // 2. 每个数据源一条批量查询
        List<QueryPlan> plans = new ArrayList<>(bySource.size());
        int cellTotal = 0;
        for (Map.Entry<String, List<MetricSpec>> entry : bySource.entrySet()) {
            QueryPlan plan = planSource(entry.getKey(), entry.getValue(), combinations, segments, window, resolver);
            cellTotal += plan.cells().size();
            plans.add(plan);
        }

        log.info("Planned {} metric(s) x {} combination(s) x {} segment(s) into {} plan(s), {} cell(s)",
                metrics.size(), combinations.size(), Math.max(segments == null ? 0 : segments.size(), 1),
                plans.size(), cellTotal);
        return plans;
    }

    /**
     * 只校验定义结构与切片，不访问后端
     *
     * @return 切片展开后的组合
     * @throws PlanningException 定义结构错误
     */
    public List<Combination> validate(List<MetricSpec> metrics, List<SliceSpec> slices, List<SegmentSpec> segments,
                                      TimeWindow window) {
        if (metrics != null) {
            validateMetrics(metrics, window);
        }
        validateSegments(segments);
        return slicePlanner.expand(slices);
    }

    private QueryPlan planSource(String source, List<MetricSpec> metrics, List<Combination> combinations,
                                 List<SegmentSpec> segments, TimeWindow window, TableResolver resolver) {
        SourceUri uri;
        try {
            uri = SourceUri.parse(source);
        } catch (InvalidSourceUriException e) {
            throw new PlanningException("Invalid source for metric(s) " + names(metrics) + ": " + e.getMessage(), e);
        }

        // 表只解析一次；后端不可用时仍做语法编译，失败延迟到执行阶段上报
        TableHandle table;
        KpiComputeException resolutionFailure = null;
        try {
            table = resolver.resolve(source);
        } catch (ConnectorException | PlanTimeoutException e) {
            log.warn("Cannot resolve table for source {}: {}", source, e.getMessage());
            table = TableHandle.unverified(source, uri.backendType(), uri.table());
            resolutionFailure = e;
        }

        Map<String, CompiledExpression> predicateCache = new HashMap<>();
        List<Filter> segmentFilters = new ArrayList<>();
        List<String> segmentNames = new ArrayList<>();
        if (segments == null || segments.isEmpty()) {
            segmentFilters.add(null);
            segmentNames.add(MetricsConstants.NO_SEGMENT);
        } else {
            for (SegmentSpec segment : segments) {
                CompiledExpression compiled = compiler.compilePredicate(
                        segment.where(), "segment '" + segment.name() + "'", table);
                segmentFilters.add(new Filter(compiled.toSql(), List.of()));
                segmentNames.add(segment.name());
            }
        }

        List<Filter> comboFilters = new ArrayList<>(combinations.size());
        for (Combination combination : combinations) {
            List<String> parts = new ArrayList<>();
            for (Combination.Member member : combination.members()) {
                String key = member.owner() + '\u0000' + member.where();
                TableHandle scope = table;
                CompiledExpression compiled = predicateCache.computeIfAbsent(key,
                        k -> compiler.compilePredicate(member.where(), member.owner(), scope));
                parts.add(compiled.toSql());
            }
            comboFilters.add(parts.isEmpty() ? null : new Filter(String.join(" AND ", parts), List.of()));
        }

        StringBuilder sql = new StringBuilder("SELECT");
        List<Object> params = new ArrayList<>();
        List<PlanCell> cells = new ArrayList<>();

        for (MetricSpec metric : metrics) {
            MetricExpressions exprs = compileMetric(metric, window != null, table);
            Filter windowFilter = exprs.timestamp() == null ? null : new Filter(
                    String.format("(%s >= ? AND %s < ?)", exprs.timestamp(), exprs.timestamp()),
                    List.of(window.start().toString(), window.exclusiveEnd().toString()));

            for (int c = 0; c < combinations.size(); c++) {
                Combination combination = combinations.get(c);
                for (int s = 0; s < segmentFilters.size(); s++) {
                    Filter filter = Filter.and(segmentFilters.get(s), windowFilter, comboFilters.get(c));
                    String alias = MetricsConstants.CELL_ALIAS_PREFIX + cells.size();

                    sql.append(cells.isEmpty() ? "\n  " : ",\n  ");
                    appendCell(sql, params, metric.aggregation(), exprs, filter);
                    sql.append(" AS ").append(alias);

                    cells.add(new PlanCell(metric.name(), combination.sliceType(), combination.sliceValue(),
                            segmentNames.get(s), alias));
                }
            }
        }
        sql.append("\nFROM ").append(table.sqlReference());

        log.debug("[SQL Generation] source={}, cells={}, params={}, SQL length={}",
                source, cells.size(), params.size(), sql.length());
        return new QueryPlan(source, table, window, new CompiledQuery(sql.toString(), params), cells, resolutionFailure);
    }

    private MetricExpressions compileMetric(MetricSpec metric, boolean windowed, TableHandle table) {
        String owner = "metric '" + metric.name() + "'";
        String numerator = null;
        if (!(metric.aggregation() == AggregationKind.COUNT && COUNT_ALL.equals(metric.numerator().trim()))) {
            numerator = compiler.compileMeasure(metric.numerator(), owner + " numerator", metric.aggregation(), table).toSql();
        }
        String denominator = metric.aggregation().requiresDenominator()
                ? compiler.compileMeasure(metric.denominator(), owner + " denominator", metric.aggregation(), table).toSql()
                : null;
        // 无时间窗口时不使用时间列
        String timestamp = !windowed ? null
                : compiler.compileScalar(metric.timestampColumn(), owner + " timestamp column", table).toSql();
        return new MetricExpressions(numerator, denominator, timestamp);
    }

    /**
     * ratio: SUM(分子) / NULLIF(SUM(分母), 0)，分母为 0 或 NULL 时结果为 NULL
     */
    private void appendCell(StringBuilder sql, List<Object> params, AggregationKind kind,
                            MetricExpressions exprs, Filter filter) {
        if (kind == AggregationKind.RATIO) {
            sql.append("CAST(");
            appendAggregate(sql, params, kind.sqlFunction(), exprs.numerator(), filter);
            sql.append(" AS DOUBLE) / NULLIF(CAST(");
            appendAggregate(sql, params, kind.sqlFunction(), exprs.denominator(), filter);
            sql.append(" AS DOUBLE), 0)");
            return;
        }
        sql.append("CAST(");
        appendAggregate(sql, params, kind.sqlFunction(), exprs.numerator(), filter);
        sql.append(" AS DOUBLE)");
    }

    // argument 为空表示 COUNT(*)
    private void appendAggregate(StringBuilder sql, List<Object> params, String function,
                                 String argument, Filter filter) {
        sql.append(function).append('(');
        if (filter == null) {
            sql.append(argument == null ? COUNT_ALL : argument);
        } else {
            sql.append("CASE WHEN ").append(filter.sql())
                    .append(" THEN ").append(argument == null ? "1" : argument)
                    .append(" END");
            params.addAll(filter.params());
        }
        sql.append(')');
    }

    private void validateMetrics(List<MetricSpec> metrics, TimeWindow window) {
        Set<String> seen = new HashSet<>();
        for (MetricSpec metric : metrics) {
            if (metric.name() == null || metric.name().isBlank()) {
                throw new PlanningException("Metric name must not be blank");
            }
            if (!seen.add(metric.name())) {
                throw new PlanningException("Duplicate metric name '" + metric.name() + "'");
            }
            if (metric.source() == null || metric.source().isBlank()) {
                throw new PlanningException("Metric '" + metric.name() + "' has no source");
            }
            if (metric.aggregation() == null) {
                throw new PlanningException("Metric '" + metric.name() + "' has no aggregation");
            }
            if (metric.numerator() == null || metric.numerator().isBlank()) {
                throw new PlanningException("Metric '" + metric.name() + "' has no numerator");
            }
            if (metric.aggregation().requiresDenominator() && !metric.hasDenominator()) {
                throw new PlanningException("Ratio metric '" + metric.name() + "' requires a denominator");
            }
            if (!metric.aggregation().requiresDenominator() && metric.denominator() != null) {
                throw new PlanningException("Metric '" + metric.name() + "' with aggregation "
                        + metric.aggregation() + " must not declare a denominator");
            }
            if (window != null && (metric.timestampColumn() == null || metric.timestampColumn().isBlank())) {
                throw new PlanningException("Metric '" + metric.name()
                        + "' has no timestamp column but a time window was requested");
            }
        }
    }

    private void validateSegments(List<SegmentSpec> segments) {
        if (segments == null) {
            return;
        }
        for (SegmentSpec segment : segments) {
            if (segment.name() == null || segment.name().isBlank()) {
                throw new PlanningException("Segment name must not be blank");
            }
        }
    }

    private static List<String> names(List<MetricSpec> metrics) {
        return metrics.stream().map(MetricSpec::name).toList();
    }

    private record MetricExpressions(String numerator, String denominator, String timestamp) {
    }

    /**
     * 过滤条件片段，params 与 sql 中的 ? 一一对应
     */
    private record Filter(String sql, List<Object> params) {

        static Filter and(Filter... filters) {
            List<String> parts = new ArrayList<>();
            List<Object> params = new ArrayList<>();
            for (Filter filter : filters) {
                if (filter != null) {
                    parts.add(filter.sql());
                    params.addAll(filter.params());
                }
            }
            return parts.isEmpty() ? null : new Filter(String.join(" AND ", parts), params);
        }
    }
}
