package com.asiainfo.kpicompute.core.parser;

import com.asiainfo.kpicompute.common.exception.CompilationException;
import com.asiainfo.kpicompute.core.model.AggregationKind;
import com.asiainfo.kpicompute.core.model.ColumnType;
import com.asiainfo.kpicompute.core.model.TableHandle;
import jakarta.enterprise.context.ApplicationScoped;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.expression.AnalyticExpression;
import net.sf.jsqlparser.expression.DoubleValue;
import net.sf.jsqlparser.expression.Expression;
import net.sf.jsqlparser.expression.ExpressionVisitorAdapter;
import net.sf.jsqlparser.expression.Function;
import net.sf.jsqlparser.expression.JdbcNamedParameter;
import net.sf.jsqlparser.expression.JdbcParameter;
import net.sf.jsqlparser.expression.LongValue;
import net.sf.jsqlparser.expression.NotExpression;
import net.sf.jsqlparser.expression.NullValue;
import net.sf.jsqlparser.expression.StringValue;
import net.sf.jsqlparser.expression.operators.arithmetic.Addition;
import net.sf.jsqlparser.expression.operators.arithmetic.Concat;
import net.sf.jsqlparser.expression.operators.arithmetic.Division;
import net.sf.jsqlparser.expression.operators.arithmetic.Modulo;
import net.sf.jsqlparser.expression.operators.arithmetic.Multiplication;
import net.sf.jsqlparser.expression.operators.arithmetic.Subtraction;
import net.sf.jsqlparser.expression.operators.conditional.AndExpression;
import net.sf.jsqlparser.expression.operators.conditional.OrExpression;
import net.sf.jsqlparser.expression.operators.conditional.XorExpression;
import net.sf.jsqlparser.expression.operators.relational.Between;
import net.sf.jsqlparser.expression.operators.relational.ComparisonOperator;
import net.sf.jsqlparser.expression.operators.relational.ExistsExpression;
import net.sf.jsqlparser.expression.operators.relational.InExpression;
import net.sf.jsqlparser.expression.operators.relational.IsBooleanExpression;
import net.sf.jsqlparser.expression.operators.relational.IsNullExpression;
import net.sf.jsqlparser.expression.operators.relational.LikeExpression;
import net.sf.jsqlparser.expression.operators.relational.ParenthesedExpressionList;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.schema.Column;
import net.sf.jsqlparser.schema.Table;
import net.sf.jsqlparser.statement.select.ParenthesedSelect;
import net.sf.jsqlparser.statement.select.Select;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 表达式编译器
 * 1. 用 JSqlParser 解析片段（禁止部分解析，尾随文本即为语法错误）。
 * 2. 校验位置：聚合位置须为标量，过滤位置须为布尔。
 * 3. 校验列名在表范围内可见，禁止聚合函数、窗口函数、子查询、绑定参数。
 * 4. 表已校验时，片段本身是单个列的，按列类型校验位置与聚合方式。
 * 纯函数，不访问后端。
 */
@ApplicationScoped
public class ExpressionCompiler {

    private static final Logger log = LoggerFactory.getLogger(ExpressionCompiler.class);

    // 聚合由指标的 aggregation 决定，片段内不允许再出现
    private static final Set<String> AGGREGATE_FUNCTIONS = Set.of(
            "SUM", "AVG", "COUNT", "MIN", "MAX", "MEDIAN", "MODE",
            "STDDEV", "STDDEV_POP", "STDDEV_SAMP", "VARIANCE", "VAR_POP", "VAR_SAMP",
            "ANY_VALUE", "ARRAY_AGG", "STRING_AGG", "GROUP_CONCAT", "LIST",
            "FIRST", "LAST", "QUANTILE", "PERCENTILE_CONT", "PERCENTILE_DISC",
            "APPROX_COUNT_DISTINCT", "COUNT_IF", "BOOL_AND", "BOOL_OR", "BIT_AND", "BIT_OR");

    private static final Set<String> BOOLEAN_LITERALS = Set.of("true", "false");

    public CompiledExpression compileScalar(String fragment, String owner, TableHandle scope) {
        return compile(fragment, owner, ExpressionPosition.SCALAR, scope);
    }

    public CompiledExpression compilePredicate(String fragment, String owner, TableHandle scope) {
        return compile(fragment, owner, ExpressionPosition.PREDICATE, scope);
    }

    /**
     * 编译聚合参数；除 COUNT 外，单列参数须为数值列（SUM/RATIO 也接受布尔列）
     */
    public CompiledExpression compileMeasure(String fragment, String owner, AggregationKind kind, TableHandle scope) {
        CompiledExpression compiled = compileScalar(fragment, owner, scope);
        if (kind == AggregationKind.COUNT) {
            return compiled;
        }
        ColumnType type = bareColumnType(compiled.ast(), scope);
        boolean summable = kind == AggregationKind.SUM || kind == AggregationKind.RATIO;
        if (type == ColumnType.TEXT || type == ColumnType.TEMPORAL
                || (type == ColumnType.BOOLEAN && !summable)) {
            throw new CompilationException(fragment, owner, String.format(
                    "cannot apply %s to column of type %s", kind, type));
        }
        return compiled;
    }

    public CompiledExpression compile(String fragment, String owner, ExpressionPosition position, TableHandle scope) {
        if (fragment == null || fragment.isBlank()) {
            throw new CompilationException(String.valueOf(fragment), owner, "expression is empty");
        }

        Expression ast = parse(fragment, owner, position);
        checkPosition(ast, fragment, owner, position);
        if (position == ExpressionPosition.PREDICATE) {
            checkConditionColumn(ast, fragment, owner, scope);
        }

        ScopeChecker checker = new ScopeChecker(scope);
        ast.accept(checker);
        if (!checker.problems.isEmpty()) {
            throw new CompilationException(fragment, owner, checker.problems.get(0));
        }
        if (!checker.unresolved.isEmpty()) {
            throw new CompilationException(fragment, owner, String.format(
                    "unknown column(s) %s in table '%s'", checker.unresolved, scope.tableName()));
        }

        CompiledExpression compiled = new CompiledExpression(fragment, owner, position, scope, ast);
        log.debug("Compiled {} against {} (verified={}): {}", owner, scope.tableName(), scope.verified(), compiled);
        return compiled;
    }

    private Expression parse(String fragment, String owner, ExpressionPosition position) {
        try {
            return CCJSqlParserUtil.parseExpression(fragment, false);
        } catch (JSQLParserException e) {
            if (position == ExpressionPosition.PREDICATE) {
                try {
                    return CCJSqlParserUtil.parseCondExpression(fragment, false);
                } catch (JSQLParserException condError) {
                    // 以第一次解析的错误为准
                    e.addSuppressed(condError);
                }
            }
            throw new CompilationException(fragment, owner, "syntax error: " + firstLine(e), e);
        }
    }

    private void checkPosition(Expression ast, String fragment, String owner, ExpressionPosition position) {
        Expression root = unwrap(ast);
        if (position == ExpressionPosition.SCALAR && isBooleanRooted(root)) {
            throw new CompilationException(fragment, owner, "expected a scalar expression but found a condition");
        }
        if (position == ExpressionPosition.PREDICATE && isScalarRooted(root)) {
            throw new CompilationException(fragment, owner, "expected a condition but found a scalar expression");
        }
    }

    // SQLite 没有布尔类型，数值列可直接作条件
    private void checkConditionColumn(Expression ast, String fragment, String owner, TableHandle scope) {
        ColumnType type = bareColumnType(ast, scope);
        boolean numericFlag = type == ColumnType.NUMERIC && "sqlite".equals(scope.backendType());
        if (type == ColumnType.TEXT || type == ColumnType.TEMPORAL
                || (type == ColumnType.NUMERIC && !numericFlag)) {
            throw new CompilationException(fragment, owner, String.format(
                    "expected a condition but column is of type %s", type));
        }
    }

    /**
     * 片段为单个已知列时返回其类型，否则 UNKNOWN
     */
    private static ColumnType bareColumnType(Expression ast, TableHandle scope) {
        if (!scope.verified() || !(unwrap(ast) instanceof Column column)) {
            return ColumnType.UNKNOWN;
        }
        String name = unquote(column.getColumnName());
        if (BOOLEAN_LITERALS.contains(name.toLowerCase(Locale.ROOT))) {
            return ColumnType.UNKNOWN;
        }
        return scope.columnType(name);
    }

    private static Expression unwrap(Expression expression) {
        Expression current = expression;
        while (current instanceof ParenthesedExpressionList<?> list && list.size() == 1) {
            current = list.get(0);
        }
        return current;
    }

    private static boolean isBooleanRooted(Expression e) {
        return e instanceof AndExpression || e instanceof OrExpression || e instanceof XorExpression
                || e instanceof NotExpression || e instanceof ComparisonOperator
                || e instanceof InExpression || e instanceof Between || e instanceof IsNullExpression
                || e instanceof LikeExpression || e instanceof ExistsExpression
                || e instanceof IsBooleanExpression;
    }

    private static boolean isScalarRooted(Expression e) {
        return e instanceof Addition || e instanceof Subtraction || e instanceof Multiplication
                || e instanceof Division || e instanceof Modulo || e instanceof Concat
                || e instanceof LongValue || e instanceof DoubleValue || e instanceof StringValue
                || e instanceof NullValue;
    }

    private static String firstLine(Exception e) {
        String message = e.getCause() != null && e.getCause().getMessage() != null
                ? e.getCause().getMessage() : String.valueOf(e.getMessage());
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    private static String unquote(String identifier) {
        if (identifier.length() >= 2) {
            char first = identifier.charAt(0);
            char last = identifier.charAt(identifier.length() - 1);
            if ((first == '"' && last == '"') || (first == '`' && last == '`')
                    || (first == '[' && last == ']')) {
                return identifier.substring(1, identifier.length() - 1);
            }
        }
        return identifier;
    }

    /**
     * 遍历语法树，收集未解析的列与不允许的结构
     */
    private static final class ScopeChecker extends ExpressionVisitorAdapter<Void> {

        private final TableHandle scope;
        private final Set<String> unresolved = new LinkedHashSet<>();
        private final List<String> problems = new ArrayList<>();

        private ScopeChecker(TableHandle scope) {
            this.scope = scope;
        }

        @Override
        public <S> Void visit(Column column, S context) {
            String name = unquote(column.getColumnName());
            Table qualifier = column.getTable();
            if (qualifier == null || qualifier.getName() == null) {
                if (BOOLEAN_LITERALS.contains(name.toLowerCase(Locale.ROOT))) {
                    return null;
                }
            } else if (!unquote(qualifier.getName()).equalsIgnoreCase(scope.simpleName())) {
                problems.add(String.format("column '%s' is qualified with '%s', expected '%s'",
                        column.getFullyQualifiedName(), qualifier.getName(), scope.simpleName()));
                return null;
            }
            if (scope.verified() && !scope.hasColumn(name)) {
                unresolved.add(name);
            }
            return null;
        }

        @Override
        public <S> Void visit(Function function, S context) {
            String name = function.getName();
            if (name != null && AGGREGATE_FUNCTIONS.contains(name.toUpperCase(Locale.ROOT))) {
                problems.add("aggregate function " + name + " is not allowed; the metric aggregation is applied automatically");
                return null;
            }
            return super.visit(function, context);
        }

        @Override
        public <S> Void visit(AnalyticExpression expression, S context) {
            problems.add("window function " + expression.getName() + " is not allowed");
            return null;
        }

        @Override
        public <S> Void visit(ParenthesedSelect select, S context) {
            problems.add("subqueries are not allowed");
            return null;
        }

        @Override
        public <S> Void visit(Select select, S context) {
            problems.add("subqueries are not allowed");
            return null;
        }

        @Override
        public <S> Void visit(JdbcParameter parameter, S context) {
            problems.add("bind parameters are not allowed");
            return null;
        }

        @Override
        public <S> Void visit(JdbcNamedParameter parameter, S context) {
            problems.add("bind parameters are not allowed");
            return null;
        }
    }
}
