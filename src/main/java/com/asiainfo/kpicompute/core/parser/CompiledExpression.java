package com.asiainfo.kpicompute.core.parser;

import com.asiainfo.kpicompute.core.model.TableHandle;
import net.sf.jsqlparser.expression.Expression;

/**
 * 绑定到某张表的已编译表达式
 * 只能由 {@link ExpressionCompiler} 创建；拼入查询的是语法树反解析出的 SQL，不是原始文本
 */
public final class CompiledExpression {

    private final String fragment;
    private final String owner;
    private final ExpressionPosition position;
    private final TableHandle scope;
    private final Expression ast;
    private final String sql;

    CompiledExpression(String fragment, String owner, ExpressionPosition position, TableHandle scope, Expression ast) {
        this.fragment = fragment;
        this.owner = owner;
        this.position = position;
        this.scope = scope;
        this.ast = ast;
        this.sql = ast.toString();
    }

    Expression ast() {
        return ast;
    }

    public String fragment() {
        return fragment;
    }

    public String owner() {
        return owner;
    }

    public ExpressionPosition position() {
        return position;
    }

    public TableHandle scope() {
        return scope;
    }

    /**
     * 带括号的 SQL，可直接嵌入更大的表达式
     */
    public String toSql() {
        return "(" + sql + ")";
    }

    @Override
    public String toString() {
        return owner + ": " + sql;
    }
}
