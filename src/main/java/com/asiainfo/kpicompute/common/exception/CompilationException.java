package com.asiainfo.kpicompute.common.exception;

/**
 * 表达式编译失败：语法错误、列不存在、位置类型不符
 * 致命错误，在任何查询执行前中止整个计算
 */
public class CompilationException extends KpiComputeException {

    private final String fragment;
    private final String owner;

    public CompilationException(String fragment, String owner, String reason) {
        super(String.format("Cannot compile %s expression '%s': %s", owner, fragment, reason));
        this.fragment = fragment;
        this.owner = owner;
    }

    public CompilationException(String fragment, String owner, String reason, Throwable cause) {
        super(String.format("Cannot compile %s expression '%s': %s", owner, fragment, reason), cause);
        this.fragment = fragment;
        this.owner = owner;
    }

    public String getFragment() {
        return fragment;
    }

    /**
     * 表达式所属的定义，如 "metric 'ctr' numerator"
     */
    public String getOwner() {
        return owner;
    }
}
