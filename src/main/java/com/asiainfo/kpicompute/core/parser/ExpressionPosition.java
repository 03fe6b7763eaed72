package com.asiainfo.kpicompute.core.parser;

/**
 * 表达式在查询中的位置
 */
public enum ExpressionPosition {
    /** 聚合函数的参数，须为标量 */
    SCALAR,
    /** 过滤条件，须为布尔 */
    PREDICATE
}
