package com.asiainfo.kpicompute.core.model;

import java.util.Locale;

/**
 * 指标聚合方式
 */
public enum AggregationKind {
    SUM("SUM"),
    AVG("AVG"),
    COUNT("COUNT"),
    MIN("MIN"),
    MAX("MAX"),
    /** 分子、分母各自求和后相除 */
    RATIO("SUM");

    private final String sqlFunction;

    AggregationKind(String sqlFunction) {
        this.sqlFunction = sqlFunction;
    }

    public String sqlFunction() {
        return sqlFunction;
    }

    public boolean requiresDenominator() {
        return this == RATIO;
    }

    public static AggregationKind fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Aggregation kind must not be blank");
        }
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "sum" -> SUM;
            case "avg", "average", "mean" -> AVG;
            case "count" -> COUNT;
            case "min" -> MIN;
            case "max" -> MAX;
            case "ratio" -> RATIO;
            default -> throw new IllegalArgumentException("Unknown aggregation kind: " + name);
        };
    }
}
