package com.asiainfo.kpicompute.core.model;

/**
 * 分群：作用于全部指标的人群过滤条件
 */
public record SegmentSpec(String name, String where) {
}
