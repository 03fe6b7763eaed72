package com.asiainfo.kpicompute.core.model;

/**
 * 切片取值：名称 + 过滤条件
 */
public record SliceValue(String name, String where) {
}
