package com.asiainfo.kpicompute.core.model;

import com.asiainfo.kpicompute.common.exception.KpiComputeException;

/**
 * 一个数据源的表解析结果，handle 与 failure 二选一
 */
public record TableResolution(String source, TableHandle handle, KpiComputeException failure) {

    public static TableResolution resolved(String source, TableHandle handle) {
        return new TableResolution(source, handle, null);
    }

    public static TableResolution failed(String source, KpiComputeException failure) {
        return new TableResolution(source, null, failure);
    }

    public boolean isResolved() {
        return failure == null;
    }

    /**
     * 解析成功返回表，否则抛出记录的失败
     */
    public TableHandle handleOrThrow() {
        if (failure != null) {
            throw failure;
        }
        return handle;
    }
}
