package com.asiainfo.kpicompute.common.exception;

/**
 * 指标计算异常基类
 */
public class KpiComputeException extends RuntimeException {

    public KpiComputeException(String message) {
        super(message);
    }

    public KpiComputeException(String message, Throwable cause) {
        super(message, cause);
    }
}
