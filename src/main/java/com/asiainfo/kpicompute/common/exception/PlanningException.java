package com.asiainfo.kpicompute.common.exception;

/**
 * 结构性定义错误（如 ratio 指标缺少分母），致命
 */
public class PlanningException extends KpiComputeException {

    public PlanningException(String message) {
        super(message);
    }

    public PlanningException(String message, Throwable cause) {
        super(message, cause);
    }
}
