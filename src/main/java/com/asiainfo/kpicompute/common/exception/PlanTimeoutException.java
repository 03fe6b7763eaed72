package com.asiainfo.kpicompute.common.exception;

/**
 * 计划在截止时间内未完成，已被放弃
 */
public class PlanTimeoutException extends KpiComputeException {

    public PlanTimeoutException(String message) {
        super(message);
    }
}
