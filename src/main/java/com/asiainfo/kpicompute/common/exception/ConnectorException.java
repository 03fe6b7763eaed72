package com.asiainfo.kpicompute.common.exception;

/**
 * 后端访问失败。只影响所属计划，由执行器降级为 PlanFailure
 */
public class ConnectorException extends KpiComputeException {

    public ConnectorException(String message) {
        super(message);
    }

    public ConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
