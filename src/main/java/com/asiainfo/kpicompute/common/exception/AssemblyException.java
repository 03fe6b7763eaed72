package com.asiainfo.kpicompute.common.exception;

/**
 * 合并结果时单个计划的结果结构与计划不一致，致命
 */
public class AssemblyException extends KpiComputeException {

    public AssemblyException(String message) {
        super(message);
    }
}
