package com.asiainfo.kpicompute.common.exception;

public class UnsupportedBackendException extends KpiComputeException {

    public UnsupportedBackendException(String message) {
        super(message);
    }
}
