package com.asiainfo.kpicompute.common.exception;

public class InvalidSourceUriException extends KpiComputeException {

    public InvalidSourceUriException(String message) {
        super(message);
    }
}
