package com.asiainfo.kpicompute.common.exception;

public class ConfigurationException extends KpiComputeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
