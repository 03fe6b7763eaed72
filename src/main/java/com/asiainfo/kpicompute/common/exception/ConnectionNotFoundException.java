package com.asiainfo.kpicompute.common.exception;

public class ConnectionNotFoundException extends ConnectorException {

    private final String backendType;

    public ConnectionNotFoundException(String backendType) {
        super("No connection configured for backend '" + backendType + "'");
        this.backendType = backendType;
    }

    public String getBackendType() {
        return backendType;
    }
}
