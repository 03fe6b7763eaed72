package com.asiainfo.kpicompute.common.exception;

public class TableNotFoundException extends ConnectorException {

    public TableNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
