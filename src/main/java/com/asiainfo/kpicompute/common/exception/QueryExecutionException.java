package com.asiainfo.kpicompute.common.exception;

public class QueryExecutionException extends ConnectorException {

    public QueryExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
