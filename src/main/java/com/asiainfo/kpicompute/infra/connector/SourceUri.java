package com.asiainfo.kpicompute.infra.connector;

import com.asiainfo.kpicompute.common.exception.InvalidSourceUriException;

import java.util.Arrays;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 数据源 URI：backend://database/table
 * <ul>
 *   <li>duckdb://analytics.db/events → (duckdb, analytics.db, events)</li>
 *   <li>duckdb://:memory:/events → (duckdb, :memory:, events)</li>
 *   <li>duckdb:///abs/path/db/events → (duckdb, /abs/path/db, events)</li>
 *   <li>bigquery://project.dataset.table → (bigquery, project, dataset.table)</li>
 *   <li>bigquery://project/dataset.table → (bigquery, project, dataset.table)</li>
 * </ul>
 */
public record SourceUri(String uri, String backendType, String database, String table) {

    private static final String SCHEME_SEPARATOR = "://";
    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_$]*(\\.[A-Za-z_][A-Za-z0-9_$]*)*");

    public static SourceUri parse(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new InvalidSourceUriException("Source URI must not be blank");
        }
        int schemeEnd = uri.indexOf(SCHEME_SEPARATOR);
        if (schemeEnd <= 0) {
            throw new InvalidSourceUriException("Missing backend type in URI: '" + uri
                    + "'. URI must start with backend type, e.g. duckdb://analytics.db/events");
        }
        String backendType = uri.substring(0, schemeEnd).toLowerCase(Locale.ROOT);
        String fullPath = uri.substring(schemeEnd + SCHEME_SEPARATOR.length());
        if (fullPath.isEmpty()) {
            throw new InvalidSourceUriException("Empty path in URI: '" + uri + "'. URI must include database and table");
        }

        SourceUri parsed = "bigquery".equals(backendType)
                ? parseBigQuery(uri, fullPath)
                : parseLastSlash(uri, backendType, fullPath);

        if (!TABLE_NAME.matcher(parsed.table()).matches()) {
            throw new InvalidSourceUriException("Invalid table name '" + parsed.table() + "' in URI: '" + uri + "'");
        }
        return parsed;
    }

    // 以最后一个 / 分隔库与表
    private static SourceUri parseLastSlash(String uri, String backendType, String fullPath) {
        int lastSlash = fullPath.lastIndexOf('/');
        if (lastSlash < 0) {
            throw new InvalidSourceUriException("Missing table separator '/' in URI: '" + uri
                    + "'. Expected " + backendType + "://database/table_name");
        }
        String table = fullPath.substring(lastSlash + 1);
        if (table.isEmpty()) {
            throw new InvalidSourceUriException("Empty table name in URI: '" + uri + "'");
        }
        return new SourceUri(uri, backendType, fullPath.substring(0, lastSlash), table);
    }

    private static SourceUri parseBigQuery(String uri, String fullPath) {
        String[] parts = fullPath.replace('/', '.').split("\\.");
        if (parts.length < 3) {
            throw new InvalidSourceUriException("BigQuery URI must have at least 3 parts (project.dataset.table): '"
                    + uri + "'");
        }
        String table = String.join(".", Arrays.copyOfRange(parts, 1, parts.length));
        return new SourceUri(uri, "bigquery", parts[0], table);
    }
}
