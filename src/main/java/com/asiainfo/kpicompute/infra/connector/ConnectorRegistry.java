package com.asiainfo.kpicompute.infra.connector;

import com.asiainfo.kpicompute.common.exception.ConfigurationException;
import com.asiainfo.kpicompute.common.exception.ConnectionNotFoundException;
import com.asiainfo.kpicompute.common.exception.ConnectorException;
import com.asiainfo.kpicompute.common.exception.ConnectorUnavailableException;
import com.asiainfo.kpicompute.common.exception.UnsupportedBackendException;
import com.asiainfo.kpicompute.core.model.TableHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 连接器注册表，按后端类型路由数据源
 * 显式创建并传给执行器，不是全局单例
 */
public class ConnectorRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistry.class);

    public static final String PROPERTY_PREFIX = "kpi.connections.";

    private final Map<String, Connector> connectors = new ConcurrentHashMap<>();

    /**
     * 从 kpi.connections.&lt;backend&gt;.&lt;key&gt; 属性构建并连接
     * 任一后端失败时关闭已打开的连接
     */
    public static ConnectorRegistry fromProperties(Map<String, String> properties) {
        Map<String, Map<String, String>> byBackend = new TreeMap<>();
        for (Map.Entry<String, String> entry : properties.entrySet()) {
            String name = entry.getKey();
            if (!name.startsWith(PROPERTY_PREFIX)) {
                continue;
            }
            String rest = name.substring(PROPERTY_PREFIX.length());
            int dot = rest.indexOf('.');
            if (dot <= 0 || dot == rest.length() - 1) {
                throw new ConfigurationException("Invalid connection property '" + name
                        + "', expected " + PROPERTY_PREFIX + "<backend>.<key>");
            }
            byBackend.computeIfAbsent(rest.substring(0, dot), k -> new TreeMap<>())
                    .put(rest.substring(dot + 1), entry.getValue());
        }

        ConnectorRegistry registry = new ConnectorRegistry();
        try {
            byBackend.forEach((backend, settings) -> registry.register(createConnector(backend, settings)));
        } catch (RuntimeException e) {
            registry.close();
            throw e;
        }
        return registry;
    }

    private static JdbcConnector createConnector(String backend, Map<String, String> settings) {
        if (!JdbcConnector.SUPPORTED_BACKENDS.contains(backend)) {
            throw new UnsupportedBackendException(String.format("Backend type '%s' not supported. Supported backends: %s",
                    backend, String.join(", ", new TreeSet<>(JdbcConnector.SUPPORTED_BACKENDS))));
        }
        String path = settings.get("path");
        if (path == null || path.isBlank()) {
            throw new ConfigurationException(String.format(
                    "Missing required field 'path' in %s configuration (%s%s.path)", backend, PROPERTY_PREFIX, backend));
        }

        JdbcConnector connector = switch (backend) {
            case "duckdb" -> JdbcConnector.duckdb(path, Boolean.parseBoolean(settings.getOrDefault("read-only", "false")));
            case "sqlite" -> JdbcConnector.sqlite(path);
            default -> throw new UnsupportedBackendException("Backend type '" + backend + "' not supported");
        };
        try {
            connector.connect();
        } catch (ConnectorException e) {
            throw new ConfigurationException(
                    String.format("Failed to create connection for backend '%s': %s", backend, e.getMessage()), e);
        }
        return connector;
    }

    public ConnectorRegistry register(Connector connector) {
        Connector previous = connectors.put(connector.backendType(), connector);
        if (previous != null && previous != connector) {
            log.warn("Replacing connector for backend {}", connector.backendType());
            previous.close();
        }
        return this;
    }

    public Optional<Connector> find(String backendType) {
        return Optional.ofNullable(connectors.get(backendType));
    }

    public Connector connectorFor(String source) {
        String backend = SourceUri.parse(source).backendType();
        return find(backend).orElseThrow(() -> new ConnectionNotFoundException(backend));
    }

    /**
     * 解析数据源对应的表；后端未配置、不可用或表不存在时抛 ConnectorException
     */
    public TableHandle resolveTable(String source) {
        SourceUri uri = SourceUri.parse(source);
        Connector connector = find(uri.backendType())
                .orElseThrow(() -> new ConnectionNotFoundException(uri.backendType()));
        if (!connector.isAvailable()) {
            throw new ConnectorUnavailableException("Backend '" + uri.backendType() + "' is not available");
        }
        return connector.resolveTable(uri);
    }

    public Set<String> backends() {
        return Collections.unmodifiableSet(new TreeSet<>(connectors.keySet()));
    }

    @Override
    public void close() {
        List<Connector> all = new ArrayList<>(connectors.values());
        connectors.clear();
        for (Connector connector : all) {
            try {
                connector.close();
            } catch (RuntimeException e) {
                log.warn("Failed to close connector {}", connector.backendType(), e);
            }
        }
    }

    @Override
    public String toString() {
        return "ConnectorRegistry(backends=" + backends() + ")";
    }
}
