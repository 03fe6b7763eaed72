package com.asiainfo.kpicompute.infra.connector;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.TreeMap;

/**
 * 根据配置创建连接器注册表，应用关闭时释放连接
 * 配置值中的 ${ENV} 占位符由 MicroProfile Config 展开
 */
@ApplicationScoped
public class ConnectorRegistryProducer {

    private static final Logger log = LoggerFactory.getLogger(ConnectorRegistryProducer.class);

    @Produces
    @Singleton
    ConnectorRegistry connectorRegistry() {
        Config config = ConfigProvider.getConfig();
        Map<String, String> properties = new TreeMap<>();
        for (String name : config.getPropertyNames()) {
            if (name.startsWith(ConnectorRegistry.PROPERTY_PREFIX)) {
                config.getOptionalValue(name, String.class).ifPresent(value -> properties.put(name, value));
            }
        }
        ConnectorRegistry registry = ConnectorRegistry.fromProperties(properties);
        log.info("Connector registry initialized: {}", registry.backends());
        return registry;
    }

    void close(@Disposes ConnectorRegistry registry) {
        log.info("Closing connector registry {}", registry.backends());
        registry.close();
    }
}
