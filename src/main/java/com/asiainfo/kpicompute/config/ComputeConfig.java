package com.asiainfo.kpicompute.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * 计算配置
 * 超时为单次 compute 的整体期限（含表解析），超出后未完成的计划记为失败
 */
@ApplicationScoped
public class ComputeConfig {

    private static final Logger log = LoggerFactory.getLogger(ComputeConfig.class);

    @ConfigProperty(name = "kpi.compute.timeout-seconds", defaultValue = "300")
    long timeoutSeconds;

    @PostConstruct
    void init() {
        log.info("=== Compute Configuration ===");
        log.info("Timeout:         {}s", timeoutSeconds);
        log.info("=============================");
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }
}
