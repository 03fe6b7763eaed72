package com.asiainfo.kpicompute.config;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 计算线程池配置
 * 每个任务独占一个线程（按需创建、空闲回收），阻塞的后端查询不会挤占其他数据源的线程
 */
@ApplicationScoped
public class ComputeExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ComputeExecutorConfig.class);

    private ExecutorService computeExecutor;

    @PostConstruct
    void init() {
        this.computeExecutor = newComputeExecutor();
        log.info("计算线程池初始化完成, 按任务分配线程");
    }

    @PreDestroy
    void shutdown() {
        if (computeExecutor != null) {
            computeExecutor.shutdownNow();
            log.info("计算线程池已关闭");
        }
    }

    /**
     * 获取计算执行器
     * 用于后端查询：每个查询计划一个任务
     */
    public ExecutorService getComputeExecutor() {
        return computeExecutor;
    }

    public static ExecutorService newComputeExecutor() {
        return Executors.newCachedThreadPool(namedDaemonThreads("kpi-compute-"));
    }

    static ThreadFactory namedDaemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger(1);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
