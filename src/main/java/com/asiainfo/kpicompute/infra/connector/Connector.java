package com.asiainfo.kpicompute.infra.connector;

import com.asiainfo.kpicompute.core.model.CompiledQuery;
import com.asiainfo.kpicompute.core.model.TableHandle;

import java.util.List;
import java.util.Map;

/**
 * 后端连接器
 * 所有方法的失败均以 {@link com.asiainfo.kpicompute.common.exception.ConnectorException} 抛出
 */
public interface Connector extends AutoCloseable {

    String backendType();

    /**
     * 解析表并读取列名
     */
    TableHandle resolveTable(SourceUri source);

    /**
     * 执行一次查询，结果每行一个 Map（列标签 -> 值）
     */
    List<Map<String, Object>> runQuery(CompiledQuery query);

    /**
     * 分发前的健康检查
     */
    boolean isAvailable();

    /**
     * 放弃一条仍在执行的查询，释放其占用的线程；查询未在执行时忽略
     */
    default void cancel(CompiledQuery query) {
    }

    @Override
    void close();
}
