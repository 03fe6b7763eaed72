package com.asiainfo.kpicompute.core.planner;

import com.asiainfo.kpicompute.core.model.TableHandle;

/**
 * 数据源到物理表的解析；失败时抛 KpiComputeException
 */
@FunctionalInterface
public interface TableResolver {

    TableHandle resolve(String source);
}
