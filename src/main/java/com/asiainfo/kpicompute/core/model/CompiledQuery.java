package com.asiainfo.kpicompute.core.model;

import java.util.Collections;
import java.util.List;

/**
 * 可直接提交给后端的查询：SQL 文本 + 按位置绑定的参数
 */
public record CompiledQuery(String sql, List<Object> params) {

    public CompiledQuery {
        params = params == null ? Collections.emptyList() : List.copyOf(params);
    }

    public CompiledQuery(String sql) {
        this(sql, Collections.emptyList());
    }
}
