package com.asiainfo.kpicompute.core.model;

import java.util.Arrays;
import java.util.List;

/**
 * 切片维度定义
 * 取值按声明顺序保存，不要求互斥，也不要求覆盖全集
 */
public record SliceSpec(String name, List<SliceValue> values) {

    public SliceSpec {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static SliceSpec of(String name, SliceValue... values) {
        return new SliceSpec(name, Arrays.asList(values));
    }
}
