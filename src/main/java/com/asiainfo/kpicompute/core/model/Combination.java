package com.asiainfo.kpicompute.core.model;

import com.asiainfo.kpicompute.core.MetricsConstants;

import java.util.List;

/**
 * 切片组合（由 SlicePlanner 派生）
 * sliceType / sliceValue 为各维度名称、取值名称按声明顺序以 | 拼接；
 * 过滤条件为各成员条件的逻辑与
 */
public record Combination(String sliceType, String sliceValue, List<Member> members) {

    /** 未传切片时的唯一组合，无过滤条件 */
    public static final Combination NONE =
            new Combination(MetricsConstants.NO_SLICE_TYPE, MetricsConstants.NO_SLICE_VALUE, List.of());

    public Combination {
        members = List.copyOf(members);
    }

    public boolean isSentinel() {
        return members.isEmpty();
    }

    /**
     * 组合中的单个切片取值
     */
    public record Member(String sliceName, String valueName, String where) {

        public String owner() {
            return String.format("slice '%s' value '%s'", sliceName, valueName);
        }
    }
}
