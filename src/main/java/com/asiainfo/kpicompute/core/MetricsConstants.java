package com.asiainfo.kpicompute.core;

import java.util.List;

public class MetricsConstants {

    // 未传切片/分群时的占位值
    public static final String NO_SLICE_TYPE = "none";
    public static final String NO_SLICE_VALUE = "all";
    public static final String NO_SEGMENT = "none";

    public static final String PERIOD_ALL_TIME = "all_time";
    public static final String PERIOD_CUSTOM = "custom";

    // 多个切片维度组合时的分隔符
    public static final String SLICE_DELIMITER = "|";

    public static final String COL_PERIOD_TYPE = "period_type";
    public static final String COL_PERIOD_START = "period_start_date";
    public static final String COL_PERIOD_END = "period_end_date";
    public static final String COL_METRIC_NAME = "metric_name";
    public static final String COL_SLICE_TYPE = "slice_type";
    public static final String COL_SLICE_VALUE = "slice_value";
    public static final String COL_SEGMENT_NAME = "segment_name";
    public static final String COL_METRIC_VALUE = "metric_value";

    public static final List<String> OUTPUT_COLUMNS = List.of(
            COL_PERIOD_TYPE, COL_PERIOD_START, COL_PERIOD_END, COL_METRIC_NAME,
            COL_SLICE_TYPE, COL_SLICE_VALUE, COL_SEGMENT_NAME, COL_METRIC_VALUE);

    // 批量 SQL 中每个单元格的列别名前缀，cell_0, cell_1 ...
    public static final String CELL_ALIAS_PREFIX = "cell_";

    private MetricsConstants() {}
}
