package com.asiainfo.kpicompute.core.model;

import com.asiainfo.kpicompute.core.MetricsConstants;

import java.time.LocalDate;

/**
 * 时间窗口，起止日期均包含
 */
public record TimeWindow(String periodType, LocalDate start, LocalDate end) {

    public TimeWindow {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time window boundaries must not be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time window end " + end + " is before start " + start);
        }
        if (periodType == null || periodType.isBlank()) {
            periodType = MetricsConstants.PERIOD_CUSTOM;
        }
    }

    public static TimeWindow of(LocalDate start, LocalDate end) {
        return new TimeWindow(MetricsConstants.PERIOD_CUSTOM, start, end);
    }

    /**
     * 右开区间的上界，使 end 当天的时间戳也能命中
     */
    public LocalDate exclusiveEnd() {
        return end.plusDays(1);
    }
}
