package com.asiainfo.kpicompute.core.planner;

import com.asiainfo.kpicompute.common.exception.PlanningException;
import com.asiainfo.kpicompute.core.MetricsConstants;
import com.asiainfo.kpicompute.core.model.Combination;
import com.asiainfo.kpicompute.core.model.SliceSpec;
import com.asiainfo.kpicompute.core.model.SliceValue;
import jakarta.enterprise.context.ApplicationScoped;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 切片展开
 * N 个切片、各自 c1..cN 个取值，展开为 Π(ci) 个组合；
 * 顺序按切片声明顺序、再按取值声明顺序，第一个切片变化最慢。不做任何重排序。
 */
@ApplicationScoped
public class SlicePlanner {

    public List<Combination> expand(List<SliceSpec> slices) {
        if (slices == null || slices.isEmpty()) {
            return List.of(Combination.NONE);
        }

        List<List<Combination.Member>> prefixes = new ArrayList<>();
        prefixes.add(List.of());

        for (SliceSpec slice : slices) {
            validate(slice);
            List<List<Combination.Member>> next = new ArrayList<>(prefixes.size() * slice.values().size());
            for (List<Combination.Member> prefix : prefixes) {
                for (SliceValue value : slice.values()) {
                    List<Combination.Member> extended = new ArrayList<>(prefix.size() + 1);
                    extended.addAll(prefix);
                    extended.add(new Combination.Member(slice.name(), value.name(), value.where()));
                    next.add(extended);
                }
            }
            prefixes = next;
        }

        String sliceType = slices.stream()
                .map(SliceSpec::name)
                .collect(Collectors.joining(MetricsConstants.SLICE_DELIMITER));

        List<Combination> combinations = new ArrayList<>(prefixes.size());
        for (List<Combination.Member> members : prefixes) {
            String sliceValue = members.stream()
                    .map(Combination.Member::valueName)
                    .collect(Collectors.joining(MetricsConstants.SLICE_DELIMITER));
            combinations.add(new Combination(sliceType, sliceValue, members));
        }
        return combinations;
    }

    private void validate(SliceSpec slice) {
        if (slice.name() == null || slice.name().isBlank()) {
            throw new PlanningException("Slice name must not be blank");
        }
        if (slice.values().isEmpty()) {
            throw new PlanningException("Slice '" + slice.name() + "' declares no values");
        }
        for (SliceValue value : slice.values()) {
            if (value.name() == null || value.name().isBlank()) {
                throw new PlanningException("Slice '" + slice.name() + "' has a value without a name");
            }
        }
    }
}
