package com.hartwig.hpcwe.submission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class JobscriptGrouperTest {

    private static JobscriptGroup group(int resourceIndex, Map<Integer, List<Integer>> elements) {
        return JobscriptGroup.builder().resourceIndex(resourceIndex).elements(elements).build();
    }

    @Test
    void mixedResourcesWithGaps() {
        int[][] resourceMap = {
                { 1, 1, 1, 2, -1, 2, 4, -1, 1 },
                { 1, 3, 1, 2, 2, 2, 4, 4, 1 },
                { 1, 1, 3, 2, 2, 2, 4, -1, 1 } };

        var allocation = JobscriptGrouper.group(resourceMap);

        assertThat(allocation.groups()).containsExactly(group(1, Map.of(0, List.of(0, 1, 2), 1, List.of(0), 2, List.of(0, 1), 8, List.of(0, 1, 2))),
                group(2, Map.of(3, List.of(0, 1, 2), 4, List.of(1, 2), 5, List.of(0, 1, 2))),
                group(4, Map.of(6, List.of(0, 1, 2), 7, List.of(1))),
                group(3, Map.of(1, List.of(1))),
                group(1, Map.of(1, List.of(2))),
                group(3, Map.of(2, List.of(2))));
        assertThat(allocation.jobscriptMap()).isDeepEqualTo(new int[][] {
                { 0, 0, 0, 1, -1, 1, 2, -1, 0 },
                { 0, 3, 0, 1, 1, 1, 2, 2, 0 },
                { 0, 4, 5, 1, 1, 1, 2, -1, 0 } });
    }

    @Test
    void sentinelCellsExtendColumnsWithoutBeingClaimed() {
        int[][] resourceMap = {
                { 2, 2, -1 },
                { 4, 4, 1 },
                { 4, 4, -1 },
                { 1, 1, 1 } };

        var allocation = JobscriptGrouper.group(resourceMap);

        assertThat(allocation.groups()).containsExactly(group(2, Map.of(0, List.of(0), 1, List.of(0))),
                group(1, Map.of(2, List.of(1, 3))),
                group(4, Map.of(0, List.of(1, 2), 1, List.of(1, 2))),
                group(1, Map.of(0, List.of(3), 1, List.of(3))));
        assertThat(allocation.jobscriptMap()).isDeepEqualTo(new int[][] {
                { 0, 0, -1 },
                { 2, 2, 1 },
                { 2, 2, -1 },
                { 3, 3, 1 } });
    }

    @Test
    void emptyAndAllSentinelMapsHaveNoJobscripts() {
        assertThat(JobscriptGrouper.group(new int[0][0]).groups()).isEmpty();
        assertThat(JobscriptGrouper.group(new int[][] { { -1, -1 }, { -1, -1 } }).groups()).isEmpty();
    }

    @Test
    void raggedOrInvalidMapsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> JobscriptGrouper.group(new int[][] { { 0, 0 }, { 0 } }));
        assertThrows(IllegalArgumentException.class, () -> JobscriptGrouper.group(new int[][] { { 0, -2 } }));
    }
}
