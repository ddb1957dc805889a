package com.hartwig.hpcwe.submission;

import java.util.List;

public final class JobscriptAllocation {
    private final List<JobscriptGroup> groups;
    private final int[][] jobscriptMap;

    JobscriptAllocation(final List<JobscriptGroup> groups, final int[][] jobscriptMap) {
        this.groups = List.copyOf(groups);
        this.jobscriptMap = jobscriptMap;
    }

    public List<JobscriptGroup> groups() {
        return groups;
    }

    /**
     * Same shape as the resource map; the index of the group covering each cell, or -1.
     */
    public int[][] jobscriptMap() {
        return jobscriptMap;
    }
}
