package com.hartwig.hpcwe.submission;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.hpcwe.model.JobscriptDependency;
import com.hartwig.hpcwe.model.JobscriptDescriptor;
import com.hartwig.hpcwe.model.Resources;
import com.hartwig.hpcwe.model.TaskAction;

import org.junit.jupiter.api.Test;

class JobscriptMergerTest {
    private static final Resources SMALL = Resources.builder().numCores(1).build();
    private static final Resources LARGE = Resources.builder().numCores(16).build();
    private static final JobscriptDependency ONE_TO_ONE =
            JobscriptDependency.builder().elementMapping(Map.of(0, List.of(0), 1, List.of(1))).isArray(true).build();
    private static final JobscriptDependency ALL_TO_ALL =
            JobscriptDependency.builder().elementMapping(Map.of(0, List.of(0, 1), 1, List.of(0, 1))).isArray(false).build();

    private static JobscriptDescriptor jobscript(int index, int taskInsertId, Resources resources, List<Integer> runIds,
            Map<Integer, JobscriptDependency> dependencies) {
        return JobscriptDescriptor.builder()
                .index(index)
                .resources(resources)
                .addTaskInsertIds(taskInsertId)
                .addTaskLoopIndex(Map.of())
                .addTaskActions(TaskAction.of(taskInsertId, 0, 0))
                .putTaskElements(0, List.of(0))
                .putTaskElements(1, List.of(1))
                .addRunIds(runIds)
                .dependencies(dependencies)
                .build();
    }

    @Test
    void arrayDependencyWithEqualResourcesIsMergedIntoItsDependency() {
        var jobscripts = new LinkedHashMap<Integer, JobscriptDescriptor>();
        jobscripts.put(0, jobscript(0, 0, SMALL, List.of(10, 11), Map.of()));
        jobscripts.put(1, jobscript(1, 1, SMALL, List.of(20, 21), Map.of(0, ONE_TO_ONE)));
        jobscripts.put(2, jobscript(2, 2, LARGE, List.of(30, 31), Map.of(1, ONE_TO_ONE)));

        var merged = JobscriptMerger.mergeAcrossTasks(jobscripts);

        assertThat(merged).containsOnlyKeys(0, 2);
        var target = merged.get(0);
        assertThat(target.taskInsertIds()).containsExactly(0, 1);
        assertThat(target.taskLoopIndex()).hasSize(2);
        assertThat(target.taskActions()).containsExactly(TaskAction.of(0, 0, 0), TaskAction.of(1, 0, 1));
        assertThat(target.taskElements()).isEqualTo(Map.of(0, List.of(0, 0), 1, List.of(1, 1)));
        assertThat(target.runIds()).containsExactly(List.of(10, 11), List.of(20, 21));
        assertThat(merged.get(2).dependencies()).containsOnlyKeys(0);
    }

    @Test
    void chainsWithEqualResourcesCollapseIntoOneJobscript() {
        var jobscripts = new LinkedHashMap<Integer, JobscriptDescriptor>();
        jobscripts.put(0, jobscript(0, 0, SMALL, List.of(10, 11), Map.of()));
        jobscripts.put(1, jobscript(1, 1, SMALL, List.of(20, 21), Map.of(0, ONE_TO_ONE)));
        jobscripts.put(2, jobscript(2, 2, SMALL, List.of(30, 31), Map.of(1, ONE_TO_ONE)));

        var merged = JobscriptMerger.mergeAcrossTasks(jobscripts);

        assertThat(merged).containsOnlyKeys(0);
        assertThat(merged.get(0).taskInsertIds()).containsExactly(0, 1, 2);
        assertThat(merged.get(0).taskActions()).extracting(TaskAction::loopIndexPosition).containsExactly(0, 1, 2);
    }

    @Test
    void nonArrayOrMultipleDependenciesAreNotMerged() {
        var jobscripts = new LinkedHashMap<Integer, JobscriptDescriptor>();
        jobscripts.put(0, jobscript(0, 0, SMALL, List.of(10, 11), Map.of()));
        jobscripts.put(1, jobscript(1, 1, SMALL, List.of(20, 21), Map.of(0, ALL_TO_ALL)));
        jobscripts.put(2, jobscript(2, 2, SMALL, List.of(30, 31), Map.of(0, ONE_TO_ONE, 1, ONE_TO_ONE)));

        assertThat(JobscriptMerger.mergeAcrossTasks(jobscripts)).isEqualTo(jobscripts);
    }

    @Test
    void toListNumbersConsecutivelyAndRewritesDependencies() {
        var jobscripts = new LinkedHashMap<Integer, JobscriptDescriptor>();
        jobscripts.put(0, jobscript(0, 0, SMALL, List.of(10, 11), Map.of()));
        jobscripts.put(3, jobscript(3, 1, LARGE, List.of(20, 21), Map.of(0, ONE_TO_ONE)));
        jobscripts.put(5, jobscript(5, 2, SMALL, List.of(30, 31), Map.of(3, ALL_TO_ALL)));

        var list = JobscriptMerger.toList(jobscripts);

        assertThat(list).extracting(JobscriptDescriptor::index).containsExactly(0, 1, 2);
        assertThat(list.get(1).dependencies()).containsOnlyKeys(0);
        assertThat(list.get(2).dependencies()).isEqualTo(Map.of(1, ALL_TO_ALL));
    }
}
