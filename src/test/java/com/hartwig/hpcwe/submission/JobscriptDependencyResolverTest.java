package com.hartwig.hpcwe.submission;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.hartwig.hpcwe.model.JobscriptDependency;
import com.hartwig.hpcwe.model.JobscriptDescriptor;
import com.hartwig.hpcwe.model.Resources;
import com.hartwig.hpcwe.model.TaskAction;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JobscriptDependencyResolverTest {
    private final Map<Integer, JobscriptDescriptor> jobscripts = new LinkedHashMap<>();

    private static JobscriptDescriptor jobscript(int index, int taskInsertId, List<Integer> runIds) {
        var builder = JobscriptDescriptor.builder()
                .index(index)
                .resources(Resources.builder().build())
                .addTaskInsertIds(taskInsertId)
                .addTaskLoopIndex(Map.of())
                .addTaskActions(TaskAction.of(taskInsertId, 0, 0))
                .addRunIds(runIds);
        for (int i = 0; i < runIds.size(); i++) {
            builder.putTaskElements(i, List.of(i));
        }
        return builder.build();
    }

    @BeforeEach
    void setUp() {
        jobscripts.put(0, jobscript(0, 0, List.of(10, 11)));
        jobscripts.put(1, jobscript(1, 1, List.of(20, 21)));
        jobscripts.put(2, jobscript(2, 2, List.of(30)));
        jobscripts.put(3, jobscript(3, 3, List.of(40, 41)));
    }

    @Test
    void oneToOneDependencyIsAnArrayDependency() {
        var resolved = JobscriptDependencyResolver.resolve(jobscripts, Map.of(1, Map.of(0, List.of(10), 1, List.of(11))));

        assertThat(resolved).isEqualTo(Map.of(1,
                Map.of(0, JobscriptDependency.builder().elementMapping(Map.of(0, List.of(0), 1, List.of(1))).isArray(true).build())));
    }

    @Test
    void elementDependingOnSeveralElementsIsNotAnArrayDependency() {
        var resolved = JobscriptDependencyResolver.resolve(jobscripts, Map.of(2, Map.of(0, List.of(11, 10))));

        var dependency = resolved.get(2).get(0);
        assertThat(dependency.elementMapping()).isEqualTo(Map.of(0, List.of(1, 0)));
        assertThat(dependency.isArray()).isFalse();
    }

    @Test
    void partialCoverageIsNotAnArrayDependency() {
        var resolved = JobscriptDependencyResolver.resolve(jobscripts, Map.of(3, Map.of(0, List.of(20))));

        assertThat(resolved.get(3)).containsOnlyKeys(1);
        assertThat(resolved.get(3).get(1).isArray()).isFalse();
    }

    @Test
    void dependenciesOnTheSameOrLaterJobscriptsAreIgnored() {
        var resolved = JobscriptDependencyResolver.resolve(jobscripts, Map.of(1, Map.of(0, List.of(21, 30))));

        assertThat(resolved.get(1)).isEmpty();
    }

    @Test
    void elementsCanDependOnSeveralJobscripts() {
        var resolved = JobscriptDependencyResolver.resolve(jobscripts, Map.of(2, Map.of(0, List.of(20, 10))));

        assertThat(resolved.get(2)).containsOnlyKeys(0, 1);
        assertThat(resolved.get(2).get(0).elementMapping()).isEqualTo(Map.of(0, List.of(0)));
        assertThat(resolved.get(2).get(1).elementMapping()).isEqualTo(Map.of(0, List.of(0)));
    }
}
