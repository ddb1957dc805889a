package com.hartwig.hpcwe.submission;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.hartwig.hpcwe.TestWorkflows;
import com.hartwig.hpcwe.ThreadUtil;
import com.hartwig.hpcwe.model.DataIndex;
import com.hartwig.hpcwe.model.JobscriptDependency;
import com.hartwig.hpcwe.model.JobscriptDescriptor;
import com.hartwig.hpcwe.model.Resources;
import com.hartwig.hpcwe.model.TaskAction;
import com.hartwig.hpcwe.store.PersistentStore;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

@Timeout(5)
class SubmissionDispatcherTest {
    @TempDir
    Path tempDir;

    private PersistentStore store;
    private ExecutorService executorService;
    private JobscriptScheduler scheduler;
    private final AtomicBoolean queueDown = new AtomicBoolean(false);
    private int submissionIndex;

    private static JobscriptDescriptor jobscript(int index, int runId, Map<Integer, JobscriptDependency> dependencies) {
        return JobscriptDescriptor.builder()
                .index(index)
                .resources(Resources.builder().build())
                .addTaskInsertIds(0)
                .addTaskLoopIndex(Map.of())
                .addTaskActions(TaskAction.of(0, 0, 0))
                .putTaskElements(0, List.of(runId))
                .addRunIds(List.of(runId))
                .dependencies(dependencies)
                .build();
    }

    @BeforeEach
    void setUp() throws IOException {
        store = TestWorkflows.create(tempDir);
        var task = store.addTask(0, TestWorkflows.taskTemplate("t0"));
        for (int i = 0; i < 3; i++) {
            var iteration = store.addElementIteration(store.addElement(task, 0, Map.of(), Map.of()), DataIndex.empty(), List.of(), Map.of());
            store.addRun(iteration, 0, List.of(), DataIndex.empty(), JsonNodeFactory.instance.objectNode());
        }
        var dependency = JobscriptDependency.builder().elementMapping(Map.of(0, List.of(0))).isArray(true).build();
        submissionIndex = store.addSubmission(List.of(jobscript(0, 0, Map.of()), jobscript(1, 1, Map.of(0, dependency)), jobscript(2, 2, Map.of())));
        store.save();

        executorService = ThreadUtil.createExecutorService(2, "dispatch-%d");
        scheduler = mock(JobscriptScheduler.class);
        when(scheduler.submit(anyInt(), any(), any())).thenAnswer(invocation -> {
            JobscriptDescriptor jobscript = invocation.getArgument(1);
            if (jobscript.index() == 0 && queueDown.get()) {
                return CompletableFuture.failedFuture(new IOException("queue unavailable"));
            }
            return CompletableFuture.completedFuture(SchedulerReference.of("job-" + jobscript.index()));
        });
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    private SubmissionDispatcher dispatcher() {
        return new SubmissionDispatcher(store, scheduler, executorService);
    }

    @Test
    void submitsAllJobscriptsAndRecordsThem() {
        var submitted = dispatcher().dispatch(submissionIndex);

        assertThat(submitted).containsExactly(0, 1, 2);
        verify(scheduler).submit(eq(submissionIndex), argThat(jobscript -> jobscript.index() == 1), eq(Map.of(0, SchedulerReference.of("job-0"))));

        var submission = store.getSubmission(submissionIndex);
        assertThat(new ArrayList<>(submission.submissionParts().values())).containsExactly(List.of(0, 1, 2));
        assertThat(submission.jobscripts().get(0).metadata().schedulerJobId()).contains("job-0");
        assertThat(submission.jobscripts().get(2).metadata().submitTime()).isPresent();
        assertThat(store.getRuns(List.of(0, 1, 2))).allSatisfy(run -> assertThat(run.submissionIndex()).isEqualTo(Optional.of(submissionIndex)));
    }

    @Test
    void dispatchesOnExecutorSizedByStoreConfig() {
        assertThat(new SubmissionDispatcher(store, scheduler).dispatch(submissionIndex)).containsExactly(0, 1, 2);
    }

    @Test
    void secondDispatchSubmitsNothing() {
        dispatcher().dispatch(submissionIndex);

        assertThat(dispatcher().dispatch(submissionIndex)).isEmpty();
        verify(scheduler, times(3)).submit(anyInt(), any(), any());
    }

    @Test
    void failureSkipsDependentsAndRecordsTheRest() {
        queueDown.set(true);

        var e = assertThrows(SubmissionFailedException.class, () -> dispatcher().dispatch(submissionIndex));

        assertThat(e.getFailedJobscripts()).containsExactly(0, 1);
        assertThat(e.getCause()).isInstanceOf(IOException.class);
        assertThat(store.getSubmission(submissionIndex).submittedJobscripts()).containsExactly(2);
        assertThat(store.getRun(2).submissionIndex()).contains(submissionIndex);
        assertThat(store.getRun(0).submissionIndex()).isEmpty();
        verify(scheduler, times(0)).submit(anyInt(), argThat(jobscript -> jobscript.index() == 1), any());
    }

    @Test
    void retrySubmitsOnlyTheFailedJobscripts() {
        queueDown.set(true);
        assertThrows(SubmissionFailedException.class, () -> dispatcher().dispatch(submissionIndex));
        queueDown.set(false);

        var submitted = dispatcher().dispatch(submissionIndex);

        assertThat(submitted).containsExactly(0, 1);
        assertThat(store.getSubmission(submissionIndex).submittedJobscripts()).containsExactlyInAnyOrder(0, 1, 2);
        verify(scheduler, times(2)).submit(anyInt(), argThat(jobscript -> jobscript.index() == 0), any());
    }
}
