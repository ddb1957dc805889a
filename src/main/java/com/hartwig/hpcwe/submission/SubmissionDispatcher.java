package com.hartwig.hpcwe.submission;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

import com.hartwig.hpcwe.ThreadUtil;
import com.hartwig.hpcwe.model.JobscriptDescriptor;
import com.hartwig.hpcwe.store.PersistentStore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands the outstanding jobscripts of a submission to a scheduler. A jobscript is submitted once all jobscripts it
 * depends on were submitted, independent jobscripts concurrently on the executor. The store is only touched from the
 * calling thread, after all submissions completed.
 */
public class SubmissionDispatcher {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubmissionDispatcher.class);

    private final PersistentStore store;
    private final JobscriptScheduler scheduler;
    private final ExecutorService executorService;

    public SubmissionDispatcher(final PersistentStore store, final JobscriptScheduler scheduler) {
        this(store, scheduler, ThreadUtil.createExecutorService(store.config().dispatcherThreads(), "jobscript-submit-%d"));
    }

    public SubmissionDispatcher(final PersistentStore store, final JobscriptScheduler scheduler, final ExecutorService executorService) {
        this.store = store;
        this.scheduler = scheduler;
        this.executorService = executorService;
    }

    /**
     * Submits every jobscript of the submission not submitted before and records the successful ones as a new
     * submission part.
     *
     * @return indices of the jobscripts submitted by this call
     * @throws SubmissionFailedException when any jobscript failed; the successful ones are recorded first
     */
    public List<Integer> dispatch(int submissionIndex) {
        var submission = store.getSubmission(submissionIndex);
        var alreadySubmitted = new HashSet<>(submission.submittedJobscripts());
        var references = new ConcurrentHashMap<Integer, CompletableFuture<SchedulerReference>>();
        var outstanding = new LinkedHashMap<Integer, CompletableFuture<SchedulerReference>>();
        var dispatchTime = Instant.now();

        for (JobscriptDescriptor jobscript : submission.jobscripts()) {
            if (alreadySubmitted.contains(jobscript.index())) {
                references.put(jobscript.index(), CompletableFuture.completedFuture(storedReference(submissionIndex, jobscript)));
                continue;
            }
            var dependencyFutures = new ArrayList<CompletableFuture<SchedulerReference>>();
            for (Integer dependency : jobscript.dependencies().keySet()) {
                var future = references.get(dependency);
                if (future == null) {
                    throw new IllegalStateException(String.format("Jobscript %s of submission %s depends on jobscript %s which comes after it",
                            jobscript.index(),
                            submissionIndex,
                            dependency));
                }
                dependencyFutures.add(future);
            }
            var future = CompletableFuture.allOf(dependencyFutures.toArray(new CompletableFuture[0]))
                    .thenComposeAsync(ignored -> scheduler.submit(submissionIndex, jobscript, resolved(jobscript, references)),
                            executorService);
            references.put(jobscript.index(), future);
            outstanding.put(jobscript.index(), future);
        }
        LOGGER.info("[{}] Dispatching {} jobscript(s) of submission {}", store.workflowPath().getFileName(), outstanding.size(), submissionIndex);

        var submitted = new LinkedHashMap<Integer, SchedulerReference>();
        var failed = new ArrayList<Integer>();
        Throwable firstFailure = null;
        for (var entry : outstanding.entrySet()) {
            try {
                var reference = entry.getValue().join();
                submitted.put(entry.getKey(), reference);
                LOGGER.info("[{}] Submitted jobscript {} as job {}", submissionIndex, entry.getKey(), reference.jobId());
            } catch (CompletionException | CancellationException e) {
                var cause = e.getCause() != null ? e.getCause() : e;
                LOGGER.error("[{}] Failed to submit jobscript {}: {}", submissionIndex, entry.getKey(), cause.getMessage());
                failed.add(entry.getKey());
                if (firstFailure == null) {
                    firstFailure = cause;
                }
            }
        }

        if (!submitted.isEmpty()) {
            record(submissionIndex, submission.jobscripts(), submitted, dispatchTime);
        }
        if (!failed.isEmpty()) {
            throw new SubmissionFailedException(submissionIndex, failed, firstFailure);
        }
        return new ArrayList<>(submitted.keySet());
    }

    private void record(int submissionIndex, List<JobscriptDescriptor> jobscripts, Map<Integer, SchedulerReference> submitted,
            Instant dispatchTime) {
        var submitTime = store.codec().formatTimestamp(dispatchTime);
        store.batchUpdate(() -> {
            var runSubmissions = new LinkedHashMap<Integer, Integer>();
            for (var entry : submitted.entrySet()) {
                store.setJobscriptMetadata(submissionIndex, entry.getKey(), entry.getValue().toMetadata(submitTime));
                for (List<Integer> row : jobscripts.get(entry.getKey()).runIds()) {
                    row.stream().filter(runId -> runId != ResourceMap.NO_RUN).forEach(runId -> runSubmissions.put(runId, submissionIndex));
                }
            }
            store.setRunSubmissionIndices(runSubmissions);
            store.addSubmissionPart(submissionIndex, dispatchTime, new ArrayList<>(submitted.keySet()));
            return null;
        });
    }

    private static Map<Integer, SchedulerReference> resolved(JobscriptDescriptor jobscript,
            Map<Integer, CompletableFuture<SchedulerReference>> references) {
        var resolved = new LinkedHashMap<Integer, SchedulerReference>();
        for (Integer dependency : jobscript.dependencies().keySet()) {
            resolved.put(dependency, references.get(dependency).join());
        }
        return resolved;
    }

    private static SchedulerReference storedReference(int submissionIndex, JobscriptDescriptor jobscript) {
        var metadata = jobscript.metadata();
        var jobId = metadata.schedulerJobId()
                .orElseThrow(() -> new IllegalStateException(String.format(
                        "Jobscript %s of submission %s was submitted but has no scheduler job ID",
                        jobscript.index(),
                        submissionIndex)));
        return SchedulerReference.builder()
                .jobId(jobId)
                .processId(metadata.processId())
                .hostname(metadata.submitHostname())
                .submitCommand(metadata.submitCommand())
                .build();
    }
}
