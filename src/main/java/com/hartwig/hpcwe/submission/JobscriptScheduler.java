package com.hartwig.hpcwe.submission;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import com.hartwig.hpcwe.model.JobscriptDescriptor;

/**
 * A scheduler backend (direct process, SGE, SLURM) that renders and submits jobscripts.
 */
public interface JobscriptScheduler {
    /**
     * Submits one jobscript. It is only called once every jobscript it depends on was submitted.
     *
     * @param dependencies jobscript index to the reference it was submitted under, for each dependency
     * @return future completing with the reference of the submitted job, or exceptionally when submission failed
     */
    CompletableFuture<SchedulerReference> submit(int submissionIndex, JobscriptDescriptor jobscript,
            Map<Integer, SchedulerReference> dependencies);
}
