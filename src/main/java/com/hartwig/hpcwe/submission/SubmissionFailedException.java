package com.hartwig.hpcwe.submission;

import java.util.List;

public class SubmissionFailedException extends RuntimeException {
    private final List<Integer> failedJobscripts;

    public SubmissionFailedException(final int submissionIndex, final List<Integer> failedJobscripts, final Throwable cause) {
        super(String.format("Jobscripts %s of submission %s could not be submitted", failedJobscripts, submissionIndex), cause);
        this.failedJobscripts = List.copyOf(failedJobscripts);
    }

    public List<Integer> getFailedJobscripts() {
        return failedJobscripts;
    }
}
