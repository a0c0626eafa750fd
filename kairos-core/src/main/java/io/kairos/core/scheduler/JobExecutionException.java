package io.kairos.core.scheduler;

public final class JobExecutionException extends Exception {
    private final String jobId;

    public JobExecutionException(String jobId, Throwable cause) {
        super("Job " + jobId + " failed: " + cause.getMessage(), cause);
        this.jobId = jobId;
    }

    public String jobId() {
        return jobId;
    }
}
