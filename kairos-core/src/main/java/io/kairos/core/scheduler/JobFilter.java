package io.kairos.core.scheduler;

public record JobFilter(JobType type, Boolean enabled, String productId) {

    public static JobFilter all() {
        return new JobFilter(null, null, null);
    }

    public boolean matches(ScheduledJob job) {
        if (type != null && job.type() != type) {
            return false;
        }
        if (enabled != null && job.enabled() != enabled) {
            return false;
        }
        if (productId != null && !productId.isBlank() && !productId.equals(job.payload().productId())) {
            return false;
        }
        return true;
    }
}
