package io.kairos.core.scheduler;

@FunctionalInterface
public interface JobEventListener {
    void onEvent(JobEvent event);
}
