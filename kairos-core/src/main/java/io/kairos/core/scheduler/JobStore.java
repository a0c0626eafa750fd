package io.kairos.core.scheduler;

import java.io.IOException;
import java.util.List;

public interface JobStore {
    List<ScheduledJob> load() throws IOException;

    void save(List<ScheduledJob> jobs) throws IOException;
}
