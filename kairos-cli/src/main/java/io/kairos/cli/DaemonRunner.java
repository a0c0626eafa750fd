package io.kairos.cli;

import java.nio.file.Path;

@FunctionalInterface
public interface DaemonRunner {
    int run(Integer portOverride, Path workspaceOverride) throws Exception;
}
