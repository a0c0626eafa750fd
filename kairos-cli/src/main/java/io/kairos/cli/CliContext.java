package io.kairos.cli;

import io.kairos.core.config.ConfigService;
import io.kairos.core.scheduler.TimeParser;
import java.nio.file.Path;

public record CliContext(
    ConfigService configService,
    Path configPath,
    TimeParser timeParser,
    DaemonRunner daemonRunner
) {
    public CliContext(ConfigService configService, Path configPath, TimeParser timeParser) {
        this(configService, configPath, timeParser, (port, workspace) -> {
            throw new UnsupportedOperationException("daemon runner is not configured");
        });
    }
}
