package io.kairos.cli;

import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "daemon", description = "Run the scheduler with its jobs HTTP API")
public final class DaemonCommand implements Callable<Integer> {
    private final CliContext context;

    @Option(names = {"--port"}, description = "API port, defaults to api.port from config")
    Integer port;

    @Option(names = {"--workspace"}, description = "Workspace override")
    Path workspace;

    public DaemonCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            return context.daemonRunner().run(port, workspace);
        } catch (Exception e) {
            System.err.println("Daemon command failed: " + e.getMessage());
            return 1;
        }
    }
}
