package io.kairos.cli;

import picocli.CommandLine.Command;

@Command(name = "kairos", mixinStandardHelpOptions = true, description = "Kairos job scheduler with calendar sync")
public final class KairosCliCommand implements Runnable {

    @Override
    public void run() {
        // Root command only shows help when no subcommand is provided.
    }
}
