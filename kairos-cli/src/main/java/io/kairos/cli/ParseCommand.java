package io.kairos.cli;

import io.kairos.core.scheduler.ScheduleSpec;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

@Command(name = "parse", description = "Show how a natural-language schedule is interpreted")
public final class ParseCommand implements Callable<Integer> {
    private final CliContext context;

    @Parameters(arity = "1..*", paramLabel = "PHRASE", description = "Schedule phrase, e.g. \"every 5 minutes\" or \"tomorrow at 3pm\"")
    List<String> words;

    public ParseCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        String phrase = String.join(" ", words);
        try {
            Optional<ScheduleSpec> schedule = context.timeParser().resolve(phrase);
            if (schedule.isEmpty()) {
                System.err.println("Parse failed: could not understand \"" + phrase + "\"");
                return 1;
            }
            if (schedule.get().oneShot()) {
                System.out.println("One-shot at " + Instant.ofEpochMilli(schedule.get().executeAt()));
            } else {
                System.out.println("Recurring cron " + schedule.get().cronExpression());
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Parse failed: " + e.getMessage());
            return 1;
        }
    }
}
