package io.kairos.core.config;

import static org.assertj.core.api.Assertions.assertThat;

import io.kairos.core.config.model.KairosConfig;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigServiceTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldLoadDefaultsWhenConfigMissing() throws Exception {
        ConfigService service = new ConfigService(Map.of());
        Path configPath = tempDir.resolve("config.json");

        KairosConfig config = service.load(configPath);

        assertThat(config.scheduler().workerThreads()).isEqualTo(4);
        assertThat(config.scheduler().storeFile()).isEqualTo("scheduler.json");
        assertThat(config.calendar().defaultCalendarId()).isEqualTo("primary");
        assertThat(config.calendar().defaultTimezone()).isEqualTo("UTC");
        assertThat(config.api().port()).isEqualTo(8787);
    }

    @Test
    void shouldMergeExistingValuesOverDefaults() throws Exception {
        ConfigService service = new ConfigService(Map.of());
        Path configPath = tempDir.resolve("config.json");
        Files.writeString(configPath, """
            {
              "scheduler": {
                "workerThreads": 8
              },
              "calendar": {
                "defaultTimezone": "Europe/Berlin",
                "products": {
                  "prod-1": { "calendarId": "launches@group.calendar.google.com" }
                }
              }
            }
            """);

        KairosConfig config = service.load(configPath);

        assertThat(config.scheduler().workerThreads()).isEqualTo(8);
        assertThat(config.scheduler().storeRetrySeconds()).isEqualTo(30);
        assertThat(config.calendar().defaultTimezone()).isEqualTo("Europe/Berlin");
        assertThat(config.calendar().command()).isEqualTo("gog");
        assertThat(config.calendar().productCalendarIds())
            .containsEntry("prod-1", "launches@group.calendar.google.com");
    }

    @Test
    void shouldApplyEnvironmentOverridesWithoutPersistingThem() throws Exception {
        Path workspace = tempDir.resolve("env-workspace");
        ConfigService service = new ConfigService(Map.of(
            ConfigService.WORKSPACE_ENV, workspace.toString(),
            ConfigService.CALENDAR_COMMAND_ENV, "/opt/gog/bin/gog"
        ));
        Path configPath = tempDir.resolve(".kairos/config.json");

        OnboardResult result = service.onboard(configPath, false);
        KairosConfig config = service.load(configPath);

        assertThat(result.createdConfig()).isTrue();
        assertThat(result.workspacePath()).isEqualTo(workspace);
        assertThat(Files.isDirectory(workspace)).isTrue();
        assertThat(config.calendar().command()).isEqualTo("/opt/gog/bin/gog");
        assertThat(Files.readString(configPath)).doesNotContain("/opt/gog/bin/gog");
    }

    @Test
    void shouldResolveStoreFileInsideWorkspace() {
        KairosConfig config = KairosConfig.defaults();
        Path workspace = tempDir.resolve("ws");

        Path store = ConfigPaths.resolveStoreFile(config.scheduler().withWorkspace(workspace.toString()));

        assertThat(store).isEqualTo(workspace.resolve("scheduler.json"));
    }
}
