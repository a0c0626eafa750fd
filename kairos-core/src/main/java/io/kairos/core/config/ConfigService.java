package io.kairos.core.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.kairos.core.config.model.KairosConfig;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

public final class ConfigService {
    public static final String WORKSPACE_ENV = "KAIROS_WORKSPACE";
    public static final String CALENDAR_COMMAND_ENV = "KAIROS_CALENDAR_COMMAND";

    private final ObjectMapper mapper;
    private final Map<String, String> environment;

    public ConfigService() {
        this(System.getenv());
    }

    public ConfigService(Map<String, String> environment) {
        this.environment = Map.copyOf(Objects.requireNonNull(environment, "environment must not be null"));
        mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public KairosConfig load(Path configPath) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        if (!Files.exists(configPath)) {
            return applyEnvironment(KairosConfig.defaults());
        }
        return applyEnvironment(readFileOnly(configPath));
    }

    public void save(Path configPath, KairosConfig config) throws IOException {
        Objects.requireNonNull(configPath, "configPath must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Files.createDirectories(configPath.getParent());
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        Files.writeString(configPath, json + System.lineSeparator());
    }

    public OnboardResult onboard(Path configPath, boolean overwrite) throws IOException {
        boolean created = !Files.exists(configPath);
        boolean overwritten = false;

        KairosConfig config;
        if (created || overwrite) {
            config = KairosConfig.defaults();
            overwritten = !created && overwrite;
        } else {
            config = readFileOnly(configPath);
        }

        save(configPath, config);

        Path workspace = ConfigPaths.resolveWorkspace(applyEnvironment(config).scheduler().workspace());
        Files.createDirectories(workspace);
        return new OnboardResult(configPath, workspace, created, overwritten);
    }

    public String toPrettyJson(KairosConfig config) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize config", e);
        }
    }

    // Environment overrides are never written back to the file.
    private KairosConfig readFileOnly(Path configPath) throws IOException {
        JsonNode defaultsNode = mapper.valueToTree(KairosConfig.defaults());
        JsonNode existingNode = mapper.readTree(Files.readString(configPath));
        JsonNode merged = deepMerge(defaultsNode, existingNode);
        return mapper.treeToValue(merged, KairosConfig.class);
    }

    private KairosConfig applyEnvironment(KairosConfig config) {
        KairosConfig result = config;
        String workspace = environment.get(WORKSPACE_ENV);
        if (workspace != null && !workspace.isBlank()) {
            result = result.withScheduler(result.scheduler().withWorkspace(workspace.trim()));
        }
        String command = environment.get(CALENDAR_COMMAND_ENV);
        if (command != null && !command.isBlank()) {
            result = result.withCalendar(result.calendar().withCommand(command.trim()));
        }
        return result;
    }

    private JsonNode deepMerge(JsonNode base, JsonNode override) {
        if (base == null) {
            return override;
        }
        if (override == null) {
            return base;
        }
        if (!base.isObject() || !override.isObject()) {
            return override;
        }

        ObjectNode merged = ((ObjectNode) base).deepCopy();
        override.fields().forEachRemaining(entry -> {
            JsonNode existing = merged.get(entry.getKey());
            merged.set(entry.getKey(), deepMerge(existing, entry.getValue()));
        });
        return merged;
    }
}
