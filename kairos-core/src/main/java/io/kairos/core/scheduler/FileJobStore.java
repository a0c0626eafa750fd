package io.kairos.core.scheduler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

public final class FileJobStore implements JobStore {
    public static final String DEFAULT_FILE_NAME = "scheduler.json";

    private final Path path;
    private final ObjectMapper mapper;

    public FileJobStore(Path path) {
        this.path = path;
        this.mapper = new ObjectMapper();
        this.mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    public static FileJobStore inWorkspace(Path workspace) {
        return new FileJobStore(workspace.resolve(DEFAULT_FILE_NAME));
    }

    public Path path() {
        return path;
    }

    @Override
    public synchronized List<ScheduledJob> load() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        String json = Files.readString(path);
        if (json.isBlank()) {
            return List.of();
        }
        try {
            List<ScheduledJob> jobs = mapper.readValue(json, new TypeReference<List<ScheduledJob>>() {
            });
            return jobs == null ? List.of() : List.copyOf(jobs);
        } catch (JsonProcessingException e) {
            throw new JobStoreException(path, "Malformed job file", e);
        }
    }

    @Override
    public synchronized void save(List<ScheduledJob> jobs) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(jobs);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
