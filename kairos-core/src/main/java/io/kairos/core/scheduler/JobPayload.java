package io.kairos.core.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobPayload(
    String channel,
    String content,
    String productId,
    String campaignId,
    String action,
    Map<String, Object> metadata
) {
    public JobPayload {
        metadata = metadata == null ? null : copyOf(metadata);
    }

    public static JobPayload empty() {
        return new JobPayload(null, null, null, null, null, null);
    }

    public static JobPayload ofContent(String content) {
        return new JobPayload(null, content, null, null, null, null);
    }

    private static Map<String, Object> copyOf(Map<String, Object> metadata) {
        // values may be null
        return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
