package io.kairos.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ApiConfig(String host, int port) {

    public static ApiConfig defaults() {
        return new ApiConfig("127.0.0.1", 8787);
    }
}
