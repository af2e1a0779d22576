package io.chimera.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProviderConfig(
    @JsonAlias({"api_key"}) String apiKey,
    @JsonAlias({"api_base"}) String apiBase,
    @JsonAlias({"timeout_seconds"}) int timeoutSeconds
) {

    public static ProviderConfig defaults(String apiBase, int timeoutSeconds) {
        return new ProviderConfig("", apiBase, timeoutSeconds);
    }

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
