package io.chimera.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ChimeraConfig(
    EngineConfig engine,
    ProvidersConfig providers
) {

    public static ChimeraConfig defaults() {
        return new ChimeraConfig(
            EngineConfig.defaults(),
            ProvidersConfig.defaults()
        );
    }
}
