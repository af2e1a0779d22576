package io.chimera.core.config.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineConfig(
    @JsonAlias({"system_prompt"}) String systemPrompt,
    String workspace,
    @JsonAlias({"default_model"}) String defaultModel,
    @JsonAlias({"search_pool_size"}) int searchPoolSize,
    @JsonAlias({"default_top_k"}) int defaultTopK,
    @JsonAlias({"max_injected_memories"}) int maxInjectedMemories,
    @JsonAlias({"max_memory_chars"}) int maxMemoryChars,
    @JsonAlias({"history_depth"}) int historyDepth
) {

    public static EngineConfig defaults() {
        return new EngineConfig(
            "You are a helpful AI assistant in the Chimera Protocol system.",
            "~/.chimera/workspace",
            "echo",
            100,
            5,
            5,
            1000,
            5
        );
    }
}
