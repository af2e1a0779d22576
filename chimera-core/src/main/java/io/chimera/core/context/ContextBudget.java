package io.chimera.core.context;

import io.chimera.core.config.model.EngineConfig;

public record ContextBudget(int maxMemories, int maxMemoryChars, int historyDepth) {
    public static final int DEFAULT_MAX_MEMORIES = 5;
    public static final int DEFAULT_MAX_MEMORY_CHARS = 1000;
    public static final int DEFAULT_HISTORY_DEPTH = 5;

    public ContextBudget {
        maxMemories = Math.max(0, maxMemories);
        maxMemoryChars = Math.max(0, maxMemoryChars);
        historyDepth = Math.max(0, historyDepth);
    }

    public static ContextBudget defaults() {
        return new ContextBudget(DEFAULT_MAX_MEMORIES, DEFAULT_MAX_MEMORY_CHARS, DEFAULT_HISTORY_DEPTH);
    }

    public static ContextBudget from(EngineConfig engine) {
        return new ContextBudget(engine.maxInjectedMemories(), engine.maxMemoryChars(), engine.historyDepth());
    }
}
