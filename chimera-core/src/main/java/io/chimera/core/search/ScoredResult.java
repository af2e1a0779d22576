package io.chimera.core.search;

import io.chimera.core.memory.MemoryRecord;
import java.util.Objects;

public record ScoredResult(MemoryRecord memory, double score) {

    public ScoredResult {
        Objects.requireNonNull(memory, "memory must not be null");
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("score must be within [0, 1]: " + score);
        }
    }
}
