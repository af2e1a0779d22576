package io.chimera.core.extract;

import java.util.List;
import java.util.Objects;

public record Classification(
    Importance importance,
    List<String> tags,
    double score,
    List<ExtractionCandidate> candidates
) {

    public Classification {
        Objects.requireNonNull(importance, "importance must not be null");
        tags = tags == null ? List.of() : List.copyOf(tags);
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public boolean shouldPersist() {
        return importance != Importance.NONE;
    }
}
