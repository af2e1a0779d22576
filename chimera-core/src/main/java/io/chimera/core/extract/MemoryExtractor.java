package io.chimera.core.extract;

import java.util.List;

public interface MemoryExtractor {
    Importance classify(String userMessage);

    List<ExtractionCandidate> extractFacts(String text);

    List<String> generateTags(String text);

    double importanceScore(String text);

    default boolean shouldPersist(Importance importance) {
        return importance != null && importance != Importance.NONE;
    }

    default Classification analyze(String text) {
        return new Classification(classify(text), generateTags(text), importanceScore(text), extractFacts(text));
    }
}
