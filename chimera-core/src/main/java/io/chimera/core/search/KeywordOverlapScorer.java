package io.chimera.core.search;

import io.chimera.core.memory.MemoryRecord;
import java.util.Set;

// title hits count 2, content-only hits 1, divided by the query size
public final class KeywordOverlapScorer implements RelevanceScorer {
    private static final double TITLE_WEIGHT = 2.0;

    @Override
    public double score(Set<String> queryTokens, MemoryRecord memory) {
        if (queryTokens == null || queryTokens.isEmpty() || memory == null) {
            return 0.0;
        }
        Set<String> memoryTokens = Tokenizer.tokenize(memory.title() + " " + memory.content());
        Set<String> titleTokens = Tokenizer.tokenize(memory.title());

        int matches = 0;
        int titleMatches = 0;
        for (String token : queryTokens) {
            if (memoryTokens.contains(token)) {
                matches++;
            }
            if (titleTokens.contains(token)) {
                titleMatches++;
            }
        }
        if (matches == 0) {
            return 0.0;
        }
        int contentMatches = matches - titleMatches;
        double score = (titleMatches * TITLE_WEIGHT + contentMatches) / queryTokens.size();
        return Math.min(score, 1.0);
    }
}
