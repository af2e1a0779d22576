package io.chimera.core.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.chimera.core.memory.MemoryRecord;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class KeywordOverlapScorerTest {
    private final KeywordOverlapScorer scorer = new KeywordOverlapScorer();

    @Test
    void shouldCountContentOnlyMatchesOnce() {
        MemoryRecord memory = memory("Dark mode", "prefers dark mode in every editor");

        double score = scorer.score(Tokenizer.tokenize("editor theme colors"), memory);

        assertThat(score).isCloseTo(1.0 / 3.0, within(1e-9));
    }

    @Test
    void shouldWeightTitleMatchesDouble() {
        MemoryRecord memory = memory("Dark mode", "");

        double score = scorer.score(Tokenizer.tokenize("dark colors layout"), memory);

        assertThat(score).isCloseTo(2.0 / 3.0, within(1e-9));
    }

    @Test
    void shouldCapScoreAtOne() {
        MemoryRecord memory = memory("Dark mode", "User prefers dark mode in every editor");

        assertThat(scorer.score(Tokenizer.tokenize("dark mode preference"), memory)).isEqualTo(1.0);
    }

    @Test
    void shouldScoreZeroExactlyWhenNothingOverlaps() {
        MemoryRecord memory = memory("Dark mode", "User prefers dark mode in every editor");

        assertThat(scorer.score(Tokenizer.tokenize("kubernetes cluster"), memory)).isZero();
        assertThat(scorer.score(Tokenizer.tokenize(""), memory)).isZero();
    }

    private static MemoryRecord memory(String title, String content) {
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        return new MemoryRecord("memory-1", "ws", title, content, null, List.of(), Map.of(), 1, now, now);
    }
}
