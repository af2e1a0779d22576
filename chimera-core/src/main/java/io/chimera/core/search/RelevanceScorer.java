package io.chimera.core.search;

import io.chimera.core.memory.MemoryRecord;
import java.util.Set;

/**
 * Scores one memory against an already tokenized query. Implementations must return a value in
 * {@code [0, 1]} and {@code 0} when the memory is unrelated to the query.
 */
public interface RelevanceScorer {
    double score(Set<String> queryTokens, MemoryRecord memory);
}
