package io.chimera.core.search;

import io.chimera.core.memory.MemoryRecord;
import io.chimera.core.memory.MemoryScope;
import io.chimera.core.memory.MemoryStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MemorySearchService {
    public static final int DEFAULT_POOL_SIZE = 100;

    private static final Logger LOG = LoggerFactory.getLogger(MemorySearchService.class);
    private static final Comparator<ScoredResult> RANKING = Comparator
        .comparingDouble(ScoredResult::score).reversed()
        .thenComparing((ScoredResult result) -> result.memory().updatedAt(), Comparator.reverseOrder())
        .thenComparing(result -> result.memory().id());

    private final MemoryStore memoryStore;
    private final RelevanceScorer scorer;
    private final int poolSize;

    public MemorySearchService(MemoryStore memoryStore) {
        this(memoryStore, new KeywordOverlapScorer(), DEFAULT_POOL_SIZE);
    }

    public MemorySearchService(MemoryStore memoryStore, RelevanceScorer scorer, int poolSize) {
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore must not be null");
        this.scorer = Objects.requireNonNull(scorer, "scorer must not be null");
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive: " + poolSize);
        }
        this.poolSize = poolSize;
    }

    public List<ScoredResult> search(String query, int topK, MemoryScope scope) {
        if (topK <= 0) {
            return List.of();
        }
        Set<String> queryTokens = Tokenizer.tokenize(query);
        if (queryTokens.isEmpty()) {
            LOG.debug("Query has no searchable tokens");
            return List.of();
        }

        List<MemoryRecord> candidates;
        try {
            candidates = memoryStore.fetchCandidates(scope == null ? MemoryScope.all() : scope, poolSize);
        } catch (IOException e) {
            LOG.warn("Failed to fetch memory candidates for {}", scope, e);
            return List.of();
        }

        List<ScoredResult> scored = new ArrayList<>();
        for (MemoryRecord candidate : candidates) {
            double score = clamp(scorer.score(queryTokens, candidate));
            if (score > 0) {
                scored.add(new ScoredResult(candidate, score));
            }
        }
        scored.sort(RANKING);
        LOG.debug("Scored {} of {} candidates for {} query tokens", scored.size(), candidates.size(), queryTokens.size());
        return List.copyOf(scored.subList(0, Math.min(topK, scored.size())));
    }

    private double clamp(double score) {
        if (Double.isNaN(score) || score <= 0) {
            return 0.0;
        }
        return Math.min(score, 1.0);
    }
}
