package io.chimera.core.search;

import static org.assertj.core.api.Assertions.assertThat;

import io.chimera.core.memory.MemoryRecord;
import io.chimera.core.memory.MemoryScope;
import io.chimera.core.memory.MemoryStore;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MemorySearchServiceTest {
    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void shouldReturnAtMostTopKResultsInDescendingScoreOrder() {
        ListMemoryStore store = new ListMemoryStore(List.of(
            memory("m1", "ws", "Database backups", "Nightly postgres backup at 02:00", 0),
            memory("m2", "ws", "Team lunch", "Fridays at noon", 1),
            memory("m3", "ws", "Cluster tuning", "Raise shared_buffers for the postgres cluster", 2),
            memory("m4", "ws", "Notes", "postgres upgrade planned", 3)
        ));
        MemorySearchService service = new MemorySearchService(store);

        List<ScoredResult> results = service.search("postgres backup", 2, MemoryScope.all());

        assertThat(results).hasSize(2);
        assertThat(results).extracting(result -> result.memory().id()).containsExactly("m1", "m4");
        assertThat(results.get(0).score()).isGreaterThanOrEqualTo(results.get(1).score());
        assertThat(results).allSatisfy(result -> assertThat(result.score()).isGreaterThan(0.0).isLessThanOrEqualTo(1.0));
    }

    @Test
    void shouldOmitMemoriesWithoutOverlap() {
        ListMemoryStore store = new ListMemoryStore(List.of(
            memory("m1", "ws", "Team lunch", "Fridays at noon", 0)
        ));

        assertThat(new MemorySearchService(store).search("postgres", 5, MemoryScope.all())).isEmpty();
    }

    @Test
    void shouldBreakTiesByMostRecentlyUpdated() {
        ListMemoryStore store = new ListMemoryStore(List.of(
            memory("older", "ws", "Deploy checklist", "Run migrations first", 0),
            memory("newer", "ws", "Deploy checklist", "Run migrations first", 60)
        ));

        List<ScoredResult> results = new MemorySearchService(store).search("deploy", 5, MemoryScope.all());

        assertThat(results).extracting(result -> result.memory().id()).containsExactly("newer", "older");
    }

    @Test
    void shouldNotTouchStoreForStopWordOnlyQueryOrNonPositiveTopK() {
        ListMemoryStore store = new ListMemoryStore(List.of(
            memory("m1", "ws", "The plan", "and then some", 0)
        ));
        MemorySearchService service = new MemorySearchService(store);

        assertThat(service.search("the and with", 5, MemoryScope.all())).isEmpty();
        assertThat(service.search("plan", 0, MemoryScope.all())).isEmpty();
        assertThat(store.fetches).isZero();
    }

    @Test
    void shouldPassPoolSizeAndScopeToStore() {
        ListMemoryStore store = new ListMemoryStore(List.of(
            memory("m1", "alpha", "Release notes", "release train", 0),
            memory("m2", "beta", "Release notes", "release train", 1)
        ));
        MemorySearchService service = new MemorySearchService(store, new KeywordOverlapScorer(), 25);

        List<ScoredResult> results = service.search("release", 5, MemoryScope.workspace("alpha"));

        assertThat(store.lastLimit).isEqualTo(25);
        assertThat(results).extracting(result -> result.memory().id()).containsExactly("m1");
    }

    @Test
    void shouldReturnEmptyWhenStoreFails() {
        MemoryStore failing = new ListMemoryStore(List.of()) {
            @Override
            public List<MemoryRecord> fetchCandidates(MemoryScope scope, int limit) throws IOException {
                throw new IOException("disk unavailable");
            }
        };

        assertThat(new MemorySearchService(failing).search("anything useful", 5, MemoryScope.all())).isEmpty();
    }

    @Test
    void shouldClampOutOfRangeScoresFromCustomScorer() {
        ListMemoryStore store = new ListMemoryStore(List.of(
            memory("m1", "ws", "Anything", "whatever", 0),
            memory("m2", "ws", "Something", "else", 1)
        ));
        RelevanceScorer wild = (query, memory) -> memory.id().equals("m1") ? 7.5 : -2.0;

        List<ScoredResult> results = new MemorySearchService(store, wild, 10).search("query words", 5, MemoryScope.all());

        assertThat(results).hasSize(1);
        assertThat(results.get(0).score()).isEqualTo(1.0);
    }

    private static MemoryRecord memory(String id, String workspace, String title, String content, int minutesAfterBase) {
        Instant at = BASE.plusSeconds(minutesAfterBase * 60L);
        return new MemoryRecord(id, workspace, title, content, null, List.of(), Map.of(), 1, at, at);
    }

    private static class ListMemoryStore implements MemoryStore {
        private final List<MemoryRecord> records;
        int fetches;
        int lastLimit;

        ListMemoryStore(List<MemoryRecord> records) {
            this.records = new ArrayList<>(records);
        }

        @Override
        public List<MemoryRecord> fetchCandidates(MemoryScope scope, int limit) throws IOException {
            fetches++;
            lastLimit = limit;
            return records.stream()
                .filter(record -> scope.includes(record.workspaceId()))
                .sorted((a, b) -> b.updatedAt().compareTo(a.updatedAt()))
                .limit(limit)
                .toList();
        }

        @Override
        public Optional<MemoryRecord> find(String id) {
            return records.stream().filter(record -> record.id().equals(id)).findFirst();
        }

        @Override
        public MemoryRecord save(MemoryRecord record) {
            records.add(record);
            return record;
        }

        @Override
        public MemoryRecord bumpVersion(String id) {
            throw new UnsupportedOperationException();
        }
    }
}
