package io.chimera.core.memory;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

public interface MemoryStore {
    List<MemoryRecord> fetchCandidates(MemoryScope scope, int limit) throws IOException;

    Optional<MemoryRecord> find(String id) throws IOException;

    MemoryRecord save(MemoryRecord record) throws IOException;

    MemoryRecord bumpVersion(String id) throws IOException;
}
