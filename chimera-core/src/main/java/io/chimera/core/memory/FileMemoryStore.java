package io.chimera.core.memory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class FileMemoryStore implements MemoryStore {
    private static final Comparator<MemoryRecord> NEWEST_FIRST = Comparator
        .comparing(MemoryRecord::updatedAt)
        .thenComparing(MemoryRecord::createdAt)
        .reversed();

    private final Path path;
    private final Clock clock;
    private final ObjectMapper mapper;

    public FileMemoryStore(Path path) {
        this(path, Clock.systemUTC());
    }

    public FileMemoryStore(Path path, Clock clock) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized List<MemoryRecord> fetchCandidates(MemoryScope scope, int limit) throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        MemoryScope effective = scope == null ? MemoryScope.all() : scope;
        return listInternal().stream()
            .filter(record -> effective.includes(record.workspaceId()))
            .sorted(NEWEST_FIRST)
            .limit(limit)
            .toList();
    }

    @Override
    public synchronized Optional<MemoryRecord> find(String id) throws IOException {
        return listInternal().stream()
            .filter(record -> record.id().equals(id))
            .findFirst();
    }

    @Override
    public synchronized MemoryRecord save(MemoryRecord record) throws IOException {
        Objects.requireNonNull(record, "record must not be null");
        List<MemoryRecord> records = new ArrayList<>(listInternal());
        for (int i = 0; i < records.size(); i++) {
            MemoryRecord existing = records.get(i);
            if (!existing.id().equals(record.id())) {
                continue;
            }
            if (record.version() <= existing.version()) {
                throw new IllegalArgumentException(
                    "Stale write for memory " + record.id() + ": version " + record.version()
                        + " is not newer than stored version " + existing.version()
                );
            }
            records.set(i, record);
            write(records);
            return record;
        }
        records.add(record);
        write(records);
        return record;
    }

    @Override
    public synchronized MemoryRecord bumpVersion(String id) throws IOException {
        MemoryRecord existing = find(id)
            .orElseThrow(() -> new IllegalArgumentException("Unknown memory: " + id));
        return save(existing.nextVersion(clock.instant()));
    }

    private List<MemoryRecord> listInternal() throws IOException {
        if (!Files.exists(path)) {
            return List.of();
        }
        return mapper.readValue(Files.readString(path), new TypeReference<List<MemoryRecord>>() {
        });
    }

    private void write(List<MemoryRecord> records) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(records);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
