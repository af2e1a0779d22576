package io.chimera.core.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.chimera.core.memory.MemoryRecord;
import io.chimera.core.memory.MemoryStore;
import io.chimera.core.model.ChatMessage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class FileConversationStore implements ConversationStore {
    private static final Logger LOG = LoggerFactory.getLogger(FileConversationStore.class);

    private final Path path;
    private final MemoryStore memoryStore;
    private final Clock clock;
    private final ObjectMapper mapper;

    public FileConversationStore(Path path, MemoryStore memoryStore) {
        this(path, memoryStore, Clock.systemUTC());
    }

    public FileConversationStore(Path path, MemoryStore memoryStore, Clock clock) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void append(String conversationId, ChatMessage message) throws IOException {
        Objects.requireNonNull(message, "message must not be null");
        Snapshot snapshot = load();
        snapshot.messages().computeIfAbsent(conversationId, ignored -> new ArrayList<>()).add(message);
        save(snapshot);
    }

    @Override
    public synchronized List<ChatMessage> history(String conversationId, int limit) throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        List<ChatMessage> messages = load().messages().getOrDefault(conversationId, List.of());
        int from = Math.max(0, messages.size() - limit);
        return List.copyOf(messages.subList(from, messages.size()));
    }

    @Override
    public synchronized List<MemoryRecord> activeInjectedMemories(String conversationId) throws IOException {
        List<MemoryRecord> memories = new ArrayList<>();
        for (InjectedMemoryLink link : links(conversationId)) {
            if (!link.active()) {
                continue;
            }
            Optional<MemoryRecord> memory = memoryStore.find(link.memoryId());
            if (memory.isPresent()) {
                memories.add(memory.get());
            } else {
                LOG.warn("Conversation {} links missing memory {}", conversationId, link.memoryId());
            }
        }
        return memories;
    }

    @Override
    public synchronized InjectedMemoryLink inject(String conversationId, String memoryId) throws IOException {
        Snapshot snapshot = load();
        List<InjectedMemoryLink> links = snapshot.links();
        for (int i = 0; i < links.size(); i++) {
            InjectedMemoryLink existing = links.get(i);
            if (existing.sameTarget(conversationId, memoryId)) {
                if (existing.active()) {
                    return existing;
                }
                InjectedMemoryLink reactivated = existing.withActive(true);
                links.set(i, reactivated);
                save(snapshot);
                return reactivated;
            }
        }
        InjectedMemoryLink created = new InjectedMemoryLink(conversationId, memoryId, true, clock.instant());
        links.add(created);
        save(snapshot);
        return created;
    }

    @Override
    public synchronized boolean setActive(String conversationId, String memoryId, boolean active) throws IOException {
        Snapshot snapshot = load();
        List<InjectedMemoryLink> links = snapshot.links();
        for (int i = 0; i < links.size(); i++) {
            if (links.get(i).sameTarget(conversationId, memoryId)) {
                links.set(i, links.get(i).withActive(active));
                save(snapshot);
                return true;
            }
        }
        return false;
    }

    @Override
    public synchronized boolean remove(String conversationId, String memoryId) throws IOException {
        Snapshot snapshot = load();
        boolean removed = snapshot.links().removeIf(link -> link.sameTarget(conversationId, memoryId));
        if (removed) {
            save(snapshot);
        }
        return removed;
    }

    @Override
    public synchronized List<InjectedMemoryLink> links(String conversationId) throws IOException {
        return load().links().stream()
            .filter(link -> link.conversationId().equals(conversationId))
            .toList();
    }

    private Snapshot load() throws IOException {
        if (!Files.exists(path)) {
            return new Snapshot(new LinkedHashMap<>(), new ArrayList<>());
        }
        Snapshot stored = mapper.readValue(Files.readString(path), Snapshot.class);
        Map<String, List<ChatMessage>> messages = new LinkedHashMap<>();
        if (stored.messages() != null) {
            stored.messages().forEach((id, list) -> messages.put(id, new ArrayList<>(list)));
        }
        List<InjectedMemoryLink> links = stored.links() == null ? new ArrayList<>() : new ArrayList<>(stored.links());
        return new Snapshot(messages, links);
    }

    private void save(Snapshot snapshot) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        Files.writeString(tmp, json + System.lineSeparator());
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    record Snapshot(Map<String, List<ChatMessage>> messages, List<InjectedMemoryLink> links) {
    }
}
