package io.chimera.core.memory;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

public record MemoryRecord(
    String id,
    String workspaceId,
    String title,
    String content,
    String snippet,
    List<String> tags,
    Map<String, Object> metadata,
    long version,
    Instant createdAt,
    Instant updatedAt
) {
    public static final int SNIPPET_LENGTH = 150;

    public MemoryRecord {
        Objects.requireNonNull(id, "id must not be null");
        title = title == null ? "" : title;
        content = content == null ? "" : content;
        snippet = snippet == null ? snippetOf(content) : snippet;
        tags = tags == null ? List.of() : tags.stream().filter(Objects::nonNull).toList();
        // stored metadata may carry explicit nulls, e.g. "model_used": null
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        version = Math.max(1, version);
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
        updatedAt = updatedAt == null ? createdAt : updatedAt;
    }

    public static MemoryRecord create(
        String workspaceId,
        String title,
        String content,
        List<String> tags,
        Map<String, Object> metadata,
        Instant now
    ) {
        return new MemoryRecord(
            newId(),
            workspaceId,
            title,
            content,
            snippetOf(content),
            tags,
            metadata,
            1,
            now,
            now
        );
    }

    public MemoryRecord withContent(String newContent, Instant now) {
        String normalized = newContent == null ? "" : newContent;
        return new MemoryRecord(id, workspaceId, title, normalized, snippetOf(normalized), tags, metadata, version + 1, createdAt, now);
    }

    public MemoryRecord withTitle(String newTitle, Instant now) {
        return new MemoryRecord(id, workspaceId, newTitle, content, snippet, tags, metadata, version + 1, createdAt, now);
    }

    public MemoryRecord withTags(List<String> newTags, Instant now) {
        return new MemoryRecord(id, workspaceId, title, content, snippet, newTags, metadata, version + 1, createdAt, now);
    }

    public MemoryRecord withMetadata(Map<String, Object> newMetadata, Instant now) {
        return new MemoryRecord(id, workspaceId, title, content, snippet, tags, newMetadata, version + 1, createdAt, now);
    }

    public MemoryRecord nextVersion(Instant now) {
        return new MemoryRecord(id, workspaceId, title, content, snippet, tags, metadata, version + 1, createdAt, now);
    }

    static String snippetOf(String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        if (content.length() <= SNIPPET_LENGTH) {
            return content;
        }
        return content.substring(0, SNIPPET_LENGTH) + "...";
    }

    private static String newId() {
        return "memory-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
