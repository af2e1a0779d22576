package io.chimera.core.model;

import java.time.Instant;
import java.util.Objects;

public record ChatMessage(MessageRole role, String content, Instant timestamp) {

    public ChatMessage {
        Objects.requireNonNull(role, "role must not be null");
        content = content == null ? "" : content;
        timestamp = timestamp == null ? Instant.EPOCH : timestamp;
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(MessageRole.SYSTEM, content, Instant.now());
    }

    public static ChatMessage user(String content) {
        return new ChatMessage(MessageRole.USER, content, Instant.now());
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(MessageRole.ASSISTANT, content, Instant.now());
    }
}
