package io.chimera.core.session;

import java.time.Instant;
import java.util.Objects;

public record InjectedMemoryLink(String conversationId, String memoryId, boolean active, Instant injectedAt) {

    public InjectedMemoryLink {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        Objects.requireNonNull(memoryId, "memoryId must not be null");
        injectedAt = injectedAt == null ? Instant.EPOCH : injectedAt;
    }

    public boolean sameTarget(String otherConversationId, String otherMemoryId) {
        return conversationId.equals(otherConversationId) && memoryId.equals(otherMemoryId);
    }

    public InjectedMemoryLink withActive(boolean newActive) {
        return new InjectedMemoryLink(conversationId, memoryId, newActive, injectedAt);
    }
}
