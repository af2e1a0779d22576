package io.chimera.core.session;

import io.chimera.core.memory.MemoryRecord;
import io.chimera.core.model.ChatMessage;
import java.io.IOException;
import java.util.List;

public interface ConversationStore {
    void append(String conversationId, ChatMessage message) throws IOException;

    List<ChatMessage> history(String conversationId, int limit) throws IOException;

    List<MemoryRecord> activeInjectedMemories(String conversationId) throws IOException;

    InjectedMemoryLink inject(String conversationId, String memoryId) throws IOException;

    boolean setActive(String conversationId, String memoryId, boolean active) throws IOException;

    boolean remove(String conversationId, String memoryId) throws IOException;

    List<InjectedMemoryLink> links(String conversationId) throws IOException;
}
