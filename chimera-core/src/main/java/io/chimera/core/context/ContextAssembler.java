package io.chimera.core.context;

import io.chimera.core.memory.MemoryRecord;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.session.ConversationStore;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ContextAssembler {
    private static final Logger LOG = LoggerFactory.getLogger(ContextAssembler.class);

    private final ConversationStore conversationStore;
    private final String systemPrompt;
    private final ContextBudget budget;

    public ContextAssembler(ConversationStore conversationStore, String systemPrompt, ContextBudget budget) {
        this.conversationStore = Objects.requireNonNull(conversationStore, "conversationStore must not be null");
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
    }

    public ContextBundle build(String conversationId, String userMessage) throws IOException {
        List<ChatMessage> history = conversationStore.history(conversationId, budget.historyDepth());
        List<MemoryRecord> memories = conversationStore.activeInjectedMemories(conversationId);
        return assemble(memories, history, userMessage);
    }

    public ContextBundle assemble(List<MemoryRecord> memories, List<ChatMessage> history, String userMessage) {
        List<MemoryRecord> safeMemories = memories == null ? List.of() : memories;
        List<ChatMessage> safeHistory = history == null ? List.of() : history;

        List<InjectedMemory> injected = new ArrayList<>();
        for (MemoryRecord memory : safeMemories) {
            if (injected.size() >= budget.maxMemories()) {
                break;
            }
            injected.add(truncate(memory));
        }

        int from = Math.max(0, safeHistory.size() - budget.historyDepth());
        List<ChatMessage> recent = safeHistory.subList(from, safeHistory.size());

        if (safeMemories.size() > injected.size() || safeHistory.size() > recent.size()) {
            LOG.debug(
                "Context budget dropped {} memories and {} history messages",
                safeMemories.size() - injected.size(),
                safeHistory.size() - recent.size()
            );
        }
        return new ContextBundle(systemPrompt, injected, recent, userMessage);
    }

    private InjectedMemory truncate(MemoryRecord memory) {
        String content = memory.content();
        if (content.length() <= budget.maxMemoryChars()) {
            return new InjectedMemory(memory.id(), memory.title(), content, false);
        }
        return new InjectedMemory(memory.id(), memory.title(), content.substring(0, budget.maxMemoryChars()), true);
    }
}
