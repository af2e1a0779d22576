package io.chimera.core.context;

import io.chimera.core.model.ChatMessage;
import java.util.ArrayList;
import java.util.List;

public record ContextBundle(
    String systemPrompt,
    List<InjectedMemory> memories,
    List<ChatMessage> history,
    String userMessage
) {
    static final String MEMORIES_HEADER = "=== Injected Context ===";
    static final String MEMORIES_FOOTER = "=== End Context ===";

    public ContextBundle {
        systemPrompt = systemPrompt == null ? "" : systemPrompt;
        memories = memories == null ? List.of() : List.copyOf(memories);
        history = history == null ? List.of() : List.copyOf(history);
        userMessage = userMessage == null ? "" : userMessage;
    }

    public static ContextBundle of(String systemPrompt, String userMessage) {
        return new ContextBundle(systemPrompt, List.of(), List.of(), userMessage);
    }

    public String memoriesBlock() {
        if (memories.isEmpty()) {
            return "";
        }
        StringBuilder block = new StringBuilder("\n\n").append(MEMORIES_HEADER).append('\n');
        for (InjectedMemory memory : memories) {
            block.append(memory.render());
        }
        return block.append('\n').append(MEMORIES_FOOTER).append('\n').toString();
    }

    public String systemContent() {
        return systemPrompt + memoriesBlock();
    }

    public List<ChatMessage> toMessages() {
        List<ChatMessage> messages = new ArrayList<>(history.size() + 2);
        messages.add(ChatMessage.system(systemContent()));
        messages.addAll(history);
        messages.add(ChatMessage.user(userMessage));
        return List.copyOf(messages);
    }
}
