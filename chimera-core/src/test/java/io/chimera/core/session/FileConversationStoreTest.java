package io.chimera.core.session;

import static org.assertj.core.api.Assertions.assertThat;

import io.chimera.core.memory.FileMemoryStore;
import io.chimera.core.memory.MemoryRecord;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.model.MessageRole;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileConversationStoreTest {
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @TempDir
    Path tempDir;

    private FileMemoryStore memoryStore;
    private FileConversationStore store;

    @BeforeEach
    void setUp() {
        memoryStore = new FileMemoryStore(tempDir.resolve("memories.json"));
        store = new FileConversationStore(tempDir.resolve("conversations.json"), memoryStore);
    }

    @Test
    void shouldReturnNewestMessagesInChronologicalOrder() throws Exception {
        for (int i = 0; i < 4; i++) {
            store.append("conv-1", new ChatMessage(MessageRole.USER, "m" + i, NOW.plusSeconds(i)));
        }
        store.append("conv-2", ChatMessage.user("elsewhere"));

        assertThat(store.history("conv-1", 2)).extracting(ChatMessage::content).containsExactly("m2", "m3");
        assertThat(store.history("conv-1", 10)).hasSize(4);
        assertThat(store.history("conv-1", 0)).isEmpty();
        assertThat(store.history("unknown", 5)).isEmpty();

        FileConversationStore reopened = new FileConversationStore(tempDir.resolve("conversations.json"), memoryStore);
        assertThat(reopened.history("conv-1", 1).get(0).timestamp()).isEqualTo(NOW.plusSeconds(3));
    }

    @Test
    void shouldKeepOneLinkPerConversationAndMemory() throws Exception {
        MemoryRecord memory = memoryStore.save(memory("m1"));

        InjectedMemoryLink first = store.inject("conv", memory.id());
        InjectedMemoryLink second = store.inject("conv", memory.id());

        assertThat(second).isEqualTo(first);
        assertThat(store.links("conv")).hasSize(1);
        assertThat(store.activeInjectedMemories("conv")).containsExactly(memory);
    }

    @Test
    void shouldReactivateDeactivatedLinkOnReinjection() throws Exception {
        MemoryRecord memory = memoryStore.save(memory("m1"));
        store.inject("conv", memory.id());

        assertThat(store.setActive("conv", memory.id(), false)).isTrue();
        assertThat(store.activeInjectedMemories("conv")).isEmpty();

        InjectedMemoryLink reactivated = store.inject("conv", memory.id());

        assertThat(reactivated.active()).isTrue();
        assertThat(store.links("conv")).hasSize(1);
        assertThat(store.activeInjectedMemories("conv")).containsExactly(memory);
    }

    @Test
    void shouldRemoveLinksAndSkipMissingMemories() throws Exception {
        MemoryRecord kept = memoryStore.save(memory("kept"));
        store.inject("conv", kept.id());
        store.inject("conv", "memory-deleted");

        assertThat(store.activeInjectedMemories("conv")).extracting(MemoryRecord::id).containsExactly("kept");
        assertThat(store.remove("conv", "memory-deleted")).isTrue();
        assertThat(store.remove("conv", "memory-deleted")).isFalse();
        assertThat(store.setActive("conv", "memory-deleted", true)).isFalse();
        assertThat(store.links("conv")).extracting(InjectedMemoryLink::memoryId).containsExactly("kept");
    }

    @Test
    void shouldResolveLatestMemoryVersion() throws Exception {
        MemoryRecord original = memoryStore.save(memory("m1"));
        store.inject("conv", original.id());

        MemoryRecord edited = memoryStore.save(original.withContent("edited body", NOW.plusSeconds(60)));

        assertThat(store.activeInjectedMemories("conv")).containsExactly(edited);
    }

    private static MemoryRecord memory(String id) {
        return new MemoryRecord(id, "ws", "Title " + id, "Body " + id, null, List.of(), Map.of(), 1, NOW, NOW);
    }
}
