package io.chimera.core.extract;

import io.chimera.core.memory.MemoryRecord;
import io.chimera.core.memory.MemoryStore;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MemoryCaptureService {
    private static final Logger LOG = LoggerFactory.getLogger(MemoryCaptureService.class);
    private static final int FACT_TITLE_LENGTH = 50;
    private static final int EXCHANGE_TITLE_LENGTH = 40;

    private final MemoryExtractor extractor;
    private final MemoryStore memoryStore;
    private final Clock clock;

    public MemoryCaptureService(MemoryExtractor extractor, MemoryStore memoryStore) {
        this(extractor, memoryStore, Clock.systemUTC());
    }

    public MemoryCaptureService(MemoryExtractor extractor, MemoryStore memoryStore, Clock clock) {
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.memoryStore = Objects.requireNonNull(memoryStore, "memoryStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public List<MemoryRecord> capture(Exchange exchange) throws IOException {
        Objects.requireNonNull(exchange, "exchange must not be null");
        Importance importance = extractor.classify(exchange.userMessage());
        if (!extractor.shouldPersist(importance)) {
            return List.of();
        }

        Instant now = clock.instant();
        List<MemoryRecord> created = new ArrayList<>();
        for (ExtractionCandidate fact : extractor.extractFacts(exchange.userMessage())) {
            Map<String, Object> metadata = baseMetadata(exchange, "user", importance);
            metadata.put("importance_score", extractor.importanceScore(fact.text()));
            metadata.put("extraction_type", fact.provenance().extractionType());
            metadata.put("confidence", fact.confidence().name().toLowerCase(Locale.ROOT));

            created.add(memoryStore.save(MemoryRecord.create(
                exchange.workspaceId(),
                abbreviate(fact.text(), FACT_TITLE_LENGTH),
                fact.text(),
                extractor.generateTags(fact.text()),
                metadata,
                now
            )));
        }

        if (importance == Importance.HIGH) {
            List<String> tags = new ArrayList<>(extractor.generateTags(exchange.userMessage() + " " + exchange.reply()));
            tags.add("full-exchange");
            tags.add("high-importance");

            created.add(memoryStore.save(MemoryRecord.create(
                exchange.workspaceId(),
                "Important: " + abbreviate(exchange.userMessage(), EXCHANGE_TITLE_LENGTH),
                "User: " + exchange.userMessage() + "\n\nAssistant: " + exchange.reply(),
                tags,
                baseMetadata(exchange, "exchange", importance),
                now
            )));
        }

        LOG.debug("Captured {} memories from conversation {} at importance {}",
            created.size(), exchange.conversationId(), importance.label());
        return List.copyOf(created);
    }

    private Map<String, Object> baseMetadata(Exchange exchange, String source, Importance importance) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", source);
        metadata.put("auto_extracted", true);
        metadata.put("importance", importance.label());
        if (exchange.modelUsed() != null && !exchange.modelUsed().isBlank()) {
            metadata.put("model_used", exchange.modelUsed());
        }
        if (exchange.conversationId() != null) {
            metadata.put("conversation_id", exchange.conversationId());
        }
        return metadata;
    }

    private String abbreviate(String text, int max) {
        if (text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }

    public record Exchange(
        String workspaceId,
        String conversationId,
        String userMessage,
        String reply,
        String modelUsed
    ) {
        public Exchange {
            userMessage = userMessage == null ? "" : userMessage;
            reply = reply == null ? "" : reply;
        }
    }
}
