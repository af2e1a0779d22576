package io.chimera.core.engine;

import io.chimera.core.config.model.ChimeraConfig;
import io.chimera.core.config.model.EngineConfig;
import io.chimera.core.context.ContextAssembler;
import io.chimera.core.context.ContextBudget;
import io.chimera.core.context.ContextBundle;
import io.chimera.core.credential.CredentialStore;
import io.chimera.core.extract.Classification;
import io.chimera.core.extract.HeuristicMemoryExtractor;
import io.chimera.core.extract.MemoryCaptureService;
import io.chimera.core.extract.MemoryExtractor;
import io.chimera.core.memory.MemoryRecord;
import io.chimera.core.memory.MemoryScope;
import io.chimera.core.memory.MemoryStore;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.provider.ConnectionCheck;
import io.chimera.core.provider.DispatchExecutor;
import io.chimera.core.provider.DispatchResult;
import io.chimera.core.provider.ErrorKind;
import io.chimera.core.provider.ModelCatalog;
import io.chimera.core.provider.ProviderModel;
import io.chimera.core.provider.ProviderRegistry;
import io.chimera.core.provider.ProviderRouter;
import io.chimera.core.search.KeywordOverlapScorer;
import io.chimera.core.search.MemorySearchService;
import io.chimera.core.search.ScoredResult;
import io.chimera.core.session.ConversationStore;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ChimeraEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ChimeraEngine.class);

    private final MemorySearchService searchService;
    private final MemoryExtractor extractor;
    private final ContextAssembler contextAssembler;
    private final ModelCatalog catalog;
    private final ProviderRouter router;
    private final DispatchExecutor executor;
    private final CredentialStore credentials;
    private final ConversationStore conversationStore;
    private final MemoryCaptureService captureService;
    private final int defaultTopK;

    public ChimeraEngine(
        MemorySearchService searchService,
        MemoryExtractor extractor,
        ContextAssembler contextAssembler,
        ModelCatalog catalog,
        DispatchExecutor executor,
        CredentialStore credentials,
        ConversationStore conversationStore,
        MemoryCaptureService captureService,
        int defaultTopK
    ) {
        this.searchService = Objects.requireNonNull(searchService, "searchService must not be null");
        this.extractor = Objects.requireNonNull(extractor, "extractor must not be null");
        this.contextAssembler = Objects.requireNonNull(contextAssembler, "contextAssembler must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.router = new ProviderRouter(catalog);
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.conversationStore = Objects.requireNonNull(conversationStore, "conversationStore must not be null");
        this.captureService = Objects.requireNonNull(captureService, "captureService must not be null");
        this.defaultTopK = Math.max(0, defaultTopK);
    }

    public static ChimeraEngine create(
        ChimeraConfig config,
        MemoryStore memoryStore,
        ConversationStore conversationStore,
        ProviderRegistry registry,
        CredentialStore credentials
    ) {
        EngineConfig engine = config.engine();
        MemoryExtractor extractor = new HeuristicMemoryExtractor();
        return new ChimeraEngine(
            new MemorySearchService(memoryStore, new KeywordOverlapScorer(), engine.searchPoolSize()),
            extractor,
            new ContextAssembler(conversationStore, engine.systemPrompt(), ContextBudget.from(engine)),
            ModelCatalog.defaults(),
            new DispatchExecutor(registry),
            credentials,
            conversationStore,
            new MemoryCaptureService(extractor, memoryStore),
            engine.defaultTopK()
        );
    }

    public List<ScoredResult> search(String query, MemoryScope scope, int topK) {
        return searchService.search(query, topK, scope);
    }

    public List<ScoredResult> search(String query, MemoryScope scope) {
        return search(query, scope, defaultTopK);
    }

    public Classification classify(String text) {
        return extractor.analyze(text == null ? "" : text);
    }

    public ContextBundle buildContext(String conversationId, String message) throws IOException {
        return contextAssembler.build(conversationId, message);
    }

    public ProviderModel resolveProvider(String modelIdentifier) {
        return router.resolve(modelIdentifier);
    }

    public List<ProviderModel> models() {
        return catalog.supportedModels();
    }

    public List<ProviderModel> models(String provider) {
        return catalog.modelsFor(provider);
    }

    public DispatchResult dispatch(String modelIdentifier, ContextBundle bundle, String credential) {
        return dispatch(resolveProvider(modelIdentifier), bundle, credential);
    }

    public DispatchResult dispatch(ProviderModel target, ContextBundle bundle, String credential) {
        return executor.dispatch(target, bundle, credential);
    }

    public List<String> providers() {
        return executor.providerNames();
    }

    public ConnectionCheck verifyProvider(String account, String provider) {
        String credential = credentials.credentialFor(account, provider == null ? null : provider.trim()).orElse(null);
        return executor.verify(provider, credential);
    }

    // Context is built before the new message is appended so it is not sent twice.
    public DispatchResult respond(
        String account,
        String workspaceId,
        String conversationId,
        String modelIdentifier,
        String message
    ) {
        Objects.requireNonNull(conversationId, "conversationId must not be null");
        ProviderModel target = resolveProvider(modelIdentifier);
        ContextBundle bundle;
        try {
            bundle = buildContext(conversationId, message);
            conversationStore.append(conversationId, ChatMessage.user(message));
        } catch (IOException e) {
            LOG.error("Failed to prepare context for conversation {}", conversationId, e);
            return DispatchResult.failed(
                target.provider(),
                target.canonicalModel(),
                ErrorKind.INTERNAL_ERROR,
                "Failed to load conversation: " + e.getMessage()
            );
        }

        String credential = credentials.credentialFor(account, target.provider()).orElse(null);
        DispatchResult result = dispatch(target, bundle, credential);
        if (!result.succeeded()) {
            return result;
        }

        try {
            conversationStore.append(conversationId, ChatMessage.assistant(result.reply()));
            List<MemoryRecord> captured = captureService.capture(new MemoryCaptureService.Exchange(
                workspaceId,
                conversationId,
                message,
                result.reply(),
                result.canonicalModel()
            ));
            if (!captured.isEmpty()) {
                LOG.info("Captured {} memories from conversation {}", captured.size(), conversationId);
            }
        } catch (IOException e) {
            LOG.warn("Failed to record exchange for conversation {}: {}", conversationId, e.getMessage());
        }
        return result;
    }
}
