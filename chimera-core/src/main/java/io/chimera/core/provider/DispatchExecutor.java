package io.chimera.core.provider;

import io.chimera.core.context.ContextBundle;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class DispatchExecutor {
    private static final Logger LOG = LoggerFactory.getLogger(DispatchExecutor.class);

    private final ProviderRegistry registry;

    public DispatchExecutor(ProviderRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    public DispatchResult dispatch(ProviderModel target, ContextBundle bundle, String credential) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(bundle, "bundle must not be null");

        LlmProvider provider = registry.resolve(target.provider());
        String model = target.canonicalModel();
        Call call = new Call(provider.name(), model);

        if (provider.requiresCredential() && (credential == null || credential.isBlank())) {
            LOG.warn("No credential for provider {}; skipping dispatch of model {}", provider.name(), model);
            return call.finish(DispatchResult.failed(
                provider.name(),
                model,
                ErrorKind.AUTH_ERROR,
                "No API key configured for provider " + provider.name()
            ));
        }

        call.moveTo(DispatchState.IN_FLIGHT);
        DispatchResult result;
        try {
            result = provider.chat(model, bundle, credential);
            if (result == null) {
                throw new IllegalStateException("provider " + provider.name() + " returned no result");
            }
        } catch (RuntimeException e) {
            LOG.error("Provider {} failed internally for model {}", provider.name(), model, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            result = DispatchResult.failed(
                provider.name(),
                model,
                ErrorKind.INTERNAL_ERROR,
                ResponseNormalizer.truncate(message, ResponseNormalizer.MAX_DIAGNOSTIC_LENGTH)
            );
        }
        if (!result.succeeded()) {
            LOG.warn("Dispatch to {} ({}) failed: {} {}", provider.name(), model, result.errorKind(), result.diagnostic());
        } else {
            LOG.debug("Dispatch to {} ({}) succeeded, tokens={}", provider.name(), model, result.tokenUsage());
        }
        return call.finish(result);
    }

    public ConnectionCheck verify(String providerTag, String credential) {
        LlmProvider provider = registry.find(providerTag)
            .orElseThrow(() -> new IllegalArgumentException("Unknown provider: " + providerTag));
        if (provider.requiresCredential() && (credential == null || credential.isBlank())) {
            return ConnectionCheck.failed(provider.name(), ErrorKind.AUTH_ERROR, "No API key configured");
        }
        ConnectionCheck check;
        try {
            check = provider.verify(credential);
        } catch (RuntimeException e) {
            LOG.error("Provider {} failed internally while verifying its credential", provider.name(), e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            return ConnectionCheck.failed(provider.name(), ErrorKind.INTERNAL_ERROR, message);
        }
        if (!check.connected()) {
            LOG.warn("Connection check for {} failed: {} {}", provider.name(), check.errorKind(), check.message());
        }
        return check;
    }

    public List<String> providerNames() {
        return registry.names();
    }

    private static final class Call {
        private final String provider;
        private final String model;
        private DispatchState state = DispatchState.NOT_STARTED;

        private Call(String provider, String model) {
            this.provider = provider;
            this.model = model;
        }

        void moveTo(DispatchState next) {
            if (!state.canMoveTo(next)) {
                throw new IllegalStateException(
                    "dispatch " + provider + "/" + model + " cannot move from " + state + " to " + next
                );
            }
            state = next;
        }

        DispatchResult finish(DispatchResult result) {
            moveTo(result.succeeded() ? DispatchState.SUCCEEDED : DispatchState.FAILED);
            return result;
        }
    }
}
