package io.chimera.core.provider;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public final class ProviderRegistry {
    private final Map<String, LlmProvider> providers;
    private final LlmProvider fallback;

    private ProviderRegistry(Map<String, LlmProvider> providers) {
        this.providers = Map.copyOf(providers);
        this.fallback = providers.get(normalize(EchoProvider.NAME));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<LlmProvider> find(String tag) {
        return Optional.ofNullable(providers.get(normalize(tag)));
    }

    public LlmProvider resolve(String tag) {
        return find(tag).orElse(fallback);
    }

    public List<String> names() {
        return providers.values().stream().map(LlmProvider::name).sorted().toList();
    }

    static String normalize(String tag) {
        return tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    public static final class Builder {
        private final Map<String, LlmProvider> providers = new LinkedHashMap<>();

        private Builder() {
            register(new EchoProvider());
        }

        public Builder register(LlmProvider provider) {
            Objects.requireNonNull(provider, "provider must not be null");
            providers.put(normalize(provider.name()), provider);
            return this;
        }

        public ProviderRegistry build() {
            return new ProviderRegistry(providers);
        }
    }
}
