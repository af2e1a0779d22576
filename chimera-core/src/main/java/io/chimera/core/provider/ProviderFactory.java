package io.chimera.core.provider;

import io.chimera.core.config.model.ProviderConfig;
import io.chimera.core.config.model.ProvidersConfig;
import java.time.Duration;
import java.util.Objects;

public final class ProviderFactory {
    private static final ProvidersConfig DEFAULTS = ProvidersConfig.defaults();

    private ProviderFactory() {
    }

    public static ProviderRegistry fromConfig(ProvidersConfig providers) {
        Objects.requireNonNull(providers, "providers must not be null");
        return ProviderRegistry.builder()
            .register(new OpenAiCompatProvider("openai", apiBase(providers.openai(), DEFAULTS.openai()), timeout(providers.openai(), DEFAULTS.openai())))
            .register(new AnthropicProvider(apiBase(providers.anthropic(), DEFAULTS.anthropic()), timeout(providers.anthropic(), DEFAULTS.anthropic())))
            .register(new GeminiProvider(apiBase(providers.google(), DEFAULTS.google()), timeout(providers.google(), DEFAULTS.google())))
            .register(new OpenAiCompatProvider("deepseek", apiBase(providers.deepseek(), DEFAULTS.deepseek()), timeout(providers.deepseek(), DEFAULTS.deepseek())))
            .register(new OpenAiCompatProvider("groq", apiBase(providers.groq(), DEFAULTS.groq()), timeout(providers.groq(), DEFAULTS.groq())))
            .build();
    }

    private static String apiBase(ProviderConfig config, ProviderConfig fallback) {
        if (config == null || config.apiBase() == null || config.apiBase().isBlank()) {
            return fallback.apiBase();
        }
        return config.apiBase();
    }

    private static Duration timeout(ProviderConfig config, ProviderConfig fallback) {
        int seconds = config == null || config.timeoutSeconds() <= 0 ? fallback.timeoutSeconds() : config.timeoutSeconds();
        return Duration.ofSeconds(seconds);
    }
}
