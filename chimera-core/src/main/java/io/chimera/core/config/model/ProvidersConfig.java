package io.chimera.core.config.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProvidersConfig(
    ProviderConfig openai,
    ProviderConfig anthropic,
    ProviderConfig google,
    ProviderConfig deepseek,
    ProviderConfig groq
) {

    public static ProvidersConfig defaults() {
        return new ProvidersConfig(
            ProviderConfig.defaults("https://api.openai.com/v1", 60),
            ProviderConfig.defaults("https://api.anthropic.com/v1", 60),
            ProviderConfig.defaults("https://generativelanguage.googleapis.com/v1beta", 60),
            ProviderConfig.defaults("https://api.deepseek.com", 60),
            ProviderConfig.defaults("https://api.groq.com/openai/v1", 30)
        );
    }

    public Map<String, ProviderConfig> byTag() {
        Map<String, ProviderConfig> tags = new LinkedHashMap<>();
        tags.put("openai", openai);
        tags.put("anthropic", anthropic);
        tags.put("google", google);
        tags.put("deepseek", deepseek);
        tags.put("groq", groq);
        return tags;
    }

    public Optional<ProviderConfig> forTag(String provider) {
        if (provider == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byTag().get(provider.toLowerCase(Locale.ROOT)));
    }
}
