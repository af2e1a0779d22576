package io.chimera.core.provider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public final class ModelCatalog {
    public static final String ECHO = "echo";

    private final Map<String, String> providersByModel;

    public ModelCatalog(Map<String, String> providersByModel) {
        Objects.requireNonNull(providersByModel, "providersByModel must not be null");
        this.providersByModel = Collections.unmodifiableMap(new LinkedHashMap<>(providersByModel));
    }

    public static ModelCatalog defaults() {
        Map<String, String> models = new LinkedHashMap<>();
        models.put("gpt-4", "openai");
        models.put("gpt-4-turbo", "openai");
        models.put("gpt-4o", "openai");
        models.put("gpt-3.5-turbo", "openai");

        models.put("claude-3-opus", "anthropic");
        models.put("claude-3-sonnet", "anthropic");
        models.put("claude-3-haiku", "anthropic");
        models.put("claude-3.5-sonnet", "anthropic");

        models.put("gemini-2.0-flash", "google");
        models.put("gemini-2.0-flash-exp", "google");
        models.put("gemini-1.5-flash", "google");
        models.put("gemini-1.5-pro", "google");

        models.put("deepseek-chat", "deepseek");
        models.put("deepseek-coder", "deepseek");

        models.put("llama-3.3-70b-versatile", "groq");
        models.put("llama-3.1-8b-instant", "groq");
        models.put("mixtral-8x7b-32768", "groq");
        models.put("gemma2-9b-it", "groq");

        models.put(ECHO, ECHO);
        return new ModelCatalog(models);
    }

    public List<ProviderModel> supportedModels() {
        return providersByModel.entrySet().stream()
            .map(entry -> ProviderModel.of(entry.getKey(), entry.getValue()))
            .toList();
    }

    public List<ProviderModel> modelsFor(String provider) {
        if (provider == null) {
            return List.of();
        }
        String wanted = provider.toLowerCase(Locale.ROOT);
        return supportedModels().stream()
            .filter(model -> model.provider().equals(wanted))
            .toList();
    }
}
