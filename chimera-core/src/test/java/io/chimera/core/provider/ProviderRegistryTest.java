package io.chimera.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import io.chimera.core.config.model.ProviderConfig;
import io.chimera.core.config.model.ProvidersConfig;
import io.chimera.core.context.ContextBundle;
import org.junit.jupiter.api.Test;

class ProviderRegistryTest {

    @Test
    void shouldFindProvidersIgnoringCaseAndSeparators() {
        LlmProvider custom = new NamedProvider("local_llm");
        ProviderRegistry registry = ProviderRegistry.builder().register(custom).build();

        assertThat(registry.find("LOCAL-LLM")).contains(custom);
        assertThat(registry.find("local_llm")).contains(custom);
        assertThat(registry.find("other")).isEmpty();
        assertThat(registry.resolve("other").name()).isEqualTo("echo");
        assertThat(registry.names()).containsExactly("echo", "local_llm");
    }

    @Test
    void shouldRegisterEveryConfiguredProviderTag() {
        ProvidersConfig defaults = ProvidersConfig.defaults();
        ProvidersConfig providers = new ProvidersConfig(
            defaults.openai(),
            defaults.anthropic(),
            new ProviderConfig("g-key", "", 0),
            defaults.deepseek(),
            defaults.groq()
        );

        ProviderRegistry registry = ProviderFactory.fromConfig(providers);

        assertThat(registry.names()).containsExactly("anthropic", "deepseek", "echo", "google", "groq", "openai");
        assertThat(registry.resolve("google")).isInstanceOf(GeminiProvider.class);
        assertThat(registry.resolve("groq")).isInstanceOf(OpenAiCompatProvider.class);
        assertThat(registry.resolve("anthropic").requiresCredential()).isTrue();
        assertThat(registry.resolve("echo").requiresCredential()).isFalse();
    }

    private record NamedProvider(String name) implements LlmProvider {
        @Override
        public DispatchResult chat(String model, ContextBundle bundle, String credential) {
            return DispatchResult.succeeded("ok", name, model, 0);
        }
    }
}
