package io.chimera.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ProviderRouterTest {
    private final ProviderRouter router = new ProviderRouter(ModelCatalog.defaults());

    @Test
    void shouldResolveCaseAndPunctuationVariantsToSameModel() {
        ProviderModel exact = router.resolve("gpt-4");

        assertThat(router.resolve("GPT-4")).isEqualTo(exact);
        assertThat(router.resolve("gpt.4")).isEqualTo(exact);
        assertThat(exact.provider()).isEqualTo("openai");
        assertThat(exact.canonicalModel()).isEqualTo("gpt-4");
    }

    @Test
    void shouldStripPublicPrefix() {
        assertThat(router.resolve("model-gpt-4o").canonicalModel()).isEqualTo("gpt-4o");
        assertThat(router.resolve("MODEL-GPT-4O").canonicalModel()).isEqualTo("gpt-4o");
        assertThat(router.resolve("model-claude-35-sonnet"))
            .isEqualTo(ProviderModel.of("claude-3.5-sonnet", "anthropic"));
    }

    @Test
    void shouldRoundTripEveryPublicId() {
        for (ProviderModel model : ModelCatalog.defaults().supportedModels()) {
            assertThat(router.resolve(model.publicId())).isEqualTo(model);
        }
    }

    @Test
    void shouldFallBackToEchoForUnknownOrBlankIdentifiers() {
        ProviderModel unknown = router.resolve("model-mystery-9000");
        assertThat(unknown.provider()).isEqualTo("echo");
        assertThat(unknown.canonicalModel()).isEqualTo("mystery-9000");

        assertThat(router.resolve(null)).isEqualTo(ProviderModel.of("echo", "echo"));
        assertThat(router.resolve("   ")).isEqualTo(ProviderModel.of("echo", "echo"));
    }
}
