package io.chimera.core.provider;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chimera.core.context.ContextBundle;
import io.chimera.core.context.InjectedMemory;
import io.chimera.core.model.ChatMessage;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldSendChatCompletionAndParseReply() throws Exception {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {
                  "model": "gpt-4o-2024-08-06",
                  "choices": [
                    { "message": { "role": "assistant", "content": "Use tabs." } }
                  ],
                  "usage": { "prompt_tokens": 30, "completion_tokens": 12, "total_tokens": 42 }
                }
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", server.url("/v1/").toString(), Duration.ofSeconds(5));
        ContextBundle bundle = new ContextBundle(
            "sys",
            List.of(new InjectedMemory("m1", "Coding style", "Prefers tabs", false)),
            List.of(ChatMessage.user("earlier question"), ChatMessage.assistant("earlier answer")),
            "tabs or spaces?"
        );

        DispatchResult result = provider.chat("gpt-4o", bundle, "sk-test");

        assertThat(result.succeeded()).isTrue();
        assertThat(result.reply()).isEqualTo("Use tabs.");
        assertThat(result.tokenUsage()).isEqualTo(42);
        assertThat(result.canonicalModel()).isEqualTo("gpt-4o-2024-08-06");
        assertThat(result.provider()).isEqualTo("openai");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");

        JsonNode body = new ObjectMapper().readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o");
        assertThat(body.path("temperature").asDouble()).isEqualTo(0.7);
        assertThat(body.path("max_tokens").asInt()).isEqualTo(2000);
        JsonNode messages = body.path("messages");
        assertThat(messages).hasSize(4);
        assertThat(messages.path(0).path("role").asText()).isEqualTo("system");
        assertThat(messages.path(0).path("content").asText()).startsWith("sys").contains("[Coding style]", "Prefers tabs");
        assertThat(messages.path(1).path("role").asText()).isEqualTo("user");
        assertThat(messages.path(2).path("role").asText()).isEqualTo("assistant");
        assertThat(messages.path(3).path("content").asText()).isEqualTo("tabs or spaces?");
    }

    @Test
    void shouldFallBackToRequestedModelAndZeroTokens() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("""
                {"choices": [{"message": {"content": "hi"}}]}
                """));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("groq", server.url("/openai/v1").toString(), Duration.ofSeconds(5));

        DispatchResult result = provider.chat("llama-3.1-8b-instant", ContextBundle.of("sys", "hello"), "gsk");

        assertThat(result.canonicalModel()).isEqualTo("llama-3.1-8b-instant");
        assertThat(result.tokenUsage()).isZero();
        assertThat(result.provider()).isEqualTo("groq");
    }

    @Test
    void shouldTreatMissingChoicesAsUpstreamError() {
        server.enqueue(new MockResponse()
            .setHeader("Content-Type", "application/json")
            .setBody("{\"choices\": []}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("deepseek", server.url("/").toString(), Duration.ofSeconds(5));

        DispatchResult result = provider.chat("deepseek-chat", ContextBundle.of("sys", "hello"), "sk-ds");

        assertThat(result.errorKind()).isEqualTo(ErrorKind.UPSTREAM_ERROR);
        assertThat(result.diagnostic()).isEqualTo("No response generated");
    }

    @Test
    void shouldTreatMalformedJsonAsUpstreamError() {
        server.enqueue(new MockResponse().setBody("<html>gateway</html>"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", server.url("/v1/").toString(), Duration.ofSeconds(5));

        DispatchResult result = provider.chat("gpt-4o", ContextBundle.of("sys", "hello"), "sk-test");

        assertThat(result.errorKind()).isEqualTo(ErrorKind.UPSTREAM_ERROR);
        assertThat(result.diagnostic()).startsWith("Malformed response");
    }

    @Test
    void shouldVerifyKeyByListingModels() throws Exception {
        server.enqueue(new MockResponse().setHeader("Content-Type", "application/json").setBody("{\"data\": []}"));
        server.enqueue(new MockResponse().setResponseCode(401).setBody("{\"error\": {\"message\": \"Incorrect API key provided\"}}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", server.url("/v1/").toString(), Duration.ofSeconds(5));

        ConnectionCheck valid = provider.verify("sk-test");
        ConnectionCheck invalid = provider.verify("sk-revoked");

        assertThat(valid.connected()).isTrue();
        assertThat(valid.errorKind()).isNull();
        assertThat(invalid.connected()).isFalse();
        assertThat(invalid.errorKind()).isEqualTo(ErrorKind.AUTH_ERROR);
        assertThat(invalid.message()).isEqualTo("Invalid API key");

        RecordedRequest request = server.takeRequest();
        assertThat(request.getMethod()).isEqualTo("GET");
        assertThat(request.getPath()).isEqualTo("/v1/models");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
    }

    @Test
    void shouldReportVerificationTimeout() {
        server.enqueue(new MockResponse().setHeadersDelay(2, TimeUnit.SECONDS).setBody("{}"));

        OpenAiCompatProvider provider = new OpenAiCompatProvider("groq", server.url("/openai/v1").toString(), Duration.ofMillis(300));

        ConnectionCheck check = provider.verify("gsk-test");

        assertThat(check.errorKind()).isEqualTo(ErrorKind.TIMEOUT);
        assertThat(check.message()).isEqualTo("Connection timeout - API did not respond in time");
    }
}
