package io.chimera.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.chimera.core.context.ContextBundle;
import io.chimera.core.model.ChatMessage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

// Also serves deepseek and groq, which speak the same wire format.
public final class OpenAiCompatProvider extends AbstractHttpProvider {
    static final double TEMPERATURE = 0.7;
    static final int MAX_TOKENS = 2000;

    public OpenAiCompatProvider(String name, String apiBase, Duration timeout) {
        super(name, apiBase, timeout);
    }

    @Override
    protected Request buildRequest(String model, ContextBundle bundle, String credential)
        throws JsonProcessingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("messages", toWireMessages(bundle.toMessages()));
        payload.put("temperature", TEMPERATURE);
        payload.put("max_tokens", MAX_TOKENS);

        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(completionsUrl())
            .post(body)
            .header("Authorization", "Bearer " + credential)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .build();
    }

    @Override
    protected Request buildVerifyRequest(String credential) {
        return new Request.Builder()
            .url(apiBase().newBuilder().addPathSegment("models").build())
            .get()
            .header("Authorization", "Bearer " + credential)
            .header("Accept", "application/json")
            .build();
    }

    @Override
    protected DispatchResult parseSuccess(String model, JsonNode root) {
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual()) {
            return normalizer.upstreamError(name(), model, "No response generated");
        }
        return normalizer.success(
            name(),
            model,
            content.asText(),
            root.path("model").asText(""),
            normalizer.tokens(root.path("usage").path("total_tokens"))
        );
    }

    private HttpUrl completionsUrl() {
        return apiBase().newBuilder()
            .addPathSegment("chat")
            .addPathSegment("completions")
            .build();
    }

    private List<Map<String, Object>> toWireMessages(List<ChatMessage> messages) {
        List<Map<String, Object>> wire = new ArrayList<>();
        for (ChatMessage message : messages) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("role", message.role().wireName());
            row.put("content", message.content());
            wire.add(row);
        }
        return wire;
    }
}
