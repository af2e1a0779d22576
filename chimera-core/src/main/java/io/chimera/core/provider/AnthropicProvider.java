package io.chimera.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.chimera.core.context.ContextBundle;
import io.chimera.core.model.ChatMessage;
import io.chimera.core.model.MessageRole;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import okhttp3.Request;
import okhttp3.RequestBody;

public final class AnthropicProvider extends AbstractHttpProvider {
    static final String API_VERSION = "2023-06-01";
    static final int MAX_TOKENS = 2000;
    static final String VERIFY_MODEL = "claude-3-haiku-20240307";

    // Catalog short names to the dated ids the Messages API accepts.
    private static final Map<String, String> API_MODEL_IDS = Map.of(
        "claude-3.5-sonnet", "claude-3-5-sonnet-20241022",
        "claude-3-opus", "claude-3-opus-20240229",
        "claude-3-sonnet", "claude-3-sonnet-20240229",
        "claude-3-haiku", "claude-3-haiku-20240307"
    );

    public AnthropicProvider(String apiBase, Duration timeout) {
        super("anthropic", apiBase, timeout);
    }

    static String apiModelId(String model) {
        return API_MODEL_IDS.getOrDefault(model, model);
    }

    @Override
    protected Request buildRequest(String model, ContextBundle bundle, String credential)
        throws JsonProcessingException {
        List<Map<String, Object>> messages = new ArrayList<>();
        for (ChatMessage message : bundle.history()) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            messages.add(wireMessage(message.role().wireName(), message.content()));
        }
        messages.add(wireMessage("user", bundle.userMessage()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", apiModelId(model));
        payload.put("max_tokens", MAX_TOKENS);
        payload.put("system", bundle.systemContent());
        payload.put("messages", messages);

        return messagesRequest(payload, credential);
    }

    @Override
    protected Request buildVerifyRequest(String credential) throws JsonProcessingException {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", VERIFY_MODEL);
        payload.put("max_tokens", 1);
        payload.put("messages", List.of(wireMessage("user", "test")));
        return messagesRequest(payload, credential);
    }

    private Request messagesRequest(Map<String, Object> payload, String credential) throws JsonProcessingException {
        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(apiBase().newBuilder().addPathSegment("messages").build())
            .post(body)
            .header("x-api-key", credential)
            .header("anthropic-version", API_VERSION)
            .header("Content-Type", "application/json")
            .build();
    }

    @Override
    protected DispatchResult parseSuccess(String model, JsonNode root) {
        StringBuilder reply = new StringBuilder();
        boolean found = false;
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText("text")) && block.path("text").isTextual()) {
                reply.append(block.path("text").asText());
                found = true;
            }
        }
        if (!found) {
            return normalizer.upstreamError(name(), model, "No response generated");
        }
        JsonNode usage = root.path("usage");
        long tokens = normalizer.tokens(usage.path("input_tokens")) + normalizer.tokens(usage.path("output_tokens"));
        return normalizer.success(name(), model, reply.toString(), root.path("model").asText(""), tokens);
    }

    private static Map<String, Object> wireMessage(String role, String content) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("role", role);
        row.put("content", content);
        return row;
    }
}
