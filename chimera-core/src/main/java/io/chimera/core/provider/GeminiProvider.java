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
import okhttp3.HttpUrl;
import okhttp3.Request;
import okhttp3.RequestBody;

public final class GeminiProvider extends AbstractHttpProvider {
    static final double TEMPERATURE = 0.7;
    static final int MAX_OUTPUT_TOKENS = 2000;
    static final String INVALID_KEY_REASON = "API_KEY_INVALID";

    public GeminiProvider(String apiBase, Duration timeout) {
        super("google", apiBase, timeout);
    }

    @Override
    protected Request buildRequest(String model, ContextBundle bundle, String credential)
        throws JsonProcessingException {
        List<Map<String, Object>> contents = new ArrayList<>();
        for (ChatMessage message : bundle.history()) {
            if (message.role() == MessageRole.SYSTEM) {
                continue;
            }
            contents.add(turn(message.role() == MessageRole.USER ? "user" : "model", message.content()));
        }

        // Without earlier turns the system text rides in the single user turn.
        Map<String, Object> payload = new LinkedHashMap<>();
        String system = bundle.systemContent();
        if (contents.isEmpty()) {
            String text = system.isBlank() ? bundle.userMessage() : system + "\n\nUser: " + bundle.userMessage();
            contents.add(turn("user", text));
        } else {
            contents.add(turn("user", bundle.userMessage()));
            if (!system.isBlank()) {
                payload.put("systemInstruction", Map.of("parts", List.of(Map.of("text", system))));
            }
        }
        payload.put("contents", contents);
        payload.put("generationConfig", Map.of("temperature", TEMPERATURE, "maxOutputTokens", MAX_OUTPUT_TOKENS));

        HttpUrl url = apiBase().newBuilder()
            .addPathSegment("models")
            .addPathSegment(model + ":generateContent")
            .addQueryParameter("key", credential)
            .build();
        RequestBody body = RequestBody.create(mapper.writeValueAsString(payload), JSON);
        return new Request.Builder()
            .url(url)
            .post(body)
            .header("Content-Type", "application/json")
            .build();
    }

    @Override
    protected Request buildVerifyRequest(String credential) {
        HttpUrl url = apiBase().newBuilder()
            .addPathSegment("models")
            .addQueryParameter("key", credential)
            .build();
        return new Request.Builder().url(url).get().build();
    }

    @Override
    protected DispatchResult parseSuccess(String model, JsonNode root) {
        StringBuilder reply = new StringBuilder();
        for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
            reply.append(part.path("text").asText(""));
        }
        if (reply.length() == 0) {
            return normalizer.upstreamError(name(), model, "No response generated");
        }
        return normalizer.success(
            name(),
            model,
            reply.toString(),
            root.path("modelVersion").asText(""),
            normalizer.tokens(root.path("usageMetadata").path("totalTokenCount"))
        );
    }

    // Google answers an unknown key with 400 rather than 401.
    @Override
    protected boolean rejectsCredential(int httpStatus, String body) {
        if (super.rejectsCredential(httpStatus, body)) {
            return true;
        }
        return httpStatus == 400 && body != null
            && (body.contains(INVALID_KEY_REASON) || body.contains("API key not valid"));
    }

    @Override
    protected DispatchResult upstreamFailure(String model, int httpStatus, String body) {
        if (httpStatus == 429) {
            return normalizer.upstreamError(name(), model, "Rate limit exceeded");
        }
        return super.upstreamFailure(model, httpStatus, body);
    }

    private static Map<String, Object> turn(String role, String text) {
        Map<String, Object> turn = new LinkedHashMap<>();
        turn.put("role", role);
        turn.put("parts", List.of(Map.of("text", text)));
        return turn;
    }
}
