package io.chimera.core.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.util.Objects;

public final class ResponseNormalizer {
    public static final int MAX_DIAGNOSTIC_LENGTH = 200;

    private final ObjectMapper mapper;

    public ResponseNormalizer(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public DispatchResult success(String provider, String requestedModel, String reply, String echoedModel, long tokens) {
        String model = echoedModel == null || echoedModel.isBlank() ? requestedModel : echoedModel;
        return DispatchResult.succeeded(reply, provider, model, tokens);
    }

    public DispatchResult upstreamError(String provider, String model, int httpStatus, String body) {
        return DispatchResult.failed(provider, model, ErrorKind.UPSTREAM_ERROR, diagnostic(body, httpStatus));
    }

    public DispatchResult authError(String provider, String model, int httpStatus, String body) {
        return DispatchResult.failed(provider, model, ErrorKind.AUTH_ERROR, diagnostic(body, httpStatus));
    }

    public DispatchResult upstreamError(String provider, String model, String message) {
        return DispatchResult.failed(provider, model, ErrorKind.UPSTREAM_ERROR, truncate(message, MAX_DIAGNOSTIC_LENGTH));
    }

    public DispatchResult transportError(String provider, String model, IOException error) {
        if (error instanceof InterruptedIOException) {
            return DispatchResult.failed(provider, model, ErrorKind.TIMEOUT, "Request timeout");
        }
        String message = error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
        return DispatchResult.failed(provider, model, ErrorKind.TRANSPORT_ERROR, truncate(message, MAX_DIAGNOSTIC_LENGTH));
    }

    public String diagnostic(String body, int httpStatus) {
        String message = extractErrorMessage(body);
        if (message.isBlank()) {
            message = body == null ? "" : body.trim();
        }
        if (message.isBlank()) {
            message = "HTTP " + httpStatus;
        }
        return truncate(message, MAX_DIAGNOSTIC_LENGTH);
    }

    public long tokens(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || !node.canConvertToLong()) {
            return 0;
        }
        return Math.max(0, node.asLong());
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private String extractErrorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode root = mapper.readTree(body);
            JsonNode error = root.path("error");
            if (error.isTextual()) {
                return error.asText("");
            }
            return error.path("message").asText("");
        } catch (IOException notJson) {
            return "";
        }
    }
}
