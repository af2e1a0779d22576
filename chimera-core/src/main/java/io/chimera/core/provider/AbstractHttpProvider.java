package io.chimera.core.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import io.chimera.core.context.ContextBundle;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public abstract class AbstractHttpProvider implements LlmProvider {
    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final Duration MAX_CONNECT_TIMEOUT = Duration.ofSeconds(20);
    private static final Duration MAX_VERIFY_TIMEOUT = Duration.ofSeconds(10);

    private final String name;
    private final HttpUrl apiBase;
    private final OkHttpClient client;
    private final OkHttpClient verifyClient;
    protected final ObjectMapper mapper;
    protected final ResponseNormalizer normalizer;

    protected AbstractHttpProvider(String name, String apiBase, Duration timeout) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.apiBase = HttpUrl.get(Objects.requireNonNull(apiBase, "apiBase must not be null"));
        Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        Duration connectTimeout = min(timeout, MAX_CONNECT_TIMEOUT);
        this.client = new OkHttpClient.Builder()
            .callTimeout(timeout)
            .connectTimeout(connectTimeout)
            .readTimeout(timeout)
            .writeTimeout(connectTimeout)
            .retryOnConnectionFailure(false)
            .build();
        Duration verifyTimeout = min(timeout, MAX_VERIFY_TIMEOUT);
        this.verifyClient = client.newBuilder()
            .callTimeout(verifyTimeout)
            .connectTimeout(verifyTimeout)
            .readTimeout(verifyTimeout)
            .writeTimeout(verifyTimeout)
            .build();
        this.mapper = new ObjectMapper();
        this.normalizer = new ResponseNormalizer(mapper);
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final DispatchResult chat(String model, ContextBundle bundle, String credential) {
        Request request;
        try {
            request = buildRequest(model, bundle, credential);
        } catch (JsonProcessingException e) {
            return DispatchResult.failed(name, model, ErrorKind.INTERNAL_ERROR, "Could not encode request: " + e.getOriginalMessage());
        }

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (!response.isSuccessful()) {
                if (rejectsCredential(response.code(), raw)) {
                    return normalizer.authError(name, model, response.code(), raw);
                }
                return upstreamFailure(model, response.code(), raw);
            }
            JsonNode root = raw.isBlank() ? MissingNode.getInstance() : mapper.readTree(raw);
            return parseSuccess(model, root);
        } catch (JsonProcessingException e) {
            return normalizer.upstreamError(name, model, "Malformed response: " + e.getOriginalMessage());
        } catch (IOException e) {
            return normalizer.transportError(name, model, e);
        }
    }

    @Override
    public final ConnectionCheck verify(String credential) {
        Request request;
        try {
            request = buildVerifyRequest(credential);
        } catch (JsonProcessingException e) {
            return ConnectionCheck.failed(name, ErrorKind.INTERNAL_ERROR, "Could not encode request: " + e.getOriginalMessage());
        }

        try (Response response = verifyClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String raw = body == null ? "" : body.string();
            if (response.isSuccessful()) {
                return ConnectionCheck.connected(name);
            }
            if (rejectsCredential(response.code(), raw)) {
                return ConnectionCheck.failed(name, ErrorKind.AUTH_ERROR, "Invalid API key");
            }
            return ConnectionCheck.failed(name, ErrorKind.UPSTREAM_ERROR, "API returned status " + response.code());
        } catch (InterruptedIOException e) {
            return ConnectionCheck.failed(name, ErrorKind.TIMEOUT, "Connection timeout - API did not respond in time");
        } catch (IOException e) {
            return ConnectionCheck.failed(name, ErrorKind.TRANSPORT_ERROR, "Connection error - unable to reach API");
        }
    }

    protected HttpUrl apiBase() {
        return apiBase;
    }

    protected abstract Request buildRequest(String model, ContextBundle bundle, String credential)
        throws JsonProcessingException;

    protected abstract Request buildVerifyRequest(String credential) throws JsonProcessingException;

    protected abstract DispatchResult parseSuccess(String model, JsonNode root);

    protected boolean rejectsCredential(int httpStatus, String body) {
        return httpStatus == 401 || httpStatus == 403;
    }

    protected DispatchResult upstreamFailure(String model, int httpStatus, String body) {
        return normalizer.upstreamError(name, model, httpStatus, body);
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) < 0 ? a : b;
    }
}
