package com.swipesentinel.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.swipesentinel.util.JsonSupport;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeUnit;

/**
 * Manages all communication with an OpenAI-compatible chat-completions API.
 *
 * Responsibilities:
 *  - Submits request bodies to {@code {base_url}/v1/chat/completions} with bearer auth
 *  - Classifies failures into {@link ModelErrorKind}s
 *  - Retries exactly once, after a fixed backoff, on transient failures
 *    (timeout, connection error, 429 without a quota code, 5xx)
 *  - Extracts the assistant message text and token usage
 *
 * Thread-safe. The OkHttpClient is shared across calls.
 */
public class ModelApiGateway implements ModelClient {

    private static final Logger log = LoggerFactory.getLogger(ModelApiGateway.class);

    static final String COMPLETIONS_PATH = "/v1/chat/completions";
    static final int MAX_ATTEMPTS = 2;
    private static final MediaType JSON_MEDIA_TYPE = MediaType.get("application/json; charset=utf-8");

    private final String       endpoint;
    private final String       apiKey;
    private final long         retryBackoffMs;
    private final boolean      logPrompts;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ModelApiGateway(String baseUrl, String apiKey, int timeoutSeconds, long retryBackoffMs, boolean logPrompts) {
        this.endpoint       = stripTrailingSlash(baseUrl) + COMPLETIONS_PATH;
        this.apiKey         = apiKey;
        this.retryBackoffMs = retryBackoffMs;
        this.logPrompts     = logPrompts;
        this.httpClient = new OkHttpClient.Builder()
            .connectTimeout(10, TimeUnit.SECONDS)
            .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
            .writeTimeout(10, TimeUnit.SECONDS)
            .build();
        this.objectMapper = JsonSupport.compactMapper();
    }

    @Override
    public ModelReply complete(ObjectNode requestBody) {
        String model = requestBody.path("model").asText(null);
        long startMs = System.currentTimeMillis();
        int attempts = 0;

        String body;
        try {
            body = objectMapper.writeValueAsString(requestBody);
        } catch (IOException e) {
            return ModelReply.error(ModelErrorKind.BAD_REQUEST, "Unserialisable request: " + e.getMessage(), model, 0, 0);
        }
        if (logPrompts) log.debug("ModelApiGateway: request\n{}", body);

        ModelCallException last = null;
        while (attempts < MAX_ATTEMPTS) {
            attempts++;
            try {
                String responseBody = post(body);
                long latencyMs = System.currentTimeMillis() - startMs;
                return parseResponse(responseBody, model, latencyMs, attempts);
            } catch (ModelCallException e) {
                last = e;
                if (!e.getKind().isTransient() || attempts >= MAX_ATTEMPTS) break;
                log.warn("ModelApiGateway: attempt {} failed ({}: {}). Retrying in {}ms...",
                    attempts, e.getKind(), e.getMessage(), retryBackoffMs);
                if (!sleep(retryBackoffMs)) {
                    last = new ModelCallException(ModelErrorKind.TRANSPORT, "Interrupted during retry wait");
                    break;
                }
            }
        }

        long latencyMs = System.currentTimeMillis() - startMs;
        log.error("ModelApiGateway: call failed after {} attempt(s), {}ms: {} {}",
            attempts, latencyMs, last.getKind(), last.getMessage());
        return ModelReply.error(last.getKind(), last.getMessage(), model, latencyMs, attempts);
    }

    // ── HTTP Execution ────────────────────────────────────────────────────────

    private String post(String requestBody) throws ModelCallException {
        Request request = new Request.Builder()
            .url(endpoint)
            .addHeader("Authorization", "Bearer " + apiKey)
            .addHeader("Content-Type", "application/json")
            .post(RequestBody.create(requestBody, JSON_MEDIA_TYPE))
            .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (response.isSuccessful()) return body;
            throw classifyHttpError(response.code(), body);
        } catch (SocketTimeoutException e) {
            throw new ModelCallException(ModelErrorKind.TIMEOUT, "Timed out: " + e.getMessage(), e);
        } catch (InterruptedIOException e) {
            throw new ModelCallException(ModelErrorKind.TIMEOUT, "Call interrupted or timed out: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ModelCallException(ModelErrorKind.TRANSPORT, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    static ModelCallException classifyHttpError(int code, String body) {
        String snippet = "HTTP " + code + ": " + body.substring(0, Math.min(200, body.length()));
        if (code == 429) {
            return body.contains("insufficient_quota")
                ? new ModelCallException(ModelErrorKind.QUOTA, snippet)
                : new ModelCallException(ModelErrorKind.RATE_LIMIT, snippet);
        }
        if (code == 401 || code == 403) return new ModelCallException(ModelErrorKind.AUTH, snippet);
        if (code >= 500)                return new ModelCallException(ModelErrorKind.SERVER, snippet);
        return new ModelCallException(ModelErrorKind.BAD_REQUEST, snippet);
    }

    // ── Response Parsing ──────────────────────────────────────────────────────

    private ModelReply parseResponse(String responseBody, String requestedModel, long latencyMs, int attempts) {
        try {
            JsonNode root = objectMapper.readTree(responseBody);
            JsonNode content = root.path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                return ModelReply.error(ModelErrorKind.MALFORMED_RESPONSE,
                    "Missing choices[0].message.content", requestedModel, latencyMs, attempts);
            }

            JsonNode usage = root.path("usage");
            int inputTokens  = usage.path("prompt_tokens").asInt(0);
            int outputTokens = usage.path("completion_tokens").asInt(0);
            String model = root.path("model").asText(requestedModel);

            if (logPrompts) {
                log.debug("ModelApiGateway: response ({}ms, {} tokens)\n{}",
                    latencyMs, inputTokens + outputTokens, content.asText());
            }
            log.info("ModelApiGateway: reply from {} in {}ms, attempts={}, tokens={}/{}",
                model, latencyMs, attempts, inputTokens, outputTokens);
            return ModelReply.success(content.asText(), model, inputTokens, outputTokens, latencyMs, attempts);

        } catch (IOException e) {
            log.error("ModelApiGateway: failed to parse response: {}", e.getMessage());
            log.debug("ModelApiGateway: raw response was: {}",
                responseBody.substring(0, Math.min(500, responseBody.length())));
            return ModelReply.error(ModelErrorKind.MALFORMED_RESPONSE,
                "Non-JSON response body: " + e.getMessage(), requestedModel, latencyMs, attempts);
        }
    }

    /**
     * Parses the first JSON object out of assistant text. Tolerates markdown code
     * fences and leading prose.
     *
     * @throws ModelCallException with {@link ModelErrorKind#MALFORMED_RESPONSE}
     *         when no JSON object can be read
     */
    public static JsonNode extractJsonObject(String text) throws ModelCallException {
        if (text == null || text.isBlank()) {
            throw new ModelCallException(ModelErrorKind.MALFORMED_RESPONSE, "Model response was empty");
        }
        String cleaned = text.trim();
        if (cleaned.startsWith("```")) {
            int firstNewline = cleaned.indexOf('\n');
            int lastFence = cleaned.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                cleaned = cleaned.substring(firstNewline + 1, lastFence).trim();
            }
        }
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new ModelCallException(ModelErrorKind.MALFORMED_RESPONSE, "No JSON object in model response");
        }
        try {
            JsonNode node = JsonSupport.compactMapper().readTree(cleaned.substring(start, end + 1));
            if (!node.isObject()) {
                throw new ModelCallException(ModelErrorKind.MALFORMED_RESPONSE, "Model JSON is not an object");
            }
            return node;
        } catch (IOException e) {
            throw new ModelCallException(ModelErrorKind.MALFORMED_RESPONSE, "Invalid JSON in model response: " + e.getMessage(), e);
        }
    }

    private static boolean sleep(long ms) {
        if (ms <= 0) return true;
        try {
            Thread.sleep(ms);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
