package com.zzf.workspace.core.rag.vector;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Builder;
import lombok.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Client for OpenAI-compatible {@code POST /embeddings} endpoints. Inputs are sent as one
 * batch; the response items are put back in input order by their {@code index}. Failures
 * reach the caller unchanged, with no retry and no fallback.
 */
public final class RemoteEmbeddingService implements EmbeddingService {
    private static final Logger logger = LoggerFactory.getLogger(RemoteEmbeddingService.class);
    private static final int ERROR_BODY_CHARS = 500;

    @Value
    @Builder
    public static class Endpoint {
        URI baseUri;
        String apiKey;
        String model;
        /**
         * Requested and verified vector size; 0 leaves it to the model.
         */
        int dimensions;
        @Builder.Default
        Duration timeout = Duration.ofSeconds(15);

        URI embeddingsUri() {
            String base = baseUri == null ? "" : baseUri.toString();
            return URI.create(base.endsWith("/") ? base + "embeddings" : base + "/embeddings");
        }
    }

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final Endpoint endpoint;

    public RemoteEmbeddingService(HttpClient http, ObjectMapper mapper, Endpoint endpoint) {
        this.http = http;
        this.mapper = mapper;
        this.endpoint = endpoint;
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text == null ? "" : text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        long t0 = System.nanoTime();
        JsonNode body = post(request(texts));
        List<float[]> vectors = parse(body, texts.size());
        if (endpoint.getDimensions() > 0) {
            for (float[] v : vectors) {
                if (v.length != endpoint.getDimensions()) {
                    throw new IllegalStateException("embedding dims mismatch expected=" + endpoint.getDimensions() + " actual=" + v.length);
                }
            }
        }
        JsonNode usage = body.path("usage");
        logger.debug("embed.remote.ok model={} inputs={} promptTokens={} totalTokens={} tookMs={}",
                endpoint.getModel(), texts.size(),
                usage.path("prompt_tokens").asInt(-1), usage.path("total_tokens").asInt(-1),
                (System.nanoTime() - t0) / 1_000_000L);
        return vectors;
    }

    private ObjectNode request(List<String> texts) {
        ObjectNode payload = mapper.createObjectNode();
        payload.put("model", endpoint.getModel());
        payload.put("encoding_format", "float");
        if (endpoint.getDimensions() > 0) {
            payload.put("dimensions", endpoint.getDimensions());
        }
        ArrayNode input = payload.putArray("input");
        texts.forEach(text -> input.add(text == null ? "" : text));
        return payload;
    }

    private JsonNode post(ObjectNode payload) {
        try {
            HttpRequest req = HttpRequest.newBuilder(endpoint.embeddingsUri())
                    .timeout(endpoint.getTimeout())
                    .header("Content-Type", "application/json")
                    .header("Authorization", "Bearer " + endpoint.getApiKey())
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload), StandardCharsets.UTF_8))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (resp.statusCode() / 100 != 2) {
                throw new IllegalStateException("embedding http " + resp.statusCode() + ": " + abbreviate(resp.body()));
            }
            return mapper.readTree(resp.body());
        } catch (IOException e) {
            logger.warn("embed.remote.fail model={} inputs={} err={}", endpoint.getModel(), payload.path("input").size(), e.toString());
            throw new IllegalStateException("embedding request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("embedding request interrupted", e);
        }
    }

    /**
     * Vectors of a response, ordered by {@code index} (array position when absent).
     */
    static List<float[]> parse(JsonNode root, int expectedCount) {
        JsonNode data = root.path("data");
        if (!data.isArray() || data.size() != expectedCount) {
            throw new IllegalStateException("embedding response has " + (data.isArray() ? data.size() : 0)
                    + " items, expected " + expectedCount);
        }
        float[][] ordered = new float[expectedCount][];
        for (int pos = 0; pos < data.size(); pos++) {
            JsonNode item = data.get(pos);
            int index = item.path("index").asInt(pos);
            if (index < 0 || index >= expectedCount || ordered[index] != null) {
                throw new IllegalStateException("embedding response has a bad index: " + index);
            }
            JsonNode embedding = item.path("embedding");
            if (!embedding.isArray() || embedding.size() == 0) {
                throw new IllegalStateException("embedding response missing embedding at index " + index);
            }
            float[] v = new float[embedding.size()];
            for (int i = 0; i < v.length; i++) {
                v[i] = (float) embedding.get(i).asDouble();
            }
            ordered[index] = v;
        }
        return new ArrayList<>(Arrays.asList(ordered));
    }

    private static String abbreviate(String s) {
        if (s == null) {
            return "";
        }
        return s.length() <= ERROR_BODY_CHARS ? s : s.substring(0, ERROR_BODY_CHARS);
    }
}
