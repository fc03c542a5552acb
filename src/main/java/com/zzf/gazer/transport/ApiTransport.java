package com.zzf.gazer.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.gazer.util.JsonUtils;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * Thin HTTP wrapper shared by the provider clients: resolves endpoints against the base URL,
 * adds bearer auth and JSON headers, and logs outgoing bodies.
 */
@Slf4j
public class ApiTransport {

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;

    public ApiTransport(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String apiKey, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl == null ? "" : baseUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
    }

    /**
     * Sends the request and returns the response with its body unread. The caller owns the body stream.
     */
    public HttpResponse<InputStream> send(String method, String endpoint, Object body, Map<String, String> headers)
            throws IOException, InterruptedException {
        String json = body == null ? null : objectMapper.writeValueAsString(body);
        URI uri = resolve(endpoint);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", "application/json");
        if (requestTimeout != null) {
            builder.timeout(requestTimeout);
        }
        if (apiKey != null && !apiKey.isEmpty()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        if (headers != null) {
            headers.forEach(builder::setHeader);
        }
        HttpRequest.BodyPublisher publisher = json == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(json);
        builder.method(method, publisher);

        logRequest(method, uri, json);
        return httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
    }

    /**
     * Absolute URLs pass through; anything else is appended to the base URL.
     */
    public URI resolve(String endpoint) {
        if (endpoint.startsWith("http://") || endpoint.startsWith("https://") || baseUrl.isEmpty()) {
            return URI.create(endpoint);
        }
        String base = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        String path = endpoint.startsWith("/") ? endpoint.substring(1) : endpoint;
        return URI.create(base + "/" + path);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    void logRequest(String method, URI uri, String json) {
        if (!log.isDebugEnabled()) {
            return;
        }
        log.debug("HTTP request {}", describeRequest(method, uri, json));
    }

    String describeRequest(String method, URI uri, String json) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("url", uri.toString());
        entry.put("method", method);
        if (json != null && !json.isEmpty()) {
            try {
                JsonNode parsed = objectMapper.readTree(json);
                JsonUtils.truncateLargeFields(parsed);
                entry.set("body", parsed);
            } catch (JsonProcessingException e) {
                entry.put("body", JsonUtils.truncateForLog(json, JsonUtils.MAX_LOGGED_FIELD_LENGTH));
            }
        }
        return entry.toString();
    }
}
