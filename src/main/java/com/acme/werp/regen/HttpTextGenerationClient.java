package com.acme.werp.regen;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/** POSTs {"prompt": ...} and reads the reply's "text" field, or the raw body when it has none. */
public class HttpTextGenerationClient implements TextGenerationClient {
    private static final Logger logger = LoggerFactory.getLogger(HttpTextGenerationClient.class);

    private final HttpClient httpClient;
    private final URI endpoint;
    private final Duration timeout;
    private final ObjectMapper mapper;

    public HttpTextGenerationClient(URI endpoint, Duration timeout, ObjectMapper mapper) {
        this.endpoint = endpoint;
        this.timeout = timeout;
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder().connectTimeout(timeout).build();
    }

    @Override
    public String generate(String prompt) throws RegenerationException {
        String payload;
        try { payload = mapper.writeValueAsString(Map.of("prompt", prompt)); }
        catch (JsonProcessingException e) { throw new RegenerationException("Cannot encode prompt", e); }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(payload))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() >= 400) {
                logger.warn("Generation request failed status={} body={}", response.statusCode(), response.body());
                throw new RegenerationException("Generation service returned HTTP " + response.statusCode());
            }
            return textOf(response.body());
        } catch (IOException e) {
            throw new RegenerationException("Generation service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RegenerationException("Interrupted while waiting for generation service", e);
        }
    }

    String textOf(String body) {
        try {
            JsonNode n = mapper.readTree(body);
            if (n != null && n.isObject() && n.path("text").isTextual()) return n.get("text").asText();
        } catch (JsonProcessingException e) {
            logger.debug("Reply is not a JSON envelope; using raw body");
        }
        return body;
    }
}
