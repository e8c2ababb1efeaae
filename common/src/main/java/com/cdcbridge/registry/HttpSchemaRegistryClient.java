package com.cdcbridge.registry;

import com.cdcbridge.config.SchemaRegistryConfig;
import com.cdcbridge.error.SchemaResolutionException;
import com.cdcbridge.error.TransientIOException;
import com.cdcbridge.retry.Retrier;
import com.cdcbridge.retry.RetryPolicy;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Schema registry client speaking the Confluent REST convention:
 * {@code GET {url}/schemas/ids/{id}} answering {@code {"schema": "..."}}.
 *
 * <p>Connection failures, HTTP 5xx and 429 are retried with backoff. HTTP 404 means the id
 * was never registered and fails immediately with {@link SchemaResolutionException}.</p>
 */
@Slf4j
public class HttpSchemaRegistryClient implements SchemaRegistryClient {

    private final String baseUrl;
    private final Duration requestTimeout;
    private final Retrier retrier;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public HttpSchemaRegistryClient(SchemaRegistryConfig config, RetryPolicy retryPolicy) {
        this(config, new Retrier(retryPolicy));
    }

    public HttpSchemaRegistryClient(SchemaRegistryConfig config, Retrier retrier) {
        this.baseUrl = stripTrailingSlash(config.getUrl());
        this.requestTimeout = Duration.ofMillis(config.getRequestTimeoutMs());
        this.retrier = retrier;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .build();
        log.info("Schema registry client → {}", baseUrl);
    }

    @Override
    public String fetchSchema(int schemaId) {
        return retrier.call(
                "Schema lookup id=" + schemaId,
                () -> fetchOnce(schemaId),
                e -> e instanceof TransientIOException,
                e -> e instanceof RuntimeException
                        ? (RuntimeException) e
                        : new TransientIOException("Schema lookup failed for id=" + schemaId, e));
    }

    private String fetchOnce(int schemaId) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/schemas/ids/" + schemaId))
                .header("Accept", "application/vnd.schemaregistry.v1+json, application/json")
                .timeout(requestTimeout)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientIOException("Schema registry unreachable at " + baseUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientIOException("Interrupted while fetching schema id=" + schemaId, e);
        }

        int status = response.statusCode();
        if (status == 404) {
            throw new SchemaResolutionException(schemaId,
                    "Schema id " + schemaId + " is not registered: " + response.body());
        }
        if (status == 429 || status >= 500) {
            throw new TransientIOException("Schema registry returned status=" + status
                    + " for id=" + schemaId);
        }
        if (status < 200 || status >= 300) {
            throw new SchemaResolutionException(schemaId,
                    "Schema registry rejected lookup of id=" + schemaId + " status=" + status
                            + " body=" + response.body());
        }

        try {
            JsonNode body = objectMapper.readTree(response.body());
            JsonNode schema = body.get("schema");
            if (schema == null || !schema.isTextual()) {
                throw new SchemaResolutionException(schemaId,
                        "Registry response for id=" + schemaId + " has no schema");
            }
            return schema.asText();
        } catch (IOException e) {
            throw new SchemaResolutionException(schemaId,
                    "Unparseable registry response for id=" + schemaId, e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
