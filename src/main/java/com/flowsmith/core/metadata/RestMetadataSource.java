package com.flowsmith.core.metadata;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowsmith.core.model.DataSourceMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Asks the connector service for a sample of one data source.
 *
 * <p>POSTs {@code {plugin_key, action, parameters, sample_size}} to
 * {@code <base-url>/metadata/sample} and expects a {@link DataSourceMetadata}
 * document back. The call races the configured timeout; a late response is
 * discarded and the request cancelled.
 */
public class RestMetadataSource implements MetadataSource {

    private static final Logger log = LoggerFactory.getLogger(RestMetadataSource.class);

    private final MetadataProperties properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public RestMetadataSource(MetadataProperties properties) {
        this(properties, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build());
    }

    RestMetadataSource(MetadataProperties properties, HttpClient httpClient) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public boolean isEnabled() {
        return true;
    }

    @Override
    public Optional<DataSourceMetadata> sample(String pluginKey, String action, Map<String, Object> parameters) {
        try {
            return Optional.of(fetch(pluginKey, action, parameters));
        } catch (MetadataUnavailableException e) {
            log.warn("Sampling {}.{} failed: {}", pluginKey, action, e.getMessage());
            return Optional.empty();
        }
    }

    DataSourceMetadata fetch(String pluginKey, String action, Map<String, Object> parameters) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("plugin_key", pluginKey);
        body.put("action", action);
        body.put("parameters", parameters == null ? Map.of() : parameters);
        body.put("sample_size", properties.getSampleSize());

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(stripTrailingSlash(properties.getBaseUrl()) + "/metadata/sample"))
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)))
                    .build();
        } catch (IOException e) {
            throw new MetadataUnavailableException("Could not encode sampling request", e);
        }

        Duration timeout = properties.getTimeout();
        CompletableFuture<HttpResponse<String>> call =
                httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> response;
        try {
            response = call.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new MetadataUnavailableException("Sampling timed out after " + timeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new MetadataUnavailableException("Sampling interrupted", e);
        } catch (ExecutionException e) {
            throw new MetadataUnavailableException("Sampling request failed: " + e.getCause().getMessage(), e.getCause());
        }

        if (response.statusCode() >= 400) {
            throw new MetadataUnavailableException("Connector returned HTTP " + response.statusCode());
        }
        try {
            DataSourceMetadata metadata = objectMapper.readValue(response.body(), DataSourceMetadata.class);
            log.info("Sampled {}.{}: {} headers, {} rows", pluginKey, action,
                    metadata.effectiveHeaders().size(), metadata.sampleRows().size());
            return metadata.pluginKey() == null
                    ? new DataSourceMetadata(metadata.type(), metadata.headers(), metadata.fields(),
                            metadata.sampleRows(), metadata.rowCount(), pluginKey)
                    : metadata;
        } catch (IOException e) {
            throw new MetadataUnavailableException("Connector returned unreadable metadata", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
