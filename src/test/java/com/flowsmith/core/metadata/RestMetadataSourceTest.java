package com.flowsmith.core.metadata;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RestMetadataSourceTest {

    private static MetadataProperties properties() {
        var props = new MetadataProperties();
        props.setBaseUrl("http://connector.local/");
        props.setTimeout(Duration.ofMillis(200));
        return props;
    }

    @SuppressWarnings("unchecked")
    private static HttpResponse<String> response(int status, String body) {
        HttpResponse<String> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    @Test
    @DisplayName("posts to /metadata/sample and decodes the connector document")
    void decodesSample() {
        var client = mock(HttpClient.class);
        var response = response(200, """
                {"type":"tabular","headers":["Name","Email"],"sample_rows":[{"Name":"Ada","Email":"ada@example.com"}],"row_count":42}
                """);
        doReturn(CompletableFuture.completedFuture(response)).when(client).sendAsync(any(), any());
        var source = new RestMetadataSource(properties(), client);

        var metadata = source.sample("google-sheets", "read_range", Map.of("spreadsheet_id", "abc")).orElseThrow();

        assertEquals(2, metadata.headers().size());
        assertEquals(Integer.valueOf(42), metadata.rowCount());
        assertEquals("google-sheets", metadata.pluginKey());
        assertTrue(metadata.hasSampleRows());

        var captor = ArgumentCaptor.forClass(HttpRequest.class);
        verify(client).sendAsync(captor.capture(), any());
        assertEquals("http://connector.local/metadata/sample", captor.getValue().uri().toString());
        assertEquals("POST", captor.getValue().method());
    }

    @Test
    @DisplayName("HTTP errors produce no metadata")
    void httpErrorIsEmpty() {
        var client = mock(HttpClient.class);
        var response = response(503, "unavailable");
        doReturn(CompletableFuture.completedFuture(response)).when(client).sendAsync(any(), any());
        var source = new RestMetadataSource(properties(), client);

        assertTrue(source.sample("slack", "read_messages", Map.of()).isEmpty());
        assertThrows(MetadataUnavailableException.class, () -> source.fetch("slack", "read_messages", Map.of()));
    }

    @Test
    @DisplayName("a response slower than the timeout is discarded")
    void timeoutIsEmpty() {
        var client = mock(HttpClient.class);
        doReturn(new CompletableFuture<HttpResponse<String>>()).when(client).sendAsync(any(), any());
        var source = new RestMetadataSource(properties(), client);

        var ex = assertThrows(MetadataUnavailableException.class, () -> source.fetch("slack", "read_messages", null));
        assertTrue(ex.getMessage().contains("timed out"));
    }

    @Test
    @DisplayName("sampling is enabled only when a base URL is configured")
    void enabledByBaseUrl() {
        var props = new MetadataProperties();
        assertFalse(props.isLiveSamplingEnabled());
        assertFalse(new MetadataConfig().metadataSource(props).isEnabled());
        props.setBaseUrl("http://connector.local");
        assertTrue(new MetadataConfig().metadataSource(props).isEnabled());
    }
}
