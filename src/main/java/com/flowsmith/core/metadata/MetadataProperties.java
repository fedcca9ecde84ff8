package com.flowsmith.core.metadata;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connector endpoint used for live sampling. Sampling is disabled when
 * {@code base-url} is empty.
 */
@Component
@ConfigurationProperties(prefix = "flowsmith.metadata")
public class MetadataProperties {

    private String baseUrl = "";
    private Duration timeout = Duration.ofSeconds(30);
    private int sampleSize = 10;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public boolean isLiveSamplingEnabled() {
        return baseUrl != null && !baseUrl.isBlank();
    }
}
