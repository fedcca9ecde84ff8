package com.flowsmith.core.metadata;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetadataConfig {

    private static final Logger log = LoggerFactory.getLogger(MetadataConfig.class);

    @Bean
    public MetadataSource metadataSource(MetadataProperties properties) {
        if (!properties.isLiveSamplingEnabled()) {
            log.info("No metadata connector configured; live sampling disabled");
            return new NoOpMetadataSource();
        }
        log.info("Live sampling via {}", properties.getBaseUrl());
        return new RestMetadataSource(properties);
    }
}
