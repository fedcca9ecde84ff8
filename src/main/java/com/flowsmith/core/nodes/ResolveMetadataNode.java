package com.flowsmith.core.nodes;

import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.metadata.MetadataResolver;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.state.GenerationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Picks the metadata grounding runs against. Counted as grounding time.
 */
@Component
public class ResolveMetadataNode {

    private static final Logger log = LoggerFactory.getLogger(ResolveMetadataNode.class);

    private final MetadataResolver resolver;

    public ResolveMetadataNode(MetadataResolver resolver) {
        this.resolver = resolver;
    }

    public Map<String, Object> apply(GenerationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.GROUNDING);
        try {
            if (state.skipGrounding()) {
                log.info("Grounding skipped by request; not resolving metadata");
                return Map.of("metadataOrigin", MetadataResolver.Origin.NONE.name());
            }
            MetadataResolver.Resolution resolution = resolver.resolve(
                    state.suppliedMetadata().orElse(null), state.enhancedPrompt().orElse(null));
            log.info("Metadata resolved from {}", resolution.origin());
            return PhaseResults.timed(PipelinePhase.GROUNDING, start, Map.of(
                    "metadata", resolution.metadata(),
                    "metadataOrigin", resolution.origin().name()));
        } catch (RuntimeException e) {
            log.error("Metadata resolution failed", e);
            return PhaseResults.failed(PipelinePhase.GROUNDING, start, "metadata_resolution_failed",
                    String.valueOf(e.getMessage()));
        } finally {
            MdcContext.clearPhase();
        }
    }
}
