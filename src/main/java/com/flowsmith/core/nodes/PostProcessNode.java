package com.flowsmith.core.nodes;

import com.flowsmith.core.compiler.WorkflowPostProcessor;
import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.state.CompilationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class PostProcessNode {

    private static final Logger log = LoggerFactory.getLogger(PostProcessNode.class);

    private final WorkflowPostProcessor postProcessor;

    public PostProcessNode(WorkflowPostProcessor postProcessor) {
        this.postProcessor = postProcessor;
    }

    public Map<String, Object> apply(CompilationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.NORMALIZATION);
        try {
            return PhaseResults.timed(PipelinePhase.NORMALIZATION, start,
                    Map.of("workflow", postProcessor.process(state.workflow())));
        } catch (RuntimeException e) {
            log.error("Post-processing failed", e);
            return PhaseResults.failed(PipelinePhase.NORMALIZATION, start, e);
        } finally {
            MdcContext.clearPhase();
        }
    }
}
