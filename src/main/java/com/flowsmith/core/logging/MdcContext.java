package com.flowsmith.core.logging;

import com.flowsmith.core.model.PipelinePhase;
import org.slf4j.MDC;

/**
 * Utility for managing pipeline-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRequest(String requestId, String stage) {
        MDC.put("requestId", requestId);
        MDC.put("stage", stage);
    }

    public static void setPhase(PipelinePhase phase) {
        MDC.put("phase", phase.value());
    }

    public static void clearPhase() {
        MDC.remove("phase");
    }

    public static void clear() {
        MDC.remove("requestId");
        MDC.remove("stage");
        MDC.remove("phase");
    }
}
