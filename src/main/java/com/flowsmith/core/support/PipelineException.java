package com.flowsmith.core.support;

import com.flowsmith.core.model.PipelinePhase;

/**
 * A pipeline phase failed in a way the request cannot recover from.
 */
public class PipelineException extends RuntimeException {

    private final PipelinePhase phase;
    private final String code;

    public PipelineException(PipelinePhase phase, String code, String message) {
        super(message);
        this.phase = phase;
        this.code = code;
    }

    public PipelineException(PipelinePhase phase, String code, String message, Throwable cause) {
        super(message, cause);
        this.phase = phase;
        this.code = code;
    }

    public PipelinePhase getPhase() {
        return phase;
    }

    public String getCode() {
        return code;
    }
}
