package com.flowsmith.core.model;

import java.io.Serializable;

/**
 * An error tagged with the phase it occurred in.
 */
public record PipelineError(PipelinePhase phase, String code, String message) implements Serializable {}
