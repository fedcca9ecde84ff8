package com.flowsmith.core.model;

import java.io.Serializable;

public record PhaseTiming(PipelinePhase phase, long durationMs) implements Serializable {}
