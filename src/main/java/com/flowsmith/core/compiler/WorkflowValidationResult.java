package com.flowsmith.core.compiler;

import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.List;

public record WorkflowValidationResult(boolean valid, List<String> errors, List<String> warnings) implements Serializable {

    public WorkflowValidationResult {
        errors = Defaults.list(errors);
        warnings = Defaults.list(warnings);
    }
}
