package com.flowsmith.core.ir;

import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.List;

public record IrValidationResult(boolean valid, List<IrValidationError> errors, List<String> warnings) implements Serializable {

    public IrValidationResult {
        errors = Defaults.list(errors);
        warnings = Defaults.list(warnings);
    }
}
