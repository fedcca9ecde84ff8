package com.flowsmith.core.nodes;

import com.flowsmith.core.formalization.FormalizationResult;
import com.flowsmith.core.formalization.IrValidator;
import com.flowsmith.core.ir.IrValidationError;
import com.flowsmith.core.ir.IrValidationResult;
import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.model.PipelineError;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.state.CompilationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * IR validation. An invalid IR ends the request; each validation error becomes
 * one pipeline error.
 */
@Component
public class ValidateIrNode {

    private static final Logger log = LoggerFactory.getLogger(ValidateIrNode.class);

    private final IrValidator validator;

    public ValidateIrNode(IrValidator validator) {
        this.validator = validator;
    }

    public Map<String, Object> apply(CompilationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.FORMALIZATION);
        try {
            if (state.ir().isEmpty()) {
                return PhaseResults.failed(PipelinePhase.FORMALIZATION, start, "missing_ir", "No IR to validate");
            }
            String rawIr = state.formalization().map(FormalizationResult::rawIr).orElse(null);
            IrValidationResult result = validator.validate(state.ir().get(), rawIr);
            Map<String, Object> updates = new HashMap<>();
            updates.put("irValidation", result);
            if (!result.valid()) {
                log.warn("IR validation failed with {} errors", result.errors().size());
                List<PipelineError> errors = result.errors().stream()
                        .map(ValidateIrNode::toPipelineError)
                        .toList();
                updates.put("errors", errors);
            }
            return PhaseResults.timed(PipelinePhase.FORMALIZATION, start, updates);
        } catch (RuntimeException e) {
            log.error("IR validation failed unexpectedly", e);
            return PhaseResults.failed(PipelinePhase.FORMALIZATION, start, e);
        } finally {
            MdcContext.clearPhase();
        }
    }

    private static PipelineError toPipelineError(IrValidationError error) {
        String where = error.irPath() == null ? "" : " (" + error.irPath() + ")";
        return new PipelineError(PipelinePhase.FORMALIZATION, error.errorCode().name(), error.message() + where);
    }
}
