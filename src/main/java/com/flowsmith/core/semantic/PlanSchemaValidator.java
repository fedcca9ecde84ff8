package com.flowsmith.core.semantic;

import com.flowsmith.core.model.Ambiguity;
import com.flowsmith.core.model.Assumption;
import com.flowsmith.core.model.AssumptionCategory;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.model.Understanding;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural check of a decoded semantic plan. Only missing essentials are
 * errors; everything a downstream phase can live without is a warning.
 */
@Component
public class PlanSchemaValidator {

    public record Report(List<String> errors, List<String> warnings) {

        public boolean valid() {
            return errors.isEmpty();
        }
    }

    public Report validate(SemanticPlan plan) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (plan == null) {
            errors.add("$ plan is missing");
            return new Report(errors, warnings);
        }

        if (plan.goal() == null || plan.goal().isBlank()) {
            errors.add("$.goal is required");
        }
        if (plan.understanding() == null) {
            errors.add("$.understanding is required");
        }
        if (plan.assumptions() == null) {
            errors.add("$.assumptions is required");
        } else {
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < plan.assumptions().size(); i++) {
                Assumption assumption = plan.assumptions().get(i);
                if (assumption.id() == null || assumption.id().isBlank()) {
                    errors.add("$.assumptions[" + i + "].id is required");
                } else if (!seen.add(assumption.id())) {
                    errors.add("$.assumptions[" + i + "].id duplicates '" + assumption.id() + "'");
                }
                if (assumption.category() == AssumptionCategory.UNKNOWN) {
                    warnings.add("$.assumptions[" + i + "].category is not a known category");
                }
            }
        }

        Understanding understanding = plan.understandingOrEmpty();
        if (plan.understanding() != null && understanding.dataSources().isEmpty()) {
            warnings.add("$.understanding.data_sources is empty");
        }
        if (plan.understanding() != null && understanding.delivery() == null) {
            warnings.add("$.understanding.delivery is missing");
        }
        if (plan.reasoningTrace().isEmpty()) {
            warnings.add("$.reasoning_trace is empty");
        }
        for (Ambiguity ambiguity : plan.ambiguities()) {
            if (ambiguity.possibleResolutions().isEmpty()) {
                warnings.add("ambiguity '" + ambiguity.id() + "' lists no possible resolutions");
            }
        }
        return new Report(List.copyOf(errors), List.copyOf(warnings));
    }
}
