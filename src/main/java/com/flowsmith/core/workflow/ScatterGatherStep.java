package com.flowsmith.core.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.util.List;

/**
 * Fans nested steps out over a collection and collects the results.
 * <p>
 * Canonical shape is {@code scatter{input, itemVariable, steps}} plus
 * {@code gather{operation}}. Some generators emit the legacy
 * {@code config{data, item_variable, actions}} shape instead; the
 * normaliser rewrites it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScatterGatherStep(
    String id,
    @JsonProperty("step_id") String stepId,
    String description,
    Scatter scatter,
    Gather gather,
    LegacyConfig config,
    @JsonProperty("output_variable") String outputVariable
) implements WorkflowStep {

    @Override
    public ScatterGatherStep withId(String newId) {
        return new ScatterGatherStep(newId, null, description, scatter, gather, config, outputVariable);
    }

    /**
     * Scatter/gather keeps its output variable; it binds loop-scoped results.
     */
    @Override
    public ScatterGatherStep withoutOutputVariable() {
        return this;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Scatter(String input, String itemVariable, List<WorkflowStep> steps) {
        public Scatter {
            steps = Defaults.list(steps);
        }
    }

    public record Gather(String operation) {
        public static Gather collect() {
            return new Gather("collect");
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record LegacyConfig(
        String data,
        @JsonProperty("item_variable") String itemVariable,
        List<WorkflowStep> actions
    ) {
        public LegacyConfig {
            actions = actions == null ? null : Defaults.list(actions);
        }
    }
}
