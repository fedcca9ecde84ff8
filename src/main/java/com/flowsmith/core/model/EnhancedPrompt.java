package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Structured, sectioned form of a user's natural-language workflow request.
 *
 * @param sections    ordered request sections (data, actions, output, delivery, processing steps)
 * @param userContext the original request text and any clarifications already gathered
 * @param specifics   involved services and pre-resolved user inputs
 */
public record EnhancedPrompt(
    Sections sections,
    @JsonProperty("user_context") UserContext userContext,
    Specifics specifics
) implements Serializable {

    public EnhancedPrompt {
        sections = sections == null ? new Sections(null, null, null, null, null) : sections;
        userContext = userContext == null ? new UserContext(null, null) : userContext;
        specifics = specifics == null ? new Specifics(null, null) : specifics;
    }

    public record Sections(
        List<String> data,
        List<String> actions,
        List<String> output,
        List<String> delivery,
        @JsonProperty("processing_steps") List<String> processingSteps
    ) implements Serializable {
        public Sections {
            data = Defaults.list(data);
            actions = Defaults.list(actions);
            output = Defaults.list(output);
            delivery = Defaults.list(delivery);
            processingSteps = Defaults.list(processingSteps);
        }
    }

    public record UserContext(
        @JsonProperty("original_request") String originalRequest,
        List<String> clarifications
    ) implements Serializable {
        public UserContext {
            originalRequest = Defaults.text(originalRequest);
            clarifications = Defaults.list(clarifications);
        }
    }

    public record Specifics(
        @JsonProperty("services_involved") List<String> servicesInvolved,
        @JsonProperty("resolved_user_inputs") List<ResolvedInput> resolvedUserInputs
    ) implements Serializable {
        public Specifics {
            servicesInvolved = Defaults.list(servicesInvolved);
            resolvedUserInputs = Defaults.list(resolvedUserInputs);
        }
    }

    public List<String> servicesInvolved() {
        return specifics.servicesInvolved();
    }

    public List<ResolvedInput> resolvedUserInputs() {
        return specifics.resolvedUserInputs();
    }
}
