package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IrValidationError(
    @JsonProperty("error_code") ErrorCode errorCode,
    String message,
    @JsonProperty("ir_path") String irPath,
    @JsonProperty("leaked_token") String leakedToken
) implements Serializable {

    public enum ErrorCode {
        INVALID_SCHEMA,
        FORBIDDEN_TOKEN,
        MISSING_REQUIRED_FIELD,
        INVALID_REFERENCE
    }

    public static IrValidationError of(ErrorCode code, String message, String path) {
        return new IrValidationError(code, message, path, null);
    }
}
