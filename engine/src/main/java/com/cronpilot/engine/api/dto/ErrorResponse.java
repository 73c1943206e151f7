package com.cronpilot.engine.api.dto;

import com.cronpilot.engine.definition.JobValidationException.FieldViolation;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(String error, List<FieldViolation> fields, Instant timestamp) {

    public static ErrorResponse of(String error) {
        return new ErrorResponse(error, List.of(), Instant.now());
    }
}
