package com.cronpilot.engine.definition;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A job definition was rejected. Carries one entry per offending field;
 * nothing is persisted when this is thrown.
 */
public class JobValidationException extends RuntimeException {

    private final List<FieldViolation> violations;

    public JobValidationException(List<FieldViolation> violations) {
        super("Invalid job definition: " + violations.stream()
                .map(FieldViolation::toString)
                .collect(Collectors.joining("; ")));
        this.violations = List.copyOf(violations);
    }

    public JobValidationException(String field, String message) {
        this(List.of(new FieldViolation(field, message)));
    }

    public List<FieldViolation> getViolations() { return violations; }

    public record FieldViolation(String field, String message) {
        @Override
        public String toString() {
            return field + ": " + message;
        }
    }
}
