package com.structural.topology.generator;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when generation parameters are invalid or describe a degenerate structure.
 * Holds every violation found, not just the first.
 */
public class TopologyValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<ParameterViolation> violations;

    public TopologyValidationException(List<ParameterViolation> violations) {
        super(violations.stream()
                .map(ParameterViolation::toString)
                .collect(Collectors.joining(System.lineSeparator())));
        this.violations = List.copyOf(violations);
    }

    public List<ParameterViolation> getViolations() {
        return violations;
    }

    public boolean hasViolationFor(String parameter) {
        return violations.stream().anyMatch(v -> v.getParameter().equals(parameter));
    }
}
