package com.structural.topology.generator;

import lombok.NonNull;
import lombok.Value;

/**
 * One rejected parameter and the constraint it broke.
 */
@Value
public class ParameterViolation {
    @NonNull
    String parameter;
    @NonNull
    String message;

    @Override
    public String toString() {
        return parameter + ": " + message;
    }
}
