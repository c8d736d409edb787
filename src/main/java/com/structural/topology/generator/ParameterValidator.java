package com.structural.topology.generator;

import java.util.ArrayList;
import java.util.List;

import com.structural.topology.model.TopologyParameters;

/**
 * Collects parameter violations so that a caller sees all of them at once.
 */
public class ParameterValidator {

    private final List<ParameterViolation> violations = new ArrayList<>();

    /**
     * Requires a present, finite dimension in (0, max].
     *
     * @return true when the value passed
     */
    public boolean requireDimension(String name, Double value, double max) {
        if (value == null) {
            reject(name, "is required");
            return false;
        }
        if (!Double.isFinite(value)) {
            reject(name, "must be a finite number. Got: " + value);
            return false;
        }
        if (value <= 0 || value > max) {
            reject(name, "must be greater than 0 and at most " + format(max) + ". Got: " + format(value));
            return false;
        }
        return true;
    }

    /**
     * Requires a present count in [1, max].
     *
     * @return true when the value passed
     */
    public boolean requireCount(String name, Integer value, int max) {
        if (value == null) {
            reject(name, "is required");
            return false;
        }
        if (value < 1 || value > max) {
            reject(name, "must be between 1 and " + max + ". Got: " + value);
            return false;
        }
        return true;
    }

    /**
     * Checks the cross-parameter rules that apply to every topology kind.
     */
    public void checkCommon(TopologyParameters p) {
        if (p.getEaveHeight() != null && p.getRidgeHeight() != null
                && Double.isFinite(p.getEaveHeight()) && Double.isFinite(p.getRidgeHeight())
                && p.getRidgeHeight() <= p.getEaveHeight()) {
            reject("ridgeHeight", "must be greater than eave height ("
                    + format(p.getEaveHeight()) + "). Got: " + format(p.getRidgeHeight()));
        }
    }

    public void reject(String name, String message) {
        violations.add(new ParameterViolation(name, message));
    }

    public List<ParameterViolation> getViolations() {
        return List.copyOf(violations);
    }

    static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
