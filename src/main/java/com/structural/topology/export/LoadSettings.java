package com.structural.topology.export;

import java.util.ArrayList;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * Loads written after the supports. Uniform loads are force per unit length on members
 * and pressure on plate elements; the joint live load is a force per loaded joint. All
 * magnitudes are positive, the direction is fixed per load.
 */
@Value
@Builder(toBuilder = true)
public class LoadSettings {

    boolean selfWeight;

    double deadLoad;

    double liveLoad;

    double jointLiveLoad;

    double windLoad;

    boolean combinations;

    public static LoadSettings none() {
        return LoadSettings.builder().build();
    }

    /**
     * @return one message per load that is negative or not a finite number
     */
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        checkMagnitude(problems, "deadLoad", deadLoad);
        checkMagnitude(problems, "liveLoad", liveLoad);
        checkMagnitude(problems, "jointLiveLoad", jointLiveLoad);
        checkMagnitude(problems, "windLoad", windLoad);
        return problems;
    }

    private static void checkMagnitude(List<String> problems, String name, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            problems.add(name + " must be a finite number of at least 0. Got: " + value);
        }
    }
}
