package com.structural.topology.model;

import lombok.Value;

/**
 * A point of the generated structure. Ids are 1-based and assigned in creation order.
 */
@Value
public class Joint {
    int id;
    double x;
    double y;
    double z;

    public double distanceTo(Joint other) {
        double dx = other.x - x;
        double dy = other.y - y;
        double dz = other.z - z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    public boolean isFinite() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }
}
