package com.structural.topology.export;

import com.structural.topology.model.Joint;

/**
 * Vertical-axis convention of an export target. Generated models are always Y up.
 */
public enum AxisConvention {

    Y_UP("Y", "Z") {
        @Override
        public Joint apply(Joint joint) {
            return joint;
        }
    },

    /**
     * Swaps the vertical and transverse axes: {@code (x, y, z) -> (x, z, y)}.
     */
    Z_UP("Z", "Y") {
        @Override
        public Joint apply(Joint joint) {
            return new Joint(joint.getId(), joint.getX(), joint.getZ(), joint.getY());
        }
    };

    private final String vertical;
    private final String transverse;

    AxisConvention(String vertical, String transverse) {
        this.vertical = vertical;
        this.transverse = transverse;
    }

    public abstract Joint apply(Joint joint);

    /**
     * Global axis label of the generated y axis (gravity acts against it).
     */
    public String getVertical() {
        return vertical;
    }

    /**
     * Global axis label of the generated z axis.
     */
    public String getTransverse() {
        return transverse;
    }
}
