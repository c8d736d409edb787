package com.structural.topology.generator.variant;

import com.structural.topology.generator.ModelBuilder;
import com.structural.topology.generator.ParameterValidator;
import com.structural.topology.generator.TopologyVariant;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.Measure;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyCounts;
import com.structural.topology.model.TopologyKind;
import com.structural.topology.model.TopologyParameters;

/**
 * Single-bay planar portal frame with a flat roof beam.
 */
public class PortalFrameTopology implements TopologyVariant {

    static final double MAX_WIDTH = 500.0;
    static final double MAX_EAVE_HEIGHT = 100.0;

    @Override
    public TopologyKind kind() {
        return TopologyKind.PORTAL_FRAME;
    }

    @Override
    public void validate(TopologyParameters p, ParameterValidator validator) {
        validator.requireDimension("width", p.getWidth(), MAX_WIDTH);
        validator.requireDimension("eaveHeight", p.getEaveHeight(), MAX_EAVE_HEIGHT);
    }

    @Override
    public TopologyCounts predictCounts(TopologyParameters p) {
        return TopologyCounts.builder()
                .joints(4)
                .members(3)
                .plates(0)
                .roleCount(MemberRole.COLUMN, 2)
                .roleCount(MemberRole.BEAM, 1)
                .build();
    }

    @Override
    public void synthesize(TopologyParameters p, ModelBuilder model) {
        double width = p.getWidth();
        double eave = p.getEaveHeight();

        int baseLeft = model.addJoint(0.0, 0.0, 0.0);
        int baseRight = model.addJoint(width, 0.0, 0.0);
        int topLeft = model.addJoint(0.0, eave, 0.0);
        int topRight = model.addJoint(width, eave, 0.0);

        model.addMember(baseLeft, topLeft, MemberRole.COLUMN);
        model.addMember(baseRight, topRight, MemberRole.COLUMN);
        model.addMember(topLeft, topRight, MemberRole.BEAM);

        for (int base : new int[] { baseLeft, baseRight }) {
            model.mark(Landmark.BASE_JOINTS, base);
            model.mark(Landmark.SUPPORT_CANDIDATES, base);
        }
        model.mark(Landmark.EAVE_JOINTS, topLeft);
        model.mark(Landmark.EAVE_JOINTS, topRight);

        model.measure(Measure.OVERALL_LENGTH, width);
        model.measure(Measure.OVERALL_HEIGHT, eave);
    }
}
