package com.structural.topology.generator.variant;

import java.util.ArrayList;
import java.util.List;

import com.structural.topology.generator.ModelBuilder;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyKind;

/**
 * Warren truss: top joints centred over each panel and a continuous zig-zag of
 * diagonals, no verticals.
 */
public class WarrenTruss extends TrussTopology {

    @Override
    public TopologyKind kind() {
        return TopologyKind.WARREN_TRUSS;
    }

    @Override
    protected List<Integer> placeTopChord(ModelBuilder model, double span, double height, int panels) {
        List<Integer> top = new ArrayList<>(panels);
        for (int i = 0; i < panels; i++) {
            top.add(model.addJoint((i + 0.5) * span / panels, height, 0.0));
        }
        return top;
    }

    @Override
    protected void connectWeb(ModelBuilder model, List<Integer> bottom, List<Integer> top, int panels) {
        for (int i = 0; i < panels; i++) {
            model.addMember(bottom.get(i), top.get(i), MemberRole.DIAGONAL);
            model.addMember(top.get(i), bottom.get(i + 1), MemberRole.DIAGONAL);
        }
    }

    @Override
    protected int topJointCount(int panels) {
        return panels;
    }

    @Override
    protected int verticalCount(int panels) {
        return 0;
    }

    @Override
    protected int diagonalCount(int panels) {
        return 2 * panels;
    }
}
