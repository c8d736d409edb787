package com.structural.topology.generator.variant;

import java.util.List;

import com.structural.topology.generator.ModelBuilder;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyKind;

/**
 * Pratt truss: diagonals slope down toward midspan (tension diagonals under gravity).
 */
public class PrattTruss extends TrussTopology {

    @Override
    public TopologyKind kind() {
        return TopologyKind.PRATT_TRUSS;
    }

    @Override
    protected void connectWeb(ModelBuilder model, List<Integer> bottom, List<Integer> top, int panels) {
        connectVerticals(model, bottom, top);
        for (int i = 0; i < panels; i++) {
            if (isBeforeMidspan(i, panels)) {
                model.addMember(top.get(i), bottom.get(i + 1), MemberRole.DIAGONAL);
            } else {
                model.addMember(bottom.get(i), top.get(i + 1), MemberRole.DIAGONAL);
            }
        }
    }
}
