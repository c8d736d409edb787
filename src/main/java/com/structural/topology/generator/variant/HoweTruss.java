package com.structural.topology.generator.variant;

import java.util.List;

import com.structural.topology.generator.ModelBuilder;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyKind;

/**
 * Howe truss: the mirror of {@link PrattTruss}, diagonals rise toward midspan.
 */
public class HoweTruss extends TrussTopology {

    @Override
    public TopologyKind kind() {
        return TopologyKind.HOWE_TRUSS;
    }

    @Override
    protected void connectWeb(ModelBuilder model, List<Integer> bottom, List<Integer> top, int panels) {
        connectVerticals(model, bottom, top);
        for (int i = 0; i < panels; i++) {
            if (isBeforeMidspan(i, panels)) {
                model.addMember(bottom.get(i), top.get(i + 1), MemberRole.DIAGONAL);
            } else {
                model.addMember(top.get(i), bottom.get(i + 1), MemberRole.DIAGONAL);
            }
        }
    }
}
