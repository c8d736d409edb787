package com.structural.topology.generator.variant;

import java.util.ArrayList;
import java.util.List;

import com.structural.topology.generator.ModelBuilder;
import com.structural.topology.generator.ParameterValidator;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyKind;
import com.structural.topology.model.TopologyParameters;

/**
 * Bowstring arch: the top chord follows {@code height * sin(i / p * PI)}, meeting the
 * deck at both ends. Full verticals plus one diagonal per panel.
 */
public class BowstringTruss extends TrussTopology {

    @Override
    public TopologyKind kind() {
        return TopologyKind.BOWSTRING_ARCH;
    }

    @Override
    public void validate(TopologyParameters p, ParameterValidator validator) {
        super.validate(p, validator);
        if (p.getPanelCount() != null && p.getPanelCount() == 1) {
            // a single panel has no interior arch point; the diagonal would lie on the deck
            validator.reject("panelCount", "must be at least 2 for a bowstring arch. Got: 1");
        }
    }

    @Override
    public void synthesize(TopologyParameters p, ModelBuilder model) {
        super.synthesize(p, model);
        List<Integer> degenerate = new ArrayList<>();
        for (int id = 1; id <= model.memberCount(); id++) {
            if (model.memberLength(id) == 0.0) {
                degenerate.add(id);
            }
        }
        if (!degenerate.isEmpty()) {
            model.warn("Members " + degenerate + " have zero length; the arch meets the deck at both supports");
        }
    }

    @Override
    protected List<Integer> placeTopChord(ModelBuilder model, double span, double height, int panels) {
        List<Integer> top = new ArrayList<>(panels + 1);
        for (int i = 0; i <= panels; i++) {
            top.add(model.addJoint(i * span / panels, archHeight(height, i, panels), 0.0));
        }
        return top;
    }

    @Override
    protected void connectWeb(ModelBuilder model, List<Integer> bottom, List<Integer> top, int panels) {
        connectVerticals(model, bottom, top);
        for (int i = 0; i < panels; i++) {
            model.addMember(bottom.get(i), top.get(i + 1), MemberRole.DIAGONAL);
        }
    }

    /**
     * Arch ordinate at panel point {@code i}; exactly zero at both supports.
     */
    static double archHeight(double height, int i, int panels) {
        if (i == 0 || i == panels) {
            return 0.0;
        }
        return height * Math.sin((double) i / panels * Math.PI);
    }
}
