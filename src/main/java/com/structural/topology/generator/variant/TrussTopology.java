package com.structural.topology.generator.variant;

import java.util.ArrayList;
import java.util.List;

import com.structural.topology.generator.ModelBuilder;
import com.structural.topology.generator.ParameterValidator;
import com.structural.topology.generator.TopologyVariant;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.Measure;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyCounts;
import com.structural.topology.model.TopologyParameters;

/**
 * Shared synthesis for planar trusses.
 *
 * Bottom chord joints sit at {@code x = i / p * span}, {@code y = 0} for
 * {@code i in [0, p]}. Subclasses place the top chord and connect the web. Members are
 * numbered bottom chord, top chord, verticals, diagonals.
 */
public abstract class TrussTopology implements TopologyVariant {

    static final double MAX_SPAN = 1000.0;
    static final double MAX_HEIGHT = 500.0;
    static final int MAX_PANELS = 20;

    @Override
    public void validate(TopologyParameters p, ParameterValidator validator) {
        validator.requireDimension("span", p.getSpan(), MAX_SPAN);
        validator.requireDimension("height", p.getHeight(), MAX_HEIGHT);
        validator.requireCount("panelCount", p.getPanelCount(), MAX_PANELS);
    }

    @Override
    public TopologyCounts predictCounts(TopologyParameters p) {
        int panels = p.getPanelCount();
        int top = topJointCount(panels);
        int verticals = verticalCount(panels);
        int diagonals = diagonalCount(panels);
        TopologyCounts.TopologyCountsBuilder counts = TopologyCounts.builder()
                .joints(panels + 1 + top)
                .members(panels + (top - 1) + verticals + diagonals)
                .plates(0)
                .roleCount(MemberRole.CHORD_BOTTOM, panels)
                .roleCount(MemberRole.DIAGONAL, diagonals);
        // roles without members are left out, matching GenerationResult.counts()
        if (top > 1) {
            counts.roleCount(MemberRole.CHORD_TOP, top - 1);
        }
        if (verticals > 0) {
            counts.roleCount(MemberRole.VERTICAL, verticals);
        }
        return counts.build();
    }

    @Override
    public void synthesize(TopologyParameters p, ModelBuilder model) {
        double span = p.getSpan();
        double height = p.getHeight();
        int panels = p.getPanelCount();
        double panelWidth = span / panels;

        List<Integer> bottom = new ArrayList<>(panels + 1);
        for (int i = 0; i <= panels; i++) {
            bottom.add(model.addJoint(i * panelWidth, 0.0, 0.0));
        }
        List<Integer> top = placeTopChord(model, span, height, panels);

        for (int i = 0; i < panels; i++) {
            model.addMember(bottom.get(i), bottom.get(i + 1), MemberRole.CHORD_BOTTOM);
        }
        for (int i = 0; i < top.size() - 1; i++) {
            model.addMember(top.get(i), top.get(i + 1), MemberRole.CHORD_TOP);
        }
        connectWeb(model, bottom, top, panels);

        bottom.forEach(id -> model.mark(Landmark.BOTTOM_CHORD, id));
        top.forEach(id -> model.mark(Landmark.TOP_CHORD, id));
        model.mark(Landmark.SUPPORT_CANDIDATES, bottom.get(0));
        model.mark(Landmark.SUPPORT_CANDIDATES, bottom.get(panels));
        for (int i = 1; i < panels; i++) {
            model.mark(Landmark.LOADED_JOINTS, bottom.get(i));
        }

        model.measure(Measure.PANEL_WIDTH, panelWidth);
        model.measure(Measure.OVERALL_LENGTH, span);
        model.measure(Measure.OVERALL_HEIGHT, height);
    }

    /**
     * Default top chord: one joint above every bottom joint at full height.
     */
    protected List<Integer> placeTopChord(ModelBuilder model, double span, double height, int panels) {
        List<Integer> top = new ArrayList<>(panels + 1);
        for (int i = 0; i <= panels; i++) {
            top.add(model.addJoint(i * span / panels, height, 0.0));
        }
        return top;
    }

    protected abstract void connectWeb(ModelBuilder model, List<Integer> bottom, List<Integer> top, int panels);

    protected int topJointCount(int panels) {
        return panels + 1;
    }

    protected int verticalCount(int panels) {
        return panels + 1;
    }

    protected int diagonalCount(int panels) {
        return panels;
    }

    /**
     * Connects every bottom joint to the top joint at the same x position.
     */
    protected static void connectVerticals(ModelBuilder model, List<Integer> bottom, List<Integer> top) {
        for (int i = 0; i < bottom.size(); i++) {
            model.addMember(bottom.get(i), top.get(i), MemberRole.VERTICAL);
        }
    }

    /**
     * Midspan tie-break shared by Pratt and Howe trusses. The midspan panel index is
     * {@code panels / 2}; for an odd panel count the panel straddling midspan counts as
     * before midspan, so {@code ceil(panels / 2)} panels fall on that side.
     */
    static boolean isBeforeMidspan(int panel, int panels) {
        return panel < panels - panels / 2;
    }
}
