package com.structural.topology.generator.variant;

import com.structural.topology.generator.JointIndex;
import com.structural.topology.generator.ModelBuilder;
import com.structural.topology.generator.ParameterValidator;
import com.structural.topology.generator.TopologyVariant;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.Measure;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyCounts;
import com.structural.topology.model.TopologyKind;
import com.structural.topology.model.TopologyParameters;

import lombok.Value;

/**
 * Multi-bay rigid gable frame (warehouse shed) with optional purlins and roof bracing.
 *
 * Frame station {@code s} sits at {@code x = s * baySpacing}. Each station carries
 * left-base, left-eave, ridge, right-eave and right-base joints, mirrored about the
 * building centreline {@code z = width / 2}. When purlins are requested each rafter is
 * split at the purlin lines, so purlin joints are always part of the frame.
 */
public class GableFrameTopology implements TopologyVariant {

    static final double MAX_LENGTH = 1000.0;
    static final double MAX_WIDTH = 500.0;
    static final double MAX_HEIGHT = 100.0;
    static final double MAX_BAY_SPACING = 50.0;
    static final int MAX_BAYS = 20;
    static final int MAX_PURLIN_LINES = 20;

    private static final double FLOOR_TOLERANCE = 1e-9;

    /**
     * Named joint positions within one frame station.
     */
    enum FramePoint {
        LEFT_BASE,
        LEFT_SLOPE,
        RIDGE,
        RIGHT_SLOPE,
        RIGHT_BASE
    }

    /**
     * Symbolic joint key. {@code line} is 0 for the eave on a slope and counts purlin
     * lines up toward the ridge.
     */
    @Value
    static class FrameKey {
        int station;
        FramePoint point;
        int line;
    }

    @Override
    public TopologyKind kind() {
        return TopologyKind.GABLE_FRAME;
    }

    @Override
    public void validate(TopologyParameters p, ParameterValidator validator) {
        boolean widthOk = validator.requireDimension("width", p.getWidth(), MAX_WIDTH);
        validator.requireDimension("eaveHeight", p.getEaveHeight(), MAX_HEIGHT);
        validator.requireDimension("ridgeHeight", p.getRidgeHeight(), MAX_HEIGHT);
        boolean spacingOk = validator.requireDimension("baySpacing", p.getBaySpacing(), MAX_BAY_SPACING);

        if (p.getNumBays() != null) {
            validator.requireCount("numBays", p.getNumBays(), MAX_BAYS);
            if (p.getLength() != null) {
                validator.requireDimension("length", p.getLength(), MAX_LENGTH);
            }
        } else if (p.getLength() == null) {
            validator.reject("numBays", "is required unless length is given");
        } else if (validator.requireDimension("length", p.getLength(), MAX_LENGTH) && spacingOk) {
            int derived = floorDiv(p.getLength(), p.getBaySpacing());
            if (derived < 1) {
                validator.reject("length", "is shorter than one bay spacing (" + p.getBaySpacing()
                        + "); no usable bay fits. Got: " + p.getLength());
            } else if (derived > MAX_BAYS) {
                validator.reject("length", "yields " + derived + " bays at spacing " + p.getBaySpacing()
                        + "; at most " + MAX_BAYS + " are allowed");
            }
        }

        if (p.isIncludePurlins()) {
            double maxSpacing = widthOk ? p.getWidth() : MAX_WIDTH;
            if (validator.requireDimension("purlinSpacing", p.getPurlinSpacing(), maxSpacing) && widthOk) {
                int lines = floorDiv(p.getWidth() / 2.0, p.getPurlinSpacing());
                if (lines > MAX_PURLIN_LINES) {
                    validator.reject("purlinSpacing", "yields " + lines + " purlin lines per slope; at most "
                            + MAX_PURLIN_LINES + " are allowed");
                }
            }
        }
    }

    @Override
    public TopologyCounts predictCounts(TopologyParameters p) {
        int bays = bayCount(p);
        int stations = bays + 1;
        int lines = purlinLines(p);
        int segments = Math.max(lines, 1);
        int purlins = lines > 0 ? bays * (2 * segments + 1) : 0;
        int bracing = p.isIncludeBracing() ? 4 * bays : 0;

        TopologyCounts.TopologyCountsBuilder counts = TopologyCounts.builder()
                .joints(stations * (5 + 2 * (segments - 1)))
                .members(2 * stations + 2 * segments * stations + purlins + bracing)
                .plates(0)
                .roleCount(MemberRole.COLUMN, 2 * stations)
                .roleCount(MemberRole.RAFTER, 2 * segments * stations);
        if (purlins > 0) {
            counts.roleCount(MemberRole.PURLIN, purlins);
        }
        if (bracing > 0) {
            counts.roleCount(MemberRole.BRACING, bracing);
        }
        return counts.build();
    }

    @Override
    public void synthesize(TopologyParameters p, ModelBuilder model) {
        double width = p.getWidth();
        double halfWidth = width / 2.0;
        double eave = p.getEaveHeight();
        double ridge = p.getRidgeHeight();
        double rise = ridge - eave;
        double spacing = p.getBaySpacing();
        int bays = bayCount(p);
        int stations = bays + 1;
        int lines = purlinLines(p);
        int segments = Math.max(lines, 1);

        if (p.isIncludePurlins() && lines == 0) {
            model.warn("Purlin spacing " + p.getPurlinSpacing() + " exceeds half width " + halfWidth
                    + "; purlins omitted");
        }
        if (p.getNumBays() != null && p.getLength() != null && bays * spacing > p.getLength()) {
            model.warn("Bays exceed length: " + bays + " x " + spacing + " = " + (bays * spacing)
                    + " > " + p.getLength());
        }

        JointIndex<FrameKey> index = new JointIndex<>();
        for (int s = 0; s < stations; s++) {
            double x = s * spacing;
            index.put(new FrameKey(s, FramePoint.LEFT_BASE, 0), model.addJoint(x, 0.0, 0.0));
            index.put(new FrameKey(s, FramePoint.LEFT_SLOPE, 0), model.addJoint(x, eave, 0.0));
            index.put(new FrameKey(s, FramePoint.RIDGE, 0), model.addJoint(x, ridge, halfWidth));
            index.put(new FrameKey(s, FramePoint.RIGHT_SLOPE, 0), model.addJoint(x, eave, width));
            index.put(new FrameKey(s, FramePoint.RIGHT_BASE, 0), model.addJoint(x, 0.0, width));

            for (int k = 1; k < segments; k++) {
                double t = (double) k / segments;
                index.put(new FrameKey(s, FramePoint.LEFT_SLOPE, k),
                        model.addJoint(x, eave + rise * t, halfWidth * t));
            }
            for (int k = 1; k < segments; k++) {
                double t = (double) k / segments;
                index.put(new FrameKey(s, FramePoint.RIGHT_SLOPE, k),
                        model.addJoint(x, eave + rise * t, width - halfWidth * t));
            }
        }

        for (int s = 0; s < stations; s++) {
            model.addMember(index.get(new FrameKey(s, FramePoint.LEFT_BASE, 0)),
                    index.get(new FrameKey(s, FramePoint.LEFT_SLOPE, 0)), MemberRole.COLUMN);
            model.addMember(index.get(new FrameKey(s, FramePoint.RIGHT_BASE, 0)),
                    index.get(new FrameKey(s, FramePoint.RIGHT_SLOPE, 0)), MemberRole.COLUMN);
            addRafters(model, index, s, FramePoint.LEFT_SLOPE, segments);
            addRafters(model, index, s, FramePoint.RIGHT_SLOPE, segments);
        }

        if (lines > 0) {
            for (int s = 0; s < bays; s++) {
                for (int k = 0; k < segments; k++) {
                    addLongitudinal(model, index, new FrameKey(s, FramePoint.LEFT_SLOPE, k), MemberRole.PURLIN);
                }
                addLongitudinal(model, index, new FrameKey(s, FramePoint.RIDGE, 0), MemberRole.PURLIN);
                for (int k = 0; k < segments; k++) {
                    addLongitudinal(model, index, new FrameKey(s, FramePoint.RIGHT_SLOPE, k), MemberRole.PURLIN);
                }
            }
        }

        if (p.isIncludeBracing()) {
            for (int s = 0; s < bays; s++) {
                int leftEave = index.get(new FrameKey(s, FramePoint.LEFT_SLOPE, 0));
                int ridgeJoint = index.get(new FrameKey(s, FramePoint.RIDGE, 0));
                int rightEave = index.get(new FrameKey(s, FramePoint.RIGHT_SLOPE, 0));
                int nextLeftEave = index.get(new FrameKey(s + 1, FramePoint.LEFT_SLOPE, 0));
                int nextRidge = index.get(new FrameKey(s + 1, FramePoint.RIDGE, 0));
                int nextRightEave = index.get(new FrameKey(s + 1, FramePoint.RIGHT_SLOPE, 0));

                model.addMember(leftEave, nextRidge, MemberRole.BRACING);
                model.addMember(ridgeJoint, nextLeftEave, MemberRole.BRACING);
                model.addMember(ridgeJoint, nextRightEave, MemberRole.BRACING);
                model.addMember(rightEave, nextRidge, MemberRole.BRACING);
            }
        }

        for (int s = 0; s < stations; s++) {
            for (FramePoint base : new FramePoint[] { FramePoint.LEFT_BASE, FramePoint.RIGHT_BASE }) {
                int id = index.get(new FrameKey(s, base, 0));
                model.mark(Landmark.BASE_JOINTS, id);
                model.mark(Landmark.SUPPORT_CANDIDATES, id);
            }
            model.mark(Landmark.EAVE_JOINTS, index.get(new FrameKey(s, FramePoint.LEFT_SLOPE, 0)));
            model.mark(Landmark.EAVE_JOINTS, index.get(new FrameKey(s, FramePoint.RIGHT_SLOPE, 0)));
            model.mark(Landmark.RIDGE_JOINTS, index.get(new FrameKey(s, FramePoint.RIDGE, 0)));
        }

        model.measure(Measure.FRAME_STATIONS, stations);
        model.measure(Measure.OVERALL_LENGTH, bays * spacing);
        model.measure(Measure.OVERALL_HEIGHT, ridge);
        model.measure(Measure.ROOF_SLOPE_DEGREES, roofSlopeDegrees(eave, ridge, width));
        model.measure(Measure.PURLIN_LINES_PER_SLOPE, lines);
    }

    /**
     * Rafter segments of one slope, from the eave up to the ridge.
     */
    private static void addRafters(ModelBuilder model, JointIndex<FrameKey> index, int station,
                                   FramePoint slope, int segments) {
        for (int k = 0; k < segments; k++) {
            int from = index.get(new FrameKey(station, slope, k));
            int to = k + 1 == segments
                    ? index.get(new FrameKey(station, FramePoint.RIDGE, 0))
                    : index.get(new FrameKey(station, slope, k + 1));
            model.addMember(from, to, MemberRole.RAFTER);
        }
    }

    private static void addLongitudinal(ModelBuilder model, JointIndex<FrameKey> index, FrameKey from,
                                        MemberRole role) {
        FrameKey to = new FrameKey(from.getStation() + 1, from.getPoint(), from.getLine());
        model.addMember(index.get(from), index.get(to), role);
    }

    static int bayCount(TopologyParameters p) {
        if (p.getNumBays() != null) {
            return p.getNumBays();
        }
        return floorDiv(p.getLength(), p.getBaySpacing());
    }

    /**
     * Purlin lines per slope, {@code floor((width / 2) / purlinSpacing)}; 0 when purlins
     * are off or the spacing exceeds half the width.
     */
    static int purlinLines(TopologyParameters p) {
        if (!p.isIncludePurlins()) {
            return 0;
        }
        return floorDiv(p.getWidth() / 2.0, p.getPurlinSpacing());
    }

    public static double roofSlopeDegrees(double eaveHeight, double ridgeHeight, double width) {
        return Math.toDegrees(Math.atan2(ridgeHeight - eaveHeight, width / 2.0));
    }

    private static int floorDiv(double value, double divisor) {
        return (int) Math.floor(value / divisor + FLOOR_TOLERANCE);
    }
}
