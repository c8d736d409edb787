package com.structural.topology.generator.variant;

import java.util.ArrayList;
import java.util.List;
import java.util.function.IntBinaryOperator;

import com.structural.topology.generator.ModelBuilder;
import com.structural.topology.generator.ParameterValidator;
import com.structural.topology.generator.TopologyVariant;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.Measure;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.PlateComponent;
import com.structural.topology.model.TopologyCounts;
import com.structural.topology.model.TopologyKind;
import com.structural.topology.model.TopologyParameters;

/**
 * Wall and slab meshed into 1 x 1 quadrilateral plates.
 *
 * The wall stands in the plane {@code x = 0} with joints {@code (0, j, i)}; the slab
 * lies in {@code y = 0} with joints {@code (xOffset + i, 0, j)}, centred on the wall
 * plane. Dimensions are truncated to whole mesh units. Each unique lattice edge
 * becomes one plate-edge member.
 */
public class PlateMeshTopology implements TopologyVariant {

    static final double MAX_PLATE_DIMENSION = 200.0;
    static final double MAX_THICKNESS = 10.0;

    @Override
    public TopologyKind kind() {
        return TopologyKind.PLATE_MESH;
    }

    @Override
    public void validate(TopologyParameters p, ParameterValidator validator) {
        requireMeshDimension(validator, "wallHeight", p.getWallHeight());
        requireMeshDimension(validator, "wallWidth", p.getWallWidth());
        validator.requireDimension("wallThickness", p.getWallThickness(), MAX_THICKNESS);
        requireMeshDimension(validator, "slabLength", p.getSlabLength());
        requireMeshDimension(validator, "slabWidth", p.getSlabWidth());
        validator.requireDimension("slabThickness", p.getSlabThickness(), MAX_THICKNESS);
    }

    private static void requireMeshDimension(ParameterValidator validator, String name, Double value) {
        if (validator.requireDimension(name, value, MAX_PLATE_DIMENSION) && divisions(value) < 1) {
            validator.reject(name, "is below one mesh unit, no plate fits. Got: " + value);
        }
    }

    @Override
    public TopologyCounts predictCounts(TopologyParameters p) {
        int wallCols = divisions(p.getWallWidth());
        int wallRows = divisions(p.getWallHeight());
        int slabCols = divisions(p.getSlabLength());
        int slabRows = divisions(p.getSlabWidth());
        int edges = edgeCount(wallCols, wallRows) + edgeCount(slabCols, slabRows);
        return TopologyCounts.builder()
                .joints((wallCols + 1) * (wallRows + 1) + (slabCols + 1) * (slabRows + 1))
                .members(edges)
                .plates(wallCols * wallRows + slabCols * slabRows)
                .roleCount(MemberRole.PLATE_EDGE, edges)
                .build();
    }

    @Override
    public void synthesize(TopologyParameters p, ModelBuilder model) {
        int wallCols = divisions(p.getWallWidth());
        int wallRows = divisions(p.getWallHeight());
        int slabCols = divisions(p.getSlabLength());
        int slabRows = divisions(p.getSlabWidth());
        double xOffset = -slabCols / 2.0;

        warnIfTruncated(model, "wallHeight", p.getWallHeight());
        warnIfTruncated(model, "wallWidth", p.getWallWidth());
        warnIfTruncated(model, "slabLength", p.getSlabLength());
        warnIfTruncated(model, "slabWidth", p.getSlabWidth());

        int[][] wall = mesh(model, PlateComponent.WALL, p.getWallThickness(), wallCols, wallRows,
                (i, j) -> model.addJoint(0.0, j, i));
        int[][] slab = mesh(model, PlateComponent.SLAB, p.getSlabThickness(), slabCols, slabRows,
                (i, j) -> model.addJoint(xOffset + i, 0.0, j));

        for (int[] row : wall) {
            for (int id : row) {
                model.mark(Landmark.WALL_JOINTS, id);
            }
        }
        for (int[] row : slab) {
            for (int id : row) {
                model.mark(Landmark.SLAB_JOINTS, id);
            }
        }
        for (int id : wall[0]) {
            model.mark(Landmark.BASE_JOINTS, id);
            model.mark(Landmark.SUPPORT_CANDIDATES, id);
        }

        model.measure(Measure.OVERALL_HEIGHT, wallRows);
        model.measure(Measure.OVERALL_LENGTH, slabCols);
    }

    /**
     * Meshes one component. Joints are created row by row; the returned array is
     * indexed {@code [row][column]}.
     */
    private static int[][] mesh(ModelBuilder model, PlateComponent component, double thickness,
                                int cols, int rows, IntBinaryOperator placeJoint) {
        int[][] ids = new int[rows + 1][cols + 1];
        for (int j = 0; j <= rows; j++) {
            for (int i = 0; i <= cols; i++) {
                ids[j][i] = placeJoint.applyAsInt(i, j);
            }
        }

        for (int j = 0; j < rows; j++) {
            for (int i = 0; i < cols; i++) {
                List<Integer> corners = new ArrayList<>(4);
                corners.add(ids[j][i]);
                corners.add(ids[j][i + 1]);
                corners.add(ids[j + 1][i + 1]);
                corners.add(ids[j + 1][i]);
                model.addPlate(corners, component, thickness);
            }
        }

        for (int j = 0; j <= rows; j++) {
            for (int i = 0; i < cols; i++) {
                model.addMember(ids[j][i], ids[j][i + 1], MemberRole.PLATE_EDGE);
            }
        }
        for (int j = 0; j < rows; j++) {
            for (int i = 0; i <= cols; i++) {
                model.addMember(ids[j][i], ids[j + 1][i], MemberRole.PLATE_EDGE);
            }
        }
        return ids;
    }

    private static void warnIfTruncated(ModelBuilder model, String name, double value) {
        if (value != divisions(value)) {
            model.warn(name + " " + value + " truncated to " + divisions(value) + " mesh units");
        }
    }

    static int divisions(double dimension) {
        return (int) Math.floor(dimension);
    }

    private static int edgeCount(int cols, int rows) {
        return cols * (rows + 1) + rows * (cols + 1);
    }
}
