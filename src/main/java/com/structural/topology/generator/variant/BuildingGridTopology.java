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
 * Orthogonal multi-story building grid. Joints form a regular lattice indexed by
 * (level, i, j) with level 0 at the ground; beams run along x and z on every
 * suspended level and columns join vertically adjacent levels.
 */
public class BuildingGridTopology implements TopologyVariant {

    static final int MAX_BAYS = 20;
    static final int MAX_STORIES = 50;
    static final double MAX_BAY_SIZE = 50.0;
    static final double MAX_STORY_HEIGHT = 100.0;

    @Value
    static class GridKey {
        int level;
        int i;
        int j;
    }

    @Override
    public TopologyKind kind() {
        return TopologyKind.BUILDING_GRID;
    }

    @Override
    public void validate(TopologyParameters p, ParameterValidator validator) {
        validator.requireCount("baysX", p.getBaysX(), MAX_BAYS);
        validator.requireCount("baysZ", p.getBaysZ(), MAX_BAYS);
        validator.requireCount("stories", p.getStories(), MAX_STORIES);
        validator.requireDimension("bayWidth", p.getBayWidth(), MAX_BAY_SIZE);
        validator.requireDimension("bayDepth", p.getBayDepth(), MAX_BAY_SIZE);
        validator.requireDimension("storyHeight", p.getStoryHeight(), MAX_STORY_HEIGHT);
    }

    @Override
    public TopologyCounts predictCounts(TopologyParameters p) {
        int baysX = p.getBaysX();
        int baysZ = p.getBaysZ();
        int stories = p.getStories();
        int perLevel = (baysX + 1) * (baysZ + 1);
        int beams = stories * (baysX * (baysZ + 1) + baysZ * (baysX + 1));
        int columns = stories * perLevel;
        return TopologyCounts.builder()
                .joints((stories + 1) * perLevel)
                .members(beams + columns)
                .plates(0)
                .roleCount(MemberRole.BEAM, beams)
                .roleCount(MemberRole.COLUMN, columns)
                .build();
    }

    @Override
    public void synthesize(TopologyParameters p, ModelBuilder model) {
        int baysX = p.getBaysX();
        int baysZ = p.getBaysZ();
        int stories = p.getStories();
        double bayWidth = p.getBayWidth();
        double bayDepth = p.getBayDepth();
        double storyHeight = p.getStoryHeight();

        JointIndex<GridKey> index = new JointIndex<>();
        for (int level = 0; level <= stories; level++) {
            for (int i = 0; i <= baysX; i++) {
                for (int j = 0; j <= baysZ; j++) {
                    index.put(new GridKey(level, i, j),
                            model.addJoint(i * bayWidth, level * storyHeight, j * bayDepth));
                }
            }
        }

        for (int level = 1; level <= stories; level++) {
            for (int i = 0; i <= baysX; i++) {
                for (int j = 0; j <= baysZ; j++) {
                    int joint = index.get(new GridKey(level, i, j));
                    if (i < baysX) {
                        model.addMember(joint, index.get(new GridKey(level, i + 1, j)), MemberRole.BEAM);
                    }
                    if (j < baysZ) {
                        model.addMember(joint, index.get(new GridKey(level, i, j + 1)), MemberRole.BEAM);
                    }
                }
            }
        }

        for (int level = 0; level < stories; level++) {
            for (int i = 0; i <= baysX; i++) {
                for (int j = 0; j <= baysZ; j++) {
                    model.addMember(index.get(new GridKey(level, i, j)),
                            index.get(new GridKey(level + 1, i, j)), MemberRole.COLUMN);
                }
            }
        }

        for (int i = 0; i <= baysX; i++) {
            for (int j = 0; j <= baysZ; j++) {
                int base = index.get(new GridKey(0, i, j));
                model.mark(Landmark.BASE_JOINTS, base);
                model.mark(Landmark.SUPPORT_CANDIDATES, base);
            }
        }

        model.measure(Measure.OVERALL_LENGTH, baysX * bayWidth);
        model.measure(Measure.OVERALL_HEIGHT, stories * storyHeight);
    }
}
