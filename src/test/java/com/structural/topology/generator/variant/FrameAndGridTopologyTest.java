package com.structural.topology.generator.variant;

import static com.structural.topology.generator.TopologyFixtures.grid;
import static com.structural.topology.generator.TopologyFixtures.portal;
import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.Test;

import com.structural.topology.generator.TopologyGenerator;
import com.structural.topology.generator.TopologyValidationException;
import com.structural.topology.model.GenerationResult;
import com.structural.topology.model.Joint;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.Measure;
import com.structural.topology.model.Member;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.TopologyKind;

class FrameAndGridTopologyTest {

    private final TopologyGenerator generator = new TopologyGenerator();

    @Test
    void testPortalFrame() {
        GenerationResult result = generator.generate(TopologyKind.PORTAL_FRAME, portal(30.0, 12.0));

        assertThat(result.getJoints()).containsExactly(
                new Joint(1, 0.0, 0.0, 0.0),
                new Joint(2, 30.0, 0.0, 0.0),
                new Joint(3, 0.0, 12.0, 0.0),
                new Joint(4, 30.0, 12.0, 0.0));
        assertThat(result.getMembers()).containsExactly(
                new Member(1, 1, 3, MemberRole.COLUMN),
                new Member(2, 2, 4, MemberRole.COLUMN),
                new Member(3, 3, 4, MemberRole.BEAM));
        assertThat(result.getLandmark(Landmark.SUPPORT_CANDIDATES)).containsExactly(1, 2);
        assertThat(result.getLandmark(Landmark.EAVE_JOINTS)).containsExactly(3, 4);
    }

    @Test
    void testPortalFrameRequiresEaveHeight() {
        assertThatThrownBy(() -> generator.generate(TopologyKind.PORTAL_FRAME, portal(30.0, 12.0).toBuilder()
                .eaveHeight(null)
                .build()))
                .isInstanceOf(TopologyValidationException.class)
                .hasMessageContaining("eaveHeight: is required");
    }

    @Test
    void testGridCounts() {
        GenerationResult result = generator.generate(TopologyKind.BUILDING_GRID, grid(2, 3, 4));

        assertThat(result.getJoints()).hasSize(60);
        assertThat(result.counts().membersWithRole(MemberRole.BEAM)).isEqualTo(68);
        assertThat(result.counts().membersWithRole(MemberRole.COLUMN)).isEqualTo(48);
        assertThat(result.getMembers()).hasSize(116);
        assertThat(result.getMeasure(Measure.OVERALL_HEIGHT)).hasValue(14.0);
    }

    @Test
    void testGridNumbersBeamsBeforeColumns() {
        GenerationResult result = generator.generate(TopologyKind.BUILDING_GRID, grid(2, 3, 4));

        // level 1 starts at joint 13; joint (level, i, j) = level * 12 + i * 4 + j + 1
        assertThat(result.getMember(1)).isEqualTo(new Member(1, 13, 17, MemberRole.BEAM));
        assertThat(result.getMember(2)).isEqualTo(new Member(2, 13, 14, MemberRole.BEAM));
        assertThat(result.getMember(68).getRole()).isEqualTo(MemberRole.BEAM);
        assertThat(result.getMember(69)).isEqualTo(new Member(69, 1, 13, MemberRole.COLUMN));
        assertThat(result.getJoint(60)).isEqualTo(new Joint(60, 12.0, 14.0, 15.0));
        assertThat(result.getLandmark(Landmark.BASE_JOINTS)).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12);
    }

    @Test
    void testSingleStoryGrid() {
        GenerationResult result = generator.generate(TopologyKind.BUILDING_GRID, grid(1, 1, 1));

        assertThat(result.getJoints()).hasSize(8);
        assertThat(result.getMembers()).hasSize(8);
    }

    @Test
    void testGridRejectsTooManyStories() {
        TopologyValidationException e = catchThrowableOfType(
                () -> generator.generate(TopologyKind.BUILDING_GRID, grid(2, 2, 51)),
                TopologyValidationException.class);

        assertThat(e.getViolations()).hasSize(1);
        assertThat(e.hasViolationFor("stories")).isTrue();
    }
}
