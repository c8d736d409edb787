package com.structural.topology.generator;

import static org.assertj.core.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.structural.topology.model.GenerationResult;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.PlateComponent;
import com.structural.topology.model.TopologyKind;
import com.structural.topology.model.TopologyParameters;

class GraphInvariantsTest {

    private static final TopologyParameters NO_PARAMETERS = TopologyParameters.builder().build();

    @Test
    void testConnectedModelPasses() {
        ModelBuilder model = new ModelBuilder(TopologyKind.PORTAL_FRAME, NO_PARAMETERS);
        int a = model.addJoint(0, 0, 0);
        int b = model.addJoint(0, 3, 0);
        int c = model.addJoint(4, 3, 0);
        model.addMember(a, b, MemberRole.COLUMN);
        model.addMember(b, c, MemberRole.BEAM);

        assertThatCode(() -> GraphInvariants.verify(model.build())).doesNotThrowAnyException();
    }

    @Test
    void testDisconnectedFrameRejected() {
        ModelBuilder model = new ModelBuilder(TopologyKind.PORTAL_FRAME, NO_PARAMETERS);
        int a = model.addJoint(0, 0, 0);
        int b = model.addJoint(0, 3, 0);
        model.addJoint(9, 9, 0);
        model.addMember(a, b, MemberRole.COLUMN);

        assertThatThrownBy(() -> GraphInvariants.verify(model.build()))
                .isInstanceOf(TopologyInvariantException.class)
                .hasMessageContaining("2 disconnected parts");
    }

    @Test
    void testDuplicateMemberRejectedInEitherDirection() {
        ModelBuilder model = new ModelBuilder(TopologyKind.WARREN_TRUSS, NO_PARAMETERS);
        int a = model.addJoint(0, 0, 0);
        int b = model.addJoint(1, 0, 0);
        model.addMember(a, b, MemberRole.CHORD_BOTTOM);
        model.addMember(b, a, MemberRole.DIAGONAL);

        assertThatThrownBy(() -> GraphInvariants.verify(model.build()))
                .isInstanceOf(TopologyInvariantException.class)
                .hasMessage("Members 1 and 2 connect the same joints");
    }

    @Test
    void testNonFiniteJointRejected() {
        ModelBuilder model = new ModelBuilder(TopologyKind.PORTAL_FRAME, NO_PARAMETERS);
        int a = model.addJoint(0, 0, 0);
        int b = model.addJoint(0, Double.POSITIVE_INFINITY, 0);
        model.addMember(a, b, MemberRole.COLUMN);

        assertThatThrownBy(() -> GraphInvariants.verify(model.build()))
                .isInstanceOf(TopologyInvariantException.class)
                .hasMessageContaining("non-finite");
    }

    @Test
    void testPlateComponentsMayBeSeparateButNotBroken() {
        ModelBuilder model = new ModelBuilder(TopologyKind.PLATE_MESH, NO_PARAMETERS);
        int w1 = model.addJoint(0, 0, 0);
        int w2 = model.addJoint(0, 0, 1);
        int s1 = model.addJoint(5, 0, 0);
        int s2 = model.addJoint(6, 0, 0);
        model.addMember(w1, w2, MemberRole.PLATE_EDGE);
        model.addMember(s1, s2, MemberRole.PLATE_EDGE);
        model.mark(Landmark.WALL_JOINTS, w1);
        model.mark(Landmark.WALL_JOINTS, w2);
        model.mark(Landmark.SLAB_JOINTS, s1);
        model.mark(Landmark.SLAB_JOINTS, s2);

        assertThatCode(() -> GraphInvariants.verify(model.build())).doesNotThrowAnyException();

        int stray = model.addJoint(9, 0, 9);
        model.mark(Landmark.SLAB_JOINTS, stray);
        assertThatThrownBy(() -> GraphInvariants.verify(model.build()))
                .isInstanceOf(TopologyInvariantException.class)
                .hasMessageContaining("SLAB_JOINTS");
    }

    @Test
    void testGableStationsWithoutPurlinsOrBracingAreSeparateParts() {
        ModelBuilder model = new ModelBuilder(TopologyKind.GABLE_FRAME, NO_PARAMETERS);
        addStation(model, 0.0);
        addStation(model, 25.0);

        assertThatCode(() -> GraphInvariants.verify(model.build())).doesNotThrowAnyException();

        model.addJoint(50.0, 0.0, 0.0);
        assertThatThrownBy(() -> GraphInvariants.verify(model.build()))
                .isInstanceOf(TopologyInvariantException.class)
                .hasMessage("Multi-bay rigid frame has 3 disconnected parts for 2 stations");
    }

    @Test
    void testGableStationsMustNotMergeWithoutLongitudinalMembers() {
        ModelBuilder model = new ModelBuilder(TopologyKind.GABLE_FRAME, NO_PARAMETERS);
        int ridgeA = addStation(model, 0.0);
        int ridgeB = addStation(model, 25.0);
        model.addMember(ridgeA, ridgeB, MemberRole.RAFTER);
        model.addJoint(50.0, 0.0, 0.0);

        assertThatThrownBy(() -> GraphInvariants.verify(model.build()))
                .isInstanceOf(TopologyInvariantException.class)
                .hasMessage("Ridge joint " + ridgeB + " shares its part with another station");
    }

    @Test
    void testBracedGableFrameMustBeOnePart() {
        ModelBuilder model = new ModelBuilder(TopologyKind.GABLE_FRAME, NO_PARAMETERS);
        int ridgeA = addStation(model, 0.0);
        int ridgeB = addStation(model, 25.0);
        addStation(model, 50.0);
        model.addMember(ridgeA, ridgeB, MemberRole.BRACING);

        // the third station is not braced to the others
        assertThatThrownBy(() -> GraphInvariants.verify(model.build()))
                .isInstanceOf(TopologyInvariantException.class)
                .hasMessage("Multi-bay rigid frame has 2 disconnected parts");
    }

    @Test
    void testModelBuilderRejectsBrokenReferences() {
        ModelBuilder model = new ModelBuilder(TopologyKind.PLATE_MESH, NO_PARAMETERS);
        int a = model.addJoint(0, 0, 0);
        int b = model.addJoint(1, 0, 0);
        int c = model.addJoint(1, 1, 0);

        assertThatThrownBy(() -> model.addMember(a, a, MemberRole.PLATE_EDGE))
                .isInstanceOf(TopologyInvariantException.class);
        assertThatThrownBy(() -> model.addMember(a, 7, MemberRole.PLATE_EDGE))
                .isInstanceOf(TopologyInvariantException.class)
                .hasMessageContaining("unknown joint 7");
        assertThatThrownBy(() -> model.addPlate(List.of(a, b, c), PlateComponent.SLAB, 0.2))
                .isInstanceOf(TopologyInvariantException.class);
        assertThat(model.memberCount()).isZero();
    }

    @Test
    void testMemberLengthFromJointCoordinates() {
        ModelBuilder model = new ModelBuilder(TopologyKind.BOWSTRING_ARCH, NO_PARAMETERS);
        int a = model.addJoint(0, 0, 0);
        int b = model.addJoint(3, 4, 0);
        int c = model.addJoint(3, 4, 0);
        int ab = model.addMember(a, b, MemberRole.CHORD_BOTTOM);
        int bc = model.addMember(b, c, MemberRole.VERTICAL);

        assertThat(model.memberLength(ab)).isEqualTo(5.0);
        assertThat(model.memberLength(bc)).isZero();
        assertThatThrownBy(() -> model.memberLength(3))
                .isInstanceOf(TopologyInvariantException.class)
                .hasMessageContaining("unknown member 3");
    }

    @Test
    void testBuiltResultIsImmutable() {
        ModelBuilder model = new ModelBuilder(TopologyKind.PORTAL_FRAME, NO_PARAMETERS);
        int a = model.addJoint(0, 0, 0);
        model.mark(Landmark.BASE_JOINTS, a);
        GenerationResult result = model.build();

        assertThatThrownBy(() -> result.getJoints().clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.getLandmark(Landmark.BASE_JOINTS).add(2))
                .isInstanceOf(UnsupportedOperationException.class);

        model.addJoint(1, 1, 1);
        assertThat(result.getJoints()).hasSize(1);
    }

    @Test
    void testJointIndexKeysAreUnique() {
        JointIndex<String> index = new JointIndex<>();
        index.put("ridge", 3);

        assertThat(index.get("ridge")).isEqualTo(3);
        assertThatThrownBy(() -> index.put("ridge", 4)).isInstanceOf(TopologyInvariantException.class);
        assertThatThrownBy(() -> index.get("eave")).isInstanceOf(TopologyInvariantException.class);
        assertThat(index.size()).isEqualTo(1);
    }

    /**
     * Adds a column and rafter pair at station {@code x} and returns the ridge joint.
     */
    private static int addStation(ModelBuilder model, double x) {
        int base = model.addJoint(x, 0.0, 0.0);
        int eave = model.addJoint(x, 20.0, 0.0);
        int ridge = model.addJoint(x, 28.0, 30.0);
        model.addMember(base, eave, MemberRole.COLUMN);
        model.addMember(eave, ridge, MemberRole.RAFTER);
        model.mark(Landmark.RIDGE_JOINTS, ridge);
        return ridge;
    }
}
