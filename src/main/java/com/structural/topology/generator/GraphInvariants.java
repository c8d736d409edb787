package com.structural.topology.generator;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.structural.topology.model.GenerationResult;
import com.structural.topology.model.Joint;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.Member;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.Plate;
import com.structural.topology.model.TopologyKind;

/**
 * Post-conditions every generated model must satisfy. A failure here is a generator
 * bug and surfaces as {@link TopologyInvariantException}.
 */
public final class GraphInvariants {

    private GraphInvariants() {
        // Utility class
    }

    public static void verify(GenerationResult result) {
        verifyDenseIds(result);
        verifyJointsFinite(result);
        verifyMemberReferences(result);
        verifyPlateReferences(result);
        verifyNoDuplicateMembers(result);
        verifyConnectivity(result);
    }

    static void verifyDenseIds(GenerationResult result) {
        List<Joint> joints = result.getJoints();
        for (int i = 0; i < joints.size(); i++) {
            if (joints.get(i).getId() != i + 1) {
                throw new TopologyInvariantException("Joint at position " + i + " has id " + joints.get(i).getId());
            }
        }
        List<Member> members = result.getMembers();
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).getId() != i + 1) {
                throw new TopologyInvariantException("Member at position " + i + " has id " + members.get(i).getId());
            }
        }
        List<Plate> plates = result.getPlates();
        for (int i = 0; i < plates.size(); i++) {
            if (plates.get(i).getId() != i + 1) {
                throw new TopologyInvariantException("Plate at position " + i + " has id " + plates.get(i).getId());
            }
        }
    }

    static void verifyJointsFinite(GenerationResult result) {
        for (Joint joint : result.getJoints()) {
            if (!joint.isFinite()) {
                throw new TopologyInvariantException("Joint " + joint.getId() + " has a non-finite coordinate");
            }
        }
    }

    static void verifyMemberReferences(GenerationResult result) {
        for (Member member : result.getMembers()) {
            if (!result.hasJoint(member.getStartJoint()) || !result.hasJoint(member.getEndJoint())) {
                throw new TopologyInvariantException("Member " + member.getId() + " references a missing joint");
            }
            if (member.getStartJoint() == member.getEndJoint()) {
                throw new TopologyInvariantException("Member " + member.getId() + " is a self loop");
            }
        }
    }

    static void verifyPlateReferences(GenerationResult result) {
        for (Plate plate : result.getPlates()) {
            for (int jointId : plate.getJoints()) {
                if (!result.hasJoint(jointId)) {
                    throw new TopologyInvariantException("Plate " + plate.getId() + " references missing joint " + jointId);
                }
            }
        }
    }

    static void verifyNoDuplicateMembers(GenerationResult result) {
        Map<Long, Integer> seen = new HashMap<>();
        for (Member member : result.getMembers()) {
            Integer previous = seen.putIfAbsent(member.undirectedKey(), member.getId());
            if (previous != null) {
                throw new TopologyInvariantException("Members " + previous + " and " + member.getId()
                        + " connect the same joints");
            }
        }
    }

    static void verifyConnectivity(GenerationResult result) {
        int jointCount = result.getJoints().size();
        if (jointCount == 0) {
            return;
        }
        DisjointSets components = new DisjointSets(jointCount);
        for (Member member : result.getMembers()) {
            components.union(member.getStartJoint() - 1, member.getEndJoint() - 1);
        }

        if (result.getKind() == TopologyKind.GABLE_FRAME && !tiesStations(result)) {
            verifyOneComponentPerStation(result, components);
            return;
        }

        if (result.getKind().requiresSingleComponent()) {
            if (components.count() != 1) {
                throw new TopologyInvariantException(result.getKind().getDisplayName() + " has "
                        + components.count() + " disconnected parts");
            }
            return;
        }

        // Composed models: each component landmark must be internally connected
        verifyLandmarkConnected(result, components, Landmark.WALL_JOINTS);
        verifyLandmarkConnected(result, components, Landmark.SLAB_JOINTS);
    }

    /**
     * Purlins and bracing are the only members running between stations.
     */
    private static boolean tiesStations(GenerationResult result) {
        return result.getMembers().stream()
                .anyMatch(m -> m.getRole() == MemberRole.PURLIN || m.getRole() == MemberRole.BRACING);
    }

    /**
     * Without longitudinal members every station frame is its own part. Each station has
     * exactly one ridge joint, so the parts must match the ridge joints one to one.
     */
    private static void verifyOneComponentPerStation(GenerationResult result, DisjointSets components) {
        List<Integer> ridges = result.getLandmark(Landmark.RIDGE_JOINTS);
        if (components.count() != ridges.size()) {
            throw new TopologyInvariantException(result.getKind().getDisplayName() + " has "
                    + components.count() + " disconnected parts for " + ridges.size() + " stations");
        }
        Set<Integer> roots = new HashSet<>();
        for (int ridge : ridges) {
            if (!roots.add(components.find(ridge - 1))) {
                throw new TopologyInvariantException("Ridge joint " + ridge + " shares its part with another station");
            }
        }
    }

    private static void verifyLandmarkConnected(GenerationResult result, DisjointSets components, Landmark landmark) {
        List<Integer> ids = result.getLandmark(landmark);
        if (ids.isEmpty()) {
            return;
        }
        int root = components.find(ids.get(0) - 1);
        for (int id : ids) {
            if (components.find(id - 1) != root) {
                throw new TopologyInvariantException(landmark + " joint " + id + " is not connected to its component");
            }
        }
    }

    /**
     * Union-find over zero-based joint indices.
     */
    static final class DisjointSets {
        private final int[] parent;
        private int count;

        DisjointSets(int size) {
            parent = new int[size];
            for (int i = 0; i < size; i++) {
                parent[i] = i;
            }
            count = size;
        }

        int find(int i) {
            while (parent[i] != i) {
                parent[i] = parent[parent[i]];
                i = parent[i];
            }
            return i;
        }

        void union(int a, int b) {
            int ra = find(a);
            int rb = find(b);
            if (ra != rb) {
                parent[ra] = rb;
                count--;
            }
        }

        int count() {
            return count;
        }
    }
}
