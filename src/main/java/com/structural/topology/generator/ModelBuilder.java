package com.structural.topology.generator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.structural.topology.model.GenerationResult;
import com.structural.topology.model.Joint;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.Measure;
import com.structural.topology.model.Member;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.Plate;
import com.structural.topology.model.PlateComponent;
import com.structural.topology.model.TopologyKind;
import com.structural.topology.model.TopologyParameters;

/**
 * Per-call accumulator for one generation run. Owns the joint, member and plate id
 * counters, so independent runs never share numbering state.
 */
public class ModelBuilder {

    private final TopologyKind kind;
    private final TopologyParameters parameters;

    private final List<Joint> joints = new ArrayList<>();
    private final List<Member> members = new ArrayList<>();
    private final List<Plate> plates = new ArrayList<>();
    private final Map<Landmark, List<Integer>> landmarks = new EnumMap<>(Landmark.class);
    private final Map<Measure, Double> measures = new EnumMap<>(Measure.class);
    private final List<String> warnings = new ArrayList<>();

    public ModelBuilder(TopologyKind kind, TopologyParameters parameters) {
        this.kind = kind;
        this.parameters = parameters;
    }

    /**
     * @return the id of the new joint
     */
    public int addJoint(double x, double y, double z) {
        int id = joints.size() + 1;
        joints.add(new Joint(id, x, y, z));
        return id;
    }

    /**
     * @return the id of the new member
     */
    public int addMember(int startJoint, int endJoint, MemberRole role) {
        requireJoint(startJoint);
        requireJoint(endJoint);
        if (startJoint == endJoint) {
            throw new TopologyInvariantException("Member would connect joint " + startJoint + " to itself");
        }
        int id = members.size() + 1;
        members.add(new Member(id, startJoint, endJoint, role));
        return id;
    }

    /**
     * @return the id of the new plate
     */
    public int addPlate(List<Integer> corners, PlateComponent component, double thickness) {
        if (corners.size() != 4) {
            throw new TopologyInvariantException("Plate needs 4 corners, got " + corners.size());
        }
        corners.forEach(this::requireJoint);
        int id = plates.size() + 1;
        plates.add(new Plate(id, List.copyOf(corners), component, thickness));
        return id;
    }

    public void mark(Landmark landmark, int jointId) {
        requireJoint(jointId);
        landmarks.computeIfAbsent(landmark, l -> new ArrayList<>()).add(jointId);
    }

    public void measure(Measure measure, double value) {
        measures.put(measure, value);
    }

    public void warn(String warning) {
        warnings.add(warning);
    }

    public int memberCount() {
        return members.size();
    }

    /**
     * Distance between the two joints of a member already added to this model.
     */
    public double memberLength(int memberId) {
        if (memberId < 1 || memberId > members.size()) {
            throw new TopologyInvariantException("Reference to unknown member " + memberId);
        }
        Member member = members.get(memberId - 1);
        return joints.get(member.getStartJoint() - 1).distanceTo(joints.get(member.getEndJoint() - 1));
    }

    public GenerationResult build() {
        Map<Landmark, List<Integer>> frozenLandmarks = new EnumMap<>(Landmark.class);
        landmarks.forEach((landmark, ids) -> frozenLandmarks.put(landmark, List.copyOf(ids)));

        return GenerationResult.builder()
                .kind(kind)
                .parameters(parameters)
                .joints(List.copyOf(joints))
                .members(List.copyOf(members))
                .plates(List.copyOf(plates))
                .landmarks(Collections.unmodifiableMap(frozenLandmarks))
                .measures(Collections.unmodifiableMap(new EnumMap<>(measures)))
                .warnings(List.copyOf(warnings))
                .build();
    }

    private void requireJoint(int jointId) {
        if (jointId < 1 || jointId > joints.size()) {
            throw new TopologyInvariantException("Reference to unknown joint " + jointId);
        }
    }
}
