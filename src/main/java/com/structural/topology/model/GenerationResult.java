package com.structural.topology.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Complete, read-only output of one generation call.
 *
 * Joints, members and plates are stored in id order, so the element with id {@code n}
 * sits at list index {@code n - 1}.
 */
@Value
@Builder
public class GenerationResult {

    @NonNull
    TopologyKind kind;

    @NonNull
    TopologyParameters parameters;

    @NonNull
    List<Joint> joints;

    @NonNull
    List<Member> members;

    @NonNull
    List<Plate> plates;

    @NonNull
    Map<Landmark, List<Integer>> landmarks;

    @NonNull
    Map<Measure, Double> measures;

    /**
     * Non-fatal notes about the generated geometry (e.g. omitted purlins).
     */
    @NonNull
    List<String> warnings;

    public Joint getJoint(int id) {
        if (id < 1 || id > joints.size()) {
            throw new IllegalArgumentException("No joint with id " + id);
        }
        return joints.get(id - 1);
    }

    public Member getMember(int id) {
        if (id < 1 || id > members.size()) {
            throw new IllegalArgumentException("No member with id " + id);
        }
        return members.get(id - 1);
    }

    public boolean hasJoint(int id) {
        return id >= 1 && id <= joints.size();
    }

    public MemberRole roleOf(int memberId) {
        return getMember(memberId).getRole();
    }

    /**
     * Member ids grouped by role, in id order. Every member id appears exactly once.
     */
    public Map<MemberRole, List<Integer>> membersByRole() {
        Map<MemberRole, List<Integer>> byRole = new EnumMap<>(MemberRole.class);
        for (Member member : members) {
            byRole.computeIfAbsent(member.getRole(), r -> new ArrayList<>()).add(member.getId());
        }
        return byRole;
    }

    public List<Integer> getLandmark(Landmark landmark) {
        return landmarks.getOrDefault(landmark, Collections.emptyList());
    }

    public OptionalDouble getMeasure(Measure measure) {
        Double value = measures.get(measure);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public TopologyCounts counts() {
        TopologyCounts.TopologyCountsBuilder builder = TopologyCounts.builder()
                .joints(joints.size())
                .members(members.size())
                .plates(plates.size());
        membersByRole().forEach((role, ids) -> builder.roleCount(role, ids.size()));
        return builder.build();
    }
}
