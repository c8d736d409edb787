package com.structural.topology.model;

import java.util.Map;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Joint, member and plate counts of a topology, either predicted from parameters
 * or taken from a generated result.
 */
@Value
@Builder(toBuilder = true)
public class TopologyCounts {

    int joints;

    int members;

    int plates;

    /**
     * Members per role. Roles without members may be absent.
     */
    @NonNull
    @Singular("roleCount")
    Map<MemberRole, Integer> roleCounts;

    public int membersWithRole(MemberRole role) {
        return roleCounts.getOrDefault(role, 0);
    }
}
