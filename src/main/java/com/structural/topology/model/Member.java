package com.structural.topology.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A line element between two joints. The role is fixed when the member is created.
 */
@Value
public class Member {
    int id;
    int startJoint;
    int endJoint;
    @NonNull
    MemberRole role;

    /**
     * Order-independent key of the joint pair, used to detect duplicate members.
     */
    public long undirectedKey() {
        long lo = Math.min(startJoint, endJoint);
        long hi = Math.max(startJoint, endJoint);
        return (hi << 32) | lo;
    }
}
