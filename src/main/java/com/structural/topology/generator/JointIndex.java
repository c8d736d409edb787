package com.structural.topology.generator;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps symbolic joint keys (station and landmark, lattice indices, ...) to joint ids,
 * so connectivity never depends on id arithmetic.
 */
public class JointIndex<K> {

    private final Map<K, Integer> ids = new HashMap<>();

    public void put(K key, int jointId) {
        Integer previous = ids.putIfAbsent(key, jointId);
        if (previous != null) {
            throw new TopologyInvariantException("Joint key " + key + " already bound to joint " + previous);
        }
    }

    public int get(K key) {
        Integer id = ids.get(key);
        if (id == null) {
            throw new TopologyInvariantException("No joint for key " + key);
        }
        return id;
    }

    public int size() {
        return ids.size();
    }
}
