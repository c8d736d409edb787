package com.structural.topology.generator;

import com.structural.topology.model.TopologyCounts;
import com.structural.topology.model.TopologyKind;
import com.structural.topology.model.TopologyParameters;

/**
 * One tagged topology variant: its parameter rules, its closed-form counts and its
 * coordinate and connectivity synthesis.
 *
 * Implementations hold no mutable state; all per-call state lives in the
 * {@link ModelBuilder} handed to {@link #synthesize}.
 */
public interface TopologyVariant {

    TopologyKind kind();

    /**
     * Records every violation of this variant's parameter rules.
     */
    void validate(TopologyParameters parameters, ParameterValidator validator);

    /**
     * Counts derived from validated parameters alone, without building geometry.
     */
    TopologyCounts predictCounts(TopologyParameters parameters);

    /**
     * Creates joints, members, plates and landmarks for validated parameters.
     */
    void synthesize(TopologyParameters parameters, ModelBuilder model);
}
