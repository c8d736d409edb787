package com.structural.topology.generator;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.structural.topology.generator.variant.BowstringTruss;
import com.structural.topology.generator.variant.BuildingGridTopology;
import com.structural.topology.generator.variant.GableFrameTopology;
import com.structural.topology.generator.variant.HoweTruss;
import com.structural.topology.generator.variant.PlateMeshTopology;
import com.structural.topology.generator.variant.PortalFrameTopology;
import com.structural.topology.generator.variant.PrattTruss;
import com.structural.topology.generator.variant.WarrenTruss;
import com.structural.topology.model.GenerationResult;
import com.structural.topology.model.TopologyCounts;
import com.structural.topology.model.TopologyKind;
import com.structural.topology.model.TopologyParameters;

/**
 * Entry point of the topology generator.
 *
 * Stateless and side-effect free: each call validates its parameters, builds a fresh
 * model, checks the model's invariants and returns it. Instances can be shared
 * between threads.
 */
public class TopologyGenerator {

    private final Map<TopologyKind, TopologyVariant> variants;

    public TopologyGenerator() {
        this(List.of(
                new WarrenTruss(),
                new PrattTruss(),
                new HoweTruss(),
                new BowstringTruss(),
                new PortalFrameTopology(),
                new GableFrameTopology(),
                new BuildingGridTopology(),
                new PlateMeshTopology()));
    }

    public TopologyGenerator(List<TopologyVariant> variants) {
        Map<TopologyKind, TopologyVariant> byKind = new EnumMap<>(TopologyKind.class);
        for (TopologyVariant variant : variants) {
            if (byKind.put(variant.kind(), variant) != null) {
                throw new IllegalArgumentException("Duplicate variant for " + variant.kind());
            }
        }
        this.variants = byKind;
    }

    /**
     * Generates the topology of the given kind.
     *
     * @throws TopologyValidationException if the parameters are invalid or infeasible;
     *                                     nothing is generated in that case
     */
    public GenerationResult generate(TopologyKind kind, TopologyParameters parameters) {
        TopologyVariant variant = validated(kind, parameters);

        ModelBuilder model = new ModelBuilder(kind, parameters);
        variant.synthesize(parameters, model);
        GenerationResult result = model.build();

        GraphInvariants.verify(result);
        return result;
    }

    /**
     * Predicts the counts {@link #generate} would produce, without building geometry.
     *
     * @throws TopologyValidationException if the parameters are invalid or infeasible
     */
    public TopologyCounts predictCounts(TopologyKind kind, TopologyParameters parameters) {
        return validated(kind, parameters).predictCounts(parameters);
    }

    /**
     * Runs validation only and returns every violation found.
     */
    public List<ParameterViolation> check(TopologyKind kind, TopologyParameters parameters) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(parameters, "parameters");
        ParameterValidator validator = new ParameterValidator();
        validator.checkCommon(parameters);
        variantFor(kind).validate(parameters, validator);
        return validator.getViolations();
    }

    private TopologyVariant validated(TopologyKind kind, TopologyParameters parameters) {
        List<ParameterViolation> violations = check(kind, parameters);
        if (!violations.isEmpty()) {
            throw new TopologyValidationException(violations);
        }
        return variantFor(kind);
    }

    private TopologyVariant variantFor(TopologyKind kind) {
        TopologyVariant variant = variants.get(kind);
        if (variant == null) {
            throw new IllegalArgumentException("No topology variant registered for " + kind);
        }
        return variant;
    }
}
