package com.structural.topology.model;

/**
 * Structural pattern families the generator can produce.
 */
public enum TopologyKind {
    WARREN_TRUSS("Warren truss", TopologyFamily.TRUSS, true),
    PRATT_TRUSS("Pratt truss", TopologyFamily.TRUSS, true),
    HOWE_TRUSS("Howe truss", TopologyFamily.TRUSS, true),
    BOWSTRING_ARCH("Bowstring arch", TopologyFamily.TRUSS, true),
    PORTAL_FRAME("Rigid portal frame", TopologyFamily.FRAME, true),
    GABLE_FRAME("Multi-bay rigid frame", TopologyFamily.FRAME, false),
    BUILDING_GRID("Orthogonal multi-story grid", TopologyFamily.GRID, false),
    PLATE_MESH("Planar 1x1 plate mesh", TopologyFamily.PLATE, false);

    private final String displayName;
    private final TopologyFamily family;
    private final boolean planar;

    TopologyKind(String displayName, TopologyFamily family, boolean planar) {
        this.displayName = displayName;
        this.family = family;
        this.planar = planar;
    }

    public String getDisplayName() {
        return displayName;
    }

    public TopologyFamily getFamily() {
        return family;
    }

    /**
     * True when every joint lies in the z = 0 plane.
     */
    public boolean isPlanar() {
        return planar;
    }

    /**
     * Whether the whole member graph must form a single connected component.
     * Plate meshes are composed of independent components instead, and a gable frame
     * without purlins or bracing is checked station by station.
     */
    public boolean requiresSingleComponent() {
        return family != TopologyFamily.PLATE;
    }
}
