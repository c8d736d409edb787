package com.structural.topology.export;

import java.util.EnumMap;
import java.util.Map;

import com.structural.topology.model.MemberRole;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Options for {@link StructuralModelWriter}. Section properties are full property
 * specifications ({@code TABLE ST W12X26}, {@code PRIS YD 0.45 ZD 0.3}); roles without
 * an explicit entry fall back to {@link #DEFAULT_SECTIONS}.
 */
@Value
@Builder(toBuilder = true)
public class ExportSettings {

    public static final Map<MemberRole, String> DEFAULT_SECTIONS = defaultSections();

    @NonNull
    @Builder.Default
    String title = "TOPOLOGY MODEL";

    @NonNull
    @Builder.Default
    UnitSystem units = UnitSystem.FEET_KIP;

    @NonNull
    @Builder.Default
    AxisConvention axis = AxisConvention.Y_UP;

    @NonNull
    @Builder.Default
    Material material = Material.STEEL;

    /**
     * Support type of every support joint not covered by a side override.
     */
    @NonNull
    @Builder.Default
    SupportType supportType = SupportType.PINNED;

    /**
     * Optional override for the support joints at the start of the span. For gable frames
     * the span runs across the width, otherwise along x.
     */
    SupportType leftSupport;

    /**
     * Optional override for the support joints at the end of the span.
     */
    SupportType rightSupport;

    @Singular
    Map<MemberRole, String> sections;

    @Builder.Default
    boolean emitSupports = true;

    @NonNull
    @Builder.Default
    LoadSettings loads = LoadSettings.none();

    /**
     * Adds {@code PERFORM ANALYSIS}; only written when at least one load case exists.
     */
    @Builder.Default
    boolean performAnalysis = false;

    /**
     * Plate edges duplicate the element boundaries, so they are left out unless asked for.
     */
    @Builder.Default
    boolean emitPlateEdgeMembers = false;

    public static ExportSettings defaults() {
        return ExportSettings.builder().build();
    }

    public String sectionFor(MemberRole role) {
        String section = sections.get(role);
        return section != null ? section : DEFAULT_SECTIONS.get(role);
    }

    private static Map<MemberRole, String> defaultSections() {
        Map<MemberRole, String> defaults = new EnumMap<>(MemberRole.class);
        defaults.put(MemberRole.CHORD_TOP, "TABLE ST W12X26");
        defaults.put(MemberRole.CHORD_BOTTOM, "TABLE ST W12X26");
        defaults.put(MemberRole.DIAGONAL, "TABLE ST L40404");
        defaults.put(MemberRole.VERTICAL, "TABLE ST L40404");
        defaults.put(MemberRole.COLUMN, "TABLE ST W14X90");
        defaults.put(MemberRole.RAFTER, "TABLE ST W18X35");
        defaults.put(MemberRole.PURLIN, "TABLE ST C8X11.5");
        defaults.put(MemberRole.BRACING, "TABLE ST L40404");
        defaults.put(MemberRole.BEAM, "PRIS YD 0.45 ZD 0.3");
        defaults.put(MemberRole.PLATE_EDGE, "PRIS YD 0.1 ZD 0.1");
        return Map.copyOf(defaults);
    }
}
