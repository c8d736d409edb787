package com.structural.topology.export;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.structural.topology.model.GenerationResult;
import com.structural.topology.model.Joint;
import com.structural.topology.model.Landmark;
import com.structural.topology.model.Member;
import com.structural.topology.model.MemberRole;
import com.structural.topology.model.Plate;
import com.structural.topology.model.PlateComponent;
import com.structural.topology.model.TopologyFamily;
import com.structural.topology.model.TopologyKind;

import lombok.Value;

/**
 * Template data model: every value is preformatted so the template only lays out lines.
 *
 * Members and shell elements share one numbering space in the command file, so plate
 * element numbers continue after the highest emitted member id.
 */
@Value
public class StructuralModelView {

    String header;
    String title;
    String units;
    List<JointLine> joints;
    List<IncidenceLine> members;
    List<IncidenceLine> elements;
    List<PropertyLine> memberProperties;
    List<PropertyLine> elementProperties;
    String material;
    List<PropertyLine> supports;
    List<LoadCaseBlock> loadCases;
    List<CombinationBlock> combinations;
    boolean performAnalysis;

    @Value
    public static class JointLine {
        String id;
        String x;
        String y;
        String z;
    }

    @Value
    public static class IncidenceLine {
        String id;
        String joints;
    }

    @Value
    public static class PropertyLine {
        String ids;
        String value;
    }

    /**
     * One primary load case; {@code lines} are the command lines below the case header.
     */
    @Value
    public static class LoadCaseBlock {
        String number;
        String loadType;
        String title;
        List<String> lines;
    }

    @Value
    public static class CombinationBlock {
        String number;
        String title;
        String factors;
    }

    public static StructuralModelView of(GenerationResult result, ExportSettings settings) {
        requireSingleLineTitle(settings.getTitle());
        List<String> loadProblems = settings.getLoads().problems();
        if (!loadProblems.isEmpty()) {
            throw new IllegalArgumentException(String.join("; ", loadProblems));
        }

        boolean plane = result.getKind().isPlanar() && settings.getAxis() == AxisConvention.Y_UP;

        List<JointLine> joints = new ArrayList<>();
        for (Joint joint : result.getJoints()) {
            Joint placed = settings.getAxis().apply(joint);
            joints.add(new JointLine(String.valueOf(placed.getId()),
                    coordinate(placed.getX()), coordinate(placed.getY()), coordinate(placed.getZ())));
        }

        List<IncidenceLine> members = new ArrayList<>();
        Map<MemberRole, List<Integer>> byRole = new EnumMap<>(MemberRole.class);
        int lastMemberId = 0;
        for (Member member : result.getMembers()) {
            if (member.getRole() == MemberRole.PLATE_EDGE && !settings.isEmitPlateEdgeMembers()) {
                continue;
            }
            members.add(new IncidenceLine(String.valueOf(member.getId()),
                    member.getStartJoint() + " " + member.getEndJoint()));
            byRole.computeIfAbsent(member.getRole(), r -> new ArrayList<>()).add(member.getId());
            lastMemberId = member.getId();
        }

        List<IncidenceLine> elements = new ArrayList<>();
        Map<String, List<Integer>> byThickness = new LinkedHashMap<>();
        Map<PlateComponent, List<Integer>> byComponent = new EnumMap<>(PlateComponent.class);
        for (Plate plate : result.getPlates()) {
            int elementId = lastMemberId + plate.getId();
            StringBuilder corners = new StringBuilder();
            for (Integer jointId : plate.getJoints()) {
                if (corners.length() > 0) {
                    corners.append(' ');
                }
                corners.append(jointId);
            }
            elements.add(new IncidenceLine(String.valueOf(elementId), corners.toString()));
            byThickness.computeIfAbsent(decimal(plate.getThickness()), t -> new ArrayList<>()).add(elementId);
            byComponent.computeIfAbsent(plate.getComponent(), c -> new ArrayList<>()).add(elementId);
        }

        List<PropertyLine> memberProperties = new ArrayList<>();
        byRole.forEach((role, ids) -> memberProperties.add(
                new PropertyLine(IdRanges.format(ids), settings.sectionFor(role))));

        List<PropertyLine> elementProperties = new ArrayList<>();
        byThickness.forEach((thickness, ids) -> elementProperties.add(
                new PropertyLine(IdRanges.format(ids), "THICKNESS " + thickness)));

        List<PropertyLine> supports = new ArrayList<>();
        if (settings.isEmitSupports()) {
            supportTypes(result, settings).forEach((type, ids) -> supports.add(
                    new PropertyLine(IdRanges.format(ids), type.getKeyword())));
        }

        List<LoadCaseBlock> loadCases = new ArrayList<>();
        Map<LoadCase, Integer> caseNumbers = new EnumMap<>(LoadCase.class);
        for (LoadCase loadCase : LoadCase.values()) {
            List<String> lines = loadLines(loadCase, result, settings, byRole, byComponent);
            if (!lines.isEmpty()) {
                int number = loadCases.size() + 1;
                caseNumbers.put(loadCase, number);
                loadCases.add(new LoadCaseBlock(String.valueOf(number), loadCase.getLoadType(),
                        loadCase.getTitle(), List.copyOf(lines)));
            }
        }

        List<CombinationBlock> combinations = new ArrayList<>();
        if (settings.getLoads().isCombinations()) {
            for (LoadCombination combination : LoadCombination.values()) {
                if (!caseNumbers.keySet().containsAll(combination.getCases())) {
                    continue;
                }
                StringBuilder factors = new StringBuilder();
                for (LoadCase loadCase : combination.getCases()) {
                    if (factors.length() > 0) {
                        factors.append(' ');
                    }
                    factors.append(caseNumbers.get(loadCase)).append(' ')
                            .append(BigDecimal.valueOf(combination.factorFor(loadCase)).toPlainString());
                }
                int number = loadCases.size() + combinations.size() + 1;
                combinations.add(new CombinationBlock(String.valueOf(number), combination.getTitle(),
                        factors.toString()));
            }
        }

        return new StructuralModelView(
                plane ? "STAAD PLANE" : "STAAD SPACE",
                settings.getTitle(),
                settings.getUnits().getKeyword(),
                joints, members, elements, memberProperties, elementProperties,
                settings.getMaterial().getKeyword(),
                supports, loadCases, combinations,
                settings.isPerformAnalysis() && !loadCases.isEmpty());
    }

    /**
     * The title becomes one command line, so it may not break the line or end the command.
     */
    static void requireSingleLineTitle(String title) {
        if (title.indexOf('\n') >= 0 || title.indexOf('\r') >= 0 || title.indexOf(';') >= 0) {
            throw new IllegalArgumentException("Title must not contain line breaks or ';'. Got: " + title);
        }
    }

    /**
     * Groups the support joints by type, keeping the order in which types first appear.
     * Side overrides apply to the joints at the lowest and highest span position.
     */
    private static Map<SupportType, List<Integer>> supportTypes(GenerationResult result, ExportSettings settings) {
        List<Integer> supportJoints = result.getLandmark(Landmark.SUPPORT_CANDIDATES);
        Map<SupportType, List<Integer>> byType = new LinkedHashMap<>();
        if (supportJoints.isEmpty()) {
            return byType;
        }
        double start = Double.POSITIVE_INFINITY;
        double end = Double.NEGATIVE_INFINITY;
        for (int id : supportJoints) {
            double position = spanPosition(result, id);
            start = Math.min(start, position);
            end = Math.max(end, position);
        }
        for (int id : supportJoints) {
            double position = spanPosition(result, id);
            SupportType type = settings.getSupportType();
            if (position == start && settings.getLeftSupport() != null) {
                type = settings.getLeftSupport();
            } else if (position == end && settings.getRightSupport() != null) {
                type = settings.getRightSupport();
            }
            byType.computeIfAbsent(type, t -> new ArrayList<>()).add(id);
        }
        return byType;
    }

    private static double spanPosition(GenerationResult result, int jointId) {
        Joint joint = result.getJoint(jointId);
        // a gable frame spans its width; its length runs along x
        return result.getKind() == TopologyKind.GABLE_FRAME ? joint.getZ() : joint.getX();
    }

    private static List<String> loadLines(LoadCase loadCase, GenerationResult result, ExportSettings settings,
            Map<MemberRole, List<Integer>> byRole, Map<PlateComponent, List<Integer>> byComponent) {
        LoadSettings loads = settings.getLoads();
        String vertical = settings.getAxis().getVertical();
        TopologyFamily family = result.getKind().getFamily();
        List<String> lines = new ArrayList<>();
        switch (loadCase) {
            case DEAD:
                if (loads.isSelfWeight()) {
                    lines.add("SELFWEIGHT " + vertical + " -1");
                }
                addUniformLoad(lines, gravityMembers(family, byRole), byComponent.get(PlateComponent.SLAB),
                        "G" + vertical, -loads.getDeadLoad());
                break;
            case LIVE:
                addUniformLoad(lines, gravityMembers(family, byRole), byComponent.get(PlateComponent.SLAB),
                        "G" + vertical, -loads.getLiveLoad());
                List<Integer> loaded = result.getLandmark(Landmark.LOADED_JOINTS);
                if (loads.getJointLiveLoad() > 0.0 && !loaded.isEmpty()) {
                    lines.add("JOINT LOAD");
                    lines.add(IdRanges.format(loaded) + " F" + vertical + " " + decimal(-loads.getJointLiveLoad()));
                }
                break;
            case WIND:
                String lateral = result.getKind() == TopologyKind.GABLE_FRAME
                        ? "G" + settings.getAxis().getTransverse()
                        : "GX";
                addUniformLoad(lines, windMembers(family, byRole), byComponent.get(PlateComponent.WALL),
                        lateral, loads.getWindLoad());
                break;
            default:
                throw new IllegalStateException("Unhandled load case " + loadCase);
        }
        return lines;
    }

    private static void addUniformLoad(List<String> lines, List<Integer> memberIds, List<Integer> elementIds,
            String direction, double magnitude) {
        if (magnitude == 0.0) {
            return;
        }
        if (!memberIds.isEmpty()) {
            lines.add("MEMBER LOAD");
            lines.add(IdRanges.format(memberIds) + " UNI " + direction + " " + decimal(magnitude));
        }
        if (elementIds != null && !elementIds.isEmpty()) {
            lines.add("ELEMENT LOAD");
            lines.add(IdRanges.format(elementIds) + " PR " + direction + " " + decimal(magnitude));
        }
    }

    /**
     * Members carrying the uniform dead and live loads: the deck chord of a truss, the
     * roof of a frame and the floor beams of a grid.
     */
    private static List<Integer> gravityMembers(TopologyFamily family, Map<MemberRole, List<Integer>> byRole) {
        switch (family) {
            case TRUSS:
                return withRoles(byRole, MemberRole.CHORD_BOTTOM);
            case FRAME:
                return withRoles(byRole, MemberRole.RAFTER, MemberRole.BEAM);
            case GRID:
                return withRoles(byRole, MemberRole.BEAM);
            default:
                return List.of();
        }
    }

    private static List<Integer> windMembers(TopologyFamily family, Map<MemberRole, List<Integer>> byRole) {
        switch (family) {
            case TRUSS:
                return byRole.containsKey(MemberRole.VERTICAL)
                        ? withRoles(byRole, MemberRole.VERTICAL)
                        : withRoles(byRole, MemberRole.CHORD_BOTTOM);
            case FRAME:
            case GRID:
                return withRoles(byRole, MemberRole.COLUMN);
            default:
                return List.of();
        }
    }

    private static List<Integer> withRoles(Map<MemberRole, List<Integer>> byRole, MemberRole... roles) {
        List<Integer> ids = new ArrayList<>();
        for (MemberRole role : roles) {
            ids.addAll(byRole.getOrDefault(role, List.of()));
        }
        return ids;
    }

    static String coordinate(double value) {
        // avoid printing -0.0000
        return String.format(Locale.ROOT, "%.4f", value == 0.0 ? 0.0 : value);
    }

    static String decimal(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
