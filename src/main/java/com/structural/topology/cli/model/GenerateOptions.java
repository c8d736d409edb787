package com.structural.topology.cli.model;

import java.nio.file.Path;

import com.structural.topology.export.AxisConvention;
import com.structural.topology.export.Material;
import com.structural.topology.export.SupportType;
import com.structural.topology.export.UnitSystem;
import com.structural.topology.model.TopologyKind;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "topology-gen" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--kind", "-k" }, required = true, description = "Topology kind: ${COMPLETION-CANDIDATES}")
	private TopologyKind kind;

	// Trusses
	@Option(names = { "--span" }, description = "Truss span")
	private Double span;

	@Option(names = { "--height" }, description = "Truss height (peak height of a bowstring arch)")
	private Double height;

	@Option(names = { "--panels" }, description = "Number of truss panels")
	private Integer panelCount;

	// Frames
	@Option(names = { "--length" }, description = "Building length, used to derive the bay count when --bays is absent")
	private Double length;

	@Option(names = { "--width" }, description = "Frame width between column lines")
	private Double width;

	@Option(names = { "--eave-height" }, description = "Eave height")
	private Double eaveHeight;

	@Option(names = { "--ridge-height" }, description = "Ridge height, must exceed the eave height")
	private Double ridgeHeight;

	@Option(names = { "--bays" }, description = "Number of frame bays")
	private Integer numBays;

	@Option(names = { "--bay-spacing" }, description = "Distance between frame stations")
	private Double baySpacing;

	@Option(names = { "--purlins" }, description = "Add purlin lines between frames")
	private boolean includePurlins;

	@Option(names = { "--purlin-spacing" }, description = "Purlin spacing measured along the half width")
	private Double purlinSpacing;

	@Option(names = { "--bracing" }, description = "Add roof bracing in every bay")
	private boolean includeBracing;

	// Building grids
	@Option(names = { "--bays-x" }, description = "Grid bays along x")
	private Integer baysX;

	@Option(names = { "--bays-z" }, description = "Grid bays along z")
	private Integer baysZ;

	@Option(names = { "--bay-width" }, description = "Grid bay width along x")
	private Double bayWidth;

	@Option(names = { "--bay-depth" }, description = "Grid bay depth along z")
	private Double bayDepth;

	@Option(names = { "--stories" }, description = "Number of stories")
	private Integer stories;

	@Option(names = { "--story-height" }, description = "Story height")
	private Double storyHeight;

	// Plate meshes
	@Option(names = { "--wall-height" }, description = "Wall height in mesh units")
	private Double wallHeight;

	@Option(names = { "--wall-width" }, description = "Wall width in mesh units")
	private Double wallWidth;

	@Option(names = { "--wall-thickness" }, description = "Wall plate thickness")
	private Double wallThickness;

	@Option(names = { "--slab-length" }, description = "Slab length in mesh units")
	private Double slabLength;

	@Option(names = { "--slab-width" }, description = "Slab width in mesh units")
	private Double slabWidth;

	@Option(names = { "--slab-thickness" }, description = "Slab plate thickness")
	private Double slabThickness;

	// Output
	@Option(names = { "--preview" }, description = "Only print the predicted counts, do not generate")
	private boolean preview;

	@Option(names = { "--output", "-o" }, description = "Structural command file to write")
	private Path output;

	@Option(names = { "--force", "-f" }, description = "Overwrite an existing output file")
	private boolean force;

	@Option(names = { "--title" }, defaultValue = "TOPOLOGY MODEL", description = "Job name written to the output file")
	private String title;

	@Option(names = { "--units" }, defaultValue = "FEET_KIP", description = "Unit system: ${COMPLETION-CANDIDATES}")
	private UnitSystem units;

	@Option(names = { "--axis" }, defaultValue = "Y_UP", description = "Vertical axis of the output file: ${COMPLETION-CANDIDATES}")
	private AxisConvention axis;

	@Option(names = { "--supports" }, defaultValue = "PINNED", description = "Support type at support joints: ${COMPLETION-CANDIDATES}")
	private SupportType supportType;

	@Option(names = { "--left-support" }, description = "Support type at the start of the span, overrides --supports")
	private SupportType leftSupport;

	@Option(names = { "--right-support" }, description = "Support type at the end of the span, overrides --supports")
	private SupportType rightSupport;

	@Option(names = { "--no-supports" }, description = "Do not write a SUPPORTS block")
	private boolean skipSupports;

	@Option(names = { "--plate-edges" }, description = "Also write plate edge members")
	private boolean plateEdgeMembers;

	@Option(names = { "--material" }, defaultValue = "STEEL", description = "Material of all members and elements: ${COMPLETION-CANDIDATES}")
	private Material material;

	// Loads
	@Option(names = { "--self-weight" }, description = "Add self weight to the dead load case")
	private boolean selfWeight;

	@Option(names = { "--dead-load" }, description = "Uniform dead load on deck, roof and floor members")
	private Double deadLoad;

	@Option(names = { "--live-load" }, description = "Uniform live load on deck, roof and floor members")
	private Double liveLoad;

	@Option(names = { "--joint-load" }, description = "Live load at every loaded truss joint")
	private Double jointLiveLoad;

	@Option(names = { "--wind-load" }, description = "Uniform lateral wind load")
	private Double windLoad;

	@Option(names = { "--load-combinations" }, description = "Add LRFD load combinations")
	private boolean loadCombinations;

	@Option(names = { "--analysis" }, description = "Request an analysis run in the output file")
	private boolean performAnalysis;
}
