package com.structural.topology.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.structural.topology.cli.exception.OptionsValidationException;
import com.structural.topology.cli.model.GenerateOptions;
import com.structural.topology.cli.model.ValidatedGenerateOptions;
import com.structural.topology.export.ExportSettings;
import com.structural.topology.export.LoadSettings;
import com.structural.topology.model.TopologyParameters;

/**
 * Checks command line concerns only. Structural parameter bounds are enforced by the
 * generator itself.
 */
public class GenerateOptionsValidator {

	public ValidatedGenerateOptions validate(GenerateOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getKind() == null) {
			errors.add("Topology kind is required (--kind / -k).");
		}

		if (o.getPurlinSpacing() != null && !o.isIncludePurlins()) {
			errors.add("--purlin-spacing requires --purlins.");
		}

		if (isBlank(o.getTitle())) {
			errors.add("Title must not be blank (--title).");
		} else if (o.getTitle().matches("(?s).*[\\r\\n;].*")) {
			errors.add("Title must not contain line breaks or ';' (--title).");
		}

		checkLoad(errors, "--dead-load", o.getDeadLoad());
		checkLoad(errors, "--live-load", o.getLiveLoad());
		checkLoad(errors, "--joint-load", o.getJointLiveLoad());
		checkLoad(errors, "--wind-load", o.getWindLoad());
		boolean deadCase = o.isSelfWeight() || isPositive(o.getDeadLoad());
		boolean anyLoad = deadCase || isPositive(o.getLiveLoad()) || isPositive(o.getJointLiveLoad())
				|| isPositive(o.getWindLoad());
		if (o.isLoadCombinations() && !deadCase) {
			errors.add("--load-combinations requires --self-weight or --dead-load.");
		}
		if (o.isPerformAnalysis() && !anyLoad) {
			errors.add("--analysis requires at least one load.");
		}

		Path outputPath = null;
		if (o.getOutput() != null) {
			outputPath = o.getOutput().toAbsolutePath().normalize();
			if (o.isPreview()) {
				errors.add("--preview cannot be combined with --output.");
			}
			if (Files.isDirectory(outputPath)) {
				errors.add("Output must be a file, not a directory: " + outputPath);
			} else if (Files.exists(outputPath) && !o.isForce()) {
				errors.add("Output file already exists: " + outputPath + ". Use --force to overwrite.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedGenerateOptions(toParameters(o), toExportSettings(o), outputPath);
	}

	private TopologyParameters toParameters(GenerateOptions o) {
		return TopologyParameters.builder()
				.span(o.getSpan())
				.height(o.getHeight())
				.panelCount(o.getPanelCount())
				.length(o.getLength())
				.width(o.getWidth())
				.eaveHeight(o.getEaveHeight())
				.ridgeHeight(o.getRidgeHeight())
				.numBays(o.getNumBays())
				.baySpacing(o.getBaySpacing())
				.includePurlins(o.isIncludePurlins())
				.purlinSpacing(o.getPurlinSpacing())
				.includeBracing(o.isIncludeBracing())
				.baysX(o.getBaysX())
				.baysZ(o.getBaysZ())
				.bayWidth(o.getBayWidth())
				.bayDepth(o.getBayDepth())
				.stories(o.getStories())
				.storyHeight(o.getStoryHeight())
				.wallHeight(o.getWallHeight())
				.wallWidth(o.getWallWidth())
				.wallThickness(o.getWallThickness())
				.slabLength(o.getSlabLength())
				.slabWidth(o.getSlabWidth())
				.slabThickness(o.getSlabThickness())
				.build();
	}

	private ExportSettings toExportSettings(GenerateOptions o) {
		return ExportSettings.builder()
				.title(o.getTitle().trim())
				.units(o.getUnits())
				.axis(o.getAxis())
				.material(o.getMaterial())
				.supportType(o.getSupportType())
				.leftSupport(o.getLeftSupport())
				.rightSupport(o.getRightSupport())
				.emitSupports(!o.isSkipSupports())
				.emitPlateEdgeMembers(o.isPlateEdgeMembers())
				.loads(LoadSettings.builder()
						.selfWeight(o.isSelfWeight())
						.deadLoad(orZero(o.getDeadLoad()))
						.liveLoad(orZero(o.getLiveLoad()))
						.jointLiveLoad(orZero(o.getJointLiveLoad()))
						.windLoad(orZero(o.getWindLoad()))
						.combinations(o.isLoadCombinations())
						.build())
				.performAnalysis(o.isPerformAnalysis())
				.build();
	}

	private static void checkLoad(List<String> errors, String option, Double value) {
		if (value != null && (!Double.isFinite(value) || value < 0.0)) {
			errors.add(option + " must be a finite number of at least 0. Got: " + value);
		}
	}

	private static boolean isPositive(Double value) {
		return value != null && value > 0.0;
	}

	private static double orZero(Double value) {
		return value != null ? value : 0.0;
	}

	private static boolean isBlank(String s) {
		return s == null || s.isBlank();
	}
}
