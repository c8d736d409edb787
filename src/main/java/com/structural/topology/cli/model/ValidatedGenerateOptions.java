package com.structural.topology.cli.model;

import java.nio.file.Path;

import com.structural.topology.export.ExportSettings;
import com.structural.topology.model.TopologyParameters;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps GenerateCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedGenerateOptions {
    TopologyParameters parameters;
    ExportSettings exportSettings;
    /**
     * Normalised output file, or null when nothing is written.
     */
    Path outputPath;
}
