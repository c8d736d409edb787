package com.structural.topology;

import com.structural.topology.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point of the structural topology generator CLI.
 */
public class TopologyGeneratorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
