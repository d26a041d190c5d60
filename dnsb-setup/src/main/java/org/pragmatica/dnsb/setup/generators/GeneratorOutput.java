package org.pragmatica.dnsb.setup.generators;

import java.nio.file.Path;
import java.util.List;

/**
 * Output from a generator run.
 *
 * @param outputDir      Root directory containing generated files
 * @param generatedFiles All generated file paths, relative to outputDir
 * @param instructions   Human-readable instructions for next steps
 */
public record GeneratorOutput(Path outputDir, List<Path> generatedFiles, String instructions) {
    public GeneratorOutput {
        generatedFiles = List.copyOf(generatedFiles);
    }

    public static GeneratorOutput generatorOutput(Path outputDir, List<Path> files, String instructions) {
        return new GeneratorOutput(outputDir, files, instructions);
    }
}
