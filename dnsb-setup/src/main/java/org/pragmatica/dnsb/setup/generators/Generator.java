package org.pragmatica.dnsb.setup.generators;

import org.pragmatica.dnsb.compiler.plan.BuildPlan;
import org.pragmatica.lang.Result;

import java.nio.file.Path;

/**
 * Writes deployment artifacts for a compiled build plan.
 */
public interface Generator {
    /**
     * Generate deployment artifacts.
     *
     * @param plan      Compiled build plan
     * @param outputDir Output directory for generated files, replaced as a whole
     * @return Result indicating success or failure
     */
    Result<GeneratorOutput> generate(BuildPlan plan, Path outputDir);
}
