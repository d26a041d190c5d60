package org.pragmatica.dnsb.compiler;

import org.pragmatica.dnsb.compiler.behavior.GlueLabelGenerator;
import org.pragmatica.dnsb.compiler.substitute.Scope;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Tunables of a compile run.
 *
 * @param workingDirectory  directory of the project configuration, handed to hooks
 * @param glueLabels        label source for synthesized glue records
 * @param clock             time source for zone serials
 * @param environment       values for {@code ${env.*}} placeholders
 * @param parallelism       worker threads for per-service stage work
 */
public record CompilerSettings(Path workingDirectory,
                               GlueLabelGenerator glueLabels,
                               Clock clock,
                               Scope.Env environment,
                               int parallelism) {
    public static CompilerSettings compilerSettings(Path workingDirectory) {
        return new CompilerSettings(workingDirectory,
                                    GlueLabelGenerator.random(),
                                    Clock.systemUTC(),
                                    Scope.Env.system(),
                                    Runtime.getRuntime()
                                           .availableProcessors());
    }

    public CompilerSettings withGlueLabels(GlueLabelGenerator generator) {
        return new CompilerSettings(workingDirectory, generator, clock, environment, parallelism);
    }

    public CompilerSettings withClock(Clock newClock) {
        return new CompilerSettings(workingDirectory, glueLabels, newClock, environment, parallelism);
    }

    public CompilerSettings withEnvironment(Scope.Env newEnvironment) {
        return new CompilerSettings(workingDirectory, glueLabels, clock, newEnvironment, parallelism);
    }

    public CompilerSettings withParallelism(int threads) {
        return new CompilerSettings(workingDirectory, glueLabels, clock, environment, threads);
    }
}
