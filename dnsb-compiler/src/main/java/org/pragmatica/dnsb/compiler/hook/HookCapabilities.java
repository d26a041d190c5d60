package org.pragmatica.dnsb.compiler.hook;

import org.pragmatica.dnsb.config.ConfigSource;
import org.pragmatica.lang.Result;

import java.nio.file.Path;

/**
 * Read-only collaborators available to hooks. Hooks have no other channel into the pipeline.
 *
 * @param workingDirectory directory of the project configuration
 */
public record HookCapabilities(Path workingDirectory) {
    public static HookCapabilities hookCapabilities(Path workingDirectory) {
        return new HookCapabilities(workingDirectory.toAbsolutePath()
                                                    .normalize());
    }

    /**
     * Reads a file relative to the working directory, or a bundled {@code resource:} file.
     */
    public Result<String> read(String reference) {
        return ConfigSource.of(reference, workingDirectory)
                           .read();
    }
}
