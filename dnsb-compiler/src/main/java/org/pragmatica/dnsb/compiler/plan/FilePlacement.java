package org.pragmatica.dnsb.compiler.plan;

import org.pragmatica.dnsb.compiler.behavior.GeneratedFile;
import org.pragmatica.dnsb.compiler.substitute.Placeholders;
import org.pragmatica.lang.Result;

/**
 * A file the service container needs, and where it comes from.
 */
public sealed interface FilePlacement {
    String containerPath();

    /**
     * Content produced by compilation.
     */
    record Generated(GeneratedFile file) implements FilePlacement {
        @Override
        public String containerPath() {
            return file.containerPath();
        }
    }

    /**
     * Local file or bundled {@code resource:} copied into the service directory.
     */
    record Copied(String source, String containerPath) implements FilePlacement {
        public String fileName() {
            var slash = containerPath.lastIndexOf('/');
            return containerPath.substring(slash + 1);
        }
    }

    /**
     * Host path mounted as given, taken from a volume carrying the origin marker.
     */
    record Mounted(String hostPath, String containerPath) implements FilePlacement {}

    /**
     * Parses a {@code host:container} volume entry. The split is on the last ':' so that
     * {@code resource:} sources keep their prefix.
     */
    static Result<FilePlacement> fromVolume(String service, String volume) {
        var separator = volume.lastIndexOf(':');
        if (separator <= 0 || separator == volume.length() - 1) {
            return new PlanError.InvalidVolume(service, volume).result();
        }
        var host = volume.substring(0, separator);
        var container = volume.substring(separator + 1);
        if (Placeholders.hasOrigin(host)) {
            return Result.success(new Mounted(Placeholders.stripOrigin(host), container));
        }
        return Result.success(new Copied(host, container));
    }
}
