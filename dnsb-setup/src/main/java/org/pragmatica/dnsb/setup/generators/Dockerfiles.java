package org.pragmatica.dnsb.setup.generators;

import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Option;
import org.pragmatica.lang.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Dockerfile text for a resolved image.
 *
 * <p>The base comes from {@code from}; {@code dependency} and {@code util} packages are installed
 * with apt. An {@code apt} entry in the project mirror settings rewrites the package sources of
 * Ubuntu and Debian bases to the given host.
 */
public sealed interface Dockerfiles {
    String FROM = "from";
    String DEPENDENCY = "dependency";
    String UTIL = "util";
    String APT_MIRROR = "apt";

    static Result<String> dockerfile(String service, String imageName, Mapping image, Mapping mirror) {
        var base = image.text(FROM);
        if (base.isEmpty()) {
            return new GeneratorError.InvalidImage(service, imageName, "no 'from' base image").result();
        }
        var lines = new ArrayList<String>();
        lines.add("# Generated by dnsb for image '" + imageName + "'");
        lines.add("FROM " + base.unwrap());
        mirror.text(APT_MIRROR)
              .map(host -> mirrorSetup(base.unwrap(), host))
              .filter(setup -> !setup.isEmpty())
              .onPresent(lines::add);
        install(packages(image, DEPENDENCY)).onPresent(lines::add);
        install(packages(image, UTIL)).onPresent(lines::add);
        return Result.success(String.join("\n", lines) + "\n");
    }

    private static List<String> packages(Mapping image, String key) {
        return image.sequence(key)
                    .map(sequence -> sequence.items()
                                             .stream()
                                             .map(ConfigValue::projection)
                                             .toList())
                    .or(List.of());
    }

    private static Option<String> install(List<String> packages) {
        if (packages.isEmpty()) {
            return Option.none();
        }
        return Option.some("RUN apt-get update && apt-get install -y --no-install-recommends "
                           + String.join(" ", new TreeSet<>(packages))
                           + " && rm -rf /var/lib/apt/lists/*");
    }

    private static String mirrorSetup(String base, String mirror) {
        var host = mirror.replaceFirst("^[a-z]+://", "")
                         .replaceAll("/+$", "");
        if (host.isBlank()) {
            return "";
        }
        if (base.startsWith("ubuntu")) {
            return "RUN sed -i 's|archive\\.ubuntu\\.com|" + host + "|g; s|security\\.ubuntu\\.com|" + host
                   + "|g' /etc/apt/sources.list";
        }
        if (base.startsWith("debian")) {
            return "RUN sed -i 's|deb\\.debian\\.org|" + host + "|g; s|security\\.debian\\.org|" + host
                   + "|g' /etc/apt/sources.list.d/debian.sources /etc/apt/sources.list 2>/dev/null || true";
        }
        return "";
    }

    record Unused() implements Dockerfiles {}
}
