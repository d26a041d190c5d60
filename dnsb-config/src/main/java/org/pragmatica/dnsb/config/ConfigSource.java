package org.pragmatica.dnsb.config;

import org.pragmatica.lang.Result;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Location of a configuration document.
 *
 * <p>Two namespaces are supported: local files and read-only bundled classpath resources,
 * addressed with the {@code resource:} prefix. Relative includes are resolved against the
 * directory of the including document.
 */
public sealed interface ConfigSource {
    String RESOURCE_PREFIX = "resource:";

    /**
     * Reads the whole document as UTF-8 text.
     */
    Result<String> read();

    /**
     * Resolves an include reference relative to this source.
     */
    ConfigSource resolve(String reference);

    /**
     * Canonical descriptor, used for include cycle detection and error messages.
     */
    String descriptor();

    static ConfigSource of(String reference, Path baseDir) {
        if (reference.startsWith(RESOURCE_PREFIX)) {
            return new Resource(normalizeResource(reference.substring(RESOURCE_PREFIX.length())));
        }
        var path = Path.of(reference);
        return new File(path.isAbsolute()
                        ? path.normalize()
                        : baseDir.resolve(path)
                                 .toAbsolutePath()
                                 .normalize());
    }

    static ConfigSource file(Path path) {
        return new File(path.toAbsolutePath()
                            .normalize());
    }

    static ConfigSource resource(String name) {
        return new Resource(normalizeResource(name));
    }

    private static String normalizeResource(String name) {
        return name.startsWith("/")
               ? name.substring(1)
               : name;
    }

    record File(Path path) implements ConfigSource {
        @Override
        public Result<String> read() {
            return Result.lift(e -> ConfigError.readFailed(descriptor(), e.getMessage()),
                               () -> Files.readString(path, StandardCharsets.UTF_8));
        }

        @Override
        public ConfigSource resolve(String reference) {
            var parent = path.getParent();
            return ConfigSource.of(reference,
                                   parent == null
                                   ? Path.of("")
                                   : parent);
        }

        @Override
        public String descriptor() {
            return path.toString();
        }
    }

    record Resource(String name) implements ConfigSource {
        @Override
        public Result<String> read() {
            return Result.lift(e -> ConfigError.readFailed(descriptor(), e.getMessage()),
                               this::readResource);
        }

        private String readResource() throws IOException {
            try (InputStream stream = ConfigSource.class.getClassLoader()
                                                        .getResourceAsStream(name)) {
                if (stream == null) {
                    throw new IOException("bundled resource not found");
                }
                return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        @Override
        public ConfigSource resolve(String reference) {
            if (reference.startsWith(RESOURCE_PREFIX)) {
                return ConfigSource.resource(reference.substring(RESOURCE_PREFIX.length()));
            }
            var separator = name.lastIndexOf('/');
            var dir = separator < 0
                      ? ""
                      : name.substring(0, separator + 1);
            return new Resource(Path.of(dir + reference)
                                    .normalize()
                                    .toString()
                                    .replace('\\', '/'));
        }

        @Override
        public String descriptor() {
            return RESOURCE_PREFIX + name;
        }
    }
}
