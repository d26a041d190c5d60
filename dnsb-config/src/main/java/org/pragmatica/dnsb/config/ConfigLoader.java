package org.pragmatica.dnsb.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads project configuration from YAML documents.
 *
 * <p>A document may pull in other documents with the {@code include} key, given either as a
 * single reference or a list of references:
 * <pre>
 * include:
 *   - base.yml
 *   - resource:templates/common.yml
 * </pre>
 * Included documents are merged in declaration order and form the base; the including
 * document is merged last and overrides them. Includes may nest; a cycle is an error.
 */
public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    public static final String INCLUDE_KEY = "include";

    private ConfigLoader() {}

    /**
     * Load and validate project configuration from file path.
     */
    public static Result<ProjectConfig> load(Path path) {
        return loadDocument(ConfigSource.file(path)).flatMap(ProjectConfig::projectConfig)
                                                   .flatMap(ConfigValidator::validate);
    }

    /**
     * Load and validate project configuration from YAML string content.
     * Relative includes are resolved against the working directory.
     */
    public static Result<ProjectConfig> loadFromString(String content) {
        return loadFromString(content, Path.of(""));
    }

    public static Result<ProjectConfig> loadFromString(String content, Path baseDir) {
        var origin = ConfigSource.file(baseDir.resolve("<inline>"));
        return parse(content, origin.descriptor()).flatMap(document -> expandIncludes(document,
                                                                                      origin,
                                                                                      List.of(origin.descriptor())))
                                                  .flatMap(ProjectConfig::projectConfig)
                                                  .flatMap(ConfigValidator::validate);
    }

    /**
     * Load a document with all of its includes merged, without project validation.
     */
    public static Result<Mapping> loadDocument(ConfigSource source) {
        return loadDocument(source, List.of());
    }

    /**
     * Parse a single YAML document. The top level must be a mapping; an empty document is an empty mapping.
     */
    public static Result<Mapping> parse(String content, String sourceName) {
        return Result.lift(e -> ConfigError.parseFailed(sourceName, e.getMessage()),
                           () -> ConfigValue.fromObject(YAML.readValue(content, Object.class)))
                     .flatMap(value -> asDocument(value, sourceName));
    }

    private static Result<Mapping> asDocument(ConfigValue value, String sourceName) {
        if (value instanceof Mapping mapping) {
            return Result.success(mapping);
        }
        if (value instanceof ConfigValue.Scalar scalar && scalar.isNull()) {
            return Result.success(Mapping.EMPTY);
        }
        return ConfigError.parseFailed(sourceName, "top level must be a mapping")
                          .result();
    }

    private static Result<Mapping> loadDocument(ConfigSource source, List<String> chain) {
        var descriptor = source.descriptor();
        if (chain.contains(descriptor)) {
            var cycle = new ArrayList<>(chain);
            cycle.add(descriptor);
            return ConfigError.includeCycle(cycle)
                              .result();
        }
        var nextChain = new ArrayList<>(chain);
        nextChain.add(descriptor);
        log.debug("Loading configuration document {}", descriptor);
        return source.read()
                     .flatMap(content -> parse(content, descriptor))
                     .flatMap(document -> expandIncludes(document, source, nextChain));
    }

    private static Result<Mapping> expandIncludes(Mapping document, ConfigSource source, List<String> chain) {
        return includeReferences(document, source.descriptor()).flatMap(references -> mergeIncludes(document,
                                                                                                    source,
                                                                                                    references,
                                                                                                    chain));
    }

    private static Result<List<String>> includeReferences(Mapping document, String sourceName) {
        var include = document.get(INCLUDE_KEY);
        if (include.isEmpty()) {
            return Result.success(List.of());
        }
        var value = include.unwrap();
        if (value.asText()
                 .isPresent()) {
            return Result.success(List.of(value.asText()
                                               .unwrap()));
        }
        return value.asSequence()
                    .flatMap(ConfigValue.Sequence::texts)
                    .toResult(ConfigError.parseFailed(sourceName, "'include' must be a string or a list of strings"));
    }

    private static Result<Mapping> mergeIncludes(Mapping document,
                                                 ConfigSource source,
                                                 List<String> references,
                                                 List<String> chain) {
        if (references.isEmpty()) {
            return Result.success(document.without(INCLUDE_KEY));
        }
        var included = references.stream()
                                 .map(source::resolve)
                                 .map(target -> loadDocument(target, chain))
                                 .toList();
        return Result.allOf(included)
                     .map(bases -> {
                              var merged = Mapping.EMPTY;
                              for (var base : bases) {
                                  merged = ConfigMerge.mergeMappings(merged, base);
                              }
                              log.debug("Merged {} include(s) into {}", bases.size(), source.descriptor());
                              return ConfigMerge.mergeMappings(merged, document.without(INCLUDE_KEY));
                          });
    }
}
