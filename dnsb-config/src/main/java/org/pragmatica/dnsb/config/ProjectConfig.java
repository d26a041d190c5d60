package org.pragmatica.dnsb.config;

import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Project configuration after include merging.
 *
 * @param name    project name, used for container names and the compose project
 * @param inet    IPv4 subnet in CIDR notation for the project network
 * @param images  image definitions keyed by image name
 * @param builds  service definitions keyed by service name
 * @param auto    project-wide automation settings
 * @param mirror  package mirror settings
 */
public record ProjectConfig(String name,
                            String inet,
                            Map<String, Mapping> images,
                            Map<String, Mapping> builds,
                            Mapping auto,
                            Mapping mirror) {
    public static final String NAME = "name";
    public static final String INET = "inet";
    public static final String IMAGES = "images";
    public static final String BUILDS = "builds";
    public static final String AUTO = "auto";
    public static final String MIRROR = "mirror";

    public ProjectConfig {
        images = Collections.unmodifiableMap(new LinkedHashMap<>(images));
        builds = Collections.unmodifiableMap(new LinkedHashMap<>(builds));
    }

    /**
     * Builds the project configuration from a merged document.
     *
     * <p>{@code images} may be a mapping keyed by image name or a list of mappings each carrying
     * a {@code name}; both forms produce the same name-keyed view.
     */
    public static Result<ProjectConfig> projectConfig(Mapping document) {
        var errors = new ArrayList<String>();
        var images = collectImages(document, errors);
        var builds = collectBuilds(document, errors);
        if (!errors.isEmpty()) {
            return ConfigError.validationFailed(errors)
                              .result();
        }
        return Result.success(new ProjectConfig(document.text(NAME)
                                                        .or(""),
                                                document.get(INET)
                                                        .map(ConfigValue::projection)
                                                        .or(""),
                                                images,
                                                builds,
                                                document.mapping(AUTO)
                                                        .or(Mapping.EMPTY),
                                                document.mapping(MIRROR)
                                                        .or(Mapping.EMPTY)));
    }

    /**
     * Returns a copy with the given service definitions.
     */
    public ProjectConfig withBuilds(Map<String, Mapping> newBuilds) {
        return new ProjectConfig(name, inet, images, newBuilds, auto, mirror);
    }

    /**
     * Converts back to a document, with images in the mapping form.
     */
    public Mapping toMapping() {
        var entries = new LinkedHashMap<String, ConfigValue>();
        entries.put(NAME, ConfigValue.text(name));
        entries.put(INET, ConfigValue.text(inet));
        entries.put(IMAGES, ConfigValue.mapping(images));
        entries.put(BUILDS, ConfigValue.mapping(builds));
        entries.put(AUTO, auto);
        entries.put(MIRROR, mirror);
        return new Mapping(entries);
    }

    private static Map<String, Mapping> collectImages(Mapping document, List<String> errors) {
        var result = new LinkedHashMap<String, Mapping>();
        var value = document.get(IMAGES);
        if (value.isEmpty()) {
            return result;
        }
        var images = value.unwrap();
        if (images instanceof Mapping mapping) {
            mapping.entries()
                   .forEach((name, definition) -> {
                                if (definition instanceof Mapping image) {
                                    result.put(name, image.without(NAME));
                                } else {
                                    errors.add("Image '" + name + "' must be a mapping");
                                }
                            });
        } else if (images instanceof ConfigValue.Sequence sequence) {
            for (int i = 0; i < sequence.size(); i++) {
                collectListedImage(sequence.items()
                                           .get(i),
                                   i,
                                   result,
                                   errors);
            }
        } else if (!isNull(images)) {
            errors.add("'images' must be a mapping or a list of image definitions");
        }
        return result;
    }

    private static void collectListedImage(ConfigValue entry, int index, Map<String, Mapping> result, List<String> errors) {
        var image = entry.asMapping();
        if (image.isEmpty()) {
            errors.add("images[" + index + "] must be a mapping");
            return;
        }
        var definition = image.unwrap();
        var name = definition.text(NAME);
        if (name.isEmpty()) {
            errors.add("images[" + index + "] has no 'name'");
            return;
        }
        var imageName = name.unwrap();
        if (result.containsKey(imageName)) {
            errors.add("Duplicate image name: '" + imageName + "'");
            return;
        }
        result.put(imageName, definition.without(NAME));
    }

    private static Map<String, Mapping> collectBuilds(Mapping document, List<String> errors) {
        var result = new LinkedHashMap<String, Mapping>();
        document.mapping(BUILDS)
                .onPresent(builds -> builds.entries()
                                           .forEach((name, definition) -> {
                                                        var build = definition.asMapping();
                                                        if (build.isPresent()) {
                                                            result.put(name, build.unwrap());
                                                        } else if (definition instanceof ConfigValue.Scalar scalar && scalar.isNull()) {
                                                            result.put(name, Mapping.EMPTY);
                                                        } else {
                                                            errors.add("Service '" + name + "' must be a mapping");
                                                        }
                                                    }));
        if (document.has(BUILDS) && document.mapping(BUILDS)
                                            .isEmpty() && !isNull(document.get(BUILDS)
                                                                          .unwrap())) {
            errors.add("'builds' must be a mapping of service definitions");
        }
        return result;
    }

    private static boolean isNull(ConfigValue value) {
        return value instanceof ConfigValue.Scalar scalar && scalar.isNull();
    }
}
