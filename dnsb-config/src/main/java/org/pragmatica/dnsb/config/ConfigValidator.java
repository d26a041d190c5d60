package org.pragmatica.dnsb.config;

import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates the structure of a project configuration.
 *
 * <p>Validation rules:
 * <ul>
 *   <li>Project name must be present</li>
 *   <li>{@code inet} must be an IPv4 subnet in CIDR notation</li>
 *   <li>Image and service names must not contain ':'</li>
 *   <li>An image declares either {@code ref} or all of {@code software}, {@code version}, {@code from}</li>
 *   <li>A service declares {@code image} or {@code ref}; a {@code std:} ref requires {@code image}</li>
 *   <li>{@code mixins} is a list of template names</li>
 * </ul>
 * All violations are collected and reported in a single failure.
 */
public final class ConfigValidator {
    private static final Pattern CIDR_PATTERN = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})/(\\d{1,2})$");

    public static final String REF = "ref";
    public static final String MIXINS = "mixins";
    public static final String IMAGE = "image";
    public static final String SOFTWARE = "software";
    public static final String VERSION = "version";
    public static final String FROM = "from";
    public static final String STD_PREFIX = "std:";

    private ConfigValidator() {}

    public static Result<ProjectConfig> validate(ProjectConfig config) {
        var errors = new ArrayList<String>();
        if (config.name()
                  .isBlank()) {
            errors.add("Project 'name' is required");
        }
        validateInet(config.inet(), errors);
        config.images()
              .forEach((name, image) -> validateImage(name, image, errors));
        config.builds()
              .forEach((name, build) -> validateBuild(name, build, errors));
        if (errors.isEmpty()) {
            return Result.success(config);
        }
        return ConfigError.validationFailed(errors)
                          .result();
    }

    /**
     * Checks that a string is an IPv4 subnet in CIDR notation.
     */
    public static boolean isIpv4Cidr(String inet) {
        var matcher = CIDR_PATTERN.matcher(inet.trim());
        if (!matcher.matches()) {
            return false;
        }
        for (int group = 1; group <= 4; group++) {
            if (Integer.parseInt(matcher.group(group)) > 255) {
                return false;
            }
        }
        return Integer.parseInt(matcher.group(5)) <= 32;
    }

    private static void validateInet(String inet, List<String> errors) {
        if (inet.isBlank()) {
            errors.add("Project 'inet' is required");
        } else if (!isIpv4Cidr(inet)) {
            errors.add("Invalid 'inet' subnet: " + inet + ". Expected IPv4 CIDR, e.g. 10.88.0.0/16");
        }
    }

    private static void validateImage(String name, Mapping image, List<String> errors) {
        if (name.contains(":")) {
            errors.add("Image name must not contain ':', found in '" + name + "'");
        }
        var hasRef = image.has(REF);
        var hasBaseFields = image.has(SOFTWARE) || image.has(VERSION) || image.has(FROM);
        if (hasRef && hasBaseFields) {
            errors.add("Image '" + name + "': 'ref' cannot be used with 'software', 'version' or 'from'");
        }
        if (!hasRef && !(image.has(SOFTWARE) && image.has(VERSION) && image.has(FROM))) {
            errors.add("Image '" + name + "': an image without 'ref' must have 'software', 'version' and 'from'");
        }
        validateMixins("Image", name, image, errors);
    }

    private static void validateBuild(String name, Mapping build, List<String> errors) {
        if (name.contains(":")) {
            errors.add("Service name must not contain ':', found in '" + name + "'");
        }
        var ref = build.text(REF);
        if (!build.has(IMAGE) && ref.isEmpty()) {
            errors.add("Service '" + name + "' must have either an 'image' or a 'ref' key");
        }
        if (build.has(REF) && ref.isEmpty()) {
            errors.add("Service '" + name + "': 'ref' must be a string");
        }
        ref.filter(value -> value.startsWith(STD_PREFIX))
           .filter(value -> !build.has(IMAGE))
           .onPresent(value -> errors.add("Service '" + name + "': ref '" + value + "' requires the 'image' key"));
        validateMixins("Service", name, build, errors);
    }

    private static void validateMixins(String kind, String name, Mapping definition, List<String> errors) {
        if (!definition.has(MIXINS)) {
            return;
        }
        var valid = definition.sequence(MIXINS)
                              .flatMap(ConfigValue.Sequence::texts)
                              .isPresent();
        if (!valid) {
            errors.add(kind + " '" + name + "': 'mixins' must be a list of template names");
        }
    }
}
