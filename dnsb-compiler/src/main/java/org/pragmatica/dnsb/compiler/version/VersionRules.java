package org.pragmatica.dnsb.compiler.version;

import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-software version rules for images.
 *
 * <p>A rule set maps version patterns to outcomes. For every pattern that matches the image version:
 * <ul>
 *   <li>a null outcome marks the version as supported</li>
 *   <li>an outcome containing '.' is the Ubuntu release to build on; the first match wins</li>
 *   <li>any other outcome is a package added to {@code dependency}</li>
 * </ul>
 * A version no pattern marks as supported is rejected. Images without a software type, without a
 * version, or with software the rules do not cover pass unchanged.
 */
public final class VersionRules {
    private static final Logger log = LoggerFactory.getLogger(VersionRules.class);

    public static final String SOFTWARE = "software";
    public static final String VERSION = "version";
    public static final String FROM = "from";
    public static final String DEPENDENCY = "dependency";
    public static final String OS_IMAGE = "ubuntu";

    private final Map<String, List<Rule>> rules;

    private record Rule(VersionPattern pattern, ConfigValue outcome) {
        boolean marksSupported() {
            return outcome instanceof ConfigValue.Scalar scalar && scalar.isNull();
        }

        boolean namesOsVersion() {
            return !marksSupported() && outcome.projection()
                                               .contains(".");
        }

        boolean namesDependency() {
            return !marksSupported() && !namesOsVersion();
        }
    }

    private VersionRules(Map<String, List<Rule>> rules) {
        this.rules = Map.copyOf(rules);
    }

    public static VersionRules none() {
        return new VersionRules(Map.of());
    }

    /**
     * Builds rules from a document of the form {@code <software>: {<pattern>: <outcome>}}.
     */
    public static Result<VersionRules> versionRules(Mapping document) {
        return Result.allOf(document.keys()
                                    .stream()
                                    .map(software -> ruleSet(software, document))
                                    .toList())
                     .map(sets -> {
                         var bySoftware = new LinkedHashMap<String, List<Rule>>();
                         sets.forEach(set -> bySoftware.put(set.software(), set.rules()));
                         return new VersionRules(bySoftware);
                     });
    }

    private record RuleSet(String software, List<Rule> rules) {}

    private static Result<RuleSet> ruleSet(String software, Mapping document) {
        var entries = document.mapping(software)
                              .or(Mapping.EMPTY);
        return Result.allOf(entries.keys()
                                   .stream()
                                   .map(pattern -> VersionPattern.parse(pattern)
                                                                 .map(parsed -> new Rule(parsed,
                                                                                         entries.get(pattern)
                                                                                                .unwrap())))
                                   .toList())
                     .map(parsed -> new RuleSet(software, parsed));
    }

    public boolean covers(String software) {
        return rules.containsKey(software);
    }

    /**
     * Checks the image version and applies the base release and extra packages its rules name.
     */
    public Result<Mapping> apply(String image, Mapping definition) {
        return check(image, definition, true);
    }

    /**
     * Checks the image version only; the definition is returned unchanged.
     */
    public Result<Mapping> validate(String image, Mapping definition) {
        return check(image, definition, false);
    }

    private Result<Mapping> check(String image, Mapping definition, boolean tailor) {
        var software = definition.text(SOFTWARE);
        var version = definition.get(VERSION)
                                .filter(value -> value instanceof ConfigValue.Scalar scalar && !scalar.isNull())
                                .map(ConfigValue::projection);
        if (software.isEmpty() || version.isEmpty() || !covers(software.unwrap())) {
            return Result.success(definition);
        }
        var ruleSet = rules.get(software.unwrap());
        return SoftwareVersion.softwareVersion(version.unwrap())
                              .flatMap(parsed -> {
                                  var matching = ruleSet.stream()
                                                        .filter(rule -> rule.pattern()
                                                                            .matches(parsed))
                                                        .toList();
                                  if (matching.stream()
                                              .noneMatch(Rule::marksSupported)) {
                                      return new VersionError.Unsupported(image,
                                                                          software.unwrap(),
                                                                          version.unwrap()).result();
                                  }
                                  return Result.success(tailor
                                                        ? tailored(image, definition, matching)
                                                        : definition);
                              });
    }

    private static Mapping tailored(String image, Mapping definition, List<Rule> matching) {
        var result = definition;
        var osVersion = matching.stream()
                                .filter(Rule::namesOsVersion)
                                .map(rule -> rule.outcome()
                                                 .projection())
                                .findFirst();
        if (osVersion.isPresent() && usesOsImage(definition)) {
            var base = OS_IMAGE + ":" + osVersion.get();
            log.debug("Image '{}': base set to '{}' by version rule", image, base);
            result = result.with(FROM, ConfigValue.text(base));
        }
        for (var rule : matching) {
            if (rule.namesDependency()) {
                result = withDependency(image, result, rule.outcome()
                                                           .projection());
            }
        }
        return result;
    }

    // A base other than the default OS image was chosen on purpose and is kept.
    private static boolean usesOsImage(Mapping definition) {
        return definition.text(FROM)
                         .map(from -> from.startsWith(OS_IMAGE + ":"))
                         .or(true);
    }

    private static Mapping withDependency(String image, Mapping definition, String dependency) {
        var current = definition.get(DEPENDENCY)
                                .flatMap(ConfigValue::asSequence)
                                .or(new ConfigValue.Sequence(List.of()));
        var present = current.items()
                             .stream()
                             .anyMatch(item -> item.projection()
                                                   .equals(dependency));
        if (present) {
            return definition;
        }
        log.debug("Image '{}': dependency '{}' added by version rule", image, dependency);
        return definition.with(DEPENDENCY, current.append(ConfigValue.text(dependency)));
    }
}
