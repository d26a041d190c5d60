package org.pragmatica.dnsb.config;

import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.dnsb.config.ConfigValue.Scalar;
import org.pragmatica.dnsb.config.ConfigValue.Sequence;
import org.pragmatica.lang.Option;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;

import static org.pragmatica.lang.Option.none;
import static org.pragmatica.lang.Option.some;

/**
 * Layered merge of configuration trees.
 *
 * <p>Merge rules by type pair:
 * <ul>
 *   <li>Mapping + Mapping - key union, shared keys merged recursively</li>
 *   <li>Sequence + Sequence - base elements, then override elements whose projection is absent from base</li>
 *   <li>Mapping + Sequence (either side) - both normalized to mappings and merged shallowly;
 *       if either side cannot be normalized the override replaces the base</li>
 *   <li>anything else - override replaces the base</li>
 * </ul>
 * Inputs are never modified; every call returns a new tree.
 */
public sealed interface ConfigMerge {
    static ConfigValue merge(ConfigValue base, ConfigValue override) {
        if (base instanceof Mapping baseMapping && override instanceof Mapping overrideMapping) {
            return mergeMappings(baseMapping, overrideMapping);
        }
        if (base instanceof Sequence baseSequence && override instanceof Sequence overrideSequence) {
            return mergeSequences(baseSequence, overrideSequence);
        }
        if (isContainer(base) && isContainer(override)) {
            return mergeMixed(base, override);
        }
        return override;
    }

    /**
     * Merge of two mappings, typed for callers which know both sides are mappings.
     */
    static Mapping mergeMappings(Mapping base, Mapping override) {
        var result = new LinkedHashMap<>(base.entries());
        override.entries()
                .forEach((key, value) -> result.merge(key, value, ConfigMerge::merge));
        return new Mapping(result);
    }

    /**
     * Normalizes a value to a mapping.
     *
     * <p>A mapping is returned as is. A sequence of strings becomes a mapping by splitting each
     * element on the first {@code =}; an element without {@code =} maps to null. Any other value,
     * or a sequence with a non-string element, cannot be normalized.
     */
    static Option<Mapping> normalizeToMapping(ConfigValue value) {
        if (value instanceof Mapping mapping) {
            return some(mapping);
        }
        if (value instanceof Sequence sequence) {
            return sequence.texts()
                           .map(ConfigMerge::splitAssignments);
        }
        return none();
    }

    private static Sequence mergeSequences(Sequence base, Sequence override) {
        // Projection set is fixed before scanning, so repeats inside override are kept
        var seen = new HashSet<String>();
        base.items()
            .forEach(item -> seen.add(item.projection()));
        var result = new ArrayList<>(base.items());
        for (var item : override.items()) {
            if (!seen.contains(item.projection())) {
                result.add(item);
            }
        }
        return new Sequence(result);
    }

    private static ConfigValue mergeMixed(ConfigValue base, ConfigValue override) {
        return normalizeToMapping(base).flatMap(baseMapping -> normalizeToMapping(override).map(overrideMapping -> shallowMerge(baseMapping,
                                                                                                                         overrideMapping)))
                                       .map(ConfigValue.class::cast)
                                       .or(override);
    }

    private static Mapping shallowMerge(Mapping base, Mapping override) {
        var result = new LinkedHashMap<>(base.entries());
        result.putAll(override.entries());
        return new Mapping(result);
    }

    private static Mapping splitAssignments(List<String> tokens) {
        var result = new LinkedHashMap<String, ConfigValue>();
        for (var token : tokens) {
            var separator = token.indexOf('=');
            if (separator < 0) {
                result.put(token, Scalar.NULL);
            } else {
                result.put(token.substring(0, separator), ConfigValue.text(token.substring(separator + 1)));
            }
        }
        return new Mapping(result);
    }

    private static boolean isContainer(ConfigValue value) {
        return value instanceof Mapping || value instanceof Sequence;
    }

    record Unused() implements ConfigMerge {}
}
