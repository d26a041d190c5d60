package org.pragmatica.dnsb.compiler.plan;

import org.pragmatica.dnsb.config.ConfigValue.Mapping;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;

/**
 * Output of one compile run. Only complete plans are ever produced.
 *
 * @param project   project name
 * @param inet      project subnet
 * @param mirror    package mirror settings
 * @param images    resolved image definitions
 * @param services  concrete services in declaration order
 * @param topology  behavior targets per service
 */
public record BuildPlan(String project,
                        String inet,
                        Mapping mirror,
                        Map<String, Mapping> images,
                        Map<String, ServicePlan> services,
                        Map<String, SortedSet<String>> topology) {
    public BuildPlan {
        images = Collections.unmodifiableMap(new LinkedHashMap<>(images));
        services = Collections.unmodifiableMap(new LinkedHashMap<>(services));
        topology = Collections.unmodifiableMap(new LinkedHashMap<>(topology));
    }
}
