package org.pragmatica.dnsb.compiler.topology;

import org.pragmatica.dnsb.compiler.behavior.BehaviorKind;
import org.pragmatica.dnsb.compiler.behavior.BehaviorParser;
import org.pragmatica.dnsb.compiler.behavior.BehaviorStatement;
import org.pragmatica.dnsb.compiler.behavior.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Service dependency map derived from behavior scripts: which services each service forwards to,
 * stubs, hints or delegates to.
 */
public final class TopologyMapper {
    private static final Logger log = LoggerFactory.getLogger(TopologyMapper.class);

    private TopologyMapper() {}

    /**
     * @param behaviors behavior text keyed by service name
     * @param services  names of all concrete services
     */
    public static Map<String, SortedSet<String>> map(Map<String, String> behaviors, Set<String> services) {
        var topology = new LinkedHashMap<String, SortedSet<String>>();
        services.forEach(service -> topology.put(service, new TreeSet<>()));
        behaviors.forEach((service, behavior) -> BehaviorParser.parse(service, behavior)
                                                               .onSuccess(statements -> collect(service,
                                                                                                statements,
                                                                                                services,
                                                                                                topology))
                                                               .onFailure(cause -> log.warn("Skipping behavior of '{}' in topology map: {}",
                                                                                            service,
                                                                                            cause.message())));
        var result = new LinkedHashMap<String, SortedSet<String>>();
        topology.forEach((service, targets) -> result.put(service, Collections.unmodifiableSortedSet(targets)));
        return Collections.unmodifiableMap(result);
    }

    /**
     * Graphviz DOT rendering of a topology map.
     */
    public static String toDot(String project, Map<String, SortedSet<String>> topology) {
        var dot = new StringBuilder("digraph \"").append(project)
                                                  .append("\" {\n")
                                                  .append("    rankdir=LR;\n")
                                                  .append("    node [shape=box];\n");
        topology.keySet()
                .forEach(service -> dot.append("    \"")
                                       .append(service)
                                       .append("\";\n"));
        topology.forEach((service, targets) -> targets.forEach(target -> dot.append("    \"")
                                                                            .append(service)
                                                                            .append("\" -> \"")
                                                                            .append(target)
                                                                            .append("\";\n")));
        return dot.append("}\n")
                  .toString();
    }

    private static void collect(String service,
                                List<BehaviorStatement> statements,
                                Set<String> services,
                                Map<String, SortedSet<String>> topology) {
        var targets = topology.computeIfAbsent(service, key -> new TreeSet<>());
        for (var statement : statements) {
            if (statement.kind() == BehaviorKind.MASTER && !isServiceRecord(statement)) {
                continue;
            }
            for (var target : statement.targets()) {
                if (services.contains(target)) {
                    targets.add(target);
                } else if (statement.kind() != BehaviorKind.MASTER) {
                    log.debug("Service '{}' targets '{}', which is not a service of this project", service, target);
                }
            }
        }
    }

    private static boolean isServiceRecord(BehaviorStatement statement) {
        return statement.rtype()
                        .filter(type -> type == RecordType.NS || type == RecordType.A)
                        .isPresent();
    }
}
