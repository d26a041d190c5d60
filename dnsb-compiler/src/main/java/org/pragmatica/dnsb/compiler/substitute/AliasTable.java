package org.pragmatica.dnsb.compiler.substitute;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Accepted spellings of scope keywords and built-in variable names.
 *
 * <p>Only the scope keyword (first segment) and the variable segment after a service name are
 * rewritten. Service names and definition field names are left alone.
 */
public sealed interface AliasTable {
    Map<String, String> ALIASES = Map.of("service", Scope.SERVICES,
                                         "svc", Scope.SERVICES,
                                         "builds", Scope.SERVICES,
                                         "img", Scope.IMAGE,
                                         "addr", Scope.IP,
                                         "ip4", Scope.IP,
                                         "proj", Scope.PROJECT);

    static String canonical(String segment) {
        return ALIASES.getOrDefault(segment, segment);
    }

    static List<String> apply(List<String> segments) {
        if (segments.isEmpty()) {
            return segments;
        }
        var result = new ArrayList<>(segments);
        result.set(0, canonical(result.get(0)));
        if (Scope.SERVICES.equals(result.get(0)) && result.size() > 2) {
            result.set(2, canonical(result.get(2)));
        }
        return result;
    }

    record Unused() implements AliasTable {}
}
