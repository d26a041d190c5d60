package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.lang.Option;

import java.util.Map;

/**
 * Maps service names to allocated addresses.
 */
@FunctionalInterface
public interface TargetResolver {
    Option<String> address(String service);

    static TargetResolver targetResolver(Map<String, String> addresses) {
        var snapshot = Map.copyOf(addresses);
        return service -> Option.option(snapshot.get(service));
    }
}
