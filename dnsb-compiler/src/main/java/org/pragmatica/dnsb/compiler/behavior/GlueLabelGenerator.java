package org.pragmatica.dnsb.compiler.behavior;

import java.security.SecureRandom;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Produces the host label for synthesized glue records. The label is relative to the zone the
 * NS record lives in.
 */
@FunctionalInterface
public interface GlueLabelGenerator {
    String label(String service, String zone);

    /**
     * {@code ns-<service>-<6 random characters>}.
     */
    static GlueLabelGenerator random() {
        return random(new SecureRandom());
    }

    static GlueLabelGenerator random(Random random) {
        var alphabet = "abcdefghijklmnopqrstuvwxyz0123456789";
        return (service, zone) -> {
            var suffix = new StringBuilder(6);
            for (int i = 0; i < 6; i++) {
                suffix.append(alphabet.charAt(random.nextInt(alphabet.length())));
            }
            return "ns-" + service + "-" + suffix;
        };
    }

    /**
     * {@code ns-<service>-<n>} with one counter per service, starting at 1. Labels do not depend
     * on the order in which services compile concurrently.
     */
    static GlueLabelGenerator sequential() {
        var counters = new ConcurrentHashMap<String, AtomicInteger>();
        return (service, zone) -> "ns-" + service + "-" + counters.computeIfAbsent(service, key -> new AtomicInteger())
                                                                  .incrementAndGet();
    }
}
