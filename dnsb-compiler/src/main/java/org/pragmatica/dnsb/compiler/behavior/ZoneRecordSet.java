package org.pragmatica.dnsb.compiler.behavior;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Records accumulated per zone across all {@code master} statements of one service.
 * Zones keep the order in which they were first mentioned.
 */
public final class ZoneRecordSet {
    private final Map<String, List<ZoneRecord>> zones = new LinkedHashMap<>();

    public static ZoneRecordSet zoneRecordSet() {
        return new ZoneRecordSet();
    }

    public ZoneRecordSet add(String zone, ZoneRecord record) {
        zones.computeIfAbsent(DnsNames.zoneKey(zone), key -> new ArrayList<>())
             .add(record);
        return this;
    }

    public Set<String> zones() {
        return Collections.unmodifiableSet(zones.keySet());
    }

    public List<ZoneRecord> records(String zone) {
        return List.copyOf(zones.getOrDefault(DnsNames.zoneKey(zone), List.of()));
    }

    public boolean isEmpty() {
        return zones.isEmpty();
    }

    public Map<String, List<ZoneRecord>> asMap() {
        var copy = new LinkedHashMap<String, List<ZoneRecord>>();
        zones.forEach((zone, records) -> copy.put(zone, List.copyOf(records)));
        return Collections.unmodifiableMap(copy);
    }
}
