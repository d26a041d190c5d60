package org.pragmatica.dnsb.compiler.behavior;

/**
 * Compiled resource record. {@code data} is already normalized for name-valued types.
 */
public record ZoneRecord(String name, RecordType type, int ttl, String data) {
    public static ZoneRecord zoneRecord(String name, RecordType type, int ttl, String data) {
        return new ZoneRecord(name, type, ttl, data);
    }

    @Override
    public String toString() {
        return name + " " + type + " " + ttl + " " + data;
    }
}
