package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.lang.Option;

import java.util.Arrays;

/**
 * Record types accepted in {@code master} statements.
 */
public enum RecordType {
    A,
    AAAA,
    NS,
    CNAME,
    PTR,
    TXT;

    public static Option<RecordType> recordType(String name) {
        return Option.from(Arrays.stream(values())
                                 .filter(type -> type.name()
                                                     .equalsIgnoreCase(name))
                                 .findFirst());
    }

    /**
     * Types whose data is a domain name and goes through name normalization.
     */
    public boolean hasNameData() {
        return this == NS || this == CNAME || this == PTR;
    }
}
