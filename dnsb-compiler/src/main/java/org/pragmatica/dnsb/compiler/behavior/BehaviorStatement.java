package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.lang.Option;

import java.util.List;

/**
 * One parsed behavior line.
 *
 * @param line     1-based line number in the behavior text
 * @param text     the trimmed source line
 * @param zone     zone the statement applies to
 * @param kind     statement kind
 * @param targets  comma-separated targets, in order
 * @param rname    record name, {@code master} only
 * @param rtype    record type, {@code master} only
 * @param ttl      record TTL, {@code master} only
 */
public record BehaviorStatement(int line,
                                String text,
                                String zone,
                                BehaviorKind kind,
                                List<String> targets,
                                Option<String> rname,
                                Option<RecordType> rtype,
                                int ttl) {
    public static final int DEFAULT_TTL = 3600;

    public BehaviorStatement {
        targets = List.copyOf(targets);
    }

    public static BehaviorStatement generic(int line, String text, String zone, BehaviorKind kind, List<String> targets) {
        return new BehaviorStatement(line, text, zone, kind, targets, Option.none(), Option.none(), DEFAULT_TTL);
    }

    public static BehaviorStatement master(int line,
                                           String text,
                                           String zone,
                                           String rname,
                                           RecordType rtype,
                                           int ttl,
                                           List<String> targets) {
        return new BehaviorStatement(line,
                                     text,
                                     zone,
                                     BehaviorKind.MASTER,
                                     targets,
                                     Option.some(rname),
                                     Option.some(rtype),
                                     ttl);
    }
}
