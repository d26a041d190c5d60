package org.pragmatica.dnsb.compiler.zone;

import org.pragmatica.dnsb.compiler.behavior.DnsNames;
import org.pragmatica.dnsb.compiler.behavior.ZoneRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders master zone files.
 *
 * <p>Every file starts with {@code $ORIGIN}, an SOA record, an apex NS record {@code ns.<zone>}
 * and its A record pointing at the serving service, followed by the compiled records. Names under
 * the origin are written relative to it and the apex as {@code @}.
 */
public final class ZoneFileRenderer {
    private static final Logger log = LoggerFactory.getLogger(ZoneFileRenderer.class);

    public static final int SOA_TTL = 86400;
    public static final int REFRESH = 7200;
    public static final int RETRY = 3600;
    public static final int EXPIRE = 1209600;
    public static final int MINIMUM = 3600;
    public static final int DEFAULT_TTL = 3600;

    private final Clock clock;

    private ZoneFileRenderer(Clock clock) {
        this.clock = clock;
    }

    public static ZoneFileRenderer zoneFileRenderer(Clock clock) {
        return new ZoneFileRenderer(clock);
    }

    public static ZoneFileRenderer zoneFileRenderer() {
        return new ZoneFileRenderer(Clock.systemUTC());
    }

    public String render(String zone, List<ZoneRecord> records, String nameServerAddress) {
        var origin = DnsNames.fqdn(zone);
        var prefix = DnsNames.isRoot(zone)
                     ? ""
                     : origin;
        var nameServer = "ns." + prefix;
        var serial = clock.instant()
                          .getEpochSecond();
        var lines = new ArrayList<String>();
        lines.add("$ORIGIN " + origin);
        lines.add(line("@",
                       SOA_TTL,
                       "SOA",
                       nameServer + " admin." + prefix + " " + serial + " " + REFRESH + " " + RETRY + " " + EXPIRE + " "
                       + MINIMUM));
        lines.add(line("@", DEFAULT_TTL, "NS", nameServer));
        lines.add(line(relative(nameServer, origin), DEFAULT_TTL, "A", nameServerAddress));
        records.forEach(record -> lines.add(line(relative(DnsNames.fqdn(record.name()), origin),
                                                 record.ttl(),
                                                 record.type()
                                                       .name(),
                                                 data(record))));
        log.debug("Rendered zone '{}' with {} record(s)", zone, records.size());
        return String.join("\n", lines) + "\n";
    }

    static String relative(String name, String origin) {
        if (name.equalsIgnoreCase(origin)) {
            return "@";
        }
        if (DnsNames.isRoot(origin)) {
            return name.substring(0, name.length() - 1);
        }
        var suffix = "." + origin;
        if (name.toLowerCase()
                .endsWith(suffix.toLowerCase())) {
            return name.substring(0, name.length() - suffix.length());
        }
        return name;
    }

    private static String data(ZoneRecord record) {
        if (record.type()
                  .hasNameData()) {
            return DnsNames.fqdn(record.data());
        }
        return record.data();
    }

    private static String line(String name, int ttl, String type, String data) {
        return String.format("%-24s%-8d%-8s%-8s%s", name, ttl, "IN", type, data);
    }
}
