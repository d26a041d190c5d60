package org.pragmatica.dnsb.compiler.zone;

import org.junit.jupiter.api.Test;
import org.pragmatica.dnsb.compiler.behavior.RecordType;
import org.pragmatica.dnsb.compiler.behavior.ZoneRecord;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ZoneFileRendererTest {
    private static final Clock CLOCK = Clock.fixed(Instant.ofEpochSecond(1700000000L), ZoneOffset.UTC);

    private final ZoneFileRenderer renderer = ZoneFileRenderer.zoneFileRenderer(CLOCK);

    @Test
    void render_writesHeaderAndRelativeRecords() {
        var records = List.of(ZoneRecord.zoneRecord("www.example.com", RecordType.A, 300, "1.2.3.4"),
                              ZoneRecord.zoneRecord("web.example.com", RecordType.CNAME, 3600, "www.example.com"),
                              ZoneRecord.zoneRecord("example.com", RecordType.NS, 3600, "ns1.provider.net."));

        var lines = renderer.render("example.com", records, "10.88.0.6")
                            .split("\n");

        assertThat(lines[0]).isEqualTo("$ORIGIN example.com.");
        assertThat(lines[1]).startsWith("@")
                            .contains("86400")
                            .contains("SOA")
                            .endsWith("ns.example.com. admin.example.com. 1700000000 7200 3600 1209600 3600");
        assertThat(lines[2]).isEqualTo(String.format("%-24s%-8d%-8s%-8s%s", "@", 3600, "IN", "NS", "ns.example.com."));
        assertThat(lines[3]).isEqualTo(String.format("%-24s%-8d%-8s%-8s%s", "ns", 3600, "IN", "A", "10.88.0.6"));
        assertThat(lines[4]).isEqualTo(String.format("%-24s%-8d%-8s%-8s%s", "www", 300, "IN", "A", "1.2.3.4"));
        assertThat(lines[5]).isEqualTo(String.format("%-24s%-8d%-8s%-8s%s", "web", 3600, "IN", "CNAME", "www.example.com."));
        assertThat(lines[6]).isEqualTo(String.format("%-24s%-8d%-8s%-8s%s", "@", 3600, "IN", "NS", "ns1.provider.net."));
    }

    @Test
    void render_rootZone() {
        var records = List.of(ZoneRecord.zoneRecord(".", RecordType.NS, 3600, "ns-tld-1."),
                              ZoneRecord.zoneRecord("ns-tld-1.", RecordType.A, 3600, "10.88.0.5"));

        var content = renderer.render(".", records, "10.88.0.3");

        assertThat(content).startsWith("$ORIGIN .\n")
                           .contains(String.format("%-24s%-8d%-8s%-8s%s", "ns-tld-1", 3600, "IN", "A", "10.88.0.5"))
                           .endsWith(String.format("%-24s%-8d%-8s%-8s%s", "@", 3600, "IN", "NS", "ns-tld-1.") + "\n");
    }

    @Test
    void relative_keepsNamesOutsideOrigin() {
        assertThat(ZoneFileRenderer.relative("mail.other.org.", "example.com.")).isEqualTo("mail.other.org.");
        assertThat(ZoneFileRenderer.relative("a.b.example.com.", "example.com.")).isEqualTo("a.b");
        assertThat(ZoneFileRenderer.relative("EXAMPLE.com.", "example.com.")).isEqualTo("@");
    }
}
