package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.dnsb.compiler.net.Ipv4Subnet;

import java.util.regex.Pattern;

/**
 * Domain name helpers for behavior compilation and zone rendering.
 */
public sealed interface DnsNames {
    String ROOT = ".";
    String APEX = "@";
    String ROOT_FILE_SUFFIX = "root";

    Pattern IPV6_GROUP = Pattern.compile("^[0-9a-fA-F]{1,4}$");
    int IPV6_GROUPS = 8;

    /**
     * Expands a name relative to {@code zone}. {@code @} is the zone itself, a name ending in
     * '.' is already absolute, anything else is prefixed to the zone.
     */
    static String normalize(String name, String zone) {
        if (APEX.equals(name)) {
            return zone;
        }
        if (name.endsWith(".")) {
            return name;
        }
        if (isRoot(zone)) {
            return name + ".";
        }
        return name + "." + zone;
    }

    static boolean isRoot(String zone) {
        return ROOT.equals(zone);
    }

    /**
     * Zone identifier used as record set key: trailing dot removed, root stays {@code .}.
     */
    static String zoneKey(String zone) {
        if (isRoot(zone) || !zone.endsWith(".")) {
            return zone;
        }
        return zone.substring(0, zone.length() - 1);
    }

    static String zoneFileName(String zone) {
        return "db." + (isRoot(zone)
                        ? ROOT_FILE_SUFFIX
                        : zoneKey(zone));
    }

    /**
     * Absolute form with a trailing dot.
     */
    static String fqdn(String name) {
        return name.endsWith(".")
               ? name
               : name + ".";
    }

    static boolean isIpLiteral(String text) {
        return Ipv4Subnet.isAddress(text) || isIpv6Literal(text);
    }

    /**
     * RFC 4291 text form: eight hex groups, at most one {@code ::}, optionally ending in a dotted
     * IPv4 address that stands for the last two groups.
     */
    static boolean isIpv6Literal(String text) {
        var compressed = text.indexOf("::");
        if (compressed >= 0 && text.indexOf("::", compressed + 1) >= 0) {
            return false;
        }
        if (compressed < 0) {
            return countGroups(text) == IPV6_GROUPS;
        }
        var head = text.substring(0, compressed);
        var tail = text.substring(compressed + 2);
        if (head.contains(".")) {
            return false;
        }
        var headGroups = head.isEmpty()
                         ? 0
                         : countGroups(head);
        var tailGroups = tail.isEmpty()
                         ? 0
                         : countGroups(tail);
        return headGroups >= 0 && tailGroups >= 0 && headGroups + tailGroups < IPV6_GROUPS;
    }

    // Number of 16-bit groups in a run of ':'-separated parts, or -1 if a part is malformed.
    private static int countGroups(String run) {
        var parts = run.split(":", -1);
        var groups = 0;
        for (int i = 0; i < parts.length; i++) {
            var part = parts[i];
            if (i == parts.length - 1 && part.contains(".")) {
                if (!Ipv4Subnet.isAddress(part)) {
                    return -1;
                }
                groups += 2;
            } else if (IPV6_GROUP.matcher(part)
                                 .matches()) {
                groups++;
            } else {
                return -1;
            }
        }
        return groups;
    }

    record Unused() implements DnsNames {}
}
