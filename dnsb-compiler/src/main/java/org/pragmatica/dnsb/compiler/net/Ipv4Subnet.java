package org.pragmatica.dnsb.compiler.net;

import org.pragmatica.lang.Option;
import org.pragmatica.lang.Result;

import java.util.regex.Pattern;

/**
 * IPv4 subnet in CIDR notation. Addresses are kept as unsigned 32-bit values in a {@code long}.
 */
public record Ipv4Subnet(long network, int prefix) {
    private static final Pattern ADDRESS = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");

    public static Result<Ipv4Subnet> ipv4Subnet(String cidr) {
        var parts = cidr.trim()
                        .split("/");
        if (parts.length != 2 || !parts[1].matches("\\d{1,2}")) {
            return new NetworkError.InvalidSubnet(cidr).result();
        }
        var prefix = Integer.parseInt(parts[1]);
        if (prefix > 32) {
            return new NetworkError.InvalidSubnet(cidr).result();
        }
        return parseAddress(parts[0]).map(address -> new Ipv4Subnet(address & mask(prefix), prefix))
                                     .toResult(new NetworkError.InvalidSubnet(cidr));
    }

    /**
     * Parses a dotted-quad address.
     */
    public static Option<Long> parseAddress(String text) {
        var matcher = ADDRESS.matcher(text.trim());
        if (!matcher.matches()) {
            return Option.none();
        }
        long value = 0;
        for (int group = 1; group <= 4; group++) {
            var octet = Integer.parseInt(matcher.group(group));
            if (octet > 255) {
                return Option.none();
            }
            value = (value << 8) | octet;
        }
        return Option.some(value);
    }

    public static boolean isAddress(String text) {
        return parseAddress(text).isPresent();
    }

    public static String format(long address) {
        return ((address >> 24) & 0xFF) + "." + ((address >> 16) & 0xFF) + "." + ((address >> 8) & 0xFF) + "." + (address
                                                                                                                   & 0xFF);
    }

    public boolean contains(long address) {
        return (address & mask(prefix)) == network;
    }

    public long broadcast() {
        return network | (~mask(prefix) & 0xFFFFFFFFL);
    }

    /**
     * First usable host address. /31 and /32 networks have no network or broadcast address.
     */
    public long firstHost() {
        return prefix >= 31
               ? network
               : network + 1;
    }

    public long lastHost() {
        return prefix >= 31
               ? broadcast()
               : broadcast() - 1;
    }

    @Override
    public String toString() {
        return format(network) + "/" + prefix;
    }

    private static long mask(int prefix) {
        return prefix == 0
               ? 0L
               : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
    }
}
