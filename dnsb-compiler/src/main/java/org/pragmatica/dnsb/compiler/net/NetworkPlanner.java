package org.pragmatica.dnsb.compiler.net;

import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Assigns an IPv4 address to every concrete service.
 *
 * <p>Static {@code address} values are claimed first, so a static address is never handed out
 * dynamically to an earlier service. Remaining services get the next free host address in
 * declaration order. The first two host addresses are reserved for the gateway.
 */
public final class NetworkPlanner {
    private static final Logger log = LoggerFactory.getLogger(NetworkPlanner.class);

    public static final String ADDRESS = "address";
    public static final int RESERVED_HOSTS = 2;

    private NetworkPlanner() {}

    public static Result<Map<String, String>> plan(String inet, Map<String, Mapping> services) {
        return Ipv4Subnet.ipv4Subnet(inet)
                         .flatMap(subnet -> plan(subnet, services));
    }

    private static Result<Map<String, String>> plan(Ipv4Subnet subnet, Map<String, Mapping> services) {
        log.info("Planning network for subnet {}", subnet);
        var owners = new HashMap<Long, String>();
        for (var entry : services.entrySet()) {
            var name = entry.getKey();
            var claimed = entry.getValue()
                               .text(ADDRESS)
                               .map(address -> claim(subnet, name, address, owners));
            if (claimed.isPresent() && claimed.unwrap()
                                              .isFailure()) {
                return claimed.unwrap()
                              .map(ignored -> Map.of());
            }
        }
        var addresses = new LinkedHashMap<String, String>();
        var next = subnet.firstHost() + RESERVED_HOSTS;
        for (var entry : services.entrySet()) {
            var name = entry.getKey();
            var staticAddress = entry.getValue()
                                     .text(ADDRESS);
            if (staticAddress.isPresent()) {
                addresses.put(name, staticAddress.unwrap()
                                                 .trim());
                continue;
            }
            while (next <= subnet.lastHost() && owners.containsKey(next)) {
                next++;
            }
            if (next > subnet.lastHost()) {
                return new NetworkError.SubnetExhausted(subnet.toString(), name).result();
            }
            owners.put(next, name);
            addresses.put(name, Ipv4Subnet.format(next));
            log.debug("Allocated {} to service '{}'", Ipv4Subnet.format(next), name);
            next++;
        }
        return Result.success(addresses);
    }

    private static Result<Long> claim(Ipv4Subnet subnet, String service, String address, Map<Long, String> owners) {
        var parsed = Ipv4Subnet.parseAddress(address);
        if (parsed.isEmpty()) {
            return new NetworkError.InvalidAddress(service, address).result();
        }
        var value = parsed.unwrap();
        if (!subnet.contains(value)) {
            return new NetworkError.AddressOutsideSubnet(service, address, subnet.toString()).result();
        }
        var owner = owners.putIfAbsent(value, service);
        if (owner != null) {
            return new NetworkError.AddressTaken(service, address, owner).result();
        }
        log.debug("Service '{}' requested static address {}", service, address);
        return Result.success(value);
    }
}
