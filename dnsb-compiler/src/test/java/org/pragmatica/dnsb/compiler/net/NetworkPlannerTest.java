package org.pragmatica.dnsb.compiler.net;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class NetworkPlannerTest {

    private static Mapping withAddress(String address) {
        return ConfigValue.mapping(Map.of("address", ConfigValue.text(address)));
    }

    @Test
    void plan_allocatesSequentiallyAfterReservedHosts() {
        var services = new LinkedHashMap<String, Mapping>();
        services.put("root", Mapping.EMPTY);
        services.put("tld", Mapping.EMPTY);
        services.put("recursor", Mapping.EMPTY);

        NetworkPlanner.plan("10.88.0.0/24", services)
                      .onFailure(cause -> Assertions.fail(cause.message()))
                      .onSuccess(addresses -> assertThat(addresses).containsExactly(Map.entry("root", "10.88.0.3"),
                                                                                    Map.entry("tld", "10.88.0.4"),
                                                                                    Map.entry("recursor", "10.88.0.5")));
    }

    @Test
    void plan_claimsStaticAddressesBeforeDynamicAllocation() {
        var services = new LinkedHashMap<String, Mapping>();
        services.put("first", Mapping.EMPTY);
        services.put("fixed", withAddress("10.88.0.3"));
        services.put("second", Mapping.EMPTY);

        NetworkPlanner.plan("10.88.0.0/24", services)
                      .onFailure(cause -> Assertions.fail(cause.message()))
                      .onSuccess(addresses -> {
                          assertThat(addresses.get("fixed")).isEqualTo("10.88.0.3");
                          assertThat(addresses.get("first")).isEqualTo("10.88.0.4");
                          assertThat(addresses.get("second")).isEqualTo("10.88.0.5");
                      });
    }

    @Test
    void plan_rejectsStaticAddressOutsideSubnet() {
        NetworkPlanner.plan("10.88.0.0/24", Map.of("svc", withAddress("10.89.0.3")))
                      .onSuccessRun(Assertions::fail)
                      .onFailure(cause -> assertThat(cause).isInstanceOf(NetworkError.AddressOutsideSubnet.class));
    }

    @Test
    void plan_rejectsDuplicateStaticAddress() {
        var services = new LinkedHashMap<String, Mapping>();
        services.put("a", withAddress("10.88.0.10"));
        services.put("b", withAddress("10.88.0.10"));

        NetworkPlanner.plan("10.88.0.0/24", services)
                      .onSuccessRun(Assertions::fail)
                      .onFailure(cause -> assertThat(cause.message()).contains("'b'").contains("'a'"));
    }

    @Test
    void plan_rejectsInvalidStaticAddress() {
        NetworkPlanner.plan("10.88.0.0/24", Map.of("svc", withAddress("10.88.0")))
                      .onSuccessRun(Assertions::fail)
                      .onFailure(cause -> assertThat(cause).isInstanceOf(NetworkError.InvalidAddress.class));
    }

    @Test
    void plan_failsWhenSubnetIsExhausted() {
        var services = new LinkedHashMap<String, Mapping>();
        services.put("a", Mapping.EMPTY);
        services.put("b", Mapping.EMPTY);

        // /30 has hosts .1 and .2, both reserved
        NetworkPlanner.plan("10.88.0.0/30", services)
                      .onSuccessRun(Assertions::fail)
                      .onFailure(cause -> assertThat(cause.message()).contains("'a'"));
    }

    @Test
    void plan_rejectsInvalidSubnet() {
        NetworkPlanner.plan("not-a-subnet", Map.of())
                      .onSuccessRun(Assertions::fail)
                      .onFailure(cause -> assertThat(cause).isInstanceOf(NetworkError.InvalidSubnet.class));
    }
}
