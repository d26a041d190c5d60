package org.pragmatica.dnsb.compiler.topology;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TopologyMapperTest {
    private static final LinkedHashSet<String> SERVICES = new LinkedHashSet<>(List.of("client", "recursor", "root", "tld"));

    @Test
    void map_collectsServiceTargetsOfAllKinds() {
        var behaviors = new LinkedHashMap<String, String>();
        behaviors.put("recursor", ". hint root\nexample.com forward 8.8.8.8, tld");
        behaviors.put("root", ". master com NS tld\n. master www A 1.2.3.4\n. master alias CNAME recursor");

        var topology = TopologyMapper.map(behaviors, SERVICES);

        assertThat(topology.keySet()).containsExactly("client", "recursor", "root", "tld");
        assertThat(topology.get("recursor")).containsExactly("root", "tld");
        assertThat(topology.get("root")).containsExactly("tld");
        assertThat(topology.get("client")).isEmpty();
    }

    @Test
    void map_skipsUnparsableBehavior() {
        var topology = TopologyMapper.map(Map.of("recursor", "this is not a behavior"), SERVICES);

        assertThat(topology.get("recursor")).isEmpty();
    }

    @Test
    void toDot_rendersNodesAndEdges() {
        var topology = TopologyMapper.map(Map.of("recursor", ". hint root"), new LinkedHashSet<>(List.of("recursor", "root")));

        var dot = TopologyMapper.toDot("lab", topology);

        assertThat(dot).startsWith("digraph \"lab\" {\n")
                       .contains("    \"root\";\n")
                       .contains("    \"recursor\" -> \"root\";\n")
                       .endsWith("}\n");
    }
}
