package org.pragmatica.dnsb.compiler.behavior;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BehaviorCompilerTest {
    private static final TargetResolver RESOLVER = TargetResolver.targetResolver(Map.of("root", "10.88.0.3",
                                                                                        "tld", "10.88.0.5",
                                                                                        "auth", "10.88.0.6"));

    private static BehaviorCompiler compiler() {
        return BehaviorCompiler.behaviorCompiler(RESOLVER, GlueLabelGenerator.sequential());
    }

    @Test
    void compile_rejectsHintWithSeveralTargets() {
        compiler().compile("resolver", "bind", ". hint root,backup")
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> {
                      assertThat(cause).isInstanceOf(BehaviorError.TargetCount.class);
                      assertThat(cause.message()).contains("behavior line 1");
                  });
    }

    @Test
    void compile_hintProducesRootHintsFile() {
        compiler().compile("resolver", "bind", ". hint root")
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(output -> {
                      assertThat(output.hintFiles()).hasSize(1);
                      var hints = output.hintFiles().get(0);
                      assertThat(hints.fileName()).isEqualTo("gen_resolver_root.hints");
                      assertThat(hints.containerPath()).isEqualTo("/usr/local/etc/zones/gen_resolver_root.hints");
                      assertThat(hints.content()).contains(".\t3600000\tIN\tNS\troot.")
                                                 .contains("root.\t3600000\tIN\tA\t10.88.0.3");
                      assertThat(output.fragments()).hasSize(1);
                      assertThat(output.fragments().get(0).text())
                          .isEqualTo("zone \".\" { type hint; file \"/usr/local/etc/zones/gen_resolver_root.hints\"; };");
                  });
    }

    @Test
    void compile_hintToIpLiteralUsesFallbackName() {
        compiler().compile("resolver", "bind", ". hint 192.0.2.1")
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(output -> assertThat(output.hintFiles().get(0).content())
                      .contains("a.root-servers.net.\t3600000\tIN\tA\t192.0.2.1"));
    }

    @Test
    void compile_synthesizesGlueForServiceNameServer() {
        compiler().compile("root", "bind", ". master @ NS tld")
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(output -> {
                      assertThat(output.zones().zones()).containsExactly(".");
                      assertThat(output.zones().records(".")).containsExactly(
                          ZoneRecord.zoneRecord(".", RecordType.NS, 3600, "ns-tld-1."),
                          ZoneRecord.zoneRecord("ns-tld-1.", RecordType.A, 3600, "10.88.0.5"));
                  });
    }

    @Test
    void compile_keepsExternalNameServerAsIs() {
        compiler().compile("auth", "bind", "example.com master @ NS ns1.provider.net.")
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(output -> assertThat(output.zones().records("example.com")).containsExactly(
                      ZoneRecord.zoneRecord("example.com", RecordType.NS, 3600, "ns1.provider.net.")));
    }

    @Test
    void compile_accumulatesRecordsPerZone() {
        var behavior = """
                       example.com master www A 1.2.3.4
                       example.com master api A auth
                       example.com master web CNAME www
                       other.org master @ TXT owner
                       """;

        compiler().compile("auth", "bind", behavior)
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(output -> {
                      assertThat(output.zones().zones()).containsExactly("example.com", "other.org");
                      var records = output.zones().records("example.com");
                      assertThat(records).hasSize(3);
                      assertThat(records.get(0).toString()).isEqualTo("www.example.com A 3600 1.2.3.4");
                      assertThat(records.get(1).data()).isEqualTo("10.88.0.6");
                      assertThat(records.get(2).data()).isEqualTo("www.example.com");
                      assertThat(output.zones().records("other.org").get(0).data()).isEqualTo("\"owner.other.org\"");
                      assertThat(output.fragments()).hasSize(2);
                  });
    }

    @Test
    void compile_rejectsUnknownTarget() {
        compiler().compile("auth", "bind", "example.com master www A nowhere")
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause).isInstanceOf(BehaviorError.UnresolvableTarget.class));
    }

    @Test
    void compile_rejectsServiceTargetForAaaa() {
        compiler().compile("auth", "bind", "example.com master www AAAA auth")
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause).isInstanceOf(BehaviorError.UnresolvableTarget.class));
    }

    @Test
    void compile_rejectsUnsupportedSoftware() {
        compiler().compile("svc", "nsd", ". hint root")
                  .onSuccessRun(Assertions::fail)
                  .onFailure(cause -> assertThat(cause).isInstanceOf(BehaviorError.UnsupportedSoftware.class));
    }

    @Test
    void compile_forwardResolvesServicesAndLiterals() {
        compiler().compile("fwd", "bind", "corp forward auth, 9.9.9.9")
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(output -> assertThat(output.fragments().get(0).text())
                      .isEqualTo("zone \"corp\" { type forward; forwarders { 10.88.0.6; 9.9.9.9; }; };"));
    }

    @Test
    void generatedConfig_unboundGroupsServerSection() {
        compiler().compile("resolver", "unbound", ". hint root\ncorp stub auth")
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(output -> {
                      var config = output.generatedConfig().unwrap();
                      assertThat(config.containerPath()).isEqualTo("/usr/local/etc/unbound/zones/generated_zones.conf");
                      assertThat(config.content()).contains("server:\n\troot-hints: \"/usr/local/etc/unbound/zones/gen_resolver_root.hints\"")
                                                  .contains("stub-zone:\n\tname: \"corp\"\n\tstub-addr: 10.88.0.6");
                  });
    }

    @Test
    void generatedConfig_absentWithoutStatements() {
        compiler().compile("idle", "pdns-recursor", "# nothing yet\n")
                  .onFailure(cause -> Assertions.fail(cause.message()))
                  .onSuccess(output -> assertThat(output.generatedConfig().isEmpty()).isTrue());
    }

    @Test
    void pdnsRecursor_usesIncludeDirectory() {
        var dialect = ServerDialect.dialect("pdns-recursor").unwrap();

        assertThat(dialect.generatedConfigPath()).isEqualTo("/usr/local/etc/zones/recursor.d/generated_zones.conf");
        assertThat(dialect.includeDirective(dialect.generatedConfigPath())).contains("include-dir=/usr/local/etc/zones/recursor.d");
        assertThat(dialect.includeTarget(dialect.generatedConfigPath())).isEqualTo("/usr/local/etc/zones/recursor.d");
        assertThat(dialect.includesSingleFiles()).isFalse();
        assertThat(ServerDialect.dialect("bind").unwrap().includesSingleFiles()).isTrue();
        assertThat(dialect.stub("corp", java.util.List.of("10.0.0.1")).text()).isEqualTo("forward-zones+=corp=10.0.0.1");
    }
}
