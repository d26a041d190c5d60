package org.pragmatica.dnsb.compiler;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.pragmatica.dnsb.compiler.behavior.GlueLabelGenerator;
import org.pragmatica.dnsb.compiler.behavior.RecordType;
import org.pragmatica.dnsb.compiler.behavior.ZoneRecord;
import org.pragmatica.dnsb.compiler.hook.Hook;
import org.pragmatica.dnsb.compiler.hook.HookCapabilities;
import org.pragmatica.dnsb.compiler.hook.HookError;
import org.pragmatica.dnsb.compiler.hook.HookRegistry;
import org.pragmatica.dnsb.compiler.hook.HookStage;
import org.pragmatica.dnsb.compiler.plan.BuildPlan;
import org.pragmatica.dnsb.compiler.plan.FilePlacement;
import org.pragmatica.dnsb.compiler.reference.ReferenceError;
import org.pragmatica.dnsb.compiler.reference.TemplateCatalog;
import org.pragmatica.dnsb.compiler.substitute.Scope;
import org.pragmatica.dnsb.compiler.version.VersionError;
import org.pragmatica.dnsb.config.ConfigLoader;
import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Option;
import org.pragmatica.lang.Result;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class PlanCompilerTest {
    private static final String TOPOLOGY = """
        name: lab
        inet: 10.88.0.0/24
        images:
          bind-img:
            ref: bind:9.18
        builds:
          bind-base:
            build: false
            image: bind-img
            ref: std:recursor
          root:
            image: bind-img
            ref: bind:root
            behavior: |
              . master @ NS tld
          tld:
            image: bind-img
            ref: bind:tld
            behavior: |
              com master example NS auth
          auth:
            image: bind-img
            ref: bind:authoritative
            behavior: |
              example.com master www A 1.2.3.4
          recursor:
            ref: bind-base
            environment:
              ROOT: ${services.root.ip}
              HOME_DIR: ${env.HOME_DIR:/root}
            behavior: |
              . hint root
          client:
            image: bind-img
            address: 10.88.0.50
            environment:
              RESOLVER: ${svc.recursor.addr}
        """;

    private static TemplateCatalog catalog;

    @BeforeAll
    static void loadCatalog() {
        catalog = TemplateCatalog.bundled()
                                 .onFailure(cause -> Assertions.fail(cause.message()))
                                 .unwrap();
    }

    private static CompilerSettings settings() {
        return CompilerSettings.compilerSettings(Path.of("."))
                               .withGlueLabels(GlueLabelGenerator.sequential())
                               .withClock(Clock.fixed(Instant.ofEpochSecond(1700000000L), ZoneOffset.UTC))
                               .withEnvironment(new Scope.Env(name -> Option.none()))
                               .withParallelism(4);
    }

    private static Result<BuildPlan> compile(String yaml, HookRegistry hooks) {
        return ConfigLoader.loadFromString(yaml)
                           .flatMap(config -> PlanCompiler.planCompiler(catalog, hooks, settings())
                                                          .compile(config));
    }

    private static Result<BuildPlan> compile(String yaml) {
        return compile(yaml, HookRegistry.hookRegistry());
    }

    @Test
    void compile_buildsPlanForConcreteServices() {
        compile(TOPOLOGY).onFailure(cause -> Assertions.fail(cause.message()))
                         .onSuccess(plan -> {
                             assertThat(plan.project()).isEqualTo("lab");
                             assertThat(plan.services().keySet()).containsExactly("root", "tld", "auth", "recursor", "client");
                             assertThat(plan.services().get("root").address()).isEqualTo("10.88.0.3");
                             assertThat(plan.services().get("recursor").address()).isEqualTo("10.88.0.6");
                             assertThat(plan.services().get("client").address()).isEqualTo("10.88.0.50");
                             assertThat(plan.images().get("bind-img").text("software").unwrap()).isEqualTo("bind");
                         });
    }

    @Test
    void compile_substitutesCrossServiceValues() {
        compile(TOPOLOGY).onFailure(cause -> Assertions.fail(cause.message()))
                         .onSuccess(plan -> {
                             var recursorEnv = plan.services().get("recursor").definition().mapping("environment").unwrap();
                             assertThat(recursorEnv.text("ROOT").unwrap()).isEqualTo("10.88.0.3");
                             assertThat(recursorEnv.text("HOME_DIR").unwrap()).isEqualTo("/root");
                             var clientEnv = plan.services().get("client").definition().mapping("environment").unwrap();
                             assertThat(clientEnv.text("RESOLVER").unwrap()).isEqualTo("10.88.0.6");
                         });
    }

    @Test
    void compile_exposesAbstractServicesToCrossServiceLookups() {
        var yaml = """
            name: lab
            inet: 10.88.0.0/24
            builds:
              base:
                build: false
                image: bind:9.18
                environment:
                  MODE: recursive
              svc:
                image: bind:9.18
                environment:
                  FROM_BASE: ${services.base.environment.MODE}
                  BASE_NAME: ${services.base.name}
            """;

        compile(yaml).onFailure(cause -> Assertions.fail(cause.message()))
                     .onSuccess(plan -> {
                         assertThat(plan.services()).doesNotContainKey("base");
                         var environment = plan.services().get("svc").definition().mapping("environment").unwrap();
                         assertThat(environment.text("FROM_BASE").unwrap()).isEqualTo("recursive");
                         assertThat(environment.text("BASE_NAME").unwrap()).isEqualTo("base");
                     });
    }

    @Test
    void compile_inheritsTemplateVolumesThroughAbstractService() {
        compile(TOPOLOGY).onFailure(cause -> Assertions.fail(cause.message()))
                         .onSuccess(plan -> {
                             var recursor = plan.services().get("recursor");
                             assertThat(recursor.files()).contains(new FilePlacement.Copied("resource:templates/configs/bind/named.recursor.conf",
                                                                                            "/etc/bind/named.conf"));
                             assertThat(recursor.files()).anyMatch(file -> file.containerPath()
                                                                               .equals("/usr/local/etc/zones/gen_recursor_root.hints"));
                             assertThat(recursor.includes()).hasSize(1);
                             var include = recursor.includes().get(0);
                             assertThat(include.containerPath()).isEqualTo("/etc/bind/named.conf");
                             assertThat(include.target()).isEqualTo("/usr/local/etc/zones/generated_zones.conf");
                             assertThat(include.directive()).contains("include \"/usr/local/etc/zones/generated_zones.conf\";");
                         });
    }

    @Test
    void compile_includesExtraConfigFilesIntoMainConfig() {
        var yaml = """
            name: lab
            inet: 10.88.0.0/24
            builds:
              svc:
                image: bind:9.18
                volumes:
                  - ./named.conf:/etc/bind/named.conf
                  - ./logging.conf:/etc/bind/logging.conf
                  - ./keys.conf:/etc/bind/keys.conf
            """;

        compile(yaml).onFailure(cause -> Assertions.fail(cause.message()))
                     .onSuccess(plan -> {
                         var includes = plan.services().get("svc").includes();
                         assertThat(includes).extracting(include -> include.target())
                                             .containsExactly("/etc/bind/logging.conf", "/etc/bind/keys.conf");
                         assertThat(includes).allMatch(include -> include.containerPath().equals("/etc/bind/named.conf"));
                         assertThat(includes.get(0).directive()).contains("include \"/etc/bind/logging.conf\";");
                     });
    }

    @Test
    void compile_numbersGlueLabelsPerServiceRegardlessOfScheduling() {
        for (int round = 0; round < 25; round++) {
            ConfigLoader.loadFromString(TOPOLOGY)
                        .flatMap(config -> PlanCompiler.planCompiler(catalog,
                                                                     HookRegistry.hookRegistry(),
                                                                     settings().withParallelism(8))
                                                       .compile(config))
                        .onFailure(cause -> Assertions.fail(cause.message()))
                        .onSuccess(plan -> {
                            assertThat(plan.services().get("root").zones().records("."))
                                .contains(ZoneRecord.zoneRecord(".", RecordType.NS, 3600, "ns-tld-1."));
                            assertThat(plan.services().get("tld").zones().records("com"))
                                .anyMatch(record -> record.type() == RecordType.NS && record.data().startsWith("ns-auth-1."));
                        });
        }
    }

    @Test
    void compile_synthesizesGlueAndRendersZoneFiles() {
        compile(TOPOLOGY).onFailure(cause -> Assertions.fail(cause.message()))
                         .onSuccess(plan -> {
                             var root = plan.services().get("root");
                             assertThat(root.zones().records(".")).containsExactly(
                                 ZoneRecord.zoneRecord(".", RecordType.NS, 3600, "ns-tld-1."),
                                 ZoneRecord.zoneRecord("ns-tld-1.", RecordType.A, 3600, "10.88.0.4"));
                             var zoneFile = root.files()
                                                .stream()
                                                .filter(FilePlacement.Generated.class::isInstance)
                                                .map(FilePlacement.Generated.class::cast)
                                                .filter(file -> file.file().fileName().equals("db.root"))
                                                .findFirst();
                             assertThat(zoneFile).isPresent();
                             assertThat(zoneFile.get().containerPath()).isEqualTo("/usr/local/etc/zones/db.root");
                             assertThat(zoneFile.get().file().content()).startsWith("$ORIGIN .\n")
                                                                        .contains("1700000000");
                             var auth = plan.services().get("auth");
                             assertThat(auth.zones().records("example.com").get(0).toString()).isEqualTo("www.example.com A 3600 1.2.3.4");
                         });
    }

    @Test
    void compile_mapsTopology() {
        compile(TOPOLOGY).onFailure(cause -> Assertions.fail(cause.message()))
                         .onSuccess(plan -> {
                             assertThat(plan.topology().get("recursor")).containsExactly("root");
                             assertThat(plan.topology().get("root")).containsExactly("tld");
                             assertThat(plan.topology().get("tld")).containsExactly("auth");
                             assertThat(plan.topology().get("client")).isEmpty();
                         });
    }

    @Test
    void compile_failsOnReferenceCycle() {
        var yaml = """
            name: lab
            inet: 10.88.0.0/24
            builds:
              a:
                ref: b
              b:
                ref: a
            """;

        compile(yaml).onSuccessRun(Assertions::fail)
                     .onFailure(cause -> {
                         assertThat(cause).isInstanceOf(ReferenceError.CycleDetected.class);
                         assertThat(cause.message()).contains("a → b → a");
                     });
    }

    @Test
    void compile_appliesVersionRulesToImages() {
        compile(TOPOLOGY).onFailure(cause -> Assertions.fail(cause.message()))
                         .onSuccess(plan -> assertThat(plan.images().get("bind-img").sequence("dependency").unwrap().texts().unwrap())
                             .contains("bind9", "libuv1"));
    }

    @Test
    void compile_failsOnUnsupportedSoftwareVersion() {
        var yaml = """
            name: lab
            inet: 10.88.0.0/24
            images:
              pinned:
                ref: bind:9.18
                version: "9.4.0"
            builds:
              svc:
                image: pinned
            """;

        compile(yaml).onSuccessRun(Assertions::fail)
                     .onFailure(cause -> {
                         assertThat(cause).isInstanceOf(VersionError.Unsupported.class);
                         assertThat(cause.message()).contains("'pinned'").contains("9.4.0");
                     });
    }

    @Test
    void compile_failsOnUnknownImage() {
        var yaml = """
            name: lab
            inet: 10.88.0.0/24
            builds:
              svc:
                image: missing
            """;

        compile(yaml).onSuccessRun(Assertions::fail)
                     .onFailure(cause -> assertThat(cause).isInstanceOf(ReferenceError.UnknownImage.class));
    }

    @Test
    void compile_failsWhenRequiredValueIsNeverSet() {
        var yaml = """
            name: lab
            inet: 10.88.0.0/24
            builds:
              base:
                build: false
                image: bind:9.18
                hostname: ${required}
              svc:
                ref: base
            """;

        compile(yaml).onSuccessRun(Assertions::fail)
                     .onFailure(cause -> {
                         assertThat(cause).isInstanceOf(HookError.Rejected.class);
                         assertThat(cause.message()).contains("'svc'").contains("'hostname'");
                     });
    }

    @Test
    void compile_failsOnNonScalarSubstitution() {
        var yaml = """
            name: lab
            inet: 10.88.0.0/24
            builds:
              svc:
                image: bind:9.18
                environment:
                  A: "1"
                copy: ${environment}
            """;

        compile(yaml).onSuccessRun(Assertions::fail)
                     .onFailure(cause -> assertThat(cause.message()).contains("mapping"));
    }

    @Test
    void compile_runsModifyHooksSelectedByProject() {
        var stamp = new Hook() {
            @Override
            public String name() {
                return "stamp";
            }

            @Override
            public Result<Mapping> transform(HookStage stage, String service, Mapping subtree, HookCapabilities capabilities) {
                return Result.success(subtree.with("labels", ConfigValue.mapping(Map.of("stamped", ConfigValue.text(service)))));
            }
        };
        var yaml = """
            name: lab
            inet: 10.88.0.0/24
            auto:
              modify: [stamp]
            builds:
              svc:
                image: bind:9.18
            """;

        compile(yaml, HookRegistry.hookRegistry(List.of(stamp)))
            .onFailure(cause -> Assertions.fail(cause.message()))
            .onSuccess(plan -> assertThat(plan.services().get("svc").definition().mapping("labels").unwrap().text("stamped").unwrap())
                .isEqualTo("svc"));
    }

    @Test
    void compile_failsWhenBehaviorHasNoMainConfig() {
        var yaml = """
            name: lab
            inet: 10.88.0.0/24
            builds:
              svc:
                image: bind:9.18
                behavior: ". hint 192.0.2.1"
            """;

        compile(yaml).onSuccessRun(Assertions::fail)
                     .onFailure(cause -> assertThat(cause.message()).contains("'svc'").contains(".conf"));
    }
}
