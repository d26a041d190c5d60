package org.pragmatica.dnsb.setup.generators;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.dnsb.compiler.CompilerSettings;
import org.pragmatica.dnsb.compiler.PlanCompiler;
import org.pragmatica.dnsb.compiler.behavior.GlueLabelGenerator;
import org.pragmatica.dnsb.compiler.hook.HookRegistry;
import org.pragmatica.dnsb.compiler.plan.BuildPlan;
import org.pragmatica.dnsb.compiler.reference.TemplateCatalog;
import org.pragmatica.dnsb.compiler.substitute.Scope;
import org.pragmatica.dnsb.config.ConfigLoader;
import org.pragmatica.lang.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ComposeGeneratorTest {
    private static final String TOPOLOGY = """
        name: lab
        inet: 10.88.0.0/24
        images:
          bind-img:
            ref: bind:9.18
        builds:
          root:
            image: bind-img
            ref: bind:root
            behavior: |
              . master @ NS auth
          auth:
            image: bind-img
            ref: bind:authoritative
            volumes:
              - "extra.conf:/etc/bind/extra.conf"
            behavior: |
              example.com master www A 1.2.3.4
          recursor:
            image: bind-img
            ref: bind:recursor
            cap_add: [NET_ADMIN, SYS_TIME]
            environment:
              ROOT: ${services.root.ip}
            volumes:
              - "${origin}/var/log/lab:/var/log/named"
            behavior: |
              . hint root
        """;

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @TempDir
    Path workDir;

    private static TemplateCatalog catalog;

    @BeforeAll
    static void loadCatalog() {
        catalog = TemplateCatalog.bundled()
                                 .onFailure(cause -> Assertions.fail(cause.message()))
                                 .unwrap();
    }

    private BuildPlan plan() throws IOException {
        Files.writeString(workDir.resolve("extra.conf"), "logging { };\n");
        return plan(TOPOLOGY);
    }

    private BuildPlan plan(String topology) {
        var settings = CompilerSettings.compilerSettings(workDir)
                                       .withGlueLabels(GlueLabelGenerator.sequential())
                                       .withClock(Clock.fixed(Instant.ofEpochSecond(1700000000L), ZoneOffset.UTC))
                                       .withEnvironment(new Scope.Env(name -> Option.none()));
        return ConfigLoader.loadFromString(topology, workDir)
                           .flatMap(config -> PlanCompiler.planCompiler(catalog, HookRegistry.hookRegistry(), settings)
                                                          .compile(config))
                           .onFailure(cause -> Assertions.fail(cause.message()))
                           .unwrap();
    }

    private GeneratorOutput generate(boolean graph) throws IOException {
        return ComposeGenerator.composeGenerator(workDir, graph)
                               .generate(plan(), workDir.resolve("out"))
                               .onFailure(cause -> Assertions.fail(cause.message()))
                               .unwrap();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> service(Map<String, Object> compose, String name) {
        return (Map<String, Object>) ((Map<String, Object>) compose.get("services")).get(name);
    }

    @Test
    @SuppressWarnings("unchecked")
    void generate_writesComposeFileWithNetworkAndServices() throws IOException {
        var output = generate(false);
        var compose = YAML.readValue(output.outputDir()
                                           .resolve(ComposeGenerator.COMPOSE_FILE)
                                           .toFile(),
                                     Map.class);

        assertThat(compose.get("name")).isEqualTo("lab");
        assertThat(((Map<String, Object>) compose.get("services")).keySet()).containsExactly("root", "auth", "recursor");
        var network = (Map<String, Object>) ((Map<String, Object>) compose.get("networks")).get(ComposeGenerator.NETWORK);
        assertThat(network.get("driver")).isEqualTo("bridge");
        assertThat(network.get("ipam")).isEqualTo(Map.of("config", List.of(Map.of("subnet", "10.88.0.0/24"))));

        var root = service(compose, "root");
        assertThat(root.get("container_name")).isEqualTo("lab-root");
        assertThat(root.get("hostname")).isEqualTo("root");
        assertThat(root.get("build")).isEqualTo("./root");
        assertThat(root.get("networks")).isEqualTo(Map.of("app_net", Map.of("ipv4_address", "10.88.0.3")));
        assertThat(root.get("cap_add")).isEqualTo(List.of("NET_ADMIN"));
        assertThat(root).doesNotContainKeys("image", "ref", "behavior");
        assertThat((List<String>) root.get("volumes")).contains("./root/contents/named.conf:/etc/bind/named.conf",
                                                                "./root/contents/generated_zones.conf:/usr/local/etc/zones/generated_zones.conf",
                                                                "./root/contents/zones/db.root:/usr/local/etc/zones/db.root");
    }

    @Test
    @SuppressWarnings("unchecked")
    void generate_passesThroughServiceKeysAndCapabilities() throws IOException {
        var output = generate(false);
        var compose = YAML.readValue(output.outputDir()
                                           .resolve(ComposeGenerator.COMPOSE_FILE)
                                           .toFile(),
                                     Map.class);

        var recursor = service(compose, "recursor");
        assertThat(recursor.get("cap_add")).isEqualTo(List.of("NET_ADMIN", "SYS_TIME"));
        assertThat(recursor.get("environment")).isEqualTo(Map.of("ROOT", "10.88.0.3"));
        assertThat(recursor.get("command")).isEqualTo(List.of("named", "-g", "-c", "/etc/bind/named.conf"));
        assertThat((List<String>) recursor.get("volumes")).contains("/var/log/lab:/var/log/named",
                                                                    "./recursor/contents/zones/gen_recursor_root.hints:/usr/local/etc/zones/gen_recursor_root.hints");
    }

    @Test
    void generate_writesDockerfileAndServiceContents() throws IOException {
        var output = generate(false);
        var out = output.outputDir();

        assertThat(Files.readString(out.resolve("root/Dockerfile"))).contains("FROM ubuntu:22.04")
                                                                    .contains("bind9");
        assertThat(Files.readString(out.resolve("root/contents/named.conf"))).contains("options {")
                                                                             .endsWith("include \"/usr/local/etc/zones/generated_zones.conf\";\n");
        assertThat(Files.readString(out.resolve("root/contents/generated_zones.conf"))).contains("type master");
        assertThat(Files.readString(out.resolve("root/contents/zones/db.root"))).startsWith("$ORIGIN .\n");
        assertThat(Files.readString(out.resolve("auth/contents/extra.conf"))).isEqualTo("logging { };\n");
        assertThat(output.generatedFiles()).contains(Path.of("docker-compose.yml"), Path.of("recursor", "Dockerfile"));
        assertThat(output.instructions()).contains("docker compose up");
    }

    @Test
    void generate_includesExtraConfigIntoMainConfig() throws IOException {
        var out = generate(false).outputDir();

        assertThat(Files.readString(out.resolve("auth/contents/named.conf")))
            .contains("include \"/etc/bind/extra.conf\";")
            .endsWith("include \"/usr/local/etc/zones/generated_zones.conf\";\n");
    }

    @Test
    void generate_skipsIncludeAlreadyPresentInMainConfig() throws IOException {
        var mainConfig = """
            options { directory "/var/cache/bind"; };
            include "/etc/bind/extra.conf";
            include "/usr/local/etc/zones/generated_zones.conf";
            """;
        Files.writeString(workDir.resolve("named.conf"), mainConfig);
        Files.writeString(workDir.resolve("extra.conf"), "logging { };\n");
        var topology = """
            name: lab
            inet: 10.88.0.0/24
            builds:
              auth:
                image: bind:9.18
                volumes:
                  - "named.conf:/etc/bind/named.conf"
                  - "extra.conf:/etc/bind/extra.conf"
                behavior: |
                  example.com master www A 1.2.3.4
            """;

        ComposeGenerator.composeGenerator(workDir, false)
                        .render(plan(topology))
                        .onFailure(cause -> Assertions.fail(cause.message()))
                        .onSuccess(files -> assertThat(files.get(Path.of("auth", "contents", "named.conf")))
                            .isEqualTo(mainConfig));
    }

    @Test
    void generate_writesTopologyGraphOnRequest() throws IOException {
        assertThat(generate(false).outputDir()
                                  .resolve(ComposeGenerator.TOPOLOGY_FILE)).doesNotExist();

        var graph = Files.readString(generate(true).outputDir()
                                                   .resolve(ComposeGenerator.TOPOLOGY_FILE));

        assertThat(graph).startsWith("digraph \"lab\"")
                         .contains("\"recursor\" -> \"root\";")
                         .contains("\"root\" -> \"auth\";");
    }

    @Test
    void generate_replacesPreviousOutput() throws IOException {
        var stale = workDir.resolve("out/stale/Dockerfile");
        generate(false);
        Files.createDirectories(stale.getParent());
        Files.writeString(stale, "FROM scratch\n");

        generate(false);

        assertThat(stale).doesNotExist();
    }

    @Test
    void generate_refusesForeignNonEmptyDirectory() throws IOException {
        var target = workDir.resolve("foreign");
        Files.createDirectories(target);
        Files.writeString(target.resolve("notes.txt"), "keep me\n");

        ComposeGenerator.composeGenerator(workDir, false)
                        .generate(plan(), target)
                        .onSuccessRun(Assertions::fail)
                        .onFailure(cause -> assertThat(cause).isInstanceOf(GeneratorError.IoError.class));
        assertThat(target.resolve("notes.txt")).exists();
    }

    @Test
    void generate_failsOnUnreadableSource() throws IOException {
        var plan = plan();
        Files.delete(workDir.resolve("extra.conf"));

        ComposeGenerator.composeGenerator(workDir, false)
                        .render(plan)
                        .onSuccessRun(Assertions::fail)
                        .onFailure(cause -> {
                            assertThat(cause).isInstanceOf(GeneratorError.SourceNotFound.class);
                            assertThat(cause.message()).contains("auth")
                                                       .contains("extra.conf");
                        });
    }
}
