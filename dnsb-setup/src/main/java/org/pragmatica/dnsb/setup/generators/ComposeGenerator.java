package org.pragmatica.dnsb.setup.generators;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import org.pragmatica.dnsb.compiler.behavior.ServerDialect;
import org.pragmatica.dnsb.compiler.plan.BuildPlan;
import org.pragmatica.dnsb.compiler.plan.FilePlacement;
import org.pragmatica.dnsb.compiler.plan.ServicePlan;
import org.pragmatica.dnsb.compiler.topology.TopologyMapper;
import org.pragmatica.dnsb.config.ConfigSource;
import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Generates a Docker Compose deployment for a compiled DNS topology.
 *
 * <p>Generates:
 * <ul>
 *   <li>docker-compose.yml - one service per concrete DNS service on the project network</li>
 *   <li>&lt;service&gt;/Dockerfile - image build for the service</li>
 *   <li>&lt;service&gt;/contents/ - copied configuration files and the generated zone configuration</li>
 *   <li>&lt;service&gt;/contents/zones/ - root hints and zone files</li>
 *   <li>topology.dot - service graph, when requested</li>
 * </ul>
 */
public final class ComposeGenerator implements Generator {
    private static final Logger log = LoggerFactory.getLogger(ComposeGenerator.class);

    public static final String COMPOSE_FILE = "docker-compose.yml";
    public static final String TOPOLOGY_FILE = "topology.dot";
    public static final String DOCKERFILE = "Dockerfile";
    public static final String NETWORK = "app_net";
    public static final String CONTENTS = "contents";
    public static final String ZONES = "zones";
    public static final String CAP_ADD = "cap_add";
    public static final List<String> DEFAULT_CAP_ADD = List.of("NET_ADMIN");
    public static final Set<String> RESERVED_KEYS = Set.of("image",
                                                           "volumes",
                                                           CAP_ADD,
                                                           "address",
                                                           "ref",
                                                           "behavior",
                                                           "build",
                                                           "mixins",
                                                           "mounts",
                                                           "auto");

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory().disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                                                                               .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                                                                               .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS));

    private final Path workingDirectory;
    private final boolean writeTopology;

    private ComposeGenerator(Path workingDirectory, boolean writeTopology) {
        this.workingDirectory = workingDirectory;
        this.writeTopology = writeTopology;
    }

    /**
     * @param workingDirectory directory relative volume sources are read from
     * @param writeTopology    also write the service graph as Graphviz DOT
     */
    public static ComposeGenerator composeGenerator(Path workingDirectory, boolean writeTopology) {
        return new ComposeGenerator(workingDirectory, writeTopology);
    }

    @Override
    public Result<GeneratorOutput> generate(BuildPlan plan, Path outputDir) {
        return render(plan).flatMap(files -> write(plan, outputDir, files));
    }

    /**
     * All artifact contents, keyed by path relative to the output directory.
     */
    public Result<Map<Path, String>> render(BuildPlan plan) {
        var files = new LinkedHashMap<Path, String>();
        var services = new LinkedHashMap<String, Object>();
        for (var service : plan.services()
                               .values()) {
            var block = renderService(plan, service, files);
            if (block.isFailure()) {
                return block.map(ignored -> Map.of());
            }
            services.put(service.name(), block.unwrap());
        }
        return composeFile(plan, services).map(compose -> {
                                                   files.put(Path.of(COMPOSE_FILE), compose);
                                                   if (writeTopology) {
                                                       files.put(Path.of(TOPOLOGY_FILE),
                                                                 TopologyMapper.toDot(plan.project(), plan.topology()));
                                                   }
                                                   return files;
                                               });
    }

    private Result<Map<String, Object>> renderService(BuildPlan plan, ServicePlan service, Map<Path, String> files) {
        var name = service.name();
        var serviceDir = Path.of(name);
        return Dockerfiles.dockerfile(name, service.imageName(), service.image(), plan.mirror())
                          .flatMap(dockerfile -> {
                                       files.put(serviceDir.resolve(DOCKERFILE), dockerfile);
                                       return volumes(service, serviceDir, files);
                                   })
                          .map(volumes -> composeService(plan, service, volumes));
    }

    private Result<List<String>> volumes(ServicePlan service, Path serviceDir, Map<Path, String> files) {
        var volumes = new TreeSet<String>();
        for (var placement : service.files()) {
            if (placement instanceof FilePlacement.Copied copied) {
                var content = copy(service, copied);
                if (content.isFailure()) {
                    return content.map(ignored -> List.of());
                }
                var relative = Path.of(CONTENTS, copied.fileName());
                files.put(serviceDir.resolve(relative), content.unwrap());
                volumes.add(volume(serviceDir, relative, copied.containerPath()));
            } else if (placement instanceof FilePlacement.Generated generated) {
                var file = generated.file();
                var relative = ServerDialect.GENERATED_CONFIG.equals(file.fileName())
                               ? Path.of(CONTENTS, file.fileName())
                               : Path.of(CONTENTS, ZONES, file.fileName());
                files.put(serviceDir.resolve(relative), file.content());
                volumes.add(volume(serviceDir, relative, file.containerPath()));
            } else if (placement instanceof FilePlacement.Mounted mounted) {
                volumes.add(mounted.hostPath() + ":" + mounted.containerPath());
            }
        }
        return Result.success(List.copyOf(volumes));
    }

    private Result<String> copy(ServicePlan service, FilePlacement.Copied copied) {
        return ConfigSource.of(copied.source(), workingDirectory)
                           .read()
                           .mapError(cause -> new GeneratorError.SourceNotFound(service.name(),
                                                                                 copied.source(),
                                                                                 cause.message()))
                           .map(content -> withIncludes(service, copied.containerPath(), content));
    }

    private static String withIncludes(ServicePlan service, String containerPath, String content) {
        var result = content;
        for (var include : service.includes()) {
            if (include.containerPath()
                       .equals(containerPath)) {
                result = include.applyTo(result);
            }
        }
        return result;
    }

    private static String volume(Path serviceDir, Path relative, String containerPath) {
        return "./" + serviceDir.resolve(relative)
                                .toString()
                                .replace('\\', '/') + ":" + containerPath;
    }

    private static Map<String, Object> composeService(BuildPlan plan, ServicePlan service, List<String> volumes) {
        var definition = service.definition();
        var block = new LinkedHashMap<String, Object>();
        block.put("container_name", plan.project() + "-" + service.name());
        block.put("hostname", service.name());
        block.put("build", "./" + service.name());
        block.put("networks", Map.of(NETWORK, Map.of("ipv4_address", service.address())));
        if (!volumes.isEmpty()) {
            block.put("volumes", volumes);
        }
        block.put(CAP_ADD,
                  definition.sequence(CAP_ADD)
                            .filter(sequence -> !sequence.isEmpty())
                            .map(ConfigValue::toObject)
                            .or(DEFAULT_CAP_ADD));
        definition.entries()
                  .forEach((key, value) -> {
                               if (!RESERVED_KEYS.contains(key)) {
                                   block.put(key, value.toObject());
                               }
                           });
        return block;
    }

    private static Result<String> composeFile(BuildPlan plan, Map<String, Object> services) {
        var network = new LinkedHashMap<String, Object>();
        network.put("driver", "bridge");
        network.put("ipam", Map.of("config", List.of(Map.of("subnet", plan.inet()))));
        var compose = new LinkedHashMap<String, Object>();
        compose.put("name", plan.project());
        compose.put("services", services);
        compose.put("networks", Map.of(NETWORK, network));
        return Result.lift(e -> GeneratorError.ioError("cannot serialize " + COMPOSE_FILE + ": " + e.getMessage()),
                           () -> YAML.writeValueAsString(compose));
    }

    private Result<GeneratorOutput> write(BuildPlan plan, Path outputDir, Map<Path, String> files) {
        try{
            replaceDirectory(outputDir);
            var generatedFiles = new ArrayList<Path>();
            for (var entry : files.entrySet()) {
                var target = outputDir.resolve(entry.getKey());
                Files.createDirectories(target.getParent());
                Files.writeString(target, entry.getValue());
                generatedFiles.add(entry.getKey());
                log.debug("Wrote {}", target);
            }
            log.info("Generated {} file(s) for project '{}' in {}", generatedFiles.size(), plan.project(), outputDir);
            var instructions = String.format("""
                Docker Compose topology generated in: %s

                To start the topology:
                  cd %s && docker compose up -d --build

                To stop it:
                  docker compose down

                Services: %d
                Network: %s (%s)
                """,
                                             outputDir,
                                             outputDir,
                                             plan.services()
                                                 .size(),
                                             NETWORK,
                                             plan.inet());
            return Result.success(GeneratorOutput.generatorOutput(outputDir, generatedFiles, instructions));
        } catch (IOException e) {
            return GeneratorError.ioError(e.getMessage())
                                 .result();
        }
    }

    /**
     * Removes a previous generation. A non-empty directory without a compose file is left alone.
     */
    private static void replaceDirectory(Path outputDir) throws IOException {
        if (Files.isDirectory(outputDir)) {
            boolean empty;
            try (var entries = Files.list(outputDir)) {
                empty = entries.findAny()
                               .isEmpty();
            }
            if (!empty && !Files.exists(outputDir.resolve(COMPOSE_FILE))) {
                throw new IOException("output directory " + outputDir + " is not empty and holds no " + COMPOSE_FILE);
            }
            try (var paths = Files.walk(outputDir)) {
                for (var path : paths.sorted(Comparator.reverseOrder())
                                     .toList()) {
                    Files.delete(path);
                }
            }
        }
        Files.createDirectories(outputDir);
    }
}
