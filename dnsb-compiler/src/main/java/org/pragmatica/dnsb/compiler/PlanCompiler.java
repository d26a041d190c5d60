package org.pragmatica.dnsb.compiler;

import org.pragmatica.dnsb.compiler.behavior.BehaviorCompiler;
import org.pragmatica.dnsb.compiler.behavior.BehaviorError;
import org.pragmatica.dnsb.compiler.behavior.BehaviorOutput;
import org.pragmatica.dnsb.compiler.behavior.DnsNames;
import org.pragmatica.dnsb.compiler.behavior.GeneratedFile;
import org.pragmatica.dnsb.compiler.behavior.ServerDialect;
import org.pragmatica.dnsb.compiler.behavior.TargetResolver;
import org.pragmatica.dnsb.compiler.behavior.ZoneRecordSet;
import org.pragmatica.dnsb.compiler.hook.HookCapabilities;
import org.pragmatica.dnsb.compiler.hook.HookRegistry;
import org.pragmatica.dnsb.compiler.hook.HookStage;
import org.pragmatica.dnsb.compiler.net.NetworkPlanner;
import org.pragmatica.dnsb.compiler.plan.BuildPlan;
import org.pragmatica.dnsb.compiler.plan.FilePlacement;
import org.pragmatica.dnsb.compiler.plan.PlanError;
import org.pragmatica.dnsb.compiler.plan.ServicePlan;
import org.pragmatica.dnsb.compiler.reference.DefinitionKind;
import org.pragmatica.dnsb.compiler.reference.ImageIndex;
import org.pragmatica.dnsb.compiler.reference.ReferenceError;
import org.pragmatica.dnsb.compiler.reference.ReferenceGraph;
import org.pragmatica.dnsb.compiler.reference.TemplateCatalog;
import org.pragmatica.dnsb.compiler.substitute.Scope;
import org.pragmatica.dnsb.compiler.substitute.Substitutor;
import org.pragmatica.dnsb.compiler.substitute.VariableContext;
import org.pragmatica.dnsb.compiler.topology.TopologyMapper;
import org.pragmatica.dnsb.compiler.zone.ZoneFileRenderer;
import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.dnsb.config.ProjectConfig;
import org.pragmatica.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles a project configuration into a {@link BuildPlan}.
 *
 * <p>Stages, each a barrier for the next:
 * <ol>
 *   <li>setup hooks on raw service definitions</li>
 *   <li>image and service reference resolution</li>
 *   <li>network planning</li>
 *   <li>placeholder substitution</li>
 *   <li>modify hooks</li>
 *   <li>behavior compilation and file placement</li>
 *   <li>validation hooks</li>
 * </ol>
 * Per-service work inside a stage runs concurrently. Any failure aborts the run and no plan is
 * returned.
 */
public final class PlanCompiler {
    private static final Logger log = LoggerFactory.getLogger(PlanCompiler.class);

    public static final String BUILD = "build";
    public static final String IMAGE = "image";
    public static final String BEHAVIOR = "behavior";
    public static final String VOLUMES = "volumes";
    public static final String SOFTWARE = "software";

    private static final String CONFIG_SUFFIX = ".conf";

    private final TemplateCatalog catalog;
    private final HookRegistry hooks;
    private final CompilerSettings settings;

    private PlanCompiler(TemplateCatalog catalog, HookRegistry hooks, CompilerSettings settings) {
        this.catalog = catalog;
        this.hooks = hooks;
        this.settings = settings;
    }

    public static PlanCompiler planCompiler(TemplateCatalog catalog, HookRegistry hooks, CompilerSettings settings) {
        return new PlanCompiler(catalog, hooks, settings);
    }

    public Result<BuildPlan> compile(ProjectConfig config) {
        log.info("Compiling project '{}'", config.name());
        try (var runner = StageRunner.stageRunner(settings.parallelism())) {
            return new CompileRun(config, runner).execute()
                                                 .onSuccess(plan -> log.info("Project '{}' compiled: {} service(s)",
                                                                             plan.project(),
                                                                             plan.services()
                                                                                 .size()));
        }
    }

    /**
     * A concrete service after reference resolution, with the image it runs.
     */
    record ResolvedService(String name, Mapping definition, String imageName, Mapping image) {}

    /**
     * An abstract service is a template only: {@code build: false} or no image.
     */
    static boolean isAbstract(Mapping definition) {
        return isDisabled(definition) || !definition.has(IMAGE);
    }

    private static boolean isDisabled(Mapping definition) {
        return definition.get(BUILD)
                         .map(ConfigValue::projection)
                         .filter("false"::equalsIgnoreCase)
                         .isPresent();
    }

    private final class CompileRun {
        private final ProjectConfig config;
        private final StageRunner runner;
        private final HookCapabilities capabilities;
        private final Map<String, Mapping> abstractServices = new LinkedHashMap<>();

        private CompileRun(ProjectConfig config, StageRunner runner) {
            this.config = config;
            this.runner = runner;
            this.capabilities = HookCapabilities.hookCapabilities(settings.workingDirectory());
        }

        Result<BuildPlan> execute() {
            return setupHooks().flatMap(builds -> resolveImages().flatMap(images -> compileServices(builds, images)));
        }

        private Result<BuildPlan> compileServices(Map<String, Mapping> builds, Map<String, Mapping> images) {
            return resolveServices(builds, images).flatMap(services -> NetworkPlanner.plan(config.inet(), definitions(services))
                                                                                     .flatMap(addresses -> plans(services,
                                                                                                                 addresses)))
                                                  .map(plans -> buildPlan(images, plans));
        }

        private Result<Map<String, ServicePlan>> plans(Map<String, ResolvedService> services, Map<String, String> addresses) {
            return substitute(services, addresses).flatMap(this::modifyHooks)
                                                  .flatMap(definitions -> assemble(services, addresses, definitions))
                                                  .flatMap(this::validationHooks);
        }

        private Result<Map<String, Mapping>> setupHooks() {
            return runner.run("setup-hooks",
                              config.builds(),
                              (name, definition) -> isDisabled(definition)
                                                    ? Result.success(definition)
                                                    : hooks.transform(HookStage.SETUP,
                                                                      name,
                                                                      definition,
                                                                      config.auto(),
                                                                      capabilities));
        }

        private Result<Map<String, Mapping>> resolveImages() {
            log.info("Stage image-resolution: {} image(s)", config.images()
                                                                  .size());
            return ReferenceGraph.referenceGraph(DefinitionKind.IMAGE, config.images(), catalog.imageTemplates())
                                 .resolveAll()
                                 .flatMap(this::checkVersions);
        }

        // Catches versions overridden after the preset was applied.
        private Result<Map<String, Mapping>> checkVersions(Map<String, Mapping> images) {
            return Result.allOf(images.entrySet()
                                      .stream()
                                      .map(entry -> catalog.versionRules()
                                                           .validate(entry.getKey(), entry.getValue()))
                                      .toList())
                         .map(checked -> images);
        }

        private Result<Map<String, ResolvedService>> resolveServices(Map<String, Mapping> builds,
                                                                     Map<String, Mapping> images) {
            log.info("Stage service-resolution: {} service(s)", builds.size());
            var index = ImageIndex.imageIndex(images, catalog);
            return ReferenceGraph.referenceGraph(DefinitionKind.SERVICE, builds, catalog.serviceTemplates(index))
                                 .resolveAll()
                                 .flatMap(resolved -> runner.run("service-images",
                                                                 concrete(resolved),
                                                                 (name, definition) -> attachImage(index, name, definition)));
        }

        private Result<ResolvedService> attachImage(ImageIndex index, String name, Mapping definition) {
            var imageName = definition.get(IMAGE)
                                      .map(ConfigValue::projection)
                                      .unwrap();
            return index.image(name, imageName)
                        .map(image -> new ResolvedService(name, definition, imageName, image));
        }

        private Result<Map<String, Mapping>> substitute(Map<String, ResolvedService> services, Map<String, String> addresses) {
            var selves = new LinkedHashMap<String, Scope.Self>();
            services.forEach((name, service) -> selves.put(name,
                                                           new Scope.Self(name,
                                                                          addresses.get(name),
                                                                          service.imageName(),
                                                                          service.image(),
                                                                          service.definition())));
            var project = new Scope.Project(config.name(), config.inet());
            var crossService = new Scope.CrossService(Map.copyOf(selves), Map.copyOf(abstractServices));
            return runner.run("substitution",
                              selves,
                              (name, self) -> Substitutor.substitutor(name,
                                                                      VariableContext.variableContext(self,
                                                                                                      project,
                                                                                                      crossService,
                                                                                                      settings.environment()))
                                                         .substituteAll(self.definition()));
        }

        private Result<Map<String, Mapping>> modifyHooks(Map<String, Mapping> definitions) {
            return runner.run("modify-hooks",
                              definitions,
                              (name, definition) -> hooks.transform(HookStage.MODIFY,
                                                                    name,
                                                                    definition,
                                                                    config.auto(),
                                                                    capabilities));
        }

        private Result<Map<String, ServicePlan>> assemble(Map<String, ResolvedService> services,
                                                          Map<String, String> addresses,
                                                          Map<String, Mapping> definitions) {
            var compiler = BehaviorCompiler.behaviorCompiler(TargetResolver.targetResolver(addresses),
                                                             settings.glueLabels());
            var renderer = ZoneFileRenderer.zoneFileRenderer(settings.clock());
            return runner.run("artifacts",
                              definitions,
                              (name, definition) -> servicePlan(compiler,
                                                                renderer,
                                                                services.get(name),
                                                                addresses.get(name),
                                                                definition));
        }

        private Result<ServicePlan> servicePlan(BehaviorCompiler compiler,
                                                ZoneFileRenderer renderer,
                                                ResolvedService service,
                                                String address,
                                                Mapping definition) {
            var name = service.name();
            return volumes(name, definition).flatMap(volumes -> {
                var includes = volumeIncludes(service, volumes);
                var behavior = definition.text(BEHAVIOR)
                                         .filter(text -> !text.isBlank());
                if (behavior.isEmpty()) {
                    return Result.success(new ServicePlan(name,
                                                          definition,
                                                          address,
                                                          service.imageName(),
                                                          service.image(),
                                                          List.of(),
                                                          ZoneRecordSet.zoneRecordSet(),
                                                          volumes,
                                                          includes));
                }
                return service.image()
                              .text(SOFTWARE)
                              .toResult(new ReferenceError.MissingSoftware(name, service.imageName(), "its behavior"))
                              .flatMap(software -> compiler.compile(name, software, behavior.unwrap()))
                              .flatMap(output -> withBehavior(renderer,
                                                              service,
                                                              address,
                                                              definition,
                                                              volumes,
                                                              includes,
                                                              output));
            });
        }

        private Result<ServicePlan> withBehavior(ZoneFileRenderer renderer,
                                                 ResolvedService service,
                                                 String address,
                                                 Mapping definition,
                                                 List<FilePlacement> volumes,
                                                 List<ServicePlan.ConfigInclude> includes,
                                                 BehaviorOutput output) {
            var name = service.name();
            var configs = configFiles(volumes);
            if (configs.isEmpty()) {
                return new BehaviorError.MissingMainConfig(name).result();
            }
            var dialect = output.dialect();
            var files = new ArrayList<>(volumes);
            output.hintFiles()
                  .forEach(file -> files.add(new FilePlacement.Generated(file)));
            output.generatedConfig()
                  .onPresent(file -> files.add(new FilePlacement.Generated(file)));
            output.zones()
                  .asMap()
                  .forEach((zone, records) -> files.add(new FilePlacement.Generated(new GeneratedFile(DnsNames.zoneFileName(zone),
                                                                                                      dialect.zoneFilePath(zone),
                                                                                                      renderer.render(zone,
                                                                                                                      records,
                                                                                                                      address)))));
            var allIncludes = new ArrayList<>(includes);
            allIncludes.add(new ServicePlan.ConfigInclude(configs.get(0),
                                                          dialect.includeTarget(dialect.generatedConfigPath()),
                                                          dialect.includeDirective(dialect.generatedConfigPath())));
            return Result.success(new ServicePlan(name,
                                                  definition,
                                                  address,
                                                  service.imageName(),
                                                  service.image(),
                                                  output.fragments(),
                                                  output.zones(),
                                                  files,
                                                  allIncludes));
        }

        // Every copied .conf after the first is pulled into the first one, for dialects that include single files.
        private List<ServicePlan.ConfigInclude> volumeIncludes(ResolvedService service,
                                                               List<FilePlacement> volumes) {
            var configs = configFiles(volumes);
            if (configs.size() < 2) {
                return List.of();
            }
            var main = configs.get(0);
            return service.image()
                          .text(SOFTWARE)
                          .flatMap(ServerDialect::dialect)
                          .filter(ServerDialect::includesSingleFiles)
                          .map(dialect -> configs.subList(1, configs.size())
                                                 .stream()
                                                 .map(path -> new ServicePlan.ConfigInclude(main,
                                                                                            path,
                                                                                            dialect.includeDirective(path)))
                                                 .toList())
                          .or(List.of());
        }

        private List<String> configFiles(List<FilePlacement> volumes) {
            return volumes.stream()
                          .filter(FilePlacement.Copied.class::isInstance)
                          .map(FilePlacement::containerPath)
                          .filter(path -> path.endsWith(CONFIG_SUFFIX))
                          .toList();
        }

        private Result<List<FilePlacement>> volumes(String name, Mapping definition) {
            var value = definition.get(VOLUMES);
            if (value.isEmpty()) {
                return Result.success(List.of());
            }
            return value.unwrap()
                        .asSequence()
                        .flatMap(ConfigValue.Sequence::texts)
                        .toResult(new PlanError.InvalidField(name, VOLUMES, "a list of '<host>:<container>' strings"))
                        .flatMap(entries -> Result.allOf(entries.stream()
                                                                .map(entry -> FilePlacement.fromVolume(name, entry))
                                                                .toList()));
        }

        private Result<Map<String, ServicePlan>> validationHooks(Map<String, ServicePlan> plans) {
            return runner.run("validation-hooks",
                              plans,
                              (name, plan) -> hooks.validate(name, plan.definition(), config.auto(), capabilities)
                                                   .map(ignored -> plan));
        }

        private BuildPlan buildPlan(Map<String, Mapping> images, Map<String, ServicePlan> plans) {
            var behaviors = new LinkedHashMap<String, String>();
            plans.forEach((name, plan) -> plan.definition()
                                              .text(BEHAVIOR)
                                              .onPresent(text -> behaviors.put(name, text)));
            return new BuildPlan(config.name(),
                                 config.inet(),
                                 config.mirror(),
                                 images,
                                 plans,
                                 TopologyMapper.map(behaviors, plans.keySet()));
        }

        private Map<String, Mapping> concrete(Map<String, Mapping> resolved) {
            var result = new LinkedHashMap<String, Mapping>();
            resolved.forEach((name, definition) -> {
                if (isAbstract(definition)) {
                    log.debug("Service '{}' is abstract, skipping", name);
                    abstractServices.put(name, definition);
                } else {
                    result.put(name, definition);
                }
            });
            return result;
        }

        private Map<String, Mapping> definitions(Map<String, ResolvedService> services) {
            var result = new LinkedHashMap<String, Mapping>();
            services.forEach((name, service) -> result.put(name, service.definition()));
            return result;
        }
    }
}
