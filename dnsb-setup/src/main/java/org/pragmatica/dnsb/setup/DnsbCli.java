package org.pragmatica.dnsb.setup;

import org.pragmatica.dnsb.compiler.CompilerSettings;
import org.pragmatica.dnsb.compiler.PlanCompiler;
import org.pragmatica.dnsb.compiler.hook.Hook;
import org.pragmatica.dnsb.compiler.hook.HookRegistry;
import org.pragmatica.dnsb.compiler.plan.BuildPlan;
import org.pragmatica.dnsb.compiler.reference.TemplateCatalog;
import org.pragmatica.dnsb.config.ConfigLoader;
import org.pragmatica.dnsb.setup.generators.ComposeGenerator;
import org.pragmatica.lang.Result;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * DNS topology builder.
 *
 * <p>Usage:
 * <pre>
 * dnsb build project.yml
 * dnsb build project.yml -o out/lab --graph
 * dnsb build project.yml --dry-run
 * </pre>
 *
 * <p>User hooks are discovered with {@link ServiceLoader} from the class path.
 */
@Command(name = "dnsb",
         mixinStandardHelpOptions = true,
         version = "dnsb 0.3.0",
         description = "Builds containerized DNS topologies from a YAML project description",
         subcommands = {DnsbCli.BuildCommand.class})
public class DnsbCli implements Runnable {
    @Spec
    private CommandSpec spec;

    public static void main(String[] args) {
        System.exit(new CommandLine(new DnsbCli()).execute(args));
    }

    @Override
    public void run() {
        spec.commandLine()
            .usage(spec.commandLine()
                       .getOut());
    }

    @Command(name = "build", description = "Compile a project and write its Docker Compose deployment")
    static class BuildCommand implements Callable<Integer> {
        @Spec
        private CommandSpec spec;

        @Parameters(index = "0", description = "Project configuration file")
        private Path config;

        @Option(names = {"-o", "--output"},
                description = "Output directory (default: <config dir>/output/<project>)")
        private Path output;

        @Option(names = "--dry-run", description = "Compile and print the plan without writing files")
        private boolean dryRun;

        @Option(names = "--graph", description = "Also write the service graph as topology.dot")
        private boolean graph;

        @Override
        public Integer call() {
            var out = spec.commandLine()
                          .getOut();
            var err = spec.commandLine()
                          .getErr();
            var workingDirectory = config.toAbsolutePath()
                                         .getParent();
            var result = ConfigLoader.load(config)
                                     .flatMap(project -> TemplateCatalog.bundled()
                                                                        .map(catalog -> PlanCompiler.planCompiler(catalog,
                                                                                                                  hookRegistry(),
                                                                                                                  CompilerSettings.compilerSettings(workingDirectory)))
                                                                        .flatMap(compiler -> compiler.compile(project)));
            if (dryRun) {
                return report(result.onSuccess(plan -> printPlan(out, plan)), err);
            }
            return report(result.flatMap(plan -> ComposeGenerator.composeGenerator(workingDirectory, graph)
                                                                 .generate(plan, outputDir(workingDirectory, plan)))
                                .onSuccess(generated -> out.println(generated.instructions())),
                          err);
        }

        private Path outputDir(Path workingDirectory, BuildPlan plan) {
            return output != null
                   ? output
                   : workingDirectory.resolve("output")
                                     .resolve(plan.project());
        }

        private static HookRegistry hookRegistry() {
            var hooks = new ArrayList<Hook>();
            ServiceLoader.load(Hook.class)
                         .forEach(hooks::add);
            return HookRegistry.hookRegistry(hooks);
        }

        private static void printPlan(PrintWriter out, BuildPlan plan) {
            out.println("Dry run - would generate artifacts for:");
            out.println("  Project: " + plan.project());
            out.println("  Network: " + plan.inet());
            plan.services()
                .values()
                .forEach(service -> out.println("  " + service.name() + " " + service.address() + " (" + service.imageName()
                                                + ")"));
            plan.topology()
                .forEach((service, targets) -> {
                             if (!targets.isEmpty()) {
                                 out.println("  " + service + " -> " + String.join(", ", targets));
                             }
                         });
        }

        private static Integer report(Result<?> result, PrintWriter err) {
            if (result.isFailure()) {
                result.onFailure(cause -> err.println("Error: " + cause.message()));
                return 1;
            }
            return 0;
        }
    }
}
