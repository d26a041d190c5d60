package org.pragmatica.dnsb.compiler.hook;

import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;
import org.pragmatica.lang.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Registered hooks and the rules selecting them for a service.
 *
 * <p>Hooks named in the project {@code auto} mapping apply to every service, followed by those in
 * the service's own {@code auto} mapping. {@link RequiredValuesHook} always runs first at
 * {@link HookStage#VALIDATE}.
 */
public final class HookRegistry {
    private static final Logger log = LoggerFactory.getLogger(HookRegistry.class);

    public static final String AUTO = "auto";

    private final Map<String, Hook> hooks;

    private HookRegistry(Map<String, Hook> hooks) {
        this.hooks = hooks;
    }

    public static HookRegistry hookRegistry(List<? extends Hook> hooks) {
        var registered = new LinkedHashMap<String, Hook>();
        var builtIn = new RequiredValuesHook();
        registered.put(builtIn.name(), builtIn);
        hooks.forEach(hook -> registered.put(hook.name(), hook));
        return new HookRegistry(registered);
    }

    public static HookRegistry hookRegistry() {
        return hookRegistry(List.of());
    }

    public Result<List<Hook>> hooksFor(HookStage stage, String service, Mapping projectAuto, Mapping serviceAuto) {
        var names = new LinkedHashSet<String>();
        if (stage == HookStage.VALIDATE) {
            names.add(RequiredValuesHook.NAME);
        }
        return Result.all(hookNames(stage, "project", projectAuto),
                          hookNames(stage, "service '" + service + "'", serviceAuto))
                     .flatMap((fromProject, fromService) -> {
                                  names.addAll(fromProject);
                                  names.addAll(fromService);
                                  return Result.allOf(names.stream()
                                                           .map(name -> lookup(stage, service, name))
                                                           .toList());
                              });
    }

    /**
     * Runs the {@code SETUP} or {@code MODIFY} hooks of a service in order, each receiving the
     * previous hook's output.
     */
    public Result<Mapping> transform(HookStage stage,
                                     String service,
                                     Mapping subtree,
                                     Mapping projectAuto,
                                     HookCapabilities capabilities) {
        return hooksFor(stage, service, projectAuto, autoSection(subtree)).flatMap(selected -> {
            var current = Result.success(subtree);
            for (var hook : selected) {
                current = current.flatMap(input -> invokeTransform(hook, stage, service, input, capabilities));
            }
            return current;
        });
    }

    /**
     * Runs the {@code VALIDATE} hooks of a service; the first rejection fails the run.
     */
    public Result<Unit> validate(String service, Mapping subtree, Mapping projectAuto, HookCapabilities capabilities) {
        return hooksFor(HookStage.VALIDATE, service, projectAuto, autoSection(subtree)).flatMap(selected -> {
            for (var hook : selected) {
                var verdict = invokeValidate(hook, service, subtree, capabilities);
                if (verdict.isFailure()) {
                    return verdict.map(ignored -> Unit.unit());
                }
                if (verdict.unwrap() instanceof HookVerdict.Rejected rejected) {
                    return new HookError.Rejected(hook.name(), service, rejected.reasons()).result();
                }
            }
            return Result.success(Unit.unit());
        });
    }

    private Result<Mapping> invokeTransform(Hook hook,
                                            HookStage stage,
                                            String service,
                                            Mapping input,
                                            HookCapabilities capabilities) {
        log.debug("Running {} hook '{}' for service '{}'", stage.key(), hook.name(), service);
        return Result.lift(e -> new HookError.Failed(hook.name(), stage, service, String.valueOf(e.getMessage())),
                           () -> hook.transform(stage, service, input, capabilities))
                     .flatMap(result -> result)
                     .mapError(cause -> cause instanceof HookError
                                        ? cause
                                        : new HookError.Failed(hook.name(), stage, service, cause.message()));
    }

    private Result<HookVerdict> invokeValidate(Hook hook, String service, Mapping input, HookCapabilities capabilities) {
        log.debug("Running validate hook '{}' for service '{}'", hook.name(), service);
        return Result.lift(e -> new HookError.Failed(hook.name(), HookStage.VALIDATE, service, String.valueOf(e.getMessage())),
                           () -> hook.validate(service, input, capabilities))
                     .flatMap(result -> result)
                     .mapError(cause -> cause instanceof HookError
                                        ? cause
                                        : new HookError.Failed(hook.name(), HookStage.VALIDATE, service, cause.message()));
    }

    private Result<Hook> lookup(HookStage stage, String service, String name) {
        var hook = hooks.get(name);
        if (hook == null) {
            return new HookError.UnknownHook(service, stage, name).result();
        }
        return Result.success(hook);
    }

    private static Mapping autoSection(Mapping subtree) {
        return subtree.mapping(AUTO)
                      .or(Mapping.EMPTY);
    }

    private static Result<List<String>> hookNames(HookStage stage, String owner, Mapping auto) {
        var value = auto.get(stage.key());
        if (value.isEmpty()) {
            return Result.success(List.of());
        }
        var names = value.unwrap();
        if (names instanceof ConfigValue.Scalar scalar && scalar.isText()) {
            return Result.success(List.of((String) scalar.value()));
        }
        return names.asSequence()
                    .flatMap(ConfigValue.Sequence::texts)
                    .toResult(new HookError.InvalidAutoSection(owner, "'" + stage.key() + "' must be a hook name or a list of hook names"));
    }
}
