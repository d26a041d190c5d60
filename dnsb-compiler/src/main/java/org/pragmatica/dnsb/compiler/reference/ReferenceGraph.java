package org.pragmatica.dnsb.compiler.reference;

import org.pragmatica.dnsb.config.ConfigMerge;
import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves {@code ref} and {@code mixins} chains within one collection of definitions.
 *
 * <p>Edges point from a definition to the siblings it references. Built-in templates (any reference
 * containing ':') are leaves supplied by a {@link TemplateLookup}. The walk is an iterative
 * depth-first search with per-node colors kept in this object, so deep chains do not consume the
 * call stack and cycles are reported with their full path.
 *
 * <p>Resolution of a node: the referenced definition is the base, each mixin is merged on top in
 * declaration order, and the node's own fields (without {@code ref} and {@code mixins}) are merged
 * last. Results are memoized for the lifetime of the graph, which is one compile run.
 */
public final class ReferenceGraph {
    private static final Logger log = LoggerFactory.getLogger(ReferenceGraph.class);

    public static final String REF = "ref";
    public static final String MIXINS = "mixins";
    public static final String BUILD = "build";

    /**
     * Source of built-in templates referenced with a ':'-qualified name.
     */
    @FunctionalInterface
    public interface TemplateLookup {
        Result<Mapping> template(String owner, String reference, Mapping ownDefinition);
    }

    private enum Color {
        UNVISITED,
        IN_PROGRESS,
        DONE
    }

    private final DefinitionKind kind;
    private final Map<String, Mapping> definitions;
    private final TemplateLookup templates;
    private final Map<String, Color> colors = new HashMap<>();
    private final Map<String, Mapping> resolved = new HashMap<>();

    private ReferenceGraph(DefinitionKind kind, Map<String, Mapping> definitions, TemplateLookup templates) {
        this.kind = kind;
        this.definitions = new LinkedHashMap<>(definitions);
        this.templates = templates;
        definitions.keySet()
                   .forEach(name -> colors.put(name, Color.UNVISITED));
    }

    public static ReferenceGraph referenceGraph(DefinitionKind kind,
                                                Map<String, Mapping> definitions,
                                                TemplateLookup templates) {
        return new ReferenceGraph(kind, definitions, templates);
    }

    /**
     * Resolves every definition, preserving declaration order.
     */
    public Result<Map<String, Mapping>> resolveAll() {
        for (var name : definitions.keySet()) {
            var result = resolve(name);
            if (result.isFailure()) {
                return result.map(ignored -> Map.of());
            }
        }
        var ordered = new LinkedHashMap<String, Mapping>();
        definitions.keySet()
                   .forEach(name -> ordered.put(name, resolved.get(name)));
        return Result.success(ordered);
    }

    public Result<Mapping> resolve(String name) {
        if (!definitions.containsKey(name)) {
            return new ReferenceError.InvalidDefinition(kind, name, "no such " + kind.displayName()).result();
        }
        if (colors.get(name) == Color.DONE) {
            return Result.success(resolved.get(name));
        }
        return walk(name);
    }

    private Result<Mapping> walk(String root) {
        var stack = new ArrayDeque<Frame>();
        var path = new ArrayList<String>();
        var rootFrame = enter(root, path);
        if (rootFrame.isFailure()) {
            return rootFrame.map(ignored -> Mapping.EMPTY);
        }
        stack.push(rootFrame.unwrap());
        while (!stack.isEmpty()) {
            var step = advance(stack, path);
            if (step.isFailure()) {
                resetInProgress(path);
                return step.map(ignored -> Mapping.EMPTY);
            }
        }
        return Result.success(resolved.get(root));
    }

    private Result<Boolean> advance(Deque<Frame> stack, List<String> path) {
        var frame = stack.peek();
        if (frame.hasNext()) {
            var dependency = frame.next();
            if (!definitions.containsKey(dependency)) {
                return new ReferenceError.UnknownReference(kind, frame.name, dependency).result();
            }
            switch (colors.get(dependency)) {
                case DONE -> {
                    return Result.success(true);
                }
                case IN_PROGRESS -> {
                    var cycle = new ArrayList<>(path.subList(path.indexOf(dependency), path.size()));
                    cycle.add(dependency);
                    return ReferenceError.cycleDetected(kind, cycle)
                                         .result();
                }
                default -> {
                    return enter(dependency, path).onSuccess(stack::push)
                                                  .map(ignored -> true);
                }
            }
        }
        return merge(frame.name).onSuccess(result -> complete(frame.name, result, stack, path))
                                .map(ignored -> true);
    }

    private Result<Frame> enter(String name, List<String> path) {
        return siblingDependencies(name).map(dependencies -> {
                                                 colors.put(name, Color.IN_PROGRESS);
                                                 path.add(name);
                                                 return new Frame(name, dependencies);
                                             });
    }

    private void complete(String name, Mapping result, Deque<Frame> stack, List<String> path) {
        resolved.put(name, result);
        colors.put(name, Color.DONE);
        stack.pop();
        path.remove(path.size() - 1);
        log.debug("Resolved {} '{}'", kind.displayName(), name);
    }

    private void resetInProgress(List<String> path) {
        path.forEach(name -> colors.put(name, Color.UNVISITED));
    }

    private Result<List<String>> siblingDependencies(String name) {
        var definition = definitions.get(name);
        return mixins(name, definition).map(mixins -> {
                                                var dependencies = new ArrayList<String>();
                                                definition.text(REF)
                                                          .filter(ReferenceGraph::isSibling)
                                                          .onPresent(dependencies::add);
                                                mixins.stream()
                                                      .filter(ReferenceGraph::isSibling)
                                                      .forEach(dependencies::add);
                                                return dependencies;
                                            });
    }

    private Result<Mapping> merge(String name) {
        var definition = definitions.get(name);
        var base = definition.text(REF)
                             .map(reference -> lookup(name, reference, definition))
                             .or(Result.success(Mapping.EMPTY))
                             .map(parent -> parent.without(BUILD));
        return mixins(name, definition).flatMap(mixins -> applyMixins(name, definition, base, mixins))
                                       .map(running -> ConfigMerge.mergeMappings(running,
                                                                                 definition.without(REF)
                                                                                           .without(MIXINS)));
    }

    private Result<Mapping> applyMixins(String name, Mapping definition, Result<Mapping> base, List<String> mixins) {
        var running = base;
        for (var mixin : mixins) {
            running = running.flatMap(current -> lookup(name, mixin, definition).map(layer -> ConfigMerge.mergeMappings(current,
                                                                                                                       layer.without(BUILD))));
        }
        return running;
    }

    private Result<Mapping> lookup(String owner, String reference, Mapping definition) {
        if (isSibling(reference)) {
            return Result.success(resolved.get(reference));
        }
        return templates.template(owner, reference, definition);
    }

    private Result<List<String>> mixins(String name, Mapping definition) {
        var value = definition.get(MIXINS);
        if (value.isEmpty()) {
            return Result.success(List.of());
        }
        return value.unwrap()
                    .asSequence()
                    .flatMap(ConfigValue.Sequence::texts)
                    .toResult(new ReferenceError.InvalidDefinition(kind, name, "'mixins' must be a list of template names"));
    }

    private static boolean isSibling(String reference) {
        return !reference.contains(":");
    }

    private static final class Frame {
        private final String name;
        private final List<String> dependencies;
        private int position;

        private Frame(String name, List<String> dependencies) {
            this.name = name;
            this.dependencies = dependencies;
        }

        boolean hasNext() {
            return position < dependencies.size();
        }

        String next() {
            return dependencies.get(position++);
        }
    }
}
