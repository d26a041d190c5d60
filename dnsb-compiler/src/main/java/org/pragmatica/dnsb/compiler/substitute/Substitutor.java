package org.pragmatica.dnsb.compiler.substitute;

import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.dnsb.config.ConfigValue.Scalar;
import org.pragmatica.dnsb.config.ConfigValue.Sequence;
import org.pragmatica.lang.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.Matcher;

import static org.pragmatica.dnsb.compiler.substitute.Placeholders.PLACEHOLDER;
import static org.pragmatica.dnsb.compiler.substitute.Placeholders.UNRESOLVED;

/**
 * Resolves {@code ${path}} and {@code ${path:default}} placeholders in the string fields of one
 * service definition.
 *
 * <p>Each pass replaces every innermost placeholder, then the text is scanned again, up to
 * {@link #MAX_PASSES} passes. Reserved markers are left in place. An unresolvable path without a
 * default becomes {@link Placeholders#UNRESOLVED} and is reported as a warning; a path resolving
 * to a mapping or list fails the substitution.
 *
 * <p>Instances are confined to a single service and thread.
 */
public final class Substitutor {
    private static final Logger log = LoggerFactory.getLogger(Substitutor.class);

    public static final int MAX_PASSES = 10;

    private final String service;
    private final VariableContext context;
    private final List<String> warnings = new ArrayList<>();

    private Substitutor(String service, VariableContext context) {
        this.service = service;
        this.context = context;
    }

    public static Substitutor substitutor(String service, VariableContext context) {
        return new Substitutor(service, context);
    }

    public Result<Mapping> substituteAll(Mapping definition) {
        return substituteValue(definition).map(Mapping.class::cast);
    }

    public Result<String> substitute(String text) {
        var current = text;
        for (int pass = 0; pass < MAX_PASSES; pass++) {
            var next = substitutePass(current);
            if (next.isFailure()) {
                return next;
            }
            var replaced = next.unwrap();
            if (replaced.equals(current)) {
                return Result.success(replaced);
            }
            current = replaced;
        }
        if (hasResolvablePlaceholder(current)) {
            warn("Placeholder expansion in service '" + service + "' did not settle after " + MAX_PASSES
                 + " passes, leaving '" + current + "' as is");
        }
        return Result.success(current);
    }

    /**
     * Warnings produced so far, in order.
     */
    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    private Result<ConfigValue> substituteValue(ConfigValue value) {
        if (value instanceof Mapping mapping) {
            var entries = new LinkedHashMap<String, ConfigValue>();
            for (var entry : mapping.entries()
                                    .entrySet()) {
                var substituted = substituteValue(entry.getValue());
                if (substituted.isFailure()) {
                    return substituted;
                }
                entries.put(entry.getKey(), substituted.unwrap());
            }
            return Result.success(new Mapping(entries));
        }
        if (value instanceof Sequence sequence) {
            return Result.allOf(sequence.items()
                                        .stream()
                                        .map(this::substituteValue)
                                        .toList())
                         .map(Sequence::new);
        }
        if (value instanceof Scalar scalar && scalar.isText()) {
            return substitute((String) scalar.value()).map(ConfigValue::text);
        }
        return Result.success(value);
    }

    private Result<String> substitutePass(String text) {
        var matcher = PLACEHOLDER.matcher(text);
        var output = new StringBuilder();
        while (matcher.find()) {
            var expression = matcher.group(1);
            if (Placeholders.isReserved(expression)) {
                matcher.appendReplacement(output, Matcher.quoteReplacement(matcher.group()));
                continue;
            }
            var resolved = resolve(expression);
            if (resolved.isFailure()) {
                return resolved;
            }
            matcher.appendReplacement(output, Matcher.quoteReplacement(resolved.unwrap()));
        }
        matcher.appendTail(output);
        return Result.success(output.toString());
    }

    private Result<String> resolve(String expression) {
        var separator = expression.indexOf(':');
        var path = separator < 0
                   ? expression
                   : expression.substring(0, separator);
        var value = context.lookup(path);
        if (value.isPresent()) {
            return scalarText(expression, value.unwrap());
        }
        if (separator >= 0) {
            return Result.success(expression.substring(separator + 1));
        }
        warn("Cannot resolve '${" + expression + "}' in service '" + service + "', using '" + UNRESOLVED + "'");
        return Result.success(UNRESOLVED);
    }

    private Result<String> scalarText(String expression, ConfigValue value) {
        if (value instanceof Scalar scalar) {
            return Result.success(scalar.isNull()
                                  ? ""
                                  : scalar.projection());
        }
        var kind = value.isMapping()
                   ? "mapping"
                   : "list";
        return new SubstitutionError.NonScalar(service, expression, kind).result();
    }

    private static boolean hasResolvablePlaceholder(String text) {
        var matcher = PLACEHOLDER.matcher(text);
        while (matcher.find()) {
            if (!Placeholders.isReserved(matcher.group(1))) {
                return true;
            }
        }
        return false;
    }

    private void warn(String message) {
        warnings.add(message);
        log.warn(message);
    }
}
