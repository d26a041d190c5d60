package org.pragmatica.dnsb.compiler.hook;

import org.pragmatica.dnsb.compiler.substitute.Placeholders;
import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Result;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rejects definitions that still carry the required marker anywhere, or the unresolved sentinel
 * in a field that needs a real value.
 */
public final class RequiredValuesHook implements Hook {
    public static final String NAME = "required-values";
    public static final Set<String> REAL_VALUE_FIELDS = Set.of("image", "address", "hostname");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Result<HookVerdict> validate(String service, Mapping subtree, HookCapabilities capabilities) {
        var reasons = new ArrayList<String>();
        scan("", subtree, reasons);
        REAL_VALUE_FIELDS.stream()
                         .sorted()
                         .forEach(field -> subtree.text(field)
                                                  .filter(Placeholders.UNRESOLVED::equals)
                                                  .onPresent(value -> reasons.add("'" + field
                                                                                  + "' refers to a variable that could not be resolved")));
        return Result.success(HookVerdict.reject(reasons));
    }

    private static void scan(String path, ConfigValue value, List<String> reasons) {
        if (value instanceof Mapping mapping) {
            mapping.entries()
                   .forEach((key, child) -> scan(path.isEmpty()
                                                 ? key
                                                 : path + "." + key,
                                                 child,
                                                 reasons));
        } else if (value instanceof ConfigValue.Sequence sequence) {
            for (int i = 0; i < sequence.size(); i++) {
                scan(path + "[" + i + "]",
                     sequence.items()
                             .get(i),
                     reasons);
            }
        } else if (value instanceof ConfigValue.Scalar scalar && scalar.isText() && Placeholders.isRequired((String) scalar.value())) {
            reasons.add("'" + path + "' is required but was never set");
        }
    }
}
