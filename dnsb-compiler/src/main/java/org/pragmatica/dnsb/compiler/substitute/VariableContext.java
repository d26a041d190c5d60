package org.pragmatica.dnsb.compiler.substitute;

import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.lang.Option;

import java.util.List;

/**
 * Scopes consulted for one service, in precedence order: Self, Project, CrossService, Env.
 */
public record VariableContext(List<Scope> scopes) {
    public VariableContext {
        scopes = List.copyOf(scopes);
    }

    public static VariableContext variableContext(Scope.Self self,
                                                  Scope.Project project,
                                                  Scope.CrossService services,
                                                  Scope.Env env) {
        return new VariableContext(List.of(self, project, services, env));
    }

    /**
     * Looks up a dotted path after alias rewriting.
     */
    public Option<ConfigValue> lookup(String path) {
        var segments = AliasTable.apply(List.of(path.trim()
                                                    .split("\\.")));
        for (var scope : scopes) {
            var value = scope.lookup(segments);
            if (value.isPresent()) {
                return value;
            }
        }
        return Option.none();
    }
}
