package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.lang.Option;

import java.util.List;

/**
 * Result of compiling one service's behavior script.
 *
 * @param dialect    configuration syntax used for the fragments
 * @param fragments  configuration entries, in statement order
 * @param hintFiles  generated root-hint files
 * @param zones      records contributed by {@code master} statements
 */
public record BehaviorOutput(ServerDialect dialect,
                             List<ConfigFragment> fragments,
                             List<GeneratedFile> hintFiles,
                             ZoneRecordSet zones) {
    public BehaviorOutput {
        fragments = List.copyOf(fragments);
        hintFiles = List.copyOf(hintFiles);
    }

    /**
     * The generated configuration file, absent when no fragment was produced.
     */
    public Option<GeneratedFile> generatedConfig() {
        if (fragments.isEmpty()) {
            return Option.none();
        }
        return Option.some(new GeneratedFile(ServerDialect.GENERATED_CONFIG,
                                             dialect.generatedConfigPath(),
                                             dialect.render(fragments)));
    }
}
