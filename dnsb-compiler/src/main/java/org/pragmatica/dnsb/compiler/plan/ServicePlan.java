package org.pragmatica.dnsb.compiler.plan;

import org.pragmatica.dnsb.compiler.behavior.ConfigFragment;
import org.pragmatica.dnsb.compiler.behavior.ZoneRecordSet;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;

import java.util.List;

/**
 * Everything the artifact writer needs for one service.
 *
 * @param name        service name
 * @param definition  final merged and substituted definition
 * @param address     allocated IPv4 address
 * @param imageName   image reference of the service
 * @param image       resolved image definition
 * @param fragments   compiled behavior configuration entries
 * @param zones       records for the zones this service is master of
 * @param files       file and volume placements
 * @param includes    directives to append to the main configuration file, in order
 */
public record ServicePlan(String name,
                          Mapping definition,
                          String address,
                          String imageName,
                          Mapping image,
                          List<ConfigFragment> fragments,
                          ZoneRecordSet zones,
                          List<FilePlacement> files,
                          List<ConfigInclude> includes) {
    public ServicePlan {
        fragments = List.copyOf(fragments);
        files = List.copyOf(files);
        includes = List.copyOf(includes);
    }

    /**
     * Text appended to the copied main configuration file at {@code containerPath}, unless that
     * file already mentions {@code target}.
     */
    public record ConfigInclude(String containerPath, String target, String directive) {
        public boolean isPresentIn(String content) {
            return content.contains(target);
        }

        public String applyTo(String content) {
            return isPresentIn(content)
                   ? content
                   : content + directive;
        }
    }
}
