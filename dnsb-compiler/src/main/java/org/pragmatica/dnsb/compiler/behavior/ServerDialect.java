package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.lang.Option;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Configuration syntax of one DNS server software.
 */
public sealed interface ServerDialect {
    String GENERATED_CONFIG = "generated_zones.conf";
    String GENERATED_HEADER = "# Auto-generated by dnsb\n\n";

    String software();

    /**
     * Container directory holding generated hint files and zone files.
     */
    String zoneDirectory();

    ConfigFragment forward(String zone, List<String> addresses);

    ConfigFragment stub(String zone, List<String> addresses);

    ConfigFragment hint(String zone, String hintPath);

    ConfigFragment master(String zone, String zoneFilePath);

    /**
     * Text appended to the main configuration file so that it loads {@code path}.
     */
    String includeDirective(String path);

    /**
     * Path whose presence in the main configuration file means {@code path} is already loaded.
     */
    default String includeTarget(String path) {
        return path;
    }

    /**
     * Whether single extra configuration files can be included from the main one.
     */
    default boolean includesSingleFiles() {
        return true;
    }

    default String generatedConfigPath() {
        return zoneDirectory() + "/" + GENERATED_CONFIG;
    }

    default String hintPath(String service) {
        return zoneDirectory() + "/gen_" + service + "_root.hints";
    }

    default String zoneFilePath(String zone) {
        return zoneDirectory() + "/" + DnsNames.zoneFileName(zone);
    }

    /**
     * Content of the generated configuration file.
     */
    default String render(List<ConfigFragment> fragments) {
        return GENERATED_HEADER + fragments.stream()
                                           .map(ConfigFragment::text)
                                           .collect(Collectors.joining("\n")) + "\n";
    }

    static Option<ServerDialect> dialect(String software) {
        return switch (software.toLowerCase()) {
            case Bind.SOFTWARE -> Option.some(new Bind());
            case Unbound.SOFTWARE -> Option.some(new Unbound());
            case PdnsRecursor.SOFTWARE, "pdns_recursor", "powerdns-recursor" -> Option.some(new PdnsRecursor());
            default -> Option.none();
        };
    }

    record Bind() implements ServerDialect {
        public static final String SOFTWARE = "bind";

        @Override
        public String software() {
            return SOFTWARE;
        }

        @Override
        public String zoneDirectory() {
            return "/usr/local/etc/zones";
        }

        @Override
        public ConfigFragment forward(String zone, List<String> addresses) {
            return ConfigFragment.topLevel("zone \"" + zone + "\" { type forward; forwarders { " + addressList(addresses)
                                           + " }; };");
        }

        @Override
        public ConfigFragment stub(String zone, List<String> addresses) {
            return ConfigFragment.topLevel("zone \"" + zone + "\" { type stub; masters { " + addressList(addresses)
                                           + " }; };");
        }

        @Override
        public ConfigFragment hint(String zone, String hintPath) {
            return ConfigFragment.topLevel("zone \"" + zone + "\" { type hint; file \"" + hintPath + "\"; };");
        }

        @Override
        public ConfigFragment master(String zone, String zoneFilePath) {
            return ConfigFragment.topLevel("zone \"" + zone + "\" { type master; file \"" + zoneFilePath + "\"; };");
        }

        @Override
        public String includeDirective(String path) {
            return "\n# Auto-include by dnsb\ninclude \"" + path + "\";\n";
        }

        private static String addressList(List<String> addresses) {
            return addresses.stream()
                            .map(address -> address + ";")
                            .collect(Collectors.joining(" "));
        }
    }

    /**
     * Server-section entries are grouped under one {@code server:} header, each line indented.
     */
    record Unbound() implements ServerDialect {
        public static final String SOFTWARE = "unbound";

        @Override
        public String software() {
            return SOFTWARE;
        }

        @Override
        public String zoneDirectory() {
            return "/usr/local/etc/unbound/zones";
        }

        @Override
        public ConfigFragment forward(String zone, List<String> addresses) {
            return ConfigFragment.topLevel("forward-zone:\n\tname: \"" + zone + "\"\n\t" + addresses.stream()
                                                                                                  .map(address -> "forward-addr: "
                                                                                                                  + address)
                                                                                                  .collect(Collectors.joining("\n\t")));
        }

        @Override
        public ConfigFragment stub(String zone, List<String> addresses) {
            return ConfigFragment.topLevel("stub-zone:\n\tname: \"" + zone + "\"\n\t" + addresses.stream()
                                                                                               .map(address -> "stub-addr: "
                                                                                                               + address)
                                                                                               .collect(Collectors.joining("\n\t")));
        }

        @Override
        public ConfigFragment hint(String zone, String hintPath) {
            return ConfigFragment.server("root-hints: \"" + hintPath + "\"");
        }

        @Override
        public ConfigFragment master(String zone, String zoneFilePath) {
            return ConfigFragment.topLevel("auth-zone:\n\tname: \"" + zone + "\"\n\tzonefile: \"" + zoneFilePath + "\"");
        }

        @Override
        public String includeDirective(String path) {
            return "\n# Auto-include by dnsb\ninclude: \"" + path + "\"\n";
        }

        @Override
        public String render(List<ConfigFragment> fragments) {
            var content = new StringBuilder(GENERATED_HEADER);
            var server = fragments.stream()
                                  .filter(fragment -> fragment.section() == ConfigFragment.Section.SERVER)
                                  .toList();
            if (!server.isEmpty()) {
                content.append("server:\n");
                server.forEach(fragment -> content.append("\t")
                                                  .append(fragment.text()
                                                                  .replace("\n", "\n\t"))
                                                  .append("\n"));
            }
            var topLevel = fragments.stream()
                                    .filter(fragment -> fragment.section() == ConfigFragment.Section.TOPLEVEL)
                                    .map(ConfigFragment::text)
                                    .collect(Collectors.joining("\n\n"));
            if (!topLevel.isEmpty()) {
                content.append("\n")
                       .append(topLevel)
                       .append("\n");
            }
            return content.toString();
        }
    }

    /**
     * PowerDNS Recursor has no single-file include and no native stub zone: the generated file goes
     * to an include directory, and stubs are forward zones.
     */
    record PdnsRecursor() implements ServerDialect {
        public static final String SOFTWARE = "pdns-recursor";

        @Override
        public String software() {
            return SOFTWARE;
        }

        @Override
        public String zoneDirectory() {
            return "/usr/local/etc/zones";
        }

        @Override
        public String generatedConfigPath() {
            return includeDirectory() + "/" + GENERATED_CONFIG;
        }

        @Override
        public ConfigFragment forward(String zone, List<String> addresses) {
            return ConfigFragment.topLevel("forward-zones+=" + zone + "=" + String.join(";", addresses));
        }

        @Override
        public ConfigFragment stub(String zone, List<String> addresses) {
            return forward(zone, addresses);
        }

        @Override
        public ConfigFragment hint(String zone, String hintPath) {
            return ConfigFragment.topLevel("hint-file=" + hintPath);
        }

        @Override
        public ConfigFragment master(String zone, String zoneFilePath) {
            return ConfigFragment.topLevel("auth-zones+=" + zone + "=" + zoneFilePath);
        }

        @Override
        public String includeDirective(String path) {
            return "\n# Auto-include by dnsb\ninclude-dir=" + includeDirectory() + "\n";
        }

        @Override
        public String includeTarget(String path) {
            return includeDirectory();
        }

        @Override
        public boolean includesSingleFiles() {
            return false;
        }

        private String includeDirectory() {
            return zoneDirectory() + "/recursor.d";
        }
    }
}
