package org.pragmatica.dnsb.compiler.substitute;

import org.pragmatica.dnsb.config.ConfigValue;
import org.pragmatica.dnsb.config.ConfigValue.Mapping;
import org.pragmatica.lang.Functions.Fn1;
import org.pragmatica.lang.Option;

import java.util.List;
import java.util.Map;

/**
 * One source of placeholder values. Each scope answers the dotted paths it owns and nothing else.
 */
public sealed interface Scope {
    String SERVICES = "services";
    String PROJECT = "project";
    String ENV = "env";
    String IMAGE = "image";
    String IP = "ip";
    String ADDRESS = "address";
    String NAME = "name";

    Option<ConfigValue> lookup(List<String> segments);

    /**
     * The service being substituted: its name, allocated address, image and own fields.
     */
    record Self(String name, String address, String imageName, Mapping image, Mapping definition) implements Scope {
        @Override
        public Option<ConfigValue> lookup(List<String> segments) {
            var head = segments.get(0);
            if (segments.size() == 1) {
                switch (head) {
                    case NAME -> {
                        return Option.some(ConfigValue.text(name));
                    }
                    case IP, ADDRESS -> {
                        return Option.some(ConfigValue.text(address));
                    }
                    case IMAGE -> {
                        return Option.some(ConfigValue.text(imageName));
                    }
                    default -> {
                        return definition.get(head);
                    }
                }
            }
            if (IMAGE.equals(head)) {
                var rest = segments.subList(1, segments.size());
                if (rest.size() == 1 && NAME.equals(rest.get(0))) {
                    return Option.some(ConfigValue.text(imageName));
                }
                return walk(image, rest);
            }
            return walk(definition, segments);
        }
    }

    /**
     * Project-wide values under {@code project.*}.
     */
    record Project(String name, String inet) implements Scope {
        @Override
        public Option<ConfigValue> lookup(List<String> segments) {
            if (segments.size() != 2 || !PROJECT.equals(segments.get(0))) {
                return Option.none();
            }
            return switch (segments.get(1)) {
                case NAME -> Option.some(ConfigValue.text(name));
                case "inet", "subnet" -> Option.some(ConfigValue.text(inet));
                default -> Option.none();
            };
        }
    }

    /**
     * Read-only view of every other service under {@code services.<name>.*}. Abstract services
     * ({@code build: false}) have no address or image; only their resolved fields and name are
     * visible.
     */
    record CrossService(Map<String, Self> services, Map<String, Mapping> templates) implements Scope {
        public CrossService(Map<String, Self> services) {
            this(services, Map.of());
        }

        @Override
        public Option<ConfigValue> lookup(List<String> segments) {
            if (segments.size() < 3 || !SERVICES.equals(segments.get(0))) {
                return Option.none();
            }
            var name = segments.get(1);
            var rest = segments.subList(2, segments.size());
            return Option.option(services.get(name))
                         .map(service -> service.lookup(rest))
                         .or(() -> Option.option(templates.get(name))
                                         .flatMap(template -> templateLookup(name, template, rest)));
        }

        private static Option<ConfigValue> templateLookup(String name, Mapping template, List<String> rest) {
            if (rest.size() == 1 && NAME.equals(rest.get(0))) {
                return Option.some(ConfigValue.text(name));
            }
            return walk(template, rest);
        }
    }

    /**
     * Process environment under {@code env.<NAME>}.
     */
    record Env(Fn1<Option<String>, String> environment) implements Scope {
        public static Env system() {
            return new Env(name -> Option.option(System.getenv(name)));
        }

        @Override
        public Option<ConfigValue> lookup(List<String> segments) {
            if (segments.size() < 2 || !ENV.equals(segments.get(0))) {
                return Option.none();
            }
            return environment.apply(String.join(".", segments.subList(1, segments.size())))
                              .map(ConfigValue::text);
        }
    }

    private static Option<ConfigValue> walk(Mapping root, List<String> segments) {
        ConfigValue current = root;
        for (var segment : segments) {
            var mapping = current.asMapping();
            if (mapping.isEmpty()) {
                return Option.none();
            }
            var next = mapping.unwrap()
                              .get(segment);
            if (next.isEmpty()) {
                return Option.none();
            }
            current = next.unwrap();
        }
        return Option.some(current);
    }
}
