package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.dnsb.compiler.net.Ipv4Subnet;
import org.pragmatica.lang.Result;
import org.pragmatica.lang.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiles behavior scripts into configuration fragments, root-hint files and zone records.
 *
 * <p>Targets naming a known service resolve to its allocated address. An NS target naming a
 * service gets a glue record: the NS record points at a generated label under the zone, and an
 * A record maps that label to the service address.
 */
public final class BehaviorCompiler {
    private static final Logger log = LoggerFactory.getLogger(BehaviorCompiler.class);

    public static final int HINT_TTL = 3600000;
    public static final String HINT_FALLBACK_NAME = "a.root-servers.net";

    private final TargetResolver resolver;
    private final GlueLabelGenerator glueLabels;

    private BehaviorCompiler(TargetResolver resolver, GlueLabelGenerator glueLabels) {
        this.resolver = resolver;
        this.glueLabels = glueLabels;
    }

    public static BehaviorCompiler behaviorCompiler(TargetResolver resolver, GlueLabelGenerator glueLabels) {
        return new BehaviorCompiler(resolver, glueLabels);
    }

    public Result<BehaviorOutput> compile(String service, String software, String behavior) {
        return ServerDialect.dialect(software)
                            .toResult(new BehaviorError.UnsupportedSoftware(service, software))
                            .flatMap(dialect -> BehaviorParser.parse(service, behavior)
                                                              .flatMap(statements -> compile(service, dialect, statements)));
    }

    public Result<BehaviorOutput> compile(String service, ServerDialect dialect, List<BehaviorStatement> statements) {
        var unit = new CompilationUnit(service, dialect);
        for (var statement : statements) {
            var compiled = unit.compile(statement);
            if (compiled.isFailure()) {
                return compiled.map(ignored -> unit.output());
            }
        }
        log.debug("Compiled {} behavior statement(s) for service '{}'", statements.size(), service);
        return Result.success(unit.output());
    }

    private final class CompilationUnit {
        private final String service;
        private final ServerDialect dialect;
        private final List<ConfigFragment> fragments = new ArrayList<>();
        private final List<GeneratedFile> hintFiles = new ArrayList<>();
        private final ZoneRecordSet zones = ZoneRecordSet.zoneRecordSet();
        private final Set<String> masterZones = new HashSet<>();

        private CompilationUnit(String service, ServerDialect dialect) {
            this.service = service;
            this.dialect = dialect;
        }

        BehaviorOutput output() {
            return new BehaviorOutput(dialect, fragments, hintFiles, zones);
        }

        Result<Unit> compile(BehaviorStatement statement) {
            return switch (statement.kind()) {
                case FORWARD -> addresses(statement).map(addresses -> add(dialect.forward(statement.zone(), addresses)));
                case STUB -> addresses(statement).map(addresses -> add(dialect.stub(statement.zone(), addresses)));
                case HINT -> hint(statement);
                case MASTER -> master(statement);
            };
        }

        private Result<Unit> hint(BehaviorStatement statement) {
            if (statement.targets()
                         .size() != 1) {
                return new BehaviorError.TargetCount(service,
                                                     statement.line(),
                                                     statement.targets()
                                                              .size()).result();
            }
            var target = statement.targets()
                                  .get(0);
            return address(statement, target).map(address -> {
                                                      var name = DnsNames.isIpLiteral(target)
                                                                 ? HINT_FALLBACK_NAME
                                                                 : target;
                                                      var path = dialect.hintPath(service);
                                                      var content = ".\t" + HINT_TTL + "\tIN\tNS\t" + DnsNames.fqdn(name) + "\n"
                                                                    + DnsNames.fqdn(name) + "\t" + HINT_TTL + "\tIN\tA\t" + address
                                                                    + "\n";
                                                      hintFiles.add(new GeneratedFile(fileName(path), path, content));
                                                      return add(dialect.hint(statement.zone(), path));
                                                  });
        }

        private Result<Unit> master(BehaviorStatement statement) {
            var zone = statement.zone();
            var type = statement.rtype()
                                .unwrap();
            var rname = DnsNames.normalize(statement.rname()
                                                    .unwrap(),
                                           zone);
            var ttl = statement.ttl();
            Result<List<ZoneRecord>> records = switch (type) {
                case A -> ipv4(statement).map(addresses -> addresses.stream()
                                                                         .map(address -> ZoneRecord.zoneRecord(rname,
                                                                                                               type,
                                                                                                               ttl,
                                                                                                               address))
                                                                         .toList());
                case AAAA -> ipv6(statement).map(addresses -> addresses.stream()
                                                                       .map(address -> ZoneRecord.zoneRecord(rname,
                                                                                                             type,
                                                                                                             ttl,
                                                                                                             address))
                                                                       .toList());
                case NS -> Result.success(nameServers(statement, rname));
                case CNAME, PTR -> Result.success(statement.targets()
                                                           .stream()
                                                           .map(target -> ZoneRecord.zoneRecord(rname,
                                                                                                type,
                                                                                                ttl,
                                                                                                DnsNames.normalize(target, zone)))
                                                           .toList());
                case TXT -> Result.success(List.of(ZoneRecord.zoneRecord(rname, type, ttl, text(statement))));
            };
            return records.map(compiled -> {
                                   compiled.forEach(record -> zones.add(zone, record));
                                   if (masterZones.add(DnsNames.zoneKey(zone))) {
                                       fragments.add(dialect.master(DnsNames.zoneKey(zone), dialect.zoneFilePath(zone)));
                                   }
                                   return Unit.unit();
                               });
        }

        private List<ZoneRecord> nameServers(BehaviorStatement statement, String rname) {
            var zone = statement.zone();
            var records = new ArrayList<ZoneRecord>();
            for (var target : statement.targets()) {
                var address = resolver.address(target);
                if (address.isPresent()) {
                    var label = DnsNames.normalize(glueLabels.label(target, zone), zone);
                    records.add(ZoneRecord.zoneRecord(rname, RecordType.NS, statement.ttl(), label));
                    records.add(ZoneRecord.zoneRecord(label, RecordType.A, statement.ttl(), address.unwrap()));
                    log.debug("Service '{}': glue {} -> {} for NS target '{}'", service, label, address.unwrap(), target);
                } else {
                    records.add(ZoneRecord.zoneRecord(rname,
                                                      RecordType.NS,
                                                      statement.ttl(),
                                                      DnsNames.normalize(target, zone)));
                }
            }
            return records;
        }

        private String text(BehaviorStatement statement) {
            return statement.targets()
                            .stream()
                            .map(target -> DnsNames.normalize(target, statement.zone()))
                            .map(value -> "\"" + value.replace("\"", "\\\"") + "\"")
                            .collect(Collectors.joining(" "));
        }

        private Result<List<String>> addresses(BehaviorStatement statement) {
            return Result.allOf(statement.targets()
                                         .stream()
                                         .map(target -> address(statement, target))
                                         .toList());
        }

        private Result<String> address(BehaviorStatement statement, String target) {
            if (Ipv4Subnet.isAddress(target) || DnsNames.IPV6_LITERAL.matcher(target)
                                                                    .matches()) {
                return Result.success(target);
            }
            return resolver.address(target)
                           .toResult(new BehaviorError.UnresolvableTarget(service, statement.line(), target));
        }

        private Result<List<String>> ipv4(BehaviorStatement statement) {
            return Result.allOf(statement.targets()
                                         .stream()
                                         .map(target -> DnsNames.IPV6_LITERAL.matcher(target)
                                                                             .matches()
                                                        ? new BehaviorError.UnresolvableTarget(service,
                                                                                               statement.line(),
                                                                                               target).<String>result()
                                                        : address(statement, target))
                                         .toList());
        }

        private Result<List<String>> ipv6(BehaviorStatement statement) {
            return Result.allOf(statement.targets()
                                         .stream()
                                         .map(target -> DnsNames.IPV6_LITERAL.matcher(target)
                                                                             .matches()
                                                        ? Result.success(target)
                                                        : new BehaviorError.UnresolvableTarget(service,
                                                                                               statement.line(),
                                                                                               target).<String>result())
                                         .toList());
        }

        private Unit add(ConfigFragment fragment) {
            fragments.add(fragment);
            return Unit.unit();
        }

        private String fileName(String path) {
            return path.substring(path.lastIndexOf('/') + 1);
        }
    }
}
