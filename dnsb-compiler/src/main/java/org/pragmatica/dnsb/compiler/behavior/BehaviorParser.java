package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.lang.Result;
import org.pragmatica.lang.parse.Number;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses behavior scripts.
 *
 * <pre>
 * &lt;zone&gt; forward|hint|stub &lt;target&gt;[,&lt;target&gt;...]
 * &lt;zone&gt; master &lt;rname&gt; &lt;rtype&gt; [&lt;ttl&gt;] &lt;target&gt;[,&lt;target&gt;...]
 * </pre>
 * Blank lines and lines starting with '#' are skipped.
 */
public final class BehaviorParser {
    private static final String GENERIC_FORM = "<zone> <kind> <target>[,<target>...]";
    private static final String MASTER_FORM = "<zone> master <rname> <rtype> [<ttl>] <target>[,<target>...]";

    private BehaviorParser() {}

    public static Result<List<BehaviorStatement>> parse(String service, String behavior) {
        var statements = new ArrayList<BehaviorStatement>();
        var lines = behavior.split("\\R");
        for (int index = 0; index < lines.length; index++) {
            var text = lines[index].trim();
            if (text.isEmpty() || text.startsWith("#")) {
                continue;
            }
            var statement = parseLine(service, index + 1, text);
            if (statement.isFailure()) {
                return statement.map(List::of);
            }
            statements.add(statement.unwrap());
        }
        return Result.success(statements);
    }

    public static Result<BehaviorStatement> parseLine(String service, int line, String text) {
        var tokens = text.split("\\s+");
        if (tokens.length < 3) {
            return new BehaviorError.Malformed(service, line, text, GENERIC_FORM).result();
        }
        var zone = tokens[0];
        return BehaviorKind.behaviorKind(tokens[1])
                           .toResult(new BehaviorError.UnknownKind(service, line, tokens[1]))
                           .flatMap(kind -> kind == BehaviorKind.MASTER
                                            ? parseMaster(service, line, text, zone, tokens)
                                            : parseGeneric(service, line, text, zone, kind, tokens));
    }

    private static Result<BehaviorStatement> parseGeneric(String service,
                                                          int line,
                                                          String text,
                                                          String zone,
                                                          BehaviorKind kind,
                                                          String[] tokens) {
        return targets(service, line, text, String.join(" ", Arrays.asList(tokens)
                                                                   .subList(2, tokens.length)), GENERIC_FORM)
            .map(targets -> BehaviorStatement.generic(line, text, zone, kind, targets));
    }

    private static Result<BehaviorStatement> parseMaster(String service,
                                                         int line,
                                                         String text,
                                                         String zone,
                                                         String[] tokens) {
        if (tokens.length < 5) {
            return new BehaviorError.Malformed(service, line, text, MASTER_FORM).result();
        }
        var rname = tokens[2];
        var typeName = tokens[3];
        var type = RecordType.recordType(typeName);
        if (type.isEmpty()) {
            return new BehaviorError.UnsupportedRecordType(service, line, typeName).result();
        }
        var ttl = BehaviorStatement.DEFAULT_TTL;
        var firstTarget = 4;
        if (tokens.length > 5 && tokens[4].matches("-?\\d+")) {
            var value = Number.parseInt(tokens[4]);
            if (value.isFailure() || value.unwrap() < 0) {
                return new BehaviorError.InvalidTtl(service, line, tokens[4]).result();
            }
            ttl = value.unwrap();
            firstTarget = 5;
        }
        var recordTtl = ttl;
        var rest = String.join(" ", Arrays.asList(tokens)
                                          .subList(firstTarget, tokens.length));
        if (type.unwrap() == RecordType.TXT) {
            return Result.success(BehaviorStatement.master(line, text, zone, rname, type.unwrap(), recordTtl, splitTargets(rest)));
        }
        return targets(service, line, text, rest, MASTER_FORM)
            .map(targets -> BehaviorStatement.master(line, text, zone, rname, type.unwrap(), recordTtl, targets));
    }

    private static Result<List<String>> targets(String service, int line, String text, String rest, String form) {
        var targets = splitTargets(rest);
        if (targets.stream()
                   .anyMatch(target -> target.isEmpty() || target.contains(" "))) {
            return new BehaviorError.Malformed(service, line, text, form).result();
        }
        return Result.success(targets);
    }

    private static List<String> splitTargets(String rest) {
        return Arrays.stream(rest.split(","))
                     .map(String::trim)
                     .toList();
    }
}
