package org.pragmatica.dnsb.compiler.version;

import org.pragmatica.lang.Result;

/**
 * Version rule as used in the bundled rule sets.
 * <p>
 * Supported patterns:
 * - Exact: "9.18.24"
 * - Range: "[9.11.0, 9.21.0)", "(1.0, 2.0]", with inclusive '[' ']' and exclusive '(' ')' bounds
 * - Comparison: ">=9.16.0", ">1.0", "<=2.0", "<3"
 */
public sealed interface VersionPattern {
    boolean matches(SoftwareVersion version);

    String asString();

    /// Exact version match
    record Exact(SoftwareVersion version) implements VersionPattern {
        @Override
        public boolean matches(SoftwareVersion other) {
            return version.sameAs(other);
        }

        @Override
        public String asString() {
            return version.toString();
        }
    }

    /// Version range with inclusive/exclusive bounds
    record Range(SoftwareVersion from,
                 boolean fromInclusive,
                 SoftwareVersion to,
                 boolean toInclusive) implements VersionPattern {
        @Override
        public boolean matches(SoftwareVersion version) {
            int fromCmp = version.compareTo(from);
            int toCmp = version.compareTo(to);
            boolean fromMatch = fromInclusive
                                ? fromCmp >= 0
                                : fromCmp > 0;
            boolean toMatch = toInclusive
                              ? toCmp <= 0
                              : toCmp < 0;
            return fromMatch && toMatch;
        }

        @Override
        public String asString() {
            var fromBracket = fromInclusive
                              ? "["
                              : "(";
            var toBracket = toInclusive
                            ? "]"
                            : ")";
            return fromBracket + from + ", " + to + toBracket;
        }
    }

    /// Comparison operator version pattern
    record Comparison(Operator operator, SoftwareVersion version) implements VersionPattern {
        @Override
        public boolean matches(SoftwareVersion other) {
            int cmp = other.compareTo(version);
            return switch (operator) {
                case GT -> cmp > 0;
                case GTE -> cmp >= 0;
                case LT -> cmp < 0;
                case LTE -> cmp <= 0;
            };
        }

        @Override
        public String asString() {
            return operator.symbol() + version;
        }

        public enum Operator {
            GTE(">="),
            LTE("<="),
            GT(">"),
            LT("<");
            private final String symbol;
            Operator(String symbol) {
                this.symbol = symbol;
            }
            public String symbol() {
                return symbol;
            }
        }
    }

    /// Parse version pattern from string
    static Result<VersionPattern> parse(String pattern) {
        var trimmed = pattern.trim();
        if (trimmed.isEmpty()) {
            return new VersionError.InvalidPattern(pattern, "empty").result();
        }
        if (isRangePattern(trimmed)) {
            return parseRange(trimmed);
        }
        for (var operator : Comparison.Operator.values()) {
            if (trimmed.startsWith(operator.symbol())) {
                return parseVersion(pattern, trimmed.substring(operator.symbol()
                                                                       .length()))
                    .map(version -> new Comparison(operator, version));
            }
        }
        return parseVersion(pattern, trimmed).map(Exact::new);
    }

    private static boolean isRangePattern(String pattern) {
        return (pattern.startsWith("[") || pattern.startsWith("(")) &&
        (pattern.endsWith("]") || pattern.endsWith(")"));
    }

    private static Result<VersionPattern> parseRange(String pattern) {
        var fromInclusive = pattern.startsWith("[");
        var toInclusive = pattern.endsWith("]");
        var content = pattern.substring(1, pattern.length() - 1);
        var parts = content.split(",");
        if (parts.length != 2) {
            return new VersionError.InvalidPattern(pattern, "a range needs two bounds").result();
        }
        return Result.all(parseVersion(pattern, parts[0]),
                          parseVersion(pattern, parts[1]))
                     .map((from, to) -> new Range(from, fromInclusive, to, toInclusive));
    }

    private static Result<SoftwareVersion> parseVersion(String pattern, String version) {
        return SoftwareVersion.softwareVersion(version)
                              .mapError(cause -> new VersionError.InvalidPattern(pattern, cause.message()));
    }
}
