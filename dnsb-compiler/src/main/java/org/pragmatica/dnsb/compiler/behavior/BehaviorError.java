package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.lang.Cause;

/**
 * Behavior script failures. Statement-level errors cite the service and the line number.
 */
public sealed interface BehaviorError extends Cause {
    record UnknownKind(String service, int line, String kind) implements BehaviorError {
        @Override
        public String message() {
            return at(service, line) + "unknown behavior '" + kind + "', expected forward, hint, stub or master";
        }
    }

    record Malformed(String service, int line, String text, String expected) implements BehaviorError {
        @Override
        public String message() {
            return at(service, line) + "malformed statement '" + text + "', expected '" + expected + "'";
        }
    }

    record TargetCount(String service, int line, int count) implements BehaviorError {
        @Override
        public String message() {
            return at(service, line) + "'hint' takes exactly one target, got " + count;
        }
    }

    record UnresolvableTarget(String service, int line, String target) implements BehaviorError {
        @Override
        public String message() {
            return at(service, line) + "'" + target + "' is neither a known service nor an IP address";
        }
    }

    record UnsupportedRecordType(String service, int line, String type) implements BehaviorError {
        @Override
        public String message() {
            return at(service, line) + "unsupported record type '" + type + "'";
        }
    }

    record InvalidTtl(String service, int line, String ttl) implements BehaviorError {
        @Override
        public String message() {
            return at(service, line) + "invalid TTL '" + ttl + "'";
        }
    }

    record UnsupportedSoftware(String service, String software) implements BehaviorError {
        @Override
        public String message() {
            return "Service '" + service + "' declares a behavior, but software '" + software
                   + "' has no behavior support";
        }
    }

    record MissingMainConfig(String service) implements BehaviorError {
        @Override
        public String message() {
            return "Service '" + service + "' declares a behavior, but no '.conf' volume to include the generated zones into";
        }
    }

    private static String at(String service, int line) {
        return "Service '" + service + "', behavior line " + line + ": ";
    }
}
