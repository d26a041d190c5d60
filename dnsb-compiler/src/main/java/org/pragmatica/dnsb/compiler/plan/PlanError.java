package org.pragmatica.dnsb.compiler.plan;

import org.pragmatica.lang.Cause;

/**
 * Failures while assembling service plans.
 */
public sealed interface PlanError extends Cause {
    record InvalidVolume(String service, String volume) implements PlanError {
        @Override
        public String message() {
            return "Service '" + service + "' has invalid volume '" + volume + "', expected '<host>:<container>'";
        }
    }

    record InvalidField(String service, String field, String expected) implements PlanError {
        @Override
        public String message() {
            return "Service '" + service + "': '" + field + "' must be " + expected;
        }
    }
}
