package org.pragmatica.dnsb.compiler.substitute;

import org.pragmatica.lang.Cause;

/**
 * Placeholder resolution failures.
 */
public sealed interface SubstitutionError extends Cause {
    /**
     * Placeholder resolved to a mapping or a list.
     */
    record NonScalar(String service, String placeholder, String kind) implements SubstitutionError {
        @Override
        public String message() {
            return "Placeholder '${" + placeholder + "}' in service '" + service + "' resolves to a " + kind
                   + ", only scalar values can be substituted";
        }
    }
}
