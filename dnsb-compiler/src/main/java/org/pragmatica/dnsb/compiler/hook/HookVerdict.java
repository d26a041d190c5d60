package org.pragmatica.dnsb.compiler.hook;

import java.util.List;

/**
 * Outcome of a validation hook.
 */
public sealed interface HookVerdict {
    Accepted ACCEPTED = new Accepted();

    boolean accepted();

    record Accepted() implements HookVerdict {
        @Override
        public boolean accepted() {
            return true;
        }
    }

    record Rejected(List<String> reasons) implements HookVerdict {
        public Rejected {
            reasons = List.copyOf(reasons);
        }

        @Override
        public boolean accepted() {
            return false;
        }
    }

    static HookVerdict accept() {
        return ACCEPTED;
    }

    static HookVerdict reject(List<String> reasons) {
        return reasons.isEmpty()
               ? ACCEPTED
               : new Rejected(reasons);
    }
}
