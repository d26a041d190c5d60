package org.pragmatica.dnsb.compiler.hook;

import org.pragmatica.lang.Cause;

import java.util.List;

public sealed interface HookError extends Cause {
    record UnknownHook(String service, HookStage stage, String hook) implements HookError {
        @Override
        public String message() {
            return "Service '" + service + "' lists unknown " + stage.key() + " hook '" + hook + "'";
        }
    }

    record Failed(String hook, HookStage stage, String service, String details) implements HookError {
        @Override
        public String message() {
            return "Hook '" + hook + "' failed at " + stage.key() + " for service '" + service + "': " + details;
        }
    }

    record Rejected(String hook, String service, List<String> reasons) implements HookError {
        @Override
        public String message() {
            return "Hook '" + hook + "' rejected service '" + service + "':\n- " + String.join("\n- ", reasons);
        }
    }

    record InvalidAutoSection(String owner, String details) implements HookError {
        @Override
        public String message() {
            return "Invalid 'auto' section in " + owner + ": " + details;
        }
    }
}
