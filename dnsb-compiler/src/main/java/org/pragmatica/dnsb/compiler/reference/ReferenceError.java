package org.pragmatica.dnsb.compiler.reference;

import org.pragmatica.lang.Cause;

import java.util.List;

/**
 * Errors raised while resolving {@code ref} and {@code mixins} chains.
 */
public sealed interface ReferenceError extends Cause {
    /**
     * Sibling reference names a definition that does not exist.
     */
    record UnknownReference(DefinitionKind kind, String name, String target) implements ReferenceError {
        @Override
        public String message() {
            return "The " + kind.displayName() + " '" + name + "' references undefined " + kind.displayName() + " '" + target
                   + "'";
        }
    }

    /**
     * Built-in template is not part of the bundled catalog.
     */
    record UnknownTemplate(DefinitionKind kind, String name, String template) implements ReferenceError {
        @Override
        public String message() {
            return "The " + kind.displayName() + " '" + name + "' references unknown built-in template '" + template + "'";
        }
    }

    /**
     * Reference chain loops back on itself.
     */
    record CycleDetected(DefinitionKind kind, List<String> path) implements ReferenceError {
        @Override
        public String message() {
            return "Circular " + kind.displayName() + " reference: " + String.join(" → ", path);
        }
    }

    /**
     * Service refers to an image that is neither defined nor a preset.
     */
    record UnknownImage(String service, String image) implements ReferenceError {
        @Override
        public String message() {
            return "Service '" + service + "' uses undefined image '" + image + "'";
        }
    }

    /**
     * Software type required (for {@code std:} templates or behaviors) but the image does not declare it.
     */
    record MissingSoftware(String service, String image, String reason) implements ReferenceError {
        @Override
        public String message() {
            return "Image '" + image + "' of service '" + service + "' has no 'software' type, required by " + reason;
        }
    }

    /**
     * Definition shape does not allow resolution.
     */
    record InvalidDefinition(DefinitionKind kind, String name, String reason) implements ReferenceError {
        @Override
        public String message() {
            return "Invalid " + kind.displayName() + " '" + name + "': " + reason;
        }
    }

    static ReferenceError cycleDetected(DefinitionKind kind, List<String> path) {
        return new CycleDetected(kind, List.copyOf(path));
    }
}
