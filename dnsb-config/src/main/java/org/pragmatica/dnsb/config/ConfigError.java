package org.pragmatica.dnsb.config;

import org.pragmatica.lang.Cause;

import java.util.List;

/**
 * Errors raised while loading and validating a project configuration.
 */
public sealed interface ConfigError extends Cause {
    /**
     * Document is not valid YAML or does not have the expected shape.
     */
    record ParseFailed(String source, String details) implements ConfigError {
        @Override
        public String message() {
            return "Failed to parse configuration " + source + ": " + details;
        }
    }

    /**
     * File or bundled resource cannot be read.
     */
    record ReadFailed(String source, String details) implements ConfigError {
        @Override
        public String message() {
            return "Cannot read configuration " + source + ": " + details;
        }
    }

    /**
     * Include chain loops back to a document already being loaded.
     */
    record IncludeCycle(List<String> chain) implements ConfigError {
        @Override
        public String message() {
            return "Circular include: " + String.join(" -> ", chain);
        }
    }

    /**
     * Structural validation failed; all violations are reported together.
     */
    record ValidationFailed(List<String> errors) implements ConfigError {
        @Override
        public String message() {
            return "Configuration validation failed:\n- " + String.join("\n- ", errors);
        }
    }

    static ConfigError parseFailed(String source, String details) {
        return new ParseFailed(source, details);
    }

    static ConfigError readFailed(String source, String details) {
        return new ReadFailed(source, details);
    }

    static ConfigError includeCycle(List<String> chain) {
        return new IncludeCycle(List.copyOf(chain));
    }

    static ConfigError validationFailed(List<String> errors) {
        return new ValidationFailed(List.copyOf(errors));
    }
}
