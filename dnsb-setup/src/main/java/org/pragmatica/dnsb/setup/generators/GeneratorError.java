package org.pragmatica.dnsb.setup.generators;

import org.pragmatica.lang.Cause;

/**
 * Errors that can occur during artifact generation.
 */
public sealed interface GeneratorError extends Cause {
    record IoError(String details) implements GeneratorError {
        @Override
        public String message() {
            return "I/O error during generation: " + details;
        }
    }

    record SourceNotFound(String service, String source, String details) implements GeneratorError {
        @Override
        public String message() {
            return "Volume source '" + source + "' of service '" + service + "' cannot be read: " + details;
        }
    }

    record InvalidImage(String service, String image, String reason) implements GeneratorError {
        @Override
        public String message() {
            return "Cannot write Dockerfile for service '" + service + "' from image '" + image + "': " + reason;
        }
    }

    static GeneratorError ioError(String details) {
        return new IoError(details);
    }
}
