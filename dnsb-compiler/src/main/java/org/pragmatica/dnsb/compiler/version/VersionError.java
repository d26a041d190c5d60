package org.pragmatica.dnsb.compiler.version;

import org.pragmatica.lang.Cause;

/**
 * Errors from version parsing and image version rules.
 */
public sealed interface VersionError extends Cause {
    record InvalidVersion(String version) implements VersionError {
        @Override
        public String message() {
            return "Invalid version '" + version + "', expected <major>[.<minor>[.<patch>]][-<pre-release>]";
        }
    }

    record InvalidPattern(String pattern, String reason) implements VersionError {
        @Override
        public String message() {
            return "Invalid version rule '" + pattern + "': " + reason;
        }
    }

    /**
     * No rule of the software's rule set accepts the version.
     */
    record Unsupported(String image, String software, String version) implements VersionError {
        @Override
        public String message() {
            return "Image '" + image + "': " + software + " version '" + version + "' is not supported";
        }
    }
}
