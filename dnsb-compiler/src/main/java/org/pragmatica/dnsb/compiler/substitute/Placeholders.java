package org.pragmatica.dnsb.compiler.substitute;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Placeholder syntax and reserved markers.
 */
public sealed interface Placeholders {
    /**
     * Innermost {@code ${...}} occurrence; nested placeholders resolve from the inside out. A lone
     * '$' inside, as in a default value, is part of the expression.
     */
    Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^{}]+)}");

    String REQUIRED_NAME = "required";
    String ORIGIN_NAME = "origin";

    /**
     * Field must be overridden before validation.
     */
    String REQUIRED = "${" + REQUIRED_NAME + "}";

    /**
     * Value is used as given; downstream path checks skip it.
     */
    String ORIGIN = "${" + ORIGIN_NAME + "}";

    /**
     * Replacement for an unresolvable path without a default.
     */
    String UNRESOLVED = "none";

    Set<String> RESERVED = Set.of(REQUIRED_NAME, ORIGIN_NAME);

    static boolean isReserved(String expression) {
        return RESERVED.contains(expression.trim());
    }

    static boolean isRequired(String text) {
        return text.contains(REQUIRED);
    }

    static boolean hasOrigin(String text) {
        return text.startsWith(ORIGIN);
    }

    static String stripOrigin(String text) {
        return hasOrigin(text)
               ? text.substring(ORIGIN.length())
               : text;
    }

    record Unused() implements Placeholders {}
}
