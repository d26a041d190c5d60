package org.pragmatica.dnsb.compiler.behavior;

/**
 * One generated configuration entry.
 */
public record ConfigFragment(Section section, String text) {
    /**
     * Where the entry goes in the server configuration. Only Unbound distinguishes the two.
     */
    public enum Section {
        SERVER,
        TOPLEVEL
    }

    public static ConfigFragment topLevel(String text) {
        return new ConfigFragment(Section.TOPLEVEL, text);
    }

    public static ConfigFragment server(String text) {
        return new ConfigFragment(Section.SERVER, text);
    }
}
