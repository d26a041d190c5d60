package org.pragmatica.dnsb.compiler.hook;

/**
 * Pipeline points where hooks run.
 */
public enum HookStage {
    /**
     * Raw service definition, before reference resolution.
     */
    SETUP("setup"),
    /**
     * Resolved and substituted definition.
     */
    MODIFY("modify"),
    /**
     * Final definition; hooks return a verdict instead of a subtree.
     */
    VALIDATE("validate");

    private final String key;

    HookStage(String key) {
        this.key = key;
    }

    /**
     * Key listing hook names in an {@code auto} mapping.
     */
    public String key() {
        return key;
    }
}
