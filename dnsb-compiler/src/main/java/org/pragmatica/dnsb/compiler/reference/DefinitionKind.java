package org.pragmatica.dnsb.compiler.reference;

/**
 * Collection a definition belongs to. Reference graphs are built per collection.
 */
public enum DefinitionKind {
    IMAGE("image"),
    SERVICE("service");

    private final String displayName;

    DefinitionKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
