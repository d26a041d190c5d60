package org.pragmatica.dnsb.compiler.behavior;

import org.pragmatica.lang.Option;

import java.util.Arrays;

public enum BehaviorKind {
    FORWARD("forward"),
    HINT("hint"),
    STUB("stub"),
    MASTER("master");

    private final String keyword;

    BehaviorKind(String keyword) {
        this.keyword = keyword;
    }

    public String keyword() {
        return keyword;
    }

    public static Option<BehaviorKind> behaviorKind(String keyword) {
        return Option.from(Arrays.stream(values())
                                 .filter(kind -> kind.keyword.equalsIgnoreCase(keyword))
                                 .findFirst());
    }
}
