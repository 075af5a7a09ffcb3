package com.tektonqueue.config;

import java.util.List;

/**
 * Expression section of the policy file.
 *
 * @param expressions CEL sources, evaluated in this order
 */
public record CelConfig(List<String> expressions) {

    public CelConfig {
        expressions = expressions == null ? List.of() : List.copyOf(expressions);
    }

    public static CelConfig empty() {
        return new CelConfig(List.of());
    }
}
