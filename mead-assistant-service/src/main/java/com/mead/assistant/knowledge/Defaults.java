package com.mead.assistant.knowledge;

import java.util.List;
import java.util.Objects;

/**
 * Null handling shared by the knowledge records: absent collections become empty lists,
 * absent scalars become empty strings.
 */
final class Defaults {

    static List<String> list(List<String> values) {
        if (values == null || values.isEmpty()) return List.of();
        return values.stream()
                .filter(Objects::nonNull)
                .toList();
    }

    static String text(String value) {
        return value == null ? "" : value;
    }

    private Defaults() {}
}
