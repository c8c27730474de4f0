package com.pypeek.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A {@code return} statement found in a function body.
 *
 * @param sourceLine trimmed text of the physical line holding the {@code return}
 * @param conditions predicates that enclose the return, outermost first; an entry of the
 *                   form {@code not (P)} means the return sits in the alternate branch of {@code P}
 * @param lineNumber line of the {@code return} keyword (1-indexed)
 */
public record ReturnInfo(
    String sourceLine,
    List<String> conditions,
    int lineNumber
) {
    /**
     * Compact constructor with validation.
     */
    public ReturnInfo {
        Objects.requireNonNull(sourceLine, "sourceLine must not be null");
        conditions = conditions != null ? List.copyOf(conditions) : List.of();
    }
}
