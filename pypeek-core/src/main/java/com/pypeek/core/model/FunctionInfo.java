package com.pypeek.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A function or method. Methods are not distinguished by kind (static, class, instance).
 *
 * @param name function name
 * @param parameters positional-or-keyword parameter names in declaration order
 * @param doc docstring, or {@code null} if the body does not start with a string literal
 * @param returns return statements in depth-first, top-to-bottom order
 * @param lineNumber line of the {@code def} keyword (1-indexed)
 * @param async whether the function was declared with {@code async def}
 */
public record FunctionInfo(
    String name,
    List<String> parameters,
    String doc,
    List<ReturnInfo> returns,
    int lineNumber,
    boolean async
) {
    /**
     * Compact constructor with validation.
     */
    public FunctionInfo {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        returns = returns != null ? List.copyOf(returns) : List.of();
    }

    /**
     * Check if the function contains any return statement.
     *
     * @return true if at least one return was found
     */
    public boolean hasReturns() {
        return !returns.isEmpty();
    }
}
