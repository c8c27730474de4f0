package com.pypeek.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural summary of one Python module.
 *
 * <p>This is the value handed from the walker to the renderers. Class entries keep source
 * order; the map and every list are unmodifiable.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ModuleSummary summary = new TreeWalker(lines).visitModule(module);
 * summary.classes().forEach((name, methods) -> System.out.println(name + ": " + methods.size()));
 * }</pre>
 *
 * @param moduleDoc module docstring, or {@code null}
 * @param classes class name to its methods, in source order
 * @param topLevelFunctions functions defined outside any class, except {@code main}
 * @param mainFunction the top-level function named {@code main}, or {@code null}
 * @param executable whether the module has a top-level {@code if __name__ ...} guard
 */
public record ModuleSummary(
    String moduleDoc,
    Map<String, List<FunctionInfo>> classes,
    List<FunctionInfo> topLevelFunctions,
    FunctionInfo mainFunction,
    boolean executable
) {
    /**
     * Compact constructor with validation.
     */
    public ModuleSummary {
        Map<String, List<FunctionInfo>> ordered = new LinkedHashMap<>();
        if (classes != null) {
            classes.forEach((name, methods) -> ordered.put(name, methods != null ? List.copyOf(methods) : List.of()));
        }
        classes = Collections.unmodifiableMap(ordered);
        topLevelFunctions = topLevelFunctions != null ? List.copyOf(topLevelFunctions) : List.of();
    }

    /**
     * Creates a summary of a module with no docstring, definitions or guard.
     *
     * @return empty summary
     */
    public static ModuleSummary empty() {
        return new ModuleSummary(null, Map.of(), List.of(), null, false);
    }
}
