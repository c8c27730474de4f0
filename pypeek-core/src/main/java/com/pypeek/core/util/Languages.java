package com.pypeek.core.util;

/**
 * Constants for language identification.
 * <p>
 * This utility class provides the identifiers and file markers used to decide
 * whether a file is Python source.
 * </p>
 */
public final class Languages {
    /** Language identifier for Python. */
    public static final String PYTHON = "python";

    /** File extension of Python source files. */
    public static final String PYTHON_EXTENSION = ".py";

    /** Interpreter directive marker that starts an executable script. */
    public static final String SHEBANG = "#!";

    private Languages() {
        // Utility class
    }
}
