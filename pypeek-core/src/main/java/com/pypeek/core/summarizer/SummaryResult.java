package com.pypeek.core.summarizer;

import java.util.Objects;

import com.pypeek.core.model.ModuleSummary;

/**
 * Outcome of summarizing one file.
 *
 * <p>Only {@link Success} carries a summary. {@link Skipped} is not an error: the file was
 * not recognized as Python and nothing was parsed.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * SummaryResult result = summarizer.summarizeFile(path);
 * if (result instanceof SummaryResult.SyntaxFailure failure) {
 *     System.err.println(failure.message() + " at line " + failure.line());
 * }
 * }</pre>
 */
public sealed interface SummaryResult
    permits SummaryResult.Success, SummaryResult.Skipped, SummaryResult.SyntaxFailure, SummaryResult.ReadFailure {

    /**
     * @return name of the file the result is about
     */
    String fileName();

    /**
     * Check if this result is a failure (syntax or read).
     *
     * @return true for {@link SyntaxFailure} and {@link ReadFailure}
     */
    default boolean isFailure() {
        return this instanceof SyntaxFailure || this instanceof ReadFailure;
    }

    /**
     * The file was parsed and summarized.
     *
     * @param fileName file name
     * @param summary module summary
     */
    record Success(String fileName, ModuleSummary summary) implements SummaryResult {
        public Success {
            Objects.requireNonNull(fileName, "fileName must not be null");
            Objects.requireNonNull(summary, "summary must not be null");
        }
    }

    /**
     * The file is not Python source by name or interpreter line.
     *
     * @param fileName file name
     * @param reason why the file was skipped
     */
    record Skipped(String fileName, String reason) implements SummaryResult {
        public Skipped {
            Objects.requireNonNull(fileName, "fileName must not be null");
            Objects.requireNonNull(reason, "reason must not be null");
        }
    }

    /**
     * The source is malformed.
     *
     * @param fileName file name
     * @param message parser message (e.g., "invalid syntax near ':'")
     * @param line 1-indexed line of the error
     * @param column 1-indexed column of the error
     */
    record SyntaxFailure(String fileName, String message, int line, int column) implements SummaryResult {
        public SyntaxFailure {
            Objects.requireNonNull(fileName, "fileName must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }

    /**
     * The file could not be read or decoded.
     *
     * @param fileName file name
     * @param message user-facing description
     */
    record ReadFailure(String fileName, String message) implements SummaryResult {
        public ReadFailure {
            Objects.requireNonNull(fileName, "fileName must not be null");
            Objects.requireNonNull(message, "message must not be null");
        }
    }
}
