package com.pypeek.core.walker;

/**
 * A syntax tree refers to a line the source text does not have.
 *
 * <p>This cannot happen for a tree parsed from the same text the walker was given; seeing it
 * means the tree and the source lines are out of step.
 */
public class LineIndexException extends IllegalStateException {

    private final int lineNumber;
    private final int lineCount;

    /**
     * @param lineNumber requested 1-indexed line
     * @param lineCount number of lines available
     */
    public LineIndexException(int lineNumber, int lineCount) {
        super("Line " + lineNumber + " is outside the source (" + lineCount + " lines)");
        this.lineNumber = lineNumber;
        this.lineCount = lineCount;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getLineCount() {
        return lineCount;
    }
}
