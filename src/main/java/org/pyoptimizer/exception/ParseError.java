package org.pyoptimizer.exception;

import java.io.Serial;

/**
 * ParseError is raised by the lexer and the parser when the input is not valid
 * Python. Besides the short message it keeps a detailed message that includes the
 * file name, line number and a snippet of the offending source.
 */
public class ParseError extends OptimizerException {
    @Serial
    private static final long serialVersionUID = 1L;

    private final String fileName;
    private final int line;
    private final int column;
    // Detailed error message that includes additional context about the error
    private final String errorMessage;

    /**
     * Constructs a new ParseError using the error message utility.
     *
     * @param line             1-based line of the offending token
     * @param column           0-based column of the offending token
     * @param message          the detail message describing the error
     * @param errorMessageUtil the utility for formatting error messages
     */
    public ParseError(int line, int column, String message, ErrorMessageUtil errorMessageUtil) {
        super(message);
        this.fileName = errorMessageUtil.getFileName();
        this.line = line;
        this.column = column;
        this.errorMessage = errorMessageUtil.errorMessage(line, column, message);
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Returns the detailed error message.
     *
     * @return the detailed error message
     */
    @Override
    public String getMessage() {
        return errorMessage;
    }
}
