package org.pyoptimizer.exception;

/**
 * Utility class for generating error messages with context from the source text.
 */
public class ErrorMessageUtil {
    private static final int CONTEXT_CHARS = 24;

    private final String fileName;
    private final String[] lines;

    /**
     * Constructs an ErrorMessageUtil with the specified file name and source text.
     *
     * @param fileName the name of the file
     * @param source   the complete source text
     */
    public ErrorMessageUtil(String fileName, String source) {
        this.fileName = fileName;
        this.lines = source.split("\n", -1);
    }

    public String getFileName() {
        return fileName;
    }

    /**
     * Quotes the specified string for inclusion in an error message.
     * Escapes special characters such as newlines, tabs, and backslashes.
     *
     * @param str the string to quote
     * @return the quoted and escaped string
     */
    private static String errorMessageQuote(String str) {
        StringBuilder escaped = new StringBuilder();
        for (char c : str.toCharArray()) {
            switch (c) {
                case '\n' -> escaped.append("\\n");
                case '\t' -> escaped.append("\\t");
                case '\r' -> escaped.append("\\r");
                case '\\' -> escaped.append("\\\\");
                case '"' -> escaped.append("\\\"");
                default -> escaped.append(c);
            }
        }
        return "\"" + escaped + "\"";
    }

    /**
     * Generates an error message with the text surrounding the given position.
     *
     * @param line    1-based line number
     * @param column  0-based column
     * @param message the error message
     * @return the formatted error message with context
     */
    public String errorMessage(int line, int column, String message) {
        String near = "";
        if (line >= 1 && line <= lines.length) {
            String text = lines[line - 1];
            int from = Math.max(0, Math.min(column, text.length()) - CONTEXT_CHARS / 2);
            int to = Math.min(text.length(), from + CONTEXT_CHARS);
            near = text.substring(from, to).strip();
        }
        StringBuilder sb = new StringBuilder();
        sb.append(message).append(" at ").append(fileName).append(" line ").append(line);
        if (!near.isEmpty()) {
            sb.append(", near ").append(errorMessageQuote(near));
        }
        return sb.toString();
    }
}
