package io.autolv.vistrings;

/**
 * Exported VI strings that cannot be turned into a control tree: the repaired text is not well-formed
 * XML, or a control lacks an element every control of its type must have.
 */
public class ViStringsFormatException extends RuntimeException {

    private final int line;
    private final int column;
    private final String excerpt;

    public ViStringsFormatException(String message) {
        this(message, -1, -1, null, null);
    }

    public ViStringsFormatException(String message, Throwable cause) {
        this(message, -1, -1, null, cause);
    }

    public ViStringsFormatException(String message, int line, int column, String excerpt, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
        this.excerpt = excerpt;
    }

    /** 1-based line in the repaired text, or -1 when unknown. */
    public int line() {
        return line;
    }

    /** 1-based column in the repaired text, or -1 when unknown. */
    public int column() {
        return column;
    }

    /** Repaired text around the problem, or {@code null}. */
    public String excerpt() {
        return excerpt;
    }

    public boolean hasLocation() {
        return line > 0;
    }
}
