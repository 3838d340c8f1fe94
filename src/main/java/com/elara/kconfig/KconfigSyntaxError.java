package com.elara.kconfig;

/** Raised for malformed Kconfig input. Parsing is aborted; there is no recovery. */
public class KconfigSyntaxError extends RuntimeException {

    private final String filename;
    private final int line;

    public KconfigSyntaxError(String message) {
        this(message, null, 0);
    }

    public KconfigSyntaxError(String message, String filename, int line) {
        super(filename == null ? message : filename + ":" + line + ": " + message);
        this.filename = filename;
        this.line = line;
    }

    /** File the error was found in, or null (e.g. for expressions passed to evalString). */
    public String getFilename() { return filename; }

    /** Line number within {@link #getFilename()}, 0 when unknown. */
    public int getLine() { return line; }
}
