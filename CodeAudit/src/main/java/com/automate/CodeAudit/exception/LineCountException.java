package com.automate.CodeAudit.exception;

/**
 * The external line counter failed: non-zero exit, timeout or output that
 * does not match the expected JSON shape. Never means "zero lines".
 */
public class LineCountException extends RuntimeException {
    private static final int OUTPUT_PREVIEW_MAX = 2_000;

    private final int exitCode;
    private final String output;

    public LineCountException(String message, int exitCode, String output) {
        super(message);
        this.exitCode = exitCode;
        this.output = output;
    }

    public LineCountException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.output = null;
    }

    public int getExitCode() { return exitCode; }
    public String getOutput() { return output; }

    public String outputPreview() {
        if (output == null) return null;
        return output.length() <= OUTPUT_PREVIEW_MAX
                ? output
                : output.substring(0, OUTPUT_PREVIEW_MAX) + "...(truncated)";
    }

    @Override
    public String toString() {
        return "LineCountException{exitCode=" + exitCode +
                ", message=" + getMessage() +
                ", outputPreview=" + (output == null ? "null" : outputPreview()) +
                '}';
    }
}
