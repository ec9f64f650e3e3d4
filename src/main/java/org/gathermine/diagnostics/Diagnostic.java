package org.gathermine.diagnostics;

/**
 * Represents a single diagnostic message (error or warning)
 * raised while reading a persisted table document.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param section The top-level section the issue belongs to, or the source name outside of sections.
 * @param lineNumber The line number of the issue.
 */
public record Diagnostic(
        Type type,
        String message,
        String section,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that makes a section unusable. */
        ERROR,
        /** A warning about content that was skipped. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, section, lineNumber, message);
    }
}
