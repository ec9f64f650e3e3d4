package org.gathermine.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics raised while tokenizing and parsing a table document.
 * <p>
 * This keeps the lexer and parser free of logging; callers decide how to surface the messages.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message    The error message.
     * @param section    The section in which the error occurred.
     * @param lineNumber The line number of the error.
     */
    public void reportError(String message, String section, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, section, lineNumber));
    }

    /**
     * Reports a warning.
     *
     * @param message    The warning message.
     * @param section    The section in which the warning occurred.
     * @param lineNumber The line number of the warning.
     */
    public void reportWarning(String message, String section, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, section, lineNumber));
    }

    /**
     * @return {@code true} if at least one error was reported
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the diagnostics reported for one section.
     *
     * @param section the section name
     * @return the matching diagnostics in report order
     */
    public List<Diagnostic> forSection(String section) {
        return diagnostics.stream()
                .filter(d -> d.section().equals(section))
                .collect(Collectors.toList());
    }

    /**
     * @return an unmodifiable list of all collected diagnostics
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return all collected diagnostics as one string, one per line
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
