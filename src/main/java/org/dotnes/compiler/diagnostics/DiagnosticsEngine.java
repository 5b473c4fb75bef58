package org.dotnes.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects non-fatal diagnostics of one compilation. Fatal problems are thrown as
 * {@link org.dotnes.compiler.api.CompilationException} instead.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a warning.
     *
     * @param message The warning message.
     * @param offset The IL offset, or -1.
     */
    public void reportWarning(String message, int offset) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, offset));
        CompilerLogger.debug("Diagnostic: " + message);
    }

    /**
     * Reports an informational note.
     *
     * @param message The message.
     */
    public void reportInfo(String message) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.INFO, message, -1));
    }

    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    /**
     * @return An unmodifiable list of all collected diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * @return All diagnostics as a single, formatted string.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
