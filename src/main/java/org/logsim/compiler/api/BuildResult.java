package org.logsim.compiler.api;

import org.logsim.compiler.diagnostics.Diagnostic;
import org.logsim.runtime.Circuit;

import java.util.List;

/**
 * The outcome of building a circuit.
 *
 * @param success {@code true} if no error was reported; warnings do not fail a build.
 * @param diagnostics Every error and warning in the order they were found.
 * @param circuit The built circuit, {@code null} unless the build succeeded.
 */
public record BuildResult(boolean success, List<Diagnostic> diagnostics, Circuit circuit) {

    public BuildResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return Only the errors.
     */
    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).toList();
    }

    /**
     * @return Only the warnings.
     */
    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.WARNING).toList();
    }
}
