package org.logsim.compiler.api;

import org.logsim.names.NameTable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for turning a circuit definition into a simulatable circuit.
 */
public interface ICircuitCompiler {

    /**
     * Builds a circuit with its own name table.
     *
     * @param source The complete definition text.
     * @param fileName A name for the source, used in diagnostics.
     * @return The outcome of the build; it carries a circuit only if no error was reported.
     */
    default BuildResult buildNetwork(String source, String fileName) {
        return buildNetwork(source, fileName, new NameTable());
    }

    /**
     * Builds a circuit whose registries share the given name table.
     *
     * @param source The complete definition text.
     * @param fileName A name for the source, used in diagnostics.
     * @param names The name table to intern names into.
     * @return The outcome of the build; it carries a circuit only if no error was reported.
     */
    BuildResult buildNetwork(String source, String fileName, NameTable names);

    /**
     * Builds a circuit from a file.
     * @param path The definition file.
     * @return The outcome of the build.
     * @throws IOException if the file cannot be read.
     */
    default BuildResult buildNetwork(Path path) throws IOException {
        return buildNetwork(Files.readString(path), path.toString().replace('\\', '/'));
    }
}
