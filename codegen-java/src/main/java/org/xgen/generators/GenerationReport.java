package org.xgen.generators;

import org.xgen.core.model.NodeKind;
import org.xgen.generators.dispatch.GenerationException;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of a generation run: how many nodes were dispatched, which files
 * were written and which nodes failed.
 */
public record GenerationReport(
    int dispatched,
    List<Path> generatedFiles,
    List<Failure> failures
) {
    public GenerationReport {
        generatedFiles = List.copyOf(generatedFiles);
        failures = List.copyOf(failures);
    }

    /** A node whose hook failed. */
    public record Failure(String nodeName, NodeKind kind, String hook, GenerationException cause) {
        public String describe() {
            return "%s %s (%s): %s".formatted(kind.hookName(), nodeName, hook, cause.getMessage());
        }
    }

    public boolean succeeded() {
        return failures.isEmpty();
    }

    /**
     * Abort with a single exception listing every failure.
     */
    public void throwIfFailed() throws GenerationException {
        if (succeeded()) {
            return;
        }
        String details = failures.stream()
            .map(Failure::describe)
            .collect(Collectors.joining("\n  - ", "\n  - ", ""));
        GenerationException e = new GenerationException(failures.size() + " node(s) failed to generate:" + details);
        failures.forEach(f -> e.addSuppressed(f.cause()));
        throw e;
    }
}
