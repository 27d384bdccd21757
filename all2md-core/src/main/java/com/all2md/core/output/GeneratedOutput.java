package com.all2md.core.output;

import java.util.List;
import java.util.Objects;

/**
 * Files produced by one command invocation, in output order.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }
}
