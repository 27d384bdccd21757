package com.all2md.core.output;

/**
 * Writes generated files to a destination such as the filesystem or the console.
 *
 * <p>Writers are discovered with {@link java.util.ServiceLoader}; register implementations in
 * {@code META-INF/services/com.all2md.core.output.OutputWriter}.
 */
public interface OutputWriter {

    /**
     * Returns unique identifier for this writer, e.g. {@code "filesystem"}.
     *
     * @return writer id
     */
    String getId();

    /**
     * Writes every file of {@code output}.
     *
     * @param output files to write
     * @param context destination settings
     * @throws IllegalStateException if a file cannot be written
     */
    void write(GeneratedOutput output, OutputContext context);
}
