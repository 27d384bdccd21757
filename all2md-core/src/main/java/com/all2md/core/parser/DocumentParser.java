package com.all2md.core.parser;

import java.util.Set;

import com.all2md.core.ast.Document;

/**
 * Interface for parsers that turn source text into a {@link Document} tree.
 *
 * <p>Parsers must build the tree from the node types of {@code com.all2md.core.ast} only;
 * format-specific details go into node metadata or {@link com.all2md.core.ast.SourceLocation}.
 *
 * <p>Parsers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.all2md.core.parser.DocumentParser}
 *
 * @see com.all2md.core.renderer.DocumentRenderer
 */
public interface DocumentParser {

    /**
     * Returns unique identifier for this parser.
     *
     * <p>Used on the command line to select an input format (e.g., "markdown", "json").
     *
     * @return unique parser identifier
     */
    String getId();

    /**
     * Returns file extensions this parser handles, without the leading dot.
     *
     * @return lowercase file extensions
     */
    Set<String> getFileExtensions();

    /**
     * Parses source text into a document.
     *
     * @param source source text, never null
     * @return parsed document
     * @throws com.all2md.core.All2MdException if the source cannot be parsed
     */
    Document parse(String source);

    /**
     * Checks whether this parser handles files with the given name.
     *
     * @param fileName file name or path
     * @return true if the extension matches one of {@link #getFileExtensions()}
     */
    default boolean supports(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        return getFileExtensions().contains(fileName.substring(dot + 1).toLowerCase());
    }
}
