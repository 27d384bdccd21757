package com.all2md.core.renderer;

import com.all2md.core.ast.Document;
import com.all2md.core.config.All2MdConfig;

/**
 * Interface for renderers that turn a {@link Document} tree into a target format.
 *
 * <p>Renderers traverse the tree with a {@link com.all2md.core.ast.NodeVisitor} and may use
 * {@link com.all2md.core.footnote.FootnoteCollector} and {@link com.all2md.core.util.Slugs}.
 * They must not depend on parser internals.
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.all2md.core.renderer.DocumentRenderer}
 *
 * @see com.all2md.core.parser.DocumentParser
 */
public interface DocumentRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * <p>Used on the command line to select an output format (e.g., "markdown", "json").
     *
     * @return unique renderer identifier
     */
    String getId();

    /**
     * Returns file extension for rendered output.
     *
     * @return file extension without leading dot
     */
    String getFileExtension();

    /**
     * Renders a document.
     *
     * <p>Implementations must be safe to call repeatedly; per-render state such as footnote
     * numbering is created for each call.
     *
     * @param document document to render
     * @param config renderer settings
     * @return rendered text
     */
    String render(Document document, All2MdConfig config);

    /**
     * Renders a document with {@link All2MdConfig#defaults()}.
     *
     * @param document document to render
     * @return rendered text
     */
    default String render(Document document) {
        return render(document, All2MdConfig.defaults());
    }
}
