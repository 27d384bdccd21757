package com.all2md.core.renderer.impl;

import com.all2md.core.ast.Document;
import com.all2md.core.config.All2MdConfig;
import com.all2md.core.renderer.DocumentRenderer;
import com.all2md.core.serialization.AstSerializer;

/**
 * Writes the versioned JSON form of a document, readable again by
 * {@link com.all2md.core.parser.impl.JsonAstParser}.
 */
public class JsonAstRenderer implements DocumentRenderer {

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    @Override
    public String render(Document document, All2MdConfig config) {
        return AstSerializer.astToJson(document, config.serialization().pretty());
    }
}
