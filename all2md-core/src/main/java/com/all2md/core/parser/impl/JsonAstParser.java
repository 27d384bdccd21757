package com.all2md.core.parser.impl;

import java.util.Set;

import com.all2md.core.ast.Document;
import com.all2md.core.parser.DocumentParser;
import com.all2md.core.serialization.AstSerializer;

/**
 * Reads documents previously written by {@link com.all2md.core.renderer.impl.JsonAstRenderer}.
 */
public class JsonAstParser implements DocumentParser {

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("json");
    }

    @Override
    public Document parse(String source) {
        return AstSerializer.jsonToAst(source);
    }
}
