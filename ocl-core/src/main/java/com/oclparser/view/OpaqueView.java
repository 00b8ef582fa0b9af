package com.oclparser.view;

import com.oclparser.ast.Document;
import com.oclparser.ast.Node;

import java.util.Map;

/**
 * Wraps a node with nothing to navigate, such as a recovered span of malformed input.
 */
public final class OpaqueView extends NodeView {

    OpaqueView(Document document, Node node) {
        super(document, node);
    }

    @Override
    Map<String, ViewValue> resolveEntries() {
        return Map.of();
    }
}
