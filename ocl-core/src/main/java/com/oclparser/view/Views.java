package com.oclparser.view;

import com.oclparser.Parser;
import com.oclparser.ast.ArrayValue;
import com.oclparser.ast.Attribute;
import com.oclparser.ast.Block;
import com.oclparser.ast.Dictionary;
import com.oclparser.ast.Document;
import com.oclparser.ast.Literal;
import com.oclparser.ast.Node;
import com.oclparser.ast.Recovery;

/**
 * Entry points for building views.
 *
 * <pre>{@code
 * DocumentView root = Views.parse(source);
 * Optional<ViewValue> type = root.at("step", "deploy", "action", 0, "action_type");
 * }</pre>
 */
public final class Views {

    private Views() {
        // Utility class
    }

    /**
     * Parses {@code source} and returns its root view.
     *
     * @throws com.oclparser.ParseException on a lexical error
     */
    public static DocumentView parse(String source) {
        return of(Parser.parse(source));
    }

    public static DocumentView of(Document document) {
        return new DocumentView(document);
    }

    /**
     * Returns a view rooted at {@code node}. Arrays are viewed as the list of their values; literals
     * and recovery nodes are opaque.
     *
     * @throws IllegalArgumentException if {@code node} is not part of {@code document}
     */
    public static ViewValue of(Document document, Node node) {
        if (!document.owns(node)) {
            throw new IllegalArgumentException("Node " + node.type() + " does not belong to the document");
        }
        if (node instanceof Document) {
            return new DocumentView(document);
        } else if (node instanceof Block block) {
            return new BlockView(document, block);
        } else if (node instanceof Attribute attribute) {
            return new AttributeView(document, attribute);
        } else if (node instanceof Dictionary dictionary) {
            return new DictionaryView(document, dictionary);
        } else if (node instanceof ArrayValue array) {
            return Lookups.arrayValue(document, array);
        } else if (node instanceof Literal || node instanceof Recovery) {
            return new OpaqueView(document, node);
        }
        throw new IllegalStateException("Unknown node type: " + node.type());
    }
}
