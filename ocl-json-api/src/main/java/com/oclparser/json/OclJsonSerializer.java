package com.oclparser.json;

import com.oclparser.ast.Node;
import com.oclparser.view.ViewValue;

/**
 * Interface for serializing OCL syntax trees and views to JSON.
 */
public interface OclJsonSerializer {

    /**
     * Serializes an AST node to a JSON string. Every node carries its {@code type} and {@code loc}.
     *
     * @param node the AST node to serialize
     * @return the JSON representation of the node
     * @throws OclJsonException if serialization fails
     */
    String serialize(Node node) throws OclJsonException;

    /**
     * Serializes an AST node to a pretty-printed JSON string.
     *
     * @param node the AST node to serialize
     * @return the pretty-printed JSON representation of the node
     * @throws OclJsonException if serialization fails
     */
    String serializePretty(Node node) throws OclJsonException;

    /**
     * Serializes a view to a JSON string. Objects carry exactly the view's keys.
     *
     * @param view the view to serialize
     * @return the JSON representation of the view
     * @throws OclJsonException if serialization fails
     */
    String serialize(ViewValue view) throws OclJsonException;

    /**
     * Serializes a view to a pretty-printed JSON string.
     *
     * @param view the view to serialize
     * @return the pretty-printed JSON representation of the view
     * @throws OclJsonException if serialization fails
     */
    String serializePretty(ViewValue view) throws OclJsonException;
}
