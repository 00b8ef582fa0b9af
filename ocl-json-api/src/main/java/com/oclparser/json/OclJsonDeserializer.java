package com.oclparser.json;

/**
 * Interface for reading JSON back into plain data.
 */
public interface OclJsonDeserializer {

    /**
     * Reads a JSON string into the interchange form used by
     * {@link com.oclparser.view.ViewValue#toInterchangeTree()}: maps, lists, strings, numbers and
     * booleans.
     *
     * @param json the JSON string to read
     * @return the plain-data tree
     * @throws OclJsonException if the input is not valid JSON
     */
    Object readTree(String json) throws OclJsonException;
}
