package com.oclparser.json;

/**
 * Thrown when a provider fails to write a tree or view as JSON, or to read JSON back.
 */
public class OclJsonException extends RuntimeException {

    public OclJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
