package com.aml.network.core;

/**
 * Thrown when request parameters are rejected before any traversal begins,
 * e.g. a blank entity id or a depth outside its allowed range.
 */
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
