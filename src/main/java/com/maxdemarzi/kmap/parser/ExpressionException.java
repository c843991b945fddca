package com.maxdemarzi.kmap.parser;

/**
 * Base class for everything that can go wrong turning text into a boolean value.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }
}
