package com.maxdemarzi.kmap.parser;

public class MalformedExpressionException extends ExpressionException {

    public MalformedExpressionException(String message) {
        super(message);
    }
}
