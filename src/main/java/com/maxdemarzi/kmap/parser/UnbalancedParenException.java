package com.maxdemarzi.kmap.parser;

public class UnbalancedParenException extends ExpressionException {

    public UnbalancedParenException() {
        super("Unbalanced parentheses");
    }
}
