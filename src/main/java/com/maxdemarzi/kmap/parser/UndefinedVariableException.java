package com.maxdemarzi.kmap.parser;

public class UndefinedVariableException extends ExpressionException {

    private final char name;

    public UndefinedVariableException(char name) {
        super("Variable " + name + " is not defined");
        this.name = name;
    }

    public char getName() {
        return name;
    }
}
