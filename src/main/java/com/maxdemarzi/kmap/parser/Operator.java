package com.maxdemarzi.kmap.parser;

/**
 * Boolean operators understood by the lexer, with their binding strength.
 * Higher precedence binds tighter.
 */
public enum Operator {
    NOT(1, 4, false),
    AND(2, 3, true),
    XOR(2, 2, true),
    OR(2, 1, true);

    private final int arity;
    private final int precedence;
    private final boolean leftAssociative;

    Operator(int arity, int precedence, boolean leftAssociative) {
        this.arity = arity;
        this.precedence = precedence;
        this.leftAssociative = leftAssociative;
    }

    public int getArity() {
        return arity;
    }

    public int getPrecedence() {
        return precedence;
    }

    public boolean isLeftAssociative() {
        return leftAssociative;
    }

    public boolean apply(boolean left, boolean right) {
        switch (this) {
            case AND:
                return left && right;
            case OR:
                return left || right;
            case XOR:
                return left != right;
            default:
                throw new IllegalStateException(this + " is not a binary operator");
        }
    }
}
