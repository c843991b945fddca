package com.maxdemarzi.kmap.parser;

import java.util.Objects;

/**
 * A lexical unit of a boolean expression. Each kind only carries the fields it needs:
 * numbers a 0/1 value, variables a single upper case letter, operators their
 * {@link Operator} and {@link Fixity}.
 */
public final class Token {

    public enum Kind {
        NUMBER,
        VARIABLE,
        OPERATOR,
        LEFT_PAREN,
        RIGHT_PAREN
    }

    private static final Token LEFT = new Token(Kind.LEFT_PAREN, 0, '\0', null, null, false);
    private static final Token RIGHT = new Token(Kind.RIGHT_PAREN, 0, '\0', null, null, false);
    private static final Token ZERO = new Token(Kind.NUMBER, 0, '\0', null, null, false);
    private static final Token ONE = new Token(Kind.NUMBER, 1, '\0', null, null, false);

    private final Kind kind;
    private final int value;
    private final char name;
    private final Operator operator;
    private final Fixity fixity;
    private final boolean implicit;

    private Token(Kind kind, int value, char name, Operator operator, Fixity fixity, boolean implicit) {
        this.kind = kind;
        this.value = value;
        this.name = name;
        this.operator = operator;
        this.fixity = fixity;
        this.implicit = implicit;
    }

    public static Token number(int value) {
        if (value != 0 && value != 1) {
            throw new IllegalArgumentException("Only 0 and 1 are boolean literals, got " + value);
        }
        return value == 0 ? ZERO : ONE;
    }

    public static Token variable(char name) {
        char upper = Character.toUpperCase(name);
        if (upper < 'A' || upper > 'Z') {
            throw new IllegalArgumentException("Variables are single letters A-Z, got '" + name + "'");
        }
        return new Token(Kind.VARIABLE, 0, upper, null, null, false);
    }

    public static Token prefixNot() {
        return new Token(Kind.OPERATOR, 0, '\0', Operator.NOT, Fixity.PREFIX, false);
    }

    public static Token postfixNot() {
        return new Token(Kind.OPERATOR, 0, '\0', Operator.NOT, Fixity.POSTFIX, false);
    }

    public static Token binary(Operator operator) {
        if (operator.getArity() != 2) {
            throw new IllegalArgumentException(operator + " is not a binary operator");
        }
        return new Token(Kind.OPERATOR, 0, '\0', operator, Fixity.INFIX, false);
    }

    /** The AND spliced between juxtaposed operands, e.g. {@code AB}. */
    public static Token implicitAnd() {
        return new Token(Kind.OPERATOR, 0, '\0', Operator.AND, Fixity.INFIX, true);
    }

    public static Token leftParen() {
        return LEFT;
    }

    public static Token rightParen() {
        return RIGHT;
    }

    public Kind getKind() {
        return kind;
    }

    public int getValue() {
        return value;
    }

    public char getName() {
        return name;
    }

    public Operator getOperator() {
        return operator;
    }

    public Fixity getFixity() {
        return fixity;
    }

    public boolean isImplicit() {
        return implicit;
    }

    public boolean isOperator() {
        return kind == Kind.OPERATOR;
    }

    public boolean isPrefix() {
        return kind == Kind.OPERATOR && fixity == Fixity.PREFIX;
    }

    public boolean isPostfix() {
        return kind == Kind.OPERATOR && fixity == Fixity.POSTFIX;
    }

    /** Variables, numbers, closing parens and a trailing ' finish an operand. */
    public boolean endsOperand() {
        return kind == Kind.VARIABLE || kind == Kind.NUMBER || kind == Kind.RIGHT_PAREN || isPostfix();
    }

    /** Variables, numbers, opening parens and prefix NOT start one. */
    public boolean beginsOperand() {
        return kind == Kind.VARIABLE || kind == Kind.NUMBER || kind == Kind.LEFT_PAREN || isPrefix();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Token)) return false;
        Token token = (Token) o;
        return value == token.value && name == token.name && implicit == token.implicit
                && kind == token.kind && operator == token.operator && fixity == token.fixity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, name, operator, fixity, implicit);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBER:
                return String.valueOf(value);
            case VARIABLE:
                return String.valueOf(name);
            case LEFT_PAREN:
                return "(";
            case RIGHT_PAREN:
                return ")";
            default:
                return fixity == Fixity.POSTFIX ? "NOT'" : operator.name();
        }
    }
}
