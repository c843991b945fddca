package com.maxdemarzi.kmap.parser;

public class SyntaxException extends ExpressionException {

    private final int position;
    private final char character;

    public SyntaxException(int position, char character) {
        super("Unrecognized character '" + character + "' at position " + position);
        this.position = position;
        this.character = character;
    }

    /** Offset into the expression once whitespace has been removed. */
    public int getPosition() {
        return position;
    }

    public char getCharacter() {
        return character;
    }
}
