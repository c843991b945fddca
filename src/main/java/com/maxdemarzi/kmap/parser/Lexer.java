package com.maxdemarzi.kmap.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns expression text into tokens.
 *
 * <pre>
 *   A..Z a..z   variable (upper cased)
 *   0 1         literal
 *   ! ~         prefix NOT
 *   '           postfix NOT, may repeat: A'' is A
 *   &amp; *         AND
 *   ^           XOR
 *   + |         OR
 *   ( )         grouping
 * </pre>
 *
 * Whitespace is dropped before scanning, so reported positions are offsets into
 * the stripped text.
 */
public final class Lexer {

    private Lexer() {}

    public static List<Token> tokenize(String text) {
        String src = text == null ? "" : text.replaceAll("\\s+", "");
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        while (i < src.length()) {
            char ch = src.charAt(i);
            if (ch == '0' || ch == '1') {
                tokens.add(Token.number(ch - '0'));
                i++;
            } else if ((ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z')) {
                tokens.add(Token.variable(ch));
                i = primes(src, i + 1, tokens);
            } else if (ch == '(') {
                tokens.add(Token.leftParen());
                i++;
            } else if (ch == ')') {
                tokens.add(Token.rightParen());
                i = primes(src, i + 1, tokens);
            } else if (ch == '!' || ch == '~') {
                tokens.add(Token.prefixNot());
                i++;
            } else if (ch == '&' || ch == '*') {
                tokens.add(Token.binary(Operator.AND));
                i++;
            } else if (ch == '^') {
                tokens.add(Token.binary(Operator.XOR));
                i++;
            } else if (ch == '+' || ch == '|') {
                tokens.add(Token.binary(Operator.OR));
                i++;
            } else {
                // includes a ' that does not follow an operand
                throw new SyntaxException(i, ch);
            }
        }
        return tokens;
    }

    // Consumes a run of ' starting at i; an odd run is a single NOT.
    private static int primes(String src, int i, List<Token> tokens) {
        int count = 0;
        while (i < src.length() && src.charAt(i) == '\'') {
            count++;
            i++;
        }
        if (count % 2 == 1) {
            tokens.add(Token.postfixNot());
        }
        return i;
    }
}
