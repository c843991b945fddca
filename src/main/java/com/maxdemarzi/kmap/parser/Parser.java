package com.maxdemarzi.kmap.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Shunting-yard conversion of infix tokens to postfix (RPN), with an AND inserted
 * wherever two operands sit next to each other.
 */
public final class Parser {

    private Parser() {}

    public static List<Token> parse(String text) {
        return toRPN(Lexer.tokenize(text));
    }

    public static List<Token> toRPN(List<Token> tokens) {
        List<Token> output = new ArrayList<>();
        Deque<Token> stack = new ArrayDeque<>();

        for (Token t : withImplicitAnd(tokens)) {
            switch (t.getKind()) {
                case NUMBER:
                case VARIABLE:
                    output.add(t);
                    break;
                case LEFT_PAREN:
                    stack.push(t);
                    break;
                case RIGHT_PAREN:
                    while (!stack.isEmpty() && stack.peek().getKind() != Token.Kind.LEFT_PAREN) {
                        output.add(stack.pop());
                    }
                    if (stack.isEmpty()) {
                        throw new UnbalancedParenException();
                    }
                    stack.pop();
                    break;
                case OPERATOR:
                    if (t.isPostfix()) {
                        output.add(t);
                    } else if (t.isPrefix()) {
                        stack.push(t);
                    } else {
                        while (!stack.isEmpty() && stack.peek().isOperator() && outranks(stack.peek(), t)) {
                            output.add(stack.pop());
                        }
                        stack.push(t);
                    }
                    break;
                default:
                    throw new IllegalStateException("Unknown token " + t);
            }
        }

        while (!stack.isEmpty()) {
            Token t = stack.pop();
            if (!t.isOperator()) {
                throw new UnbalancedParenException();
            }
            output.add(t);
        }
        return output;
    }

    static List<Token> withImplicitAnd(List<Token> tokens) {
        List<Token> result = new ArrayList<>(tokens.size() * 2);
        for (int i = 0; i < tokens.size(); i++) {
            Token a = tokens.get(i);
            result.add(a);
            if (i + 1 < tokens.size() && a.endsOperand() && tokens.get(i + 1).beginsOperand()) {
                result.add(Token.implicitAnd());
            }
        }
        return result;
    }

    private static boolean outranks(Token top, Token incoming) {
        int a = top.getOperator().getPrecedence();
        int b = incoming.getOperator().getPrecedence();
        return a > b || (a == b && incoming.getOperator().isLeftAssociative());
    }
}
