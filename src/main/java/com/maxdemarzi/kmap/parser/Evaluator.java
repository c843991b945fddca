package com.maxdemarzi.kmap.parser;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Postfix stack machine over boolean tokens.
 */
public final class Evaluator {

    private Evaluator() {}

    /**
     * @param rpn         tokens in postfix order, as produced by {@link Parser#toRPN(List)}
     * @param environment variable name to value; every variable in {@code rpn} must be present
     * @return 1 or 0
     */
    public static int evaluate(List<Token> rpn, Map<String, Boolean> environment) {
        Deque<Boolean> stack = new ArrayDeque<>();
        for (Token t : rpn) {
            switch (t.getKind()) {
                case NUMBER:
                    stack.push(t.getValue() == 1);
                    break;
                case VARIABLE:
                    Boolean value = environment.get(String.valueOf(t.getName()));
                    if (value == null) {
                        throw new UndefinedVariableException(t.getName());
                    }
                    stack.push(value);
                    break;
                case OPERATOR:
                    Operator op = t.getOperator();
                    if (stack.size() < op.getArity()) {
                        throw new MalformedExpressionException("Operator " + op + " is missing an operand");
                    }
                    if (op == Operator.NOT) {
                        stack.push(!stack.pop());
                    } else {
                        boolean right = stack.pop();
                        boolean left = stack.pop();
                        stack.push(op.apply(left, right));
                    }
                    break;
                default:
                    throw new MalformedExpressionException("Parenthesis left in postfix expression");
            }
        }
        if (stack.size() != 1) {
            throw new MalformedExpressionException("Expression left " + stack.size() + " values on the stack");
        }
        return stack.pop() ? 1 : 0;
    }
}
