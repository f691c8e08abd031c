package org.dxworks.blockgrid.evaluator;

import org.dxworks.blockgrid.model.Operator;

import java.util.Objects;

/**
 * Operator semantics over the three runtime value types: Integer, String and Boolean.
 */
final class Values {

    private Values() {
    }

    static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Integer number) {
            return number != 0;
        }
        if (value instanceof String text) {
            return !text.isEmpty();
        }
        return true;
    }

    static Object apply(Operator operator, Object left, Object right) {
        return switch (operator) {
            case EQUALS -> Objects.equals(left, right);
            case NOT_EQUALS -> !Objects.equals(left, right);
            case LESS -> ordered(left, right) && compare(left, right) < 0;
            case GREATER -> ordered(left, right) && compare(left, right) > 0;
            case LESS_EQUAL -> ordered(left, right) && compare(left, right) <= 0;
            case GREATER_EQUAL -> ordered(left, right) && compare(left, right) >= 0;
            case ADD -> add(left, right);
            case SUBTRACT, MULTIPLY, DIVIDE, MODULO -> arithmetic(operator, left, right);
            default -> throw new EvaluationException("Unknown binary operator: " + operator);
        };
    }

    private static Object add(Object left, Object right) {
        if (left instanceof Integer a && right instanceof Integer b) {
            return a + b;
        }
        if (left instanceof String || right instanceof String) {
            return String.valueOf(left) + right;
        }
        throw unsupported(Operator.ADD, left, right);
    }

    // ordering is only defined between two numbers or two strings
    private static boolean ordered(Object left, Object right) {
        return (left instanceof Integer && right instanceof Integer)
                || (left instanceof String && right instanceof String);
    }

    private static int compare(Object left, Object right) {
        if (left instanceof Integer a && right instanceof Integer b) {
            return Integer.compare(a, b);
        }
        return ((String) left).compareTo((String) right);
    }

    private static int arithmetic(Operator operator, Object left, Object right) {
        if (left instanceof Integer a && right instanceof Integer b) {
            return switch (operator) {
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> a / divisor(b);
                case MODULO -> a % divisor(b);
                default -> throw new EvaluationException("Unknown arithmetic operator: " + operator);
            };
        }
        throw unsupported(operator, left, right);
    }

    private static int divisor(int value) {
        if (value == 0) {
            throw new EvaluationException("Division by zero");
        }
        return value;
    }

    private static EvaluationException unsupported(Operator operator, Object left, Object right) {
        return new EvaluationException("Unsupported operands for " + operator + ": "
                + describe(left) + ", " + describe(right));
    }

    static String describe(Object value) {
        if (value instanceof String) {
            return "\"" + value + "\"";
        }
        return String.valueOf(value);
    }
}
