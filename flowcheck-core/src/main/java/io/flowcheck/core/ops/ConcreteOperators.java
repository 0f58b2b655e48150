package io.flowcheck.core.ops;

import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.exception.TypeMismatchException;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Tag;
import java.util.List;

/// Operator table evaluating literal values.
///
/// Numbers are `Long` or `Double`; integer arithmetic stays integral unless a division
/// is inexact. `+` over strings concatenates. Relations compare numbers numerically,
/// strings lexicographically and booleans for equality only.
///
/// Stateless singleton.
public final class ConcreteOperators implements OperatorTable<Object> {

    public static final ConcreteOperators INSTANCE = new ConcreteOperators();

    private ConcreteOperators() {}

    @Override
    public Object apply(Tag operator, List<Object> operands) {
        return switch (operator) {
            case AND -> operands.stream().allMatch(o -> bool(o, operator));
            case OR -> operands.stream().anyMatch(o -> bool(o, operator));
            case NOT -> !bool(operands.get(0), operator);
            case ADD -> add(operands);
            case SUB, MUL, DIV -> fold(operator, operands);
            case NEG -> negate(number(operands.get(0), operator));
            case POS -> number(operands.get(0), operator);
            case INV -> divide(1L, number(operands.get(0), operator));
            case EQ, NE, LT, LE, GT, GE -> compare(operator, operands.get(0), operands.get(1));
            default -> throw new IllegalArgumentException(operator + " is not an operator");
        };
    }

    private Object add(List<Object> operands) {
        if (operands.stream().allMatch(String.class::isInstance)) {
            StringBuilder sb = new StringBuilder();
            operands.forEach(sb::append);
            return sb.toString();
        }
        return fold(Tag.ADD, operands);
    }

    private Number fold(Tag operator, List<Object> operands) {
        Number result = number(operands.get(0), operator);
        for (Object operand : operands.subList(1, operands.size())) {
            Number next = number(operand, operator);
            result = switch (operator) {
                case ADD -> arithmetic(result, next, Math::addExact, Double::sum);
                case SUB -> arithmetic(result, next, Math::subtractExact, (a, b) -> a - b);
                case MUL -> arithmetic(result, next, Math::multiplyExact, (a, b) -> a * b);
                case DIV -> divide(result, next);
                default -> throw new IllegalArgumentException(operator + " does not fold");
            };
        }
        return result;
    }

    private interface LongOp {
        long apply(long a, long b);
    }

    private interface DoubleOp {
        double apply(double a, double b);
    }

    private static Number arithmetic(Number a, Number b, LongOp longOp, DoubleOp doubleOp) {
        if (a instanceof Long x && b instanceof Long y) {
            try {
                return longOp.apply(x, y);
            } catch (ArithmeticException e) {
                return doubleOp.apply(x, y);
            }
        }
        return doubleOp.apply(a.doubleValue(), b.doubleValue());
    }

    private static Number divide(Number a, Number b) {
        if (b.doubleValue() == 0.0) {
            throw new SemanticException("Division by zero: " + a + " / " + b);
        }
        if (a instanceof Long x && b instanceof Long y && x % y == 0
                && !(x == Long.MIN_VALUE && y == -1)) {
            return x / y;
        }
        return a.doubleValue() / b.doubleValue();
    }

    private static Number negate(Number n) {
        if (n instanceof Long l) {
            try {
                return Math.negateExact(l);
            } catch (ArithmeticException e) {
                return -l.doubleValue();
            }
        }
        return -n.doubleValue();
    }

    private static boolean compare(Tag operator, Object left, Object right) {
        Kind leftKind = Kind.of(left);
        Kind rightKind = Kind.of(right);
        if (leftKind != rightKind) {
            throw new TypeMismatchException(
                    "Cannot compare " + leftKind.label() + " with " + rightKind.label()
                            + " using '" + operator.symbol() + "'");
        }
        int cmp;
        if (leftKind == Kind.NUMBER) {
            cmp = compareNumbers((Number) left, (Number) right);
        } else if (leftKind == Kind.STRING) {
            cmp = ((String) left).compareTo((String) right);
        } else if (operator == Tag.EQ || operator == Tag.NE) {
            cmp = left.equals(right) ? 0 : 1;
        } else {
            throw new TypeMismatchException("Booleans cannot be ordered with '" + operator.symbol() + "'");
        }
        return switch (operator) {
            case EQ -> cmp == 0;
            case NE -> cmp != 0;
            case LT -> cmp < 0;
            case LE -> cmp <= 0;
            case GT -> cmp > 0;
            case GE -> cmp >= 0;
            default -> throw new IllegalArgumentException(operator + " is not a relation");
        };
    }

    private static int compareNumbers(Number a, Number b) {
        if (a instanceof Long x && b instanceof Long y) {
            return Long.compare(x, y);
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static boolean bool(Object value, Tag operator) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new TypeMismatchException(
                "Operator '" + operator.symbol() + "' expects boolean, got " + Kind.of(value).label());
    }

    private static Number number(Object value, Tag operator) {
        if (value instanceof Number n) {
            return n;
        }
        throw new TypeMismatchException(
                "Operator '" + operator.symbol() + "' expects number, got " + Kind.of(value).label());
    }
}
