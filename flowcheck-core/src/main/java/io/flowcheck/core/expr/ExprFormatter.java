package io.flowcheck.core.expr;

import java.util.stream.Collectors;

/// Renders expressions as infix text in the condition language.
///
/// Operands are parenthesised whenever their operator binds no tighter than the parent,
/// so the output of {@link #format(Expr)} for a tree without membership predicates
/// parses back into an equal tree.
final class ExprFormatter {

    private ExprFormatter() {}

    static String format(Expr expr) {
        if (expr instanceof Atom atom) {
            return formatLiteral(atom.value());
        }
        if (expr instanceof Symbol symbol) {
            return symbol.name();
        }
        if (expr instanceof Lookup lookup) {
            return String.join(".", lookup.path());
        }
        if (expr instanceof Ref ref) {
            return "<" + ref.value().getClass().getSimpleName() + ">";
        }
        if (expr instanceof Call call) {
            return format(call.function())
                    + call.args().stream().map(ExprFormatter::format)
                            .collect(Collectors.joining(", ", "(", ")"));
        }
        if (expr instanceof EnumIn in) {
            return in.domain().name()
                    + (in.positive() ? " in " : " not in ")
                    + in.members().stream().map(ExprFormatter::formatLiteral)
                            .collect(Collectors.joining(", ", "{", "}"));
        }
        Op op = (Op) expr;
        Tag tag = op.operator();
        return switch (tag) {
            case NOT -> "!" + operand(op.arg(0), tag);
            case NEG -> "-" + operand(op.arg(0), tag);
            case POS -> "+" + operand(op.arg(0), tag);
            case INV -> "1 / " + operand(op.arg(0), tag);
            default -> op.args().stream()
                    .map(arg -> operand(arg, tag))
                    .collect(Collectors.joining(" " + tag.symbol() + " "));
        };
    }

    private static String operand(Expr child, Tag parent) {
        String text = format(child);
        if (child instanceof Op op && precedence(op.operator()) <= precedence(parent)) {
            return "(" + text + ")";
        }
        if (child instanceof EnumIn && precedence(parent) >= precedence(Tag.EQ)) {
            return "(" + text + ")";
        }
        return text;
    }

    private static int precedence(Tag tag) {
        return switch (tag) {
            case OR -> 1;
            case AND -> 2;
            case EQ, NE, LT, LE, GT, GE -> 3;
            case ADD, SUB -> 4;
            case MUL, DIV -> 5;
            case NOT, NEG, POS, INV -> 6;
            default -> 7;
        };
    }

    private static String formatLiteral(Object value) {
        if (value instanceof String s) {
            return "'" + s.replace("'", "\\'") + "'";
        }
        return String.valueOf(value);
    }
}
