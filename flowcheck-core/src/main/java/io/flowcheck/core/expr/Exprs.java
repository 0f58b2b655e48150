package io.flowcheck.core.expr;

import io.flowcheck.core.domain.EnumDomain;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// Construction and inspection helpers for expression trees.
public final class Exprs {

    private Exprs() {}

    public static Expr and(Expr... args) {
        return junction(Tag.AND, List.of(args));
    }

    public static Expr or(Expr... args) {
        return junction(Tag.OR, List.of(args));
    }

    /// Builds an `and`/`or` node, collapsing degenerate operand counts.
    ///
    /// An empty operand list yields the neutral element (`true` for `and`, `false` for
    /// `or`); a single operand is returned unchanged.
    ///
    /// @param tag {@link Tag#AND} or {@link Tag#OR}
    /// @param args operands, not null
    /// @return junction expression, never null
    public static Expr junction(Tag tag, List<Expr> args) {
        if (!Tag.JUNCTIONS.contains(tag)) {
            throw new IllegalArgumentException(tag + " is not a junction");
        }
        if (args.isEmpty()) {
            return Atom.of(tag == Tag.AND);
        }
        if (args.size() == 1) {
            return args.get(0);
        }
        return new Op(tag, args);
    }

    public static Expr not(Expr arg) {
        return Op.of(Tag.NOT, arg);
    }

    public static Expr eq(Expr left, Expr right) {
        return Op.of(Tag.EQ, left, right);
    }

    public static Expr ne(Expr left, Expr right) {
        return Op.of(Tag.NE, left, right);
    }

    public static Expr lt(Expr left, Expr right) {
        return Op.of(Tag.LT, left, right);
    }

    public static Expr le(Expr left, Expr right) {
        return Op.of(Tag.LE, left, right);
    }

    public static Expr gt(Expr left, Expr right) {
        return Op.of(Tag.GT, left, right);
    }

    public static Expr ge(Expr left, Expr right) {
        return Op.of(Tag.GE, left, right);
    }

    public static Expr add(Expr... args) {
        return new Op(Tag.ADD, List.of(args));
    }

    public static Expr mul(Expr... args) {
        return new Op(Tag.MUL, List.of(args));
    }

    public static Expr neg(Expr arg) {
        return Op.of(Tag.NEG, arg);
    }

    public static Symbol number(String name) {
        return new Symbol(name, Kind.NUMBER);
    }

    public static Symbol string(String name) {
        return new Symbol(name, Kind.STRING);
    }

    public static Symbol bool(String name) {
        return new Symbol(name, Kind.BOOLEAN);
    }

    public static Atom literal(Object value) {
        return Atom.of(value);
    }

    /// Returns the operands of `expr` seen as a `tag` chain.
    ///
    /// @param expr expression, not null
    /// @param tag junction or associative operator
    /// @return children when `expr` is a `tag` node, otherwise the singleton `[expr]`
    public static List<Expr> operands(Expr expr, Tag tag) {
        return expr.tag() == tag ? expr.children() : List.of(expr);
    }

    /// Counts the nodes of a tree. Used as the cost metric of rewrites that must
    /// strictly shrink an expression.
    ///
    /// @param expr expression, not null
    /// @return number of nodes, at least 1
    public static int size(Expr expr) {
        int size = 1;
        for (Expr child : expr.children()) {
            size += size(child);
        }
        return size;
    }

    /// Collects every enumeration referenced by a membership predicate in the tree.
    ///
    /// @param expr expression, not null
    /// @return domains in first-occurrence order, never null
    public static Set<EnumDomain> domains(Expr expr) {
        Set<EnumDomain> domains = new LinkedHashSet<>();
        collectDomains(expr, domains);
        return domains;
    }

    private static void collectDomains(Expr expr, Set<EnumDomain> sink) {
        if (expr instanceof EnumIn in) {
            sink.add(in.domain());
        }
        expr.children().forEach(child -> collectDomains(child, sink));
    }

    /// Returns whether the tree contains any of the given nodes.
    ///
    /// @param expr expression, not null
    /// @param nodes nodes to look for
    /// @return `true` if some sub-tree equals one of `nodes`
    public static boolean containsAny(Expr expr, Expr... nodes) {
        if (Arrays.asList(nodes).contains(expr)) {
            return true;
        }
        for (Expr child : expr.children()) {
            if (containsAny(child, nodes)) {
                return true;
            }
        }
        return false;
    }
}
