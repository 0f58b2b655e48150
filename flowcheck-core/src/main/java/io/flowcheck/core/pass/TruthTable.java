package io.flowcheck.core.pass;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Tag;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/// Bounded exhaustive check for tautologies and contradictions.
///
/// Boolean variables, relations and any other non-logical sub-tree are treated as
/// independent propositional atoms; relations are first normalised so that `x lt y`,
/// `y gt x` and `!(y le x)` share one atom. Enumerations contribute one choice per
/// class of members that no predicate in the formula distinguishes.
///
/// Treating dependent atoms as independent only adds assignments, so a formula found
/// constant here is constant for every real assignment.
final class TruthTable {

    private record Relation(Tag tag, Expr left, Expr right) {}

    private record Literal(Object atom, boolean positive) {}

    private final Map<Object, Integer> atoms = new LinkedHashMap<>();
    private final Map<EnumDomain, Set<Set<Object>>> enumSets = new LinkedHashMap<>();

    private TruthTable() {}

    /// Decides whether a formula is constant.
    ///
    /// @param expr boolean formula, not null
    /// @param atomLimit maximal number of binary choices to enumerate (`2^atomLimit` rows)
    /// @return the constant value, or empty if the formula is not constant or too large
    static Optional<Boolean> constantValue(Expr expr, int atomLimit) {
        TruthTable table = new TruthTable();
        table.collect(expr);
        return table.decide(expr, atomLimit);
    }

    private void collect(Expr expr) {
        if (expr instanceof Atom) {
            return;
        }
        if (expr instanceof EnumIn in) {
            enumSets.computeIfAbsent(in.domain(), d -> new LinkedHashSet<>()).add(in.satisfying());
            return;
        }
        Tag tag = expr.tag();
        if (tag == Tag.AND || tag == Tag.OR || tag == Tag.NOT) {
            expr.children().forEach(this::collect);
            return;
        }
        atoms.putIfAbsent(literal(expr).atom(), atoms.size());
    }

    private Optional<Boolean> decide(Expr expr, int atomLimit) {
        List<EnumDomain> domains = new ArrayList<>(enumSets.keySet());
        List<List<Object>> choices = new ArrayList<>();
        double rows = Math.pow(2, atoms.size());
        for (EnumDomain domain : domains) {
            List<Object> representatives = representatives(domain);
            choices.add(representatives);
            rows *= representatives.size();
        }
        if (rows > Math.pow(2, atomLimit)) {
            return Optional.empty();
        }
        boolean seenTrue = false;
        boolean seenFalse = false;
        int[] enumIndex = new int[domains.size()];
        long atomRows = 1L << atoms.size();
        do {
            Map<EnumDomain, Object> enumValues = new LinkedHashMap<>();
            for (int i = 0; i < domains.size(); i++) {
                enumValues.put(domains.get(i), choices.get(i).get(enumIndex[i]));
            }
            for (long bits = 0; bits < atomRows; bits++) {
                if (eval(expr, bits, enumValues)) {
                    seenTrue = true;
                } else {
                    seenFalse = true;
                }
                if (seenTrue && seenFalse) {
                    return Optional.empty();
                }
            }
        } while (advance(enumIndex, choices));
        return Optional.of(seenTrue);
    }

    private boolean eval(Expr expr, long bits, Map<EnumDomain, Object> enumValues) {
        if (expr instanceof Atom atom) {
            return atom.isTrue();
        }
        if (expr instanceof EnumIn in) {
            return in.satisfying().contains(enumValues.get(in.domain()));
        }
        switch (expr.tag()) {
            case AND:
                for (Expr child : expr.children()) {
                    if (!eval(child, bits, enumValues)) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (Expr child : expr.children()) {
                    if (eval(child, bits, enumValues)) {
                        return true;
                    }
                }
                return false;
            case NOT:
                return !eval(expr.children().get(0), bits, enumValues);
            default:
                Literal literal = literal(expr);
                boolean value = (bits >> atoms.get(literal.atom()) & 1L) == 1L;
                return value == literal.positive();
        }
    }

    private static Literal literal(Expr expr) {
        if (!expr.tag().isRelation()) {
            return new Literal(expr, true);
        }
        Expr left = expr.children().get(0);
        Expr right = expr.children().get(1);
        return switch (expr.tag()) {
            case EQ, NE -> {
                boolean swap = left.toString().compareTo(right.toString()) > 0;
                yield new Literal(
                        new Relation(Tag.EQ, swap ? right : left, swap ? left : right),
                        expr.tag() == Tag.EQ);
            }
            case LE -> new Literal(new Relation(Tag.LE, left, right), true);
            case GE -> new Literal(new Relation(Tag.LE, right, left), true);
            case LT -> new Literal(new Relation(Tag.LE, right, left), false);
            case GT -> new Literal(new Relation(Tag.LE, left, right), false);
            default -> throw new IllegalStateException("Not a relation: " + expr);
        };
    }

    private List<Object> representatives(EnumDomain domain) {
        List<Set<Object>> sets = new ArrayList<>(enumSets.get(domain));
        Map<List<Boolean>, Object> classes = new LinkedHashMap<>();
        for (Object member : domain.members()) {
            List<Boolean> signature = new ArrayList<>(sets.size());
            for (Set<Object> set : sets) {
                signature.add(set.contains(member));
            }
            classes.putIfAbsent(signature, member);
        }
        return new ArrayList<>(classes.values());
    }

    private static boolean advance(int[] index, List<List<Object>> choices) {
        for (int i = 0; i < index.length; i++) {
            if (++index[i] < choices.get(i).size()) {
                return true;
            }
            index[i] = 0;
        }
        return false;
    }
}
