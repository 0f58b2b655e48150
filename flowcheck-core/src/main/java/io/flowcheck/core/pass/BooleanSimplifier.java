package io.flowcheck.core.pass;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.eval.MacroPass;
import io.flowcheck.core.expr.Atom;
import io.flowcheck.core.expr.EnumIn;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Exprs;
import io.flowcheck.core.expr.Kind;
import io.flowcheck.core.expr.Op;
import io.flowcheck.core.expr.Symbol;
import io.flowcheck.core.expr.Tag;
import io.flowcheck.core.ops.ConcreteOperators;
import io.flowcheck.core.ops.SymbolicOperators;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Simplifies boolean condition trees with first-class membership predicates.
///
/// Rules applied to every `and`/`or` node, bottom-up, until nothing changes:
/// - flattening of nested chains and constant reduction (`false` annihilates `and`,
///   `true` annihilates `or`, single operands collapse)
/// - duplicate removal and complement detection (`x or !x`, `x and !x`)
/// - merge of membership predicates over one enumeration: intersection under `and`,
///   union under `or`, so at most one predicate per enumeration survives
/// - absorption (`x or (x and y)`), including set inclusion between predicates
/// - context restriction: `x or (!x and y)` becomes `x or y`; a predicate `e in T` under
///   a sibling `e in S` is narrowed to `T\S` (under `or`) or `T∩S` (under `and`)
/// - resolution: `(a and x) or (a and !x)` becomes `a`, and `(a and e in S) or
///   (a and e in T)` becomes `a and e in S∪T`
/// - factoring of a shared operand, kept only when the tree shrinks
///
/// Relations between literals are evaluated, relations are oriented with the literal on
/// the right, negations are pushed to the leaves and arithmetic is canonicalised through
/// {@link SymbolicOperators}. Operands of commutative nodes are kept in a canonical order,
/// so operand order does not affect structural equality.
///
/// {@link #simplify(Expr)} additionally splits membership predicates along subsets of
/// sibling predicates when this exposes cancellations that strictly reduce the node
/// count, and folds tautologies and contradictions found by a bounded truth table.
///
/// ### Contracts
/// - **Precondition**: the tree is type checked, enumeration relations are resolved
/// - **Postcondition**: `simplify(simplify(x)).equals(simplify(x))`
///
/// @implNote Instances hold no mutable state and may be shared by concurrent workers.
public final class BooleanSimplifier extends MacroPass {

    private static final Logger logger = Logger.getLogger(BooleanSimplifier.class.getName());

    public static final int DEFAULT_TRUTH_TABLE_ATOM_LIMIT = 12;

    private static final int MAX_ROUNDS = 64;

    private static final Comparator<Expr> CANONICAL_ORDER =
            Comparator.comparing(Expr::toString)
                    .thenComparing(e -> e.tag().ordinal())
                    .thenComparing(e -> e instanceof Symbol s ? s.kind().ordinal() : -1);

    private final NegationNormalizer negation = new NegationNormalizer();
    private final int truthTableAtomLimit;

    public BooleanSimplifier() {
        this(DEFAULT_TRUTH_TABLE_ATOM_LIMIT);
    }

    /// @param truthTableAtomLimit binary choices the tautology check may enumerate;
    ///     `0` disables the check
    public BooleanSimplifier(int truthTableAtomLimit) {
        if (truthTableAtomLimit < 0 || truthTableAtomLimit > 30) {
            throw new IllegalArgumentException(
                    "truthTableAtomLimit must be within [0, 30]: " + truthTableAtomLimit);
        }
        this.truthTableAtomLimit = truthTableAtomLimit;
        on(Tag.ENUM_IN, (node, args) -> replace(((EnumIn) node).reduce()));
        on(Tag.NOT, (node, args) -> replace(simplifyNot(args.get(0))));
        on(Tag.AND, (node, args) -> replace(junction(Tag.AND, args.evaluated())));
        on(Tag.OR, (node, args) -> replace(junction(Tag.OR, args.evaluated())));
        on(Tag.RELATIONS, (node, args) -> replace(relation(node.tag(), args.get(0), args.get(1))));
        on(Tag.ARITHMETIC, (node, args) -> replace(arithmetic(node.tag(), args.evaluated())));
    }

    /// Simplifies a boolean expression to its canonical form.
    ///
    /// @param expr boolean expression, not null
    /// @return simplified expression, never null
    public Expr simplify(Expr expr) {
        Expr current = expr;
        int round = 0;
        while (true) {
            Expr next = splitSubsets(evaluate(current));
            if (next.equals(current)) {
                break;
            }
            current = next;
            if (++round >= MAX_ROUNDS) {
                logger.warning("Simplification did not converge after " + MAX_ROUNDS + " rounds: " + expr);
                break;
            }
        }
        if (truthTableAtomLimit > 0 && (current.tag() == Tag.AND || current.tag() == Tag.OR)) {
            Optional<Boolean> constant = TruthTable.constantValue(current, truthTableAtomLimit);
            if (constant.isPresent()) {
                logger.fine(() -> "Truth table folds to constant: " + expr);
                return Atom.of(constant.get().booleanValue());
            }
        }
        return current;
    }

    @Override
    public Expr apply(Expr expr) {
        return simplify(expr);
    }

    // --- negation and relations ---

    private Expr simplifyNot(Expr operand) {
        Expr negated = negation.negate(operand);
        return negated.tag() == Tag.NOT ? negated : evaluate(negated);
    }

    private Expr relation(Tag tag, Expr left, Expr right) {
        Optional<Expr> folded = ConstantFolder.foldRelation(tag, List.of(left, right));
        if (folded.isPresent()) {
            return folded.get();
        }
        if (left.equals(right)) {
            return Atom.of(tag == Tag.EQ || tag == Tag.LE || tag == Tag.GE);
        }
        if (left instanceof Atom && !(right instanceof Atom)) {
            return relation(tag.mirror(), right, left);
        }
        if (right instanceof Atom literal && literal.value() instanceof Boolean value) {
            // b == true, b != false
            return value == (tag == Tag.EQ) ? left : simplifyNot(left);
        }
        if ((tag == Tag.EQ || tag == Tag.NE)
                && !(right instanceof Atom)
                && CANONICAL_ORDER.compare(left, right) > 0) {
            return Op.of(tag, right, left);
        }
        return Op.of(tag, left, right);
    }

    // --- arithmetic ---

    private Expr arithmetic(Tag tag, List<Expr> operands) {
        Optional<Expr> folded = ConstantFolder.foldArithmetic(tag, operands);
        if (folded.isPresent()) {
            return folded.get();
        }
        if (operands.stream().anyMatch(BooleanSimplifier::isStringValued)) {
            return new Op(tag, operands);
        }
        Expr canonical = SymbolicOperators.INSTANCE.apply(tag, operands);
        if (canonical.tag() != Tag.ADD && canonical.tag() != Tag.MUL) {
            return canonical;
        }
        Tag chain = canonical.tag();
        Object neutral = chain == Tag.ADD ? 0L : 1L;
        Object accumulated = neutral;
        List<Expr> rest = new ArrayList<>();
        for (Expr operand : canonical.children()) {
            Expr literal = foldUnary(operand);
            if (literal instanceof Atom atom && atom.value() instanceof Number) {
                accumulated = ConcreteOperators.INSTANCE.apply(chain, List.of(accumulated, atom.value()));
            } else {
                rest.add(literal);
            }
        }
        double value = ((Number) accumulated).doubleValue();
        if (chain == Tag.MUL && value == 0.0) {
            return Atom.of(accumulated);
        }
        rest.sort(CANONICAL_ORDER);
        if (value != ((Number) neutral).doubleValue()) {
            rest.add(Atom.of(accumulated));
        }
        if (rest.isEmpty()) {
            return Atom.of(neutral);
        }
        return rest.size() == 1 ? rest.get(0) : new Op(chain, rest);
    }

    private static Expr foldUnary(Expr operand) {
        if (Tag.UNARY_ARITHMETIC.contains(operand.tag())) {
            return ConstantFolder.foldArithmetic(operand.tag(), operand.children()).orElse(operand);
        }
        return operand;
    }

    private static boolean isStringValued(Expr expr) {
        if (expr instanceof Atom atom) {
            return atom.kind() == Kind.STRING;
        }
        if (expr instanceof Symbol symbol) {
            return symbol.kind() == Kind.STRING;
        }
        return expr.tag() == Tag.ADD && expr.children().stream().anyMatch(BooleanSimplifier::isStringValued);
    }

    // --- junctions ---

    private Expr junction(Tag tag, List<Expr> children) {
        Atom annihilator = Atom.of(tag == Tag.OR);
        Atom identity = Atom.of(tag == Tag.AND);
        List<Expr> operands = new ArrayList<>(children);
        for (int round = 0; round < MAX_ROUNDS; round++) {
            operands = mergeEnums(tag, flatten(tag, operands));
            if (operands.contains(annihilator)) {
                return annihilator;
            }
            operands.removeIf(identity::equals);
            operands = sortedDistinct(operands);
            if (hasComplementaryPair(operands)) {
                return annihilator;
            }
            List<Expr> next = resolve(tag, restrict(tag, absorb(tag, operands)));
            if (next.equals(operands)) {
                break;
            }
            operands = next;
        }
        return factor(tag, Exprs.junction(tag, operands));
    }

    private static List<Expr> flatten(Tag tag, List<Expr> operands) {
        List<Expr> result = new ArrayList<>(operands.size());
        for (Expr operand : operands) {
            result.addAll(Exprs.operands(operand, tag));
        }
        return result;
    }

    private static List<Expr> sortedDistinct(List<Expr> operands) {
        List<Expr> result = new ArrayList<>(new LinkedHashSet<>(operands));
        result.sort(CANONICAL_ORDER);
        return result;
    }

    private static List<Expr> mergeEnums(Tag tag, List<Expr> operands) {
        Map<EnumDomain, Set<Object>> merged = new LinkedHashMap<>();
        for (Expr operand : operands) {
            if (operand instanceof EnumIn in) {
                merged.merge(in.domain(), in.satisfying(), (a, b) -> combine(tag, a, b));
            }
        }
        if (merged.isEmpty()) {
            return operands;
        }
        List<Expr> result = new ArrayList<>(operands.size());
        Set<EnumDomain> emitted = new HashSet<>();
        for (Expr operand : operands) {
            if (!(operand instanceof EnumIn in)) {
                result.add(operand);
            } else if (emitted.add(in.domain())) {
                result.add(new EnumIn(in.domain(), merged.get(in.domain()), true).reduce());
            }
        }
        return result;
    }

    private static Set<Object> combine(Tag tag, Set<Object> a, Set<Object> b) {
        Set<Object> result = new LinkedHashSet<>(a);
        if (tag == Tag.AND) {
            result.retainAll(b);
        } else {
            result.addAll(b);
        }
        return result;
    }

    private boolean hasComplementaryPair(List<Expr> operands) {
        Set<Expr> present = new HashSet<>(operands);
        for (Expr operand : operands) {
            if (present.contains(complement(operand))) {
                return true;
            }
        }
        return false;
    }

    /// Drops every operand implied (under `or`) or implying (under `and`) a sibling.
    private static List<Expr> absorb(Tag tag, List<Expr> operands) {
        List<Expr> result = new ArrayList<>(operands);
        for (int i = 0; i < result.size(); i++) {
            for (int j = 0; j < result.size(); j++) {
                if (i != j && absorbs(tag, result.get(j), result.get(i))) {
                    result.remove(i--);
                    break;
                }
            }
        }
        return result;
    }

    private static boolean absorbs(Tag tag, Expr keeper, Expr candidate) {
        Tag dual = dual(tag);
        List<Expr> keeperParts = Exprs.operands(keeper, dual);
        List<Expr> candidateParts = Exprs.operands(candidate, dual);
        for (Expr keeperPart : keeperParts) {
            boolean covered = false;
            for (Expr candidatePart : candidateParts) {
                if (tag == Tag.OR ? implies(candidatePart, keeperPart) : implies(keeperPart, candidatePart)) {
                    covered = true;
                    break;
                }
            }
            if (!covered) {
                return false;
            }
        }
        return true;
    }

    private static boolean implies(Expr premise, Expr conclusion) {
        if (premise.equals(conclusion)) {
            return true;
        }
        return premise instanceof EnumIn p
                && conclusion instanceof EnumIn c
                && p.domain().equals(c.domain())
                && c.satisfying().containsAll(p.satisfying());
    }

    private List<Expr> restrict(Tag tag, List<Expr> operands) {
        Tag dual = dual(tag);
        List<Expr> context = operands.stream().filter(e -> e.tag() != dual).collect(Collectors.toList());
        if (context.isEmpty()) {
            return operands;
        }
        List<Expr> result = new ArrayList<>(operands.size());
        for (Expr operand : operands) {
            if (operand.tag() != dual) {
                result.add(operand);
                continue;
            }
            List<Expr> parts = new ArrayList<>();
            boolean changed = false;
            for (Expr part : operand.children()) {
                Expr restricted = restrictPart(tag, part, context);
                changed |= !restricted.equals(part);
                parts.add(restricted);
            }
            result.add(changed ? evaluate(Exprs.junction(dual, parts)) : operand);
        }
        return result;
    }

    private Expr restrictPart(Tag tag, Expr part, List<Expr> context) {
        Expr current = part;
        for (Expr sibling : context) {
            if (current.equals(complement(sibling))) {
                return Atom.of(dual(tag) == Tag.AND);
            }
            if (current instanceof EnumIn in
                    && sibling instanceof EnumIn other
                    && in.domain().equals(other.domain())) {
                Set<Object> narrowed = new LinkedHashSet<>(in.satisfying());
                if (tag == Tag.OR) {
                    narrowed.removeAll(other.satisfying());
                } else {
                    narrowed.retainAll(other.satisfying());
                }
                current = new EnumIn(in.domain(), narrowed, true).reduce();
                if (current instanceof Atom) {
                    return current;
                }
            }
        }
        return current;
    }

    private List<Expr> resolve(Tag tag, List<Expr> operands) {
        Tag dual = dual(tag);
        for (int i = 0; i < operands.size(); i++) {
            List<Expr> first = Exprs.operands(operands.get(i), dual);
            for (int j = i + 1; j < operands.size(); j++) {
                List<Expr> second = Exprs.operands(operands.get(j), dual);
                if (first.size() != second.size()) {
                    continue;
                }
                List<Expr> onlyFirst = minus(first, second);
                List<Expr> onlySecond = minus(second, first);
                if (onlyFirst.size() != 1 || onlySecond.size() != 1) {
                    continue;
                }
                Expr merged = mergeLiterals(tag, onlyFirst.get(0), onlySecond.get(0));
                if (merged == null) {
                    continue;
                }
                List<Expr> common = minus(first, onlyFirst);
                common.add(merged);
                List<Expr> result = new ArrayList<>(operands);
                result.set(i, evaluate(Exprs.junction(dual, common)));
                result.remove(j);
                return result;
            }
        }
        return operands;
    }

    // null when the literals do not merge
    private Expr mergeLiterals(Tag tag, Expr p, Expr q) {
        if (q.equals(complement(p))) {
            return Atom.of(dual(tag) == Tag.AND);
        }
        if (p instanceof EnumIn a && q instanceof EnumIn b && a.domain().equals(b.domain())) {
            return new EnumIn(a.domain(), combine(tag, a.satisfying(), b.satisfying()), true).reduce();
        }
        return null;
    }

    /// Pulls an operand shared by several dual junctions out of them, keeping the result
    /// only if it has fewer nodes.
    private Expr factor(Tag tag, Expr expr) {
        if (expr.tag() != tag) {
            return expr;
        }
        Tag dual = dual(tag);
        List<Expr> operands = expr.children();
        Map<Expr, List<Integer>> holders = new LinkedHashMap<>();
        for (int i = 0; i < operands.size(); i++) {
            for (Expr part : Exprs.operands(operands.get(i), dual)) {
                holders.computeIfAbsent(part, k -> new ArrayList<>()).add(i);
            }
        }
        int size = Exprs.size(expr);
        for (Map.Entry<Expr, List<Integer>> entry : holders.entrySet()) {
            List<Integer> owners = entry.getValue();
            if (owners.size() < 2 || !(operands.get(owners.get(0)).tag() == dual)) {
                continue;
            }
            Expr shared = entry.getKey();
            List<Expr> rests = new ArrayList<>();
            List<Expr> others = new ArrayList<>();
            for (int i = 0; i < operands.size(); i++) {
                if (owners.contains(i)) {
                    List<Expr> rest = new ArrayList<>(Exprs.operands(operands.get(i), dual));
                    rest.remove(shared);
                    rests.add(Exprs.junction(dual, rest));
                } else {
                    others.add(operands.get(i));
                }
            }
            others.add(evaluate(Exprs.junction(dual, List.of(shared, Exprs.junction(tag, rests)))));
            Expr candidate = junction(tag, others);
            if (Exprs.size(candidate) < size) {
                return candidate;
            }
        }
        return expr;
    }

    // --- subset splitting ---

    private Expr splitSubsets(Expr expr) {
        if (expr.tag() != Tag.AND && expr.tag() != Tag.OR) {
            return expr;
        }
        List<Expr> children = expr.children().stream().map(this::splitSubsets).collect(Collectors.toList());
        Expr current = children.equals(expr.children()) ? expr : evaluate(expr.withChildren(children));
        boolean improved = true;
        while (improved && (current.tag() == Tag.AND || current.tag() == Tag.OR)) {
            improved = false;
            int size = Exprs.size(current);
            for (List<Expr> candidate : splitCandidates(current.tag(), current.children())) {
                Expr simplified = evaluate(Exprs.junction(current.tag(), candidate));
                if (Exprs.size(simplified) < size) {
                    logger.fine(() -> "Subset split shrinks " + expr);
                    current = simplified;
                    improved = true;
                    break;
                }
            }
        }
        return current;
    }

    /// Rewrites one predicate `e in S1` as the two cases `S2` and `S1\S2` of a sibling
    /// predicate `e in S2` (dually for conjunctions), producing one candidate per pair.
    private List<List<Expr>> splitCandidates(Tag tag, List<Expr> operands) {
        Tag dual = dual(tag);
        List<List<Expr>> candidates = new ArrayList<>();
        for (int i = 0; i < operands.size(); i++) {
            List<Expr> parts = Exprs.operands(operands.get(i), dual);
            for (Expr part : parts) {
                if (!(part instanceof EnumIn split)) {
                    continue;
                }
                for (int j = 0; j < operands.size(); j++) {
                    if (i == j) {
                        continue;
                    }
                    for (Expr other : Exprs.operands(operands.get(j), dual)) {
                        if (!(other instanceof EnumIn pivot) || !pivot.domain().equals(split.domain())) {
                            continue;
                        }
                        Set<Object> s1 = split.satisfying();
                        Set<Object> s2 = pivot.satisfying();
                        boolean applies = tag == Tag.OR
                                ? s1.containsAll(s2) && s1.size() > s2.size()
                                : s2.containsAll(s1) && s2.size() > s1.size();
                        if (!applies) {
                            continue;
                        }
                        Set<Object> remainder = new LinkedHashSet<>(tag == Tag.OR ? s1 : s2);
                        remainder.removeAll(tag == Tag.OR ? s2 : s1);
                        Set<Object> second = tag == Tag.OR
                                ? remainder
                                : split.domain().complement(remainder);
                        List<Expr> candidate = new ArrayList<>(operands);
                        candidate.set(i, replacePart(dual, parts, part, pivot));
                        candidate.add(i + 1, replacePart(dual, parts, part,
                                new EnumIn(split.domain(), second, true).reduce()));
                        candidates.add(candidate);
                    }
                }
            }
        }
        return candidates;
    }

    private Expr replacePart(Tag dual, List<Expr> parts, Expr part, Expr replacement) {
        List<Expr> replaced = new ArrayList<>(parts);
        replaced.set(replaced.indexOf(part), replacement);
        return evaluate(Exprs.junction(dual, replaced));
    }

    // --- helpers ---

    private Expr complement(Expr expr) {
        return canonical(negation.negate(expr));
    }

    private static Expr canonical(Expr expr) {
        if (expr.tag() != Tag.AND && expr.tag() != Tag.OR) {
            return expr;
        }
        List<Expr> children = expr.children().stream().map(BooleanSimplifier::canonical).collect(Collectors.toList());
        return Exprs.junction(expr.tag(), sortedDistinct(flatten(expr.tag(), children)));
    }

    private static List<Expr> minus(List<Expr> from, List<Expr> remove) {
        List<Expr> result = new ArrayList<>(from);
        result.removeAll(remove);
        return result;
    }

    private static Tag dual(Tag tag) {
        return tag == Tag.AND ? Tag.OR : Tag.AND;
    }
}
