package io.flowcheck.core.expr;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Dispatch key of an expression node.
///
/// Structural tags identify the non-operator variants ({@link Atom}, {@link Symbol},
/// {@link EnumIn}, {@link Lookup}, {@link Call}, {@link Ref}); operator tags identify the
/// operator of an {@link Op}. Evaluator handlers are registered against tags.
///
/// ### Operator categories
/// - **Equality**: `==`, `!=`
/// - **Inequation**: `lt`, `le`, `gt`, `ge`
/// - **Logic**: `and`, `or` (n-ary), `not` (unary)
/// - **Arithmetic**: `+`, `-`, `*`, `/` (n-ary), `neg`, `pos`, `inv` (unary)
public enum Tag {
    ATOM(Category.STRUCTURE, "atom", 0),
    SYMBOL(Category.STRUCTURE, "symbol", 0),
    ENUM_IN(Category.STRUCTURE, "in", 0),
    LOOKUP(Category.STRUCTURE, "lookup", 0),
    CALL(Category.STRUCTURE, "call", 0),
    REF(Category.STRUCTURE, "ref", 0),

    EQ(Category.EQUALITY, "==", 2),
    NE(Category.EQUALITY, "!=", 2),
    LT(Category.INEQUATION, "lt", 2),
    LE(Category.INEQUATION, "le", 2),
    GT(Category.INEQUATION, "gt", 2),
    GE(Category.INEQUATION, "ge", 2),

    AND(Category.LOGIC, "and", -1),
    OR(Category.LOGIC, "or", -1),
    NOT(Category.LOGIC, "not", 1),

    ADD(Category.ARITHMETIC, "+", -1),
    SUB(Category.ARITHMETIC, "-", -1),
    MUL(Category.ARITHMETIC, "*", -1),
    DIV(Category.ARITHMETIC, "/", -1),
    NEG(Category.ARITHMETIC, "neg", 1),
    POS(Category.ARITHMETIC, "pos", 1),
    INV(Category.ARITHMETIC, "inv", 1);

    /// Operator families used for signature checks and handler registration.
    public enum Category {
        STRUCTURE,
        EQUALITY,
        INEQUATION,
        LOGIC,
        ARITHMETIC
    }

    public static final Set<Tag> RELATIONS = EnumSet.of(EQ, NE, LT, LE, GT, GE);
    public static final Set<Tag> INEQUATIONS = EnumSet.of(LT, LE, GT, GE);
    public static final Set<Tag> BINARY_ARITHMETIC = EnumSet.of(ADD, SUB, MUL, DIV);
    public static final Set<Tag> UNARY_ARITHMETIC = EnumSet.of(NEG, POS, INV);
    public static final Set<Tag> ARITHMETIC = EnumSet.of(ADD, SUB, MUL, DIV, NEG, POS, INV);
    public static final Set<Tag> JUNCTIONS = EnumSet.of(AND, OR);

    private static final Map<String, Tag> BY_SYMBOL =
            Arrays.stream(values())
                    .filter(Tag::isOperator)
                    .collect(Collectors.toUnmodifiableMap(Tag::symbol, Function.identity()));

    private final Category category;
    private final String symbol;
    private final int arity;

    Tag(Category category, String symbol, int arity) {
        this.category = category;
        this.symbol = symbol;
        this.arity = arity;
    }

    public Category category() {
        return category;
    }

    /// Returns the token of this tag in the condition language.
    ///
    /// @return operator token (`"=="`, `"and"`, `"+"`, ...) or structural name, never null
    public String symbol() {
        return symbol;
    }

    /// Returns the fixed arity, or `-1` for variable-arity operators.
    ///
    /// @return arity of the operator, `0` for structural tags
    public int arity() {
        return arity;
    }

    public boolean isOperator() {
        return category != Category.STRUCTURE;
    }

    public boolean isRelation() {
        return category == Category.EQUALITY || category == Category.INEQUATION;
    }

    public boolean isVariadic() {
        return arity < 0;
    }

    /// Returns the relation that holds exactly when this one does not
    /// (`==`/`!=`, `lt`/`ge`, `le`/`gt`).
    ///
    /// @return complementary relation, never null
    /// @throws IllegalStateException if this tag is not a relation
    public Tag complement() {
        return switch (this) {
            case EQ -> NE;
            case NE -> EQ;
            case LT -> GE;
            case GE -> LT;
            case LE -> GT;
            case GT -> LE;
            default -> throw new IllegalStateException(this + " has no complement");
        };
    }

    /// Returns the relation equivalent to this one with swapped operands
    /// (`a lt b` is `b gt a`).
    ///
    /// @return mirrored relation, never null
    /// @throws IllegalStateException if this tag is not a relation
    public Tag mirror() {
        return switch (this) {
            case EQ, NE -> this;
            case LT -> GT;
            case GT -> LT;
            case LE -> GE;
            case GE -> LE;
            default -> throw new IllegalStateException(this + " has no mirror");
        };
    }

    /// Looks up an operator tag by its condition-language token.
    ///
    /// @param symbol operator token, not null
    /// @return the tag, or empty if no operator uses this token
    public static Optional<Tag> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}
