package io.flowcheck.core.ops;

import io.flowcheck.core.expr.Tag;
import java.util.List;

/// Interpretation of the condition operators over a value type.
///
/// Subtraction and division are defined as left folds over the n-ary base operators:
/// `a - b - c` means `a + (-b) + (-c)` and `a / b / c` means `a * b⁻¹ * c⁻¹`.
///
/// @param <V> value type the operators act on
/// @see SymbolicOperators for the expression-building interpretation
/// @see ConcreteOperators for the literal-evaluating interpretation
public interface OperatorTable<V> {

    /// Applies an operator.
    ///
    /// @param operator operator tag, must satisfy {@link Tag#isOperator()}
    /// @param operands operands in order, count matching the operator's arity
    /// @return result of the operator, never null
    V apply(Tag operator, List<V> operands);
}
