package io.flowcheck.core.scope;

import io.flowcheck.core.exception.SemanticException;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Tag;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/// Function callable from condition text that expands into an expression at compile time.
///
/// Bound in a {@link Scope}; lookup resolution applies it when it appears in call position.
///
/// @param name qualified name used in messages, not null
/// @param signature expected tag of each argument, in order
/// @param expansion builds the replacement expression from the resolved arguments
public record Macro(String name, List<Tag> signature, Function<List<Expr>, Expr> expansion) {

    public Macro {
        Objects.requireNonNull(name, "name");
        signature = List.copyOf(signature);
        Objects.requireNonNull(expansion, "expansion");
    }

    /// Checks the arguments against the signature and expands the macro.
    ///
    /// @param args resolved call arguments, not null
    /// @return expansion result, never null
    /// @throws SemanticException if the argument count or tags do not match the signature
    public Expr expand(List<Expr> args) {
        List<Tag> actual = args.stream().map(Expr::tag).collect(Collectors.toList());
        if (!actual.equals(signature)) {
            throw new SemanticException(
                    "Macro " + name + " expects " + describe(signature) + " but got " + describe(actual));
        }
        return expansion.apply(args);
    }

    private static String describe(List<Tag> tags) {
        return tags.stream().map(Tag::symbol).collect(Collectors.joining(", ", "[", "]"));
    }
}
