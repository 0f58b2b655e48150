package io.flowcheck.core.eval;

import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.expr.Expr;
import io.flowcheck.core.expr.Tag;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/// Recursive rewriting engine shared by every pass over expression trees.
///
/// Subclasses register handlers in their constructor, either per operator {@link Tag} or
/// per node predicate. {@link #evaluate(Expr)} walks the tree bottom-up: it evaluates the
/// children of a node (skipping positions the handler declared as {@link Leaves}), then
/// invokes the handler.
///
/// ### Handler resolution
/// 1. Exact tag match
/// 2. First matching predicate handler, in registration order
/// 3. {@link #passThrough(Expr, Arguments)}
///
/// A handler returning `Optional.empty()` signals NO_OP: the node is passed through as if
/// no handler matched, which lets passes handle only the cases they care about.
///
/// @implNote Handler tables are filled during construction and never change afterwards,
/// so a fully constructed evaluator can be shared across threads.
///
/// @param <R> result type of the evaluation
/// @see MacroPass for passes producing expressions
public abstract class Evaluator<R> {

    /// Rule applied to one node.
    ///
    /// @param <R> result type of the evaluation
    @FunctionalInterface
    public interface Handler<R> {

        /// Evaluates a node whose non-leaf children have already been evaluated.
        ///
        /// @param node node being evaluated, not null
        /// @param args raw and evaluated children, not null
        /// @return result, or empty to pass the node through unchanged
        Optional<R> apply(Expr node, Arguments<R> args);
    }

    private record Registration<R>(Leaves leaves, Handler<R> handler) {}

    private record PredicateRegistration<R>(Predicate<Expr> predicate, Registration<R> registration) {}

    private final Map<Tag, Registration<R>> byTag = new EnumMap<>(Tag.class);
    private final List<PredicateRegistration<R>> byPredicate = new ArrayList<>();

    protected final void on(Tag tag, Handler<R> handler) {
        on(tag, Leaves.none(), handler);
    }

    /// Registers the handler for one tag.
    ///
    /// @param tag dispatch tag, not null
    /// @param leaves child positions not to evaluate, not null
    /// @param handler rule, not null
    /// @throws ConfigurationException if the tag already has a handler in this evaluator
    protected final void on(Tag tag, Leaves leaves, Handler<R> handler) {
        if (byTag.putIfAbsent(tag, new Registration<>(leaves, handler)) != null) {
            throw new ConfigurationException(
                    getClass().getSimpleName() + " registers operator '" + tag.symbol() + "' twice");
        }
    }

    protected final void on(Collection<Tag> tags, Handler<R> handler) {
        tags.forEach(tag -> on(tag, Leaves.none(), handler));
    }

    protected final void when(Predicate<Expr> predicate, Handler<R> handler) {
        when(predicate, Leaves.none(), handler);
    }

    protected final void when(Predicate<Expr> predicate, Leaves leaves, Handler<R> handler) {
        byPredicate.add(new PredicateRegistration<>(predicate, new Registration<>(leaves, handler)));
    }

    /// Evaluates a tree bottom-up.
    ///
    /// @param expr root of the tree, not null
    /// @return evaluation result
    public R evaluate(Expr expr) {
        Registration<R> registration = resolve(expr);
        Leaves leaves = registration == null ? Leaves.none() : registration.leaves();
        List<Expr> children = expr.children();
        List<R> evaluated = new ArrayList<>(children.size());
        for (int i = 0; i < children.size(); i++) {
            evaluated.add(leaves.contains(i) ? null : evaluate(children.get(i)));
        }
        Arguments<R> args = new Arguments<>(children, evaluated, leaves);
        if (registration != null) {
            Optional<R> result = registration.handler().apply(expr, args);
            if (result.isPresent()) {
                return result.get();
            }
        }
        return passThrough(expr, args);
    }

    /// Produces the result for a node without handler or whose handler returned NO_OP.
    ///
    /// @param node node being evaluated, not null
    /// @param args raw and evaluated children, not null
    /// @return result for the node
    protected abstract R passThrough(Expr node, Arguments<R> args);

    private Registration<R> resolve(Expr expr) {
        Registration<R> registration = byTag.get(expr.tag());
        if (registration != null) {
            return registration;
        }
        for (PredicateRegistration<R> candidate : byPredicate) {
            if (candidate.predicate().test(expr)) {
                return candidate.registration();
            }
        }
        return null;
    }
}
