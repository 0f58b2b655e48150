package io.flowcheck.core.eval;

import java.util.Arrays;

/// Child positions a handler wants to receive unevaluated.
///
/// The evaluator does not recurse into leaf positions; the handler sees those children
/// only through {@link Arguments#raw(int)}.
public final class Leaves {

    private static final Leaves NONE = new Leaves(false, new int[0]);
    private static final Leaves ALL = new Leaves(true, new int[0]);

    private final boolean all;
    private final int[] positions;

    private Leaves(boolean all, int[] positions) {
        this.all = all;
        this.positions = positions;
    }

    /// Every child is evaluated before the handler runs.
    public static Leaves none() {
        return NONE;
    }

    /// No child is evaluated; the handler receives the raw sub-trees.
    public static Leaves all() {
        return ALL;
    }

    /// The given positions stay unevaluated.
    ///
    /// @param positions zero-based child positions
    /// @return leaf declaration, never null
    public static Leaves of(int... positions) {
        int[] copy = positions.clone();
        Arrays.sort(copy);
        return new Leaves(false, copy);
    }

    public boolean contains(int position) {
        return all || Arrays.binarySearch(positions, position) >= 0;
    }

    @Override
    public String toString() {
        return all ? "Leaves[all]" : "Leaves" + Arrays.toString(positions);
    }
}
