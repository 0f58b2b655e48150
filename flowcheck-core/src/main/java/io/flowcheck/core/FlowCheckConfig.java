package io.flowcheck.core;

import io.flowcheck.core.graph.SelfLoopPolicy;
import io.flowcheck.core.pass.BooleanSimplifier;

/// Configuration options for a flow analysis run.
///
/// ### Default Values
/// - `parallelism`: number of available processors (edge filter simplification workers)
/// - `truthTableAtomLimit`: `12` (up to 2^12 rows per tautology check, `0` disables it)
/// - `selfLoopPolicy`: {@link SelfLoopPolicy#COUNT_FOR_SOUNDNESS}
/// - `failFast`: `false` (condition errors are collected, not thrown)
///
/// @implNote **Not thread-safe**. Configure before passing to {@link FlowAnalyzer} and
/// do not modify afterwards.
///
/// @see FlowAnalyzer#FlowAnalyzer(FlowCheckConfig)
public class FlowCheckConfig {
    private int parallelism = Runtime.getRuntime().availableProcessors();
    private int truthTableAtomLimit = BooleanSimplifier.DEFAULT_TRUTH_TABLE_ATOM_LIMIT;
    private SelfLoopPolicy selfLoopPolicy = SelfLoopPolicy.COUNT_FOR_SOUNDNESS;
    private boolean failFast = false;

    /// Creates a configuration with default values.
    public FlowCheckConfig() {}

    /// Returns the number of worker threads simplifying edge filters.
    ///
    /// @return positive thread count
    public int getParallelism() {
        return parallelism;
    }

    /// Sets the number of worker threads simplifying edge filters.
    ///
    /// ### Contracts
    /// - **Precondition**: `parallelism` should be positive
    ///
    /// @param parallelism thread count, must be positive
    public void setParallelism(int parallelism) {
        this.parallelism = parallelism;
    }

    /// Returns how many binary choices the tautology check may enumerate.
    ///
    /// @return atom limit within `[0, 30]`
    public int getTruthTableAtomLimit() {
        return truthTableAtomLimit;
    }

    public void setTruthTableAtomLimit(int truthTableAtomLimit) {
        this.truthTableAtomLimit = truthTableAtomLimit;
    }

    public SelfLoopPolicy getSelfLoopPolicy() {
        return selfLoopPolicy;
    }

    public void setSelfLoopPolicy(SelfLoopPolicy selfLoopPolicy) {
        this.selfLoopPolicy = selfLoopPolicy;
    }

    /// Returns whether the first failing condition aborts the analysis.
    ///
    /// @return `true` to rethrow condition errors, `false` to collect them
    public boolean isFailFast() {
        return failFast;
    }

    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link FlowCheckConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on
    /// {@link #build()}.
    public static class Builder {
        private final FlowCheckConfig config = new FlowCheckConfig();

        public Builder parallelism(int parallelism) {
            config.parallelism = parallelism;
            return this;
        }

        public Builder truthTableAtomLimit(int truthTableAtomLimit) {
            config.truthTableAtomLimit = truthTableAtomLimit;
            return this;
        }

        public Builder selfLoopPolicy(SelfLoopPolicy selfLoopPolicy) {
            config.selfLoopPolicy = selfLoopPolicy;
            return this;
        }

        public Builder failFast(boolean failFast) {
            config.failFast = failFast;
            return this;
        }

        /// Builds and returns the configured instance.
        ///
        /// @return the configured instance, never null
        public FlowCheckConfig build() {
            return config;
        }
    }
}
