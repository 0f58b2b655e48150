package io.flowcheck.core.flow;

import io.flowcheck.core.exception.ConfigurationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable questionnaire flow: pages, their transitions and the variables conditions
/// may mention.
///
/// ### Validation
/// The builder checks that the start page exists, that page uids are unique and that
/// every transition targets a declared page.
///
/// @implNote Immutable and thread-safe after construction.
///
/// @see io.flowcheck.core.FlowAnalyzer for the analysis of a definition
public final class FlowDefinition {

    private final String id;
    private final String startPage;
    private final Map<String, Page> pages;
    private final Map<String, VariableDefinition> variables;

    private FlowDefinition(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Flow ID required");
        this.startPage = Objects.requireNonNull(builder.startPage, "Start page required");
        this.pages = Collections.unmodifiableMap(new LinkedHashMap<>(builder.pages));
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        validate();
    }

    private void validate() {
        if (!pages.containsKey(startPage)) {
            throw new ConfigurationException("Start page '" + startPage + "' not found in flow pages");
        }
        for (Page page : pages.values()) {
            for (PageTransition transition : page.transitions()) {
                if (!pages.containsKey(transition.target())) {
                    throw new ConfigurationException(
                            "Page '" + page.uid() + "' transitions to unknown page '"
                                    + transition.target() + "'");
                }
            }
        }
    }

    /// Returns the flow identifier.
    ///
    /// @return flow ID, never null
    public String getId() {
        return id;
    }

    /// Returns the uid of the page the flow starts on.
    ///
    /// @return start page uid, never null
    public String getStartPage() {
        return startPage;
    }

    /// Returns the pages by uid, in declaration order.
    ///
    /// @return unmodifiable map, never null
    public Map<String, Page> getPages() {
        return pages;
    }

    /// Returns the variables by name.
    ///
    /// @return unmodifiable map, never null
    public Map<String, VariableDefinition> getVariables() {
        return variables;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Builder for {@link FlowDefinition}. Required: `id`, `startPage`, at least the start
    /// page.
    public static final class Builder {
        private String id;
        private String startPage;
        private final Map<String, Page> pages = new LinkedHashMap<>();
        private final Map<String, VariableDefinition> variables = new LinkedHashMap<>();

        private Builder() {}

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder startPage(String startPage) {
            this.startPage = startPage;
            return this;
        }

        /// Adds a page.
        ///
        /// @param page page to add, not null
        /// @return this builder for chaining
        /// @throws ConfigurationException if a page with the same uid was added before
        public Builder page(Page page) {
            if (pages.putIfAbsent(page.uid(), page) != null) {
                throw new ConfigurationException("Duplicate page uid: " + page.uid());
            }
            return this;
        }

        /// Declares a variable, replacing an earlier declaration of the same name.
        ///
        /// @param name variable name, not null
        /// @param type variable type, not null
        /// @return this builder for chaining
        public Builder variable(String name, VariableType type) {
            variables.put(name, new VariableDefinition(name, type));
            return this;
        }

        public Builder variable(VariableDefinition variable) {
            variables.put(variable.name(), variable);
            return this;
        }

        /// Builds the flow.
        ///
        /// @return validated flow definition, never null
        /// @throws NullPointerException if `id` or `startPage` is missing
        /// @throws ConfigurationException if the start page or a transition target is unknown
        public FlowDefinition build() {
            return new FlowDefinition(this);
        }
    }
}
