package io.flowcheck.core.flow;

import io.flowcheck.core.domain.EnumDomain;
import io.flowcheck.core.domain.EnumRegistry;
import io.flowcheck.core.exception.ConfigurationException;
import io.flowcheck.core.expr.Kind;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Builds the enumerations of a flow from the answer options its pages declare.
///
/// Each enumeration variable `v` yields two domains: `v` over the option uids (strings)
/// and `v_NUM` over the option codes (numbers).
public final class EnumCatalog {

    private static final Logger logger = Logger.getLogger(EnumCatalog.class.getName());

    /// Suffix of the numeric companion enumeration.
    public static final String NUMERIC_SUFFIX = "_NUM";

    private EnumCatalog() {}

    /// Merges the enumeration declarations of all pages.
    ///
    /// A variable may be declared on several pages as long as every declaration maps the
    /// same uids to the same codes.
    ///
    /// @param pages pages of the flow, not null
    /// @return registry with a string and a numeric domain per enumeration variable
    /// @throws ConfigurationException if declarations of one variable conflict or a
    ///     variable declares no option
    public static EnumRegistry fromPages(Collection<Page> pages) {
        Map<String, Map<String, Long>> declarations = new LinkedHashMap<>();
        List<String> conflicts = new ArrayList<>();
        for (Page page : pages) {
            for (EnumValues values : page.enumValues()) {
                Map<String, Long> options = new LinkedHashMap<>();
                values.values().forEach(v -> options.put(v.uid(), v.code()));
                Map<String, Long> previous = declarations.putIfAbsent(values.variable(), options);
                if (previous != null && !previous.equals(options)) {
                    conflicts.add(values.variable() + " (page " + page.uid() + ")");
                }
            }
        }
        if (!conflicts.isEmpty()) {
            throw new ConfigurationException("Conflicting enum declarations: " + conflicts);
        }
        List<EnumDomain> domains = new ArrayList<>();
        declarations.forEach((variable, options) -> {
            if (options.isEmpty()) {
                throw new ConfigurationException("Empty enum found: " + variable);
            }
            domains.add(new EnumDomain(variable, Kind.STRING, new ArrayList<>(options.keySet())));
            // options may share a code
            domains.add(new EnumDomain(
                    variable + NUMERIC_SUFFIX, Kind.NUMBER, new ArrayList<>(new LinkedHashSet<>(options.values()))));
        });
        logger.info("Loaded " + declarations.size() + " enum variables");
        return EnumRegistry.of(domains);
    }
}
