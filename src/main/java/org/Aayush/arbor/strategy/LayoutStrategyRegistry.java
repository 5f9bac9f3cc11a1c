package org.Aayush.arbor.strategy;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Strategy lookup by case-insensitive id.
 *
 * <p>Always holds the three built-in strategies. Callers may register extra strategies;
 * one whose id matches a built-in takes its place.</p>
 */
public final class LayoutStrategyRegistry {
    public static final String STRATEGY_HIERARCHICAL = "hierarchical";
    public static final String STRATEGY_REINGOLD_TILFORD = "reingold-tilford";
    public static final String STRATEGY_ENHANCED_TREE = "enhanced-tree";

    private static final List<TreeLayoutStrategy> BUILT_INS = List.of(
            new HierarchicalLayoutStrategy(),
            new ReingoldTilfordLayoutStrategy(),
            new EnhancedTreeLayoutStrategy()
    );
    private static final LayoutStrategyRegistry DEFAULT = new LayoutStrategyRegistry();

    private final Map<String, TreeLayoutStrategy> byId;

    public LayoutStrategyRegistry() {
        this(List.of());
    }

    /**
     * Built-ins plus {@code extraStrategies}, registered in iteration order.
     *
     * @param extraStrategies additional or overriding strategies; null means none.
     * @throws IllegalArgumentException when a strategy reports a null or blank id.
     */
    public LayoutStrategyRegistry(Collection<? extends TreeLayoutStrategy> extraStrategies) {
        LinkedHashMap<String, TreeLayoutStrategy> strategies = new LinkedHashMap<>();
        for (TreeLayoutStrategy builtIn : BUILT_INS) {
            strategies.put(builtIn.id(), builtIn);
        }
        if (extraStrategies != null) {
            for (TreeLayoutStrategy extra : extraStrategies) {
                Objects.requireNonNull(extra, "strategy");
                String key = normalize(extra.id());
                if (key == null) {
                    throw new IllegalArgumentException(
                            "strategy.id must be non-blank for " + extra.getClass().getName());
                }
                strategies.put(key, extra);
            }
        }
        this.byId = Collections.unmodifiableMap(strategies);
    }

    /**
     * Shared registry of the built-ins.
     */
    public static LayoutStrategyRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * Strategy registered under {@code strategyId}, or null for unknown or blank ids.
     */
    public TreeLayoutStrategy strategy(String strategyId) {
        String key = normalize(strategyId);
        return key == null ? null : byId.get(key);
    }

    /**
     * Registered ids in registration order (unmodifiable).
     */
    public Set<String> strategyIds() {
        return byId.keySet();
    }

    static String normalize(String id) {
        if (id == null || id.isBlank()) {
            return null;
        }
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
