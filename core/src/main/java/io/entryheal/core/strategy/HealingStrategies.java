package io.entryheal.core.strategy;

import java.util.List;
import java.util.Locale;

/** The stock strategies, and lookup by configuration name. */
public final class HealingStrategies {

    public static final HealingStrategy BRIDGE_FIRST = new BridgeFirstStrategy();
    public static final HealingStrategy SELF_REPAIR_FIRST = new SelfRepairFirstStrategy();
    public static final HealingStrategy LOCAL_REPAIR_ONLY = new LocalRepairOnlyStrategy();
    public static final HealingStrategy NO_HEALING = new NoHealingStrategy();

    private static final List<HealingStrategy> ALL =
            List.of(BRIDGE_FIRST, SELF_REPAIR_FIRST, LOCAL_REPAIR_ONLY, NO_HEALING);

    private HealingStrategies() {}

    /** All stock strategies. */
    public static List<HealingStrategy> all() {
        return ALL;
    }

    /**
     * Resolves a strategy by name, case-insensitively. Underscores are read as hyphens, so
     * {@code BRIDGE_FIRST} and {@code bridge-first} name the same strategy.
     *
     * @throws IllegalArgumentException if no strategy has that name
     */
    public static HealingStrategy byName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("strategy name must not be null or blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (HealingStrategy strategy : ALL) {
            if (strategy.name().equals(normalized)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown healing strategy '" + name + "', expected one of: "
                + ALL.stream().map(HealingStrategy::name).toList());
    }
}
