package com.ritbot.hft.strategy.service;

import com.ritbot.hft.config.ArbProperties.SizeTier;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tiered order sizing. Tiers are matched highest threshold first; an edge below every
 * threshold sizes to zero. Quantities are normalised so a larger edge never trades less.
 */
public class SizingPolicy {

    private final List<Tier> tiersDescending;

    public SizingPolicy(List<SizeTier> tiers) {
        List<SizeTier> ascending = tiers.stream()
                .filter(t -> t != null && t.minEdge() != null && t.quantity() != null)
                .sorted(Comparator.comparingDouble(SizeTier::minEdge))
                .toList();
        if (ascending.isEmpty()) {
            throw new IllegalArgumentException("sizing table must contain at least one tier");
        }

        List<Tier> normalised = new ArrayList<>();
        long runningMax = 0;
        for (SizeTier tier : ascending) {
            runningMax = Math.max(runningMax, Math.max(0L, tier.quantity()));
            normalised.add(new Tier(tier.minEdge(), runningMax));
        }
        normalised.sort(Comparator.comparingDouble(Tier::minEdge).reversed());
        this.tiersDescending = List.copyOf(normalised);
    }

    /**
     * Total quantity for {@code edge}. May exceed the per-order ceiling; callers chunk.
     */
    public long quantityFor(double edge) {
        if (Double.isNaN(edge)) {
            return 0L;
        }
        for (Tier tier : tiersDescending) {
            if (edge >= tier.minEdge()) {
                return tier.quantity();
            }
        }
        return 0L;
    }

    public double lowestThreshold() {
        return tiersDescending.get(tiersDescending.size() - 1).minEdge();
    }

    private record Tier(double minEdge, long quantity) {}
}
