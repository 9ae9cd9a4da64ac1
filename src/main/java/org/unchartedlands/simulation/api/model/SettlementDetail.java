package org.unchartedlands.simulation.api.model;

import java.util.Optional;

/**
 * Full settlement detail as returned by the store. Storage, plot and biome may be missing
 * when the stored data is incomplete.
 */
public record SettlementDetail(Settlement settlement, SettlementStorage storage, Plot plot, Biome biome) {

    /**
     * @return {@code true} if settlement, storage and plot are all present
     */
    public boolean isComplete() {
        return settlement != null && storage != null && plot != null;
    }

    public Optional<Biome> biomeIfPresent() {
        return Optional.ofNullable(biome);
    }
}
