package org.unchartedlands.simulation.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Per-resource flags telling whether stock is close to its storage ceiling.
 */
public record NearCapacityStatus(boolean food, boolean water, boolean wood, boolean stone, boolean ore) {

    @JsonIgnore
    public boolean isAny() {
        return food || water || wood || stone || ore;
    }

    public boolean get(ResourceType type) {
        return switch (type) {
            case FOOD -> food;
            case WATER -> water;
            case WOOD -> wood;
            case STONE -> stone;
            case ORE -> ore;
        };
    }
}
