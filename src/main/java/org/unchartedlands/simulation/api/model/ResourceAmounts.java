package org.unchartedlands.simulation.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Amounts of the five tracked resources. Used for stock, production, consumption and
 * net deltas alike, so individual components may be negative for deltas.
 *
 * @param food  food units
 * @param water water units
 * @param wood  wood units
 * @param stone stone units
 * @param ore   ore units
 */
public record ResourceAmounts(double food, double water, double wood, double stone, double ore) {

    public static final ResourceAmounts ZERO = new ResourceAmounts(0, 0, 0, 0, 0);

    public static ResourceAmounts of(ResourceType type, double amount) {
        return ZERO.with(type, amount);
    }

    public double get(ResourceType type) {
        return switch (type) {
            case FOOD -> food;
            case WATER -> water;
            case WOOD -> wood;
            case STONE -> stone;
            case ORE -> ore;
        };
    }

    public ResourceAmounts with(ResourceType type, double amount) {
        return switch (type) {
            case FOOD -> new ResourceAmounts(amount, water, wood, stone, ore);
            case WATER -> new ResourceAmounts(food, amount, wood, stone, ore);
            case WOOD -> new ResourceAmounts(food, water, amount, stone, ore);
            case STONE -> new ResourceAmounts(food, water, wood, amount, ore);
            case ORE -> new ResourceAmounts(food, water, wood, stone, amount);
        };
    }

    public ResourceAmounts plus(ResourceAmounts other) {
        return new ResourceAmounts(
                food + other.food,
                water + other.water,
                wood + other.wood,
                stone + other.stone,
                ore + other.ore);
    }

    public ResourceAmounts minus(ResourceAmounts other) {
        return new ResourceAmounts(
                food - other.food,
                water - other.water,
                wood - other.wood,
                stone - other.stone,
                ore - other.ore);
    }

    public ResourceAmounts scale(double factor) {
        return new ResourceAmounts(food * factor, water * factor, wood * factor, stone * factor, ore * factor);
    }

    /**
     * @return {@code true} if at least one component is strictly greater than zero
     */
    @JsonIgnore
    public boolean isAnyPositive() {
        return food > 0 || water > 0 || wood > 0 || stone > 0 || ore > 0;
    }

    /**
     * Returns {@code true} if every component of this vector is at least the matching
     * component of {@code required}.
     */
    public boolean covers(ResourceAmounts required) {
        return food >= required.food
                && water >= required.water
                && wood >= required.wood
                && stone >= required.stone
                && ore >= required.ore;
    }
}
