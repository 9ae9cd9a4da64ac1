package org.unchartedlands.simulation.api.model;

/**
 * Per-resource storage ceiling of a settlement, derived from its built structures.
 */
public record StorageCapacity(double food, double water, double wood, double stone, double ore) {

    public static StorageCapacity uniform(double capacity) {
        return new StorageCapacity(capacity, capacity, capacity, capacity, capacity);
    }

    public static StorageCapacity from(ResourceAmounts amounts) {
        return new StorageCapacity(amounts.food(), amounts.water(), amounts.wood(), amounts.stone(), amounts.ore());
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
}
