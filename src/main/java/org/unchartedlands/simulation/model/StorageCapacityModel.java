package org.unchartedlands.simulation.model;

import com.typesafe.config.Config;
import org.unchartedlands.simulation.api.model.NearCapacityStatus;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.ResourceType;
import org.unchartedlands.simulation.api.model.StorageCapacity;
import org.unchartedlands.simulation.api.model.Structure;

import java.util.List;

/**
 * Storage ceilings, clamping and overflow accounting.
 * <p>
 * Capacity per resource is the base capacity plus all {@code storage_capacity} modifiers
 * (which raise every resource) plus resource-specific {@code <resource>_storage_capacity}
 * modifiers such as {@code food_storage_capacity}.
 */
public final class StorageCapacityModel {

    public static final String STORAGE_CAPACITY_MODIFIER = "storage_capacity";
    public static final double DEFAULT_BASE_CAPACITY = 1000;
    public static final double DEFAULT_NEAR_CAPACITY_THRESHOLD = 0.9;

    private final double baseCapacity;
    private final double nearCapacityThreshold;

    public StorageCapacityModel() {
        this(DEFAULT_BASE_CAPACITY, DEFAULT_NEAR_CAPACITY_THRESHOLD);
    }

    public StorageCapacityModel(double baseCapacity, double nearCapacityThreshold) {
        if (baseCapacity < 0) {
            throw new IllegalArgumentException("baseCapacity must be >= 0");
        }
        if (nearCapacityThreshold <= 0 || nearCapacityThreshold > 1) {
            throw new IllegalArgumentException("nearCapacityThreshold must be in (0, 1]");
        }
        this.baseCapacity = baseCapacity;
        this.nearCapacityThreshold = nearCapacityThreshold;
    }

    public static StorageCapacityModel fromConfig(Config options) {
        return new StorageCapacityModel(
                options.hasPath("base-capacity") ? options.getDouble("base-capacity") : DEFAULT_BASE_CAPACITY,
                options.hasPath("near-capacity-threshold")
                        ? options.getDouble("near-capacity-threshold") : DEFAULT_NEAR_CAPACITY_THRESHOLD);
    }

    public StorageCapacity capacity(List<Structure> structures) {
        ResourceAmounts capacity = ResourceAmounts.ZERO;
        for (ResourceType resource : ResourceType.values()) {
            double total = baseCapacity;
            String specific = resource.key() + "_" + STORAGE_CAPACITY_MODIFIER;
            for (Structure structure : structures) {
                total += structure.modifierTotal(STORAGE_CAPACITY_MODIFIER);
                total += structure.modifierTotal(specific);
            }
            capacity = capacity.with(resource, Math.max(0, total));
        }
        return StorageCapacity.from(capacity);
    }

    /**
     * Element-wise {@code min(max(amount, 0), capacity)}.
     */
    public ResourceAmounts clamp(ResourceAmounts amounts, StorageCapacity capacity) {
        ResourceAmounts result = amounts;
        for (ResourceType resource : ResourceType.values()) {
            double clamped = Math.min(Math.max(amounts.get(resource), 0), capacity.get(resource));
            result = result.with(resource, clamped);
        }
        return result;
    }

    /**
     * Production lost to missing headroom this cycle: element-wise
     * {@code max(0, current + net - capacity)}. Computed independently of {@link #clamp}.
     */
    public ResourceAmounts waste(ResourceAmounts current, ResourceAmounts net, StorageCapacity capacity) {
        ResourceAmounts result = ResourceAmounts.ZERO;
        for (ResourceType resource : ResourceType.values()) {
            double overflow = current.get(resource) + net.get(resource) - capacity.get(resource);
            result = result.with(resource, Math.max(0, overflow));
        }
        return result;
    }

    public NearCapacityStatus isNearCapacity(ResourceAmounts amounts, StorageCapacity capacity) {
        return isNearCapacity(amounts, capacity, nearCapacityThreshold);
    }

    /**
     * A resource is near capacity when its ceiling is positive and the stock reaches
     * {@code threshold × capacity}.
     */
    public NearCapacityStatus isNearCapacity(ResourceAmounts amounts, StorageCapacity capacity, double threshold) {
        return new NearCapacityStatus(
                near(amounts.food(), capacity.food(), threshold),
                near(amounts.water(), capacity.water(), threshold),
                near(amounts.wood(), capacity.wood(), threshold),
                near(amounts.stone(), capacity.stone(), threshold),
                near(amounts.ore(), capacity.ore(), threshold));
    }

    private static boolean near(double amount, double capacity, double threshold) {
        return capacity > 0 && amount >= capacity * threshold;
    }
}
