package org.unchartedlands.simulation.api.model;

/**
 * The storage record of a settlement and the resources it currently holds.
 */
public record SettlementStorage(String id, ResourceAmounts amounts) {
}
