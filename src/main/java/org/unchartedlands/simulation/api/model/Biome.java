package org.unchartedlands.simulation.api.model;

/**
 * The biome a plot lies in. Only the name is used, to look up production efficiencies.
 */
public record Biome(String id, String name) {
}
