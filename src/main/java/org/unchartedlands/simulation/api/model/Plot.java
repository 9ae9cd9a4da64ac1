package org.unchartedlands.simulation.api.model;

/**
 * The plot a settlement is built on, with its area and base yield potential.
 */
public record Plot(String id, double area, ResourceAmounts yieldPotential) {
}
