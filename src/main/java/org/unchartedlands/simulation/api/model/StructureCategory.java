package org.unchartedlands.simulation.api.model;

/**
 * Top-level classification of a structure.
 */
public enum StructureCategory {
    /** Housing, storage and service buildings. */
    BUILDING,
    /** Structures that extract raw resources from the plot they stand on. */
    EXTRACTOR
}
