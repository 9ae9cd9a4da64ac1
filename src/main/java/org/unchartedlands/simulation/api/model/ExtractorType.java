package org.unchartedlands.simulation.api.model;

/**
 * Kinds of extractor structures. Production rates are configured per extractor and resource.
 */
public enum ExtractorType {
    FARM,
    WELL,
    LUMBER_MILL,
    QUARRY,
    MINE,
    FISHING_DOCK,
    HUNTERS_LODGE,
    HERB_GARDEN
}
