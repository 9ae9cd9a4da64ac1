package org.unchartedlands.simulation.api.model;

/**
 * Core settlement record as held by the store.
 */
public record Settlement(String id, String ownerId, String name) {
}
