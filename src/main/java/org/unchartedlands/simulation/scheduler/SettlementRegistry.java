package org.unchartedlands.simulation.scheduler;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Membership set of settlements under active simulation, owned by one scheduler instance.
 * Iteration order is registration order, so waves are partitioned into batches
 * deterministically.
 */
public final class SettlementRegistry {

    private final Map<String, SettlementSimState> settlements = new LinkedHashMap<>();

    /**
     * Adds a settlement. Has no effect if it is already registered.
     *
     * @param currentTick the tick the new settlement's elapsed window starts at
     * @return {@code true} if the settlement was added
     */
    public synchronized boolean register(String settlementId, String ownerId, String worldId, long currentTick) {
        if (settlements.containsKey(settlementId)) {
            return false;
        }
        settlements.put(settlementId, new SettlementSimState(settlementId, ownerId, worldId, currentTick));
        return true;
    }

    /**
     * @return {@code true} if the settlement was registered
     */
    public synchronized boolean unregister(String settlementId) {
        return settlements.remove(settlementId) != null;
    }

    /**
     * Removes a settlement only if it is still registered with the given state instance,
     * so a wave never drops a settlement that was re-registered while it ran.
     */
    public synchronized boolean unregister(SettlementSimState state) {
        return settlements.remove(state.getSettlementId(), state);
    }

    /**
     * Removes all settlements of an owner.
     *
     * @return ids of the removed settlements
     */
    public synchronized List<String> unregisterOwner(String ownerId) {
        List<String> removed = new ArrayList<>();
        Iterator<SettlementSimState> it = settlements.values().iterator();
        while (it.hasNext()) {
            SettlementSimState state = it.next();
            if (state.getOwnerId().equals(ownerId)) {
                removed.add(state.getSettlementId());
                it.remove();
            }
        }
        return removed;
    }

    public synchronized Optional<SettlementSimState> get(String settlementId) {
        return Optional.ofNullable(settlements.get(settlementId));
    }

    public synchronized boolean contains(String settlementId) {
        return settlements.containsKey(settlementId);
    }

    /**
     * @return a copy of the current members in registration order
     */
    public synchronized List<SettlementSimState> snapshot() {
        return new ArrayList<>(settlements.values());
    }

    public synchronized int size() {
        return settlements.size();
    }

    public synchronized boolean isEmpty() {
        return settlements.isEmpty();
    }

    public synchronized void clear() {
        settlements.clear();
    }
}
