package org.unchartedlands.simulation.scheduler;

/**
 * Scheduler-side state of a settlement under active simulation. Not persisted; rebuilt
 * when the settlement is registered again.
 */
public final class SettlementSimState {

    private final String settlementId;
    private final String ownerId;
    private final String worldId;
    private volatile long lastUpdateTick;

    SettlementSimState(String settlementId, String ownerId, String worldId, long lastUpdateTick) {
        this.settlementId = settlementId;
        this.ownerId = ownerId;
        this.worldId = worldId;
        this.lastUpdateTick = lastUpdateTick;
    }

    public String getSettlementId() {
        return settlementId;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public String getWorldId() {
        return worldId;
    }

    public long getLastUpdateTick() {
        return lastUpdateTick;
    }

    /**
     * Advances the last update tick. Never moves backwards.
     */
    void advanceTo(long tick) {
        if (tick > lastUpdateTick) {
            lastUpdateTick = tick;
        }
    }

    @Override
    public String toString() {
        return "SettlementSimState[" + settlementId + ", owner=" + ownerId + ", world=" + worldId
                + ", lastUpdateTick=" + lastUpdateTick + "]";
    }
}
