package org.unchartedlands.simulation.api.store;

import org.unchartedlands.simulation.api.model.PopulationRecord;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.SettlementDetail;
import org.unchartedlands.simulation.api.model.Structure;

import java.util.List;
import java.util.Optional;

/**
 * Narrow query/update interface to the persistent game store.
 * <p>
 * The simulation never talks to the storage engine directly. Implementations must be safe
 * to call from several threads at once; the scheduler only ever touches the records of one
 * settlement from one thread at a time.
 * <p>
 * Any method may throw an unchecked exception to signal a failed call. The scheduler treats
 * such failures as transient and retries the same window on the next wave.
 */
public interface ISettlementStore {

    /**
     * Lists the ids of all active settlements owned by a player.
     *
     * @param ownerId the player (profile) id
     * @return settlement ids, empty if the player owns none
     */
    List<String> listActiveSettlementIds(String ownerId);

    /**
     * Fetches a settlement together with its storage, plot and biome.
     *
     * @param settlementId the settlement id
     * @return the detail, or empty if the settlement does not exist
     */
    Optional<SettlementDetail> fetchSettlementDetail(String settlementId);

    /**
     * Fetches the structures built in a settlement, with their modifiers and classification.
     *
     * @param settlementId the settlement id
     * @return the structures, empty if none are built
     */
    List<Structure> fetchSettlementStructures(String settlementId);

    /**
     * Fetches the population record of a settlement.
     *
     * @param settlementId the settlement id
     * @return the record, or empty if the population was never initialized
     */
    Optional<PopulationRecord> fetchPopulation(String settlementId);

    /**
     * Replaces the population record of a settlement.
     */
    void updatePopulation(String settlementId, PopulationRecord population);

    /**
     * Replaces the resource amounts held by a storage record.
     */
    void updateStorage(String storageId, ResourceAmounts amounts);
}
