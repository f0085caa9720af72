package com.metersentinel.core.registry;

import com.metersentinel.core.error.PromotionConsistencyException;

import java.util.List;
import java.util.Optional;

/**
 * Versioned store of model artifacts with two production pointers and an
 * append-only metrics history.
 *
 * <h3>Concurrency</h3>
 * <p>
 * There is one writer (the lifecycle manager) and many readers (the scan
 * jobs). Readers must only ever observe a complete snapshot: both pointers
 * from the same promotion, each referencing a fully written artifact.
 * </p>
 *
 * @since 1.0.0
 */
public interface ModelRegistry {

    /**
     * @return the current production pointers, if anything was ever promoted
     */
    Optional<ProductionSnapshot> currentProduction();

    /**
     * Load the models referenced by the current snapshot.
     *
     * @return both models from the same snapshot, or empty before the first
     *         promotion
     */
    Optional<ProductionModels> loadProductionModels();

    /**
     * @return a new version id, strictly greater than any issued before
     */
    String nextVersionId();

    /**
     * Persist the candidate's artifacts and repoint production to them as one
     * atomic step.
     *
     * @param candidate evaluated models to promote
     * @return the new snapshot
     * @throws PromotionConsistencyException if persistence fails after the
     *                                       registry started mutating state
     */
    ProductionSnapshot promote(ModelCandidate candidate);

    /**
     * Keep a rejected candidate as a timestamped backup without touching
     * production.
     *
     * @param candidate evaluated models that were not promoted
     */
    void backup(ModelCandidate candidate);

    /**
     * @param entry history record to append
     */
    void appendHistory(MetricsHistoryEntry entry);

    /**
     * @return every history entry, oldest first
     */
    List<MetricsHistoryEntry> history();

    /**
     * @return the newest entry that reached a promotion decision
     */
    Optional<MetricsHistoryEntry> lastCompletedTraining();

    /**
     * Delete artifact and backup versions beyond the newest {@code keep},
     * never touching the production versions.
     *
     * @param keep number of versions to retain
     * @return number of files deleted
     */
    int cleanupOldVersions(int keep);
}
