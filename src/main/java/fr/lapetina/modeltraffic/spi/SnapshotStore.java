package fr.lapetina.modeltraffic.spi;

import java.util.Optional;

/**
 * Durable key-value store for registry snapshots, rollout plans and performance baselines,
 * so the controller can resume after a restart.
 */
public interface SnapshotStore {

    <T> Optional<T> get(String key, Class<T> type);

    void put(String key, Object snapshot);

    void delete(String key);
}
