package fr.lapetina.modeltraffic.infrastructure.store;

import fr.lapetina.modeltraffic.spi.SnapshotStore;

import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local snapshot store. Nothing survives a restart.
 */
public final class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentMap<String, Object> entries = new ConcurrentHashMap<>();

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        Object value = entries.get(key);
        if (value == null) {
            return Optional.empty();
        }
        if (!type.isInstance(value)) {
            throw new IllegalStateException("Snapshot " + key + " is a " + value.getClass().getSimpleName()
                    + ", not a " + type.getSimpleName());
        }
        return Optional.of(type.cast(value));
    }

    @Override
    public void put(String key, Object snapshot) {
        entries.put(key, snapshot);
    }

    @Override
    public void delete(String key) {
        entries.remove(key);
    }

    public Set<String> keys() {
        return new TreeSet<>(entries.keySet());
    }
}
