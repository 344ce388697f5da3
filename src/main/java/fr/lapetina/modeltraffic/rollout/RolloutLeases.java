package fr.lapetina.modeltraffic.rollout;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * At most one rollout, canary or blue-green, may own a model at a time.
 */
public final class RolloutLeases {

    private static final Logger log = LoggerFactory.getLogger(RolloutLeases.class);

    private final Map<String, String> owners = new ConcurrentHashMap<>();

    /**
     * @return true if the lease was granted, or is already held by the same owner
     */
    public boolean tryAcquire(String model, String ownerId) {
        String current = owners.putIfAbsent(model, ownerId);
        if (current == null) {
            log.debug("Rollout lease acquired: model={}, owner={}", model, ownerId);
            return true;
        }
        return current.equals(ownerId);
    }

    public void release(String model, String ownerId) {
        if (owners.remove(model, ownerId)) {
            log.debug("Rollout lease released: model={}, owner={}", model, ownerId);
        }
    }

    public Optional<String> holder(String model) {
        return Optional.ofNullable(owners.get(model));
    }
}
