package fr.lapetina.modeltraffic.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.net.URI;
import java.util.Objects;

/**
 * A deployed, addressable instance of one model version.
 *
 * Immutable: weight, state and health changes produce a new instance that the
 * endpoint registry publishes as part of a new snapshot.
 */
public record ModelEndpoint(
        String id,
        String model,
        String version,
        URI address,
        double costPerToken,
        EndpointState state,
        int weight,
        int maxConcurrentRequests,
        EndpointHealth health
) {
    public ModelEndpoint {
        Objects.requireNonNull(id, "Endpoint ID is required");
        Objects.requireNonNull(model, "Model is required");
        Objects.requireNonNull(version, "Version is required");
        Objects.requireNonNull(address, "Address is required");
        if (costPerToken < 0 || Double.isNaN(costPerToken)) {
            throw new IllegalArgumentException("Cost per token must be non-negative: " + costPerToken);
        }
        if (weight < 0 || weight > 100) {
            throw new IllegalArgumentException("Weight must be within 0..100: " + weight);
        }
        if (maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("Max concurrent requests must be positive");
        }
        if (state == null) {
            state = EndpointState.DRAFT;
        }
        if (health == null) {
            health = EndpointHealth.UP;
        }
    }

    /**
     * Checks if the endpoint may be selected by the router.
     */
    @JsonIgnore
    public boolean isHealthy() {
        return health != EndpointHealth.DOWN;
    }

    /**
     * Checks if the endpoint currently holds a share of its model's traffic.
     */
    @JsonIgnore
    public boolean isServing() {
        return weight > 0;
    }

    public ModelEndpoint withWeight(int newWeight) {
        return new ModelEndpoint(id, model, version, address, costPerToken, state, newWeight,
                maxConcurrentRequests, health);
    }

    public ModelEndpoint withState(EndpointState newState) {
        return new ModelEndpoint(id, model, version, address, costPerToken, newState, weight,
                maxConcurrentRequests, health);
    }

    public ModelEndpoint withHealth(EndpointHealth newHealth) {
        return new ModelEndpoint(id, model, version, address, costPerToken, state, weight,
                maxConcurrentRequests, newHealth);
    }

    @Override
    public String toString() {
        return "ModelEndpoint{" +
                "id='" + id + '\'' +
                ", model=" + model +
                ", version=" + version +
                ", state=" + state +
                ", weight=" + weight +
                ", health=" + health +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String model;
        private String version;
        private URI address;
        private double costPerToken;
        private EndpointState state = EndpointState.DRAFT;
        private int weight;
        private int maxConcurrentRequests = 10;
        private EndpointHealth health = EndpointHealth.UP;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder address(String url) {
            this.address = URI.create(url);
            return this;
        }

        public Builder address(URI url) {
            this.address = url;
            return this;
        }

        public Builder costPerToken(double costPerToken) {
            this.costPerToken = costPerToken;
            return this;
        }

        public Builder state(EndpointState state) {
            this.state = state;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder maxConcurrentRequests(int max) {
            this.maxConcurrentRequests = max;
            return this;
        }

        public Builder health(EndpointHealth health) {
            this.health = health;
            return this;
        }

        public ModelEndpoint build() {
            return new ModelEndpoint(id, model, version, address, costPerToken, state, weight,
                    maxConcurrentRequests, health);
        }
    }
}
