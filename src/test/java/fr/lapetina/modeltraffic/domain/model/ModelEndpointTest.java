package fr.lapetina.modeltraffic.domain.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ModelEndpointTest {

    private ModelEndpoint endpoint;

    @BeforeEach
    void setUp() {
        endpoint = ModelEndpoint.builder()
                .id("llama3-v1-a")
                .model("llama3")
                .version("v1")
                .address("http://localhost:11434")
                .costPerToken(0.002)
                .weight(60)
                .maxConcurrentRequests(4)
                .build();
    }

    @Test
    @DisplayName("should create endpoint with builder defaults")
    void shouldCreateEndpointWithBuilder() {
        assertThat(endpoint.id()).isEqualTo("llama3-v1-a");
        assertThat(endpoint.address().toString()).isEqualTo("http://localhost:11434");
        assertThat(endpoint.state()).isEqualTo(EndpointState.DRAFT);
        assertThat(endpoint.health()).isEqualTo(EndpointHealth.UP);
        assertThat(endpoint.maxConcurrentRequests()).isEqualTo(4);
        assertThat(endpoint.isServing()).isTrue();
    }

    @Test
    @DisplayName("should only be unhealthy when down")
    void shouldOnlyBeUnhealthyWhenDown() {
        assertThat(endpoint.withHealth(EndpointHealth.DEGRADED).isHealthy()).isTrue();
        assertThat(endpoint.withHealth(EndpointHealth.DOWN).isHealthy()).isFalse();
    }

    @Test
    @DisplayName("should copy with new weight and state")
    void shouldCopyWithNewWeightAndState() {
        ModelEndpoint retired = endpoint.withWeight(0).withState(EndpointState.RETIRING);

        assertThat(retired.weight()).isZero();
        assertThat(retired.isServing()).isFalse();
        assertThat(retired.state()).isEqualTo(EndpointState.RETIRING);
        assertThat(endpoint.weight()).isEqualTo(60);
    }

    @Test
    @DisplayName("should reject invalid values")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> endpoint.withWeight(101))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> endpoint.withWeight(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelEndpoint.builder()
                .id("x").model("llama3").version("v1").address("http://x")
                .costPerToken(-0.1)
                .build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelEndpoint.builder().model("llama3").version("v1").address("http://x").build())
                .isInstanceOf(NullPointerException.class);
    }
}
