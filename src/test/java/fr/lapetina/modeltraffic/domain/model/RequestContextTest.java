package fr.lapetina.modeltraffic.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestContextTest {

    @Test
    @DisplayName("should generate request id and default correlation id")
    void shouldGenerateIds() {
        RequestContext context = RequestContext.of("llama3");

        assertThat(context.requestId()).isNotBlank();
        assertThat(context.correlationId()).isEqualTo(context.requestId());
        assertThat(context.routingKey()).isEqualTo(context.requestId());
        assertThat(context.createdAt()).isNotNull();
    }

    @Test
    @DisplayName("should reject blank model")
    void shouldRejectBlankModel() {
        assertThatThrownBy(() -> RequestContext.of(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
