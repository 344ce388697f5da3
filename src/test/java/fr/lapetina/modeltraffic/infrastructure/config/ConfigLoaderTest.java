package fr.lapetina.modeltraffic.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String ENDPOINTS = """
            models:
              - name: llama3
                endpoints:
                  - id: a
                    version: v1
                    url: http://a:11434
                    weight: %d
                  - id: %s
                    version: v1
                    url: http://b:11434
                    weight: %d
            """;

    private static ControllerConfig loadYaml(String yaml) {
        return new ConfigLoader("unused.yaml")
                .loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("should load from the classpath when no file exists")
        void shouldLoadFromClasspath() {
            ControllerConfig config = new ConfigLoader("test-config.yaml").load();

            assertThat(config.getRouting().getStrategy()).isEqualTo("balanced");
            assertThat(config.getPipeline().getRingBufferSize()).isEqualTo(64);
            assertThat(config.getRollout().getTrafficSteps()).containsExactly(10, 50, 100);
            assertThat(config.getModels()).hasSize(1);
            assertThat(config.getModels().get(0).getEndpoints())
                    .extracting(ControllerConfig.EndpointConfig::getWeight)
                    .containsExactly(60, 40);
            assertThat(config.getDeployments()).hasSize(1);
        }

        @Test
        @DisplayName("should apply defaults for omitted sections")
        void shouldApplyDefaults() {
            ControllerConfig config = loadYaml("store:\n  type: memory\n");

            assertThat(config.getRouting().getStrategy()).isEqualTo("balanced");
            assertThat(config.getRouting().getBalancedWeights().getLatency()).isEqualTo(0.4);
            assertThat(config.getHealthCheck().getDegradedThreshold()).isEqualTo(3);
            assertThat(config.getModels()).isEmpty();
        }

        @Test
        @DisplayName("should fail when the file is missing everywhere")
        void shouldFailWhenMissing() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("not found");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should reject an unknown routing strategy")
        void shouldRejectUnknownStrategy() {
            assertThatThrownBy(() -> loadYaml("routing:\n  strategy: random\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("random");
        }

        @Test
        @DisplayName("should reject weights that do not sum to 100")
        void shouldRejectBadWeightSum() {
            assertThatThrownBy(() -> loadYaml(ENDPOINTS.formatted(50, "b", 40)))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("sum to 100");
        }

        @Test
        @DisplayName("should reject duplicate endpoint ids")
        void shouldRejectDuplicateIds() {
            assertThatThrownBy(() -> loadYaml(ENDPOINTS.formatted(50, "a", 50)))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("Duplicate endpoint id");
        }

        @Test
        @DisplayName("should reject a ring buffer size that is not a power of 2")
        void shouldRejectRingBufferSize() {
            assertThatThrownBy(() -> loadYaml("pipeline:\n  ringBufferSize: 1000\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("power of 2");
        }

        @Test
        @DisplayName("should reject an unknown store type")
        void shouldRejectStoreType() {
            assertThatThrownBy(() -> loadYaml("store:\n  type: redis\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class)
                    .hasMessageContaining("redis");
        }

        @Test
        @DisplayName("should reject negative balanced weights")
        void shouldRejectNegativeBalancedWeights() {
            assertThatThrownBy(() -> loadYaml("routing:\n  balancedWeights:\n    cost: -1\n"))
                    .isInstanceOf(ConfigLoader.ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Reload")
    class Reload {

        @TempDir
        Path directory;

        @Test
        @DisplayName("should notify listeners with the old and new configuration")
        void shouldNotifyListeners() throws IOException {
            Path file = directory.resolve("config.yaml");
            Files.writeString(file, "routing:\n  strategy: cost_optimized\n");
            ConfigLoader loader = new ConfigLoader(file.toString());
            List<String> changes = new ArrayList<>();
            loader.addListener((oldConfig, newConfig) -> changes.add(
                    (oldConfig == null ? "none" : oldConfig.getRouting().getStrategy())
                            + "->" + newConfig.getRouting().getStrategy()));

            loader.load();
            Files.writeString(file, "routing:\n  strategy: performance_optimized\n");
            loader.reload();

            assertThat(changes).containsExactly("none->cost_optimized", "cost_optimized->performance_optimized");
            assertThat(loader.getCurrentConfig().getRouting().getStrategy()).isEqualTo("performance_optimized");
        }

        @Test
        @DisplayName("should keep the current configuration when the new one is invalid")
        void shouldKeepCurrentOnFailure() throws IOException {
            Path file = directory.resolve("config.yaml");
            Files.writeString(file, "routing:\n  strategy: cost_optimized\n");
            ConfigLoader loader = new ConfigLoader(file.toString());
            ControllerConfig loaded = loader.load();

            Files.writeString(file, "routing:\n  strategy: nonsense\n");
            ControllerConfig afterReload = loader.reload();

            assertThat(afterReload).isSameAs(loaded);
            assertThat(loader.getCurrentConfig().getRouting().getStrategy()).isEqualTo("cost_optimized");
        }
    }
}
