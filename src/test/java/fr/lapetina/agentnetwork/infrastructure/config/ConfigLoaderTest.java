package fr.lapetina.agentnetwork.infrastructure.config;

import fr.lapetina.agentnetwork.domain.model.ModelType;
import fr.lapetina.agentnetwork.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        AgentNetworkConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getServer().getHost()).isEqualTo("127.0.0.1");
        assertThat(config.getServer().getPort()).isZero();
        assertThat(config.getProvider().getType()).isEqualTo("ollama");
        assertThat(config.getModels().forType(ModelType.NORMAL).getName()).isEqualTo("llama3");
        assertThat(config.getModels().forType(ModelType.THINKING).getName()).isEqualTo("deepseek-r1");

        List<AgentNetworkConfig.EndpointConfig> endpoints = config.getRateLimit().getEndpoints();
        assertThat(endpoints).hasSize(1);
        assertThat(endpoints.get(0).getName()).isEqualTo("test_api");
        assertThat(endpoints.get(0).getMaxTokens()).isEqualTo(100);
        assertThat(endpoints.get(0).getRefillRate()).isEqualTo(100.0);
        assertThat(endpoints.get(0).getMaxRetries()).isEqualTo(1);

        assertThat(config.getOrchestration().getCallTimeoutMs()).isEqualTo(2000);
        assertThat(config.getOrchestration().getHistoryWindow()).isEqualTo(3);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("agent_network_test");
    }

    @Test
    @DisplayName("should load the bundled default configuration")
    void shouldLoadBundledConfig() {
        AgentNetworkConfig config = new ConfigLoader("config.yaml").load();

        assertThat(config.getProvider().getType()).isEqualTo("gemini");
        assertThat(config.getRateLimit().getEndpoints())
                .extracting(AgentNetworkConfig.EndpointConfig::getName)
                .contains("gemini_api");
    }

    @Test
    @DisplayName("should use defaults for an empty document and for omitted sections")
    void shouldApplyDefaults() {
        AgentNetworkConfig empty = new ConfigLoader("unused.yaml").loadFromStream(yaml(""));

        assertThat(empty.getServer().getPort()).isEqualTo(5000);
        assertThat(empty.getProvider().getType()).isEqualTo("gemini");
        assertThat(empty.getProvider().getApiKeyEnv()).isEqualTo("GEMINI_API_KEY");
        assertThat(empty.getRateLimit().getEndpoints()).hasSize(1);
        assertThat(empty.getRateLimit().getEndpoints().get(0).getMaxTokens()).isEqualTo(15);
        assertThat(empty.getRateLimit().getEndpoints().get(0).getRefillRate()).isEqualTo(0.25);
        assertThat(empty.getRateLimit().getBackoff().getBaseDelayMs()).isEqualTo(1000);
        assertThat(empty.getRateLimit().getBackoff().getMaxDelayMs()).isEqualTo(60000);
        assertThat(empty.getOrchestration().getMaxConcurrency()).isEqualTo(4);

        AgentNetworkConfig partial = new ConfigLoader("unused.yaml").loadFromStream(yaml("""
                server:
                  port: 8081
                """));
        assertThat(partial.getServer().getPort()).isEqualTo(8081);
        assertThat(partial.getServer().getHost()).isEqualTo("0.0.0.0");
        assertThat(partial.getOrchestration().getPromptsResource()).isEqualTo("prompts.md");
    }

    @Test
    @DisplayName("should fail for a missing file")
    void shouldFailForMissingFile() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("should fail for malformed YAML")
    void shouldFailForMalformedYaml() {
        assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("server: [unclosed")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("Invalid configuration");
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("should reject non-positive concurrency")
        void shouldRejectConcurrency() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("""
                    orchestration:
                      maxConcurrency: 0
                    """)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("maxConcurrency");
        }

        @Test
        @DisplayName("should reject duplicate endpoint names")
        void shouldRejectDuplicateEndpoints() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("""
                    rateLimit:
                      endpoints:
                        - name: api
                        - name: api
                    """)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("Duplicate");
        }

        @Test
        @DisplayName("should reject a non-positive refill rate")
        void shouldRejectRefillRate() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("""
                    rateLimit:
                      endpoints:
                        - name: api
                          refillRate: 0
                    """)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("refillRate");
        }

        @Test
        @DisplayName("should reject an inverted jitter range")
        void shouldRejectJitter() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("""
                    rateLimit:
                      backoff:
                        jitterMin: 1.2
                        jitterMax: 1.1
                    """)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("jitter");
        }

        @Test
        @DisplayName("should require a model name per type")
        void shouldRequireModelNames() {
            assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml("""
                    models:
                      thinking:
                        endpoint: gemini_api
                    """)))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("models.thinking.name");
        }
    }

    @Test
    @DisplayName("should notify listeners and keep the current config when a reload fails")
    void shouldReloadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("network.yaml");
        Files.writeString(file, """
                rateLimit:
                  endpoints:
                    - name: api
                      maxTokens: 5
                """);

        ConfigLoader loader = new ConfigLoader(file.toString());
        List<String> changes = new ArrayList<>();
        loader.addListener((oldConfig, newConfig) -> changes.add(
                (oldConfig == null ? "none" : String.valueOf(oldConfig.getRateLimit().getEndpoints().get(0).getMaxTokens()))
                        + "->" + newConfig.getRateLimit().getEndpoints().get(0).getMaxTokens()));

        loader.load();
        Files.writeString(file, """
                rateLimit:
                  endpoints:
                    - name: api
                      maxTokens: 9
                """);
        AgentNetworkConfig reloaded = loader.reload();

        assertThat(reloaded.getRateLimit().getEndpoints().get(0).getMaxTokens()).isEqualTo(9);
        assertThat(changes).containsExactly("none->5", "5->9");

        Files.writeString(file, """
                orchestration:
                  callTimeoutMs: -1
                """);
        AgentNetworkConfig kept = loader.reload();

        assertThat(kept).isSameAs(reloaded);
        assertThat(loader.getCurrentConfig()).isSameAs(reloaded);
        assertThat(changes).hasSize(2);
        loader.close();
    }
}
