package com.driftguard.core.config;

import com.driftguard.core.detection.DetectorKind;
import com.driftguard.core.drift.EmbedderType;
import com.driftguard.core.drift.SimilarityMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MonitorConfigLoader}.
 */
class MonitorConfigLoaderTest {

    @Test
    @DisplayName("Should load test configuration from classpath")
    void shouldLoadFromClasspath() {
        MonitorConfig config = MonitorConfigLoader.fromClasspath("test-driftguard.yml");

        assertThat(config.getLookupDirectory()).isEqualTo("test-lookups");
        assertThat(config.getAnomaly().getFields()).containsExactly("response_time");
        assertThat(config.getAnomaly().detectorKinds()).containsExactly(DetectorKind.ZSCORE);
        assertThat(config.getAnomaly().getThreshold()).isEqualTo(2.5);
        assertThat(config.getAnomaly().getWindow()).isEqualTo(20);
        assertThat(config.getBaseline().getComparison()).isEqualTo("ratio");
        assertThat(config.getBaseline().getBaselineFile()).isEqualTo("baselines.csv");
        assertThat(config.getDrift().isEnabled()).isFalse();
        assertThat(config.getDrift().embedderType()).isEqualTo(EmbedderType.HASH);
        assertThat(config.getSemantic().similarityMethod()).isEqualTo(SimilarityMethod.EUCLIDEAN);
        assertThat(config.getMetrics().isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should load the bundled default configuration")
    void shouldLoadDefaultResource() {
        MonitorConfig config = MonitorConfigLoader.load((String) null);

        assertThat(config.getAnomaly().detectorKinds()).hasSize(4);
        assertThat(config.getMetrics().isIncludeTrends()).isTrue();
    }

    @Test
    @DisplayName("Should fall back to classpath when the path does not exist")
    void shouldFallBackForMissingPath() {
        MonitorConfig config = MonitorConfigLoader.load("/no/such/driftguard.yml");

        assertThat(config.getLookupDirectory()).isEqualTo("lookups");
    }

    @Test
    @DisplayName("Should load configuration from a file")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("monitor.yml");
        Files.writeString(file, "lookupDirectory: /data/lookups\nsemantic:\n  enabled: true\n",
                StandardCharsets.UTF_8);

        MonitorConfig config = MonitorConfigLoader.load(file.toString());

        assertThat(config.getLookupDirectory()).isEqualTo("/data/lookups");
        assertThat(config.getSemantic().isEnabled()).isTrue();
        assertThat(config.getAnomaly().getMethod()).isEqualTo("zscore");
    }

    @Test
    @DisplayName("Should use defaults for an empty document")
    void shouldUseDefaultsForEmptyDocument() {
        MonitorConfig config = MonitorConfigLoader.fromClasspath("empty-driftguard.yml");

        assertThat(config.getAnomaly().getThreshold()).isEqualTo(2.0);
        assertThat(config.getDrift().getThreshold()).isEqualTo(0.8);
        assertThat(config.getSemantic().isEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should report every validation error at once")
    void shouldCollectValidationErrors() {
        assertThatThrownBy(() -> MonitorConfigLoader.fromClasspath("invalid-driftguard.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("validation failed")
                .hasMessageContaining("anomaly.fields")
                .hasMessageContaining("anomaly.method")
                .hasMessageContaining("anomaly.threshold")
                .hasMessageContaining("anomaly.window")
                .hasMessageContaining("drift.threshold")
                .hasMessageContaining("drift.embedder")
                .hasMessageContaining("semantic.method");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> MonitorConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> MonitorConfigLoader.fromFile("/no/such/file.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Config file not found");
    }

    @Test
    @DisplayName("Should load a document with unknown sections and keys")
    void shouldIgnoreUnknownKeys() {
        MonitorConfig config = MonitorConfigLoader.fromClasspath("unknown-keys-driftguard.yml");

        assertThat(config.getLookupDirectory()).isEqualTo("test-lookups");
        assertThat(config.getDrift().getThreshold()).isEqualTo(0.6);
        assertThat(config.getDrift().getField()).isEqualTo("response");
    }

    @Test
    @DisplayName("Should name unknown sections and section keys")
    void shouldReportUnknownKeys() {
        Map<String, Object> document = Map.of(
                "lookupDirectory", "lookups",
                "alerts", Map.of("channel", "ops"),
                "drift", Map.of("threshold", 0.6, "colour", "red"),
                "anomaly", Map.of("fields", List.of("response_time")));

        List<String> unknown = MonitorConfigLoader.unknownKeys(document);

        assertThat(unknown).containsExactlyInAnyOrder("alerts", "drift.colour");
    }

    @Test
    @DisplayName("Should keep section defaults when a section is empty")
    void shouldKeepDefaultsForEmptySection(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("monitor.yml");
        Files.writeString(file, "drift:\nsemantic:\n  enabled: true\n", StandardCharsets.UTF_8);

        MonitorConfig config = MonitorConfigLoader.fromFile(file.toString());

        assertThat(config.getDrift()).isNotNull();
        assertThat(config.getDrift().getThreshold()).isEqualTo(0.8);
        assertThat(config.getSemantic().isEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should reject a document that is not a mapping")
    void shouldRejectNonMappingDocument(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("monitor.yml");
        Files.writeString(file, "- anomaly\n- drift\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> MonitorConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("must be a YAML mapping");
    }

    @Test
    @DisplayName("Should reject duplicate keys with the source in the message")
    void shouldRejectDuplicateKeys(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("monitor.yml");
        Files.writeString(file, "lookupDirectory: a\nlookupDirectory: b\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> MonitorConfigLoader.fromFile(file.toString()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Malformed monitor config")
                .hasMessageContaining(file.toString());
    }
}
