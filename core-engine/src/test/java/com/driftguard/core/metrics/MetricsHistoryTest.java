package com.driftguard.core.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MetricsHistory}.
 */
class MetricsHistoryTest {

    @Test
    @DisplayName("Should keep the newest entries up to capacity")
    void shouldBoundEntries() {
        MetricsHistory history = new MetricsHistory(2);
        history.add(Map.of("response_time", 1.0));
        history.add(Map.of("response_time", 2.0));
        history.add(Map.of("response_time", 3.0));

        assertThat(history.size()).isEqualTo(2);
        assertThat(history.entries()).extracting(e -> e.get("response_time")).containsExactly(2.0, 3.0);
    }

    @Test
    @DisplayName("Should copy entries on insertion")
    void shouldCopyEntries() {
        MetricsHistory history = new MetricsHistory();
        Map<String, Double> metrics = new HashMap<>();
        metrics.put("token_count", 10.0);
        history.add(metrics);
        metrics.put("token_count", 99.0);

        assertThat(history.entries().get(0)).containsEntry("token_count", 10.0);
        assertThatThrownBy(() -> history.entries().get(0).put("x", 1.0))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
