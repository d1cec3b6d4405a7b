package com.fleetsentinel.cycle;

import com.fleetsentinel.core.config.EngineConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AnomalyEngine} wiring.
 */
class AnomalyEngineTest {

    private MutableClock clock;
    private FleetFixture fleet;
    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(FleetFixture.NOW);
        fleet = new FleetFixture()
                .container("web-1", 1L, 95.0, 92.0)
                .container("db-1", 2L, 20.0, 30.0);
        registry = new SimpleMeterRegistry();
    }

    @Test
    @DisplayName("Should run cycles end to end and keep incidents across cycles")
    void shouldRunCycles() {
        EngineConfig config = new EngineConfig();
        config.getIsolationForest().setEnabled(false);

        try (AnomalyEngine engine = AnomalyEngine.create(config, fleet, registry, clock, () -> new Random(3))) {
            List<ContainerTarget> targets = List.of(
                    new ContainerTarget("web-1", "web", 1, "local"),
                    new ContainerTarget("db-1", "db", 1, "local"));

            CycleReport first = engine.runCycle(targets);
            assertThat(first.getInsights()).hasSize(2);
            assertThat(first.getIncidents()).hasSize(1);
            assertThat(engine.getForestDetector()).isEmpty();

            clock.advance(Duration.ofMinutes(16));
            CycleReport second = engine.runCycle(targets);
            // cooldown expired: flags come back and join the open incident
            assertThat(second.getInsights()).hasSize(2);
            assertThat(second.getGrouping().getIncidentsCreated()).isZero();
            assertThat(engine.getIncidentGrouper().getActiveIncidents()).singleElement()
                    .satisfies(i -> assertThat(i.getInsightCount()).isEqualTo(4));
        }
        assertThat(registry.get("fleet_sentinel.cycles").counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should train a model per container when the Isolation Forest is enabled")
    void shouldTrainForest() {
        EngineConfig config = new EngineConfig();
        config.getIsolationForest().setMinTrainingSamples(20);
        config.getIsolationForest().setSampleSize(64);

        try (AnomalyEngine engine = AnomalyEngine.create(config, fleet, registry, clock, () -> new Random(3))) {
            engine.runCycle(List.of(ContainerTarget.of("db-1", "db")));

            assertThat(engine.getForestDetector()).hasValueSatisfying(
                    forest -> assertThat(forest.getCache().get("db-1")).isPresent());
        }
    }

    @Test
    @DisplayName("Should refuse to start with an invalid configuration")
    void shouldRejectInvalidConfig() {
        EngineConfig config = new EngineConfig();
        config.getStatistical().setWindowSize(1);

        assertThatThrownBy(() -> AnomalyEngine.create(config, fleet, registry))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("statistical.windowSize");
    }
}
