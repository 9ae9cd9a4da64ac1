package org.unchartedlands.simulation.config;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SchedulerSettingsTest {

    @Test
    void defaultsDeriveFromTickRate() {
        SchedulerSettings settings = SchedulerSettings.forTickRate(20);

        assertThat(settings.coarsePeriodTicks()).isEqualTo(20);
        assertThat(settings.populationPeriodTicks()).isEqualTo(36000);
        assertThat(settings.batchSize()).isEqualTo(10);
        assertThat(settings.statusLogIntervalTicks()).isEqualTo(6000);
        assertThat(settings.tickIntervalNanos()).isEqualTo(50_000_000L);
        assertThat(settings.ticksPerHour()).isEqualTo(72000.0);
    }

    @Test
    void missingKeysFallBackToTickRateDefaults() {
        SchedulerSettings settings = SchedulerSettings.fromConfig(ConfigFactory.parseString("""
                tick-rate = 30
                batch-size = 2
                """));

        assertThat(settings).isEqualTo(new SchedulerSettings(30, 30, 36000, 2, 9000));
    }

    @Test
    void nonPositiveValuesAreRejected() {
        assertThatThrownBy(() -> SchedulerSettings.fromConfig(ConfigFactory.parseString("batch-size = 0")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("batch-size must be >= 1 but was 0");
        assertThatThrownBy(() -> new SchedulerSettings(60, 0, 1, 1, 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("coarse-period-ticks");
        assertThatThrownBy(() -> SchedulerSettings.forTickRate(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
