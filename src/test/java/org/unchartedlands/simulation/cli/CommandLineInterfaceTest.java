package org.unchartedlands.simulation.cli;

import com.typesafe.config.Config;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.unchartedlands.simulation.api.model.SettlementDetail;
import org.unchartedlands.simulation.junit.extensions.logging.AllowLog;
import org.unchartedlands.simulation.junit.extensions.logging.LogLevel;
import org.unchartedlands.simulation.junit.extensions.logging.LogWatchExtension;
import org.unchartedlands.simulation.store.InMemorySettlementStore;
import picocli.CommandLine;

import java.io.File;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    private static final String TEST_CONFIG = "org/unchartedlands/simulation/config/test-simulation.conf";

    private static CommandLineInterface parse(String... args) {
        CommandLineInterface cli = new CommandLineInterface();
        new CommandLine(cli).parseArgs(args);
        return cli;
    }

    @Test
    void optionsHaveDefaults() {
        CommandLineInterface cli = parse();

        assertNull(cli.configFile);
        assertEquals(3, cli.demoSettlements);
        assertEquals(0, cli.runSeconds);
    }

    @Test
    void overridesWinOverConfigFile() {
        CommandLineInterface cli = parse("-c", TEST_CONFIG,
                "-Dsimulation.scheduler.batch-size=7", "--demo-settlements", "5");

        Config config = cli.loadConfiguration();

        assertEquals(new File(TEST_CONFIG), cli.configFile);
        assertEquals(5, cli.demoSettlements);
        assertEquals(7, config.getInt("simulation.scheduler.batch-size"));
        assertEquals(30, config.getInt("simulation.scheduler.tick-rate"));
        assertEquals(60, config.getInt("simulation.scheduler.coarse-period-ticks"));
    }

    @Test
    @AllowLog(level = LogLevel.WARN, messagePattern = "Configuration file 'simulation.conf' not found.*")
    void missingConfigFileFallsBackToDefaults() {
        Config config = parse().loadConfiguration();

        assertEquals(60, config.getInt("simulation.scheduler.tick-rate"));
        assertEquals("INFO", config.getString("logging.default-level"));
    }

    @Test
    void demoSettlementsAreCompleteAndOwnedByTheDemoPlayer() {
        InMemorySettlementStore store = new InMemorySettlementStore();

        DemoSettlements.seed(store, 4);

        assertThat(store.listActiveSettlementIds(DemoSettlements.OWNER_ID))
                .containsExactly("settlement-1", "settlement-2", "settlement-3", "settlement-4");
        SettlementDetail detail = store.fetchSettlementDetail("settlement-2").orElseThrow();
        assertThat(detail.isComplete()).isTrue();
        assertThat(detail.biome().name()).isEqualTo("Tropical Rainforest");
        assertThat(store.fetchSettlementStructures("settlement-2")).hasSize(5);
        assertThat(store.fetchPopulation("settlement-2").orElseThrow().current()).isEqualTo(5);
    }
}
