package org.unchartedlands.simulation.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unchartedlands.simulation.config.ConfigLoader;
import org.unchartedlands.simulation.config.LoggingConfigurator;
import org.unchartedlands.simulation.events.LoggingEventSink;
import org.unchartedlands.simulation.scheduler.TickScheduler;
import org.unchartedlands.simulation.store.InMemorySettlementStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Command line of the standalone node: loads the configuration, seeds an in-memory store with
 * demo settlements and runs the tick scheduler until interrupted or for a fixed time.
 */
@Command(
    name = "settlement-simulation",
    mixinStandardHelpOptions = true,
    version = "Settlement Simulation 0.1",
    description = "Runs the settlement simulation against an in-memory store and logs the emitted events."
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CommandLineInterface.class);

    static final String SERVICE_NAME = "tick-scheduler";

    @Option(names = {"-c", "--config"}, description = "Path to the HOCON configuration file.")
    File configFile;

    @Option(names = "-D", mapFallbackValue = "",
            description = "Override a HOCON configuration value. For example: -Dsimulation.scheduler.tick-rate=30")
    Map<String, String> hoconOverrides;

    @Option(names = "--demo-settlements", defaultValue = "3",
            description = "Number of demo settlements to seed (default: ${DEFAULT-VALUE}).")
    int demoSettlements;

    @Option(names = "--run-seconds", defaultValue = "0",
            description = "Stop after this many seconds; 0 runs until interrupted (default: ${DEFAULT-VALUE}).")
    long runSeconds;

    @Override
    public Integer call() throws Exception {
        Config config = loadConfiguration();
        LoggingConfigurator.configure(config);

        InMemorySettlementStore store = new InMemorySettlementStore();
        DemoSettlements.seed(store, demoSettlements);
        LoggingEventSink sink = new LoggingEventSink();

        TickScheduler scheduler = new TickScheduler(SERVICE_NAME, config.getConfig("simulation"), store, sink);
        CountDownLatch shutdown = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received. Stopping scheduler...");
            scheduler.close();
            shutdown.countDown();
        }));

        scheduler.start();
        scheduler.registerOwner(DemoSettlements.OWNER_ID, DemoSettlements.WORLD_ID);

        if (runSeconds > 0) {
            shutdown.await(runSeconds, TimeUnit.SECONDS);
            log.info("Final metrics: {}", scheduler.getMetrics());
            log.info("Events broadcast: {}", sink.getBroadcastCount());
            scheduler.close();
        } else {
            shutdown.await();
        }
        return 0;
    }

    /**
     * Loads the configuration through {@link ConfigLoader} and applies {@code -D} overrides on top.
     */
    Config loadConfiguration() {
        Config base = configFile != null ? ConfigLoader.load(configFile.getPath()) : ConfigLoader.load();
        Config cliConfig = hoconOverrides != null
                ? ConfigFactory.parseMap(hoconOverrides)
                : ConfigFactory.empty();
        return cliConfig.withFallback(base).resolve();
    }
}
