package org.unchartedlands.simulation.model;

import com.typesafe.config.Config;
import org.unchartedlands.simulation.api.model.PopulationStatus;
import org.unchartedlands.simulation.api.model.PopulationWarningKind;
import org.unchartedlands.simulation.random.IRandomProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Periodic stochastic update of a settlement's population and happiness.
 * <p>
 * One evaluation runs these stages:
 * <ol>
 *   <li>Happiness moves towards a target derived from morale, resource sufficiency and crowding.</li>
 *   <li>Natural growth: {@code round(current × (1 + growthRate)^hours)}, capped at housing capacity.</li>
 *   <li>Immigration trial with a probability rising with happiness; adds a bounded batch within
 *       the free housing.</li>
 *   <li>Emigration trial with a probability rising as happiness falls; removes a share of the
 *       population.</li>
 *   <li>The result is clamped to {@code [1, capacity]}.</li>
 * </ol>
 * All randomness comes from the {@link IRandomProvider} passed in, so evaluations are
 * reproducible for a given seed.
 */
public final class PopulationDynamicsModel {

    /**
     * Tunables of the population model.
     *
     * @param maxGrowthRate          growth per hour at happiness 100 (and decline at 0)
     * @param maxImmigrationChance   immigration probability at happiness 100
     * @param maxEmigrationChance    emigration probability at happiness 0
     * @param maxImmigrantBatch      largest number of settlers arriving at once
     * @param emigrationFraction     share of the population leaving on a successful trial
     * @param happinessStep          largest happiness change per evaluation
     * @param sufficiencyBonus       happiness bonus when the resource buffer is met
     * @param shortagePenalty        happiness penalty when it is not
     * @param crowdingPenalty        happiness penalty when housing is full
     * @param lowHappinessThreshold  happiness below which a low-happiness warning is raised
     */
    public record Settings(
            double maxGrowthRate,
            double maxImmigrationChance,
            double maxEmigrationChance,
            int maxImmigrantBatch,
            double emigrationFraction,
            int happinessStep,
            int sufficiencyBonus,
            int shortagePenalty,
            int crowdingPenalty,
            int lowHappinessThreshold
    ) {

        public Settings {
            if (maxImmigrantBatch < 1) {
                throw new IllegalArgumentException("max-immigrant-batch must be >= 1");
            }
            if (maxImmigrationChance < 0 || maxImmigrationChance > 1 || maxEmigrationChance < 0 || maxEmigrationChance > 1) {
                throw new IllegalArgumentException("migration chances must be in [0, 1]");
            }
            if (emigrationFraction < 0 || emigrationFraction > 1) {
                throw new IllegalArgumentException("emigration-fraction must be in [0, 1]");
            }
        }

        public static Settings defaults() {
            return new Settings(0.05, 0.3, 0.3, 3, 0.1, 10, 10, 25, 10, 35);
        }

        public static Settings fromConfig(Config options) {
            Settings d = defaults();
            return new Settings(
                    options.hasPath("max-growth-rate") ? options.getDouble("max-growth-rate") : d.maxGrowthRate,
                    options.hasPath("max-immigration-chance") ? options.getDouble("max-immigration-chance") : d.maxImmigrationChance,
                    options.hasPath("max-emigration-chance") ? options.getDouble("max-emigration-chance") : d.maxEmigrationChance,
                    options.hasPath("max-immigrant-batch") ? options.getInt("max-immigrant-batch") : d.maxImmigrantBatch,
                    options.hasPath("emigration-fraction") ? options.getDouble("emigration-fraction") : d.emigrationFraction,
                    options.hasPath("happiness-step") ? options.getInt("happiness-step") : d.happinessStep,
                    options.hasPath("sufficiency-bonus") ? options.getInt("sufficiency-bonus") : d.sufficiencyBonus,
                    options.hasPath("shortage-penalty") ? options.getInt("shortage-penalty") : d.shortagePenalty,
                    options.hasPath("crowding-penalty") ? options.getInt("crowding-penalty") : d.crowdingPenalty,
                    options.hasPath("low-happiness-threshold") ? options.getInt("low-happiness-threshold") : d.lowHappinessThreshold);
        }
    }

    /**
     * Inputs of one evaluation.
     *
     * @param current             population before the evaluation, must be >= 1
     * @param capacity            housing capacity
     * @param previousHappiness   stored happiness
     * @param morale              morale from structures
     * @param resourcesSufficient whether stock covers the consumption buffer
     * @param elapsedHours        wall-clock hours since the last recorded change
     */
    public record Input(
            int current,
            int capacity,
            int previousHappiness,
            int morale,
            boolean resourcesSufficient,
            double elapsedHours
    ) {
    }

    /**
     * A warning raised by an evaluation.
     */
    public record Warning(PopulationWarningKind kind, String message) {
    }

    /**
     * Result of one evaluation.
     */
    public record Outcome(
            int previousPopulation,
            int finalPopulation,
            int capacity,
            int previousHappiness,
            int happiness,
            double growthRate,
            double immigrationChance,
            double emigrationChance,
            int immigrants,
            int emigrants,
            boolean immigrationSucceeded,
            boolean emigrationSucceeded,
            PopulationStatus status,
            String happinessDescription,
            List<Warning> warnings
    ) {

        /**
         * @return {@code true} if the population or happiness differ from the stored values
         */
        public boolean changed() {
            return finalPopulation != previousPopulation || happiness != previousHappiness;
        }

        public boolean populationChanged() {
            return finalPopulation != previousPopulation;
        }
    }

    private final Settings settings;

    public PopulationDynamicsModel(Settings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public Settings settings() {
        return settings;
    }

    public Outcome evaluate(Input input, IRandomProvider random) {
        if (input.current() < 1) {
            throw new IllegalArgumentException("Population must be initialized above 0, was " + input.current());
        }
        int capacity = Math.max(0, input.capacity());
        int upperBound = Math.max(1, capacity);

        int happiness = nextHappiness(input);
        double growthRate = growthRate(happiness);
        double immigrationChance = immigrationChance(happiness);
        double emigrationChance = emigrationChance(happiness);

        double hours = input.elapsedHours() > 0 ? input.elapsedHours() : 0;
        double grownExact = input.current() * Math.pow(1 + growthRate, hours);
        if (Double.isNaN(grownExact)) {
            grownExact = input.current();
        }
        // capped before narrowing, long windows overflow int
        int grown = (int) Math.round(Math.min(grownExact, capacity));

        int immigrants = 0;
        boolean immigrationSucceeded = false;
        int headroom = capacity - Math.max(grown, 1);
        if (immigrationChance > 0 && headroom > 0 && random.nextDouble() < immigrationChance) {
            immigrants = Math.min(headroom, 1 + random.nextInt(settings.maxImmigrantBatch()));
            immigrationSucceeded = true;
        }

        int emigrants = 0;
        boolean emigrationSucceeded = false;
        if (emigrationChance > 0 && random.nextDouble() < emigrationChance) {
            emigrants = (int) Math.max(1, Math.round(input.current() * settings.emigrationFraction()));
            emigrationSucceeded = true;
        }

        int finalPopulation = Math.max(1, Math.min(upperBound, grown + immigrants - emigrants));

        List<Warning> warnings = new ArrayList<>();
        if (emigrationSucceeded) {
            warnings.add(new Warning(PopulationWarningKind.EMIGRATION_RISK,
                    String.format("%d settlers left because of low happiness", emigrants)));
        }
        if (happiness < settings.lowHappinessThreshold() && emigrationChance > 0) {
            warnings.add(new Warning(PopulationWarningKind.LOW_HAPPINESS,
                    String.format("Happiness is low (%d), settlers are considering leaving", happiness)));
        }
        if (immigrationChance > 0 && Math.max(grown, 1) >= capacity) {
            warnings.add(new Warning(PopulationWarningKind.NO_HOUSING,
                    "Settlers want to join but there is no free housing"));
        }

        PopulationStatus status;
        if (finalPopulation > input.current()) {
            status = PopulationStatus.GROWING;
        } else if (finalPopulation < input.current()) {
            status = PopulationStatus.DECLINING;
        } else {
            status = PopulationStatus.STABLE;
        }

        return new Outcome(input.current(), finalPopulation, capacity, input.previousHappiness(), happiness,
                growthRate, immigrationChance, emigrationChance, immigrants, emigrants,
                immigrationSucceeded, emigrationSucceeded, status, describeHappiness(happiness), List.copyOf(warnings));
    }

    /**
     * Moves the stored happiness towards its target by at most {@code happinessStep} points.
     */
    int nextHappiness(Input input) {
        int target = input.morale()
                + (input.resourcesSufficient() ? settings.sufficiencyBonus() : -settings.shortagePenalty());
        if (input.capacity() > 0 && input.current() >= input.capacity()) {
            target -= settings.crowdingPenalty();
        }
        target = clampHappiness(target);
        int previous = clampHappiness(input.previousHappiness());
        int delta = Math.max(-settings.happinessStep(), Math.min(settings.happinessStep(), target - previous));
        return clampHappiness(previous + delta);
    }

    public double growthRate(int happiness) {
        return settings.maxGrowthRate() * (happiness - 50) / 50.0;
    }

    public double immigrationChance(int happiness) {
        return settings.maxImmigrationChance() * Math.max(0, (happiness - 50) / 50.0);
    }

    public double emigrationChance(int happiness) {
        return settings.maxEmigrationChance() * Math.max(0, (50 - happiness) / 50.0);
    }

    public static String describeHappiness(int happiness) {
        if (happiness < 20) return "Miserable";
        if (happiness < 35) return "Unhappy";
        if (happiness < 65) return "Content";
        if (happiness < 85) return "Happy";
        return "Thrilled";
    }

    private static int clampHappiness(int happiness) {
        return Math.max(0, Math.min(100, happiness));
    }
}
