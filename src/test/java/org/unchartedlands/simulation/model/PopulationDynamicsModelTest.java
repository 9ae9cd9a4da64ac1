package org.unchartedlands.simulation.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.unchartedlands.simulation.api.model.PopulationStatus;
import org.unchartedlands.simulation.api.model.PopulationWarningKind;
import org.unchartedlands.simulation.random.IRandomProvider;
import org.unchartedlands.simulation.random.SeededRandomProvider;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class PopulationDynamicsModelTest {

    private final PopulationDynamicsModel model = new PopulationDynamicsModel(PopulationDynamicsModel.Settings.defaults());

    /**
     * Returns the same draw every time, so trials succeed or fail on purpose.
     */
    private record FixedRandom(double nextDouble, int nextInt) implements IRandomProvider {
        @Override
        public int nextInt(int bound) {
            return Math.min(nextInt, bound - 1);
        }

        @Override
        public double nextDouble() {
            return nextDouble;
        }

        @Override
        public IRandomProvider deriveFor(String scope, String key) {
            return this;
        }
    }

    private static final IRandomProvider TRIALS_FAIL = new FixedRandom(0.999, 0);
    private static final IRandomProvider TRIALS_SUCCEED = new FixedRandom(0.0, 2);

    private static PopulationDynamicsModel.Input input(int current, int capacity, int happiness, int morale,
                                                       boolean sufficient, double hours) {
        return new PopulationDynamicsModel.Input(current, capacity, happiness, morale, sufficient, hours);
    }

    @Test
    void happinessMovesTowardsTargetByBoundedStep() {
        PopulationDynamicsModel.Outcome rising = model.evaluate(input(5, 20, 50, 90, true, 0), TRIALS_FAIL);
        PopulationDynamicsModel.Outcome falling = model.evaluate(input(5, 20, 50, 50, false, 0), TRIALS_FAIL);
        PopulationDynamicsModel.Outcome settled = model.evaluate(input(5, 20, 58, 50, true, 0), TRIALS_FAIL);

        assertEquals(60, rising.happiness());
        assertEquals(40, falling.happiness());
        assertEquals(60, settled.happiness());
    }

    @Test
    void lowHappinessWarningIsRaisedOnce() {
        PopulationDynamicsModel.Outcome outcome = model.evaluate(input(20, 30, 30, 0, false, 0), TRIALS_FAIL);

        assertEquals(20, outcome.happiness());
        assertThat(outcome.warnings())
                .extracting(PopulationDynamicsModel.Warning::kind)
                .containsExactly(PopulationWarningKind.LOW_HAPPINESS);
        assertFalse(outcome.emigrationSucceeded());
        assertEquals(20, outcome.finalPopulation());
        assertEquals(PopulationStatus.STABLE, outcome.status());
        assertEquals("Unhappy", outcome.happinessDescription());
    }

    @Test
    void successfulEmigrationRemovesShareOfPopulation() {
        PopulationDynamicsModel.Outcome outcome = model.evaluate(input(20, 30, 30, 0, false, 0), TRIALS_SUCCEED);

        assertTrue(outcome.emigrationSucceeded());
        assertEquals(2, outcome.emigrants());
        assertEquals(18, outcome.finalPopulation());
        assertEquals(PopulationStatus.DECLINING, outcome.status());
        assertThat(outcome.warnings())
                .extracting(PopulationDynamicsModel.Warning::kind)
                .containsExactly(PopulationWarningKind.EMIGRATION_RISK, PopulationWarningKind.LOW_HAPPINESS);
        assertTrue(outcome.changed());
    }

    @Test
    void successfulImmigrationAddsBatchWithinHousing() {
        PopulationDynamicsModel.Outcome outcome = model.evaluate(input(5, 20, 100, 100, true, 0), TRIALS_SUCCEED);

        assertEquals(100, outcome.happiness());
        assertTrue(outcome.immigrationSucceeded());
        assertEquals(3, outcome.immigrants());
        assertEquals(8, outcome.finalPopulation());
        assertEquals(PopulationStatus.GROWING, outcome.status());
        assertEquals("Thrilled", outcome.happinessDescription());
        assertTrue(outcome.warnings().isEmpty());
    }

    @Test
    void immigrationIsBoundedByFreeHousing() {
        PopulationDynamicsModel.Outcome outcome = model.evaluate(input(9, 10, 100, 100, true, 0), TRIALS_SUCCEED);

        assertEquals(1, outcome.immigrants());
        assertEquals(10, outcome.finalPopulation());
    }

    @Test
    void fullHousingRaisesNoHousingWarning() {
        PopulationDynamicsModel.Outcome outcome = model.evaluate(input(10, 10, 100, 100, true, 0), TRIALS_SUCCEED);

        assertFalse(outcome.immigrationSucceeded());
        assertEquals(10, outcome.finalPopulation());
        assertThat(outcome.warnings())
                .extracting(PopulationDynamicsModel.Warning::kind)
                .containsExactly(PopulationWarningKind.NO_HOUSING);
        assertFalse(outcome.changed());
        assertEquals(PopulationStatus.STABLE, outcome.status());
    }

    @Test
    void naturalGrowthCompoundsOverElapsedHours() {
        PopulationDynamicsModel.Outcome outcome = model.evaluate(input(10, 100, 100, 100, true, 10), TRIALS_FAIL);

        // 10 * 1.05^10 = 16.29
        assertEquals(16, outcome.finalPopulation());
        assertEquals(0.05, outcome.growthRate(), 1e-12);
        assertTrue(outcome.populationChanged());
    }

    @Test
    void growthIsCappedAtHousingCapacity() {
        PopulationDynamicsModel.Outcome outcome = model.evaluate(input(10, 12, 100, 100, true, 48), TRIALS_FAIL);

        assertEquals(12, outcome.finalPopulation());
    }

    @Test
    void populationNeverDropsBelowOne() {
        PopulationDynamicsModel.Outcome outcome = model.evaluate(input(1, 0, 0, 0, false, 100), TRIALS_SUCCEED);

        assertTrue(outcome.emigrationSucceeded());
        assertEquals(1, outcome.finalPopulation());
        assertEquals(PopulationStatus.STABLE, outcome.status());
        assertEquals("Miserable", outcome.happinessDescription());
    }

    @Test
    void finalPopulationStaysWithinBoundsForAnySeed() {
        for (long seed = 0; seed < 200; seed++) {
            SeededRandomProvider random = new SeededRandomProvider(seed);
            int current = 1 + random.nextInt(60);
            int capacity = random.nextInt(50);
            int happiness = random.nextInt(101);
            int morale = random.nextInt(101);
            double hours = random.nextDouble() * 24;

            PopulationDynamicsModel.Outcome outcome = model.evaluate(
                    input(current, capacity, happiness, morale, random.nextDouble() < 0.5, hours), random);

            assertThat(outcome.finalPopulation()).isBetween(1, Math.max(1, capacity));
            assertThat(outcome.happiness()).isBetween(0, 100);
            long lowHappiness = outcome.warnings().stream()
                    .filter(w -> w.kind() == PopulationWarningKind.LOW_HAPPINESS).count();
            assertThat(lowHappiness).isLessThanOrEqualTo(1);
        }
    }

    @Test
    void longElapsedWindowFillsHousingInsteadOfCollapsing() {
        for (double hours : new double[] {48, 500, 2000, 10_000, Double.POSITIVE_INFINITY}) {
            PopulationDynamicsModel.Outcome outcome = model.evaluate(
                    input(10, 50, 100, 100, true, hours), new SeededRandomProvider(1));

            assertEquals(50, outcome.finalPopulation(), "hours=" + hours);
            assertEquals(PopulationStatus.GROWING, outcome.status(), "hours=" + hours);
        }
    }

    @Test
    void sameSeedGivesSameOutcome() {
        PopulationDynamicsModel.Input in = input(25, 40, 70, 80, true, 3.5);

        List<Integer> first = List.of(
                model.evaluate(in, new SeededRandomProvider(42)).finalPopulation(),
                model.evaluate(in, new SeededRandomProvider(42).deriveFor("population", "s-1")).finalPopulation());
        List<Integer> second = List.of(
                model.evaluate(in, new SeededRandomProvider(42)).finalPopulation(),
                model.evaluate(in, new SeededRandomProvider(42).deriveFor("population", "s-1")).finalPopulation());

        assertEquals(first, second);
    }

    @Test
    void uninitializedPopulationIsRejected() {
        assertThatThrownBy(() -> model.evaluate(input(0, 10, 50, 50, true, 1), TRIALS_FAIL))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void chancesFollowHappiness() {
        assertEquals(0.0, model.immigrationChance(50), 1e-12);
        assertEquals(0.3, model.immigrationChance(100), 1e-12);
        assertEquals(0.3, model.emigrationChance(0), 1e-12);
        assertEquals(0.0, model.emigrationChance(75), 1e-12);
        assertEquals(-0.05, model.growthRate(0), 1e-12);
    }

    @Test
    void happinessDescriptionsHaveFixedBoundaries() {
        assertEquals("Miserable", PopulationDynamicsModel.describeHappiness(19));
        assertEquals("Unhappy", PopulationDynamicsModel.describeHappiness(20));
        assertEquals("Content", PopulationDynamicsModel.describeHappiness(35));
        assertEquals("Happy", PopulationDynamicsModel.describeHappiness(65));
        assertEquals("Thrilled", PopulationDynamicsModel.describeHappiness(85));
    }
}
