package org.unchartedlands.simulation.model;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.unchartedlands.simulation.api.model.ExtractorType;
import org.unchartedlands.simulation.api.model.ResourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Balance tables of the production model: base extractor rates, level multipliers and
 * biome efficiencies. Loaded from the {@code simulation.balance} block:
 * <pre>
 * balance {
 *   production-rates = [ { extractor = FARM, resource = food, base-rate = 10 } ]
 *   level-multipliers = [ 1, 1.5, 2.25 ]
 *   biome-efficiencies = [ { biome = "Tropical Rainforest", resource = food, efficiency = 1.5 } ]
 * }
 * </pre>
 */
public final class GameBalance {

    public static final String CONFIG_PATH = "simulation.balance";

    private final Map<ExtractorType, Map<ResourceType, Double>> baseRates;
    private final double[] levelMultipliers;
    private final Map<String, Map<ResourceType, Double>> biomeEfficiencies;

    public GameBalance(Map<ExtractorType, Map<ResourceType, Double>> baseRates,
                       List<Double> levelMultipliers,
                       Map<String, Map<ResourceType, Double>> biomeEfficiencies) {
        if (levelMultipliers.isEmpty()) {
            throw new IllegalArgumentException("At least one level multiplier must be configured.");
        }
        this.baseRates = new EnumMap<>(ExtractorType.class);
        baseRates.forEach((extractor, rates) -> this.baseRates.put(extractor, Collections.unmodifiableMap(new EnumMap<>(rates))));
        this.levelMultipliers = levelMultipliers.stream().mapToDouble(Double::doubleValue).toArray();
        this.biomeEfficiencies = new HashMap<>();
        biomeEfficiencies.forEach((biome, efficiencies) ->
                this.biomeEfficiencies.put(normalizeBiome(biome), Collections.unmodifiableMap(new EnumMap<>(efficiencies))));
    }

    /**
     * @return the balance shipped in {@code reference.conf}
     */
    public static GameBalance defaults() {
        return fromConfig(ConfigFactory.defaultReference().getConfig(CONFIG_PATH));
    }

    public static GameBalance fromConfig(Config options) {
        Map<ExtractorType, Map<ResourceType, Double>> rates = new EnumMap<>(ExtractorType.class);
        if (options.hasPath("production-rates")) {
            for (Config entry : options.getConfigList("production-rates")) {
                ExtractorType extractor = ExtractorType.valueOf(entry.getString("extractor").trim().toUpperCase(Locale.ROOT));
                ResourceType resource = ResourceType.fromKey(entry.getString("resource"));
                double baseRate = entry.getDouble("base-rate");
                if (baseRate < 0) {
                    throw new IllegalArgumentException("base-rate must be >= 0 for " + extractor + "/" + resource);
                }
                rates.computeIfAbsent(extractor, k -> new EnumMap<>(ResourceType.class)).put(resource, baseRate);
            }
        }

        List<Double> multipliers = options.hasPath("level-multipliers")
                ? options.getDoubleList("level-multipliers")
                : List.of(1.0);

        Map<String, Map<ResourceType, Double>> efficiencies = new HashMap<>();
        if (options.hasPath("biome-efficiencies")) {
            for (Config entry : options.getConfigList("biome-efficiencies")) {
                String biome = entry.getString("biome");
                ResourceType resource = ResourceType.fromKey(entry.getString("resource"));
                efficiencies.computeIfAbsent(biome, k -> new EnumMap<>(ResourceType.class))
                        .put(resource, entry.getDouble("efficiency"));
            }
        }
        return new GameBalance(rates, multipliers, efficiencies);
    }

    /**
     * Units per hour produced by a level 1 extractor, 0 if the extractor does not yield the resource.
     */
    public double baseRate(ExtractorType extractor, ResourceType resource) {
        Map<ResourceType, Double> rates = baseRates.get(extractor);
        if (rates == null) {
            return 0;
        }
        return rates.getOrDefault(resource, 0.0);
    }

    /**
     * Multiplier for a structure level. Levels below 1 count as 1, levels above the table use
     * the highest configured multiplier.
     */
    public double levelMultiplier(int level) {
        int index = Math.max(1, level) - 1;
        return levelMultipliers[Math.min(index, levelMultipliers.length - 1)];
    }

    /**
     * Efficiency of a biome for a resource. Unknown biomes, unlisted resources and a
     * {@code null} biome all yield 1.0.
     */
    public double biomeEfficiency(String biomeName, ResourceType resource) {
        if (biomeName == null) {
            return 1.0;
        }
        Map<ResourceType, Double> efficiencies = biomeEfficiencies.get(normalizeBiome(biomeName));
        if (efficiencies == null) {
            return 1.0;
        }
        return efficiencies.getOrDefault(resource, 1.0);
    }

    private static String normalizeBiome(String biome) {
        return biome.trim().toLowerCase(Locale.ROOT);
    }
}
