package org.unchartedlands.simulation.api.model;

import java.util.List;

/**
 * Read-only snapshot of a built structure, taken once per wave.
 *
 * @param id            structure id
 * @param name          display name
 * @param category      building or extractor
 * @param extractorType the extractor kind, {@code null} for buildings
 * @param level         upgrade level, starting at 1
 * @param modifiers     ordered list of modifiers
 */
public record Structure(
        String id,
        String name,
        StructureCategory category,
        ExtractorType extractorType,
        int level,
        List<StructureModifier> modifiers
) {

    public Structure {
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        if (level < 1) {
            level = 1;
        }
    }

    public static Structure building(String id, String name, List<StructureModifier> modifiers) {
        return new Structure(id, name, StructureCategory.BUILDING, null, 1, modifiers);
    }

    public static Structure extractor(String id, String name, ExtractorType type, int level) {
        return new Structure(id, name, StructureCategory.EXTRACTOR, type, level, List.of());
    }

    public boolean isExtractor() {
        return category == StructureCategory.EXTRACTOR && extractorType != null;
    }

    /**
     * Sums the values of all modifiers with the given canonical name.
     *
     * @param canonicalName e.g. {@code "storage_capacity"}
     * @return the sum, 0 if none match
     */
    public double modifierTotal(String canonicalName) {
        double total = 0;
        for (StructureModifier modifier : modifiers) {
            if (modifier.canonicalName().equals(canonicalName)) {
                total += modifier.value();
            }
        }
        return total;
    }
}
