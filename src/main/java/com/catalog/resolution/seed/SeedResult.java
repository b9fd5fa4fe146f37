package com.catalog.resolution.seed;

/**
 * Counts from one seed run.
 *
 * @param entities          entities written
 * @param aliases           aliases newly written
 * @param skippedDuplicates aliases already present for the same entity, text and locale
 */
public record SeedResult(int entities, int aliases, int skippedDuplicates) {

    public static SeedResult empty() {
        return new SeedResult(0, 0, 0);
    }
}
