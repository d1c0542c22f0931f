package fr.lapetina.citationrate.statespace;

import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;

/**
 * Random providers for forecast sampling, based on Apache Commons RNG.
 *
 * <p>With a run seed, each series gets its own deterministic stream so that results do
 * not depend on which worker thread processed which series.
 */
public final class RandomSources {

    private static final RandomSource ALGORITHM = RandomSource.XO_SHI_RO_256_PP;

    private RandomSources() {
        // Utility class
    }

    /**
     * Creates a provider seeded from system entropy.
     */
    public static UniformRandomProvider unseeded() {
        return ALGORITHM.create();
    }

    /**
     * Creates a deterministic provider for the given seed.
     */
    public static UniformRandomProvider seeded(long seed) {
        return ALGORITHM.create(seed);
    }

    /**
     * Provider for one series of a run.
     *
     * @param runSeed     seed of the run, or null for nondeterministic sampling
     * @param seriesIndex position of the series in the corpus
     */
    public static UniformRandomProvider forSeries(Long runSeed, int seriesIndex) {
        if (runSeed == null) {
            return unseeded();
        }
        return seeded(runSeed + seriesIndex);
    }
}
