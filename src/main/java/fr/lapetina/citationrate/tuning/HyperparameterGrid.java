package fr.lapetina.citationrate.tuning;

/**
 * Log-uniform candidate sets for the grid search.
 *
 * <p>Defaults span roughly [0.05, 2.7] for the process variance ({@code exp(-3)..exp(1)})
 * and [0.37, 7.4] for the overdispersion ({@code exp(-1)..exp(2)}).
 *
 * @param logProcessVarianceMin  natural log of the smallest process variance candidate
 * @param logProcessVarianceMax  natural log of the largest process variance candidate
 * @param logOverdispersionMin   natural log of the smallest overdispersion candidate
 * @param logOverdispersionMax   natural log of the largest overdispersion candidate
 */
public record HyperparameterGrid(
        double logProcessVarianceMin,
        double logProcessVarianceMax,
        double logOverdispersionMin,
        double logOverdispersionMax
) {
    public static final int DEFAULT_GRID_SIZE = 40;

    public HyperparameterGrid {
        if (!(logProcessVarianceMin <= logProcessVarianceMax) || !(logOverdispersionMin <= logOverdispersionMax)) {
            throw new IllegalArgumentException("Grid bounds must be ordered min <= max");
        }
    }

    public static HyperparameterGrid defaults() {
        return new HyperparameterGrid(-3.0, 1.0, -1.0, 2.0);
    }

    public double[] processVarianceCandidates(int size) {
        return logUniform(logProcessVarianceMin, logProcessVarianceMax, size);
    }

    public double[] overdispersionCandidates(int size) {
        return logUniform(logOverdispersionMin, logOverdispersionMax, size);
    }

    /**
     * {@code exp} of {@code size} evenly spaced points from {@code logMin} to {@code logMax}
     * inclusive. A single point sits at {@code logMin}.
     */
    static double[] logUniform(double logMin, double logMax, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Grid size must be >= 1, got " + size);
        }
        double[] values = new double[size];
        if (size == 1) {
            values[0] = Math.exp(logMin);
            return values;
        }
        double step = (logMax - logMin) / (size - 1);
        for (int i = 0; i < size; i++) {
            double exponent = i == size - 1 ? logMax : logMin + i * step;
            values[i] = Math.exp(exponent);
        }
        return values;
    }
}
