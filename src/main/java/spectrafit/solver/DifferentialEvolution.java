/**
 * SpectraFit
 * DifferentialEvolution.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math3.util.FastMath;

/**
 * Differential evolution, strategy best/1/bin, over a box. The start point is
 * part of the initial population; the rest is drawn uniformly inside the
 * bounds. Stops when the spread of the population's objective values is
 * small compared with their mean, or after {@code maxGenerations}.
 */
final class DifferentialEvolution {

	private final int populationFactor;
	private final double mutation;
	private final double crossover;
	private final double tolerance;
	private final int maxGenerations;
	private final RandomGenerator random;

	DifferentialEvolution(final int populationFactor, final double mutation,
		final double crossover, final double tolerance, final int maxGenerations,
		final RandomGenerator random)
	{
		if (populationFactor <= 0) {
			throw new NotStrictlyPositiveException(populationFactor);
		}
		this.populationFactor = populationFactor;
		this.mutation = mutation;
		this.crossover = crossover;
		this.tolerance = tolerance;
		this.maxGenerations = maxGenerations;
		this.random = random;
	}

	double[] minimize(final MultivariateFunction f, final double[] start,
		final double[] lower, final double[] upper)
	{
		final int n = start.length;
		if (lower.length != n) throw new DimensionMismatchException(lower.length,
			n);
		if (upper.length != n) throw new DimensionMismatchException(upper.length,
			n);
		final int np = FastMath.max(5, populationFactor * n);

		final double[][] pop = new double[np][];
		final double[] energy = new double[np];
		pop[0] = start.clone();
		for (int i = 1; i < np; i++) {
			pop[i] = new double[n];
			for (int j = 0; j < n; j++) {
				pop[i][j] = lower[j] + random.nextDouble() * (upper[j] - lower[j]);
			}
		}
		int best = 0;
		for (int i = 0; i < np; i++) {
			energy[i] = f.value(pop[i]);
			if (energy[i] < energy[best]) best = i;
		}

		for (int g = 0; g < maxGenerations; g++) {
			for (int i = 0; i < np; i++) {
				int r1;
				int r2;
				do {
					r1 = random.nextInt(np);
				}
				while (r1 == i);
				do {
					r2 = random.nextInt(np);
				}
				while (r2 == i || r2 == r1);

				final double[] trial = pop[i].clone();
				final int forced = random.nextInt(n);
				for (int j = 0; j < n; j++) {
					if (j == forced || random.nextDouble() < crossover) {
						double v = pop[best][j] + mutation * (pop[r1][j] - pop[r2][j]);
						if (v < lower[j] || v > upper[j]) {
							v = lower[j] + random.nextDouble() * (upper[j] - lower[j]);
						}
						trial[j] = v;
					}
				}
				final double e = f.value(trial);
				if (e <= energy[i]) {
					pop[i] = trial;
					energy[i] = e;
					if (e < energy[best]) best = i;
				}
			}
			final double spread = new StandardDeviation(false).evaluate(energy);
			final double mean = new Mean().evaluate(energy);
			if (spread <= tolerance * FastMath.abs(mean)) break;
		}
		return pop[best].clone();
	}
}
