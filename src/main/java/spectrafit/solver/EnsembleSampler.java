/**
 * SpectraFit
 * EnsembleSampler.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import org.apache.commons.math3.analysis.MultivariateFunction;
import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.exception.NotStrictlyPositiveException;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

/**
 * Affine-invariant ensemble sampler (Goodman and Weare stretch move) over the
 * posterior {@code exp(-chi2 / 2)} with a flat prior inside the bounds. The
 * walkers start in a small ball around the start point. Returns the sample of
 * highest probability seen.
 */
final class EnsembleSampler {

	/** Stretch scale of the proposal distribution. */
	private static final double STRETCH = 2.0;
	/** Relative radius of the starting ball. */
	private static final double BALL = 1e-4;

	private final int walkers;
	private final int steps;
	private final RandomGenerator random;

	EnsembleSampler(final int walkers, final int steps,
		final RandomGenerator random)
	{
		if (walkers <= 1) throw new NotStrictlyPositiveException(walkers - 1);
		if (steps <= 0) throw new NotStrictlyPositiveException(steps);
		this.walkers = walkers;
		this.steps = steps;
		this.random = random;
	}

	/**
	 * @param chiSquare objective; NaN or infinite values have zero probability
	 */
	double[] sample(final MultivariateFunction chiSquare, final double[] start,
		final double[] lower, final double[] upper)
	{
		final int n = start.length;
		if (lower.length != n) throw new DimensionMismatchException(lower.length,
			n);
		if (upper.length != n) throw new DimensionMismatchException(upper.length,
			n);

		final double[][] pos = new double[walkers][];
		final double[] logProb = new double[walkers];
		double[] best = start.clone();
		double bestLogProb = Double.NEGATIVE_INFINITY;
		for (int k = 0; k < walkers; k++) {
			pos[k] = new double[n];
			for (int j = 0; j < n; j++) {
				final double scale = start[j] != 0.0 ? FastMath.abs(start[j]) : 1.0;
				final double v = start[j] + BALL * scale * random.nextGaussian();
				pos[k][j] = v < lower[j] || v > upper[j] ? start[j] : v;
			}
			logProb[k] = logProbability(chiSquare, pos[k], lower, upper);
			if (logProb[k] > bestLogProb) {
				bestLogProb = logProb[k];
				best = pos[k].clone();
			}
		}

		for (int s = 0; s < steps; s++) {
			for (int k = 0; k < walkers; k++) {
				int other;
				do {
					other = random.nextInt(walkers);
				}
				while (other == k);
				final double u = random.nextDouble();
				final double z = FastMath.pow((STRETCH - 1) * u + 1, 2) / STRETCH;
				final double[] proposal = new double[n];
				for (int j = 0; j < n; j++) {
					proposal[j] = pos[other][j] + z * (pos[k][j] - pos[other][j]);
				}
				final double lp = logProbability(chiSquare, proposal, lower, upper);
				final double logAccept = (n - 1) * FastMath.log(z) + lp - logProb[k];
				if (lp > Double.NEGATIVE_INFINITY && FastMath.log(random
					.nextDouble()) < logAccept)
				{
					pos[k] = proposal;
					logProb[k] = lp;
					if (lp > bestLogProb) {
						bestLogProb = lp;
						best = proposal.clone();
					}
				}
			}
		}
		return best;
	}

	private static double logProbability(final MultivariateFunction chiSquare,
		final double[] p, final double[] lower, final double[] upper)
	{
		for (int j = 0; j < p.length; j++) {
			if (p[j] < lower[j] || p[j] > upper[j]) return Double.NEGATIVE_INFINITY;
		}
		final double chi = chiSquare.value(p);
		return Double.isNaN(chi) || Double.isInfinite(chi)
			? Double.NEGATIVE_INFINITY : -0.5 * chi;
	}
}
