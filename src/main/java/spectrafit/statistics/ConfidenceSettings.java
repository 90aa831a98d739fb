/**
 * SpectraFit
 * ConfidenceSettings.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import org.apache.commons.math3.special.Erf;
import org.apache.commons.math3.util.FastMath;

import spectrafit.exception.InvalidSettingsException;

/**
 * Settings of the confidence-interval search. Immutable; disabled by default.
 */
public final class ConfidenceSettings {

	/** One, two and three standard deviations. */
	private static final double[] DEFAULT_PROBABILITIES = { 0.6827, 0.9545,
		0.9973 };

	private static final ConfidenceSettings DISABLED = new ConfidenceSettings(
		false, DEFAULT_PROBABILITIES, 200, 1e-5, false);

	private final boolean enabled;
	private final double[] probabilities;
	private final int maxIter;
	private final double minRelChange;
	private final boolean trace;

	private ConfidenceSettings(final boolean enabled,
		final double[] probabilities, final int maxIter,
		final double minRelChange, final boolean trace)
	{
		this.enabled = enabled;
		this.probabilities = probabilities;
		this.maxIter = maxIter;
		this.minRelChange = minRelChange;
		this.trace = trace;
	}

	public static ConfidenceSettings disabled() {
		return DISABLED;
	}

	/** @return the default search, enabled */
	public static ConfidenceSettings create() {
		return DISABLED.withEnabled(true);
	}

	public ConfidenceSettings withEnabled(final boolean newEnabled) {
		return new ConfidenceSettings(newEnabled, probabilities, maxIter,
			minRelChange, trace);
	}

	/**
	 * @param levels probabilities in (0, 1); values of 1 or more are read as a
	 *          number of standard deviations
	 * @throws InvalidSettingsException for empty or non-positive levels
	 */
	public ConfidenceSettings withProbabilities(final double... levels) {
		if (levels.length == 0) {
			throw new InvalidSettingsException("No confidence levels given");
		}
		final double[] p = new double[levels.length];
		for (int i = 0; i < levels.length; i++) {
			if (!(levels[i] > 0) || Double.isInfinite(levels[i])) {
				throw new InvalidSettingsException("Invalid confidence level: " +
					levels[i]);
			}
			p[i] = levels[i] < 1 ? levels[i] : Erf.erf(levels[i] / FastMath.sqrt(
				2));
		}
		return new ConfidenceSettings(enabled, p, maxIter, minRelChange, trace);
	}

	public ConfidenceSettings withMaxIter(final int newMaxIter) {
		if (newMaxIter < 1) {
			throw new InvalidSettingsException("maxiter must be positive: " +
				newMaxIter);
		}
		return new ConfidenceSettings(enabled, probabilities, newMaxIter,
			minRelChange, trace);
	}

	public ConfidenceSettings withMinRelChange(final double newMinRelChange) {
		return new ConfidenceSettings(enabled, probabilities, maxIter,
			newMinRelChange, trace);
	}

	public ConfidenceSettings withTrace(final boolean newTrace) {
		return new ConfidenceSettings(enabled, probabilities, maxIter,
			minRelChange, newTrace);
	}

	public boolean isEnabled() {
		return enabled;
	}

	public double[] getProbabilities() {
		return probabilities.clone();
	}

	public int getMaxIter() {
		return maxIter;
	}

	public double getMinRelChange() {
		return minRelChange;
	}

	public boolean isTrace() {
		return trace;
	}
}
