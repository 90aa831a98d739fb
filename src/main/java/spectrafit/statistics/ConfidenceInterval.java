/**
 * SpectraFit
 * ConfidenceInterval.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

/**
 * Lower and upper limits of one parameter at each probability level.
 * Unreachable limits are {@code -Infinity} / {@code +Infinity}; limits whose
 * root search failed are NaN.
 */
public final class ConfidenceInterval {

	private final String parameter;
	private final double best;
	private final double[] probabilities;
	private final double[] lower;
	private final double[] upper;

	ConfidenceInterval(final String parameter, final double best,
		final double[] probabilities, final double[] lower, final double[] upper)
	{
		this.parameter = parameter;
		this.best = best;
		this.probabilities = probabilities;
		this.lower = lower;
		this.upper = upper;
	}

	public String getParameter() {
		return parameter;
	}

	public double getBest() {
		return best;
	}

	public double[] getProbabilities() {
		return probabilities.clone();
	}

	public double[] getLower() {
		return lower.clone();
	}

	public double[] getUpper() {
		return upper.clone();
	}

	/** @return the limit at {@code probabilities[level]} on one side */
	public double limit(final int level, final boolean upperSide) {
		return upperSide ? upper[level] : lower[level];
	}
}
