/**
 * SpectraFit
 * FitMonitor.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

/**
 * Caller-supplied observer of an optimizer run. It sees every objective
 * evaluation and may stop the run, which then ends with
 * {@link TerminationReason#USER_ABORT}.
 */
public interface FitMonitor {

	/** Monitor that ignores every event. */
	FitMonitor NONE = new FitMonitor() {};

	/**
	 * Called after every objective evaluation.
	 *
	 * @param nfev evaluations so far, including this one
	 * @param maxNfev evaluation budget
	 * @param values varying parameter values of this evaluation
	 * @param chiSquare sum of squared residuals at {@code values}
	 */
	default void evaluated(final int nfev, final int maxNfev,
		final double[] values, final double chiSquare)
	{}

	/** @return true to stop the run before the next evaluation */
	default boolean isAborted() {
		return false;
	}
}
