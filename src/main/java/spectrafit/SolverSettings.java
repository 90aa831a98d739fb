/**
 * SpectraFit
 * SolverSettings.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit;

import spectrafit.parameters.PeakDetectionSettings;
import spectrafit.solver.GlobalFitAggregator;
import spectrafit.solver.Minimizer;
import spectrafit.solver.NanPolicy;
import spectrafit.statistics.ConfidenceSettings;

/**
 * Optimizer configuration of a fit project. Immutable; every
 * {@code withX(...)} returns a modified copy.
 */
public final class SolverSettings {

	public static final int DEFAULT_MAX_NFEV = 1000;

	private final Minimizer method;
	private final NanPolicy nanPolicy;
	private final int maxNfev;
	private final boolean calcCovar;
	private final int global;
	private final ConfidenceSettings confidence;
	private final PeakDetectionSettings peakDetection;

	private SolverSettings(final Minimizer method, final NanPolicy nanPolicy,
		final int maxNfev, final boolean calcCovar, final int global,
		final ConfidenceSettings confidence,
		final PeakDetectionSettings peakDetection)
	{
		this.method = method;
		this.nanPolicy = nanPolicy;
		this.maxNfev = maxNfev;
		this.calcCovar = calcCovar;
		this.global = global;
		this.confidence = confidence;
		this.peakDetection = peakDetection;
	}

	/**
	 * Levenberg-Marquardt, NaN propagation, 1000 evaluations, covariance on,
	 * automatic global mode, no confidence intervals, no peak detection.
	 */
	public static SolverSettings create() {
		return new SolverSettings(Minimizer.LEASTSQ, NanPolicy.PROPAGATE,
			DEFAULT_MAX_NFEV, true, GlobalFitAggregator.AUTO_SHARED,
			ConfidenceSettings.disabled(), PeakDetectionSettings.disabled());
	}

	public SolverSettings withMethod(final Minimizer newMethod) {
		return new SolverSettings(newMethod, nanPolicy, maxNfev, calcCovar, global,
			confidence, peakDetection);
	}

	/** @throws spectrafit.exception.UnknownMethodException for an unknown name */
	public SolverSettings withMethod(final String name) {
		return withMethod(Minimizer.fromName(name));
	}

	public SolverSettings withNanPolicy(final NanPolicy newPolicy) {
		return new SolverSettings(method, newPolicy, maxNfev, calcCovar, global,
			confidence, peakDetection);
	}

	/** @param newMaxNfev evaluation budget; zero or less means unlimited */
	public SolverSettings withMaxNfev(final int newMaxNfev) {
		return new SolverSettings(method, nanPolicy, newMaxNfev, calcCovar, global,
			confidence, peakDetection);
	}

	public SolverSettings withCalcCovar(final boolean newCalcCovar) {
		return new SolverSettings(method, nanPolicy, maxNfev, newCalcCovar, global,
			confidence, peakDetection);
	}

	/** @param newGlobal see {@link GlobalFitAggregator#plan} */
	public SolverSettings withGlobal(final int newGlobal) {
		return new SolverSettings(method, nanPolicy, maxNfev, calcCovar, newGlobal,
			confidence, peakDetection);
	}

	public SolverSettings withConfidence(final ConfidenceSettings newConfidence) {
		return new SolverSettings(method, nanPolicy, maxNfev, calcCovar, global,
			newConfidence, peakDetection);
	}

	/**
	 * @param newPeakDetection when enabled, the peaks of a single-column dataset
	 *          are detected instead of declared
	 */
	public SolverSettings withPeakDetection(
		final PeakDetectionSettings newPeakDetection)
	{
		return new SolverSettings(method, nanPolicy, maxNfev, calcCovar, global,
			confidence, newPeakDetection);
	}

	public Minimizer getMethod() {
		return method;
	}

	public NanPolicy getNanPolicy() {
		return nanPolicy;
	}

	public int getMaxNfev() {
		return maxNfev;
	}

	public boolean isCalcCovar() {
		return calcCovar;
	}

	public int getGlobal() {
		return global;
	}

	public ConfidenceSettings getConfidence() {
		return confidence;
	}

	public PeakDetectionSettings getPeakDetection() {
		return peakDetection;
	}

	@Override
	public String toString() {
		return String.format(
			"method=%s, nan_policy=%s, max_nfev=%d, calc_covar=%s, global=%d, %s",
			method, nanPolicy.key(), maxNfev, calcCovar, global, peakDetection);
	}
}
