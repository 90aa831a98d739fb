/**
 * SpectraFit
 * Optimum.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

/**
 * Outcome of one optimizer run: best varying values, covariance (or none),
 * evaluation count, termination reason and the residual at the best point.
 */
public final class Optimum {

	private final Minimizer method;
	private final double[] values;
	private final RealMatrix covariance;
	private final int nfev;
	private final int maxNfev;
	private final TerminationReason reason;
	private final boolean success;
	private final String message;
	private final double[] residual;

	Optimum(final Minimizer method, final double[] values,
		final RealMatrix covariance, final int nfev, final int maxNfev,
		final TerminationReason reason, final boolean success,
		final String message, final double[] residual)
	{
		this.method = method;
		this.values = values;
		this.covariance = covariance;
		this.nfev = nfev;
		this.maxNfev = maxNfev;
		this.reason = reason;
		this.success = success && reason == TerminationReason.CONVERGED;
		this.message = message;
		this.residual = residual;
	}

	public Minimizer getMethod() {
		return method;
	}

	/** @return best varying values, in the graph's optimizer order */
	public double[] getValues() {
		return values.clone();
	}

	/** @return covariance of the varying values, or {@code null} if not estimable */
	public RealMatrix getCovariance() {
		return covariance == null ? null : covariance.copy();
	}

	public boolean hasCovariance() {
		return covariance != null;
	}

	/** @return standard errors, NaN when the covariance is unavailable */
	public double[] getStandardErrors() {
		final double[] se = new double[values.length];
		for (int i = 0; i < se.length; i++) {
			se[i] = covariance == null ? Double.NaN : FastMath.sqrt(covariance
				.getEntry(i, i));
		}
		return se;
	}

	public int getNfev() {
		return nfev;
	}

	public int getMaxNfev() {
		return maxNfev;
	}

	public TerminationReason getReason() {
		return reason;
	}

	/**
	 * @return whether the method converged normally; false when it hit a
	 *         budget, was aborted, or gave up on a numerical failure
	 */
	public boolean isSuccess() {
		return success;
	}

	public String getMessage() {
		return message;
	}

	public double[] getResidual() {
		return residual.clone();
	}

	public double getChiSquare() {
		double chi = 0;
		for (final double r : residual) {
			chi += r * r;
		}
		return chi;
	}
}
