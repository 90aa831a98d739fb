/**
 * SpectraFit
 * GoodnessOfFit.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import org.apache.commons.math3.util.FastMath;

/**
 * Chi-square family, information criteria and coefficient of determination
 * of a fit with {@code n} residuals and {@code k} varying parameters.
 */
public final class GoodnessOfFit {

	private final int ndata;
	private final int nvarys;
	private final double chiSquare;
	private final double reducedChiSquare;
	private final double aic;
	private final double bic;
	private final double rSquared;

	private GoodnessOfFit(final int ndata, final int nvarys,
		final double chiSquare, final double reducedChiSquare, final double aic,
		final double bic, final double rSquared)
	{
		this.ndata = ndata;
		this.nvarys = nvarys;
		this.chiSquare = chiSquare;
		this.reducedChiSquare = reducedChiSquare;
		this.aic = aic;
		this.bic = bic;
		this.rSquared = rSquared;
	}

	/**
	 * @param residual weighted residuals at the optimum
	 * @param y observed intensities, for R-squared
	 * @param nvarys number of varying parameters
	 */
	public static GoodnessOfFit of(final double[] residual, final double[] y,
		final int nvarys)
	{
		final int n = residual.length;
		double chi = 0;
		for (final double r : residual) {
			chi += r * r;
		}
		final int dof = n - nvarys;
		final double redchi = dof > 0 ? chi / dof : Double.NaN;
		// floor keeps the logarithm finite for exact fits
		final double floored = FastMath.max(chi, 1e-250 * n);
		final double lnl = n * FastMath.log(floored / n);
		final double aic = lnl + 2 * nvarys;
		final double bic = lnl + nvarys * FastMath.log(n);

		double mean = 0;
		for (final double v : y) {
			mean += v;
		}
		mean /= y.length;
		double ssTot = 0;
		for (final double v : y) {
			ssTot += (v - mean) * (v - mean);
		}
		final double r2 = ssTot > 0 ? 1 - chi / ssTot : Double.NaN;
		return new GoodnessOfFit(n, nvarys, chi, redchi, aic, bic, r2);
	}

	public int getNdata() {
		return ndata;
	}

	public int getNvarys() {
		return nvarys;
	}

	public int getDegreesOfFreedom() {
		return ndata - nvarys;
	}

	public double getChiSquare() {
		return chiSquare;
	}

	/** @return chi-square per degree of freedom, NaN without degrees of freedom */
	public double getReducedChiSquare() {
		return reducedChiSquare;
	}

	public double getAic() {
		return aic;
	}

	public double getBic() {
		return bic;
	}

	public double getRSquared() {
		return rSquared;
	}
}
