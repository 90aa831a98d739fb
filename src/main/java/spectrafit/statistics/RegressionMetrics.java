/**
 * SpectraFit
 * RegressionMetrics.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.math3.exception.DimensionMismatchException;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.apache.commons.math3.util.FastMath;

/**
 * Error metrics of a fitted curve against the observed intensities.
 */
public final class RegressionMetrics {

	private static final double EPS = FastMath.ulp(1.0);

	private final double explainedVariance;
	private final double r2;
	private final double maxError;
	private final double meanAbsoluteError;
	private final double meanSquaredError;
	private final double medianAbsoluteError;
	private final double meanAbsolutePercentageError;

	private RegressionMetrics(final double explainedVariance, final double r2,
		final double maxError, final double meanAbsoluteError,
		final double meanSquaredError, final double medianAbsoluteError,
		final double meanAbsolutePercentageError)
	{
		this.explainedVariance = explainedVariance;
		this.r2 = r2;
		this.maxError = maxError;
		this.meanAbsoluteError = meanAbsoluteError;
		this.meanSquaredError = meanSquaredError;
		this.medianAbsoluteError = medianAbsoluteError;
		this.meanAbsolutePercentageError = meanAbsolutePercentageError;
	}

	/**
	 * @throws DimensionMismatchException if the arrays differ in length
	 */
	public static RegressionMetrics of(final double[] observed,
		final double[] predicted)
	{
		if (observed.length != predicted.length) {
			throw new DimensionMismatchException(predicted.length, observed.length);
		}
		final int n = observed.length;
		final double[] diff = new double[n];
		final double[] abs = new double[n];
		double max = 0;
		double sq = 0;
		double pct = 0;
		for (int i = 0; i < n; i++) {
			diff[i] = observed[i] - predicted[i];
			abs[i] = FastMath.abs(diff[i]);
			max = FastMath.max(max, abs[i]);
			sq += diff[i] * diff[i];
			pct += abs[i] / FastMath.max(FastMath.abs(observed[i]), EPS);
		}
		final double varY = StatUtils.populationVariance(observed);
		final double ssTot = varY * n;
		final double ev = varY > 0 ? 1 - StatUtils.populationVariance(diff) / varY
			: Double.NaN;
		final double r2 = ssTot > 0 ? 1 - sq / ssTot : Double.NaN;
		return new RegressionMetrics(ev, r2, max, StatUtils.mean(abs), sq / n,
			new Median().evaluate(abs), pct / n);
	}

	public double getExplainedVariance() {
		return explainedVariance;
	}

	public double getR2() {
		return r2;
	}

	public double getMaxError() {
		return maxError;
	}

	public double getMeanAbsoluteError() {
		return meanAbsoluteError;
	}

	public double getMeanSquaredError() {
		return meanSquaredError;
	}

	public double getMedianAbsoluteError() {
		return medianAbsoluteError;
	}

	public double getMeanAbsolutePercentageError() {
		return meanAbsolutePercentageError;
	}

	public Map<String, Double> toMap() {
		final Map<String, Double> m = new LinkedHashMap<>();
		m.put("explained_variance_score", explainedVariance);
		m.put("r2_score", r2);
		m.put("max_error", maxError);
		m.put("mean_absolute_error", meanAbsoluteError);
		m.put("mean_squared_error", meanSquaredError);
		m.put("median_absolute_error", medianAbsoluteError);
		m.put("mean_absolute_percentage_error", meanAbsolutePercentageError);
		return m;
	}
}
