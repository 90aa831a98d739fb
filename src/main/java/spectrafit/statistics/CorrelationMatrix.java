/**
 * SpectraFit
 * CorrelationMatrix.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.apache.commons.math3.util.FastMath;

/**
 * Square, symmetric correlation tables keyed by name on both axes.
 */
public final class CorrelationMatrix {

	private CorrelationMatrix() {}

	/**
	 * Parameter correlations from the covariance of the varying parameters.
	 * Rows and columns of fixed and derived parameters, or of every parameter
	 * when {@code covariance} is {@code null}, are NaN.
	 *
	 * @param names every parameter name, in report order
	 * @param freeNames varying parameter names, in covariance order
	 */
	public static Map<String, Map<String, Double>> parameters(
		final List<String> names, final List<String> freeNames,
		final RealMatrix covariance)
	{
		final Map<String, Map<String, Double>> out = new LinkedHashMap<>();
		for (final String a : names) {
			final Map<String, Double> row = new LinkedHashMap<>();
			final int i = freeNames.indexOf(a);
			for (final String b : names) {
				final int j = freeNames.indexOf(b);
				if (covariance == null || i < 0 || j < 0) {
					row.put(b, Double.NaN);
				}
				else if (i == j) {
					row.put(b, 1.0);
				}
				else {
					final double cij = 0.5 * (covariance.getEntry(i, j) + covariance
						.getEntry(j, i));
					row.put(b, cij / FastMath.sqrt(covariance.getEntry(i, i) * covariance
						.getEntry(j, j)));
				}
			}
			out.put(a, row);
		}
		return out;
	}

	/**
	 * Pearson correlation between every pair of columns; pairs involving a
	 * constant column are NaN.
	 */
	public static Map<String, Map<String, Double>> components(
		final Map<String, double[]> columns)
	{
		final PearsonsCorrelation pearson = new PearsonsCorrelation();
		final Map<String, Map<String, Double>> out = new LinkedHashMap<>();
		for (final Map.Entry<String, double[]> a : columns.entrySet()) {
			final Map<String, Double> row = new LinkedHashMap<>();
			for (final Map.Entry<String, double[]> b : columns.entrySet()) {
				row.put(b.getKey(), correlation(pearson, a.getValue(), b.getValue()));
			}
			out.put(a.getKey(), row);
		}
		return out;
	}

	private static double correlation(final PearsonsCorrelation pearson,
		final double[] a, final double[] b)
	{
		if (a.length < 2 || a.length != b.length || isConstant(a) || isConstant(
			b)) return Double.NaN;
		return pearson.correlation(a, b);
	}

	private static boolean isConstant(final double[] v) {
		for (final double d : v) {
			if (d != v[0]) return false;
		}
		return true;
	}
}
