/**
 * SpectraFit
 * DataStatistics.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

/**
 * Descriptive statistics of one column: count, mean, sample standard
 * deviation, minimum, deciles (R-7 interpolation) and maximum.
 */
public final class DataStatistics {

	private static final String[] DECILE_KEYS = { "10%", "20%", "30%", "40%",
		"50%", "60%", "70%", "80%", "90%" };

	private final int count;
	private final double mean;
	private final double std;
	private final double min;
	private final double[] deciles;
	private final double max;

	private DataStatistics(final int count, final double mean, final double std,
		final double min, final double[] deciles, final double max)
	{
		this.count = count;
		this.mean = mean;
		this.std = std;
		this.min = min;
		this.deciles = deciles;
		this.max = max;
	}

	public static DataStatistics of(final double[] values) {
		final DescriptiveStatistics stats = new DescriptiveStatistics(values);
		final double[] deciles = new double[DECILE_KEYS.length];
		final Percentile percentile = new Percentile().withEstimationType(
			Percentile.EstimationType.R_7);
		if (values.length > 0) percentile.setData(values);
		for (int i = 0; i < deciles.length; i++) {
			deciles[i] = values.length == 0 ? Double.NaN : percentile.evaluate(10.0 *
				(i + 1));
		}
		return new DataStatistics(values.length, stats.getMean(), stats
			.getStandardDeviation(), stats.getMin(), deciles, stats.getMax());
	}

	/** @return statistics of every column, keyed like the input */
	public static Map<String, DataStatistics> of(
		final Map<String, double[]> columns)
	{
		final Map<String, DataStatistics> out = new LinkedHashMap<>();
		for (final Map.Entry<String, double[]> e : columns.entrySet()) {
			out.put(e.getKey(), of(e.getValue()));
		}
		return out;
	}

	public int getCount() {
		return count;
	}

	public double getMean() {
		return mean;
	}

	public double getStd() {
		return std;
	}

	public double getMin() {
		return min;
	}

	/** @return the 10 %, 20 %, ..., 90 % percentiles */
	public double[] getDeciles() {
		return deciles.clone();
	}

	public double getMax() {
		return max;
	}

	/** @return {@code count, mean, std, min, 10% .. 90%, max} in this order */
	public Map<String, Double> toMap() {
		final Map<String, Double> m = new LinkedHashMap<>();
		m.put("count", (double) count);
		m.put("mean", mean);
		m.put("std", std);
		m.put("min", min);
		for (int i = 0; i < deciles.length; i++) {
			m.put(DECILE_KEYS[i], deciles[i]);
		}
		m.put("max", max);
		return m;
	}
}
