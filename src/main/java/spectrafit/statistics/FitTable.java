/**
 * SpectraFit
 * FitTable.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Columns of a finished fit: the input columns, the result table (energy,
 * intensity, residual, fit and components) and the three flat vectors the
 * goodness-of-fit figures are computed from.
 */
public final class FitTable {

	private final Map<String, double[]> input;
	private final Map<String, double[]> result;
	private final double[] observed;
	private final double[] fit;
	private final double[] residual;

	public FitTable(final Map<String, double[]> input,
		final Map<String, double[]> result, final double[] observed,
		final double[] fit, final double[] residual)
	{
		this.input = Collections.unmodifiableMap(new LinkedHashMap<>(input));
		this.result = Collections.unmodifiableMap(new LinkedHashMap<>(result));
		this.observed = observed;
		this.fit = fit;
		this.residual = residual;
	}

	public Map<String, double[]> getInput() {
		return input;
	}

	public Map<String, double[]> getResult() {
		return result;
	}

	/**
	 * Result columns padded with trailing NaN to the length of the longest one.
	 * Global fits with the omit policy can drop different samples per dataset.
	 */
	public Map<String, double[]> getAlignedResult() {
		int n = 0;
		for (final double[] column : result.values()) {
			n = Math.max(n, column.length);
		}
		final Map<String, double[]> aligned = new LinkedHashMap<>();
		for (final Map.Entry<String, double[]> e : result.entrySet()) {
			final double[] column = Arrays.copyOf(e.getValue(), n);
			Arrays.fill(column, e.getValue().length, n, Double.NaN);
			aligned.put(e.getKey(), column);
		}
		return aligned;
	}

	public double[] getObserved() {
		return observed.clone();
	}

	public double[] getFit() {
		return fit.clone();
	}

	public double[] getResidual() {
		return residual.clone();
	}
}
