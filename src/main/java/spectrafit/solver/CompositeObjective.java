/**
 * SpectraFit
 * CompositeObjective.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.ArrayUtils;

import spectrafit.exception.NonFiniteDataException;
import spectrafit.parameters.ParameterGraph;
import spectrafit.parameters.PeakBinding;

/**
 * Sum of the peaks of one dataset, compared with its intensities:
 * {@code residual = w * (y - sum(peaks))}. Under {@link NanPolicy#OMIT} the
 * non-finite sample positions are dropped once, here, so every peak sees the
 * same reduced axis.
 */
public final class CompositeObjective implements Objective {

	private final ParameterGraph graph;
	private final List<PeakBinding> peaks;
	private final int dataset;
	private final NanPolicy policy;
	private final double[] x;
	private final double[] y;
	private final double[] weights;

	/**
	 * @param dataset 1-based dataset index in a global fit, 0 otherwise
	 * @throws NonFiniteDataException under {@link NanPolicy#RAISE} if the column
	 *           contains NaN or infinite values
	 */
	public CompositeObjective(final ParameterGraph graph,
		final Dataset.Column column, final int dataset, final NanPolicy policy)
	{
		this(graph, dataset, policy, column.getX(), column.getY(), column
			.getWeights());
	}

	private CompositeObjective(final ParameterGraph graph, final int dataset,
		final NanPolicy policy, final double[] x, final double[] y,
		final double[] weights)
	{
		this.graph = graph;
		this.peaks = graph.peaks(dataset);
		this.dataset = dataset;
		this.policy = policy;

		if (policy == NanPolicy.OMIT) {
			int[] drop = new int[0];
			for (int i = 0; i < x.length; i++) {
				if (!isFinite(x[i]) || !isFinite(y[i]) || !isFinite(weights[i])) {
					drop = ArrayUtils.add(drop, i);
				}
			}
			this.x = ArrayUtils.removeAll(x, drop);
			this.y = ArrayUtils.removeAll(y, drop);
			this.weights = ArrayUtils.removeAll(weights, drop);
		}
		else {
			if (policy == NanPolicy.RAISE) {
				for (int i = 0; i < x.length; i++) {
					if (!isFinite(x[i]) || !isFinite(y[i])) {
						throw new NonFiniteDataException("Non-finite input data", i);
					}
				}
			}
			this.x = x;
			this.y = y;
			this.weights = weights;
		}
	}

	private static boolean isFinite(final double v) {
		return !Double.isNaN(v) && !Double.isInfinite(v);
	}

	@Override
	public double[] residual(final double[] values) {
		final double[] model = model(values);
		final double[] r = new double[y.length];
		for (int i = 0; i < r.length; i++) {
			r[i] = weights[i] * (y[i] - model[i]);
			if (policy == NanPolicy.RAISE && !isFinite(r[i])) {
				throw new NonFiniteDataException("Non-finite residual", i);
			}
		}
		return r;
	}

	/** @return the sum of all peaks of this dataset */
	public double[] model(final double[] values) {
		final double[] all = graph.resolveAll(values);
		final double[] sum = new double[x.length];
		for (final PeakBinding peak : peaks) {
			final double[] c = peak.evaluate(x, all);
			for (int i = 0; i < sum.length; i++) {
				sum[i] += c[i];
			}
		}
		return sum;
	}

	/** @return each peak's contribution, keyed by component name */
	public Map<String, double[]> components(final double[] values) {
		final double[] all = graph.resolveAll(values);
		final Map<String, double[]> out = new LinkedHashMap<>();
		for (final PeakBinding peak : peaks) {
			out.put(peak.componentName(), peak.evaluate(x, all));
		}
		return out;
	}

	@Override
	public int length() {
		return y.length;
	}

	@Override
	public ParameterGraph graph() {
		return graph;
	}

	@Override
	public CompositeObjective withGraph(final ParameterGraph newGraph) {
		return new CompositeObjective(newGraph, dataset, policy, x, y, weights);
	}

	/** @return the energy axis after the NaN policy was applied */
	public double[] getX() {
		return x.clone();
	}

	public double[] getY() {
		return y.clone();
	}

	public double[] getWeights() {
		return weights.clone();
	}

	public int getDataset() {
		return dataset;
	}

	public NanPolicy getPolicy() {
		return policy;
	}
}
