/**
 * SpectraFit
 * ParameterTable.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.util.FastMath;

import spectrafit.parameters.Parameter;
import spectrafit.parameters.ParameterGraph;
import spectrafit.solver.Optimum;

/** Builds the parameter table of a finished fit. */
final class ParameterTable {

	private ParameterTable() {}

	/**
	 * Parameter table at the optimum. Standard errors of derived parameters are
	 * propagated linearly through their expressions.
	 */
	static List<ParameterEstimate> estimates(final ParameterGraph graph,
		final Optimum optimum)
	{
		final double[] values = optimum.getValues();
		final double[] all = graph.resolveAll(values);
		final double[] se = optimum.getStandardErrors();
		final RealMatrix cov = optimum.getCovariance();
		final List<Parameter> params = graph.parameters();
		final List<String> freeNames = graph.freeNames();

		double[][] jac = null;
		if (cov != null) {
			// d(all)/d(free) by central differences
			jac = new double[values.length][];
			for (int k = 0; k < values.length; k++) {
				final double h = 1e-7 * FastMath.max(FastMath.abs(values[k]), 1.0);
				final double[] up = values.clone();
				final double[] down = values.clone();
				up[k] += h;
				down[k] -= h;
				final double[] a = graph.resolveAll(up);
				final double[] b = graph.resolveAll(down);
				jac[k] = new double[all.length];
				for (int i = 0; i < all.length; i++) {
					jac[k][i] = (a[i] - b[i]) / (2 * h);
				}
			}
		}

		final List<ParameterEstimate> out = new ArrayList<>(params.size());
		for (int i = 0; i < params.size(); i++) {
			final Parameter p = params.get(i);
			double stderr = Double.NaN;
			switch (p.getKind()) {
				case VARYING:
					stderr = se[freeNames.indexOf(p.getName())];
					break;
				case DERIVED:
					if (jac != null) {
						double variance = 0;
						for (int k = 0; k < values.length; k++) {
							for (int l = 0; l < values.length; l++) {
								variance += jac[k][i] * cov.getEntry(k, l) * jac[l][i];
							}
						}
						stderr = variance >= 0 ? FastMath.sqrt(variance) : Double.NaN;
					}
					break;
				default:
					break;
			}
			out.add(new ParameterEstimate(p, all[i], stderr));
		}
		return out;
	}
}
