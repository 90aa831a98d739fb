/**
 * SpectraFit
 * Objective.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.solver;

import spectrafit.parameters.ParameterGraph;

/**
 * Residual function over the varying parameters of a graph. Implementations
 * are pure: the same values always give the same residuals.
 */
public interface Objective {

	/**
	 * @param values varying parameter values, in the graph's optimizer order
	 * @return weighted residuals {@code w * (y - model)}
	 */
	double[] residual(double[] values);

	/** @return length of the residual vector */
	int length();

	ParameterGraph graph();

	/** @return the same data evaluated against another graph */
	Objective withGraph(ParameterGraph newGraph);
}
