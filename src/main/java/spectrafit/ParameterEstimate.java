/**
 * SpectraFit
 * ParameterEstimate.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit;

import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Precision;

import spectrafit.parameters.Parameter;
import spectrafit.parameters.ParameterName;

/**
 * One row of the parameter table of a fit.
 */
public final class ParameterEstimate {

	private static final double CLOSE = 1e-8;

	private final ParameterName key;
	private final Parameter.Kind kind;
	private final double initValue;
	private final double modelValue;
	private final double bestValue;
	private final double stderr;
	private final double min;
	private final double max;
	private final String expr;

	ParameterEstimate(final Parameter start, final double bestValue,
		final double stderr)
	{
		this.key = start.getKey();
		this.kind = start.getKind();
		this.initValue = kind == Parameter.Kind.DERIVED ? Double.NaN : start
			.getValue();
		this.modelValue = start.getValue();
		this.bestValue = bestValue;
		this.stderr = stderr;
		this.min = start.getMin();
		this.max = start.getMax();
		this.expr = start.getExpr();
	}

	public String getName() {
		return key.toString();
	}

	public ParameterName getKey() {
		return key;
	}

	public Parameter.Kind getKind() {
		return kind;
	}

	/** @return the declared start value, NaN for derived parameters */
	public double getInitValue() {
		return initValue;
	}

	/** @return the value the model was first evaluated with */
	public double getModelValue() {
		return modelValue;
	}

	public double getBestValue() {
		return bestValue;
	}

	/** @return the standard error, NaN when it could not be estimated */
	public double getStderr() {
		return stderr;
	}

	/** @return the standard error in percent of the best value */
	public double getErrorRelative() {
		if (Double.isNaN(stderr)) return Double.NaN;
		if (bestValue == 0) return stderr == 0 ? Double.NaN
			: Double.POSITIVE_INFINITY;
		return FastMath.abs(stderr / bestValue) * 100;
	}

	public boolean isVary() {
		return kind == Parameter.Kind.VARYING;
	}

	public String getExpr() {
		return expr;
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	public boolean isAtInitialValue() {
		return isVary() && initValue != 0 && Precision.equalsWithRelativeTolerance(
			bestValue, initValue, CLOSE);
	}

	public boolean isAtBoundary() {
		return isVary() && (Precision.equalsWithRelativeTolerance(bestValue, min,
			CLOSE) || Precision.equalsWithRelativeTolerance(bestValue, max, CLOSE));
	}

	@Override
	public String toString() {
		return String.format("%s = %g +/- %g", getName(), bestValue, stderr);
	}
}
