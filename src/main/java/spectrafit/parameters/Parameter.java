/**
 * SpectraFit
 * Parameter.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

/**
 * A flattened scalar parameter: varying (optimizer controlled), fixed, or
 * derived from an expression.
 */
public final class Parameter {

	public enum Kind {
		VARYING, FIXED, DERIVED
	}

	private final ParameterName name;
	private final Kind kind;
	private final double value;
	private final double min;
	private final double max;
	private final String expr;

	Parameter(final ParameterName name, final Kind kind, final double value,
		final double min, final double max, final String expr)
	{
		this.name = name;
		this.kind = kind;
		this.value = value;
		this.min = min;
		this.max = max;
		this.expr = expr;
	}

	Parameter withValue(final double newValue) {
		return new Parameter(name, kind, newValue, min, max, expr);
	}

	Parameter fixedAt(final double newValue) {
		return new Parameter(name, Kind.FIXED, newValue, min, max, null);
	}

	public String getName() {
		return name.toString();
	}

	public ParameterName getKey() {
		return name;
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isVarying() {
		return kind == Kind.VARYING;
	}

	/** @return the start value (evaluated expression for derived parameters) */
	public double getValue() {
		return value;
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	/** @return the expression text, or {@code null} */
	public String getExpr() {
		return expr;
	}

	@Override
	public String toString() {
		return name + "[" + kind + ", " + value + "]";
	}
}
