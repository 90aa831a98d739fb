/**
 * SpectraFit
 * AttributeSpec.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import java.util.Objects;

/**
 * Declaration of one peak attribute: either a bounded value with a vary flag,
 * or an arithmetic expression over other parameter names. When an expression
 * is present the value, bounds and vary flag are ignored.
 */
public final class AttributeSpec {

	private final Double value;
	private final double min;
	private final double max;
	private final boolean vary;
	private final String expr;
	private final Boolean shared;

	private AttributeSpec(final Double value, final double min, final double max,
		final boolean vary, final String expr, final Boolean shared)
	{
		this.value = value;
		this.min = min;
		this.max = max;
		this.vary = vary;
		this.expr = expr;
		this.shared = shared;
	}

	/** A varying, unbounded attribute starting at {@code value}. */
	public static AttributeSpec of(final double value) {
		return new AttributeSpec(value, Double.NEGATIVE_INFINITY,
			Double.POSITIVE_INFINITY, true, null, null);
	}

	/** A varying attribute constrained to {@code [min, max]}. */
	public static AttributeSpec of(final double value, final double min,
		final double max)
	{
		return new AttributeSpec(value, min, max, true, null, null);
	}

	public static AttributeSpec of(final Double value, final double min,
		final double max, final boolean vary)
	{
		return new AttributeSpec(value, min, max, vary, null, null);
	}

	/** An attribute held at {@code value}. */
	public static AttributeSpec fixed(final double value) {
		return new AttributeSpec(value, Double.NEGATIVE_INFINITY,
			Double.POSITIVE_INFINITY, false, null, null);
	}

	/** An attribute computed from other parameters. */
	public static AttributeSpec derived(final String expr) {
		return new AttributeSpec(null, Double.NEGATIVE_INFINITY,
			Double.POSITIVE_INFINITY, false, Objects.requireNonNull(expr, "expr"),
			null);
	}

	/**
	 * @param newShared whether the attribute is shared between datasets in a
	 *          global fit; {@code null} restores the default
	 * @return a new instance
	 */
	public AttributeSpec withShared(final Boolean newShared) {
		return new AttributeSpec(value, min, max, vary, expr, newShared);
	}

	public AttributeSpec withValue(final double newValue) {
		return new AttributeSpec(newValue, min, max, vary, expr, shared);
	}

	public AttributeSpec withVary(final boolean newVary) {
		return new AttributeSpec(value, min, max, newVary, expr, shared);
	}

	public boolean isDerived() {
		return expr != null;
	}

	/** @return the start value, or {@code null} to use the model default */
	public Double getValue() {
		return value;
	}

	public double getMin() {
		return min;
	}

	public double getMax() {
		return max;
	}

	public boolean isVary() {
		return vary;
	}

	public String getExpr() {
		return expr;
	}

	public Boolean getShared() {
		return shared;
	}

	/**
	 * Attributes are shared between datasets unless declared otherwise, except
	 * {@code amplitude}, which is independent per dataset by default.
	 */
	public boolean isShared(final String attribute) {
		if (shared != null) return shared;
		return !"amplitude".equals(attribute);
	}

	@Override
	public String toString() {
		if (isDerived()) return "expr=" + expr;
		return String.format("value=%s, min=%s, max=%s, vary=%s", value, min, max,
			vary);
	}
}
