/**
 * SpectraFit
 * Expression.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import java.util.Map;
import java.util.Set;

/**
 * Parsed arithmetic expression over parameter names. Trees are immutable;
 * {@link #bind(Map)} turns name references into slots of a value array so
 * that evaluation inside the optimizer loop does no lookups.
 */
public abstract class Expression {

	Expression() {}

	/** Evaluates the expression against parameter values indexed by slot. */
	public abstract double evaluate(double[] values);

	/** Adds every referenced parameter name to {@code names}. */
	public abstract void collectReferences(Set<String> names);

	/**
	 * @param slots parameter name to slot in the value array
	 * @return a copy in which every reference is bound to its slot
	 */
	public abstract Expression bind(Map<String, Integer> slots);

	static final class Constant extends Expression {

		private final double value;

		Constant(final double value) {
			this.value = value;
		}

		@Override
		public double evaluate(final double[] values) {
			return value;
		}

		@Override
		public void collectReferences(final Set<String> names) {}

		@Override
		public Expression bind(final Map<String, Integer> slots) {
			return this;
		}

		@Override
		public String toString() {
			return Double.toString(value);
		}
	}

	static final class Reference extends Expression {

		private final String name;
		private final int slot;

		Reference(final String name, final int slot) {
			this.name = name;
			this.slot = slot;
		}

		@Override
		public double evaluate(final double[] values) {
			if (slot < 0) {
				throw new IllegalStateException("Unbound parameter reference: " + name);
			}
			return values[slot];
		}

		@Override
		public void collectReferences(final Set<String> names) {
			names.add(name);
		}

		@Override
		public Expression bind(final Map<String, Integer> slots) {
			final Integer s = slots.get(name);
			if (s == null) {
				throw new IllegalArgumentException("No slot for parameter " + name);
			}
			return new Reference(name, s);
		}

		@Override
		public String toString() {
			return name;
		}
	}

	static final class Negation extends Expression {

		private final Expression operand;

		Negation(final Expression operand) {
			this.operand = operand;
		}

		@Override
		public double evaluate(final double[] values) {
			return -operand.evaluate(values);
		}

		@Override
		public void collectReferences(final Set<String> names) {
			operand.collectReferences(names);
		}

		@Override
		public Expression bind(final Map<String, Integer> slots) {
			return new Negation(operand.bind(slots));
		}

		@Override
		public String toString() {
			return "-(" + operand + ")";
		}
	}

	static final class Binary extends Expression {

		private final char operator;
		private final Expression left;
		private final Expression right;

		Binary(final char operator, final Expression left, final Expression right) {
			this.operator = operator;
			this.left = left;
			this.right = right;
		}

		@Override
		public double evaluate(final double[] values) {
			final double a = left.evaluate(values);
			final double b = right.evaluate(values);
			switch (operator) {
				case '+':
					return a + b;
				case '-':
					return a - b;
				case '*':
					return a * b;
				case '/':
					return a / b;
				default:
					throw new IllegalStateException("Operator " + operator);
			}
		}

		@Override
		public void collectReferences(final Set<String> names) {
			left.collectReferences(names);
			right.collectReferences(names);
		}

		@Override
		public Expression bind(final Map<String, Integer> slots) {
			return new Binary(operator, left.bind(slots), right.bind(slots));
		}

		@Override
		public String toString() {
			return "(" + left + " " + operator + " " + right + ")";
		}
	}
}
