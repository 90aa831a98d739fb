/**
 * SpectraFit
 * ParameterGraph.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.exception.DimensionMismatchException;

/**
 * Flat, validated parameter set of one fit. The varying parameters form the
 * optimizer's coordinate system; {@link #resolve(double[])} substitutes their
 * values and evaluates derived parameters in dependency order. Instances are
 * immutable and safe to share between objectives.
 */
public final class ParameterGraph {

	private final List<Parameter> parameters;
	private final Map<String, Integer> slots;
	private final Expression[] expressions;
	private final int[] derivedOrder;
	private final int[] free;
	private final double[] base;
	private final List<PeakBinding> peaks;
	private final int datasets;

	ParameterGraph(final List<Parameter> params, final Expression[] expressions,
		final int[] derivedOrder, final List<PeakBinding> peaks,
		final int datasets)
	{
		this.expressions = expressions;
		this.derivedOrder = derivedOrder;
		this.peaks = Collections.unmodifiableList(new ArrayList<>(peaks));
		this.datasets = datasets;

		final Map<String, Integer> s = new HashMap<>();
		int nFree = 0;
		for (int i = 0; i < params.size(); i++) {
			s.put(params.get(i).getName(), i);
			if (params.get(i).isVarying()) nFree++;
		}
		this.slots = Collections.unmodifiableMap(s);

		this.free = new int[nFree];
		final double[] values = new double[params.size()];
		int k = 0;
		for (int i = 0; i < params.size(); i++) {
			values[i] = params.get(i).getValue();
			if (params.get(i).isVarying()) free[k++] = i;
		}
		for (final int d : derivedOrder) {
			values[d] = expressions[d].evaluate(values);
		}
		this.base = values;

		final List<Parameter> resolved = new ArrayList<>(params.size());
		for (int i = 0; i < params.size(); i++) {
			final Parameter p = params.get(i);
			resolved.add(p.getKind() == Parameter.Kind.DERIVED ? p.withValue(
				values[i]) : p);
		}
		this.parameters = Collections.unmodifiableList(resolved);
	}

	/** @return every parameter, in declaration order */
	public List<Parameter> parameters() {
		return parameters;
	}

	public Parameter parameter(final String name) {
		final Integer i = slots.get(name);
		if (i == null) {
			throw new IllegalArgumentException("Unknown parameter: " + name);
		}
		return parameters.get(i);
	}

	public boolean contains(final String name) {
		return slots.containsKey(name);
	}

	/** @return slot of {@code name} in the resolved value array, or -1 */
	public int slotOf(final String name) {
		final Integer i = slots.get(name);
		return i == null ? -1 : i;
	}

	/** Reverse index from a flattened name to peak, model and attribute. */
	public ParameterName key(final String name) {
		return parameter(name).getKey();
	}

	public int freeCount() {
		return free.length;
	}

	/** @return names of the varying parameters, in optimizer order */
	public List<String> freeNames() {
		final List<String> names = new ArrayList<>(free.length);
		for (final int i : free) {
			names.add(parameters.get(i).getName());
		}
		return names;
	}

	public double[] initialValues() {
		final double[] v = new double[free.length];
		for (int k = 0; k < free.length; k++) {
			v[k] = base[free[k]];
		}
		return v;
	}

	public double[] lowerBounds() {
		final double[] v = new double[free.length];
		for (int k = 0; k < free.length; k++) {
			v[k] = parameters.get(free[k]).getMin();
		}
		return v;
	}

	public double[] upperBounds() {
		final double[] v = new double[free.length];
		for (int k = 0; k < free.length; k++) {
			v[k] = parameters.get(free[k]).getMax();
		}
		return v;
	}

	/**
	 * Values of all parameters, indexed by slot, for the given varying values.
	 *
	 * @throws DimensionMismatchException if {@code values} does not have one
	 *           entry per varying parameter
	 */
	public double[] resolveAll(final double[] values) {
		if (values.length != free.length) {
			throw new DimensionMismatchException(values.length, free.length);
		}
		final double[] all = base.clone();
		for (int k = 0; k < free.length; k++) {
			all[free[k]] = values[k];
		}
		for (final int d : derivedOrder) {
			all[d] = expressions[d].evaluate(all);
		}
		return all;
	}

	/** @return parameter name to value, in declaration order */
	public Map<String, Double> resolve(final double[] values) {
		final double[] all = resolveAll(values);
		final Map<String, Double> out = new LinkedHashMap<>();
		for (int i = 0; i < all.length; i++) {
			out.put(parameters.get(i).getName(), all[i]);
		}
		return out;
	}

	/** Maps bounded external values to unbounded optimizer coordinates. */
	public double[] toInternal(final double[] external) {
		final double[] v = new double[free.length];
		for (int k = 0; k < free.length; k++) {
			final Parameter p = parameters.get(free[k]);
			v[k] = BoundsTransform.toInternal(external[k], p.getMin(), p.getMax());
		}
		return v;
	}

	public double[] toExternal(final double[] internal) {
		final double[] v = new double[free.length];
		for (int k = 0; k < free.length; k++) {
			final Parameter p = parameters.get(free[k]);
			v[k] = BoundsTransform.toExternal(internal[k], p.getMin(), p.getMax());
		}
		return v;
	}

	public List<PeakBinding> peaks() {
		return peaks;
	}

	/** @return the peaks contributing to one dataset (all peaks in a local fit) */
	public List<PeakBinding> peaks(final int dataset) {
		if (datasets == 0) return peaks;
		final List<PeakBinding> out = new ArrayList<>();
		for (final PeakBinding b : peaks) {
			if (b.getDataset() == dataset) out.add(b);
		}
		return out;
	}

	public boolean isGlobal() {
		return datasets > 0;
	}

	/** @return number of datasets of a global fit, 0 for a local fit */
	public int datasetCount() {
		return datasets;
	}

	/**
	 * @return a graph in which {@code name} is held at {@code value}; the
	 *         other parameters keep their current start values
	 */
	public ParameterGraph withFixed(final String name, final double value) {
		final int slot = slotOf(name);
		if (slot < 0) {
			throw new IllegalArgumentException("Unknown parameter: " + name);
		}
		if (parameters.get(slot).getKind() == Parameter.Kind.DERIVED) {
			throw new IllegalArgumentException("Cannot fix derived parameter " +
				name);
		}
		final List<Parameter> copy = new ArrayList<>(parameters);
		copy.set(slot, parameters.get(slot).fixedAt(value));
		return new ParameterGraph(copy, expressions, derivedOrder, peaks,
			datasets);
	}

	/** @return a graph whose varying parameters start at {@code values} */
	public ParameterGraph withValues(final double[] values) {
		if (values.length != free.length) {
			throw new DimensionMismatchException(values.length, free.length);
		}
		final List<Parameter> copy = new ArrayList<>(parameters);
		for (int k = 0; k < free.length; k++) {
			copy.set(free[k], parameters.get(free[k]).withValue(values[k]));
		}
		return new ParameterGraph(copy, expressions, derivedOrder, peaks,
			datasets);
	}
}
