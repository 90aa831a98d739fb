/**
 * SpectraFit
 * ParameterGraphBuilder.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.math3.util.FastMath;

import spectrafit.exception.CyclicExpressionException;
import spectrafit.exception.DuplicateParameterException;
import spectrafit.exception.InvalidBoundsException;
import spectrafit.exception.InvalidExpressionException;
import spectrafit.models.Model;

/**
 * Flattens peak declarations into a {@link ParameterGraph}. All validation
 * (duplicate names, expression syntax and references, cycles, bounds) happens
 * here, before any model is evaluated.
 */
public final class ParameterGraphBuilder {

	private static final Pattern IDENTIFIER = Pattern.compile(
		"[A-Za-z_][A-Za-z0-9_]*");

	private ParameterGraphBuilder() {}

	/** Builds the graph of a single-dataset fit. */
	public static ParameterGraph build(final List<PeakSpec> peaks) {
		final Draft draft = new Draft();
		for (final PeakSpec peak : peaks) {
			draft.beginPeak(peak, 0);
			for (final Map.Entry<String, AttributeSpec> e : peak.getAttributes()
				.entrySet())
			{
				final ParameterName name = new ParameterName(peak.getModel(), e
					.getKey(), peak.getIndex(), 0);
				draft.add(name, e.getValue(), parseOrNull(e.getValue()));
			}
		}
		return draft.finish(0);
	}

	/**
	 * Builds the graph of a global fit in which every peak is replicated for
	 * each of {@code datasets} datasets. Shared attributes of datasets 2..N are
	 * derived from the dataset-1 parameter, so the optimizer sees one
	 * coordinate per shared attribute. References to local names inside
	 * expressions are redirected to the same dataset.
	 */
	public static ParameterGraph buildGlobal(final List<PeakSpec> peaks,
		final int datasets)
	{
		if (datasets < 1) {
			throw new IllegalArgumentException("At least one dataset is required");
		}
		final Set<String> localNames = new HashSet<>();
		for (final PeakSpec peak : peaks) {
			for (final String attribute : peak.getAttributes().keySet()) {
				localNames.add(ParameterName.format(peak.getModel(), attribute, peak
					.getIndex(), 0));
			}
		}

		final Draft draft = new Draft();
		for (int d = 1; d <= datasets; d++) {
			final int dataset = d;
			for (final PeakSpec peak : peaks) {
				draft.beginPeak(peak, dataset);
				for (final Map.Entry<String, AttributeSpec> e : peak.getAttributes()
					.entrySet())
				{
					final String attribute = e.getKey();
					final AttributeSpec spec = e.getValue();
					final ParameterName name = new ParameterName(peak.getModel(),
						attribute, peak.getIndex(), dataset);
					if (dataset > 1 && spec.isShared(attribute)) {
						final String first = name.inDataset(1).toString();
						draft.add(name, AttributeSpec.derived(first), new Expression.Reference(
							first, -1));
					}
					else if (spec.isDerived()) {
						final String text = localize(spec.getExpr(), localNames, dataset);
						draft.add(name, AttributeSpec.derived(text), ExpressionParser
							.parse(text));
					}
					else {
						draft.add(name, spec, null);
					}
				}
			}
		}
		return draft.finish(datasets);
	}

	/**
	 * Builds the graph of a global fit whose peaks are declared per dataset
	 * (see {@link PeakSpec#forDataset(int)}). Nothing is shared implicitly;
	 * links between datasets are written as expressions over full names.
	 */
	public static ParameterGraph buildPredefined(final List<PeakSpec> peaks) {
		int datasets = 0;
		for (final PeakSpec peak : peaks) {
			if (peak.getDataset() < 1) {
				throw new IllegalArgumentException("Peak " + peak.getIndex() +
					" has no dataset index");
			}
			datasets = FastMath.max(datasets, peak.getDataset());
		}
		final Draft draft = new Draft();
		for (final PeakSpec peak : peaks) {
			draft.beginPeak(peak, peak.getDataset());
			for (final Map.Entry<String, AttributeSpec> e : peak.getAttributes()
				.entrySet())
			{
				final ParameterName name = new ParameterName(peak.getModel(), e
					.getKey(), peak.getIndex(), peak.getDataset());
				draft.add(name, e.getValue(), parseOrNull(e.getValue()));
			}
		}
		return draft.finish(datasets);
	}

	/** Appends the dataset suffix to every local parameter name in {@code expr}. */
	static String localize(final String expr, final Set<String> localNames,
		final int dataset)
	{
		final Matcher m = IDENTIFIER.matcher(expr);
		final StringBuffer sb = new StringBuffer();
		while (m.find()) {
			final String ref = m.group().toLowerCase(Locale.ROOT);
			m.appendReplacement(sb, localNames.contains(ref) ? ref + "_" + dataset
				: m.group());
		}
		m.appendTail(sb);
		return sb.toString();
	}

	private static Expression parseOrNull(final AttributeSpec spec) {
		return spec.isDerived() ? ExpressionParser.parse(spec.getExpr()) : null;
	}

	/** Start value of a declared attribute; model defaults are clipped into the bounds. */
	static double startValue(final Model model, final String attribute,
		final AttributeSpec spec)
	{
		if (spec.getValue() != null) return spec.getValue();
		final double d = model.defaultValue(attribute);
		final double min = spec.getMin();
		final double max = spec.getMax();
		if (Double.isNaN(d)) {
			if (spec.isVary() && !Double.isInfinite(min) && !Double.isInfinite(
				max)) return 0.5 * (min + max);
			return d;
		}
		return FastMath.max(min, FastMath.min(max, d));
	}

	private static final class PeakDraft {

		final PeakSpec spec;
		final int dataset;
		final List<String> names = new ArrayList<>();

		PeakDraft(final PeakSpec spec, final int dataset) {
			this.spec = spec;
			this.dataset = dataset;
		}
	}

	private static final class Draft {

		private final List<Parameter> params = new ArrayList<>();
		private final List<Expression> exprs = new ArrayList<>();
		private final List<String> exprTexts = new ArrayList<>();
		private final Map<String, Integer> slots = new HashMap<>();
		private final List<PeakDraft> peaks = new ArrayList<>();
		private final Set<String> components = new HashSet<>();

		void beginPeak(final PeakSpec spec, final int dataset) {
			final PeakDraft p = new PeakDraft(spec, dataset);
			final String component = spec.getModel().tag() + "_" + spec.getIndex() +
				(dataset > 0 ? "_" + dataset : "");
			if (!components.add(component)) {
				throw new DuplicateParameterException(component);
			}
			peaks.add(p);
		}

		void add(final ParameterName name, final AttributeSpec spec,
			final Expression expr)
		{
			final String key = name.toString();
			if (slots.containsKey(key)) {
				throw new DuplicateParameterException(key);
			}
			slots.put(key, params.size());
			peaks.get(peaks.size() - 1).names.add(key);
			if (expr != null) {
				params.add(new Parameter(name, Parameter.Kind.DERIVED, Double.NaN,
					Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, spec
						.getExpr()));
			}
			else {
				final double value = startValue(name.getModel(), name.getAttribute(),
					spec);
				params.add(new Parameter(name, spec.isVary() ? Parameter.Kind.VARYING
					: Parameter.Kind.FIXED, value, spec.getMin(), spec.getMax(), null));
			}
			exprs.add(expr);
			exprTexts.add(spec.getExpr());
		}

		ParameterGraph finish(final int datasets) {
			final int n = params.size();
			final Expression[] bound = new Expression[n];
			final List<List<Integer>> deps = new ArrayList<>(n);
			for (int i = 0; i < n; i++) {
				final List<Integer> d = new ArrayList<>();
				final Expression e = exprs.get(i);
				if (e != null) {
					final Set<String> refs = new LinkedHashSet<>();
					e.collectReferences(refs);
					for (final String ref : refs) {
						final Integer slot = slots.get(ref);
						if (slot == null) {
							throw new InvalidExpressionException(exprTexts.get(i),
								"unknown parameter '" + ref + "' in " + params.get(i)
									.getName());
						}
						d.add(slot);
					}
					bound[i] = e.bind(slots);
				}
				deps.add(d);
			}

			final int[] order = topologicalOrder(deps);
			validateBounds();

			final List<PeakBinding> bindings = new ArrayList<>();
			for (final PeakDraft p : peaks) {
				final Model model = p.spec.getModel();
				final int[] peakSlots = new int[model.attributes().size()];
				Arrays.fill(peakSlots, -1);
				for (final String key : p.names) {
					final Parameter param = params.get(slots.get(key));
					peakSlots[model.indexOf(param.getKey().getAttribute())] = slots.get(
						key);
				}
				bindings.add(new PeakBinding(p.spec.getIndex(), p.dataset, model,
					peakSlots, model.defaults()));
			}
			return new ParameterGraph(params, bound, order, bindings, datasets);
		}

		private int[] topologicalOrder(final List<List<Integer>> deps) {
			final int n = params.size();
			final int[] state = new int[n];
			final List<Integer> order = new ArrayList<>();
			final List<Integer> path = new ArrayList<>();
			for (int i = 0; i < n; i++) {
				if (exprs.get(i) != null) visit(i, deps, state, path, order);
			}
			final int[] out = new int[order.size()];
			for (int i = 0; i < out.length; i++) {
				out[i] = order.get(i);
			}
			return out;
		}

		private void visit(final int i, final List<List<Integer>> deps,
			final int[] state, final List<Integer> path, final List<Integer> order)
		{
			if (state[i] == 2) return;
			if (state[i] == 1) {
				final List<String> cycle = new ArrayList<>();
				for (int k = path.indexOf(i); k < path.size(); k++) {
					cycle.add(params.get(path.get(k)).getName());
				}
				cycle.add(params.get(i).getName());
				throw new CyclicExpressionException(cycle);
			}
			state[i] = 1;
			path.add(i);
			for (final int d : deps.get(i)) {
				if (exprs.get(d) != null) visit(d, deps, state, path, order);
			}
			path.remove(path.size() - 1);
			state[i] = 2;
			order.add(i);
		}

		private void validateBounds() {
			for (final Parameter p : params) {
				if (!p.isVarying()) continue;
				final double v = p.getValue();
				if (Double.isNaN(v) || Double.isInfinite(v) || Double.isNaN(p
					.getMin()) || Double.isNaN(p.getMax()) || p.getMin() > p.getMax() ||
					v < p.getMin() || v > p.getMax())
				{
					throw new InvalidBoundsException(p.getName(), v, p.getMin(), p
						.getMax());
				}
			}
		}
	}
}
