/**
 * SpectraFit
 * ProjectReader.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import spectrafit.exception.InvalidSettingsException;
import spectrafit.models.Model;
import spectrafit.parameters.AttributeSpec;
import spectrafit.parameters.PeakDetectionSettings;
import spectrafit.parameters.PeakSpec;
import spectrafit.solver.Dataset;
import spectrafit.solver.GlobalFitAggregator;
import spectrafit.solver.Minimizer;
import spectrafit.solver.NanPolicy;
import spectrafit.statistics.ConfidenceSettings;

/**
 * Reads a fit project from the nested mapping produced by any JSON, TOML or
 * YAML reader:
 *
 * <pre>
 * settings: { global: 0 | 1 | 2, autopeak: false | true | { height: ..., threshold: ..., distance: ...,
 *             prominence: ..., width: ..., rel_height: ..., modeltype: ... } }
 * fitting:
 *   parameters:
 *     minimizer:     { nan_policy: ..., calc_covar: ... }
 *     optimizer:     { method: ..., max_nfev: ... }
 *     conf_interval: false | { sigmas: [...], maxiter: ..., min_rel_change: ..., trace: ... }
 *   peaks:
 *     "1": { gaussian: { amplitude: { value: 1, min: 0, max: 2, vary: true }, ... } }
 * </pre>
 *
 * With {@code global: 2} the peaks are keyed by dataset index first. With
 * {@code autopeak} the peaks are detected in the data and the declared ones
 * are ignored; a window is a minimum or a {@code [min, max]} list. Peaks are
 * taken in mapping iteration order. The mapping is only read.
 */
public final class ProjectReader {

	private ProjectReader() {}

	/** @throws InvalidSettingsException if the mapping is malformed */
	public static FitProject read(final Map<String, ?> mapping,
		final Dataset dataset)
	{
		final Map<String, ?> settings = section(mapping, "settings");
		final Map<String, ?> fitting = section(mapping, "fitting");
		final Map<String, ?> parameters = section(fitting, "parameters");

		SolverSettings solver = SolverSettings.create();
		if (settings.containsKey("global")) {
			solver = solver.withGlobal(toInt(settings.get("global"), "global"));
		}
		final Map<String, ?> minimizer = section(parameters, "minimizer");
		if (minimizer.containsKey("nan_policy")) {
			solver = solver.withNanPolicy(NanPolicy.fromString(String.valueOf(
				minimizer.get("nan_policy"))));
		}
		if (minimizer.containsKey("calc_covar")) {
			solver = solver.withCalcCovar(toBoolean(minimizer.get("calc_covar"),
				"calc_covar"));
		}
		final Map<String, ?> optimizer = section(parameters, "optimizer");
		if (optimizer.containsKey("method")) {
			solver = solver.withMethod(Minimizer.fromName(String.valueOf(optimizer
				.get("method"))));
		}
		if (optimizer.containsKey("max_nfev") && optimizer.get(
			"max_nfev") != null)
		{
			solver = solver.withMaxNfev(toInt(optimizer.get("max_nfev"),
				"max_nfev"));
		}
		solver = solver.withConfidence(confidence(parameters.get(
			"conf_interval")));
		solver = solver.withPeakDetection(peakDetection(settings.get(
			"autopeak")));

		final Map<String, ?> peakMap = section(fitting, "peaks");
		final List<PeakSpec> peaks = new ArrayList<>();
		if (solver.getGlobal() == GlobalFitAggregator.PREDEFINED) {
			for (final Map.Entry<String, ?> e : peakMap.entrySet()) {
				final int d = toIndex(e.getKey(), "dataset");
				for (final Map.Entry<String, ?> p : asMap(e.getValue(), "peaks of " +
					"dataset " + e.getKey()).entrySet())
				{
					peaks.add(peak(p.getKey(), p.getValue()).forDataset(d));
				}
			}
		}
		else {
			for (final Map.Entry<String, ?> p : peakMap.entrySet()) {
				peaks.add(peak(p.getKey(), p.getValue()));
			}
		}
		if (peaks.isEmpty() && !solver.getPeakDetection().isEnabled()) {
			throw new InvalidSettingsException("No peaks declared");
		}
		return FitProject.create(peaks, solver, dataset);
	}

	private static ConfidenceSettings confidence(final Object value) {
		if (value == null || Boolean.FALSE.equals(value)) {
			return ConfidenceSettings.disabled();
		}
		if (Boolean.TRUE.equals(value)) return ConfidenceSettings.create();
		final Map<String, ?> m = asMap(value, "conf_interval");
		ConfidenceSettings c = ConfidenceSettings.create();
		if (m.containsKey("sigmas")) {
			final Object s = m.get("sigmas");
			if (!(s instanceof List)) {
				throw new InvalidSettingsException("sigmas must be a list");
			}
			final List<?> list = (List<?>) s;
			final double[] levels = new double[list.size()];
			for (int i = 0; i < levels.length; i++) {
				levels[i] = toDouble(list.get(i), "sigmas");
			}
			c = c.withProbabilities(levels);
		}
		if (m.containsKey("maxiter")) {
			c = c.withMaxIter(toInt(m.get("maxiter"), "maxiter"));
		}
		if (m.containsKey("min_rel_change")) {
			c = c.withMinRelChange(toDouble(m.get("min_rel_change"),
				"min_rel_change"));
		}
		if (m.containsKey("trace")) {
			c = c.withTrace(toBoolean(m.get("trace"), "trace"));
		}
		return c;
	}

	private static PeakDetectionSettings peakDetection(final Object value) {
		if (value == null || Boolean.FALSE.equals(value)) {
			return PeakDetectionSettings.disabled();
		}
		if (Boolean.TRUE.equals(value)) return PeakDetectionSettings.create();
		final Map<String, ?> m = asMap(value, "autopeak");
		PeakDetectionSettings d = PeakDetectionSettings.create();
		for (final Map.Entry<String, ?> e : m.entrySet()) {
			final String key = e.getKey().trim().toLowerCase(Locale.ROOT);
			final Object v = e.getValue();
			switch (key) {
				case "modeltype":
					d = d.withModel(Model.fromTag(String.valueOf(v)));
					break;
				case "height": {
					final double[] w = window(v, key);
					d = d.withHeight(w[0], w[1]);
					break;
				}
				case "threshold": {
					final double[] w = window(v, key);
					d = d.withThreshold(w[0], w[1]);
					break;
				}
				case "distance":
					d = d.withDistance(toDouble(v, key));
					break;
				case "prominence": {
					final double[] w = window(v, key);
					d = d.withProminence(w[0], w[1]);
					break;
				}
				case "width": {
					final double[] w = window(v, key);
					d = d.withWidth(w[0], w[1]);
					break;
				}
				case "rel_height":
					d = d.withRelHeight(toDouble(v, key));
					break;
				default:
					throw new InvalidSettingsException("Unknown autopeak option: " + e
						.getKey());
			}
		}
		return d;
	}

	/** A minimum, or a {@code [min]} / {@code [min, max]} list. */
	private static double[] window(final Object value, final String what) {
		if (value instanceof List) {
			final List<?> list = (List<?>) value;
			if (list.isEmpty() || list.size() > 2) {
				throw new InvalidSettingsException(what +
					" must be a minimum or a [min, max] pair: " + value);
			}
			return new double[] { toDouble(list.get(0), what), list.size() == 2
				? toDouble(list.get(1), what) : Double.POSITIVE_INFINITY };
		}
		return new double[] { toDouble(value, what), Double.POSITIVE_INFINITY };
	}

	private static PeakSpec peak(final String key, final Object value) {
		final int index = toIndex(key, "peak");
		final Map<String, ?> models = asMap(value, "peak " + key);
		if (models.size() != 1) {
			throw new InvalidSettingsException("Peak " + key +
				" must declare exactly one model, found " + models.keySet());
		}
		final Map.Entry<String, ?> model = models.entrySet().iterator().next();
		PeakSpec peak = PeakSpec.of(index, model.getKey());
		for (final Map.Entry<String, ?> a : asMap(model.getValue(), "model " +
			model.getKey()).entrySet())
		{
			peak = peak.with(a.getKey(), attribute(a.getKey(), a.getValue()));
		}
		return peak;
	}

	private static AttributeSpec attribute(final String name,
		final Object value)
	{
		if (value instanceof Number || value instanceof String) {
			return AttributeSpec.of(toDouble(value, name));
		}
		final Map<String, ?> m = asMap(value, "attribute " + name);
		AttributeSpec spec;
		if (m.get("expr") != null) {
			spec = AttributeSpec.derived(String.valueOf(m.get("expr")));
		}
		else {
			final Double v = m.get("value") == null ? null : toDouble(m.get("value"),
				name);
			final double min = m.get("min") == null ? Double.NEGATIVE_INFINITY
				: toDouble(m.get("min"), name);
			final double max = m.get("max") == null ? Double.POSITIVE_INFINITY
				: toDouble(m.get("max"), name);
			final boolean vary = m.get("vary") == null || toBoolean(m.get("vary"),
				name);
			spec = AttributeSpec.of(v, min, max, vary);
		}
		if (m.get("shared") != null) {
			spec = spec.withShared(toBoolean(m.get("shared"), name));
		}
		return spec;
	}

	private static Map<String, ?> section(final Map<String, ?> parent,
		final String key)
	{
		final Object value = parent.get(key);
		if (value == null) return Collections.emptyMap();
		return asMap(value, key);
	}

	@SuppressWarnings("unchecked")
	private static Map<String, ?> asMap(final Object value, final String what) {
		if (!(value instanceof Map)) {
			throw new InvalidSettingsException(what + " must be a mapping, got " +
				value);
		}
		return (Map<String, ?>) value;
	}

	private static int toIndex(final String key, final String what) {
		try {
			final int i = Integer.parseInt(key.trim());
			if (i < 1) {
				throw new InvalidSettingsException(what + " index must be >= 1: " +
					key);
			}
			return i;
		}
		catch (final NumberFormatException e) {
			throw new InvalidSettingsException("Invalid " + what + " index: " + key,
				e);
		}
	}

	private static int toInt(final Object value, final String what) {
		if (value instanceof Number) return ((Number) value).intValue();
		try {
			return Integer.parseInt(String.valueOf(value).trim());
		}
		catch (final NumberFormatException e) {
			throw new InvalidSettingsException("Invalid integer for " + what + ": " +
				value, e);
		}
	}

	private static double toDouble(final Object value, final String what) {
		if (value instanceof Number) return ((Number) value).doubleValue();
		final String s = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
		switch (s) {
			case "inf":
			case "+inf":
			case "infinity":
				return Double.POSITIVE_INFINITY;
			case "-inf":
			case "-infinity":
				return Double.NEGATIVE_INFINITY;
			case "nan":
				return Double.NaN;
			default:
				try {
					return Double.parseDouble(s);
				}
				catch (final NumberFormatException e) {
					throw new InvalidSettingsException("Invalid number for " + what +
						": " + value, e);
				}
		}
	}

	private static boolean toBoolean(final Object value, final String what) {
		if (value instanceof Boolean) return (Boolean) value;
		final String s = String.valueOf(value).trim().toLowerCase(Locale.ROOT);
		if ("true".equals(s)) return true;
		if ("false".equals(s)) return false;
		throw new InvalidSettingsException("Invalid boolean for " + what + ": " +
			value);
	}
}
