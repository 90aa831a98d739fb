/**
 * SpectraFit
 * ReportAssembler.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.report;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.linear.RealMatrix;

import spectrafit.FitResult;
import spectrafit.ParameterEstimate;
import spectrafit.SolverSettings;
import spectrafit.statistics.ConfidenceInterval;
import spectrafit.statistics.ConfidenceResult;
import spectrafit.statistics.DataStatistics;
import spectrafit.statistics.GoodnessOfFit;
import spectrafit.statistics.StatisticsBlock;

/**
 * Turns a {@link FitResult} into a {@link FitReport}. Pure aggregation; no
 * numbers are recomputed here.
 */
public final class ReportAssembler {

	private ReportAssembler() {}

	public static FitReport assemble(final SolverSettings settings,
		final FitResult result)
	{
		final StatisticsBlock stats = result.getStatistics();
		final ConfidenceResult ci = stats.getConfidence();

		Map<String, List<FitReport.Level>> intervals = null;
		Map<String, Map<String, double[]>> trace = null;
		if (!ci.isEmpty()) {
			intervals = new LinkedHashMap<>();
			for (final ConfidenceInterval c : ci.getIntervals()) {
				intervals.put(c.getParameter(), levels(c));
			}
			if (!ci.getTrace().isEmpty()) trace = new LinkedHashMap<>(ci.getTrace());
		}

		Map<String, FitReport.DatasetReport> datasets = null;
		if (result.isGlobal()) {
			datasets = new LinkedHashMap<>();
			for (final FitResult d : result.getDatasets()) {
				final StatisticsBlock s = d.getStatistics();
				datasets.put(String.valueOf(d.getDataset()),
					new FitReport.DatasetReport(variables(d), goodness(s.getGoodness()),
						s.getParameterCorrelation(), s.getRegression().toMap(),
						statistics(s.getDescriptiveStatistic())));
			}
		}

		return new FitReport(settings(settings), statistics(stats
			.getDataStatistic()), statistics(stats.getDescriptiveStatistic()),
			insights(result), intervals, trace, stats.getComponentCorrelation(),
			stats.getRegression().toMap(), result.getTable().getAlignedResult(),
			datasets);
	}

	private static Map<String, Object> settings(final SolverSettings settings) {
		final Map<String, Object> m = new LinkedHashMap<>();
		m.put("method", settings.getMethod().key());
		m.put("nan_policy", settings.getNanPolicy().key());
		m.put("max_nfev", settings.getMaxNfev());
		m.put("calc_covar", settings.isCalcCovar());
		m.put("global", settings.getGlobal());
		m.put("conf_interval", settings.getConfidence().isEnabled());
		m.put("autopeak", settings.getPeakDetection().isEnabled());
		return m;
	}

	private static FitReport.FitInsights insights(final FitResult result) {
		final GoodnessOfFit gof = result.getStatistics().getGoodness();
		final Map<String, Object> configurations = new LinkedHashMap<>();
		configurations.put("fitting_method", result.getMethod().key());
		configurations.put("function_evals", result.getNfev());
		configurations.put("data_points", gof.getNdata());
		configurations.put("variable_names", new ArrayList<>(result
			.getFreeNames()));
		configurations.put("variable_numbers", gof.getNvarys());
		configurations.put("degree_of_freedom", gof.getDegreesOfFreedom());
		configurations.put("termination_reason", result.getReason().name());

		final List<String> atInitial = new ArrayList<>();
		final List<String> atBoundary = new ArrayList<>();
		for (final ParameterEstimate p : result.getParameters()) {
			if (p.isAtInitialValue()) atInitial.add(p.getName());
			if (p.isAtBoundary()) atBoundary.add(p.getName());
		}
		final Map<String, Object> errorbars = new LinkedHashMap<>();
		errorbars.put("errorbars", result.hasErrorbars());
		errorbars.put("at_initial_value", atInitial);
		errorbars.put("at_boundary", atBoundary);

		Map<String, Map<String, Double>> covariance = null;
		final RealMatrix cov = result.getCovariance();
		if (cov != null) {
			covariance = new LinkedHashMap<>();
			final List<String> names = result.getFreeNames();
			for (int i = 0; i < names.size(); i++) {
				final Map<String, Double> row = new LinkedHashMap<>();
				for (int j = 0; j < names.size(); j++) {
					row.put(names.get(j), cov.getEntry(i, j));
				}
				covariance.put(names.get(i), row);
			}
		}

		final Map<String, Object> computational = new LinkedHashMap<>();
		computational.put("success", result.isSuccess());
		computational.put("message", result.getMessage());
		computational.put("errorbars", result.hasErrorbars());
		computational.put("nfev", result.getNfev());
		computational.put("max_nfev", result.getMaxNfev());

		return new FitReport.FitInsights(configurations, goodness(gof), variables(
			result), errorbars, result.getStatistics().getParameterCorrelation(),
			covariance, computational);
	}

	private static Map<String, Double> goodness(final GoodnessOfFit gof) {
		final Map<String, Double> m = new LinkedHashMap<>();
		m.put("chi_square", gof.getChiSquare());
		m.put("reduced_chi_square", gof.getReducedChiSquare());
		m.put("akaike_information", gof.getAic());
		m.put("bayesian_information", gof.getBic());
		m.put("r_squared", gof.getRSquared());
		return m;
	}

	private static Map<String, FitReport.Variable> variables(
		final FitResult result)
	{
		final Map<String, FitReport.Variable> m = new LinkedHashMap<>();
		for (final ParameterEstimate p : result.getParameters()) {
			m.put(p.getName(), new FitReport.Variable(p.getInitValue(), p
				.getModelValue(), p.getBestValue(), p.getStderr(), p
					.getErrorRelative(), p.isVary(), p.getExpr()));
		}
		return m;
	}

	private static Map<String, Map<String, Double>> statistics(
		final Map<String, DataStatistics> columns)
	{
		final Map<String, Map<String, Double>> m = new LinkedHashMap<>();
		for (final Map.Entry<String, DataStatistics> e : columns.entrySet()) {
			m.put(e.getKey(), e.getValue().toMap());
		}
		return m;
	}

	/** Lower limits from the widest level inwards, the best value, then upper. */
	private static List<FitReport.Level> levels(final ConfidenceInterval c) {
		final double[] probs = c.getProbabilities();
		final Integer[] order = new Integer[probs.length];
		for (int i = 0; i < order.length; i++) {
			order[i] = i;
		}
		Arrays.sort(order, (a, b) -> Double.compare(probs[b], probs[a]));
		final List<FitReport.Level> out = new ArrayList<>();
		for (final int i : order) {
			out.add(new FitReport.Level(probs[i], c.getLower()[i]));
		}
		out.add(new FitReport.Level(0.0, c.getBest()));
		for (int k = order.length - 1; k >= 0; k--) {
			out.add(new FitReport.Level(probs[order[k]], c.getUpper()[order[k]]));
		}
		return out;
	}
}
