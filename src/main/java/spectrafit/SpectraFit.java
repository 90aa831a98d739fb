/**
 * SpectraFit
 * SpectraFit.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.lang3.time.StopWatch;
import org.apache.commons.math3.linear.RealMatrix;
import org.scijava.Context;
import org.scijava.app.StatusService;
import org.scijava.log.LogService;
import org.scijava.plugin.Parameter;

import spectrafit.exception.InvalidSettingsException;
import spectrafit.parameters.ParameterGraph;
import spectrafit.parameters.PeakDetector;
import spectrafit.parameters.PeakSpec;
import spectrafit.report.FitReport;
import spectrafit.report.ReportAssembler;
import spectrafit.solver.CompositeObjective;
import spectrafit.solver.Dataset;
import spectrafit.solver.FitMonitor;
import spectrafit.solver.GlobalFitAggregator;
import spectrafit.solver.GlobalFitAggregator.FitPlan;
import spectrafit.solver.OptimizerAdapter;
import spectrafit.solver.Optimum;
import spectrafit.solver.StatusMonitor;
import spectrafit.statistics.ConfidenceIntervalCalculator;
import spectrafit.statistics.ConfidenceResult;
import spectrafit.statistics.ConfidenceSettings;
import spectrafit.statistics.FitTable;
import spectrafit.statistics.StatisticsBlock;
import spectrafit.statistics.StatisticsEngine;

/**
 * Fitting pipeline: builds and validates the parameter graph, minimizes,
 * computes statistics and confidence intervals, and splits global fits into
 * per-dataset results.
 */
public class SpectraFit {

	private static final String ENERGY = "energy";
	private static final String INTENSITY = "intensity";
	private static final String RESIDUAL = "residual";
	private static final String FIT = "fit";

	@Parameter
	private LogService log;
	@Parameter
	private StatusService statusServ;

	public SpectraFit(final Context context) {
		context.inject(this);
	}

	/** Fits with progress forwarded to the status service. */
	public FitResult fit(final FitProject project) {
		return fit(project, new StatusMonitor(statusServ, log));
	}

	/**
	 * @param monitor observer of every objective evaluation
	 * @throws spectrafit.exception.SpectraFitException for invalid input, before
	 *           any optimization
	 */
	public FitResult fit(final FitProject project, final FitMonitor monitor) {
		final StopWatch sw = new StopWatch();
		sw.start();
		final SolverSettings settings = project.getSettings();
		final List<PeakSpec> peaks = settings.getPeakDetection().isEnabled()
			? detectPeaks(project) : project.getPeaks();
		final FitPlan plan = GlobalFitAggregator.plan(peaks, project.getDataset(),
			settings.getGlobal(), settings.getNanPolicy());
		final ParameterGraph graph = plan.getGraph();
		log.info(String.format("%s fit of %d peaks, %d varying parameters (%s)",
			plan.getMode(), peaks.size(), graph.freeCount(), settings));

		final Optimum optimum = new OptimizerAdapter(log).minimize(plan
			.getObjective(), settings.getMethod(), settings.getMaxNfev(), settings
				.isCalcCovar(), monitor);

		ConfidenceResult confidence = null;
		final ConfidenceSettings ci = settings.getConfidence();
		if (ci.isEnabled()) {
			confidence = new ConfidenceIntervalCalculator(log).calculate(plan
				.getObjective(), optimum, ci);
		}

		final List<ParameterEstimate> estimates = ParameterTable.estimates(graph,
			optimum);
		final List<String> names = new ArrayList<>();
		for (final ParameterEstimate e : estimates) {
			names.add(e.getName());
		}
		final StatisticsEngine engine = new StatisticsEngine(log);
		final double[] values = optimum.getValues();
		final RealMatrix covariance = optimum.getCovariance();
		final List<String> freeNames = graph.freeNames();

		final FitResult result;
		if (!plan.isGlobal()) {
			final FitTable table = localTable(plan.parts().get(0), project
				.getDataset().column(0), values, optimum.getResidual());
			final StatisticsBlock stats = engine.compute(table, graph.freeCount(),
				names, freeNames, covariance, confidence);
			result = new FitResult(0, optimum.getMethod(), estimates, table, optimum
				.getNfev(), optimum.getMaxNfev(), optimum.getReason(), optimum
					.isSuccess(), optimum.getMessage(), freeNames, covariance, stats,
				new ArrayList<FitResult>());
		}
		else {
			final List<double[]> residuals = plan.split(optimum.getResidual());
			final List<FitResult> perDataset = new ArrayList<>();
			for (int d = 1; d <= plan.parts().size(); d++) {
				final FitTable table = localTable(plan.parts().get(d - 1), project
					.getDataset().column(d - 1), values, residuals.get(d - 1));
				final List<ParameterEstimate> own = new ArrayList<>();
				final List<String> ownNames = new ArrayList<>();
				int nvarys = 0;
				for (final ParameterEstimate e : estimates) {
					if (e.getKey().getDataset() != d) continue;
					own.add(e);
					ownNames.add(e.getName());
					if (e.isVary() || (e.getExpr() != null && freeNames.contains(e
						.getExpr().trim()))) nvarys++;
				}
				perDataset.add(new FitResult(d, optimum.getMethod(), own, table,
					optimum.getNfev(), optimum.getMaxNfev(), optimum.getReason(),
					optimum.isSuccess(), optimum.getMessage(), freeNames, covariance,
					engine.compute(table, nvarys, ownNames, freeNames, covariance, null),
					new ArrayList<FitResult>()));
			}
			final FitTable table = globalTable(plan, project.getDataset(), values,
				optimum.getResidual(), residuals);
			final StatisticsBlock stats = engine.compute(table, graph.freeCount(),
				names, freeNames, covariance, confidence);
			result = new FitResult(0, optimum.getMethod(), estimates, table, optimum
				.getNfev(), optimum.getMaxNfev(), optimum.getReason(), optimum
					.isSuccess(), optimum.getMessage(), freeNames, covariance, stats,
				perDataset);
		}

		sw.stop();
		log.info(String.format("Time elapsed: %1$.1f s", sw.getTime() / 1000.0));
		return result;
	}

	/**
	 * Replaces the declared peaks by the peaks found in the only column; samples
	 * that are not finite are skipped.
	 *
	 * @throws InvalidSettingsException for several columns, predefined global
	 *           peaks, or when nothing is found
	 */
	private List<PeakSpec> detectPeaks(final FitProject project) {
		final Dataset dataset = project.getDataset();
		if (dataset.size() != 1 || project.getSettings()
			.getGlobal() == GlobalFitAggregator.PREDEFINED)
		{
			throw new InvalidSettingsException(
				"Peak detection needs a single spectrum and no predefined peaks");
		}
		final double[] x = dataset.column(0).getX();
		final double[] y = dataset.column(0).getY();
		int n = 0;
		for (int i = 0; i < x.length; i++) {
			if (Double.isNaN(x[i]) || Double.isInfinite(x[i]) || Double.isNaN(
				y[i]) || Double.isInfinite(y[i])) continue;
			x[n] = x[i];
			y[n] = y[i];
			n++;
		}
		final List<PeakSpec> peaks = new PeakDetector(project.getSettings()
			.getPeakDetection()).peaks(Arrays.copyOf(x, n), Arrays.copyOf(y, n));
		if (peaks.isEmpty()) {
			throw new InvalidSettingsException("No peaks detected (" + project
				.getSettings().getPeakDetection() + ")");
		}
		log.info(String.format("Detected %d peaks", peaks.size()));
		return peaks;
	}

	/** Assembles the versioned report of a finished fit. */
	public FitReport report(final FitProject project, final FitResult result) {
		return ReportAssembler.assemble(project.getSettings(), result);
	}

	private static FitTable localTable(final CompositeObjective part,
		final Dataset.Column column, final double[] values,
		final double[] residual)
	{
		final double[] y = part.getY();
		final double[] fit = part.model(values);
		final Map<String, double[]> input = new LinkedHashMap<>();
		input.put(ENERGY, column.getX());
		input.put(INTENSITY, column.getY());
		final Map<String, double[]> table = new LinkedHashMap<>();
		table.put(ENERGY, part.getX());
		table.put(INTENSITY, y);
		table.put(RESIDUAL, residual);
		table.put(FIT, fit);
		table.putAll(part.components(values));
		return new FitTable(input, table, y, fit, residual);
	}

	private static FitTable globalTable(final FitPlan plan,
		final Dataset dataset, final double[] values, final double[] residual,
		final List<double[]> residuals)
	{
		final List<CompositeObjective> parts = plan.parts();
		boolean shared = true;
		for (final CompositeObjective part : parts) {
			shared &= Arrays.equals(part.getX(), parts.get(0).getX());
		}
		final Map<String, double[]> input = new LinkedHashMap<>();
		final Map<String, double[]> table = new LinkedHashMap<>();
		for (int d = 1; d <= parts.size(); d++) {
			final Dataset.Column column = dataset.column(d - 1);
			if (!shared || d == 1) {
				final String key = shared ? ENERGY : ENERGY + "_" + d;
				input.put(key, column.getX());
				table.put(key, parts.get(d - 1).getX());
			}
		}
		double[] observed = new double[0];
		double[] fit = new double[0];
		final Map<String, double[]> fits = new LinkedHashMap<>();
		for (int d = 1; d <= parts.size(); d++) {
			final CompositeObjective part = parts.get(d - 1);
			input.put(INTENSITY + "_" + d, dataset.column(d - 1).getY());
			table.put(INTENSITY + "_" + d, part.getY());
			final double[] f = part.model(values);
			fits.put(FIT + "_" + d, f);
			observed = ArrayUtils.addAll(observed, part.getY());
			fit = ArrayUtils.addAll(fit, f);
		}
		table.putAll(fits);
		for (int d = 1; d <= parts.size(); d++) {
			table.put(RESIDUAL + "_" + d, residuals.get(d - 1));
		}
		if (shared) {
			final double[] avg = new double[residuals.get(0).length];
			for (final double[] r : residuals) {
				for (int i = 0; i < avg.length; i++) {
					avg[i] += r[i] / residuals.size();
				}
			}
			table.put(RESIDUAL + "_avg", avg);
		}
		for (final CompositeObjective part : parts) {
			table.putAll(part.components(values));
		}
		return new FitTable(input, table, observed, fit, residual);
	}
}
