/**
 * SpectraFit
 * ConfidenceIntervalCalculator.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.statistics;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.distribution.FDistribution;
import org.apache.commons.math3.exception.NoBracketingException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.util.FastMath;
import org.scijava.log.LogService;

import spectrafit.parameters.Parameter;
import spectrafit.parameters.ParameterGraph;
import spectrafit.solver.FitMonitor;
import spectrafit.solver.Minimizer;
import spectrafit.solver.Objective;
import spectrafit.solver.OptimizerAdapter;
import spectrafit.solver.Optimum;

/**
 * Profile confidence intervals by F-test. Each varying parameter is stepped
 * away from its optimum and held fixed while the others are re-optimized with
 * Levenberg-Marquardt; the probability of the increase in chi-square is
 * {@code F(1, n - k).cdf((chi2 / chi2_best - 1) * (n - k))}. Limits are then
 * located between the optimum and the last step with Brent's method.
 */
public class ConfidenceIntervalCalculator {

	private static final int BRENT_MAX_EVAL = 100;

	private final LogService log;
	private final OptimizerAdapter adapter;

	public ConfidenceIntervalCalculator(final LogService log) {
		this.log = log;
		this.adapter = new OptimizerAdapter(log, false);
	}

	/**
	 * @param objective objective of the finished fit
	 * @param optimum its optimum; standard errors set the step size
	 * @return the intervals, empty when the fit has no degrees of freedom
	 */
	public ConfidenceResult calculate(final Objective objective,
		final Optimum optimum, final ConfidenceSettings settings)
	{
		final ParameterGraph graph = objective.graph();
		final int dof = objective.length() - graph.freeCount();
		if (dof <= 0 || graph.freeCount() == 0) {
			log.warn("Confidence intervals need varying parameters and positive " +
				"degrees of freedom; skipped.");
			return ConfidenceResult.empty();
		}
		final Search search = new Search(objective, optimum, dof, settings);
		final List<ConfidenceInterval> intervals = new ArrayList<>();
		final Map<String, Map<String, double[]>> trace = new LinkedHashMap<>();
		final List<String> names = graph.freeNames();
		for (int k = 0; k < names.size(); k++) {
			search.begin(k);
			final double[] probs = settings.getProbabilities();
			final double[] lower = search.limits(-1);
			final double[] upper = search.limits(+1);
			intervals.add(new ConfidenceInterval(names.get(k), optimum
				.getValues()[k], probs, lower, upper));
			if (settings.isTrace()) trace.put(names.get(k), search.trace());
		}
		return new ConfidenceResult(intervals, trace);
	}

	/** State of the search along one parameter. */
	private final class Search {

		private final Objective objective;
		private final ParameterGraph base;
		private final double[] best;
		private final double[] stderr;
		private final double chiBest;
		private final int dof;
		private final FDistribution f;
		private final ConfidenceSettings settings;
		private final List<String> names;
		private int index;
		private Map<String, List<Double>> columns;

		Search(final Objective objective, final Optimum optimum, final int dof,
			final ConfidenceSettings settings)
		{
			this.objective = objective;
			this.best = optimum.getValues();
			this.base = objective.graph().withValues(best);
			this.stderr = optimum.getStandardErrors();
			this.chiBest = optimum.getChiSquare();
			this.dof = dof;
			this.f = new FDistribution(1, dof);
			this.settings = settings;
			this.names = base.freeNames();
		}

		void begin(final int k) {
			index = k;
			columns = new LinkedHashMap<>();
			for (final String n : names) {
				columns.put(n, new ArrayList<Double>());
			}
			columns.put("prob", new ArrayList<Double>());
		}

		double[] limits(final int direction) {
			final String name = names.get(index);
			final Parameter p = base.parameter(name);
			final double start = best[index];
			final double step = stderr[index] > 0 && !Double.isInfinite(
				stderr[index]) ? stderr[index] : FastMath.max(0.2 * FastMath.abs(
					start), 0.001);
			double maxProb = 0;
			for (final double q : settings.getProbabilities()) {
				maxProb = FastMath.max(maxProb, q);
			}

			double limit = start;
			double oldProb = 0;
			int i = 0;
			while (oldProb < maxProb) {
				i++;
				limit += step * direction;
				boolean atBound = false;
				if (direction > 0 && limit >= p.getMax()) {
					limit = p.getMax();
					atBound = true;
				}
				else if (direction < 0 && limit <= p.getMin()) {
					limit = p.getMin();
					atBound = true;
				}
				final double newProb = probability(limit);
				final double relChange = (newProb - oldProb) / FastMath.max(FastMath
					.max(newProb, oldProb), 1e-12);
				oldProb = newProb;
				if (atBound) {
					log.debug(name + ": bound reached at " + limit);
					break;
				}
				if (i > settings.getMaxIter()) {
					log.warn(name + ": maxiter reached, probability " + newProb);
					break;
				}
				if (relChange < settings.getMinRelChange()) {
					log.warn(name + ": probability stalled at " + newProb);
					break;
				}
			}

			final double reached = oldProb;
			final double end = limit;
			final double[] probs = settings.getProbabilities();
			final double[] out = new double[probs.length];
			for (int j = 0; j < probs.length; j++) {
				final double target = probs[j];
				if (!(target <= reached)) {
					out[j] = direction * Double.POSITIVE_INFINITY;
					continue;
				}
				final UnivariateFunction fn = x -> probability(x) - target;
				try {
					out[j] = new BrentSolver(1e-10 * FastMath.max(FastMath.abs(start),
						1.0)).solve(BRENT_MAX_EVAL, fn, FastMath.min(start, end), FastMath
							.max(start, end));
				}
				catch (final NoBracketingException | TooManyEvaluationsException e) {
					log.warn(name + ": no confidence limit at probability " + target +
						" (" + e.getMessage() + ")");
					out[j] = Double.NaN;
				}
			}
			return out;
		}

		/** Re-optimizes with the stepped parameter fixed at {@code value}. */
		double probability(final double value) {
			final String name = names.get(index);
			final ParameterGraph fixed = base.withFixed(name, value);
			final Objective restricted = objective.withGraph(fixed);
			final double[] values;
			final double[] residual;
			if (fixed.freeCount() == 0) {
				values = new double[0];
				residual = restricted.residual(values);
			}
			else {
				final Optimum o = adapter.minimize(restricted, Minimizer.LEASTSQ,
					2000 * (fixed.freeCount() + 1), false, FitMonitor.NONE);
				values = o.getValues();
				residual = o.getResidual();
			}
			double chi = 0;
			for (final double r : residual) {
				chi += r * r;
			}
			final double dchi = chiBest > 0 ? chi / chiBest - 1 : chi > 0
				? Double.POSITIVE_INFINITY : 0;
			final double prob;
			if (Double.isInfinite(dchi)) prob = 1.0;
			else prob = dchi > 0 ? f.cumulativeProbability(dchi * dof) : 0;

			final Map<String, Double> resolved = fixed.resolve(values);
			for (final String n : names) {
				columns.get(n).add(resolved.get(n));
			}
			columns.get("prob").add(prob);
			return prob;
		}

		Map<String, double[]> trace() {
			final Map<String, double[]> out = new LinkedHashMap<>();
			for (final Map.Entry<String, List<Double>> e : columns.entrySet()) {
				final double[] v = new double[e.getValue().size()];
				for (int i = 0; i < v.length; i++) {
					v[i] = e.getValue().get(i);
				}
				out.put(e.getKey(), v);
			}
			return out;
		}
	}
}
